package com.eios.collab.room;

/**
 * Identifies a document: one version of one site. The room id, and the id the
 * document is stored under, is {@code siteId:version}.
 */
public record DocumentKey(String siteId, String version) {

    public DocumentKey {
        if (siteId == null || siteId.isBlank() || version == null || version.isBlank()) {
            throw new IllegalArgumentException("siteId and version required");
        }
        if (siteId.contains(":") || siteId.contains("/") || version.contains(":") || version.contains("/")) {
            throw new IllegalArgumentException("siteId and version must not contain ':' or '/'");
        }
    }

    public static DocumentKey parse(String roomId) {
        int sep = roomId == null ? -1 : roomId.indexOf(':');
        if (sep < 0) {
            throw new IllegalArgumentException("Room id must be siteId:version, got " + roomId);
        }
        return new DocumentKey(roomId.substring(0, sep), roomId.substring(sep + 1));
    }

    public String roomId() {
        return siteId + ":" + version;
    }

    @Override
    public String toString() {
        return roomId();
    }
}
