package com.eios.collab.persistence;

/**
 * @param watermark       log entries at or below this sequence were removed
 * @param deletedSegments number of log segments deleted
 */
public record CompactionResult(String documentId, long watermark, int deletedSegments) {

    static CompactionResult none(String documentId) {
        return new CompactionResult(documentId, 0, 0);
    }
}
