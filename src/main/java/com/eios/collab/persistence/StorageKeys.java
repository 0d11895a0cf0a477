package com.eios.collab.persistence;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Object key layout. Zero-padded numbers keep lexicographic and numeric order equal.
 *
 * <pre>
 * snapshots/{documentId}/{watermark}-{epochMillis}.json
 * log/{documentId}/{firstSequence}-{lastSequence}.json
 * </pre>
 */
public final class StorageKeys {

    private static final Pattern SNAPSHOT = Pattern.compile("^snapshots/(.+)/(\\d{20})-(\\d+)\\.json$");
    private static final Pattern SEGMENT = Pattern.compile("^log/(.+)/(\\d{20})-(\\d{20})\\.json$");

    private StorageKeys() {
    }

    public static String snapshotPrefix(String documentId) {
        return "snapshots/" + documentId + "/";
    }

    public static String logPrefix(String documentId) {
        return "log/" + documentId + "/";
    }

    public static String snapshot(String documentId, long watermark, Instant createdAt) {
        return snapshotPrefix(documentId) + String.format("%020d-%d.json", watermark, createdAt.toEpochMilli());
    }

    public static String segment(String documentId, long firstSequence, long lastSequence) {
        return logPrefix(documentId) + String.format("%020d-%020d.json", firstSequence, lastSequence);
    }

    public static Optional<SnapshotInfo> parseSnapshot(String key) {
        Matcher m = SNAPSHOT.matcher(key);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new SnapshotInfo(key, m.group(1), Long.parseLong(m.group(2)),
            Instant.ofEpochMilli(Long.parseLong(m.group(3)))));
    }

    public static Optional<SegmentRange> parseSegment(String key) {
        Matcher m = SEGMENT.matcher(key);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new SegmentRange(key, Long.parseLong(m.group(2)), Long.parseLong(m.group(3))));
    }

    public record SegmentRange(String key, long firstSequence, long lastSequence) {}
}
