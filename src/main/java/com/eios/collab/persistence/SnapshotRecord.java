package com.eios.collab.persistence;

import java.time.Instant;

/**
 * Stored snapshot envelope. {@code document} is the serialized replicated state and
 * {@code checksum} the hex SHA-256 of its UTF-8 bytes.
 */
public record SnapshotRecord(
    String documentId,
    long watermark,
    Instant createdAt,
    String checksum,
    String document
) {}
