package com.eios.collab.persistence;

import java.time.Instant;

public record SnapshotInfo(String key, String documentId, long watermark, Instant createdAt) {}
