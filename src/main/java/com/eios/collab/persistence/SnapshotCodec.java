package com.eios.collab.persistence;

import com.eios.collab.crdt.DocumentData;
import com.eios.collab.error.CorruptSnapshotException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * JSON encoding of snapshots and log segments. Decoding a snapshot verifies its
 * checksum; anything unreadable is reported as {@link CorruptSnapshotException}.
 */
@ApplicationScoped
public class SnapshotCodec {

    private final ObjectMapper mapper;

    @Inject
    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encodeSnapshot(String documentId, long watermark, Instant createdAt, DocumentData data) {
        try {
            String document = mapper.writeValueAsString(data);
            SnapshotRecord record = new SnapshotRecord(documentId, watermark, createdAt, checksum(document), document);
            return mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode snapshot of " + documentId, e);
        }
    }

    public SnapshotRecord decodeSnapshot(String key, byte[] bytes) {
        SnapshotRecord record;
        try {
            record = mapper.readValue(bytes, SnapshotRecord.class);
        } catch (IOException e) {
            throw new CorruptSnapshotException("Snapshot " + key + " is not readable", e);
        }
        if (record.document() == null || record.checksum() == null) {
            throw new CorruptSnapshotException("Snapshot " + key + " is incomplete");
        }
        if (!checksum(record.document()).equals(record.checksum())) {
            throw new CorruptSnapshotException("Snapshot " + key + " failed its checksum");
        }
        return record;
    }

    public DocumentData documentOf(String key, SnapshotRecord record) {
        try {
            return mapper.readValue(record.document(), DocumentData.class);
        } catch (IOException e) {
            throw new CorruptSnapshotException("Snapshot " + key + " holds an unreadable document", e);
        }
    }

    public byte[] encodeSegment(LogSegment segment) {
        try {
            return mapper.writeValueAsBytes(segment);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode log segment of " + segment.documentId(), e);
        }
    }

    public LogSegment decodeSegment(String key, byte[] bytes) {
        try {
            return mapper.readValue(bytes, LogSegment.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Log segment " + key + " is not readable", e);
        }
    }

    static String checksum(String document) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(document.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
