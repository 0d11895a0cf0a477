package com.eios.collab.persistence;

import com.eios.collab.cluster.RoomCoordinator;
import com.eios.collab.config.CollabConfig;
import com.eios.collab.crdt.DocumentData;
import com.eios.collab.crdt.ReplicatedDocument;
import com.eios.collab.crdt.SequencedOperation;
import com.eios.collab.error.CorruptSnapshotException;
import com.eios.collab.error.TransientStorageException;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Durable history of documents: versioned snapshots plus an append-only operation log.
 *
 * <p>Snapshot and log writes run on the worker pool and are retried with exponential
 * backoff on {@link TransientStorageException}; callers never wait on them while
 * editing. The log is only truncated up to a watermark covered by a snapshot that has
 * already been written, and by default one snapshot generation earlier than that.
 */
@ApplicationScoped
public class PersistenceService {

    private static final Logger LOG = Logger.getLogger(PersistenceService.class);

    static final String SNAPSHOT_LOCK = "snapshot";

    private final BlobStore store;
    private final SnapshotCodec codec;
    private final RoomCoordinator coordinator;
    private final Clock clock;
    private final CollabConfig.PersistenceConfig config;
    private final Duration lockTtl;

    private final Map<String, PendingLog> pending = new ConcurrentHashMap<>();

    @Inject
    public PersistenceService(BlobStore store, SnapshotCodec codec, RoomCoordinator coordinator, Clock clock,
                              CollabConfig config) {
        this.store = store;
        this.codec = codec;
        this.coordinator = coordinator;
        this.clock = clock;
        this.config = config.persistence();
        this.lockTtl = config.cluster().lockTtl();
    }

    // ---- snapshots ----

    /**
     * Writes a new snapshot version and then compacts the log. Skipped (null item)
     * when another process holds the document's snapshot lock.
     */
    public Uni<SnapshotInfo> snapshot(String documentId, DocumentData data, long watermark) {
        return coordinator.tryLock(documentId, SNAPSHOT_LOCK, lockTtl)
            .onItem().transformToUni(token -> {
                if (token.isEmpty()) {
                    LOG.debugf("Snapshot of %s already in progress elsewhere", documentId);
                    return Uni.createFrom().<SnapshotInfo>nullItem();
                }
                return writeSnapshot(documentId, data, watermark)
                    .call(info -> compact(documentId)
                        .onFailure().invoke(e -> LOG.warnf("Compaction of %s failed: %s", documentId, e.getMessage()))
                        .onFailure().recoverWithNull())
                    .eventually(() -> coordinator.unlock(documentId, SNAPSHOT_LOCK, token.get())
                        .onFailure().invoke(e -> LOG.warnf("Releasing snapshot lock of %s failed: %s",
                            documentId, e.getMessage()))
                        .onFailure().recoverWithNull());
            });
    }

    private Uni<SnapshotInfo> writeSnapshot(String documentId, DocumentData data, long watermark) {
        Instant createdAt = clock.instant();
        String key = StorageKeys.snapshot(documentId, watermark, createdAt);
        byte[] bytes = codec.encodeSnapshot(documentId, watermark, createdAt, data);
        return retrying("snapshot " + key, () -> {
            store.put(key, bytes);
            return new SnapshotInfo(key, documentId, watermark, createdAt);
        }).invoke(info -> LOG.infof("Snapshot of %s written at watermark %d (%d bytes)",
            documentId, watermark, bytes.length));
    }

    public List<SnapshotInfo> listSnapshots(String documentId) {
        return store.list(StorageKeys.snapshotPrefix(documentId)).stream()
            .map(StorageKeys::parseSnapshot)
            .flatMap(Optional::stream)
            .sorted(Comparator.comparingLong(SnapshotInfo::watermark).thenComparing(SnapshotInfo::createdAt))
            .toList();
    }

    // ---- compaction ----

    /**
     * Deletes log segments fully covered by a durable snapshot. With
     * {@code keep-previous-generation} the boundary is the snapshot before the newest
     * one, so the log still bridges the gap if the newest snapshot turns out corrupt.
     */
    public Uni<CompactionResult> compact(String documentId) {
        return retrying("compaction of " + documentId, () -> {
            List<SnapshotInfo> snapshots = listSnapshots(documentId);
            int keep = config.keepPreviousGeneration() ? 2 : 1;
            if (snapshots.size() < keep) {
                return CompactionResult.none(documentId);
            }
            long watermark = snapshots.get(snapshots.size() - keep).watermark();
            int deleted = 0;
            for (String key : store.list(StorageKeys.logPrefix(documentId))) {
                Optional<StorageKeys.SegmentRange> range = StorageKeys.parseSegment(key);
                if (range.isPresent() && range.get().lastSequence() <= watermark) {
                    store.delete(key);
                    deleted++;
                }
            }
            if (deleted > 0) {
                LOG.infof("Compacted %d log segments of %s up to %d", deleted, documentId, watermark);
            }
            return new CompactionResult(documentId, watermark, deleted);
        });
    }

    // ---- operation log ----

    /**
     * Buffers a sequenced operation for the next flush.
     *
     * @return the number of buffered operations for the document
     */
    public int append(String documentId, SequencedOperation op) {
        return pending.computeIfAbsent(documentId, k -> new PendingLog()).add(op);
    }

    public int pendingCount(String documentId) {
        PendingLog log = pending.get(documentId);
        return log == null ? 0 : log.size();
    }

    /**
     * Writes buffered operations as one log segment. On failure the operations go back
     * into the buffer for the next attempt.
     *
     * @return the number of operations written
     */
    public Uni<Integer> flush(String documentId) {
        PendingLog log = pending.get(documentId);
        if (log == null) {
            return Uni.createFrom().item(0);
        }
        List<SequencedOperation> batch = log.drain();
        if (batch.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        long first = batch.get(0).sequence();
        long last = batch.get(batch.size() - 1).sequence();
        String key = StorageKeys.segment(documentId, first, last);
        byte[] bytes = codec.encodeSegment(new LogSegment(documentId, first, last, batch));
        return retrying("log segment " + key, () -> {
            store.put(key, bytes);
            return batch.size();
        }).onFailure().invoke(e -> {
            LOG.warnf("Requeueing %d log entries of %s: %s", batch.size(), documentId, e.getMessage());
            log.requeue(batch);
        });
    }

    /**
     * Drops the buffer of a document that is no longer served here.
     */
    public void discard(String documentId) {
        PendingLog log = pending.remove(documentId);
        if (log != null && log.size() > 0) {
            LOG.warnf("Discarding %d unflushed log entries of %s", log.size(), documentId);
        }
    }

    /**
     * Logged operations with a sequence above {@code afterSequence}, ordered and
     * deduplicated by sequence. Blocks on storage.
     */
    public List<SequencedOperation> readLog(String documentId, long afterSequence) {
        Map<Long, SequencedOperation> ops = new TreeMap<>();
        for (String key : store.list(StorageKeys.logPrefix(documentId))) {
            Optional<StorageKeys.SegmentRange> range = StorageKeys.parseSegment(key);
            if (range.isEmpty() || range.get().lastSequence() <= afterSequence) {
                continue;
            }
            Optional<byte[]> bytes = store.get(key);
            if (bytes.isEmpty()) {
                continue;
            }
            try {
                for (SequencedOperation op : codec.decodeSegment(key, bytes.get()).operations()) {
                    if (op.isSequenced() && op.sequence() > afterSequence) {
                        ops.putIfAbsent(op.sequence(), op);
                    }
                }
            } catch (UncheckedIOException e) {
                LOG.errorf("Skipping unreadable log segment %s: %s", key, e.getMessage());
            }
        }
        return List.copyOf(ops.values());
    }

    // ---- restore ----

    public RestoredDocument restore(String documentId) {
        return restore(documentId, ReplicatedDocument::new);
    }

    /**
     * Rebuilds a document from its newest readable snapshot plus the log after it.
     * A corrupt snapshot falls back to the previous version. Without any snapshot the
     * log is replayed over {@code genesis}, which is only possible while the log still
     * starts at sequence 1; otherwise the document is reported corrupt rather than
     * restored empty. Blocks on storage.
     */
    public RestoredDocument restore(String documentId, Supplier<ReplicatedDocument> genesis) {
        List<SnapshotInfo> snapshots = new ArrayList<>(listSnapshots(documentId));
        int corrupt = 0;
        for (int i = snapshots.size() - 1; i >= 0; i--) {
            SnapshotInfo info = snapshots.get(i);
            try {
                Optional<byte[]> bytes = store.get(info.key());
                if (bytes.isEmpty()) {
                    throw new CorruptSnapshotException("Snapshot " + info.key() + " disappeared");
                }
                SnapshotRecord record = codec.decodeSnapshot(info.key(), bytes.get());
                if (record.watermark() != info.watermark() || !documentId.equals(record.documentId())) {
                    throw new CorruptSnapshotException("Snapshot " + info.key() + " does not match its key");
                }
                ReplicatedDocument document = ReplicatedDocument.fromData(codec.documentOf(info.key(), record));
                List<SequencedOperation> replayed = replay(document, documentId, info.watermark());
                LOG.infof("Restored %s from snapshot at %d and %d logged operations",
                    documentId, info.watermark(), replayed.size());
                return new RestoredDocument(document, info.watermark(), replayed, info, false);
            } catch (CorruptSnapshotException e) {
                corrupt++;
                LOG.warnf("Falling back from corrupt snapshot: %s", e.getMessage());
            }
        }

        List<SequencedOperation> log = readLog(documentId, 0);
        if (!log.isEmpty() && log.get(0).sequence() != 1) {
            throw new CorruptSnapshotException("No readable snapshot for " + documentId
                + " and the log starts at " + log.get(0).sequence());
        }
        if (corrupt > 0 && log.isEmpty()) {
            throw new CorruptSnapshotException("All " + corrupt + " snapshots of " + documentId
                + " are corrupt and there is no log to replay");
        }
        ReplicatedDocument document = genesis.get();
        log.forEach(op -> document.merge(op.operation()));
        if (corrupt > 0) {
            LOG.warnf("Rebuilt %s from genesis and %d logged operations", documentId, log.size());
        }
        return new RestoredDocument(document, 0, log, null, log.isEmpty());
    }

    private List<SequencedOperation> replay(ReplicatedDocument document, String documentId, long watermark) {
        List<SequencedOperation> ops = readLog(documentId, watermark);
        ops.forEach(op -> document.merge(op.operation()));
        return ops;
    }

    public void ping() {
        store.ping();
    }

    private <T> Uni<T> retrying(String what, Supplier<T> work) {
        return Uni.createFrom().item(work)
            .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
            .ifNoItem().after(config.writeTimeout())
            .failWith(() -> new TransientStorageException("Timed out writing " + what, null))
            .onFailure(TransientStorageException.class)
            .invoke(e -> LOG.warnf("Storage failure on %s, retrying: %s", what, e.getMessage()))
            .onFailure(TransientStorageException.class)
            .retry().withBackOff(config.retryInitialBackoff(), config.retryMaxBackoff())
            .atMost(config.retryAttempts())
            .onFailure().invoke(e -> LOG.errorf("Giving up on %s: %s", what, e.getMessage()));
    }

    /**
     * Per-document buffer of operations waiting to be written to the log.
     */
    private static final class PendingLog {

        private final TreeMap<Long, SequencedOperation> ops = new TreeMap<>();

        synchronized int add(SequencedOperation op) {
            ops.put(op.sequence(), op);
            return ops.size();
        }

        synchronized int size() {
            return ops.size();
        }

        synchronized List<SequencedOperation> drain() {
            List<SequencedOperation> batch = new ArrayList<>(ops.values());
            ops.clear();
            return batch;
        }

        synchronized void requeue(List<SequencedOperation> batch) {
            batch.forEach(op -> ops.putIfAbsent(op.sequence(), op));
        }
    }
}
