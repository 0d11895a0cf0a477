package com.eios.collab.room;

import com.eios.collab.config.CollabConfig;
import com.eios.collab.crdt.DocumentData;
import com.eios.collab.persistence.PersistenceService;
import com.eios.collab.persistence.SnapshotInfo;
import io.smallrye.mutiny.subscription.Cancellable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides when a room is snapshotted and applies the outcome to the room.
 *
 * <p>A room is due after {@code collab.persistence.snapshot-operations} operations, or
 * once {@code collab.persistence.snapshot-interval} has passed with at least one
 * operation, or right after it was seeded. Background snapshots never block editing;
 * a failure only marks storage as failing for the degraded-mode check.
 */
@ApplicationScoped
public class RoomSnapshotter {

    private static final Logger LOG = Logger.getLogger(RoomSnapshotter.class);

    private record Capture(DocumentData data, long watermark, int covered, long previousWatermark) {}

    private final PersistenceService persistence;
    private final Clock clock;
    private final CollabConfig.PersistenceConfig config;

    @Inject
    public RoomSnapshotter(PersistenceService persistence, Clock clock, CollabConfig config) {
        this.persistence = persistence;
        this.clock = clock;
        this.config = config.persistence();
    }

    public boolean isDue(Room room, Instant now) {
        return room.call(() -> {
            if (!room.isLoaded() || room.isClosed() || room.snapshotInFlight()) {
                return false;
            }
            if (room.snapshotRequired() || room.operationsSinceSnapshot() >= config.snapshotOperations()) {
                return true;
            }
            return room.operationsSinceSnapshot() > 0
                && !room.lastSnapshotAt().plus(config.snapshotInterval()).isAfter(now);
        });
    }

    /**
     * Starts a background snapshot when the room is due.
     *
     * @return whether a snapshot was started
     */
    public boolean snapshotIfDue(Room room) {
        if (!isDue(room, clock.instant())) {
            return false;
        }
        Capture capture = room.call(() -> {
            room.snapshotStarting();
            return capture(room);
        });
        Cancellable job = persistence.snapshot(room.id(), capture.data(), capture.watermark())
            .subscribe().with(
                info -> room.run(() -> {
                    room.snapshotFinished();
                    written(room, capture, info);
                }),
                failure -> room.run(() -> {
                    room.snapshotFinished();
                    room.storageFailed(clock.instant());
                    LOG.errorf("Snapshot of %s failed: %s", room.id(), failure.getMessage());
                }));
        room.run(() -> room.snapshotJob(job));
        return true;
    }

    /**
     * Makes the room's state durable before it is evicted or the process stops: flushes
     * the log, then writes a snapshot if anything changed since the last one. Blocks.
     *
     * @return {@code false} if the state could not be made durable
     */
    public boolean finalSnapshot(Room room) {
        room.run(room::cancelSnapshot);
        Duration budget = config.writeTimeout().multipliedBy(config.retryAttempts() + 1L);
        try {
            persistence.flush(room.id()).await().atMost(budget);
            boolean dirty = room.call(() -> room.isLoaded()
                && (room.snapshotRequired() || room.operationsSinceSnapshot() > 0));
            if (dirty) {
                Capture capture = room.call(() -> capture(room));
                SnapshotInfo info = persistence.snapshot(room.id(), capture.data(), capture.watermark())
                    .await().atMost(budget);
                room.run(() -> written(room, capture, info));
            }
            return true;
        } catch (RuntimeException e) {
            room.run(() -> room.storageFailed(clock.instant()));
            LOG.errorf("Final snapshot of %s failed, keeping the room loaded: %s", room.id(), e.getMessage());
            return false;
        }
    }

    private static Capture capture(Room room) {
        return new Capture(room.document().toData(), room.journal().watermark(),
            room.operationsSinceSnapshot(), room.lastSnapshotWatermark());
    }

    private void written(Room room, Capture capture, SnapshotInfo info) {
        if (info == null) {
            // another process holds the snapshot lock; retry on a later tick
            return;
        }
        room.snapshotWritten(capture.covered(), capture.watermark(), info.createdAt());
        room.storageRecovered();
        room.journal().truncate(capture.previousWatermark());
    }
}
