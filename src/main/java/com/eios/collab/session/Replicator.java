package com.eios.collab.session;

import com.eios.collab.cluster.BusMessage;
import com.eios.collab.cluster.FanoutBus;
import com.eios.collab.cluster.InstanceIdentity;
import com.eios.collab.cluster.RoomCoordinator;
import com.eios.collab.config.CollabConfig;
import com.eios.collab.crdt.ApplyResult;
import com.eios.collab.crdt.DocumentState;
import com.eios.collab.crdt.Operation;
import com.eios.collab.crdt.OperationJournal;
import com.eios.collab.crdt.SequencedOperation;
import com.eios.collab.error.ValidationRejectedException;
import com.eios.collab.message.ServerMessage;
import com.eios.collab.persistence.PersistenceService;
import com.eios.collab.room.OutboxEntry;
import com.eios.collab.room.Room;
import com.eios.collab.scenegraph.SceneGraphTranslator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Moves operations between a room's document, its clients, the log and the other
 * processes.
 *
 * <p>A local operation is merged first, then given a room-wide sequence number,
 * journaled, logged, delivered to the other local members, acknowledged to its sender
 * and published on the bus. When sequencing or publishing fails the operation stays
 * merged and delivered locally and waits in the room's outbox; the maintenance tick
 * drains the outbox once the cluster is reachable again. A room whose outbox (or
 * storage) stays stuck for too long turns read-only until it recovers.
 */
@ApplicationScoped
public class Replicator {

    private static final Logger LOG = Logger.getLogger(Replicator.class);

    private final RoomCoordinator coordinator;
    private final FanoutBus bus;
    private final PersistenceService persistence;
    private final SceneGraphTranslator translator;
    private final InstanceIdentity instance;
    private final Clock clock;
    private final CollabConfig config;

    @Inject
    public Replicator(RoomCoordinator coordinator, FanoutBus bus, PersistenceService persistence,
                      SceneGraphTranslator translator, InstanceIdentity instance, Clock clock,
                      CollabConfig config) {
        this.coordinator = coordinator;
        this.bus = bus;
        this.persistence = persistence;
        this.translator = translator;
        this.instance = instance;
        this.clock = clock;
        this.config = config;
    }

    /**
     * Merges operations produced by a member of the room and replicates those that
     * changed the document.
     *
     * @return the operations that changed the document, with their sequence numbers
     *         (null where sequencing is pending)
     * @throws ValidationRejectedException if any operation is malformed, would break the
     *         tree or is stamped too far ahead of the room's clock; nothing is applied then
     */
    public List<SequencedOperation> commitLocal(Room room, String originSessionId, List<Operation> ops) {
        return commitLocal(room, originSessionId, state -> ops);
    }

    /**
     * Like {@link #commitLocal(Room, String, List)}, with the operations produced from the
     * state they are applied to, inside the room lock.
     */
    public List<SequencedOperation> commitLocal(Room room, String originSessionId,
                                                Function<DocumentState, List<Operation>> producer) {
        List<Operation> changed = room.call(() -> {
            DocumentState state = room.document().currentState();
            List<Operation> ops = producer.apply(state);
            long ceiling = room.document().maxCounter() + config.session().maxClockDrift();
            for (Operation op : ops) {
                String problem = op.problem();
                if (problem != null) {
                    throw new ValidationRejectedException(problem);
                }
                if (room.document().hasApplied(op)) {
                    continue;
                }
                if (op.stamp().counter() > ceiling) {
                    throw new ValidationRejectedException("Stamp " + op.stamp() + " is ahead of the room clock "
                        + room.document().maxCounter());
                }
                translator.validate(op, state);
            }
            List<Operation> out = new ArrayList<>();
            for (Operation op : ops) {
                ApplyResult result = room.document().applyLocal(op);
                if (result.changed()) {
                    room.operationApplied();
                    out.add(op);
                } else {
                    room.sendTo(originSessionId, ServerMessage.ack(room.id(), op.stamp(), null));
                }
            }
            return out;
        });

        List<SequencedOperation> committed = new ArrayList<>(changed.size());
        for (Operation op : changed) {
            committed.add(new SequencedOperation(replicate(room, originSessionId, op), op));
        }
        return committed;
    }

    private Long replicate(Room room, String originSessionId, Operation op) {
        long sequence;
        try {
            sequence = coordinator.nextSequence(room.id(), room.journal().highestSequence())
                .await().atMost(config.fanout().timeout());
        } catch (RuntimeException e) {
            LOG.warnf("Sequencing in %s failed, queueing %s: %s", room.id(), op.stamp(), e.getMessage());
            room.run(() -> {
                room.broadcast(ServerMessage.operation(room.id(), null, op), originSessionId);
                room.sendTo(originSessionId, ServerMessage.ack(room.id(), op.stamp(), null));
                room.enqueue(new OutboxEntry(op, null, clock.instant()));
            });
            updateDegraded(room);
            return null;
        }

        room.run(() -> {
            room.journal().record(sequence, op);
            room.broadcast(ServerMessage.operation(room.id(), sequence, op), originSessionId);
            room.sendTo(originSessionId, ServerMessage.ack(room.id(), op.stamp(), sequence));
        });
        log(room, sequence, op);

        if (!publish(room, sequence, op)) {
            room.run(() -> room.enqueue(new OutboxEntry(op, sequence, clock.instant())));
            updateDegraded(room);
        }
        return sequence;
    }

    private void log(Room room, long sequence, Operation op) {
        int pending = persistence.append(room.id(), new SequencedOperation(sequence, op));
        if (pending >= config.persistence().logFlushOperations()) {
            flushLog(room);
        }
    }

    /**
     * Writes the room's buffered log entries in the background.
     */
    public void flushLog(Room room) {
        persistence.flush(room.id()).subscribe().with(
            written -> room.run(room::storageRecovered),
            failure -> room.run(() -> room.storageFailed(clock.instant())));
    }

    private boolean publish(Room room, long sequence, Operation op) {
        try {
            bus.publish(room.id(), BusMessage.operation(instance.id(), room.id(), sequence, op))
                .await().atMost(config.fanout().timeout());
            return true;
        } catch (RuntimeException e) {
            LOG.warnf("Publishing %d in %s failed: %s", sequence, room.id(), e.getMessage());
            return false;
        }
    }

    /**
     * Merges an operation relayed by another process and delivers it to every local
     * member. Duplicates are dropped silently by the merge.
     */
    public void applyRemote(Room room, Long sequence, Operation op) {
        if (op == null || op.problem() != null) {
            LOG.warnf("Dropping malformed relayed operation in %s", room.id());
            return;
        }
        room.run(() -> {
            if (!room.isLoaded() || room.isClosed()) {
                return;
            }
            boolean changed = room.document().merge(op);
            boolean recorded = sequence != null && room.journal().record(sequence, op);
            if (changed) {
                room.operationApplied();
            }
            if (changed || recorded) {
                room.broadcast(ServerMessage.operation(room.id(), sequence, op), null);
            }
        });
    }

    /**
     * Sequences, logs and publishes queued operations in order, stopping at the first
     * failure.
     *
     * @return the number of entries that left the outbox
     */
    public int drainOutbox(Room room) {
        int drained = 0;
        while (true) {
            Optional<OutboxEntry> head = room.call(room::peekOutbox);
            if (head.isEmpty()) {
                break;
            }
            OutboxEntry queued = head.get();
            OutboxEntry entry = queued;
            if (!queued.isSequenced()) {
                long sequence;
                try {
                    sequence = coordinator.nextSequence(room.id(), room.journal().highestSequence())
                        .await().atMost(config.fanout().timeout());
                } catch (RuntimeException e) {
                    LOG.debugf("Outbox of %s still blocked: %s", room.id(), e.getMessage());
                    break;
                }
                OutboxEntry sequenced = queued.withSequence(sequence);
                room.run(() -> {
                    room.journal().record(sequence, queued.operation());
                    room.replaceHead(sequenced);
                    room.broadcast(ServerMessage.operation(room.id(), sequence, queued.operation()), null);
                });
                log(room, sequence, queued.operation());
                entry = sequenced;
            }
            if (!publish(room, entry.sequence(), entry.operation())) {
                break;
            }
            room.run(room::popOutbox);
            drained++;
        }
        if (drained > 0) {
            LOG.infof("Resent %d queued operations of %s", drained, room.id());
        }
        updateDegraded(room);
        return drained;
    }

    /**
     * Re-evaluates read-only mode and tells the members when it flips.
     */
    public void updateDegraded(Room room) {
        Instant now = clock.instant();
        room.run(() -> {
            boolean fanoutStuck = room.outboxSize() >= config.fanout().outboxCapacity()
                || room.peekOutbox()
                    .map(e -> olderThan(e.queuedAt(), config.fanout().degradedAfter(), now))
                    .orElse(false);
            boolean storageStuck = room.storageFailingSince() != null
                && olderThan(room.storageFailingSince(), config.persistence().degradedAfter(), now);
            boolean degraded = fanoutStuck || storageStuck;
            if (room.setDegraded(degraded)) {
                room.broadcast(degraded ? ServerMessage.degraded(room.id()) : ServerMessage.recovered(room.id()), null);
            }
        });
    }

    /**
     * Fills a gap in the journal from the durable log once it has outlived one
     * maintenance tick, and gives up on it after the fan-out degradation window.
     */
    public void repairGaps(Room room) {
        Instant now = clock.instant();
        Optional<OperationJournal.Gap> gap = room.call(() -> room.journal().firstGap());
        if (gap.isEmpty()) {
            room.run(() -> room.gapSeen(null));
            return;
        }
        Instant seenAt = room.call(() -> {
            if (room.gapSeenAt() == null) {
                room.gapSeen(now);
            }
            return room.gapSeenAt();
        });
        if (!olderThan(seenAt, config.maintenanceInterval(), now)) {
            return;
        }

        OperationJournal.Gap missing = gap.get();
        List<SequencedOperation> found = persistence.readLog(room.id(), missing.fromInclusive() - 1).stream()
            .filter(op -> op.sequence() <= missing.toInclusive())
            .toList();
        found.forEach(op -> applyRemote(room, op.sequence(), op.operation()));

        room.run(() -> {
            Optional<OperationJournal.Gap> still = room.journal().firstGap();
            if (still.isEmpty() || !still.get().equals(missing)) {
                room.gapSeen(null);
                if (!found.isEmpty()) {
                    LOG.infof("Repaired %d missing operations of %s from the log", found.size(), room.id());
                }
            } else if (olderThan(seenAt, config.fanout().degradedAfter(), now)) {
                LOG.warnf("Skipping unrecoverable sequences %d..%d of %s",
                    missing.fromInclusive(), missing.toInclusive(), room.id());
                room.journal().skip(missing);
                room.gapSeen(null);
            }
        });
    }

    private static boolean olderThan(Instant since, Duration age, Instant now) {
        return !since.plus(age).isAfter(now);
    }
}
