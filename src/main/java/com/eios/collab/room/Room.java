package com.eios.collab.room;

import com.eios.collab.crdt.OperationJournal;
import com.eios.collab.crdt.ReplicatedDocument;
import com.eios.collab.message.ServerMessage;
import com.eios.collab.session.Session;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Live collaboration unit: one document, its journal and the sessions connected to it
 * on this process.
 *
 * <p>Every read-modify-write of room state happens under the room lock, through
 * {@link #call(Supplier)} or {@link #run(Runnable)}.
 * Sends to clients are queued on their channels and never wait, so they are safe to
 * issue while the lock is held.
 */
public class Room {

    private static final Logger LOG = Logger.getLogger(Room.class);

    private final DocumentKey key;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Deque<OutboxEntry> outbox = new ArrayDeque<>();

    private ReplicatedDocument document;
    private OperationJournal journal;
    private boolean loaded;
    private volatile boolean closed;
    private volatile boolean degraded;

    // persistence bookkeeping
    private int operationsSinceSnapshot;
    private boolean snapshotRequired;
    private Instant lastSnapshotAt;
    private long lastSnapshotWatermark;
    private boolean snapshotInFlight;
    private Cancellable snapshotJob;
    private Instant storageFailingSince;

    private Instant emptySince;
    private Instant gapSeenAt;
    private volatile Cancellable busSubscription;
    private volatile Cancellable presenceSubscription;

    public Room(DocumentKey key, ObjectMapper mapper, Instant createdAt) {
        this.key = key;
        this.mapper = mapper;
        this.emptySince = createdAt;
    }

    public String id() {
        return key.roomId();
    }

    public DocumentKey key() {
        return key;
    }

    public <T> T call(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable work) {
        lock.lock();
        try {
            work.run();
        } finally {
            lock.unlock();
        }
    }

    // ---- lifecycle (call under the lock) ----

    public boolean isLoaded() {
        return loaded;
    }

    public void load(ReplicatedDocument document, OperationJournal journal, Instant now) {
        this.document = document;
        this.journal = journal;
        this.loaded = true;
        this.lastSnapshotAt = now;
        this.lastSnapshotWatermark = journal.baseline();
    }

    public boolean isClosed() {
        return closed;
    }

    public void markClosed() {
        closed = true;
    }

    /**
     * Undoes {@link #markClosed()} when an eviction could not make the state durable.
     */
    public void reopen() {
        closed = false;
    }

    public ReplicatedDocument document() {
        return document;
    }

    public OperationJournal journal() {
        return journal;
    }

    // ---- members ----

    public void join(Session session) {
        sessions.put(session.id(), session);
        emptySince = null;
    }

    public boolean leave(String sessionId, Instant now) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed && sessions.isEmpty()) {
            emptySince = now;
        }
        return removed;
    }

    public Optional<Session> session(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Collection<Session> sessions() {
        return List.copyOf(sessions.values());
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }

    public Instant emptySince() {
        return emptySince;
    }

    // ---- delivery ----

    public void broadcast(ServerMessage message, String excludeSessionId) {
        String json = toJson(message);
        sessions.forEach((sessionId, session) -> {
            if (!sessionId.equals(excludeSessionId) && session.isOpen()) {
                session.channel().send(json);
            }
        });
    }

    public void sendTo(String sessionId, ServerMessage message) {
        Session session = sessions.get(sessionId);
        if (session != null) {
            session.channel().send(toJson(message));
        }
    }

    private String toJson(ServerMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.type() + " for room " + id(), e);
        }
    }

    // ---- outbox (call under the lock) ----

    public void enqueue(OutboxEntry entry) {
        outbox.addLast(entry);
    }

    public Optional<OutboxEntry> peekOutbox() {
        return Optional.ofNullable(outbox.peekFirst());
    }

    public void replaceHead(OutboxEntry entry) {
        outbox.pollFirst();
        outbox.addFirst(entry);
    }

    public void popOutbox() {
        outbox.pollFirst();
    }

    public int outboxSize() {
        return outbox.size();
    }

    public boolean hasUnsequencedOutbox() {
        return outbox.stream().anyMatch(e -> !e.isSequenced());
    }

    // ---- degraded mode ----

    public boolean isDegraded() {
        return degraded;
    }

    /**
     * @return {@code true} if the flag changed
     */
    public boolean setDegraded(boolean degraded) {
        if (this.degraded == degraded) {
            return false;
        }
        this.degraded = degraded;
        LOG.infof("Room %s is %s", id(), degraded ? "degraded (read-only)" : "writable again");
        return true;
    }

    // ---- persistence bookkeeping (call under the lock) ----

    public void operationApplied() {
        operationsSinceSnapshot++;
    }

    public int operationsSinceSnapshot() {
        return operationsSinceSnapshot;
    }

    public boolean snapshotRequired() {
        return snapshotRequired;
    }

    public void requireSnapshot() {
        snapshotRequired = true;
    }

    public Instant lastSnapshotAt() {
        return lastSnapshotAt;
    }

    public long lastSnapshotWatermark() {
        return lastSnapshotWatermark;
    }

    /**
     * Records a durable snapshot covering {@code covered} operations counted before
     * it was taken.
     */
    public void snapshotWritten(int covered, long watermark, Instant at) {
        operationsSinceSnapshot = Math.max(0, operationsSinceSnapshot - covered);
        snapshotRequired = false;
        lastSnapshotAt = at;
        lastSnapshotWatermark = Math.max(lastSnapshotWatermark, watermark);
    }

    public boolean snapshotInFlight() {
        return snapshotInFlight;
    }

    public void snapshotStarting() {
        snapshotInFlight = true;
    }

    /**
     * Keeps the running job so eviction can cancel it. Ignored when the job already
     * finished.
     */
    public void snapshotJob(Cancellable job) {
        if (snapshotInFlight) {
            snapshotJob = job;
        }
    }

    public void snapshotFinished() {
        snapshotInFlight = false;
        snapshotJob = null;
    }

    public void cancelSnapshot() {
        if (snapshotJob != null) {
            snapshotJob.cancel();
        }
        snapshotFinished();
    }

    public Instant storageFailingSince() {
        return storageFailingSince;
    }

    public void storageFailed(Instant at) {
        if (storageFailingSince == null) {
            storageFailingSince = at;
        }
    }

    public void storageRecovered() {
        storageFailingSince = null;
    }

    public Instant gapSeenAt() {
        return gapSeenAt;
    }

    public void gapSeen(Instant at) {
        gapSeenAt = at;
    }

    // ---- subscriptions ----

    public boolean isBusConnected() {
        return busSubscription != null;
    }

    public void busSubscribed(Cancellable subscription) {
        busSubscription = subscription;
    }

    public void busLost() {
        busSubscription = null;
    }

    public boolean isPresenceSubscribed() {
        return presenceSubscription != null;
    }

    public void presenceSubscribed(Cancellable subscription) {
        presenceSubscription = subscription;
    }

    public void cancelSubscriptions() {
        if (busSubscription != null) {
            busSubscription.cancel();
            busSubscription = null;
        }
        if (presenceSubscription != null) {
            presenceSubscription.cancel();
            presenceSubscription = null;
        }
    }
}
