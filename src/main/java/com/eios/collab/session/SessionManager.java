package com.eios.collab.session;

import com.eios.collab.cluster.BusMessage;
import com.eios.collab.cluster.FanoutBus;
import com.eios.collab.cluster.InstanceIdentity;
import com.eios.collab.config.CollabConfig;
import com.eios.collab.crdt.Operation;
import com.eios.collab.crdt.SequencedOperation;
import com.eios.collab.error.AuthRejectedException;
import com.eios.collab.error.CollabException;
import com.eios.collab.error.ValidationRejectedException;
import com.eios.collab.message.ClientMessage;
import com.eios.collab.message.ErrorCode;
import com.eios.collab.message.RejectReason;
import com.eios.collab.message.ServerMessage;
import com.eios.collab.persistence.PersistenceService;
import com.eios.collab.presence.PresenceEntry;
import com.eios.collab.presence.PresenceState;
import com.eios.collab.presence.PresenceStatus;
import com.eios.collab.presence.PresenceTracker;
import com.eios.collab.presence.UserColors;
import com.eios.collab.room.DocumentKey;
import com.eios.collab.room.Room;
import com.eios.collab.room.RoomLoader;
import com.eios.collab.room.RoomRegistry;
import com.eios.collab.room.RoomSnapshotter;
import com.eios.collab.room.RoomStats;
import com.eios.collab.scenegraph.SceneEdit;
import com.eios.collab.scenegraph.SceneGraphTranslator;
import com.eios.collab.security.Authenticator;
import com.eios.collab.security.Identity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.subscription.Cancellable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns every connection of this process: admits clients into rooms, routes their
 * frames, relays bus traffic into rooms, and runs the periodic room maintenance
 * (heartbeats, presence expiry, log flushes, snapshots, outbox drains, eviction).
 */
@ApplicationScoped
public class SessionManager {

    private static final Logger LOG = Logger.getLogger(SessionManager.class);

    static final int HEARTBEAT_CLOSE_CODE = 4408;
    static final int GOING_AWAY_CLOSE_CODE = 1001;
    static final int NORMAL_CLOSE_CODE = 1000;
    private static final int JOIN_ATTEMPTS = 3;

    private final RoomRegistry registry;
    private final RoomLoader loader;
    private final RoomSnapshotter snapshotter;
    private final Authenticator authenticator;
    private final ConnectionRateLimiter rateLimiter;
    private final Replicator replicator;
    private final PresenceTracker presence;
    private final SceneGraphTranslator translator;
    private final FanoutBus bus;
    private final PersistenceService persistence;
    private final InstanceIdentity instance;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final CollabConfig config;

    // by channel id
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Inject
    public SessionManager(RoomRegistry registry, RoomLoader loader, RoomSnapshotter snapshotter,
                          Authenticator authenticator, ConnectionRateLimiter rateLimiter, Replicator replicator,
                          PresenceTracker presence, SceneGraphTranslator translator, FanoutBus bus,
                          PersistenceService persistence, InstanceIdentity instance, ObjectMapper mapper,
                          Clock clock, CollabConfig config) {
        this.registry = registry;
        this.loader = loader;
        this.snapshotter = snapshotter;
        this.authenticator = authenticator;
        this.rateLimiter = rateLimiter;
        this.replicator = replicator;
        this.presence = presence;
        this.translator = translator;
        this.bus = bus;
        this.persistence = persistence;
        this.instance = instance;
        this.mapper = mapper;
        this.clock = clock;
        this.config = config;
    }

    // ---- joining ----

    /**
     * Authenticates the connection and joins it to its document's room. Blocks on the
     * identity service and, for the first member, on restoring the document.
     *
     * @return the joined session, or empty if the connection was rejected and closed
     */
    public Optional<Session> open(ClientChannel channel, ConnectRequest request) {
        DocumentKey key = request.document();
        Session session = new Session(UUID.randomUUID().toString(), channel, key.roomId(), clock.instant());

        if (!rateLimiter.tryAcquire(key.roomId(), request.clientAddress())) {
            LOG.warnf("Rate limited connection from %s to %s", request.clientAddress(), key);
            reject(session, RejectReason.RATE_LIMITED, "Too many connections, try again later");
            return Optional.empty();
        }

        session.transition(SessionState.AUTHENTICATING);
        Identity identity;
        try {
            identity = authenticator.authenticate(request.bearer(), key);
        } catch (AuthRejectedException e) {
            LOG.warnf("Rejected connection to %s: %s", key, e.getMessage());
            reject(session, e.reason(), e.getMessage());
            return Optional.empty();
        }
        session.authenticated(identity, displayName(request.name(), identity), color(request.color(), identity));

        for (int attempt = 0; attempt < JOIN_ATTEMPTS; attempt++) {
            Room room = registry.getOrCreate(key);
            try {
                if (join(room, session, request.watermark())) {
                    sessions.put(channel.id(), session);
                    LOG.infof("User %s joined %s as session %s%s", identity.userId(), room.id(), session.id(),
                        identity.canEdit() ? "" : " (read-only)");
                    return Optional.of(session);
                }
            } catch (CollabException e) {
                LOG.errorf("Room %s could not be loaded: %s", room.id(), e.getMessage());
                reject(session, RejectReason.ROOM_UNAVAILABLE, "Document could not be loaded, try again later");
                return Optional.empty();
            }
            if (registry.get(room.id()).filter(current -> current == room).isPresent()) {
                break;
            }
        }
        reject(session, RejectReason.ROOM_UNAVAILABLE, "Room is closing, try again later");
        return Optional.empty();
    }

    /**
     * @return {@code false} if the room closed before the session could join
     */
    private boolean join(Room room, Session session, Long clientWatermark) {
        return room.call(() -> {
            if (room.isClosed()) {
                return false;
            }
            loader.ensureLoaded(room);
            attach(room);

            session.transition(SessionState.JOINED);
            room.join(session);
            presence.setLocal(room.id(), session.id(), new PresenceState(session.userId(), session.name(),
                session.color(), null, List.of(), PresenceStatus.ACTIVE));

            boolean readOnly = !session.canEdit() || room.isDegraded();
            long watermark = room.journal().watermark();
            Map<String, PresenceState> members = presence.snapshot(room.id());
            Optional<List<SequencedOperation>> delta = clientWatermark == null || room.hasUnsequencedOutbox()
                ? Optional.empty()
                : room.journal().since(clientWatermark);
            ServerMessage accepted = delta
                .map(ops -> ServerMessage.acceptedDelta(room.id(), session.id(), readOnly, watermark, ops, members))
                .orElseGet(() -> ServerMessage.acceptedFull(room.id(), session.id(), readOnly, watermark,
                    room.document().toData(), members));
            room.sendTo(session.id(), accepted);
            room.broadcast(ServerMessage.userJoined(room.id(), session.id(), session.userId()), session.id());
            return true;
        });
    }

    private static String displayName(String requested, Identity identity) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        if (identity.displayName() != null && !identity.displayName().isBlank()) {
            return identity.displayName();
        }
        String userId = identity.userId();
        return "User " + userId.substring(0, Math.min(6, userId.length()));
    }

    private static String color(String requested, Identity identity) {
        return requested != null && !requested.isBlank() ? requested : UserColors.forUser(identity.userId());
    }

    private void reject(Session session, RejectReason reason, String message) {
        session.transition(SessionState.CLOSED);
        session.channel().send(toJson(ServerMessage.rejected(reason, message)));
        session.channel().close(reason.closeCode(), message);
    }

    // ---- bus and presence subscriptions ----

    /**
     * Subscribes the room to its bus channel and to coalesced presence, whichever is
     * missing. A new bus subscription asks the other processes for their members'
     * presence.
     */
    private void attach(Room room) {
        if (!room.isBusConnected()) {
            AtomicBoolean ended = new AtomicBoolean();
            Cancellable subscription = bus.subscribe(room.id()).subscribe().with(
                message -> onBusMessage(room, message),
                failure -> {
                    ended.set(true);
                    room.busLost();
                    LOG.warnf("Bus subscription of %s lost: %s", room.id(), failure.getMessage());
                },
                () -> {
                    ended.set(true);
                    room.busLost();
                });
            room.busSubscribed(subscription);
            if (ended.get()) {
                room.busLost();
            } else {
                publish(room.id(), BusMessage.presenceSync(instance.id(), room.id()));
            }
        }
        if (!room.isPresenceSubscribed()) {
            room.presenceSubscribed(presence.onChange(room.id()).subscribe().with(
                snapshot -> publishPresence(room, snapshot),
                failure -> LOG.errorf(failure, "Presence stream of %s failed", room.id())));
        }
    }

    private void publishPresence(Room room, Map<String, PresenceState> snapshot) {
        room.broadcast(ServerMessage.presence(room.id(), snapshot), null);
        for (PresenceEntry entry : presence.drainLocalChanges(room.id())) {
            publish(room.id(), BusMessage.presence(instance.id(), room.id(), entry.sessionId(), entry.state()));
        }
    }

    void onBusMessage(Room room, BusMessage message) {
        if (instance.isSelf(message.instanceId()) || message.type() == null) {
            return;
        }
        switch (message.type()) {
            case BusMessage.OPERATION -> replicator.applyRemote(room, message.sequence(), message.operation());
            case BusMessage.PRESENCE -> {
                if (message.presence() != null) {
                    presence.applyRemote(room.id(), message.sessionId(), message.presence(), message.instanceId());
                }
            }
            case BusMessage.PRESENCE_LEAVE -> presence.remove(room.id(), message.sessionId());
            case BusMessage.PRESENCE_SYNC -> {
                for (PresenceEntry entry : presence.entries(room.id())) {
                    if (instance.isSelf(entry.instanceId())) {
                        publish(room.id(), BusMessage.presence(instance.id(), room.id(), entry.sessionId(), entry.state()));
                    }
                }
            }
            case BusMessage.ROOM_CLOSING -> {
                LOG.infof("Room %s closed by %s", room.id(), message.instanceId());
                closeLocally(room, message.reason());
            }
            default -> LOG.debugf("Ignoring bus message %s in %s", message.type(), room.id());
        }
    }

    private void publish(String roomId, BusMessage message) {
        bus.publish(roomId, message).subscribe().with(
            ignored -> { },
            failure -> LOG.debugf("Publishing %s in %s failed: %s", message.type(), roomId, failure.getMessage()));
    }

    // ---- frames ----

    /**
     * Routes one frame of a joined client. Problems are answered with an {@code error}
     * frame; the connection stays open.
     */
    public void handle(ClientChannel channel, ClientMessage message) {
        Session session = sessions.get(channel.id());
        Room room = session == null ? null : registry.get(session.roomId()).orElse(null);
        if (room == null || room.isClosed()) {
            channel.send(toJson(ServerMessage.error(ErrorCode.NOT_JOINED, "Not joined to a room")));
            return;
        }
        session.touch(clock.instant());
        session.transition(SessionState.JOINED, SessionState.ACTIVE);

        String type = message.type() == null ? "" : message.type();
        switch (type) {
            case ClientMessage.PING -> room.sendTo(session.id(), ServerMessage.pong(room.call(() -> room.journal().watermark())));
            case ClientMessage.ACK -> {
                if (message.watermark() != null) {
                    session.acknowledge(message.watermark());
                }
            }
            case ClientMessage.PRESENCE -> handlePresence(room, session, message.presence());
            case ClientMessage.OPERATION -> handleOperation(room, session, message.operation());
            case ClientMessage.EDIT -> handleEdit(room, session, message.edit());
            case ClientMessage.LEAVE -> {
                disconnect(channel);
                channel.close(NORMAL_CLOSE_CODE, "Left");
            }
            default -> error(room, session, ErrorCode.BAD_REQUEST, "Unknown message type '" + type + "'");
        }
    }

    private void handlePresence(Room room, Session session, PresenceState state) {
        if (state == null) {
            error(room, session, ErrorCode.BAD_REQUEST, "Presence state required");
            return;
        }
        presence.setLocal(room.id(), session.id(), state.withIdentity(session.userId(), session.name(), session.color()));
    }

    private void handleOperation(Room room, Session session, Operation op) {
        if (op == null) {
            error(room, session, ErrorCode.BAD_REQUEST, "Operation required");
            return;
        }
        if (!writable(room, session)) {
            return;
        }
        if (op.stamp() == null || !session.id().equals(op.stamp().origin())) {
            error(room, session, ErrorCode.ORIGIN_MISMATCH, "Operation origin must be the session id");
            return;
        }
        try {
            replicator.commitLocal(room, session.id(), List.of(op));
        } catch (ValidationRejectedException e) {
            error(room, session, ErrorCode.VALIDATION_REJECTED, e.getMessage());
        }
    }

    private void handleEdit(Room room, Session session, SceneEdit edit) {
        if (edit == null) {
            error(room, session, ErrorCode.BAD_REQUEST, "Edit required");
            return;
        }
        if (!writable(room, session)) {
            return;
        }
        try {
            List<SequencedOperation> committed = replicator.commitLocal(room, session.id(),
                state -> translator.toOps(edit, state, () -> room.document().nextStamp(session.id())));
            if (LOG.isDebugEnabled()) {
                LOG.debugf("Edit by %s in %s: %s", session.id(), room.id(),
                    translator.fromOps(committed.stream().map(SequencedOperation::operation).toList()));
            }
        } catch (ValidationRejectedException e) {
            error(room, session, ErrorCode.VALIDATION_REJECTED, e.getMessage());
        }
    }

    private boolean writable(Room room, Session session) {
        if (!session.canEdit()) {
            error(room, session, ErrorCode.READ_ONLY, "Read-only access");
            return false;
        }
        if (room.isDegraded()) {
            error(room, session, ErrorCode.READ_ONLY, "Room is temporarily read-only");
            return false;
        }
        return true;
    }

    private void error(Room room, Session session, ErrorCode code, String message) {
        room.sendTo(session.id(), ServerMessage.error(code, message));
    }

    // ---- leaving ----

    /**
     * Removes the channel's session from its room. Safe to call more than once.
     */
    public void disconnect(ClientChannel channel) {
        Session session = sessions.remove(channel.id());
        if (session == null || !session.beginDisconnect()) {
            return;
        }
        registry.get(session.roomId()).ifPresent(room -> leave(room, session));
        session.transition(SessionState.CLOSED);
        LOG.infof("Session %s of %s left %s", session.id(), session.userId(), session.roomId());
    }

    private void leave(Room room, Session session) {
        if (presence.remove(room.id(), session.id())) {
            publish(room.id(), BusMessage.presenceLeave(instance.id(), room.id(), session.id()));
        }
        room.run(() -> {
            if (room.leave(session.id(), clock.instant())) {
                room.broadcast(ServerMessage.userLeft(room.id(), session.id(), session.userId()), null);
            }
        });
    }

    // ---- closing ----

    /**
     * Tells the members the room is closing and closes their connections. The room is
     * evicted by the next maintenance pass, or right away by {@link #closeRoom}.
     */
    void closeLocally(Room room, String reason) {
        List<Session> members = room.call(() -> {
            room.markClosed();
            room.broadcast(ServerMessage.roomClosing(room.id(), reason), null);
            return List.copyOf(room.sessions());
        });
        for (Session member : members) {
            sessions.remove(member.channel().id(), member);
            if (!member.beginDisconnect()) {
                continue;
            }
            leave(room, member);
            member.transition(SessionState.CLOSED);
            member.channel().close(GOING_AWAY_CLOSE_CODE, reason == null ? "Room closing" : reason);
        }
    }

    /**
     * Closes a room for maintenance on every process: members are notified and
     * disconnected, the state is snapshotted and the room is evicted.
     *
     * @return {@code false} if the room is not loaded on this process
     */
    public boolean closeRoom(String roomId, String reason) {
        Optional<Room> found = registry.get(roomId);
        if (found.isEmpty()) {
            return false;
        }
        Room room = found.get();
        closeLocally(room, reason);
        try {
            bus.publish(roomId, BusMessage.roomClosing(instance.id(), roomId, reason))
                .await().atMost(config.fanout().timeout());
        } catch (RuntimeException e) {
            LOG.warnf("Room %s closed here but the close could not be relayed: %s", roomId, e.getMessage());
        }
        evict(room);
        return true;
    }

    /**
     * Closes and persists every room before the process stops.
     */
    public void shutdown() {
        List<Room> rooms = List.copyOf(registry.rooms());
        LOG.infof("Shutting down %d rooms", rooms.size());
        for (Room room : rooms) {
            closeLocally(room, "Server shutting down");
            evict(room);
        }
    }

    /**
     * Makes the room durable and drops it from memory. A room whose state could not
     * be persisted stays loaded and is retried on the next pass.
     *
     * @return whether the room was evicted
     */
    boolean evict(Room room) {
        Instant now = clock.instant();
        Optional<Boolean> wasClosed = room.call(() -> {
            boolean closed = room.isClosed();
            boolean idle = RoomRegistry.isEvictable(room, now, config.room().gracePeriod());
            if (!closed && !idle) {
                return Optional.empty();
            }
            room.markClosed();
            return Optional.of(closed);
        });
        if (wasClosed.isEmpty()) {
            return false;
        }

        room.cancelSubscriptions();
        if (room.call(room::isLoaded)) {
            if (room.call(room::outboxSize) > 0) {
                replicator.drainOutbox(room);
            }
            if (!snapshotter.finalSnapshot(room)) {
                if (!wasClosed.get()) {
                    room.run(room::reopen);
                }
                return false;
            }
        }
        persistence.discard(room.id());
        presence.clearRoom(room.id());
        registry.remove(room);
        LOG.infof("Room %s evicted", room.id());
        return true;
    }

    // ---- maintenance ----

    /**
     * One maintenance pass over this process' connections and rooms.
     */
    public void maintain() {
        Instant now = clock.instant();
        sweepHeartbeats(now);
        sweepPresence();
        rateLimiter.evictExpired();
        for (Room room : registry.rooms()) {
            try {
                maintain(room, now);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Maintenance of room %s failed", room.id());
            }
        }
    }

    private void sweepHeartbeats(Instant now) {
        for (Session session : List.copyOf(sessions.values())) {
            if (!session.lastSeen().plus(config.session().heartbeatTimeout()).isAfter(now)) {
                LOG.infof("Session %s in %s timed out", session.id(), session.roomId());
                disconnect(session.channel());
                session.channel().close(HEARTBEAT_CLOSE_CODE, "Heartbeat timeout");
            }
        }
    }

    private void sweepPresence() {
        for (PresenceEntry expired : presence.sweep()) {
            if (instance.isSelf(expired.instanceId())) {
                publish(expired.roomId(), BusMessage.presenceLeave(instance.id(), expired.roomId(), expired.sessionId()));
            }
        }
    }

    private void maintain(Room room, Instant now) {
        if (room.isClosed() || room.isEmpty()) {
            if (evict(room) || room.isClosed()) {
                return;
            }
        }
        if (!room.call(room::isLoaded)) {
            return;
        }
        room.run(() -> attach(room));
        if (room.call(room::outboxSize) > 0) {
            replicator.drainOutbox(room);
        }
        replicator.repairGaps(room);
        if (persistence.pendingCount(room.id()) > 0) {
            replicator.flushLog(room);
        }
        snapshotter.snapshotIfDue(room);
        replicator.updateDegraded(room);
    }

    // ---- inspection ----

    public Optional<RoomStats> stats(String roomId) {
        return registry.get(roomId).map(room -> room.call(() -> {
            boolean loaded = room.isLoaded();
            List<String> users = room.sessions().stream().map(Session::userId).distinct().sorted().toList();
            return new RoomStats(
                room.id(),
                instance.id(),
                room.sessions().size(),
                users,
                presence.snapshot(room.id()).size(),
                loaded ? room.document().liveNodeCount() : 0,
                loaded ? room.journal().watermark() : 0,
                loaded ? room.journal().highestSequence() : 0,
                loaded ? room.journal().size() : 0,
                room.outboxSize(),
                persistence.pendingCount(room.id()),
                room.operationsSinceSnapshot(),
                room.lastSnapshotAt(),
                room.isDegraded(),
                room.isBusConnected());
        }));
    }

    public List<RoomStats> allStats() {
        return registry.rooms().stream()
            .map(room -> stats(room.id()))
            .flatMap(Optional::stream)
            .toList();
    }

    public int sessionCount() {
        return sessions.size();
    }

    private String toJson(ServerMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.type(), e);
        }
    }
}
