package com.eios.collab.session;

import com.eios.collab.cluster.InstanceIdentity;
import com.eios.collab.cluster.LocalFanoutBus;
import com.eios.collab.cluster.LocalRoomCoordinator;
import com.eios.collab.cluster.RoomCoordinator;
import com.eios.collab.config.CollabConfig;
import com.eios.collab.config.JacksonCustomizer;
import com.eios.collab.crdt.DocumentData;
import com.eios.collab.crdt.DocumentState;
import com.eios.collab.crdt.Operation;
import com.eios.collab.crdt.OperationType;
import com.eios.collab.crdt.ReplicatedDocument;
import com.eios.collab.crdt.SequencedOperation;
import com.eios.collab.crdt.Stamp;
import com.eios.collab.crdt.Tombstone;
import com.eios.collab.error.AuthRejectedException;
import com.eios.collab.error.FanoutUnavailableException;
import com.eios.collab.message.ClientMessage;
import com.eios.collab.message.RejectReason;
import com.eios.collab.persistence.PersistenceService;
import com.eios.collab.persistence.SnapshotCodec;
import com.eios.collab.presence.PresenceTracker;
import com.eios.collab.room.DocumentKey;
import com.eios.collab.room.Room;
import com.eios.collab.room.RoomLoader;
import com.eios.collab.room.RoomRegistry;
import com.eios.collab.room.RoomSnapshotter;
import com.eios.collab.room.RoomStats;
import com.eios.collab.scenegraph.SceneEdit;
import com.eios.collab.scenegraph.SceneGraphSeeder;
import com.eios.collab.scenegraph.SceneGraphTranslator;
import com.eios.collab.security.Authenticator;
import com.eios.collab.security.Identity;
import com.eios.collab.testing.InMemoryBlobStore;
import com.eios.collab.testing.MutableClock;
import com.eios.collab.testing.RecordingChannel;
import com.eios.collab.testing.TestConfigs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Two engines sharing one bus, coordinator and store behave like two processes
 * serving the same rooms.
 */
class SessionManagerTest {

    private static final DocumentKey DOC = new DocumentKey("site_42", "v1");

    private final ObjectMapper mapper = JacksonCustomizer.configure(new ObjectMapper());
    private final AtomicInteger channels = new AtomicInteger();

    private MutableClock clock;
    private LocalFanoutBus bus;
    private SwitchableCoordinator coordinator;
    private InMemoryBlobStore store;
    private List<Engine> engines;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        bus = new LocalFanoutBus();
        coordinator = new SwitchableCoordinator(new LocalRoomCoordinator(clock));
        store = new InMemoryBlobStore();
        engines = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        engines.forEach(e -> e.registry.rooms().forEach(Room::cancelSubscriptions));
    }

    // ---- joining ----

    @Test
    void firstJoinReceivesFullDocument() {
        Engine a = engine("a");
        RecordingChannel client = new RecordingChannel("c1");

        Optional<Session> session = a.manager.open(client, connect("alice", null));

        assertThat(session).isPresent();
        JsonNode accepted = client.last("accepted");
        assertThat(accepted.path("mode").asText()).isEqualTo("full");
        assertThat(accepted.path("sessionId").asText()).isEqualTo(session.get().id());
        assertThat(accepted.path("readOnly").asBoolean()).isFalse();
        assertThat(accepted.path("watermark").asLong()).isZero();
        assertThat(accepted.path("document").path("maps").path("canvas").has("width")).isTrue();
        assertThat(session.get().state()).isEqualTo(SessionState.JOINED);
        assertThat(a.manager.sessionCount()).isEqualTo(1);
    }

    @Test
    void joinIsAnnouncedToOtherMembers() {
        Engine a = engine("a");
        RecordingChannel first = new RecordingChannel("c1");
        a.manager.open(first, connect("alice", null));

        Session second = a.manager.open(new RecordingChannel("c2"), connect("bob", null)).orElseThrow();

        JsonNode joined = first.last("user_joined");
        assertThat(joined.path("sessionId").asText()).isEqualTo(second.id());
        assertThat(joined.path("userId").asText()).isEqualTo("bob");
        assertThat(second.name()).isEqualTo("User bob");
    }

    @Test
    void reconnectWithKnownWatermarkReceivesDelta() {
        Engine a = engine("a");
        Engine b = engine("b");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        b.manager.open(new RecordingChannel("r"), connect("bob", null));

        a.manager.handle(writer, operation(insert(session.id(), "n1")));

        RecordingChannel rejoined = new RecordingChannel("r2");
        b.manager.open(rejoined, connect("bob", 0L));
        JsonNode accepted = rejoined.last("accepted");
        assertThat(accepted.path("mode").asText()).isEqualTo("delta");
        assertThat(accepted.path("watermark").asLong()).isEqualTo(1);
        assertThat(accepted.path("operations")).hasSize(1);
        assertThat(accepted.path("operations").get(0).path("sequence").asLong()).isEqualTo(1);

        RecordingChannel ahead = new RecordingChannel("r3");
        b.manager.open(ahead, connect("bob", 7L));
        assertThat(ahead.last("accepted").path("mode").asText()).isEqualTo("full");
    }

    @Test
    void deltaReconnectConvergesWithTheRoom() throws Exception {
        Engine a = engine("a");
        Engine b = engine("b");
        RecordingChannel writer = new RecordingChannel("w");
        RecordingChannel reader = new RecordingChannel("r");
        a.manager.open(writer, connect("alice", null));
        b.manager.open(reader, connect("bob", null));
        JsonNode first = reader.last("accepted");
        ReplicatedDocument replica = ReplicatedDocument.fromData(mapper.treeToValue(first.path("document"), DocumentData.class));

        a.manager.handle(writer, edit(SceneEdit.insert("g1", "group", "root", null, null)));
        a.manager.handle(writer, edit(SceneEdit.insert("t1", "text", "root", null, mapper.createObjectNode().put("text", "Hi"))));
        a.manager.handle(writer, edit(SceneEdit.insert("t2", "rect", "g1", null, null)));
        a.manager.handle(writer, edit(SceneEdit.move("t1", "g1", 0)));
        a.manager.handle(writer, edit(SceneEdit.setProperty("t1", "text", mapper.getNodeFactory().textNode("Hello"))));
        a.manager.handle(writer, edit(SceneEdit.delete("t2")));
        a.manager.handle(writer, edit(SceneEdit.setSetting("theme", "accent", mapper.getNodeFactory().textNode("#ff0000"))));

        RecordingChannel rejoined = new RecordingChannel("r2");
        b.manager.open(rejoined, connect("bob", first.path("watermark").asLong()));
        JsonNode accepted = rejoined.last("accepted");
        assertThat(accepted.path("mode").asText()).isEqualTo("delta");
        for (JsonNode entry : accepted.path("operations")) {
            replica.merge(mapper.treeToValue(entry, SequencedOperation.class).operation());
        }

        Room room = a.registry.get(DOC.roomId()).orElseThrow();
        DocumentState expected = room.call(() -> room.document().currentState());
        assertThat(replica.currentState()).isEqualTo(expected);
        assertThat(expected.childIds("g1")).containsExactly("t1");
        assertThat(expected.tombstones()).extracting(Tombstone::nodeId).containsExactly("t2");
    }

    // ---- rejections ----

    @Test
    void missingCredentialIsRejected() {
        Engine a = engine("a");
        RecordingChannel client = new RecordingChannel("c1");

        assertThat(a.manager.open(client, connect(null, null))).isEmpty();

        assertThat(client.last("rejected").path("code").asText()).isEqualTo("unauthenticated");
        assertThat(client.closeCode()).isEqualTo(4401);
        assertThat(a.registry.get(DOC.roomId())).isEmpty();
    }

    @Test
    void connectionFloodIsRateLimited() {
        Engine a = engine("a", "collab.rate-limit.max-connections", "2");
        a.manager.open(new RecordingChannel("c1"), connect("alice", null, "10.9.9.9"));
        a.manager.open(new RecordingChannel("c2"), connect("alice", null, "10.9.9.9"));
        RecordingChannel third = new RecordingChannel("c3");

        assertThat(a.manager.open(third, connect("alice", null, "10.9.9.9"))).isEmpty();

        assertThat(third.last("rejected").path("code").asText()).isEqualTo("rate_limited");
        assertThat(third.closeCode()).isEqualTo(RejectReason.RATE_LIMITED.closeCode());
        assertThat(a.manager.open(new RecordingChannel("c4"), connect("alice", null, "10.9.9.10"))).isPresent();
    }

    @Test
    void connectionLimitIsSharedByEveryProcess() {
        Engine a = engine("a", "collab.rate-limit.max-connections", "2");
        Engine b = engine("b", "collab.rate-limit.max-connections", "2");
        a.manager.open(new RecordingChannel("c1"), connect("alice", null, "10.9.9.9"));
        b.manager.open(new RecordingChannel("c2"), connect("alice", null, "10.9.9.9"));
        RecordingChannel third = new RecordingChannel("c3");

        assertThat(b.manager.open(third, connect("alice", null, "10.9.9.9"))).isEmpty();

        assertThat(third.last("rejected").path("code").asText()).isEqualTo("rate_limited");
    }

    @Test
    void framesBeforeJoiningAreRefused() {
        Engine a = engine("a");
        RecordingChannel stranger = new RecordingChannel("x");

        a.manager.handle(stranger, new ClientMessage(ClientMessage.PING, null, null, null, null));

        assertThat(stranger.last("error").path("code").asText()).isEqualTo("not_joined");
    }

    // ---- operations ----

    @Test
    void operationIsSequencedAndRelayedToOtherProcesses() {
        Engine a = engine("a");
        Engine b = engine("b");
        RecordingChannel writer = new RecordingChannel("w");
        RecordingChannel local = new RecordingChannel("l");
        RecordingChannel remote = new RecordingChannel("r");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        a.manager.open(local, connect("carol", null));
        b.manager.open(remote, connect("bob", null));

        a.manager.handle(writer, operation(insert(session.id(), "n1")));

        JsonNode ack = writer.last("ack");
        assertThat(ack.path("sequence").asLong()).isEqualTo(1);
        assertThat(ack.path("stamp").path("origin").asText()).isEqualTo(session.id());
        assertThat(writer.frames("operation")).isEmpty();
        assertThat(local.last("operation").path("sequence").asLong()).isEqualTo(1);
        assertThat(remote.last("operation").path("operation").path("nodeId").asText()).isEqualTo("n1");

        Room remoteRoom = b.registry.get(DOC.roomId()).orElseThrow();
        assertThat(remoteRoom.call(() -> remoteRoom.document().currentState().childIds("root"))).containsExactly("n1");
        assertThat(remoteRoom.call(() -> remoteRoom.journal().watermark())).isEqualTo(1);
    }

    @Test
    void duplicateOperationIsAcknowledgedWithoutSequence() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        Operation op = insert(session.id(), "n1");

        a.manager.handle(writer, operation(op));
        writer.clear();
        a.manager.handle(writer, operation(op));

        assertThat(writer.last("ack").has("sequence")).isFalse();
        assertThat(a.manager.stats(DOC.roomId()).map(RoomStats::watermark)).contains(1L);
    }

    @Test
    void viewerJoinsReadOnlyAndCannotWrite() {
        Engine a = engine("a");
        RecordingChannel viewer = new RecordingChannel("v");
        Session session = a.manager.open(viewer, connect("viewer-1", null)).orElseThrow();

        assertThat(viewer.last("accepted").path("readOnly").asBoolean()).isTrue();

        a.manager.handle(viewer, operation(insert(session.id(), "n1")));

        assertThat(viewer.last("error").path("code").asText()).isEqualTo("read_only");
        assertThat(viewer.frames("ack")).isEmpty();
    }

    @Test
    void operationMustCarryTheSessionAsOrigin() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        a.manager.open(writer, connect("alice", null));

        a.manager.handle(writer, operation(insert("someone-else", "n1")));

        assertThat(writer.last("error").path("code").asText()).isEqualTo("origin_mismatch");
    }

    @Test
    void malformedOperationIsRejectedAndConnectionStaysOpen() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        Operation untyped = new Operation(OperationType.INSERT_NODE, new Stamp(100, session.id()), "n1", null,
            "root", 1024L, null, null);

        a.manager.handle(writer, operation(untyped));

        assertThat(writer.last("error").path("code").asText()).isEqualTo("validation_rejected");
        assertThat(writer.isClosed()).isFalse();
    }

    @Test
    void rawOperationsThatWouldBreakTheTreeAreRejected() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        a.manager.handle(writer, edit(SceneEdit.insert("g1", "group", "root", null, null)));
        a.manager.handle(writer, edit(SceneEdit.insert("g2", "group", "g1", null, null)));
        a.manager.handle(writer, edit(SceneEdit.insert("leaf", "text", "root", null, null)));
        Room room = a.registry.get(DOC.roomId()).orElseThrow();
        DocumentState before = room.call(() -> room.document().currentState());
        long watermark = room.call(() -> room.journal().watermark());
        writer.clear();

        a.manager.handle(writer, operation(Operation.move(nextStamp(room, session), "g1", "g2", 1024)));
        a.manager.handle(writer, operation(Operation.insert(nextStamp(room, session), "x", "banana", "g2", 1024, null)));
        a.manager.handle(writer, operation(Operation.insert(nextStamp(room, session), "y", "text", "leaf", 1024, null)));
        a.manager.handle(writer, operation(Operation.insert(nextStamp(room, session), "g2", "group", "root", 4096, null)));
        a.manager.handle(writer, operation(Operation.move(nextStamp(room, session), "leaf", "missing", 1024)));

        assertThat(writer.frames("error")).hasSize(5)
            .allSatisfy(error -> assertThat(error.path("code").asText()).isEqualTo("validation_rejected"));
        assertThat(writer.frames("ack")).isEmpty();
        assertThat(room.call(() -> room.journal().watermark())).isEqualTo(watermark);
        assertThat(room.call(() -> room.document().currentState())).isEqualTo(before);
        assertThat(writer.isClosed()).isFalse();
    }

    @Test
    void validRawOperationIsStillAccepted() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        a.manager.handle(writer, edit(SceneEdit.insert("g1", "group", "root", null, null)));
        a.manager.handle(writer, edit(SceneEdit.insert("leaf", "text", "root", null, null)));
        Room room = a.registry.get(DOC.roomId()).orElseThrow();
        writer.clear();

        a.manager.handle(writer, operation(Operation.move(nextStamp(room, session), "leaf", "g1", 1024)));

        assertThat(writer.frames("error")).isEmpty();
        assertThat(writer.last("ack").path("sequence").asLong()).isEqualTo(3);
        assertThat(room.call(() -> room.document().currentState().childIds("g1"))).containsExactly("leaf");
    }

    @Test
    void operationStampedFarAheadOfTheRoomClockIsRejected() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        a.manager.handle(writer, edit(SceneEdit.insert("t", "text", "root", null, mapper.createObjectNode().put("text", "hi"))));
        Room room = a.registry.get(DOC.roomId()).orElseThrow();
        long clockBefore = room.call(() -> room.document().maxCounter());
        writer.clear();

        a.manager.handle(writer, operation(Operation.setField(new Stamp(Long.MAX_VALUE, session.id()), "t", "text",
            mapper.getNodeFactory().textNode("evil"))));

        assertThat(writer.last("error").path("code").asText()).isEqualTo("validation_rejected");
        assertThat(room.call(() -> room.document().maxCounter())).isEqualTo(clockBefore);

        a.manager.handle(writer, edit(SceneEdit.setProperty("t", "text", mapper.getNodeFactory().textNode("good"))));

        assertThat(room.call(() -> room.document().currentState().find("t")))
            .hasValueSatisfying(node -> assertThat(node.props().get("text").asText()).isEqualTo("good"));
    }

    @Test
    void sceneEditIsTranslatedAndReplicated() {
        Engine a = engine("a");
        Engine b = engine("b");
        RecordingChannel writer = new RecordingChannel("w");
        RecordingChannel remote = new RecordingChannel("r");
        a.manager.open(writer, connect("alice", null));
        b.manager.open(remote, connect("bob", null));
        ObjectNode props = mapper.createObjectNode().put("text", "Hello");

        a.manager.handle(writer, new ClientMessage(ClientMessage.EDIT, null,
            SceneEdit.insert("title", "text", "root", null, props), null, null));

        assertThat(writer.frames("ack")).isNotEmpty();
        Room remoteRoom = b.registry.get(DOC.roomId()).orElseThrow();
        assertThat(remoteRoom.call(() -> remoteRoom.document().currentState().find("title")))
            .hasValueSatisfying(node -> assertThat(node.props().get("text").asText()).isEqualTo("Hello"));
    }

    @Test
    void unknownFrameTypeIsAnsweredWithError() {
        Engine a = engine("a");
        RecordingChannel client = new RecordingChannel("c");
        a.manager.open(client, connect("alice", null));

        a.manager.handle(client, new ClientMessage("shout", null, null, null, null));

        assertThat(client.last("error").path("code").asText()).isEqualTo("bad_request");
    }

    @Test
    void pingIsAnsweredWithWatermark() {
        Engine a = engine("a");
        RecordingChannel client = new RecordingChannel("c");
        Session session = a.manager.open(client, connect("alice", null)).orElseThrow();

        a.manager.handle(client, new ClientMessage(ClientMessage.PING, null, null, null, null));

        assertThat(client.last("pong").path("watermark").asLong()).isZero();
        assertThat(session.state()).isEqualTo(SessionState.ACTIVE);
    }

    // ---- presence ----

    @Test
    void lateJoinerOnAnotherProcessSeesExistingMembers() {
        Engine a = engine("a");
        Engine b = engine("b");
        Session alice = a.manager.open(new RecordingChannel("a1"), connect("alice", null)).orElseThrow();

        RecordingChannel bobChannel = new RecordingChannel("b1");
        Session bob = b.manager.open(bobChannel, connect("bob", null)).orElseThrow();

        JsonNode members = bobChannel.last("accepted").path("presence");
        assertThat(members.has(alice.id())).isTrue();
        assertThat(members.has(bob.id())).isTrue();
        assertThat(b.presence.snapshot(DOC.roomId()).get(alice.id()).userId()).isEqualTo("alice");
    }

    @Test
    void leavingMemberIsRemovedFromPresenceOnEveryProcess() {
        Engine a = engine("a");
        Engine b = engine("b");
        RecordingChannel aliceChannel = new RecordingChannel("a1");
        Session alice = a.manager.open(aliceChannel, connect("alice", null)).orElseThrow();
        b.manager.open(new RecordingChannel("b1"), connect("bob", null));
        assertThat(b.presence.snapshot(DOC.roomId())).containsKey(alice.id());

        a.manager.disconnect(aliceChannel);

        assertThat(b.presence.snapshot(DOC.roomId())).doesNotContainKey(alice.id());
    }

    @Test
    void expiredPresenceIsRemovedOnEveryProcess() {
        Engine a = engine("a", "collab.session.heartbeat-timeout", "10m");
        Engine b = engine("b", "collab.session.heartbeat-timeout", "10m");
        RecordingChannel aliceChannel = new RecordingChannel("a1");
        Session alice = a.manager.open(aliceChannel, connect("alice", null)).orElseThrow();
        b.manager.open(new RecordingChannel("b1"), connect("bob", null));
        assertThat(b.presence.snapshot(DOC.roomId())).containsKey(alice.id());

        clock.advance(Duration.ofSeconds(61));
        a.manager.maintain();

        assertThat(aliceChannel.isClosed()).isFalse();
        assertThat(a.presence.snapshot(DOC.roomId())).doesNotContainKey(alice.id());
        assertThat(b.presence.snapshot(DOC.roomId())).doesNotContainKey(alice.id());
    }

    // ---- outbox ----

    @Test
    void operationsQueuedWhileCoordinatorIsDownAreResentLater() {
        Engine a = engine("a");
        Engine b = engine("b");
        RecordingChannel writer = new RecordingChannel("w");
        RecordingChannel remote = new RecordingChannel("r");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        b.manager.open(remote, connect("bob", null));

        coordinator.down = true;
        a.manager.handle(writer, operation(insert(session.id(), "n1")));

        assertThat(writer.last("ack").has("sequence")).isFalse();
        assertThat(remote.frames("operation")).isEmpty();
        assertThat(a.manager.stats(DOC.roomId()).map(RoomStats::outboxSize)).contains(1);

        coordinator.down = false;
        a.manager.maintain();

        assertThat(remote.last("operation").path("sequence").asLong()).isEqualTo(1);
        assertThat(a.manager.stats(DOC.roomId()).map(RoomStats::outboxSize)).contains(0);
    }

    @Test
    void longStuckOutboxTurnsTheRoomReadOnly() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();

        coordinator.down = true;
        a.manager.handle(writer, operation(insert(session.id(), "n1")));
        clock.advance(Duration.ofSeconds(31));
        a.manager.handle(writer, new ClientMessage(ClientMessage.PING, null, null, null, null));
        a.manager.maintain();

        assertThat(writer.frames("degraded")).hasSize(1);
        a.manager.handle(writer, operation(insert(session.id(), "n2")));
        assertThat(writer.last("error").path("code").asText()).isEqualTo("read_only");

        coordinator.down = false;
        a.manager.maintain();

        assertThat(writer.frames("recovered")).hasSize(1);
    }

    // ---- leaving and closing ----

    @Test
    void silentSessionTimesOut() {
        Engine a = engine("a");
        RecordingChannel quiet = new RecordingChannel("q");
        RecordingChannel chatty = new RecordingChannel("c");
        Session quietSession = a.manager.open(quiet, connect("alice", null)).orElseThrow();
        a.manager.open(chatty, connect("bob", null));

        clock.advance(Duration.ofSeconds(20));
        a.manager.handle(chatty, new ClientMessage(ClientMessage.PING, null, null, null, null));
        clock.advance(Duration.ofSeconds(11));
        a.manager.maintain();

        assertThat(quiet.closeCode()).isEqualTo(SessionManager.HEARTBEAT_CLOSE_CODE);
        assertThat(chatty.isClosed()).isFalse();
        assertThat(chatty.last("user_left").path("sessionId").asText()).isEqualTo(quietSession.id());
        assertThat(a.manager.sessionCount()).isEqualTo(1);
    }

    @Test
    void leaveClosesNormallyAndIsIdempotent() {
        Engine a = engine("a");
        RecordingChannel client = new RecordingChannel("c");
        a.manager.open(client, connect("alice", null));

        a.manager.handle(client, new ClientMessage(ClientMessage.LEAVE, null, null, null, null));
        a.manager.disconnect(client);

        assertThat(client.closeCode()).isEqualTo(SessionManager.NORMAL_CLOSE_CODE);
        assertThat(a.manager.sessionCount()).isZero();
        assertThat(a.manager.stats(DOC.roomId()).map(RoomStats::sessions)).contains(0);
    }

    @Test
    void emptyRoomIsSnapshottedAndEvictedAfterGracePeriod() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        a.manager.handle(writer, operation(insert(session.id(), "n1")));
        a.manager.disconnect(writer);
        Room room = a.registry.get(DOC.roomId()).orElseThrow();

        clock.advance(Duration.ofMinutes(4));
        assertThat(a.manager.evict(room)).isFalse();
        assertThat(room.isClosed()).isFalse();

        clock.advance(Duration.ofMinutes(1));
        a.manager.maintain();

        assertThat(a.registry.get(DOC.roomId())).isEmpty();
        assertThat(a.persistence.listSnapshots(DOC.roomId()))
            .singleElement()
            .satisfies(info -> assertThat(info.watermark()).isEqualTo(1));
    }

    @Test
    void evictedRoomIsRestoredOnNextJoin() {
        Engine a = engine("a");
        RecordingChannel writer = new RecordingChannel("w");
        Session session = a.manager.open(writer, connect("alice", null)).orElseThrow();
        a.manager.handle(writer, operation(insert(session.id(), "n1")));
        a.manager.closeRoom(DOC.roomId(), "Maintenance");

        RecordingChannel back = new RecordingChannel("back");
        a.manager.open(back, connect("alice", null));

        JsonNode accepted = back.last("accepted");
        assertThat(accepted.path("watermark").asLong()).isEqualTo(1);
        assertThat(accepted.path("document").path("nodes").findValuesAsText("id")).contains("n1");
    }

    @Test
    void closingRoomDisconnectsMembersOnEveryProcess() {
        Engine a = engine("a");
        Engine b = engine("b");
        RecordingChannel local = new RecordingChannel("l");
        RecordingChannel remote = new RecordingChannel("r");
        a.manager.open(local, connect("alice", null));
        b.manager.open(remote, connect("bob", null));

        assertThat(a.manager.closeRoom(DOC.roomId(), "Maintenance")).isTrue();

        assertThat(local.last("room_closing").path("message").asText()).isEqualTo("Maintenance");
        assertThat(local.closeCode()).isEqualTo(SessionManager.GOING_AWAY_CLOSE_CODE);
        assertThat(remote.last("room_closing").path("message").asText()).isEqualTo("Maintenance");
        assertThat(remote.closeCode()).isEqualTo(SessionManager.GOING_AWAY_CLOSE_CODE);
        assertThat(a.registry.get(DOC.roomId())).isEmpty();
        assertThat(a.persistence.listSnapshots(DOC.roomId())).isNotEmpty();

        b.manager.maintain();
        assertThat(b.registry.get(DOC.roomId())).isEmpty();
        assertThat(a.manager.closeRoom(DOC.roomId(), "again")).isFalse();
    }

    // ---- harness ----

    private Engine engine(String id, String... overrides) {
        Engine engine = new Engine(id, TestConfigs.config(overrides));
        engines.add(engine);
        return engine;
    }

    private ConnectRequest connect(String bearer, Long watermark) {
        return connect(bearer, watermark, "10.0.0." + channels.incrementAndGet());
    }

    private ConnectRequest connect(String bearer, Long watermark, String address) {
        return new ConnectRequest(bearer, DOC, null, null, watermark, address);
    }

    private static ClientMessage edit(SceneEdit edit) {
        return new ClientMessage(ClientMessage.EDIT, null, edit, null, null);
    }

    private static Stamp nextStamp(Room room, Session session) {
        return new Stamp(room.call(() -> room.document().maxCounter()) + 1, session.id());
    }

    private Operation insert(String origin, String nodeId) {
        return Operation.insert(new Stamp(100, origin), nodeId, "text", "root", 1024,
            mapper.createObjectNode().put("text", nodeId));
    }

    private static ClientMessage operation(Operation op) {
        return new ClientMessage(ClientMessage.OPERATION, op, null, null, null);
    }

    /**
     * Tokens name the user; users whose name starts with {@code viewer} may only read.
     */
    private static final Authenticator AUTH = (bearer, document) -> {
        if (bearer == null) {
            throw new AuthRejectedException(RejectReason.UNAUTHENTICATED, "Bearer credential required");
        }
        return new Identity(bearer, null, !bearer.startsWith("viewer"));
    };

    private final class Engine {

        final RoomRegistry registry;
        final PersistenceService persistence;
        final PresenceTracker presence;
        final SessionManager manager;

        Engine(String id, CollabConfig config) {
            InstanceIdentity instance = new InstanceIdentity(id);
            registry = new RoomRegistry(mapper, clock);
            persistence = new PersistenceService(store, new SnapshotCodec(mapper), coordinator, clock, config);
            SceneGraphSeeder seeder = new SceneGraphSeeder(mapper);
            RoomLoader loader = new RoomLoader(persistence, (siteId, version) -> null, seeder, clock);
            SceneGraphTranslator translator = new SceneGraphTranslator();
            presence = new PresenceTracker(clock, instance, config);
            manager = new SessionManager(
                registry,
                loader,
                new RoomSnapshotter(persistence, clock, config),
                AUTH,
                new ConnectionRateLimiter(coordinator, config),
                new Replicator(coordinator, bus, persistence, translator, instance, clock, config),
                presence,
                translator,
                bus,
                persistence,
                instance,
                mapper,
                clock,
                config);
        }
    }

    /**
     * Coordinator whose sequencing can be switched off to simulate a lost cluster.
     */
    private static final class SwitchableCoordinator implements RoomCoordinator {

        private final RoomCoordinator delegate;
        volatile boolean down;

        SwitchableCoordinator(RoomCoordinator delegate) {
            this.delegate = delegate;
        }

        @Override
        public Uni<Long> nextSequence(String roomId, long floor) {
            if (down) {
                return Uni.createFrom().failure(new FanoutUnavailableException("coordinator down", null));
            }
            return delegate.nextSequence(roomId, floor);
        }

        @Override
        public Uni<Optional<String>> tryLock(String roomId, String lockName, Duration ttl) {
            return delegate.tryLock(roomId, lockName, ttl);
        }

        @Override
        public Uni<Void> unlock(String roomId, String lockName, String token) {
            return delegate.unlock(roomId, lockName, token);
        }

        @Override
        public Uni<Long> countConnection(String roomId, String clientAddress, Duration window) {
            return delegate.countConnection(roomId, clientAddress, window);
        }

        @Override
        public void evictExpired() {
            delegate.evictExpired();
        }

        @Override
        public Uni<Void> ping() {
            return delegate.ping();
        }
    }
}
