package com.eios.collab.room;

import com.eios.collab.cluster.LocalRoomCoordinator;
import com.eios.collab.config.CollabConfig;
import com.eios.collab.config.JacksonCustomizer;
import com.eios.collab.crdt.Operation;
import com.eios.collab.crdt.OperationJournal;
import com.eios.collab.crdt.ReplicatedDocument;
import com.eios.collab.crdt.SequencedOperation;
import com.eios.collab.crdt.Stamp;
import com.eios.collab.persistence.PersistenceService;
import com.eios.collab.persistence.SnapshotCodec;
import com.eios.collab.persistence.SnapshotInfo;
import com.eios.collab.testing.InMemoryBlobStore;
import com.eios.collab.testing.MutableClock;
import com.eios.collab.testing.TestConfigs;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.eios.collab.crdt.ReplicatedDocument.ROOT_ID;
import static org.assertj.core.api.Assertions.assertThat;

class RoomSnapshotterTest {

    private final ObjectMapper mapper = JacksonCustomizer.configure(new ObjectMapper());
    private MutableClock clock;
    private InMemoryBlobStore store;
    private PersistenceService persistence;
    private RoomSnapshotter snapshotter;
    private Room room;
    private long sequence;

    @BeforeEach
    void setUp() {
        setUp(TestConfigs.config("collab.persistence.snapshot-operations", "3"));
    }

    private void setUp(CollabConfig config) {
        clock = new MutableClock();
        store = new InMemoryBlobStore();
        persistence = new PersistenceService(store, new SnapshotCodec(mapper), new LocalRoomCoordinator(clock),
            clock, config);
        snapshotter = new RoomSnapshotter(persistence, clock, config);
        room = new Room(new DocumentKey("site", "v1"), mapper, clock.instant());
        sequence = 0;
    }

    private void load() {
        room.run(() -> room.load(new ReplicatedDocument(), new OperationJournal(0), clock.instant()));
    }

    private void edit() {
        long seq = ++sequence;
        Operation op = Operation.insert(new Stamp(seq, "s1"), "n" + seq, "text", ROOT_ID, seq * 1024,
            mapper.createObjectNode());
        room.run(() -> {
            room.document().merge(op);
            room.journal().record(seq, op);
            room.operationApplied();
        });
        persistence.append(room.id(), new SequencedOperation(seq, op));
    }

    private void awaitSnapshot() throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (room.call(room::snapshotInFlight)) {
            assertThat(System.nanoTime()).isLessThan(deadline);
            Thread.sleep(5);
        }
    }

    @Test
    void unloadedRoomIsNeverDue() {
        assertThat(snapshotter.isDue(room, clock.instant())).isFalse();
    }

    @Test
    void roomWithoutSnapshotIsDueRightAway() throws Exception {
        load();
        room.run(room::requireSnapshot);

        assertThat(snapshotter.snapshotIfDue(room)).isTrue();
        awaitSnapshot();

        assertThat(persistence.listSnapshots(room.id())).hasSize(1);
        assertThat(room.call(room::snapshotRequired)).isFalse();
        assertThat(snapshotter.isDue(room, clock.instant())).isFalse();
    }

    @Test
    void dueAfterIntervalWhenChanged() {
        load();
        edit();

        assertThat(snapshotter.isDue(room, clock.instant())).isFalse();
        clock.advance(Duration.ofSeconds(30));
        assertThat(snapshotter.isDue(room, clock.instant())).isTrue();
    }

    @Test
    void dueAfterOperationCount() {
        load();
        edit();
        edit();
        assertThat(snapshotter.isDue(room, clock.instant())).isFalse();

        edit();

        assertThat(snapshotter.isDue(room, clock.instant())).isTrue();
    }

    @Test
    void journalIsTruncatedOneGenerationBehind() throws Exception {
        load();
        edit();
        edit();
        edit();
        snapshotter.snapshotIfDue(room);
        awaitSnapshot();
        assertThat(room.call(() -> room.journal().baseline())).isZero();

        edit();
        edit();
        edit();
        clock.advance(Duration.ofSeconds(1));
        snapshotter.snapshotIfDue(room);
        awaitSnapshot();

        assertThat(room.call(() -> room.journal().baseline())).isEqualTo(3);
        assertThat(room.call(room::operationsSinceSnapshot)).isZero();
        assertThat(persistence.listSnapshots(room.id())).extracting(SnapshotInfo::watermark).containsExactly(3L, 6L);
    }

    @Test
    void finalSnapshotFlushesLogAndWritesSnapshot() {
        load();
        edit();

        assertThat(snapshotter.finalSnapshot(room)).isTrue();

        assertThat(persistence.pendingCount(room.id())).isZero();
        assertThat(persistence.readLog(room.id(), 0)).hasSize(1);
        assertThat(persistence.listSnapshots(room.id())).extracting(SnapshotInfo::watermark).containsExactly(1L);
    }

    @Test
    void finalSnapshotReportsStorageFailure() {
        load();
        edit();
        store.setAvailable(false);

        assertThat(snapshotter.finalSnapshot(room)).isFalse();

        assertThat(room.call(room::storageFailingSince)).isEqualTo(clock.instant());
        assertThat(persistence.pendingCount(room.id())).isEqualTo(1);
    }

    @Test
    void failedBackgroundSnapshotMarksStorageFailing() throws Exception {
        load();
        room.run(room::requireSnapshot);
        store.setAvailable(false);

        snapshotter.snapshotIfDue(room);
        awaitSnapshot();

        assertThat(room.call(room::storageFailingSince)).isNotNull();
        assertThat(room.call(room::snapshotRequired)).isTrue();
    }
}
