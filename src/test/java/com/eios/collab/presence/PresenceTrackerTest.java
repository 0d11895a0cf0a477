package com.eios.collab.presence;

import com.eios.collab.cluster.InstanceIdentity;
import com.eios.collab.testing.MutableClock;
import com.eios.collab.testing.TestConfigs;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PresenceTrackerTest {

    private static final String ROOM = "site_42:v1";

    private MutableClock clock;
    private PresenceTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tracker = new PresenceTracker(clock, new InstanceIdentity("self"), TestConfigs.config(
            "collab.presence.idle-after", "30s",
            "collab.presence.expire-after", "60s"));
    }

    private static PresenceState cursorAt(String userId, int x) {
        return new PresenceState(userId, "User " + userId, "#FF6B6B",
            JsonNodeFactory.instance.objectNode().put("x", x), List.of(), null);
    }

    @Test
    void localUpdatesAreActiveAndReplacePreviousState() {
        tracker.setLocal(ROOM, "s1", cursorAt("u1", 1));
        tracker.setLocal(ROOM, "s1", cursorAt("u1", 2));

        Map<String, PresenceState> snapshot = tracker.snapshot(ROOM);
        assertThat(snapshot).containsOnlyKeys("s1");
        assertThat(snapshot.get("s1").status()).isEqualTo(PresenceStatus.ACTIVE);
        assertThat(snapshot.get("s1").cursor().get("x").asInt()).isEqualTo(2);
    }

    @Test
    void entriesGoIdleThenExpire() {
        tracker.setLocal(ROOM, "s1", cursorAt("u1", 1));

        clock.advance(Duration.ofSeconds(31));
        assertThat(tracker.sweep()).isEmpty();
        assertThat(tracker.snapshot(ROOM).get("s1").status()).isEqualTo(PresenceStatus.IDLE);

        clock.advance(Duration.ofSeconds(30));
        List<PresenceEntry> expired = tracker.sweep();
        assertThat(expired).extracting(PresenceEntry::sessionId).containsExactly("s1");
        assertThat(tracker.snapshot(ROOM)).isEmpty();
    }

    @Test
    void updateBringsIdleEntryBackToActive() {
        tracker.setLocal(ROOM, "s1", cursorAt("u1", 1));
        clock.advance(Duration.ofSeconds(40));
        tracker.sweep();

        tracker.setLocal(ROOM, "s1", cursorAt("u1", 5));

        assertThat(tracker.snapshot(ROOM).get("s1").status()).isEqualTo(PresenceStatus.ACTIVE);
    }

    @Test
    void remoteEntriesFromOwnInstanceAreIgnored() {
        tracker.applyRemote(ROOM, "s9", cursorAt("u9", 1), "self");
        assertThat(tracker.snapshot(ROOM)).isEmpty();

        tracker.applyRemote(ROOM, "s9", cursorAt("u9", 1), "other");
        assertThat(tracker.snapshot(ROOM)).containsOnlyKeys("s9");
        assertThat(tracker.drainLocalChanges(ROOM)).isEmpty();
    }

    @Test
    void removeDropsEntryImmediately() {
        tracker.setLocal(ROOM, "s1", cursorAt("u1", 1));

        assertThat(tracker.remove(ROOM, "s1")).isTrue();
        assertThat(tracker.remove(ROOM, "s1")).isFalse();
        assertThat(tracker.snapshot(ROOM)).isEmpty();
        assertThat(tracker.drainLocalChanges(ROOM)).isEmpty();
    }

    @Test
    void localChangesAreDrainedOnce() {
        tracker.setLocal(ROOM, "s1", cursorAt("u1", 1));
        tracker.setLocal(ROOM, "s2", cursorAt("u2", 1));

        assertThat(tracker.drainLocalChanges(ROOM)).extracting(PresenceEntry::sessionId)
            .containsExactlyInAnyOrder("s1", "s2");
        assertThat(tracker.drainLocalChanges(ROOM)).isEmpty();
    }

    @Test
    void changeStreamOnlyEmitsWhenSomethingChanged() throws InterruptedException {
        tracker.setLocal(ROOM, "s1", cursorAt("u1", 1));
        AssertSubscriber<Map<String, PresenceState>> subscriber = tracker.onChange(ROOM)
            .subscribe().withSubscriber(AssertSubscriber.create(Long.MAX_VALUE));

        subscriber.awaitItems(1);
        Thread.sleep(150);
        assertThat(subscriber.getItems()).hasSize(1);

        tracker.setLocal(ROOM, "s2", cursorAt("u2", 3));
        subscriber.awaitItems(2);
        assertThat(subscriber.getItems().get(1)).containsOnlyKeys("s1", "s2");
        subscriber.cancel();
    }

    @Test
    void coloursAreStablePerUser() {
        assertThat(UserColors.forUser("a")).isEqualTo("#F7DC6F");
        assertThat(UserColors.forUser("ab")).isEqualTo("#DDA0DD");
        assertThat(UserColors.forUser("user-123")).isEqualTo(UserColors.forUser("user-123"))
            .isIn(UserColors.PALETTE);
    }
}
