package com.eios.collab.presence;

import com.eios.collab.cluster.InstanceIdentity;
import com.eios.collab.config.CollabConfig;
import io.smallrye.mutiny.Multi;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Last-writer-wins awareness state per room.
 *
 * <p>An entry moves {@code active -> idle} after {@code collab.presence.idle-after}
 * without updates and disappears after {@code collab.presence.expire-after}, or as
 * soon as its session disconnects. Subscribers of {@link #onChange(String)} see at
 * most one snapshot per {@code collab.presence.broadcast-interval}.
 */
@ApplicationScoped
public class PresenceTracker {

    private static final Logger LOG = Logger.getLogger(PresenceTracker.class);

    private final Clock clock;
    private final InstanceIdentity instance;
    private final Duration broadcastInterval;
    private final Duration idleAfter;
    private final Duration expireAfter;

    private final Map<String, Map<String, PresenceEntry>> rooms = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> versions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> dirtyLocal = new ConcurrentHashMap<>();

    @Inject
    public PresenceTracker(Clock clock, InstanceIdentity instance, CollabConfig config) {
        this.clock = clock;
        this.instance = instance;
        this.broadcastInterval = config.presence().broadcastInterval();
        this.idleAfter = config.presence().idleAfter();
        this.expireAfter = config.presence().expireAfter();
    }

    /**
     * Records the state of a session connected to this process.
     */
    public PresenceEntry setLocal(String roomId, String sessionId, PresenceState state) {
        PresenceEntry entry = new PresenceEntry(sessionId, roomId, state.withStatus(PresenceStatus.ACTIVE),
            clock.instant(), instance.id());
        room(roomId).put(sessionId, entry);
        dirtyLocal.computeIfAbsent(roomId, k -> ConcurrentHashMap.newKeySet()).add(sessionId);
        bump(roomId);
        return entry;
    }

    /**
     * Records state relayed by another process. The receive time is used for expiry
     * so clock skew between processes does not matter.
     */
    public void applyRemote(String roomId, String sessionId, PresenceState state, String instanceId) {
        if (instance.isSelf(instanceId)) {
            return;
        }
        PresenceStatus status = state.status() == null ? PresenceStatus.ACTIVE : state.status();
        room(roomId).put(sessionId, new PresenceEntry(sessionId, roomId, state.withStatus(status),
            clock.instant(), instanceId));
        bump(roomId);
    }

    public boolean remove(String roomId, String sessionId) {
        Map<String, PresenceEntry> entries = rooms.get(roomId);
        if (entries == null || entries.remove(sessionId) == null) {
            return false;
        }
        Set<String> dirty = dirtyLocal.get(roomId);
        if (dirty != null) {
            dirty.remove(sessionId);
        }
        bump(roomId);
        return true;
    }

    public Map<String, PresenceState> snapshot(String roomId) {
        Map<String, PresenceEntry> entries = rooms.get(roomId);
        if (entries == null) {
            return Map.of();
        }
        Map<String, PresenceState> out = new TreeMap<>();
        entries.forEach((sessionId, entry) -> out.put(sessionId, entry.state()));
        return Collections.unmodifiableMap(out);
    }

    public List<PresenceEntry> entries(String roomId) {
        Map<String, PresenceEntry> entries = rooms.get(roomId);
        return entries == null ? List.of() : List.copyOf(entries.values());
    }

    /**
     * Returns local entries updated since the previous call, for relaying to other
     * processes at the coalesced rate.
     */
    public List<PresenceEntry> drainLocalChanges(String roomId) {
        Set<String> dirty = dirtyLocal.get(roomId);
        Map<String, PresenceEntry> entries = rooms.get(roomId);
        if (dirty == null || entries == null) {
            return List.of();
        }
        List<PresenceEntry> out = new ArrayList<>();
        for (String sessionId : List.copyOf(dirty)) {
            dirty.remove(sessionId);
            PresenceEntry entry = entries.get(sessionId);
            if (entry != null) {
                out.add(entry);
            }
        }
        return out;
    }

    /**
     * Advances the idle/expiry state machine.
     *
     * @return the entries that expired and are now absent
     */
    public List<PresenceEntry> sweep() {
        Instant now = clock.instant();
        List<PresenceEntry> expired = new ArrayList<>();
        rooms.forEach((roomId, entries) -> {
            boolean changed = false;
            for (PresenceEntry entry : List.copyOf(entries.values())) {
                Duration age = Duration.between(entry.updatedAt(), now);
                if (age.compareTo(expireAfter) >= 0) {
                    if (entries.remove(entry.sessionId(), entry)) {
                        expired.add(entry);
                        changed = true;
                    }
                } else if (age.compareTo(idleAfter) >= 0 && entry.status() == PresenceStatus.ACTIVE) {
                    PresenceEntry idle = new PresenceEntry(entry.sessionId(), roomId,
                        entry.state().withStatus(PresenceStatus.IDLE), entry.updatedAt(), entry.instanceId());
                    changed |= entries.replace(entry.sessionId(), entry, idle);
                }
            }
            if (changed) {
                bump(roomId);
            }
        });
        if (!expired.isEmpty()) {
            LOG.debugf("Expired %d presence entries", expired.size());
        }
        return expired;
    }

    public void clearRoom(String roomId) {
        rooms.remove(roomId);
        dirtyLocal.remove(roomId);
        versions.remove(roomId);
    }

    /**
     * Coalesced stream of room presence. Emits the current snapshot on the first tick
     * and then only when something changed, never more often than the broadcast
     * interval.
     */
    public Multi<Map<String, PresenceState>> onChange(String roomId) {
        return Multi.createFrom().ticks().every(broadcastInterval)
            .map(tick -> version(roomId))
            .skip().repetitions()
            .map(version -> snapshot(roomId));
    }

    long version(String roomId) {
        AtomicLong version = versions.get(roomId);
        return version == null ? 0L : version.get();
    }

    private Map<String, PresenceEntry> room(String roomId) {
        return rooms.computeIfAbsent(roomId, k -> new ConcurrentHashMap<>());
    }

    private void bump(String roomId) {
        versions.computeIfAbsent(roomId, k -> new AtomicLong()).incrementAndGet();
    }
}
