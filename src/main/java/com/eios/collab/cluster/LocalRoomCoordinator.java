package com.eios.collab.cluster;

import io.smallrye.mutiny.Uni;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process coordinator.
 */
public class LocalRoomCoordinator implements RoomCoordinator {

    private record Lock(String token, Instant expiresAt) {}

    private record Window(long count, Instant resetAt) {}

    private final Clock clock;
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Map<String, Lock> locks = new ConcurrentHashMap<>();
    private final Map<String, Window> connections = new ConcurrentHashMap<>();

    public LocalRoomCoordinator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Long> nextSequence(String roomId, long floor) {
        AtomicLong counter = sequences.computeIfAbsent(roomId, k -> new AtomicLong());
        return Uni.createFrom().item(() -> counter.updateAndGet(current -> Math.max(current, floor) + 1));
    }

    @Override
    public Uni<Optional<String>> tryLock(String roomId, String lockName, Duration ttl) {
        return Uni.createFrom().item(() -> {
            String key = RedisKeys.lock(roomId, lockName);
            String token = UUID.randomUUID().toString();
            Instant now = clock.instant();
            Lock acquired = locks.compute(key, (k, current) ->
                current == null || !current.expiresAt().isAfter(now) ? new Lock(token, now.plus(ttl)) : current);
            return acquired.token().equals(token) ? Optional.of(token) : Optional.empty();
        });
    }

    @Override
    public Uni<Void> unlock(String roomId, String lockName, String token) {
        return Uni.createFrom().item(() -> {
            locks.computeIfPresent(RedisKeys.lock(roomId, lockName),
                (k, current) -> current.token().equals(token) ? null : current);
            return null;
        });
    }

    @Override
    public Uni<Long> countConnection(String roomId, String clientAddress, Duration window) {
        return Uni.createFrom().item(() -> {
            Instant now = clock.instant();
            return connections.compute(RedisKeys.connections(roomId, clientAddress), (k, current) ->
                current == null || !now.isBefore(current.resetAt())
                    ? new Window(1, now.plus(window))
                    : new Window(current.count() + 1, current.resetAt())).count();
        });
    }

    @Override
    public void evictExpired() {
        Instant now = clock.instant();
        connections.values().removeIf(w -> !now.isBefore(w.resetAt()));
        locks.values().removeIf(l -> !l.expiresAt().isAfter(now));
    }

    int trackedConnectionWindows() {
        return connections.size();
    }

    @Override
    public Uni<Void> ping() {
        return Uni.createFrom().voidItem();
    }
}
