package com.eios.collab.cluster;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Coordinator backed by Redis. Sequence allocation, lock release and connection
 * counting are Lua scripts so each is a single atomic step on the server.
 */
public class RedisRoomCoordinator implements RoomCoordinator {

    // KEYS[1] counter, ARGV[1] floor
    static final String NEXT_SEQUENCE = """
        local current = tonumber(redis.call('GET', KEYS[1]) or '0')
        local floor = tonumber(ARGV[1])
        if current < floor then
          redis.call('SET', KEYS[1], floor)
        end
        return redis.call('INCR', KEYS[1])
        """;

    // KEYS[1] lock, ARGV[1] token
    static final String RELEASE_LOCK = """
        if redis.call('GET', KEYS[1]) == ARGV[1] then
          return redis.call('DEL', KEYS[1])
        end
        return 0
        """;

    // KEYS[1] counter, ARGV[1] window in millis
    static final String COUNT_CONNECTION = """
        local count = redis.call('INCR', KEYS[1])
        if count == 1 then
          redis.call('PEXPIRE', KEYS[1], ARGV[1])
        end
        return count
        """;

    private final ReactiveRedisDataSource redis;
    private final String instanceId;

    public RedisRoomCoordinator(ReactiveRedisDataSource redis, String instanceId) {
        this.redis = redis;
        this.instanceId = instanceId;
    }

    @Override
    public Uni<Long> nextSequence(String roomId, long floor) {
        return redis.execute("EVAL", NEXT_SEQUENCE, "1", RedisKeys.sequence(roomId), Long.toString(floor))
            .map(Response::toLong);
    }

    @Override
    public Uni<Optional<String>> tryLock(String roomId, String lockName, Duration ttl) {
        String token = instanceId + ":" + UUID.randomUUID();
        return redis.execute("SET", RedisKeys.lock(roomId, lockName), token, "NX", "PX", Long.toString(ttl.toMillis()))
            .map(response -> response != null && "OK".equals(response.toString())
                ? Optional.of(token)
                : Optional.<String>empty());
    }

    @Override
    public Uni<Void> unlock(String roomId, String lockName, String token) {
        return redis.execute("EVAL", RELEASE_LOCK, "1", RedisKeys.lock(roomId, lockName), token)
            .replaceWithVoid();
    }

    @Override
    public Uni<Long> countConnection(String roomId, String clientAddress, Duration window) {
        return redis.execute("EVAL", COUNT_CONNECTION, "1", RedisKeys.connections(roomId, clientAddress),
                Long.toString(window.toMillis()))
            .map(Response::toLong);
    }

    @Override
    public Uni<Void> ping() {
        return redis.execute("PING").replaceWithVoid();
    }
}
