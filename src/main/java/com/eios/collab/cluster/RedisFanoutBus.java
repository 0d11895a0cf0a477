package com.eios.collab.cluster;

import com.eios.collab.error.FanoutUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.pubsub.ReactivePubSubCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Bus over Redis pub/sub, one channel per room. Messages travel as JSON strings.
 */
public class RedisFanoutBus implements FanoutBus {

    private static final Logger LOG = Logger.getLogger(RedisFanoutBus.class);

    private final ReactivePubSubCommands<String> pubsub;
    private final ObjectMapper mapper;

    public RedisFanoutBus(ReactiveRedisDataSource redis, ObjectMapper mapper) {
        this.pubsub = redis.pubsub(String.class);
        this.mapper = mapper;
    }

    @Override
    public Uni<Void> publish(String roomId, BusMessage message) {
        String json;
        try {
            json = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(new IllegalStateException("Failed to encode bus message", e));
        }
        return pubsub.publish(RedisKeys.broadcast(roomId), json)
            .onFailure().transform(e -> new FanoutUnavailableException("Publish to " + roomId + " failed", e));
    }

    @Override
    public Multi<BusMessage> subscribe(String roomId) {
        return pubsub.subscribe(RedisKeys.broadcast(roomId))
            .onItem().transformToIterable(json -> {
                try {
                    return List.of(mapper.readValue(json, BusMessage.class));
                } catch (JsonProcessingException e) {
                    LOG.warnf("Dropping unreadable bus message on %s: %s", roomId, e.getOriginalMessage());
                    return List.of();
                }
            })
            .onFailure().transform(e -> new FanoutUnavailableException("Subscription to " + roomId + " failed", e));
    }
}
