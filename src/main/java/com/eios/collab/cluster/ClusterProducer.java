package com.eios.collab.cluster;

import com.eios.collab.config.CollabConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.DefaultBean;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Selects the bus and the coordinator.
 *
 * collab.cluster.provider:
 *  - local (default, single process)
 *  - redis (Redis pub/sub and scripts, any number of processes)
 */
@ApplicationScoped
public class ClusterProducer {

    private static final Logger LOG = Logger.getLogger(ClusterProducer.class);

    @Produces
    @Singleton
    @DefaultBean
    public FanoutBus fanoutBus(CollabConfig config, Instance<ReactiveRedisDataSource> redis, ObjectMapper mapper) {
        if (isRedis(config)) {
            LOG.info("Using Redis fan-out bus");
            return new RedisFanoutBus(redis.get(), mapper);
        }
        LOG.info("Using in-process fan-out bus");
        return new LocalFanoutBus();
    }

    @Produces
    @Singleton
    @DefaultBean
    public RoomCoordinator roomCoordinator(CollabConfig config, Instance<ReactiveRedisDataSource> redis,
                                           InstanceIdentity instance, Clock clock) {
        if (isRedis(config)) {
            return new RedisRoomCoordinator(redis.get(), instance.id());
        }
        return new LocalRoomCoordinator(clock);
    }

    private static boolean isRedis(CollabConfig config) {
        String provider = config.cluster().provider().trim().toLowerCase();
        return switch (provider) {
            case "redis" -> true;
            case "local" -> false;
            default -> throw new IllegalStateException("Unknown collab.cluster.provider: " + provider);
        };
    }
}
