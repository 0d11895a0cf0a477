package com.eios.collab.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Tunables of the collaboration engine.
 *
 * <p>Configure via application.properties:
 * <pre>
 * collab.cluster.provider=redis
 * collab.storage.provider=s3
 * collab.persistence.snapshot-interval=30s
 * </pre>
 */
@ConfigMapping(prefix = "collab")
public interface CollabConfig {

    /**
     * Identity of this process on the fan-out bus. Generated when unset.
     */
    Optional<String> instanceId();

    /**
     * Period of the maintenance tick (heartbeats, presence expiry, snapshots, eviction).
     */
    @WithDefault("1s")
    Duration maintenanceInterval();

    RoomConfig room();

    SessionConfig session();

    PresenceConfig presence();

    PersistenceConfig persistence();

    FanoutConfig fanout();

    RateLimitConfig rateLimit();

    ClusterConfig cluster();

    StorageConfig storage();

    interface RoomConfig {

        /**
         * How long an empty room stays loaded before it is evicted.
         */
        @WithDefault("5m")
        Duration gracePeriod();
    }

    interface SessionConfig {

        @WithDefault("30s")
        Duration heartbeatTimeout();

        /**
         * How far past the room's logical clock a client may stamp an operation.
         */
        @WithDefault("1000")
        long maxClockDrift();
    }

    interface PresenceConfig {

        /**
         * Minimum spacing between two presence broadcasts to one room.
         */
        @WithDefault("200ms")
        Duration broadcastInterval();

        @WithDefault("30s")
        Duration idleAfter();

        @WithDefault("60s")
        Duration expireAfter();
    }

    interface PersistenceConfig {

        @WithDefault("30s")
        Duration snapshotInterval();

        @WithDefault("500")
        int snapshotOperations();

        @WithDefault("200")
        int logFlushOperations();

        @WithDefault("5")
        int retryAttempts();

        @WithDefault("200ms")
        Duration retryInitialBackoff();

        @WithDefault("10s")
        Duration retryMaxBackoff();

        /**
         * Keep the log segments covered only by the newest snapshot, so a corrupt newest
         * snapshot can still be recovered from the previous one.
         */
        @WithDefault("true")
        boolean keepPreviousGeneration();

        /**
         * How long snapshot writes may keep failing before the room turns read-only.
         */
        @WithDefault("60s")
        Duration degradedAfter();

        @WithDefault("30s")
        Duration writeTimeout();
    }

    interface FanoutConfig {

        /**
         * Age of the oldest unpublished operation at which the room turns read-only.
         */
        @WithDefault("30s")
        Duration degradedAfter();

        @WithDefault("10000")
        int outboxCapacity();

        @WithDefault("2s")
        Duration timeout();
    }

    interface RateLimitConfig {

        @WithDefault("100")
        int maxConnections();

        @WithDefault("60s")
        Duration window();
    }

    interface ClusterConfig {

        /**
         * {@code local} for a single process, {@code redis} for a cluster.
         */
        @WithDefault("local")
        String provider();

        @WithDefault("30s")
        Duration lockTtl();
    }

    interface StorageConfig {

        /**
         * {@code filesystem} or {@code s3}.
         */
        @WithDefault("filesystem")
        String provider();

        @WithDefault("data/collab")
        String directory();

        S3Config s3();
    }

    interface S3Config {

        Optional<String> endpoint();

        @WithDefault("us-east-1")
        String region();

        Optional<String> accessKey();

        Optional<String> secretKey();

        @WithDefault("collab-documents")
        String bucket();
    }
}
