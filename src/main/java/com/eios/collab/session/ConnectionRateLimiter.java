package com.eios.collab.session;

import com.eios.collab.cluster.RoomCoordinator;
import com.eios.collab.config.CollabConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Fixed-window limit on connection attempts per room and client address, counted by
 * the {@link RoomCoordinator} so the limit holds across every process serving the room.
 *
 * <p>When the coordinator cannot be reached the attempt is let through.
 */
@ApplicationScoped
public class ConnectionRateLimiter {

    private static final Logger LOG = Logger.getLogger(ConnectionRateLimiter.class);

    private final RoomCoordinator coordinator;
    private final int maxConnections;
    private final Duration window;
    private final Duration timeout;

    @Inject
    public ConnectionRateLimiter(RoomCoordinator coordinator, CollabConfig config) {
        this(coordinator, config.rateLimit().maxConnections(), config.rateLimit().window(), config.fanout().timeout());
    }

    public ConnectionRateLimiter(RoomCoordinator coordinator, int maxConnections, Duration window, Duration timeout) {
        if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections must be positive");
        this.coordinator = coordinator;
        this.maxConnections = maxConnections;
        this.window = window;
        this.timeout = timeout;
    }

    public boolean tryAcquire(String roomId, String clientAddress) {
        String address = clientAddress != null ? clientAddress : "unknown";
        long attempts;
        try {
            attempts = coordinator.countConnection(roomId, address, window).await().atMost(timeout);
        } catch (RuntimeException e) {
            LOG.warnf("Connection count for %s from %s unavailable, admitting: %s", roomId, address, e.getMessage());
            return true;
        }
        return attempts <= maxConnections;
    }

    /**
     * Drops windows that have ended.
     */
    public void evictExpired() {
        coordinator.evictExpired();
    }
}
