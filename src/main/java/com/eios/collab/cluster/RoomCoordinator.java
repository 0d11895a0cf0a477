package com.eios.collab.cluster;

import io.smallrye.mutiny.Uni;

import java.time.Duration;
import java.util.Optional;

/**
 * Cluster-wide coordination for rooms: sequence numbers, short-lived locks and
 * connection counting.
 */
public interface RoomCoordinator {

    /**
     * Allocates the next room-wide sequence number. The counter is first raised to
     * {@code floor} if it is behind, so a room restored at watermark W never reuses
     * W or below.
     */
    Uni<Long> nextSequence(String roomId, long floor);

    /**
     * @return the owner token when the lock was acquired, empty when someone else holds it
     */
    Uni<Optional<String>> tryLock(String roomId, String lockName, Duration ttl);

    /**
     * Releases the lock if {@code token} still owns it.
     */
    Uni<Void> unlock(String roomId, String lockName, String token);

    /**
     * Counts one connection attempt from {@code clientAddress} to the room within the
     * current fixed window, which starts with the first attempt and lasts {@code window}.
     *
     * @return the attempts counted in the window so far, this one included
     */
    Uni<Long> countConnection(String roomId, String clientAddress, Duration window);

    /**
     * Drops state whose time is up. A no-op where the backing store expires keys itself.
     */
    default void evictExpired() {
    }

    Uni<Void> ping();
}
