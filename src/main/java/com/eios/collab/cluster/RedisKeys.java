package com.eios.collab.cluster;

/**
 * Redis keyspace of the collaboration cluster, all under {@code collab:{roomId}:}.
 */
public final class RedisKeys {

    private RedisKeys() {
    }

    /**
     * Pub/sub channel carrying operations, presence and room control for one room.
     */
    public static String broadcast(String roomId) {
        return key(roomId, "broadcast");
    }

    /**
     * Integer counter: the last sequence number handed out for the room.
     */
    public static String sequence(String roomId) {
        return key(roomId, "seq");
    }

    /**
     * String holding the owner token of a named lock, with a PX expiry.
     */
    public static String lock(String roomId, String lockName) {
        return key(roomId, "lock:" + lockName);
    }

    /**
     * Integer counter of connection attempts from one address, with a PX expiry at the
     * end of its window.
     */
    public static String connections(String roomId, String clientAddress) {
        return key(roomId, "conn:" + clientAddress);
    }

    private static String key(String roomId, String suffix) {
        return "collab:" + roomId + ":" + suffix;
    }
}
