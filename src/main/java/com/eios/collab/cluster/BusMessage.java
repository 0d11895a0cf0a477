package com.eios.collab.cluster;

import com.eios.collab.crdt.Operation;
import com.eios.collab.presence.PresenceState;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Message relayed between processes on a room's channel.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BusMessage(
    String type,            // "operation", "presence", "presence_leave", "presence_sync", "room_closing"
    String instanceId,
    String roomId,
    Long sequence,
    Operation operation,
    String sessionId,
    PresenceState presence,
    String reason
) {
    public static final String OPERATION = "operation";
    public static final String PRESENCE = "presence";
    public static final String PRESENCE_LEAVE = "presence_leave";
    // Asks the other processes to republish the presence of their members.
    public static final String PRESENCE_SYNC = "presence_sync";
    public static final String ROOM_CLOSING = "room_closing";

    public static BusMessage operation(String instanceId, String roomId, long sequence, Operation op) {
        return new BusMessage(OPERATION, instanceId, roomId, sequence, op, null, null, null);
    }

    public static BusMessage presence(String instanceId, String roomId, String sessionId, PresenceState state) {
        return new BusMessage(PRESENCE, instanceId, roomId, null, null, sessionId, state, null);
    }

    public static BusMessage presenceLeave(String instanceId, String roomId, String sessionId) {
        return new BusMessage(PRESENCE_LEAVE, instanceId, roomId, null, null, sessionId, null, null);
    }

    public static BusMessage presenceSync(String instanceId, String roomId) {
        return new BusMessage(PRESENCE_SYNC, instanceId, roomId, null, null, null, null, null);
    }

    public static BusMessage roomClosing(String instanceId, String roomId, String reason) {
        return new BusMessage(ROOM_CLOSING, instanceId, roomId, null, null, null, null, reason);
    }
}
