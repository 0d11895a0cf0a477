package com.eios.collab.message;

import com.eios.collab.crdt.DocumentData;
import com.eios.collab.crdt.Operation;
import com.eios.collab.crdt.SequencedOperation;
import com.eios.collab.crdt.Stamp;
import com.eios.collab.presence.PresenceState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
    String type,
    String roomId,
    String sessionId,
    String userId,
    String mode,                            // accepted: "full" or "delta"
    Boolean readOnly,
    Long watermark,
    DocumentData document,                  // accepted (full)
    List<SequencedOperation> operations,    // accepted (delta)
    Long sequence,
    Operation operation,
    Stamp stamp,
    Map<String, PresenceState> presence,
    String code,
    String message
) {
    public static final String MODE_FULL = "full";
    public static final String MODE_DELTA = "delta";

    public static ServerMessage acceptedFull(String roomId, String sessionId, boolean readOnly, long watermark,
                                             DocumentData document, Map<String, PresenceState> presence) {
        return new ServerMessage("accepted", roomId, sessionId, null, MODE_FULL, readOnly, watermark,
            document, null, null, null, null, presence, null, null);
    }

    public static ServerMessage acceptedDelta(String roomId, String sessionId, boolean readOnly, long watermark,
                                              List<SequencedOperation> operations,
                                              Map<String, PresenceState> presence) {
        return new ServerMessage("accepted", roomId, sessionId, null, MODE_DELTA, readOnly, watermark,
            null, operations, null, null, null, presence, null, null);
    }

    public static ServerMessage rejected(RejectReason reason, String message) {
        return new ServerMessage("rejected", null, null, null, null, null, null,
            null, null, null, null, null, null, reason.code(), message);
    }

    public static ServerMessage operation(String roomId, Long sequence, Operation op) {
        return new ServerMessage("operation", roomId, null, null, null, null, null,
            null, null, sequence, op, null, null, null, null);
    }

    public static ServerMessage ack(String roomId, Stamp stamp, Long sequence) {
        return new ServerMessage("ack", roomId, null, null, null, null, null,
            null, null, sequence, null, stamp, null, null, null);
    }

    public static ServerMessage presence(String roomId, Map<String, PresenceState> presence) {
        return new ServerMessage("presence", roomId, null, null, null, null, null,
            null, null, null, null, null, presence, null, null);
    }

    public static ServerMessage pong(long watermark) {
        return new ServerMessage("pong", null, null, null, null, null, watermark,
            null, null, null, null, null, null, null, null);
    }

    public static ServerMessage userJoined(String roomId, String sessionId, String userId) {
        return new ServerMessage("user_joined", roomId, sessionId, userId, null, null, null,
            null, null, null, null, null, null, null, null);
    }

    public static ServerMessage userLeft(String roomId, String sessionId, String userId) {
        return new ServerMessage("user_left", roomId, sessionId, userId, null, null, null,
            null, null, null, null, null, null, null, null);
    }

    public static ServerMessage roomClosing(String roomId, String reason) {
        return new ServerMessage("room_closing", roomId, null, null, null, null, null,
            null, null, null, null, null, null, null, reason);
    }

    public static ServerMessage degraded(String roomId) {
        return new ServerMessage("degraded", roomId, null, null, null, true, null,
            null, null, null, null, null, null, null, "Editing is temporarily read-only");
    }

    public static ServerMessage recovered(String roomId) {
        return new ServerMessage("recovered", roomId, null, null, null, false, null,
            null, null, null, null, null, null, null, null);
    }

    public static ServerMessage error(ErrorCode code, String message) {
        return new ServerMessage("error", null, null, null, null, null, null,
            null, null, null, null, null, null, code.code(), message);
    }
}
