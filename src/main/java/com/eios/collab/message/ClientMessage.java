package com.eios.collab.message;

import com.eios.collab.crdt.Operation;
import com.eios.collab.presence.PresenceState;
import com.eios.collab.scenegraph.SceneEdit;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientMessage(
    String type,            // "operation", "edit", "presence", "ack", "ping", "leave"
    Operation operation,
    SceneEdit edit,
    PresenceState presence,
    Long watermark
) {
    public static final String OPERATION = "operation";
    public static final String EDIT = "edit";
    public static final String PRESENCE = "presence";
    public static final String ACK = "ack";
    public static final String PING = "ping";
    public static final String LEAVE = "leave";
}
