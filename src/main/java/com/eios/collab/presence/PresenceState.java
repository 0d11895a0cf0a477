package com.eios.collab.presence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Ephemeral per-session awareness state. Never persisted and never merged: the
 * latest update for a session replaces the previous one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresenceState(
    String userId,
    String name,
    String color,
    JsonNode cursor,
    List<String> selection,
    PresenceStatus status
) {

    public PresenceState withIdentity(String userId, String name, String color) {
        return new PresenceState(userId, name, color, cursor, selection, status);
    }

    public PresenceState withStatus(PresenceStatus status) {
        return new PresenceState(userId, name, color, cursor, selection, status);
    }
}
