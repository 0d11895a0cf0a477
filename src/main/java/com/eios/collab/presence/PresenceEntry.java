package com.eios.collab.presence;

import java.time.Instant;

/**
 * Tracked presence of one session. Absent sessions have no entry at all.
 *
 * @param instanceId process the session is connected to; remote entries are swept by
 *                   the same timers as local ones
 */
public record PresenceEntry(
    String sessionId,
    String roomId,
    PresenceState state,
    Instant updatedAt,
    String instanceId
) {

    public PresenceStatus status() {
        return state.status();
    }
}
