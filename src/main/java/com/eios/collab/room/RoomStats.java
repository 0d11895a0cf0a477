package com.eios.collab.room;

import java.time.Instant;
import java.util.List;

public record RoomStats(
    String roomId,
    String instanceId,
    int sessions,
    List<String> users,
    int presence,
    int liveNodes,
    long watermark,
    long highestSequence,
    int journalSize,
    int outboxSize,
    int pendingLogEntries,
    int operationsSinceSnapshot,
    Instant lastSnapshotAt,
    boolean degraded,
    boolean busConnected
) {}
