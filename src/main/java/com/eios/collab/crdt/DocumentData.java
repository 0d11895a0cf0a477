package com.eios.collab.crdt;

import java.util.List;
import java.util.Map;

/**
 * Full replicated state of a document: every register with its stamp, so a replica
 * rebuilt from it keeps merging exactly like the one it was taken from. This is what
 * snapshots store and what a full sync sends.
 */
public record DocumentData(
    List<NodeData> nodes,
    Map<String, Map<String, Register>> maps,
    long maxCounter
) {

    public static DocumentData empty() {
        return new DocumentData(List.of(), Map.of(), 0);
    }
}
