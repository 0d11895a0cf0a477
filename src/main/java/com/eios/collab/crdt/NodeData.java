package com.eios.collab.crdt;

import java.util.Map;

/**
 * Serialized form of one node's replicated state, tombstoned or not.
 */
public record NodeData(
    String id,
    String type,
    Stamp insertedAt,
    Placement placement,
    Map<String, Register> fields,
    Stamp deletedAt
) {}
