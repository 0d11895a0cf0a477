package com.eios.collab.crdt;

import java.util.Map;

/**
 * A deleted node. {@code retainedEdits} holds the field writes stamped after the
 * delete, i.e. concurrent edits that lost to it but are kept for inspection.
 */
public record Tombstone(String nodeId, String type, Stamp deletedAt, Map<String, Register> retainedEdits) {}
