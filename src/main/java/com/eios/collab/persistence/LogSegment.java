package com.eios.collab.persistence;

import com.eios.collab.crdt.SequencedOperation;

import java.util.List;

public record LogSegment(
    String documentId,
    long firstSequence,
    long lastSequence,
    List<SequencedOperation> operations
) {}
