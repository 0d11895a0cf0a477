package com.eios.collab.room;

import com.eios.collab.crdt.Operation;

import java.time.Instant;

/**
 * A local operation that is merged and delivered locally but not yet sequenced or not
 * yet published to other processes.
 */
public record OutboxEntry(Operation operation, Long sequence, Instant queuedAt) {

    public boolean isSequenced() {
        return sequence != null;
    }

    public OutboxEntry withSequence(long sequence) {
        return new OutboxEntry(operation, sequence, queuedAt);
    }
}
