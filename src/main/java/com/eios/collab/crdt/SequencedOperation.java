package com.eios.collab.crdt;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An operation together with the room-wide sequence number it was logged under.
 * The sequence is {@code null} while the operation waits in an outbox.
 */
public record SequencedOperation(Long sequence, Operation operation) {

    @JsonIgnore
    public boolean isSequenced() {
        return sequence != null;
    }
}
