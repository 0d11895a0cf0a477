package com.eios.collab.crdt;

import java.util.Optional;

/**
 * Outcome of applying a locally produced operation.
 *
 * @param accepted {@code false} only for malformed operations
 * @param changed  {@code false} when the operation was already reflected (duplicate or superseded)
 */
public record ApplyResult(boolean accepted, boolean changed, Operation operation, String problem) {

    static ApplyResult rejected(Operation operation, String problem) {
        return new ApplyResult(false, false, operation, problem);
    }

    static ApplyResult applied(Operation operation, boolean changed) {
        return new ApplyResult(true, changed, operation, null);
    }

    /**
     * The delta to relay to other replicas, empty when nothing changed.
     */
    public Optional<Operation> delta() {
        return changed ? Optional.of(operation) : Optional.empty();
    }
}
