package com.eios.collab.error;

/**
 * Base class for failures raised by the synchronization engine.
 *
 * <p>Subclasses map one-to-one onto how the failure is handled: terminal for a
 * connection, rejected before it becomes an operation, retried in the background,
 * or degraded until a collaborator recovers.
 */
public abstract class CollabException extends RuntimeException {

    protected CollabException(String message) {
        super(message);
    }

    protected CollabException(String message, Throwable cause) {
        super(message, cause);
    }
}
