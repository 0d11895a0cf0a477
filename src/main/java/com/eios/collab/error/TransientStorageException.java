package com.eios.collab.error;

/**
 * A read or write against durable storage failed and may succeed when retried.
 */
public class TransientStorageException extends CollabException {

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
