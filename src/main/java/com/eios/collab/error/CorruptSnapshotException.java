package com.eios.collab.error;

/**
 * A stored snapshot failed its integrity check or could not be decoded.
 */
public class CorruptSnapshotException extends CollabException {

    public CorruptSnapshotException(String message) {
        super(message);
    }

    public CorruptSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
