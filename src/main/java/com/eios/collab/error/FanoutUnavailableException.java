package com.eios.collab.error;

/**
 * The cross-process bus (or the coordinator behind it) could not be reached.
 */
public class FanoutUnavailableException extends CollabException {

    public FanoutUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
