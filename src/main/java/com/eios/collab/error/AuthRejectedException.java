package com.eios.collab.error;

import com.eios.collab.message.RejectReason;

/**
 * Raised while authenticating a connection. Terminal for that connection only.
 */
public class AuthRejectedException extends CollabException {

    private final RejectReason reason;

    public AuthRejectedException(RejectReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthRejectedException(RejectReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public RejectReason reason() {
        return reason;
    }
}
