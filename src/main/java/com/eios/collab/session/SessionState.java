package com.eios.collab.session;

/**
 * Lifecycle of a {@link Session}. {@link #CLOSED} is terminal.
 */
public enum SessionState {
    CONNECTING,
    AUTHENTICATING,
    JOINED,
    ACTIVE,
    DISCONNECTING,
    CLOSED;

    public boolean canMoveTo(SessionState next) {
        return switch (this) {
            case CONNECTING -> next == AUTHENTICATING || next == CLOSED;
            case AUTHENTICATING -> next == JOINED || next == CLOSED;
            case JOINED -> next == ACTIVE || next == DISCONNECTING;
            case ACTIVE -> next == DISCONNECTING;
            case DISCONNECTING -> next == CLOSED;
            case CLOSED -> false;
        };
    }
}
