package com.eios.collab.message;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a connection was refused. Each reason maps to the frame code the client sees
 * and to the WebSocket close code sent right after it.
 */
public enum RejectReason {
    UNAUTHENTICATED("unauthenticated", 4401),
    UNAUTHORIZED("unauthorized", 4403),
    DOCUMENT_NOT_FOUND("document_not_found", 4404),
    RATE_LIMITED("rate_limited", 4429),
    AUTH_UNAVAILABLE("auth_unavailable", 1013),
    ROOM_UNAVAILABLE("room_unavailable", 1013);

    private final String code;
    private final int closeCode;

    RejectReason(String code, int closeCode) {
        this.code = code;
        this.closeCode = closeCode;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int closeCode() {
        return closeCode;
    }
}
