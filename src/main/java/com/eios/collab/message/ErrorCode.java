package com.eios.collab.message;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Codes carried by {@code error} frames. None of them close the connection.
 */
public enum ErrorCode {
    BAD_REQUEST("bad_request"),
    VALIDATION_REJECTED("validation_rejected"),
    READ_ONLY("read_only"),
    ORIGIN_MISMATCH("origin_mismatch"),
    NOT_JOINED("not_joined");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
