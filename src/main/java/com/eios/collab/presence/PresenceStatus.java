package com.eios.collab.presence;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PresenceStatus {
    ACTIVE("active"),
    IDLE("idle");

    private final String code;

    PresenceStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
