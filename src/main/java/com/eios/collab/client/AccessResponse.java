package com.eios.collab.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessResponse(
    boolean allowed,
    boolean canEdit,
    String role,        // "owner", "editor", "viewer"
    String displayName
) {}
