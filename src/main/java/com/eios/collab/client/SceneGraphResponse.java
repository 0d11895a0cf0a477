package com.eios.collab.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SceneGraphResponse(
    String siteId,
    String versionId,
    JsonNode sceneGraph,
    Instant updatedAt
) {}
