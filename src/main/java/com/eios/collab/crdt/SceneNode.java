package com.eios.collab.crdt;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * A visible node of the materialized scene graph.
 */
public record SceneNode(
    String id,
    String type,
    long orderIndex,
    Map<String, JsonNode> props,
    List<SceneNode> children
) {}
