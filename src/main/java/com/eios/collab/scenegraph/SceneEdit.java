package com.eios.collab.scenegraph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A domain-level edit as the editor expresses it, before translation into
 * replicated operations.
 */
public record SceneEdit(
    SceneEditKind kind,
    String nodeId,
    String nodeType,    // INSERT
    String parentId,    // INSERT, MOVE
    Integer index,      // INSERT, MOVE, REORDER; null appends
    String map,         // SET_SETTING: "canvas", "theme", "settings", "assets"
    String field,       // SET_PROPERTY, SET_SETTING
    JsonNode value      // SET_PROPERTY, SET_SETTING; object for INSERT and SET_PROPERTIES
) {

    public static SceneEdit insert(String nodeId, String nodeType, String parentId, Integer index, ObjectNode props) {
        return new SceneEdit(SceneEditKind.INSERT, nodeId, nodeType, parentId, index, null, null, props);
    }

    public static SceneEdit delete(String nodeId) {
        return new SceneEdit(SceneEditKind.DELETE, nodeId, null, null, null, null, null, null);
    }

    public static SceneEdit move(String nodeId, String parentId, Integer index) {
        return new SceneEdit(SceneEditKind.MOVE, nodeId, null, parentId, index, null, null, null);
    }

    public static SceneEdit reorder(String nodeId, int index) {
        return new SceneEdit(SceneEditKind.REORDER, nodeId, null, null, index, null, null, null);
    }

    public static SceneEdit setProperty(String nodeId, String field, JsonNode value) {
        return new SceneEdit(SceneEditKind.SET_PROPERTY, nodeId, null, null, null, null, field, value);
    }

    public static SceneEdit setProperties(String nodeId, ObjectNode values) {
        return new SceneEdit(SceneEditKind.SET_PROPERTIES, nodeId, null, null, null, null, null, values);
    }

    public static SceneEdit setSetting(String map, String field, JsonNode value) {
        return new SceneEdit(SceneEditKind.SET_SETTING, null, null, null, null, map, field, value);
    }
}
