package com.eios.collab.crdt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A replicated primitive. Which fields are set depends on {@link #type()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Operation(
    OperationType type,
    Stamp stamp,
    String nodeId,      // target node, or the document map name for SET_META
    String nodeType,    // INSERT_NODE
    String parentId,    // INSERT_NODE, MOVE_NODE
    Long orderIndex,    // INSERT_NODE, MOVE_NODE
    String field,       // SET_FIELD, SET_META
    JsonNode value      // SET_FIELD, SET_META; initial properties for INSERT_NODE
) {

    public static Operation insert(Stamp stamp, String nodeId, String nodeType, String parentId,
                                   long orderIndex, ObjectNode props) {
        return new Operation(OperationType.INSERT_NODE, stamp, nodeId, nodeType, parentId, orderIndex, null, props);
    }

    public static Operation delete(Stamp stamp, String nodeId) {
        return new Operation(OperationType.DELETE_NODE, stamp, nodeId, null, null, null, null, null);
    }

    public static Operation setField(Stamp stamp, String nodeId, String field, JsonNode value) {
        return new Operation(OperationType.SET_FIELD, stamp, nodeId, null, null, null, field, value);
    }

    public static Operation move(Stamp stamp, String nodeId, String parentId, long orderIndex) {
        return new Operation(OperationType.MOVE_NODE, stamp, nodeId, null, parentId, orderIndex, null, null);
    }

    public static Operation setMeta(Stamp stamp, String map, String key, JsonNode value) {
        return new Operation(OperationType.SET_META, stamp, map, null, null, null, key, value);
    }

    /**
     * Returns a description of what is missing, or {@code null} when the operation is
     * well formed.
     */
    public String problem() {
        if (type == null) return "operation type required";
        if (stamp == null) return "operation stamp required";
        if (nodeId == null || nodeId.isBlank()) return "nodeId required";
        return switch (type) {
            case INSERT_NODE -> {
                if (ReplicatedDocument.ROOT_ID.equals(nodeId)) yield "root cannot be inserted";
                if (nodeType == null || nodeType.isBlank()) yield "nodeType required";
                if (parentId == null || orderIndex == null) yield "parentId and orderIndex required";
                if (value != null && !value.isObject()) yield "insert properties must be an object";
                yield null;
            }
            case DELETE_NODE -> ReplicatedDocument.ROOT_ID.equals(nodeId) ? "root cannot be deleted" : null;
            case MOVE_NODE -> {
                if (ReplicatedDocument.ROOT_ID.equals(nodeId)) yield "root cannot be moved";
                if (parentId == null || orderIndex == null) yield "parentId and orderIndex required";
                if (parentId.equals(nodeId)) yield "node cannot be its own parent";
                yield null;
            }
            case SET_FIELD, SET_META -> field == null || field.isBlank() ? "field required" : null;
        };
    }
}
