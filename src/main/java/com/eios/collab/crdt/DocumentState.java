package com.eios.collab.crdt;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Materialized, immutable view of a document: the visible tree under the canvas
 * root, the document-level maps and the tombstones. Two replicas that applied the
 * same operations produce equal states.
 */
public record DocumentState(
    SceneNode root,
    Map<String, Map<String, JsonNode>> maps,
    List<Tombstone> tombstones
) {

    public Optional<SceneNode> find(String nodeId) {
        return find(root, nodeId);
    }

    private static Optional<SceneNode> find(SceneNode node, String nodeId) {
        if (node.id().equals(nodeId)) return Optional.of(node);
        for (SceneNode child : node.children()) {
            Optional<SceneNode> found = find(child, nodeId);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    public List<String> childIds(String parentId) {
        return find(parentId)
            .map(n -> n.children().stream().map(SceneNode::id).toList())
            .orElse(List.of());
    }
}
