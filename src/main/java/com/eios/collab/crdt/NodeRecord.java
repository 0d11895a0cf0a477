package com.eios.collab.crdt;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable replicated state of one node. Only {@link ReplicatedDocument} touches it,
 * always under the document's monitor.
 */
final class NodeRecord {

    final String id;
    String type;
    Stamp insertedAt;
    Placement placement;
    final Map<String, Register> fields = new TreeMap<>();
    Stamp deletedAt;

    NodeRecord(String id) {
        this.id = id;
    }

    boolean isInserted() {
        return type != null;
    }

    boolean isLive() {
        return type != null && deletedAt == null;
    }

    boolean insert(String nodeType, Stamp stamp, Placement at, JsonNode props) {
        boolean changed = false;
        if (stamp.isAfter(insertedAt)) {
            type = nodeType;
            insertedAt = stamp;
            changed = true;
        }
        changed |= place(at);
        if (props != null) {
            Iterator<Map.Entry<String, JsonNode>> it = props.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                changed |= setField(e.getKey(), e.getValue(), stamp);
            }
        }
        return changed;
    }

    boolean place(Placement at) {
        if (placement == null || at.stamp().isAfter(placement.stamp())) {
            placement = at;
            return true;
        }
        return false;
    }

    boolean setField(String field, JsonNode value, Stamp stamp) {
        Register current = fields.get(field);
        if (current == null || current.loses(stamp)) {
            fields.put(field, new Register(value, stamp));
            return true;
        }
        return false;
    }

    // The earliest delete wins so the outcome does not depend on arrival order.
    boolean delete(Stamp stamp) {
        if (deletedAt == null || deletedAt.isAfter(stamp)) {
            deletedAt = stamp;
            return true;
        }
        return false;
    }

    Map<String, Register> retainedEdits() {
        Map<String, Register> retained = new TreeMap<>();
        if (deletedAt == null) return retained;
        fields.forEach((field, register) -> {
            if (register.stamp().isAfter(deletedAt)) {
                retained.put(field, register);
            }
        });
        return retained;
    }

    NodeData toData() {
        return new NodeData(id, type, insertedAt, placement, Collections.unmodifiableMap(new TreeMap<>(fields)), deletedAt);
    }

    static NodeRecord fromData(NodeData data) {
        NodeRecord node = new NodeRecord(data.id());
        node.type = data.type();
        node.insertedAt = data.insertedAt();
        node.placement = data.placement();
        if (data.fields() != null) {
            node.fields.putAll(data.fields());
        }
        node.deletedAt = data.deletedAt();
        return node;
    }
}
