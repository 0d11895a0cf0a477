package com.eios.collab.scenegraph;

import com.eios.collab.crdt.DocumentState;
import com.eios.collab.crdt.Operation;
import com.eios.collab.crdt.ReplicatedDocument;
import com.eios.collab.crdt.SceneNode;
import com.eios.collab.crdt.Stamp;
import com.eios.collab.crdt.Tombstone;
import com.eios.collab.error.ValidationRejectedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Translates editor edits into replicated operations and back.
 *
 * <p>Every edit is validated against the current materialized state before any
 * operation is produced; an edit that would break the tree (cycles, unknown parents,
 * leaves used as containers) is rejected with {@link ValidationRejectedException} and
 * never reaches the replicated log.
 *
 * <p>Sibling order is a sparse order index. An insert or move between two siblings
 * takes the midpoint of their indices; when no integer is left between them, only the
 * following siblings that collide are rewritten. A rewrite is a {@code MOVE_NODE} that
 * keeps the sibling under the parent it has in the state the edit was translated
 * against, so a concurrent reparent of that sibling on another process loses to the
 * rewrite when the rewrite carries the higher stamp.
 */
@ApplicationScoped
public class SceneGraphTranslator {

    static final long STEP = 1024;

    public List<Operation> toOps(SceneEdit edit, DocumentState state, Supplier<Stamp> stamps) {
        if (edit == null || edit.kind() == null) {
            throw new ValidationRejectedException("Edit kind required");
        }
        return switch (edit.kind()) {
            case INSERT -> insert(edit, state, stamps);
            case DELETE -> delete(edit, state, stamps);
            case MOVE -> move(edit, edit.parentId(), state, stamps);
            case REORDER -> move(edit, parentOf(state.root(), requireNodeId(edit))
                .orElseThrow(() -> new ValidationRejectedException("Node " + edit.nodeId() + " not found")).id(),
                state, stamps);
            case SET_PROPERTY -> setProperty(edit, state, stamps);
            case SET_PROPERTIES -> setProperties(edit, state, stamps);
            case SET_SETTING -> setSetting(edit, stamps);
        };
    }

    /**
     * Checks an operation built outside this translator against the current state with
     * the rules edits follow: known node types, live container parents, unused node ids
     * and no cycles. Deletes and field writes may still target a deleted node; they lose
     * to its tombstone when merged.
     *
     * @throws ValidationRejectedException if the operation would break the tree
     */
    public void validate(Operation op, DocumentState state) {
        switch (op.type()) {
            case INSERT_NODE -> {
                requireFreshId(state, op.nodeId());
                requireNodeType(op.nodeType());
                requireProperties(op.value());
                requireContainer(state, op.parentId());
            }
            case DELETE_NODE -> requireKnown(state, op.nodeId());
            case MOVE_NODE -> {
                requireNoCycle(requireNode(state, op.nodeId()), op.parentId());
                requireContainer(state, op.parentId());
            }
            case SET_FIELD -> {
                requireKnown(state, op.nodeId());
                requireWritableField(op.field());
            }
            case SET_META -> requireDocumentMap(op.nodeId());
        }
    }

    public EditSummary fromOps(List<Operation> ops) {
        Set<String> inserted = new LinkedHashSet<>();
        Set<String> deleted = new LinkedHashSet<>();
        Set<String> moved = new LinkedHashSet<>();
        Map<String, Set<String>> fields = new LinkedHashMap<>();
        Map<String, Set<String>> settings = new LinkedHashMap<>();
        for (Operation op : ops) {
            switch (op.type()) {
                case INSERT_NODE -> inserted.add(op.nodeId());
                case DELETE_NODE -> deleted.add(op.nodeId());
                case MOVE_NODE -> moved.add(op.nodeId());
                case SET_FIELD -> fields.computeIfAbsent(op.nodeId(), k -> new LinkedHashSet<>()).add(op.field());
                case SET_META -> settings.computeIfAbsent(op.nodeId(), k -> new LinkedHashSet<>()).add(op.field());
            }
        }
        return new EditSummary(List.copyOf(inserted), List.copyOf(deleted), List.copyOf(moved),
            Map.copyOf(fields), Map.copyOf(settings));
    }

    private List<Operation> insert(SceneEdit edit, DocumentState state, Supplier<Stamp> stamps) {
        String nodeId = requireNodeId(edit);
        requireFreshId(state, nodeId);
        requireNodeType(edit.nodeType());
        ObjectNode props = requireProperties(edit.value());
        String parentId = edit.parentId() == null ? ReplicatedDocument.ROOT_ID : edit.parentId();
        SceneNode parent = requireContainer(state, parentId);

        List<Operation> ops = new ArrayList<>();
        Placed placed = place(parent.children(), nodeId, edit.index(), parentId, stamps);
        ops.add(Operation.insert(stamps.get(), nodeId, edit.nodeType(), parentId, placed.orderIndex(), props));
        ops.addAll(placed.rewrites());
        return ops;
    }

    private List<Operation> delete(SceneEdit edit, DocumentState state, Supplier<Stamp> stamps) {
        String nodeId = requireNodeId(edit);
        if (ReplicatedDocument.ROOT_ID.equals(nodeId)) {
            throw new ValidationRejectedException("The root cannot be deleted");
        }
        requireNode(state, nodeId);
        return List.of(Operation.delete(stamps.get(), nodeId));
    }

    private List<Operation> move(SceneEdit edit, String targetParentId, DocumentState state, Supplier<Stamp> stamps) {
        String nodeId = requireNodeId(edit);
        if (ReplicatedDocument.ROOT_ID.equals(nodeId)) {
            throw new ValidationRejectedException("The root cannot be moved");
        }
        SceneNode node = requireNode(state, nodeId);
        String parentId = targetParentId == null ? ReplicatedDocument.ROOT_ID : targetParentId;
        requireNoCycle(node, parentId);
        SceneNode parent = requireContainer(state, parentId);
        List<SceneNode> siblings = parent.children().stream()
            .filter(child -> !child.id().equals(nodeId))
            .toList();

        Placed placed = place(siblings, nodeId, edit.index(), parentId, stamps);
        List<Operation> ops = new ArrayList<>();
        ops.add(Operation.move(stamps.get(), nodeId, parentId, placed.orderIndex()));
        ops.addAll(placed.rewrites());
        return ops;
    }

    private List<Operation> setProperty(SceneEdit edit, DocumentState state, Supplier<Stamp> stamps) {
        String nodeId = requireNodeId(edit);
        requireNode(state, nodeId);
        if (edit.field() == null || edit.field().isBlank()) {
            throw new ValidationRejectedException("Property name required");
        }
        requireWritableField(edit.field());
        JsonNode value = edit.value() == null ? NullNode.getInstance() : edit.value();
        return List.of(Operation.setField(stamps.get(), nodeId, edit.field(), value));
    }

    private List<Operation> setProperties(SceneEdit edit, DocumentState state, Supplier<Stamp> stamps) {
        String nodeId = requireNodeId(edit);
        requireNode(state, nodeId);
        if (edit.value() == null || !edit.value().isObject() || edit.value().isEmpty()) {
            throw new ValidationRejectedException("Properties must be a non-empty object");
        }
        List<Operation> ops = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = edit.value().fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            requireWritableField(e.getKey());
            ops.add(Operation.setField(stamps.get(), nodeId, e.getKey(), e.getValue()));
        }
        return ops;
    }

    private List<Operation> setSetting(SceneEdit edit, Supplier<Stamp> stamps) {
        requireDocumentMap(edit.map());
        if (edit.field() == null || edit.field().isBlank()) {
            throw new ValidationRejectedException("Setting name required");
        }
        JsonNode value = edit.value() == null ? NullNode.getInstance() : edit.value();
        return List.of(Operation.setMeta(stamps.get(), edit.map(), edit.field(), value));
    }

    private record Placed(long orderIndex, List<Operation> rewrites) {}

    /**
     * Chooses an order index for a node placed at {@code index} among
     * {@code siblings}, rewriting following siblings only when they leave no room.
     */
    private Placed place(List<SceneNode> siblings, String nodeId, Integer index, String parentId,
                         Supplier<Stamp> stamps) {
        int size = siblings.size();
        int at = index == null ? size : index;
        if (at < 0 || at > size) {
            throw new ValidationRejectedException("Index " + at + " out of range 0.." + size + " for " + nodeId);
        }
        if (size == 0) {
            return new Placed(STEP, List.of());
        }
        if (at == size) {
            return new Placed(siblings.get(size - 1).orderIndex() + STEP, List.of());
        }
        long next = siblings.get(at).orderIndex();
        if (at == 0) {
            return new Placed(next - STEP, List.of());
        }
        long prev = siblings.get(at - 1).orderIndex();
        if (next - prev >= 2) {
            return new Placed(prev + (next - prev) / 2, List.of());
        }

        long orderIndex = prev + STEP;
        List<Operation> rewrites = new ArrayList<>();
        long last = orderIndex;
        for (int i = at; i < size; i++) {
            SceneNode sibling = siblings.get(i);
            if (sibling.orderIndex() > last) {
                break;
            }
            last += STEP;
            rewrites.add(Operation.move(stamps.get(), sibling.id(), parentId, last));
        }
        return new Placed(orderIndex, rewrites);
    }

    private static String requireNodeId(SceneEdit edit) {
        if (edit.nodeId() == null || edit.nodeId().isBlank()) {
            throw new ValidationRejectedException("nodeId required");
        }
        return edit.nodeId();
    }

    private static SceneNode requireNode(DocumentState state, String nodeId) {
        return state.find(nodeId)
            .orElseThrow(() -> new ValidationRejectedException("Node " + nodeId + " not found"));
    }

    private static SceneNode requireContainer(DocumentState state, String parentId) {
        SceneNode parent = state.find(parentId)
            .orElseThrow(() -> new ValidationRejectedException("Parent " + parentId + " not found"));
        if (!NodeTypes.isContainer(parent.type())) {
            throw new ValidationRejectedException("Node " + parentId + " of type " + parent.type()
                + " cannot have children");
        }
        return parent;
    }

    private static void requireFreshId(DocumentState state, String nodeId) {
        if (ReplicatedDocument.ROOT_ID.equals(nodeId) || state.find(nodeId).isPresent()) {
            throw new ValidationRejectedException("Node " + nodeId + " already exists");
        }
        if (isTombstoned(state, nodeId)) {
            throw new ValidationRejectedException("Node id " + nodeId + " belongs to a deleted node");
        }
    }

    private static void requireKnown(DocumentState state, String nodeId) {
        if (state.find(nodeId).isEmpty() && !isTombstoned(state, nodeId)) {
            throw new ValidationRejectedException("Node " + nodeId + " not found");
        }
    }

    private static boolean isTombstoned(DocumentState state, String nodeId) {
        return state.tombstones().stream().map(Tombstone::nodeId).anyMatch(nodeId::equals);
    }

    private static void requireNodeType(String nodeType) {
        if (nodeType == null || !NodeTypes.NODE_TYPES.contains(nodeType)) {
            throw new ValidationRejectedException("Unknown node type: " + nodeType);
        }
    }

    private static ObjectNode requireProperties(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new ValidationRejectedException("Node properties must be an object");
        }
        ObjectNode props = (ObjectNode) value;
        props.fieldNames().forEachRemaining(SceneGraphTranslator::requireWritableField);
        JsonNode componentType = props.get("componentType");
        if (componentType != null && !NodeTypes.COMPONENT_TYPES.contains(componentType.asText())) {
            throw new ValidationRejectedException("Unknown component type: " + componentType.asText());
        }
        return props;
    }

    private static void requireNoCycle(SceneNode node, String parentId) {
        if (parentId.equals(node.id()) || find(node, parentId).isPresent()) {
            throw new ValidationRejectedException("Cannot move " + node.id() + " into its own descendant " + parentId);
        }
    }

    private static void requireDocumentMap(String map) {
        if (map == null || !NodeTypes.DOCUMENT_MAPS.contains(map)) {
            throw new ValidationRejectedException("Unknown document setting group: " + map);
        }
    }

    private static void requireWritableField(String field) {
        if (NodeTypes.RESERVED_FIELDS.contains(field)) {
            throw new ValidationRejectedException("Property " + field + " is reserved");
        }
    }

    private static Optional<SceneNode> find(SceneNode from, String nodeId) {
        for (SceneNode child : from.children()) {
            if (child.id().equals(nodeId)) return Optional.of(child);
            Optional<SceneNode> found = find(child, nodeId);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    private static Optional<SceneNode> parentOf(SceneNode from, String nodeId) {
        for (SceneNode child : from.children()) {
            if (child.id().equals(nodeId)) return Optional.of(from);
            Optional<SceneNode> found = parentOf(child, nodeId);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }
}
