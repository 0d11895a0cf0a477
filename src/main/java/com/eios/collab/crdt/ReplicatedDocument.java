package com.eios.collab.crdt;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Conflict-free replicated scene document.
 *
 * <p>Every piece of state is a last-writer-wins register keyed by {@link Stamp}:
 * node type, node placement (parent + order index), each node field and each entry
 * of the document-level maps. Deletion is a tombstone that always beats concurrent
 * edits. Merging is therefore commutative and idempotent; replicas that saw the same
 * operations in any order, any number of times, materialize equal states.
 *
 * <p>All methods are synchronized: mutation of one document is serialized while
 * different documents proceed independently.
 */
public class ReplicatedDocument {

    private static final Logger LOG = Logger.getLogger(ReplicatedDocument.class);

    public static final String ROOT_ID = "root";
    public static final String ROOT_TYPE = "root";

    private final Map<String, NodeRecord> nodes = new HashMap<>();
    private final Map<String, Map<String, Register>> maps = new TreeMap<>();
    private long maxCounter;

    public ReplicatedDocument() {
    }

    public static ReplicatedDocument fromData(DocumentData data) {
        ReplicatedDocument doc = new ReplicatedDocument();
        doc.load(data);
        return doc;
    }

    private void load(DocumentData data) {
        if (data.nodes() != null) {
            for (NodeData node : data.nodes()) {
                nodes.put(node.id(), NodeRecord.fromData(node));
            }
        }
        if (data.maps() != null) {
            data.maps().forEach((name, entries) -> maps.put(name, new TreeMap<>(entries)));
        }
        maxCounter = data.maxCounter();
    }

    /**
     * Applies an operation produced by a session connected to this process.
     */
    public synchronized ApplyResult applyLocal(Operation op) {
        String problem = op.problem();
        if (problem != null) {
            return ApplyResult.rejected(op, problem);
        }
        return ApplyResult.applied(op, mergeInternal(op));
    }

    /**
     * Merges an operation received from another replica.
     *
     * @return {@code true} if the operation changed this replica, {@code false} for a no-op
     */
    public synchronized boolean merge(Operation op) {
        String problem = op.problem();
        if (problem != null) {
            LOG.warnf("Dropping malformed remote operation %s: %s", op.stamp(), problem);
            return false;
        }
        return mergeInternal(op);
    }

    /**
     * Whether an operation with this stamp is what currently holds the slot it writes,
     * i.e. a redelivery of an operation already merged here.
     */
    public synchronized boolean hasApplied(Operation op) {
        if (op.type() == OperationType.SET_META) {
            Map<String, Register> entries = maps.get(op.nodeId());
            Register current = entries == null ? null : entries.get(op.field());
            return current != null && op.stamp().equals(current.stamp());
        }
        NodeRecord node = nodes.get(op.nodeId());
        if (node == null) {
            return false;
        }
        return switch (op.type()) {
            case INSERT_NODE -> op.stamp().equals(node.insertedAt);
            case DELETE_NODE -> op.stamp().equals(node.deletedAt);
            case MOVE_NODE -> node.placement != null && op.stamp().equals(node.placement.stamp());
            case SET_FIELD -> {
                Register current = node.fields.get(op.field());
                yield current != null && op.stamp().equals(current.stamp());
            }
            case SET_META -> false;
        };
    }

    public synchronized Stamp nextStamp(String origin) {
        maxCounter = Math.addExact(maxCounter, 1);
        return new Stamp(maxCounter, origin);
    }

    public synchronized long maxCounter() {
        return maxCounter;
    }

    public synchronized int liveNodeCount() {
        return (int) nodes.values().stream().filter(NodeRecord::isLive).count();
    }

    private boolean mergeInternal(Operation op) {
        maxCounter = Math.max(maxCounter, op.stamp().counter());
        return switch (op.type()) {
            case INSERT_NODE -> node(op.nodeId()).insert(op.nodeType(), op.stamp(),
                new Placement(op.parentId(), op.orderIndex(), op.stamp()), op.value());
            case DELETE_NODE -> node(op.nodeId()).delete(op.stamp());
            case SET_FIELD -> node(op.nodeId()).setField(op.field(), op.value(), op.stamp());
            case MOVE_NODE -> node(op.nodeId()).place(new Placement(op.parentId(), op.orderIndex(), op.stamp()));
            case SET_META -> setMeta(op.nodeId(), op.field(), op.value(), op.stamp());
        };
    }

    private NodeRecord node(String id) {
        return nodes.computeIfAbsent(id, NodeRecord::new);
    }

    private boolean setMeta(String map, String key, JsonNode value, Stamp stamp) {
        Map<String, Register> entries = maps.computeIfAbsent(map, k -> new TreeMap<>());
        Register current = entries.get(key);
        if (current == null || current.loses(stamp)) {
            entries.put(key, new Register(value, stamp));
            return true;
        }
        return false;
    }

    public synchronized DocumentData toData() {
        List<NodeData> data = nodes.values().stream()
            .sorted(Comparator.comparing(n -> n.id))
            .map(NodeRecord::toData)
            .toList();
        Map<String, Map<String, Register>> mapData = new TreeMap<>();
        maps.forEach((name, entries) -> mapData.put(name, Collections.unmodifiableMap(new TreeMap<>(entries))));
        return new DocumentData(data, Collections.unmodifiableMap(mapData), maxCounter);
    }

    public synchronized DocumentState currentState() {
        Map<String, String> parents = new HashMap<>();
        for (NodeRecord node : nodes.values()) {
            if (node.isLive()) {
                parents.put(node.id, node.placement.parentId());
            }
        }
        breakCycles(parents);

        Map<String, List<NodeRecord>> children = new HashMap<>();
        parents.forEach((id, parent) -> children.computeIfAbsent(parent, k -> new ArrayList<>()).add(nodes.get(id)));
        children.values().forEach(list -> list.sort(
            Comparator.comparing((NodeRecord n) -> n.placement, Placement.SIBLING_ORDER)));

        NodeRecord rootRecord = nodes.get(ROOT_ID);
        SceneNode root = new SceneNode(ROOT_ID, ROOT_TYPE, 0,
            rootRecord == null ? Map.of() : values(rootRecord.fields),
            build(ROOT_ID, children));

        Map<String, Map<String, JsonNode>> mapValues = new TreeMap<>();
        maps.forEach((name, entries) -> mapValues.put(name, values(entries)));

        List<Tombstone> tombstones = nodes.values().stream()
            .filter(n -> n.isInserted() && n.deletedAt != null)
            .sorted(Comparator.comparing(n -> n.id))
            .map(n -> new Tombstone(n.id, n.type, n.deletedAt, Collections.unmodifiableMap(n.retainedEdits())))
            .toList();

        return new DocumentState(root, Collections.unmodifiableMap(mapValues), tombstones);
    }

    private List<SceneNode> build(String parentId, Map<String, List<NodeRecord>> children) {
        List<NodeRecord> list = children.getOrDefault(parentId, List.of());
        List<SceneNode> out = new ArrayList<>(list.size());
        for (NodeRecord child : list) {
            out.add(new SceneNode(child.id, child.type, child.placement.orderIndex(),
                values(child.fields), build(child.id, children)));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Concurrent moves can close a parent cycle that no single replica validated.
     * Each cycle is broken by re-rooting the member whose placement is newest, which
     * depends only on the merged state and so agrees on every replica.
     */
    private void breakCycles(Map<String, String> parents) {
        Set<String> settled = new HashSet<>();
        for (String start : new TreeSet<>(parents.keySet())) {
            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            String current = start;
            while (current != null && parents.containsKey(current) && !settled.contains(current)) {
                if (!onPath.add(current)) {
                    List<String> cycle = path.subList(path.indexOf(current), path.size());
                    String newest = cycle.stream()
                        .max(Comparator.comparing((String id) -> nodes.get(id).placement.stamp()))
                        .orElseThrow();
                    LOG.debugf("Breaking parent cycle %s at %s", cycle, newest);
                    parents.put(newest, ROOT_ID);
                    break;
                }
                path.add(current);
                current = parents.get(current);
            }
            settled.addAll(path);
        }
    }

    private static Map<String, JsonNode> values(Map<String, Register> registers) {
        Map<String, JsonNode> out = new TreeMap<>();
        registers.forEach((k, r) -> out.put(k, r.value()));
        return Collections.unmodifiableMap(out);
    }
}
