package com.eios.collab.scenegraph;

import com.eios.collab.crdt.Operation;
import com.eios.collab.crdt.ReplicatedDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the genesis document of a room from a stored editor scene graph
 * ({@code version}, {@code canvas}, {@code assets}, {@code nodes}, {@code components}).
 *
 * <p>Genesis operations are stamped with the reserved {@code seed} origin and
 * consecutive counters, so every process that seeds the same scene graph produces
 * the same replicated state.
 */
@ApplicationScoped
public class SceneGraphSeeder {

    private static final Logger LOG = Logger.getLogger(SceneGraphSeeder.class);

    public static final String SEED_ORIGIN = "seed";
    public static final int SCENE_GRAPH_VERSION = 1;

    private static final Set<String> NODE_STRUCTURE_KEYS = Set.of("id", "type", "children", "parentId");

    private final ObjectMapper mapper;

    @Inject
    public SceneGraphSeeder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ReplicatedDocument defaultDocument() {
        return seed(defaultSceneGraph());
    }

    public ObjectNode defaultSceneGraph() {
        ObjectNode graph = mapper.createObjectNode();
        graph.put("version", SCENE_GRAPH_VERSION);
        graph.putObject("canvas")
            .put("width", 1440)
            .put("height", 900)
            .put("background", "#ffffff");
        ObjectNode assets = graph.putObject("assets");
        assets.putObject("images");
        assets.putObject("fonts");
        graph.putArray("nodes");
        graph.putArray("components");
        return graph;
    }

    public ReplicatedDocument seed(JsonNode sceneGraph) {
        ReplicatedDocument doc = new ReplicatedDocument();
        if (sceneGraph == null || !sceneGraph.isObject()) {
            LOG.warn("Stored scene graph is not an object, seeding the default document");
            return defaultDocument();
        }

        JsonNode canvas = sceneGraph.path("canvas");
        putAll(doc, "canvas", canvas.isObject() ? canvas : defaultSceneGraph().get("canvas"));
        putAll(doc, "assets", sceneGraph.path("assets"));
        putAll(doc, "settings", sceneGraph.path("metadata"));
        doc.merge(Operation.setMeta(doc.nextStamp(SEED_ORIGIN), "settings", "sceneGraphVersion",
            mapper.getNodeFactory().numberNode(sceneGraph.path("version").asInt(SCENE_GRAPH_VERSION))));

        Map<String, JsonNode> nodes = new LinkedHashMap<>();
        for (JsonNode node : sceneGraph.path("nodes")) {
            String id = node.path("id").asText(null);
            String type = node.path("type").asText(null);
            if (id == null || id.isBlank() || ReplicatedDocument.ROOT_ID.equals(id) || nodes.containsKey(id)) {
                LOG.warnf("Skipping scene graph node with missing or duplicate id: %s", id);
                continue;
            }
            if (!NodeTypes.NODE_TYPES.contains(type) || NodeTypes.COMPONENT.equals(type)) {
                LOG.warnf("Skipping scene graph node %s with unknown type %s", id, type);
                continue;
            }
            nodes.put(id, node);
        }

        Map<String, String> parents = new HashMap<>();
        Map<String, List<String>> children = new LinkedHashMap<>();
        nodes.forEach((id, node) -> {
            for (JsonNode child : node.path("children")) {
                String childId = child.asText();
                if (nodes.containsKey(childId) && !parents.containsKey(childId)) {
                    if (NodeTypes.isContainer(node.path("type").asText())) {
                        parents.put(childId, id);
                        children.computeIfAbsent(id, k -> new ArrayList<>()).add(childId);
                    } else {
                        LOG.warnf("Node %s of type %s cannot have children, %s moves to the root",
                            id, node.path("type").asText(), childId);
                    }
                }
            }
        });

        detachCycles(nodes.keySet(), parents, children);

        List<String> topLevel = nodes.keySet().stream()
            .filter(id -> !parents.containsKey(id))
            .sorted((a, b) -> Integer.compare(nodes.get(a).path("zIndex").asInt(0), nodes.get(b).path("zIndex").asInt(0)))
            .toList();
        children.put(ReplicatedDocument.ROOT_ID, new ArrayList<>(topLevel));

        long index = 0;
        for (String id : topLevel) {
            index += SceneGraphTranslator.STEP;
            insertTree(doc, nodes, children, id, ReplicatedDocument.ROOT_ID, index);
        }

        for (JsonNode component : sceneGraph.path("components")) {
            String id = component.path("id").asText(null);
            String componentType = component.path("type").asText(null);
            if (id == null || id.isBlank() || nodes.containsKey(id)) {
                LOG.warnf("Skipping component with missing or duplicate id: %s", id);
                continue;
            }
            if (!NodeTypes.COMPONENT_TYPES.contains(componentType)) {
                LOG.warnf("Skipping component %s with unknown type %s", id, componentType);
                continue;
            }
            ObjectNode props = properties(component);
            props.put("componentType", componentType);
            index += SceneGraphTranslator.STEP;
            doc.merge(Operation.insert(doc.nextStamp(SEED_ORIGIN), id, NodeTypes.COMPONENT,
                ReplicatedDocument.ROOT_ID, index, props));
        }
        return doc;
    }

    // Children lists that loop back on themselves would leave the whole loop unreachable.
    private static void detachCycles(Set<String> ids, Map<String, String> parents, Map<String, List<String>> children) {
        for (String id : ids) {
            Set<String> seen = new HashSet<>();
            String current = id;
            while (parents.containsKey(current)) {
                if (!seen.add(current)) {
                    String parent = parents.remove(current);
                    children.get(parent).remove(current);
                    LOG.warnf("Scene graph nodes around %s form a cycle, %s moves to the root", id, current);
                    break;
                }
                current = parents.get(current);
            }
        }
    }

    private void insertTree(ReplicatedDocument doc, Map<String, JsonNode> nodes, Map<String, List<String>> children,
                            String id, String parentId, long orderIndex) {
        JsonNode node = nodes.get(id);
        doc.merge(Operation.insert(doc.nextStamp(SEED_ORIGIN), id, node.path("type").asText(),
            parentId, orderIndex, properties(node)));
        long childIndex = 0;
        for (String childId : children.getOrDefault(id, List.of())) {
            childIndex += SceneGraphTranslator.STEP;
            insertTree(doc, nodes, children, childId, id, childIndex);
        }
    }

    private ObjectNode properties(JsonNode node) {
        ObjectNode props = mapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!NODE_STRUCTURE_KEYS.contains(e.getKey())) {
                props.set(e.getKey(), e.getValue());
            }
        }
        return props;
    }

    private static void putAll(ReplicatedDocument doc, String map, JsonNode values) {
        if (!values.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = values.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            doc.merge(Operation.setMeta(doc.nextStamp(SEED_ORIGIN), map, e.getKey(), e.getValue()));
        }
    }
}
