package com.framesmith.core.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framesmith.core.model.DesignGraph;
import com.framesmith.core.model.DesignNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses a serialized design document into an immutable {@link DesignGraph}.
 * <p>
 * Two shapes are accepted:
 * <ul>
 *   <li>nested: {@code {"name": ..., "document": {"id", "type", "name", "children": [ ... ]}}}</li>
 *   <li>flat: {@code {"name": ..., "rootId": ..., "nodes": {"<id>": {"type", "name", "children": ["<id>", ...]}}}}</li>
 * </ul>
 * Both are normalized into an id-keyed node table first, then assembled with a single
 * visited-set walk that rejects dangling references, cycles, shared children and orphans.
 */
@Service
public class DesignGraphLoader {

    private static final Logger log = LoggerFactory.getLogger(DesignGraphLoader.class);

    private static final Set<String> RESERVED_KEYS = Set.of("id", "type", "name", "children");

    private final ObjectMapper objectMapper;

    public DesignGraphLoader() {
        this.objectMapper = new ObjectMapper();
    }

    public DesignGraph load(Path file) {
        try {
            return load(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read design document " + file, e);
        }
    }

    public DesignGraph load(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedInputException("Design document is empty");
        }
        JsonNode document;
        try {
            document = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("Design document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw new MalformedInputException("Design document must be a JSON object");
        }

        var table = new LinkedHashMap<String, RawNode>();
        String rootId;
        if (document.has("document")) {
            rootId = collectNested(document.get("document"), table);
        } else if (document.has("nodes")) {
            rootId = collectFlat(document, table);
        } else if (document.has("id") && document.has("type")) {
            rootId = collectNested(document, table);
        } else {
            throw new MalformedInputException("Design document has neither a 'document' tree nor a 'nodes' table");
        }

        DesignNode root = assemble(rootId, table);
        String name = textOr(document.get("name"), root.name());
        var graph = new DesignGraph(name, root);
        log.info("Loaded design '{}' with {} nodes", name, graph.nodeCount());
        return graph;
    }

    private String collectNested(JsonNode rootNode, Map<String, RawNode> table) {
        var stack = new ArrayDeque<JsonNode>();
        stack.push(rootNode);
        String rootId = null;
        while (!stack.isEmpty()) {
            JsonNode json = stack.pop();
            if (json == null || !json.isObject()) {
                throw new MalformedInputException("Design node must be a JSON object");
            }
            String id = requiredText(json, "id", null);
            if (rootId == null) {
                rootId = id;
            }
            var childIds = new ArrayList<String>();
            JsonNode children = json.get("children");
            if (children != null && !children.isNull()) {
                if (!children.isArray()) {
                    throw new MalformedInputException("Node " + id + ": 'children' must be an array");
                }
                for (JsonNode child : children) {
                    if (!child.isObject()) {
                        throw new MalformedInputException("Node " + id + ": child must be a JSON object");
                    }
                    childIds.add(requiredText(child, "id", id));
                    stack.push(child);
                }
            }
            if (table.putIfAbsent(id, rawNode(id, json, childIds)) != null) {
                throw new MalformedInputException("Duplicate node id: " + id);
            }
        }
        return rootId;
    }

    private String collectFlat(JsonNode document, Map<String, RawNode> table) {
        JsonNode nodes = document.get("nodes");
        if (nodes == null || !nodes.isObject()) {
            throw new MalformedInputException("'nodes' must be an object keyed by node id");
        }
        String rootId = requiredText(document, "rootId", null);
        Iterator<Map.Entry<String, JsonNode>> fields = nodes.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            String id = entry.getKey();
            JsonNode json = entry.getValue();
            if (!json.isObject()) {
                throw new MalformedInputException("Node " + id + " must be a JSON object");
            }
            if (json.hasNonNull("id") && !id.equals(json.get("id").asText())) {
                throw new MalformedInputException("Node key " + id + " does not match its id " + json.get("id").asText());
            }
            var childIds = new ArrayList<String>();
            JsonNode children = json.get("children");
            if (children != null && !children.isNull()) {
                if (!children.isArray()) {
                    throw new MalformedInputException("Node " + id + ": 'children' must be an array of ids");
                }
                for (JsonNode child : children) {
                    if (child.isTextual() && !child.asText().isBlank()) {
                        childIds.add(child.asText());
                    } else if (child.isObject()) {
                        childIds.add(requiredText(child, "id", id));
                    } else {
                        throw new MalformedInputException("Node " + id + ": child reference must be a node id");
                    }
                }
            }
            table.put(id, rawNode(id, json, childIds));
        }
        if (!table.containsKey(rootId)) {
            throw new MalformedInputException("Root node " + rootId + " is not present in 'nodes'");
        }
        return rootId;
    }

    private RawNode rawNode(String id, JsonNode json, List<String> childIds) {
        String type = requiredText(json, "type", null, id);
        String name = textOr(json.get("name"), type);
        var attributes = new LinkedHashMap<String, Object>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (!RESERVED_KEYS.contains(field.getKey())) {
                attributes.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
        return new RawNode(id, type, name, attributes, childIds);
    }

    /**
     * Post-order assembly from the root. Nodes on the current path are tracked to detect cycles, and
     * every child is claimed by exactly one parent.
     */
    private DesignNode assemble(String rootId, Map<String, RawNode> table) {
        var built = new HashMap<String, DesignNode>(table.size() * 2);
        var onPath = new HashSet<String>();
        var owner = new HashMap<String, String>(table.size() * 2);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(rootId, false));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            RawNode node = table.get(frame.id());
            if (!frame.expanded()) {
                onPath.add(frame.id());
                stack.push(new Frame(frame.id(), true));
                for (int i = node.childIds().size() - 1; i >= 0; i--) {
                    String childId = node.childIds().get(i);
                    if (!table.containsKey(childId)) {
                        throw new MalformedInputException("Node " + frame.id() + " references missing node " + childId);
                    }
                    if (onPath.contains(childId)) {
                        throw new MalformedInputException("Cycle detected: node " + childId
                                + " is an ancestor of " + frame.id());
                    }
                    String previous = owner.putIfAbsent(childId, frame.id());
                    if (previous != null) {
                        throw new MalformedInputException("Node " + childId + " is owned by both "
                                + previous + " and " + frame.id());
                    }
                    stack.push(new Frame(childId, false));
                }
            } else {
                var children = new ArrayList<DesignNode>(node.childIds().size());
                for (String childId : node.childIds()) {
                    children.add(built.get(childId));
                }
                built.put(node.id(), DesignNode.of(node.id(), node.type(), node.name(), node.attributes(), children));
                onPath.remove(node.id());
            }
        }

        if (built.size() != table.size()) {
            var orphans = new ArrayList<String>();
            for (String id : table.keySet()) {
                if (!built.containsKey(id)) {
                    orphans.add(id);
                }
            }
            throw new MalformedInputException("Nodes not reachable from root " + rootId + ": "
                    + (orphans.size() > 10 ? orphans.subList(0, 10) + "..." : orphans));
        }
        return built.get(rootId);
    }

    private static String requiredText(JsonNode json, String field, String parentId) {
        return requiredText(json, field, parentId, null);
    }

    private static String requiredText(JsonNode json, String field, String parentId, String nodeId) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            String where = nodeId != null ? "node " + nodeId
                    : parentId != null ? "a child of node " + parentId
                    : "document";
            throw new MalformedInputException("Missing required field '" + field + "' on " + where);
        }
        return value.asText();
    }

    private static String textOr(JsonNode value, String fallback) {
        return value != null && value.isValueNode() && !value.asText().isBlank() ? value.asText() : fallback;
    }

    private record RawNode(String id, String type, String name, Map<String, Object> attributes,
                           List<String> childIds) {}

    private record Frame(String id, boolean expanded) {}
}
