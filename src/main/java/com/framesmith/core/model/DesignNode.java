package com.framesmith.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A single visual node of a design document. Immutable; a parent exclusively owns its children.
 *
 * @param id          node id, unique within the document (e.g. "12:345")
 * @param type        node type such as DOCUMENT, CANVAS, FRAME, TEXT, INSTANCE
 * @param name        designer-facing name
 * @param attributes  geometry and style attributes, in document order
 * @param children    ordered child nodes
 * @param subtreeSize number of nodes in this subtree, including this node
 */
public record DesignNode(
    String id,
    String type,
    String name,
    Map<String, Object> attributes,
    List<DesignNode> children,
    int subtreeSize
) implements Serializable {

    public static DesignNode of(String id, String type, String name,
                                Map<String, Object> attributes, List<DesignNode> children) {
        int size = 1;
        for (var child : children) {
            size += child.subtreeSize();
        }
        return new DesignNode(id, type, name,
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes)),
                List.copyOf(children), size);
    }

    public static DesignNode leaf(String id, String type, String name) {
        return of(id, type, name, Map.of(), List.of());
    }

    /**
     * Returns a copy of this node holding only the given children.
     */
    public DesignNode withChildren(List<DesignNode> newChildren) {
        return of(id, type, name, attributes, newChildren);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Depth-first, pre-order visit of this subtree.
     */
    public void walk(Consumer<DesignNode> visitor) {
        var stack = new ArrayList<DesignNode>();
        stack.add(this);
        while (!stack.isEmpty()) {
            var node = stack.remove(stack.size() - 1);
            visitor.accept(node);
            for (int i = node.children().size() - 1; i >= 0; i--) {
                stack.add(node.children().get(i));
            }
        }
    }

    public List<String> subtreeIds() {
        var ids = new ArrayList<String>(subtreeSize);
        walk(n -> ids.add(n.id()));
        return ids;
    }
}
