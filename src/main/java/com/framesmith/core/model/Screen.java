package com.framesmith.core.model;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An independently processable unit of a design: a self-contained subtree copy.
 * <p>
 * Only PENDING screens are bounded by the oracle capacity. A screen rejected during analysis keeps its whole
 * oversized subtree so the screen set still covers every node, and it is never sent to the oracle.
 *
 * @param id            screen id; the root node id, or {@code rootId#partN} for virtual sub-screens
 * @param name          display name, taken from the screen root
 * @param root          self-contained subtree copy
 * @param nodeCount     nodes in {@code root}
 * @param ordinal       stable 0-based position in document order
 * @param ancestorIds   ids of the container nodes above this screen, outermost first
 * @param ancestorPath  names of the same containers
 * @param status        current lifecycle status
 * @param componentRefs normalized names of registry components this screen uses
 * @param failureReason why the screen failed, or null
 */
public record Screen(
    String id,
    String name,
    DesignNode root,
    int nodeCount,
    int ordinal,
    List<String> ancestorIds,
    List<String> ancestorPath,
    ScreenStatus status,
    Set<String> componentRefs,
    String failureReason
) implements Serializable {

    public static Screen pending(String id, String name, DesignNode root, int ordinal,
                                 List<String> ancestorIds, List<String> ancestorPath) {
        return new Screen(id, name, root, root.subtreeSize(), ordinal,
                List.copyOf(ancestorIds), List.copyOf(ancestorPath),
                ScreenStatus.PENDING, Set.of(), null);
    }

    /**
     * Moves this screen to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current status
     */
    public Screen transitionTo(ScreenStatus next) {
        return transitionTo(next, failureReason);
    }

    public Screen transitionTo(ScreenStatus next, String reason) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Screen " + id + " cannot move from " + status + " to " + next);
        }
        return new Screen(id, name, root, nodeCount, ordinal, ancestorIds, ancestorPath,
                next, componentRefs, reason);
    }

    public Screen withComponentRef(String normalizedName) {
        var refs = new LinkedHashSet<>(componentRefs);
        refs.add(normalizedName);
        return new Screen(id, name, root, nodeCount, ordinal, ancestorIds, ancestorPath,
                status, Set.copyOf(refs), failureReason);
    }

    /**
     * Every node id this screen covers: its own subtree plus the shared containers above it.
     */
    public Set<String> nodeIds() {
        var ids = new LinkedHashSet<String>(ancestorIds);
        ids.addAll(root.subtreeIds());
        return ids;
    }

    public boolean isVirtual() {
        return id.contains("#");
    }

    /** 1-based ordinal used in collision suffixes. */
    public int displayOrdinal() {
        return ordinal + 1;
    }
}
