package com.pagechains.analytics.chains;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Critical request chains of one page load, keyed by root request id. Holds at most one root.
 */
public final class ChainForest {
    private static final ChainForest EMPTY = new ChainForest(null);

    private final ChainNode root;

    private ChainForest(ChainNode root) {
        this.root = root;
    }

    public static ChainForest empty() {
        return EMPTY;
    }

    public static ChainForest of(ChainNode root) {
        if (root == null) {
            throw new IllegalArgumentException("root node is required");
        }
        return new ChainForest(root);
    }

    public boolean isEmpty() {
        return root == null;
    }

    /** Root node, or null for an empty forest. */
    public ChainNode root() {
        return root;
    }

    public Map<String, ChainNode> roots() {
        if (root == null) {
            return Collections.emptyMap();
        }
        return Collections.singletonMap(root.requestId(), root);
    }

    /** All request ids in the forest, depth-first from the root. */
    public Set<String> requestIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (root == null) {
            return ids;
        }
        Deque<ChainNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ChainNode node = stack.pop();
            ids.add(node.requestId());
            // Reverse push keeps discovery order in the output.
            List<ChainNode> children = new ArrayList<>(node.children().values());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ids;
    }

    public int nodeCount() {
        return requestIds().size();
    }

    /** Child id to parent id for every non-root node. */
    public Map<String, String> parentById() {
        Map<String, String> parents = new LinkedHashMap<>();
        if (root == null) {
            return parents;
        }
        Deque<ChainNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            ChainNode node = queue.poll();
            for (ChainNode child : node.children().values()) {
                parents.put(child.requestId(), node.requestId());
                queue.add(child);
            }
        }
        return parents;
    }
}
