package com.pagechains.analytics.chains;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Headline numbers for a forest: how many root-to-leaf chains it has and which one took longest.
 *
 * <p>A chain's duration runs from the root's start to the leaf's end, in milliseconds. Ties keep the
 * chain discovered first. A forest holding only the root counts as one chain of length 1.</p>
 */
public final class ChainSummary {
    private static final ChainSummary EMPTY = new ChainSummary(0, 0, 0.0, 0L, Collections.emptyList());

    private final int chainCount;
    private final int longestChainLength;
    private final double longestChainDurationMs;
    private final long longestChainTransferSize;
    private final List<String> longestChainRequestIds;

    private ChainSummary(
            int chainCount,
            int longestChainLength,
            double longestChainDurationMs,
            long longestChainTransferSize,
            List<String> longestChainRequestIds) {
        this.chainCount = chainCount;
        this.longestChainLength = longestChainLength;
        this.longestChainDurationMs = longestChainDurationMs;
        this.longestChainTransferSize = longestChainTransferSize;
        this.longestChainRequestIds = longestChainRequestIds;
    }

    public static ChainSummary of(ChainForest forest) {
        if (forest == null || forest.isEmpty()) {
            return EMPTY;
        }
        ChainNode root = forest.root();
        double rootStart = root.request().startTime;

        int chainCount = 0;
        double bestDuration = -1.0;
        List<ChainNode> bestPath = null;

        Deque<List<ChainNode>> stack = new ArrayDeque<>();
        stack.push(Collections.singletonList(root));
        while (!stack.isEmpty()) {
            List<ChainNode> path = stack.pop();
            ChainNode tail = path.get(path.size() - 1);
            if (tail.isLeaf()) {
                chainCount++;
                double duration = Math.max(0.0, (tail.request().endTime - rootStart) * 1000.0);
                if (duration > bestDuration) {
                    bestDuration = duration;
                    bestPath = path;
                }
                continue;
            }
            List<ChainNode> children = new ArrayList<>(tail.children().values());
            for (int i = children.size() - 1; i >= 0; i--) {
                List<ChainNode> extended = new ArrayList<>(path);
                extended.add(children.get(i));
                stack.push(extended);
            }
        }

        long transferSize = 0L;
        List<String> ids = new ArrayList<>();
        for (ChainNode node : bestPath) {
            transferSize += node.request().transferSize;
            ids.add(node.requestId());
        }
        return new ChainSummary(chainCount, bestPath.size(), bestDuration, transferSize,
                Collections.unmodifiableList(ids));
    }

    public int chainCount() {
        return chainCount;
    }

    public int longestChainLength() {
        return longestChainLength;
    }

    public double longestChainDurationMs() {
        return longestChainDurationMs;
    }

    public long longestChainTransferSize() {
        return longestChainTransferSize;
    }

    public List<String> longestChainRequestIds() {
        return longestChainRequestIds;
    }
}
