package org.flightopt.routing.core;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Nodes and edges a single search must not use.
 *
 * <p>The source node of a search is never treated as blocked.</p>
 */
final class SearchMask {
    private static final SearchMask NONE = new SearchMask();

    private final IntOpenHashSet blockedNodes = new IntOpenHashSet();
    private final IntOpenHashSet blockedEdges = new IntOpenHashSet();

    /**
     * Shared empty mask. Must not be modified.
     */
    static SearchMask none() {
        return NONE;
    }

    SearchMask blockNode(int nodeId) {
        checkMutable();
        blockedNodes.add(nodeId);
        return this;
    }

    SearchMask blockEdge(int edgeId) {
        checkMutable();
        blockedEdges.add(edgeId);
        return this;
    }

    boolean isNodeBlocked(int nodeId) {
        return blockedNodes.contains(nodeId);
    }

    boolean isEdgeBlocked(int edgeId) {
        return blockedEdges.contains(edgeId);
    }

    private void checkMutable() {
        if (this == NONE) {
            throw new UnsupportedOperationException("shared empty mask is read-only");
        }
    }
}
