package org.flightopt.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.flightopt.routing.cost.CombinedWeights;
import org.flightopt.routing.graph.LegGraph;

/**
 * Planner-side contract checks shared by both search strategies.
 */
final class SearchGuards {
    static final String REASON_WEIGHTS_GRAPH_MISMATCH = "SEARCH_WEIGHTS_GRAPH_MISMATCH";
    static final String REASON_NEGATIVE_EDGE_WEIGHT = "SEARCH_NEGATIVE_EDGE_WEIGHT";
    static final String REASON_NEGATIVE_CYCLE = "SEARCH_NEGATIVE_CYCLE";

    private SearchGuards() {
    }

    /**
     * Rejects a weight table computed for another graph.
     */
    static void requireBound(LegGraph graph, CombinedWeights weights) {
        if (!weights.isBoundTo(graph)) {
            throw new SearchContractException(
                    REASON_WEIGHTS_GRAPH_MISMATCH,
                    "combined weights were computed for a different graph"
            );
        }
    }

    /**
     * Converts a predecessor-edge array into a node path ending at {@code targetNodeId}.
     * A chain longer than the node count means the predecessors form a cycle.
     */
    static int[] buildNodePath(LegGraph graph, int[] predecessorEdge, int sourceNodeId, int targetNodeId) {
        int hops = 0;
        int cursor = targetNodeId;
        while (cursor != sourceNodeId) {
            int edgeId = predecessorEdge[cursor];
            if (++hops > graph.nodeCount()) {
                throw new SearchContractException(
                        REASON_NEGATIVE_CYCLE,
                        "predecessor chain of node " + targetNodeId + " does not reach the source"
                );
            }
            cursor = graph.getEdgeOrigin(edgeId);
        }

        int[] nodePath = new int[hops + 1];
        cursor = targetNodeId;
        for (int i = hops; i > 0; i--) {
            nodePath[i] = cursor;
            cursor = graph.getEdgeOrigin(predecessorEdge[cursor]);
        }
        nodePath[0] = sourceNodeId;
        return nodePath;
    }

    /**
     * Deterministic planner contract failure with reason code.
     */
    @Getter
    @Accessors(fluent = true)
    static final class SearchContractException extends RuntimeException {
        private final String reasonCode;

        SearchContractException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
