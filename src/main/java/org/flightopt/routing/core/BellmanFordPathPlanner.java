package org.flightopt.routing.core;

import org.flightopt.routing.cost.CombinedWeights;
import org.flightopt.routing.graph.LegGraph;

import java.util.Arrays;

/**
 * Label-correcting shortest-path planner.
 *
 * <p>Relaxes every unmasked edge in ascending edge id for at most {@code V - 1} rounds,
 * stopping early once a round changes nothing. Negative edge weights are accepted; a
 * negative cycle reachable from the source fails the search. Runs in O(V * E).</p>
 */
final class BellmanFordPathPlanner implements PathPlanner {
    private static final double INF = Double.POSITIVE_INFINITY;
    private static final int NO_EDGE = -1;

    @Override
    public InternalRoutePlan compute(LegGraph graph, CombinedWeights weights, InternalRouteRequest request) {
        SearchGuards.requireBound(graph, weights);
        int sourceNodeId = request.sourceNodeId();
        int targetNodeId = request.targetNodeId();
        SearchMask mask = request.mask();

        if (sourceNodeId == targetNodeId) {
            return InternalRoutePlan.trivial(sourceNodeId);
        }

        int nodeCount = graph.nodeCount();
        double[] distance = new double[nodeCount];
        int[] predecessorEdge = new int[nodeCount];
        Arrays.fill(distance, INF);
        Arrays.fill(predecessorEdge, NO_EDGE);
        distance[sourceNodeId] = 0.0d;

        int relaxations = 0;
        boolean changed = true;
        for (int round = 0; round < nodeCount - 1 && changed; round++) {
            changed = false;
            for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
                if (relax(graph, weights, mask, sourceNodeId, edgeId, distance, predecessorEdge)) {
                    changed = true;
                    relaxations++;
                }
            }
        }

        if (changed) {
            for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
                if (improves(graph, weights, mask, sourceNodeId, edgeId, distance)) {
                    throw new SearchGuards.SearchContractException(
                            SearchGuards.REASON_NEGATIVE_CYCLE,
                            "negative cycle reachable from node " + sourceNodeId + " through edge " + edgeId
                    );
                }
            }
        }

        if (distance[targetNodeId] == INF) {
            return InternalRoutePlan.unreachable(relaxations);
        }
        int[] path = SearchGuards.buildNodePath(graph, predecessorEdge, sourceNodeId, targetNodeId);
        return new InternalRoutePlan(true, distance[targetNodeId], relaxations, path);
    }

    private static boolean relax(
            LegGraph graph,
            CombinedWeights weights,
            SearchMask mask,
            int sourceNodeId,
            int edgeId,
            double[] distance,
            int[] predecessorEdge
    ) {
        if (!improves(graph, weights, mask, sourceNodeId, edgeId, distance)) {
            return false;
        }
        int to = graph.getEdgeDestination(edgeId);
        distance[to] = distance[graph.getEdgeOrigin(edgeId)] + weights.weight(edgeId);
        predecessorEdge[to] = edgeId;
        return true;
    }

    private static boolean improves(
            LegGraph graph,
            CombinedWeights weights,
            SearchMask mask,
            int sourceNodeId,
            int edgeId,
            double[] distance
    ) {
        if (mask.isEdgeBlocked(edgeId)) {
            return false;
        }
        int from = graph.getEdgeOrigin(edgeId);
        int to = graph.getEdgeDestination(edgeId);
        if (distance[from] == INF || isBlocked(mask, sourceNodeId, from) || isBlocked(mask, sourceNodeId, to)) {
            return false;
        }
        return distance[from] + weights.weight(edgeId) < distance[to];
    }

    private static boolean isBlocked(SearchMask mask, int sourceNodeId, int nodeId) {
        return nodeId != sourceNodeId && mask.isNodeBlocked(nodeId);
    }
}
