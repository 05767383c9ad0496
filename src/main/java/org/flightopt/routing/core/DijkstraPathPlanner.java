package org.flightopt.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.flightopt.routing.cost.CombinedWeights;
import org.flightopt.routing.graph.LegGraph;

import java.util.Arrays;
import java.util.PriorityQueue;

/**
 * Label-setting shortest-path planner over node states.
 *
 * <p>Returned paths are canonical: among all minimum-weight paths the planner picks the one
 * with the fewest legs, and among those the lexicographically smallest node-id sequence
 * (which follows airport-code order). Labels are {@code (distance, hops)} pairs compared
 * lexicographically; once the target is settled, the path is rebuilt forward over tight
 * edges, always taking the smallest successor that still reaches the target.</p>
 *
 * <p>Weight tables containing any negative weight are refused before the search starts.</p>
 */
final class DijkstraPathPlanner implements PathPlanner {
    private static final double INF = Double.POSITIVE_INFINITY;

    @Override
    public InternalRoutePlan compute(LegGraph graph, CombinedWeights weights, InternalRouteRequest request) {
        SearchGuards.requireBound(graph, weights);
        if (weights.hasNegativeWeight()) {
            throw new SearchGuards.SearchContractException(
                    SearchGuards.REASON_NEGATIVE_EDGE_WEIGHT,
                    "label-setting search requires non-negative combined weights"
            );
        }
        int sourceNodeId = request.sourceNodeId();
        int targetNodeId = request.targetNodeId();
        SearchMask mask = request.mask();

        if (sourceNodeId == targetNodeId) {
            return InternalRoutePlan.trivial(sourceNodeId);
        }

        int nodeCount = graph.nodeCount();
        double[] distance = new double[nodeCount];
        int[] hops = new int[nodeCount];
        boolean[] settled = new boolean[nodeCount];
        Arrays.fill(distance, INF);
        Arrays.fill(hops, Integer.MAX_VALUE);

        PriorityQueue<FrontierState> frontier = new PriorityQueue<>();
        distance[sourceNodeId] = 0.0d;
        hops[sourceNodeId] = 0;
        frontier.add(new FrontierState(sourceNodeId, 0.0d, 0));

        int settledStates = 0;
        while (!frontier.isEmpty()) {
            FrontierState state = frontier.poll();
            int nodeId = state.nodeId();
            // stale entry: a better label was queued later
            if (settled[nodeId] || state.distance() != distance[nodeId] || state.hops() != hops[nodeId]) {
                continue;
            }
            settled[nodeId] = true;
            settledStates++;
            if (nodeId == targetNodeId) {
                int[] path = canonicalPath(graph, weights, mask, distance, hops, settled, sourceNodeId, targetNodeId);
                return new InternalRoutePlan(true, distance[targetNodeId], settledStates, path);
            }

            int end = graph.edgeRangeEnd(nodeId);
            for (int edgeId = graph.edgeRangeStart(nodeId); edgeId < end; edgeId++) {
                if (mask.isEdgeBlocked(edgeId)) {
                    continue;
                }
                int nextNodeId = graph.getEdgeDestination(edgeId);
                if (settled[nextNodeId] || mask.isNodeBlocked(nextNodeId)) {
                    continue;
                }
                double nextDistance = state.distance() + weights.weight(edgeId);
                int nextHops = state.hops() + 1;
                if (nextDistance < distance[nextNodeId]
                        || (nextDistance == distance[nextNodeId] && nextHops < hops[nextNodeId])) {
                    distance[nextNodeId] = nextDistance;
                    hops[nextNodeId] = nextHops;
                    frontier.add(new FrontierState(nextNodeId, nextDistance, nextHops));
                }
            }
        }
        return InternalRoutePlan.unreachable(settledStates);
    }

    /**
     * Rebuilds the lexicographically smallest optimal path.
     *
     * <p>An edge {@code u -> v} is tight when both ends are settled, it is unmasked and
     * {@code label(u) + (w, 1) == label(v)}. Hops strictly increase along tight edges, so
     * a backward sweep by hop level marks every node that reaches the target over tight
     * edges; the forward walk then takes the smallest marked successor at every step.</p>
     */
    private static int[] canonicalPath(
            LegGraph graph,
            CombinedWeights weights,
            SearchMask mask,
            double[] distance,
            int[] hops,
            boolean[] settled,
            int sourceNodeId,
            int targetNodeId
    ) {
        int targetHops = hops[targetNodeId];
        IntArrayList[] levels = new IntArrayList[targetHops];
        for (int nodeId = 0; nodeId < settled.length; nodeId++) {
            if (settled[nodeId] && hops[nodeId] < targetHops) {
                if (levels[hops[nodeId]] == null) {
                    levels[hops[nodeId]] = new IntArrayList();
                }
                levels[hops[nodeId]].add(nodeId);
            }
        }

        boolean[] reachesTarget = new boolean[settled.length];
        reachesTarget[targetNodeId] = true;
        for (int level = targetHops - 1; level >= 0; level--) {
            if (levels[level] == null) {
                continue;
            }
            for (int i = 0; i < levels[level].size(); i++) {
                int nodeId = levels[level].getInt(i);
                int end = graph.edgeRangeEnd(nodeId);
                for (int edgeId = graph.edgeRangeStart(nodeId); edgeId < end; edgeId++) {
                    if (reachesTarget[graph.getEdgeDestination(edgeId)]
                            && isTight(graph, weights, mask, distance, hops, settled, edgeId)) {
                        reachesTarget[nodeId] = true;
                        break;
                    }
                }
            }
        }

        int[] nodePath = new int[targetHops + 1];
        nodePath[0] = sourceNodeId;
        int cursor = sourceNodeId;
        for (int step = 1; step <= targetHops; step++) {
            int next = -1;
            int end = graph.edgeRangeEnd(cursor);
            // adjacency is sorted by destination id, so the first match is the smallest
            for (int edgeId = graph.edgeRangeStart(cursor); edgeId < end; edgeId++) {
                int candidate = graph.getEdgeDestination(edgeId);
                if (reachesTarget[candidate] && isTight(graph, weights, mask, distance, hops, settled, edgeId)) {
                    next = candidate;
                    break;
                }
            }
            if (next < 0) {
                throw new IllegalStateException("no tight edge leaves node " + cursor + " towards the target");
            }
            nodePath[step] = next;
            cursor = next;
        }
        return nodePath;
    }

    private static boolean isTight(
            LegGraph graph,
            CombinedWeights weights,
            SearchMask mask,
            double[] distance,
            int[] hops,
            boolean[] settled,
            int edgeId
    ) {
        if (mask.isEdgeBlocked(edgeId)) {
            return false;
        }
        int from = graph.getEdgeOrigin(edgeId);
        int to = graph.getEdgeDestination(edgeId);
        return settled[from]
                && settled[to]
                && hops[from] + 1 == hops[to]
                && distance[from] + weights.weight(edgeId) == distance[to];
    }

    private record FrontierState(int nodeId, double distance, int hops) implements Comparable<FrontierState> {
        /**
         * Orders by distance, then hop count, then node id for stability.
         */
        @Override
        public int compareTo(FrontierState other) {
            int byDistance = Double.compare(this.distance, other.distance);
            if (byDistance != 0) {
                return byDistance;
            }
            int byHops = Integer.compare(this.hops, other.hops);
            if (byHops != 0) {
                return byHops;
            }
            return Integer.compare(this.nodeId, other.nodeId);
        }
    }
}
