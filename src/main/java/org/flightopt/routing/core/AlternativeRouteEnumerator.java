package org.flightopt.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import org.flightopt.routing.cost.CombinedWeights;
import org.flightopt.routing.graph.LegGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * k-shortest loopless paths (Yen) over combined weights.
 *
 * <p>Each {@link #open} call starts an independent enumeration whose results are
 * pulled one at a time through {@link RouteCursor#next()}. Emitted paths are simple,
 * pairwise distinct and ordered by non-decreasing total weight; equal weights are
 * ordered by hop count, then by node-id sequence (which follows airport-code order).
 * The spur planner must return the minimum path under that same order, as
 * {@link DijkstraPathPlanner} does; the first result is therefore the overall minimum
 * and every later result follows the candidate order.</p>
 *
 * <p>Cost per pull: up to {@code L} spur searches for a previous path of {@code L}
 * nodes, each {@code O((V + E) log V)}. The candidate pool can grow exponentially on
 * dense graphs with many near-equal paths; flight networks are sparse enough in
 * practice, and {@link EnumerationBudget} caps total spur searches per cursor.</p>
 */
final class AlternativeRouteEnumerator {
    private final PathPlanner spurPlanner;
    private final EnumerationBudget budget;

    AlternativeRouteEnumerator(PathPlanner spurPlanner, EnumerationBudget budget) {
        this.spurPlanner = Objects.requireNonNull(spurPlanner, "spurPlanner");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Opens a fresh cursor. No search runs until the first pull.
     */
    RouteCursor open(LegGraph graph, CombinedWeights weights, int sourceNodeId, int targetNodeId) {
        SearchGuards.requireBound(graph, weights);
        return new RouteCursor(graph, weights, sourceNodeId, targetNodeId);
    }

    /**
     * Pull-based enumeration state for one (source, target, weights) query. Not thread-safe.
     */
    final class RouteCursor {
        private final LegGraph graph;
        private final CombinedWeights weights;
        private final int sourceNodeId;
        private final int targetNodeId;

        private final List<int[]> emitted = new ArrayList<>();
        private final ObjectOpenHashSet<IntArrayList> seen = new ObjectOpenHashSet<>();
        private final PriorityQueue<Candidate> candidates = new PriorityQueue<>();
        private boolean started;
        private boolean exhausted;
        private int spurSearches;

        private RouteCursor(LegGraph graph, CombinedWeights weights, int sourceNodeId, int targetNodeId) {
            this.graph = graph;
            this.weights = weights;
            this.sourceNodeId = sourceNodeId;
            this.targetNodeId = targetNodeId;
        }

        /**
         * Produces the next path, or empty once no further simple path exists.
         */
        Optional<InternalRoutePlan> next() {
            if (exhausted) {
                return Optional.empty();
            }
            if (!started) {
                started = true;
                InternalRoutePlan first = spurPlanner.compute(
                        graph, weights, InternalRouteRequest.of(sourceNodeId, targetNodeId)
                );
                if (!first.reachable()) {
                    exhausted = true;
                    return Optional.empty();
                }
                return Optional.of(emit(first.nodePath(), first.totalWeight(), first.workStates()));
            }

            int[] previous = emitted.get(emitted.size() - 1);
            int work = 0;
            for (int spurIndex = 0; spurIndex < previous.length - 1; spurIndex++) {
                work += generateSpurCandidate(previous, spurIndex);
            }

            Candidate best = candidates.poll();
            if (best == null) {
                exhausted = true;
                return Optional.empty();
            }
            return Optional.of(emit(best.nodePath(), best.totalWeight(), work));
        }

        /**
         * Pulls up to {@code limit} further paths.
         */
        List<InternalRoutePlan> take(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be >= 0");
            }
            List<InternalRoutePlan> plans = new ArrayList<>(Math.min(limit, 16));
            while (plans.size() < limit) {
                Optional<InternalRoutePlan> plan = next();
                if (plan.isEmpty()) {
                    break;
                }
                plans.add(plan.get());
            }
            return plans;
        }

        boolean isExhausted() {
            return exhausted;
        }

        int emittedCount() {
            return emitted.size();
        }

        private InternalRoutePlan emit(int[] nodePath, double totalWeight, int work) {
            emitted.add(nodePath);
            seen.add(IntArrayList.wrap(nodePath));
            return new InternalRoutePlan(true, totalWeight, work, nodePath.clone());
        }

        /**
         * Runs one spur search deviating from {@code previous} at {@code spurIndex}.
         *
         * @return work states spent by the spur search.
         */
        private int generateSpurCandidate(int[] previous, int spurIndex) {
            int spurNodeId = previous[spurIndex];
            SearchMask mask = new SearchMask();
            for (int[] path : emitted) {
                if (path.length > spurIndex + 1 && sharesPrefix(path, previous, spurIndex)) {
                    mask.blockEdge(graph.findEdge(path[spurIndex], path[spurIndex + 1]));
                }
            }
            for (int i = 0; i < spurIndex; i++) {
                mask.blockNode(previous[i]);
            }

            budget.checkSpurSearches(++spurSearches);
            InternalRoutePlan spur = spurPlanner.compute(
                    graph, weights, new InternalRouteRequest(spurNodeId, targetNodeId, mask)
            );
            if (!spur.reachable()) {
                return spur.workStates();
            }

            int[] spurPath = spur.nodePath();
            int[] candidatePath = new int[spurIndex + spurPath.length];
            System.arraycopy(previous, 0, candidatePath, 0, spurIndex);
            System.arraycopy(spurPath, 0, candidatePath, spurIndex, spurPath.length);
            if (seen.add(IntArrayList.wrap(candidatePath))) {
                candidates.add(new Candidate(candidatePath, pathWeight(candidatePath)));
            }
            return spur.workStates();
        }

        /**
         * Sums edge weights in path order, matching the accumulation order of the planners.
         */
        private double pathWeight(int[] nodePath) {
            double total = 0.0d;
            for (int i = 0; i + 1 < nodePath.length; i++) {
                total += weights.weight(graph.findEdge(nodePath[i], nodePath[i + 1]));
            }
            return total;
        }
    }

    /**
     * Returns whether both paths agree on their first {@code spurIndex + 1} nodes.
     */
    private static boolean sharesPrefix(int[] path, int[] reference, int spurIndex) {
        return Arrays.equals(path, 0, spurIndex + 1, reference, 0, spurIndex + 1);
    }

    private record Candidate(int[] nodePath, double totalWeight) implements Comparable<Candidate> {
        /**
         * Orders by total weight, then hop count, then node-id sequence.
         */
        @Override
        public int compareTo(Candidate other) {
            int byWeight = Double.compare(this.totalWeight, other.totalWeight);
            if (byWeight != 0) {
                return byWeight;
            }
            int byHops = Integer.compare(this.nodePath.length, other.nodePath.length);
            if (byHops != 0) {
                return byHops;
            }
            return Arrays.compare(this.nodePath, other.nodePath);
        }
    }
}
