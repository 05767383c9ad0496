package org.flightopt.routing.core;

/**
 * Planner output in internal node-id space.
 *
 * @param reachable whether the target is reachable from the source.
 * @param totalWeight summed combined weight of the path (or {@code +INF} when unreachable).
 * @param workStates settled nodes (label-setting) or successful relaxations (label-correcting).
 * @param nodePath node ids from source to target (empty when unreachable).
 */
record InternalRoutePlan(
        boolean reachable,
        double totalWeight,
        int workStates,
        int[] nodePath
) {
    /**
     * Canonical unreachable plan.
     */
    static InternalRoutePlan unreachable(int workStates) {
        return new InternalRoutePlan(false, Double.POSITIVE_INFINITY, workStates, new int[0]);
    }

    /**
     * Zero-length plan for a query whose source equals its target.
     */
    static InternalRoutePlan trivial(int nodeId) {
        return new InternalRoutePlan(true, 0.0d, 0, new int[]{nodeId});
    }
}
