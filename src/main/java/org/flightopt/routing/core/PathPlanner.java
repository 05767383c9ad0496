package org.flightopt.routing.core;

import org.flightopt.routing.cost.CombinedWeights;
import org.flightopt.routing.graph.LegGraph;

/**
 * Single-source single-target shortest-path capability.
 *
 * <p>Implementations differ only in which weight domains they accept; for
 * non-negative weights they must return paths of equal total weight.</p>
 */
interface PathPlanner {
    /**
     * Computes one point-to-point plan.
     *
     * @param graph immutable leg graph.
     * @param weights combined weights bound to {@code graph}.
     * @param request normalized request in internal node-id space.
     * @return computed plan; {@code reachable=false} when no path exists.
     * @throws SearchGuards.SearchContractException on weight-domain violations.
     */
    InternalRoutePlan compute(LegGraph graph, CombinedWeights weights, InternalRouteRequest request);
}
