package org.flightopt.routing.core;

import org.flightopt.routing.cost.WeightVector;

import java.util.List;

/**
 * Query boundary of the route optimizer.
 */
public interface RouterService {

    /**
     * Best path under the request's algorithm.
     *
     * @throws RouteCoreException with {@link RouteCore#REASON_NO_PATH_FOUND} when unreachable.
     */
    RouteResponse route(RouteRequest request);

    /**
     * Opens a fresh pull-based enumeration of alternatives.
     */
    RankedRouteCursor openAlternatives(RouteRequest request);

    /**
     * First {@code limit} alternatives; empty when the target is unreachable.
     */
    List<RankedRoute> alternatives(RouteRequest request, int limit);

    /**
     * Planner results plus up to {@code limit} ranked alternatives.
     *
     * @throws RouteCoreException with {@link RouteCore#REASON_NO_PATH_FOUND} when unreachable.
     */
    RoutePlanResponse plan(RouteRequest request, int limit);

    /**
     * Scores an externally supplied path.
     */
    PathScore score(List<String> path, WeightVector weights);
}
