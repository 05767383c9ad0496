package org.flightopt.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Best path found by one planner.
 */
@Value
@Builder
public class RouteResponse {
    /** Planner that produced the path. */
    RoutingAlgorithm algorithm;
    /** Path from source to target as airport codes. */
    @Singular("pathNode")
    List<String> path;
    /** Totals and weighted score, recomputed from the graph. */
    PathScore score;
    /**
     * Summed combined edge weight the planner minimised. Exceeds
     * {@code score.combinedScore} by the layover weight for any path with at least one leg.
     */
    double searchWeight;
    /** Settled nodes or successful relaxations spent by the planner. */
    int workStates;
}
