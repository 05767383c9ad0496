package org.flightopt.routing.core;

import lombok.Builder;
import lombok.Value;
import org.flightopt.routing.cost.WeightVector;

/**
 * Client-facing route query.
 *
 * <p>Airports are expressed as codes; mapping to internal node ids is handled by
 * {@link RouteCore}.</p>
 */
@Value
@Builder(toBuilder = true)
public class RouteRequest {
    /** Origin airport code. */
    String sourceAirport;
    /** Destination airport code. */
    String targetAirport;
    /** Importance weights applied to this query only. */
    WeightVector weights;
    /** Planner used by {@link RouterService#route}; ignored by enumeration. */
    @Builder.Default
    RoutingAlgorithm algorithm = RoutingAlgorithm.DIJKSTRA;
}
