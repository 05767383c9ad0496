package org.flightopt.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.flightopt.routing.cost.WeightVector;

import java.util.List;

/**
 * Full ranked answer to one query: both planner results followed by the best and
 * alternative paths, in that order.
 */
@Value
@Builder
public class RoutePlanResponse {
    String sourceAirport;
    String targetAirport;
    WeightVector weights;
    @Singular
    List<RankedRoute> routes;

    /**
     * Routes carrying the given label, in response order.
     */
    public List<RankedRoute> routesLabeled(String label) {
        return routes.stream().filter(route -> route.getLabel().equals(label)).toList();
    }
}
