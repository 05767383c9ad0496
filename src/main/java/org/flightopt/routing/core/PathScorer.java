package org.flightopt.routing.core;

import org.flightopt.core.id.AirportIndex;
import org.flightopt.routing.cost.WeightVector;
import org.flightopt.routing.graph.LegGraph;

import java.util.List;
import java.util.Objects;

/**
 * Recomputes raw totals and the weighted score of a path from the leg graph.
 *
 * <p>Pure function of its arguments: the result does not depend on which planner,
 * if any, produced the path. Externally supplied paths are checked leg by leg.</p>
 */
public final class PathScorer {

    /**
     * Scores a path given as airport codes.
     *
     * @throws RouteCoreException with {@link RouteCore#REASON_PATH_REQUIRED},
     *         {@link RouteCore#REASON_UNKNOWN_AIRPORT} or {@link RouteCore#REASON_DISCONNECTED_PATH}.
     */
    public PathScore score(LegGraph graph, List<String> path, WeightVector weightVector) {
        Objects.requireNonNull(graph, "graph");
        if (path == null || path.isEmpty()) {
            throw new RouteCoreException(RouteCore.REASON_PATH_REQUIRED, "path must contain at least one airport");
        }
        AirportIndex index = graph.airportIndex();
        int[] nodePath = new int[path.size()];
        for (int i = 0; i < nodePath.length; i++) {
            String code = path.get(i);
            if (!index.containsExternal(code)) {
                throw new RouteCoreException(RouteCore.REASON_UNKNOWN_AIRPORT, "unknown airport in path: " + code);
            }
            nodePath[i] = index.toInternal(code);
        }
        return score(graph, nodePath, weightVector);
    }

    /**
     * Scores a path given as internal node ids.
     */
    PathScore score(LegGraph graph, int[] nodePath, WeightVector weightVector) {
        Objects.requireNonNull(weightVector, "weightVector");
        if (nodePath.length == 0) {
            throw new RouteCoreException(RouteCore.REASON_PATH_REQUIRED, "path must contain at least one airport");
        }

        double totalCost = 0.0d;
        double totalTime = 0.0d;
        double totalCo2 = 0.0d;
        for (int i = 0; i + 1 < nodePath.length; i++) {
            int edgeId = graph.findEdge(nodePath[i], nodePath[i + 1]);
            if (edgeId == LegGraph.NO_EDGE) {
                AirportIndex index = graph.airportIndex();
                throw new RouteCoreException(
                        RouteCore.REASON_DISCONNECTED_PATH,
                        "no leg from " + index.toExternal(nodePath[i]) + " to " + index.toExternal(nodePath[i + 1])
                );
            }
            totalCost += graph.getCost(edgeId);
            totalTime += graph.getTimeMinutes(edgeId);
            totalCo2 += graph.getCo2Kg(edgeId);
        }

        int layovers = Math.max(0, nodePath.length - 2);
        double combined = weightVector.getCostWeight() * totalCost
                + weightVector.getTimeWeight() * totalTime
                + weightVector.getCo2Weight() * totalCo2
                + weightVector.getLayoverWeight() * layovers;
        return PathScore.builder()
                .combinedScore(combined)
                .totalCost(totalCost)
                .totalTimeMinutes(totalTime)
                .totalCo2Kg(totalCo2)
                .layoverCount(layovers)
                .build();
    }
}
