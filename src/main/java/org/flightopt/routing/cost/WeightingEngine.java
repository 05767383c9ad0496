package org.flightopt.routing.cost;

import org.flightopt.routing.graph.LegGraph;

import java.util.Objects;

/**
 * Derives combined edge weights from raw leg attributes.
 * <p>
 * Canonical combined weight of one leg:
 * </p>
 * <pre>
 * combined = cost_w * cost + time_w * time_minutes + co2_w * co2_kg + layover_w * 1
 * </pre>
 * <p>
 * Every call covers all edges of the graph and returns a fresh table; the graph itself
 * is never written. A table therefore cannot outlive the weight vector it was built from.
 * </p>
 */
public final class WeightingEngine {

    /**
     * Computes the combined weight of every edge in O(E).
     *
     * @param graph graph to weight; an empty graph yields an empty table.
     * @param weightVector query weights.
     * @return immutable query-scoped weight table.
     */
    public CombinedWeights recompute(LegGraph graph, WeightVector weightVector) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(weightVector, "weightVector");

        double[] weights = new double[graph.edgeCount()];
        for (int edgeId = 0; edgeId < weights.length; edgeId++) {
            weights[edgeId] = weightVector.combine(
                    graph.getCost(edgeId),
                    graph.getTimeMinutes(edgeId),
                    graph.getCo2Kg(edgeId)
            );
        }
        return new CombinedWeights(graph, weightVector, weights);
    }
}
