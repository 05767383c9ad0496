package org.flightopt.routing.cost;

import org.flightopt.routing.graph.LegGraph;

import java.util.Arrays;
import java.util.Objects;

/**
 * Query-scoped table of combined edge weights for one graph.
 *
 * <p>The table is bound to the graph instance it was computed for; planners reject
 * a table bound to a different graph. Instances are immutable.</p>
 */
public final class CombinedWeights {
    private final LegGraph graph;
    private final WeightVector weightVector;
    private final double[] weights;
    private final boolean negative;

    CombinedWeights(LegGraph graph, WeightVector weightVector, double[] weights) {
        this.graph = graph;
        this.weightVector = weightVector;
        this.weights = weights;
        this.negative = Arrays.stream(weights).anyMatch(weight -> weight < 0.0d);
    }

    /**
     * Wraps externally computed edge weights, which may be negative (for example
     * subsidised legs). Only the label-correcting planner accepts negative weights.
     *
     * @param graph graph the weights belong to.
     * @param weights one finite weight per edge id.
     */
    public static CombinedWeights explicit(LegGraph graph, double[] weights) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(weights, "weights");
        if (weights.length != graph.edgeCount()) {
            throw new IllegalArgumentException(
                    "expected " + graph.edgeCount() + " edge weights, got " + weights.length
            );
        }
        for (int edgeId = 0; edgeId < weights.length; edgeId++) {
            if (!Double.isFinite(weights[edgeId])) {
                throw new IllegalArgumentException("weight of edge " + edgeId + " must be finite");
            }
        }
        return new CombinedWeights(graph, null, weights.clone());
    }

    public double weight(int edgeId) {
        return weights[edgeId];
    }

    public int size() {
        return weights.length;
    }

    /**
     * Returns whether this table was computed for {@code candidate}.
     */
    public boolean isBoundTo(LegGraph candidate) {
        return graph == candidate;
    }

    /**
     * Weight vector the table was derived from, or {@code null} for explicit tables.
     */
    public WeightVector weightVector() {
        return weightVector;
    }

    /**
     * Returns whether any edge carries a negative weight.
     */
    public boolean hasNegativeWeight() {
        return negative;
    }

    /**
     * Element-wise equality of the weight values.
     */
    public boolean sameWeights(CombinedWeights other) {
        return other != null && Arrays.equals(weights, other.weights);
    }
}
