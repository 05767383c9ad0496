package org.flightopt.routing.cost;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Per-query importance weights for the four cost criteria.
 *
 * <p>Components must be finite and non-negative. Upper bounds imposed by a user
 * interface are enforced by {@link PreferenceScale}, not here.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WeightVector {
    double costWeight;
    double timeWeight;
    double layoverWeight;
    double co2Weight;

    /**
     * Creates a validated weight vector.
     *
     * @throws IllegalArgumentException when a component is negative or not finite.
     */
    public static WeightVector of(double costWeight, double timeWeight, double layoverWeight, double co2Weight) {
        return new WeightVector(
                requireWeight(costWeight, "costWeight"),
                requireWeight(timeWeight, "timeWeight"),
                requireWeight(layoverWeight, "layoverWeight"),
                requireWeight(co2Weight, "co2Weight")
        );
    }

    /**
     * Combined weight of a single leg: every leg counts as one layover unit.
     */
    public double combine(double cost, double timeMinutes, double co2Kg) {
        return costWeight * cost + timeWeight * timeMinutes + co2Weight * co2Kg + layoverWeight;
    }

    private static double requireWeight(double value, String name) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and >= 0, got " + value);
        }
        return value;
    }
}
