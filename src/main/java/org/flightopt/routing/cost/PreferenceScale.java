package org.flightopt.routing.cost;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Maps bounded integer importance ratings onto a {@link WeightVector}.
 *
 * <p>Bounds are read from system properties by {@link #defaults()} and fall back
 * to the conventional 1..10 rating range.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PreferenceScale {
    public static final int DEFAULT_MIN = 1;
    public static final int DEFAULT_MAX = 10;

    private static final String PROP_MIN = "flightopt.preferences.min";
    private static final String PROP_MAX = "flightopt.preferences.max";

    private final int min;
    private final int max;

    private PreferenceScale(int min, int max) {
        if (min < 0) {
            throw new IllegalArgumentException("min must be >= 0, got " + min);
        }
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min, got [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    /**
     * Creates a scale with explicit bounds.
     */
    public static PreferenceScale of(int min, int max) {
        return new PreferenceScale(min, max);
    }

    /**
     * Loads bounds from system properties.
     */
    public static PreferenceScale defaults() {
        int min = readInt(PROP_MIN, DEFAULT_MIN);
        int max = readInt(PROP_MAX, DEFAULT_MAX);
        if (min < 0 || max < min) {
            return new PreferenceScale(DEFAULT_MIN, DEFAULT_MAX);
        }
        return new PreferenceScale(min, max);
    }

    /**
     * Mid-scale rating used when the caller expresses no preference.
     */
    public int defaultImportance() {
        return min + (max - min) / 2;
    }

    /**
     * Converts four ratings to weights.
     *
     * @throws IllegalArgumentException when a rating is outside {@code [min, max]}.
     */
    public WeightVector toWeightVector(int costImportance, int timeImportance, int layoverImportance, int co2Importance) {
        return WeightVector.of(
                requireInRange(costImportance, "cost"),
                requireInRange(timeImportance, "time"),
                requireInRange(layoverImportance, "layover"),
                requireInRange(co2Importance, "co2")
        );
    }

    /**
     * Weight vector with every criterion at {@link #defaultImportance()}.
     */
    public WeightVector defaultWeights() {
        int rating = defaultImportance();
        return toWeightVector(rating, rating, rating, rating);
    }

    private int requireInRange(int rating, String criterion) {
        if (rating < min || rating > max) {
            throw new IllegalArgumentException(
                    criterion + " importance must be within [" + min + ", " + max + "], got " + rating
            );
        }
        return rating;
    }

    private static int readInt(String key, int fallback) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
