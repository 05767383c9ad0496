package org.flightopt.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-cursor bound on alternative-path enumeration work.
 */
final class EnumerationBudget {
    static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_SPUR_SEARCHES_EXCEEDED = "ENUMERATION_SPUR_SEARCHES_EXCEEDED";

    private static final String PROP_MAX_SPUR_SEARCHES = "flightopt.routing.maxSpurSearches";

    @Getter
    @Accessors(fluent = true)
    private final int maxSpurSearches;

    private EnumerationBudget(int maxSpurSearches) {
        this.maxSpurSearches = maxSpurSearches <= 0 ? UNBOUNDED : maxSpurSearches;
    }

    /**
     * Creates a budget with an explicit bound; non-positive means unbounded.
     */
    static EnumerationBudget of(int maxSpurSearches) {
        return new EnumerationBudget(maxSpurSearches);
    }

    /**
     * Loads the bound from system properties.
     */
    static EnumerationBudget defaults() {
        return new EnumerationBudget(readBound(PROP_MAX_SPUR_SEARCHES));
    }

    /**
     * Validates the number of spur searches run by one cursor so far.
     */
    void checkSpurSearches(int spurSearches) {
        if (spurSearches > maxSpurSearches) {
            throw new BudgetExceededException(
                    REASON_SPUR_SEARCHES_EXCEEDED,
                    "spur search budget exceeded: " + spurSearches + " > " + maxSpurSearches
            );
        }
    }

    private static int readBound(String key) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    /**
     * Deterministic budget breach.
     */
    @Getter
    @Accessors(fluent = true)
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
