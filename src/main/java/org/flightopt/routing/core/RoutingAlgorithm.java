package org.flightopt.routing.core;

import lombok.Getter;

/**
 * Shortest-path strategy selector.
 */
public enum RoutingAlgorithm {
    /** Label-setting search; requires non-negative combined weights. */
    DIJKSTRA("Dijkstra"),
    /** Label-correcting search; tolerates negative weights, detects negative cycles. */
    BELLMAN_FORD("Bellman-Ford");

    /** Display label handed to renderers. */
    @Getter
    private final String label;

    RoutingAlgorithm(String label) {
        this.label = label;
    }
}
