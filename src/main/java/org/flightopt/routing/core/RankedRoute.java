package org.flightopt.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Labeled route handed to renderers: {@code {label, path, score, cost, time, co2, layovers}}.
 */
@Value
@Builder
public class RankedRoute {
    public static final String LABEL_BEST = "Best";
    public static final String LABEL_ALTERNATIVE = "Alternative";

    /** "Dijkstra", "Bellman-Ford", "Best" or "Alternative". */
    String label;
    /** One-based rank within the producing sequence. */
    int rank;
    @Singular("pathNode")
    List<String> path;
    double score;
    double cost;
    double time;
    double co2;
    int layovers;

    /**
     * Flattens a path and its score into the renderer shape.
     */
    static RankedRoute of(String label, int rank, List<String> path, PathScore score) {
        return RankedRoute.builder()
                .label(label)
                .rank(rank)
                .path(path)
                .score(score.getCombinedScore())
                .cost(score.getTotalCost())
                .time(score.getTotalTimeMinutes())
                .co2(score.getTotalCo2Kg())
                .layovers(score.getLayoverCount())
                .build();
    }

    @Override
    public String toString() {
        return String.format("%s %d: %s | score %.2f, cost %.2f, %.0f min, %.2f kg CO2, %d layovers",
                label, rank, String.join(" -> ", path), score, cost, time, co2, layovers);
    }
}
