package org.flightopt.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Raw totals and weighted score of one path.
 *
 * <pre>
 * combinedScore = cost_w * totalCost + time_w * totalTimeMinutes
 *               + co2_w * totalCo2Kg + layover_w * layoverCount
 * </pre>
 */
@Value
@Builder
public class PathScore {
    double combinedScore;
    double totalCost;
    double totalTimeMinutes;
    double totalCo2Kg;
    /** Intermediate stops: node count minus two, never negative. */
    int layoverCount;

    /**
     * Score of a zero-length path.
     */
    public static PathScore zero() {
        return PathScore.builder().build();
    }
}
