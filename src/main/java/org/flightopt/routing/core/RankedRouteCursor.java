package org.flightopt.routing.core;

import org.flightopt.core.id.AirportIndex;
import org.flightopt.routing.cost.WeightVector;
import org.flightopt.routing.graph.LegGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Client-facing view of an alternative-path enumeration.
 *
 * <p>Each pull runs just enough search to produce one more route; the caller
 * decides when to stop. Not thread-safe.</p>
 */
public final class RankedRouteCursor {
    private final AlternativeRouteEnumerator.RouteCursor cursor;
    private final LegGraph graph;
    private final WeightVector weights;
    private final PathScorer pathScorer;
    private int rank;

    RankedRouteCursor(
            AlternativeRouteEnumerator.RouteCursor cursor,
            LegGraph graph,
            WeightVector weights,
            PathScorer pathScorer
    ) {
        this.cursor = cursor;
        this.graph = graph;
        this.weights = weights;
        this.pathScorer = pathScorer;
    }

    /**
     * Next route, labeled {@link RankedRoute#LABEL_BEST} for the first and
     * {@link RankedRoute#LABEL_ALTERNATIVE} afterwards; empty once exhausted.
     *
     * @throws RouteCoreException when the enumeration budget is exhausted.
     */
    public Optional<RankedRoute> next() {
        Optional<InternalRoutePlan> plan;
        try {
            plan = cursor.next();
        } catch (EnumerationBudget.BudgetExceededException ex) {
            throw new RouteCoreException(
                    RouteCore.REASON_ENUMERATION_BUDGET_EXCEEDED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }
        return plan.map(this::toRankedRoute);
    }

    /**
     * Pulls up to {@code limit} further routes.
     */
    public List<RankedRoute> take(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        List<RankedRoute> routes = new ArrayList<>();
        while (routes.size() < limit) {
            Optional<RankedRoute> route = next();
            if (route.isEmpty()) {
                break;
            }
            routes.add(route.get());
        }
        return routes;
    }

    /**
     * Whether the enumeration has run out of simple paths.
     */
    public boolean isExhausted() {
        return cursor.isExhausted();
    }

    private RankedRoute toRankedRoute(InternalRoutePlan plan) {
        rank++;
        String label = rank == 1 ? RankedRoute.LABEL_BEST : RankedRoute.LABEL_ALTERNATIVE;
        PathScore score = pathScorer.score(graph, plan.nodePath(), weights);
        return RankedRoute.of(label, rank, toAirportCodes(graph.airportIndex(), plan.nodePath()), score);
    }

    static List<String> toAirportCodes(AirportIndex index, int[] nodePath) {
        List<String> codes = new ArrayList<>(nodePath.length);
        for (int nodeId : nodePath) {
            codes.add(index.toExternal(nodeId));
        }
        return codes;
    }
}
