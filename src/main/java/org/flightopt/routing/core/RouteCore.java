package org.flightopt.routing.core;

import lombok.Builder;
import org.flightopt.core.id.AirportIndex;
import org.flightopt.routing.cost.CombinedWeights;
import org.flightopt.routing.cost.WeightVector;
import org.flightopt.routing.cost.WeightingEngine;
import org.flightopt.routing.graph.LegGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main route-optimizer entry point.
 *
 * <p>The facade owns the immutable leg graph and applies deterministic request
 * validation before any search starts. Execution flow per query:</p>
 * <ul>
 * <li>Validate the request and map airport codes to internal node ids.</li>
 * <li>Compute a fresh query-scoped {@link CombinedWeights} table.</li>
 * <li>Delegate to the selected planner or open an alternative-path cursor.</li>
 * <li>Wrap planner guardrail exceptions into {@link RouteCoreException} with stable reason codes.</li>
 * <li>Rescore every path with {@link PathScorer} and map node ids back to airport codes.</li>
 * </ul>
 * <p>No per-query state is kept on the facade, so one instance serves concurrent queries.</p>
 */
public final class RouteCore implements RouterService {
    public static final String REASON_ROUTE_REQUEST_REQUIRED = "ROUTE_REQUEST_REQUIRED";
    public static final String REASON_SOURCE_REQUIRED = "SOURCE_REQUIRED";
    public static final String REASON_TARGET_REQUIRED = "TARGET_REQUIRED";
    public static final String REASON_WEIGHTS_REQUIRED = "WEIGHTS_REQUIRED";
    public static final String REASON_UNKNOWN_AIRPORT = "UNKNOWN_AIRPORT";
    public static final String REASON_NO_PATH_FOUND = "NO_PATH_FOUND";
    public static final String REASON_PATH_REQUIRED = "PATH_REQUIRED";
    public static final String REASON_DISCONNECTED_PATH = "DISCONNECTED_PATH";
    public static final String REASON_NEGATIVE_EDGE_WEIGHT = "NEGATIVE_EDGE_WEIGHT";
    public static final String REASON_NEGATIVE_CYCLE = "NEGATIVE_CYCLE";
    public static final String REASON_WEIGHTS_GRAPH_MISMATCH = "WEIGHTS_GRAPH_MISMATCH";
    public static final String REASON_ENUMERATION_BUDGET_EXCEEDED = "ENUMERATION_BUDGET_EXCEEDED";

    public static final int DEFAULT_ALTERNATIVES = 5;
    private static final String PROP_DEFAULT_ALTERNATIVES = "flightopt.routing.defaultAlternatives";

    private static final Logger LOG = LoggerFactory.getLogger(RouteCore.class);

    private final LegGraph graph;
    private final WeightingEngine weightingEngine;
    private final PathScorer pathScorer;
    private final Map<RoutingAlgorithm, PathPlanner> planners;
    private final AlternativeRouteEnumerator enumerator;
    private final int defaultAlternatives;

    /**
     * Creates the facade.
     *
     * @param graph immutable leg graph shared by all queries.
     * @param weightingEngine optional weighting engine override.
     * @param enumerationBudget optional spur-search budget (defaults from system properties).
     * @param defaultAlternatives optional alternative count for {@link #plan(RouteRequest)}.
     */
    @Builder
    private RouteCore(
            LegGraph graph,
            WeightingEngine weightingEngine,
            EnumerationBudget enumerationBudget,
            Integer defaultAlternatives
    ) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.weightingEngine = weightingEngine == null ? new WeightingEngine() : weightingEngine;
        this.pathScorer = new PathScorer();

        DijkstraPathPlanner dijkstra = new DijkstraPathPlanner();
        this.planners = new EnumMap<>(RoutingAlgorithm.class);
        this.planners.put(RoutingAlgorithm.DIJKSTRA, dijkstra);
        this.planners.put(RoutingAlgorithm.BELLMAN_FORD, new BellmanFordPathPlanner());
        this.enumerator = new AlternativeRouteEnumerator(
                dijkstra,
                enumerationBudget == null ? EnumerationBudget.defaults() : enumerationBudget
        );

        int alternatives = defaultAlternatives == null ? readDefaultAlternatives() : defaultAlternatives;
        if (alternatives < 0) {
            throw new IllegalArgumentException("defaultAlternatives must be >= 0");
        }
        this.defaultAlternatives = alternatives;
    }

    /**
     * Facade over {@code graph} with default settings.
     */
    public static RouteCore of(LegGraph graph) {
        return RouteCore.builder().graph(graph).build();
    }

    @Override
    public RouteResponse route(RouteRequest request) {
        ResolvedQuery query = resolve(request);
        RoutingAlgorithm algorithm = request.getAlgorithm() == null ? RoutingAlgorithm.DIJKSTRA : request.getAlgorithm();
        InternalRoutePlan plan = computeInternal(
                algorithm,
                query.weights(),
                InternalRouteRequest.of(query.sourceNodeId(), query.targetNodeId())
        );
        if (!plan.reachable()) {
            throw new RouteCoreException(
                    REASON_NO_PATH_FOUND,
                    "no route from " + request.getSourceAirport() + " to " + request.getTargetAirport()
            );
        }

        LOG.debug("{} {} -> {}: weight {} after {} work states",
                algorithm.getLabel(), request.getSourceAirport(), request.getTargetAirport(),
                plan.totalWeight(), plan.workStates());

        RouteResponse.RouteResponseBuilder builder = RouteResponse.builder()
                .algorithm(algorithm)
                .score(pathScorer.score(graph, plan.nodePath(), request.getWeights()))
                .searchWeight(plan.totalWeight())
                .workStates(plan.workStates());
        for (String code : RankedRouteCursor.toAirportCodes(graph.airportIndex(), plan.nodePath())) {
            builder.pathNode(code);
        }
        return builder.build();
    }

    @Override
    public RankedRouteCursor openAlternatives(RouteRequest request) {
        ResolvedQuery query = resolve(request);
        AlternativeRouteEnumerator.RouteCursor cursor;
        try {
            cursor = enumerator.open(graph, query.weights(), query.sourceNodeId(), query.targetNodeId());
        } catch (SearchGuards.SearchContractException ex) {
            throw wrap(ex);
        }
        return new RankedRouteCursor(cursor, graph, request.getWeights(), pathScorer);
    }

    @Override
    public List<RankedRoute> alternatives(RouteRequest request, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        return openAlternatives(request).take(limit);
    }

    /**
     * Planner results plus the configured default number of alternatives.
     */
    public RoutePlanResponse plan(RouteRequest request) {
        return plan(request, defaultAlternatives);
    }

    @Override
    public RoutePlanResponse plan(RouteRequest request, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        if (request == null) {
            throw new RouteCoreException(REASON_ROUTE_REQUEST_REQUIRED, "route request must be provided");
        }
        RoutePlanResponse.RoutePlanResponseBuilder builder = RoutePlanResponse.builder();
        for (RoutingAlgorithm algorithm : RoutingAlgorithm.values()) {
            RouteResponse response = route(request.toBuilder().algorithm(algorithm).build());
            builder.route(RankedRoute.of(algorithm.getLabel(), 1, response.getPath(), response.getScore()));
        }
        List<RankedRoute> alternatives = alternatives(request, limit);
        builder.routes(alternatives);

        LOG.debug("Planned {} -> {}: {} alternatives", request.getSourceAirport(), request.getTargetAirport(),
                alternatives.size());
        return builder
                .sourceAirport(request.getSourceAirport())
                .targetAirport(request.getTargetAirport())
                .weights(request.getWeights())
                .build();
    }

    @Override
    public PathScore score(List<String> path, WeightVector weights) {
        if (weights == null) {
            throw new RouteCoreException(REASON_WEIGHTS_REQUIRED, "weights must be provided");
        }
        return pathScorer.score(graph, path, weights);
    }

    /**
     * Endpoint coordinates of the leg between two airports, for renderers.
     */
    public LegGraph.LegGeometry legGeometry(String origin, String destination) {
        int edgeId = graph.findEdge(toNodeId(origin), toNodeId(destination));
        if (edgeId == LegGraph.NO_EDGE) {
            throw new RouteCoreException(REASON_DISCONNECTED_PATH, "no leg from " + origin + " to " + destination);
        }
        return graph.legGeometry(edgeId);
    }

    /**
     * Exposes the graph this facade serves.
     */
    public LegGraph graph() {
        return graph;
    }

    public int defaultAlternatives() {
        return defaultAlternatives;
    }

    /**
     * Runs one planner with guardrail exceptions normalized to facade reason codes.
     */
    InternalRoutePlan computeInternal(RoutingAlgorithm algorithm, CombinedWeights weights, InternalRouteRequest request) {
        try {
            return planners.get(algorithm).compute(graph, weights, request);
        } catch (SearchGuards.SearchContractException ex) {
            throw wrap(ex);
        }
    }

    private ResolvedQuery resolve(RouteRequest request) {
        if (request == null) {
            throw new RouteCoreException(REASON_ROUTE_REQUEST_REQUIRED, "route request must be provided");
        }
        if (request.getSourceAirport() == null || request.getSourceAirport().isBlank()) {
            throw new RouteCoreException(REASON_SOURCE_REQUIRED, "sourceAirport must be provided");
        }
        if (request.getTargetAirport() == null || request.getTargetAirport().isBlank()) {
            throw new RouteCoreException(REASON_TARGET_REQUIRED, "targetAirport must be provided");
        }
        if (request.getWeights() == null) {
            throw new RouteCoreException(REASON_WEIGHTS_REQUIRED, "weights must be provided");
        }
        int sourceNodeId = toNodeId(request.getSourceAirport());
        int targetNodeId = toNodeId(request.getTargetAirport());
        return new ResolvedQuery(sourceNodeId, targetNodeId, weightingEngine.recompute(graph, request.getWeights()));
    }

    private int toNodeId(String airportCode) {
        AirportIndex index = graph.airportIndex();
        try {
            return index.toInternal(airportCode);
        } catch (AirportIndex.UnknownAirportCodeException ex) {
            throw new RouteCoreException(REASON_UNKNOWN_AIRPORT, "unknown airport: " + airportCode, ex);
        }
    }

    private static RouteCoreException wrap(SearchGuards.SearchContractException ex) {
        String reason = switch (ex.reasonCode()) {
            case SearchGuards.REASON_NEGATIVE_EDGE_WEIGHT -> REASON_NEGATIVE_EDGE_WEIGHT;
            case SearchGuards.REASON_NEGATIVE_CYCLE -> REASON_NEGATIVE_CYCLE;
            default -> REASON_WEIGHTS_GRAPH_MISMATCH;
        };
        return new RouteCoreException(reason, ex.reasonCode() + ": " + ex.getMessage(), ex);
    }

    private static int readDefaultAlternatives() {
        String raw = System.getProperty(PROP_DEFAULT_ALTERNATIVES);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_ALTERNATIVES;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value < 0 ? DEFAULT_ALTERNATIVES : value;
        } catch (NumberFormatException ex) {
            return DEFAULT_ALTERNATIVES;
        }
    }

    private record ResolvedQuery(int sourceNodeId, int targetNodeId, CombinedWeights weights) {
    }
}
