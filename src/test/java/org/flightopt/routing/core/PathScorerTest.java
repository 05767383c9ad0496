package org.flightopt.routing.core;

import org.flightopt.routing.cost.WeightVector;
import org.flightopt.routing.graph.LegGraph;
import org.flightopt.routing.testutil.FlightFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Path Scorer Tests")
class PathScorerTest {

    private final PathScorer scorer = new PathScorer();

    @Test
    @DisplayName("Totals and score for A-B-C under unit weights")
    void testTriangleTotals() {
        LegGraph graph = FlightFixtureFactory.triangle();
        PathScore score = scorer.score(graph, List.of("A", "B", "C"), WeightVector.of(1, 1, 1, 1));

        assertEquals(150.0d, score.getTotalCost());
        assertEquals(90.0d, score.getTotalTimeMinutes());
        assertEquals(70.0d, score.getTotalCo2Kg());
        assertEquals(1, score.getLayoverCount());
        assertEquals(311.0d, score.getCombinedScore());
    }

    @Test
    @DisplayName("Direct leg has no layovers")
    void testDirectLeg() {
        LegGraph graph = FlightFixtureFactory.triangle();
        PathScore score = scorer.score(graph, List.of("A", "C"), WeightVector.of(2, 1, 0.5, 100));

        assertEquals(0, score.getLayoverCount());
        assertEquals(2 * 200 + 50 + 0.5 * 80, score.getCombinedScore());
    }

    @Test
    @DisplayName("Layover weight scales with intermediate stops only")
    void testLayoverWeightOnly() {
        LegGraph graph = FlightFixtureFactory.hubNetwork();
        PathScore score = scorer.score(graph, List.of("DEL", "BOM", "BLR", "MAA"), WeightVector.of(0, 0, 7, 0));

        assertEquals(2, score.getLayoverCount());
        assertEquals(14.0d, score.getCombinedScore());
        assertEquals(45.0d + 32.0d + 25.0d, score.getTotalCost());
    }

    @Test
    @DisplayName("Single-airport path scores zero")
    void testSingleAirport() {
        LegGraph graph = FlightFixtureFactory.triangle();
        PathScore score = scorer.score(graph, List.of("B"), WeightVector.of(3, 3, 3, 3));
        assertEquals(PathScore.zero(), score);
    }

    @Test
    @DisplayName("Score is independent of how the path was produced")
    void testScoreMatchesPlannerPath() {
        LegGraph graph = FlightFixtureFactory.hubNetwork();
        WeightVector vector = WeightVector.of(1, 2, 3, 4);
        int[] nodePath = {
                graph.airportIndex().toInternal("DEL"),
                graph.airportIndex().toInternal("HYD"),
                graph.airportIndex().toInternal("MAA")
        };
        assertEquals(
                scorer.score(graph, List.of("DEL", "HYD", "MAA"), vector),
                scorer.score(graph, nodePath, vector)
        );
    }

    @Test
    @DisplayName("Missing leg is reported as a disconnected path")
    void testDisconnected() {
        LegGraph graph = FlightFixtureFactory.triangle();
        RouteCoreException ex = assertThrows(RouteCoreException.class,
                () -> scorer.score(graph, List.of("C", "A"), WeightVector.of(1, 1, 1, 1)));
        assertEquals(RouteCore.REASON_DISCONNECTED_PATH, ex.getReasonCode());
        assertTrue(ex.getMessage().startsWith("[DISCONNECTED_PATH]"));
    }

    @Test
    @DisplayName("Unknown airport and empty path are rejected")
    void testInvalidPaths() {
        LegGraph graph = FlightFixtureFactory.triangle();
        WeightVector vector = WeightVector.of(1, 1, 1, 1);

        assertEquals(RouteCore.REASON_UNKNOWN_AIRPORT,
                assertThrows(RouteCoreException.class, () -> scorer.score(graph, List.of("A", "ZZZ"), vector))
                        .getReasonCode());
        assertEquals(RouteCore.REASON_PATH_REQUIRED,
                assertThrows(RouteCoreException.class, () -> scorer.score(graph, List.of(), vector))
                        .getReasonCode());
        assertEquals(RouteCore.REASON_PATH_REQUIRED,
                assertThrows(RouteCoreException.class, () -> scorer.score(graph, (List<String>) null, vector))
                        .getReasonCode());
    }
}
