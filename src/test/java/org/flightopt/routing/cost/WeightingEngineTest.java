package org.flightopt.routing.cost;

import org.flightopt.routing.graph.LegGraph;
import org.flightopt.routing.graph.LegGraphLoader;
import org.flightopt.routing.testutil.FlightFixtureFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Weighting Engine Tests")
class WeightingEngineTest {

    private final WeightingEngine engine = new WeightingEngine();

    @Test
    @DisplayName("Combined weight applies all four weights plus one layover unit per leg")
    void testCombinedWeightFormula() {
        LegGraph graph = FlightFixtureFactory.triangle();
        CombinedWeights weights = engine.recompute(graph, WeightVector.of(2, 3, 7, 5));

        int a = graph.airportIndex().toInternal("A");
        int b = graph.airportIndex().toInternal("B");
        int edge = graph.findEdge(a, b);
        // 2*100 + 3*60 + 5*50 + 7
        assertEquals(637.0d, weights.weight(edge));
        assertEquals(graph.edgeCount(), weights.size());
    }

    @Test
    @DisplayName("Unit weights on the triangle fixture")
    void testUnitWeights() {
        LegGraph graph = FlightFixtureFactory.triangle();
        CombinedWeights weights = engine.recompute(graph, WeightVector.of(1, 1, 1, 1));
        int a = graph.airportIndex().toInternal("A");
        int b = graph.airportIndex().toInternal("B");
        int c = graph.airportIndex().toInternal("C");

        assertEquals(211.0d, weights.weight(graph.findEdge(a, b)));
        assertEquals(101.0d, weights.weight(graph.findEdge(b, c)));
        assertEquals(331.0d, weights.weight(graph.findEdge(a, c)));
    }

    @Test
    @DisplayName("Recomputing with the same vector is idempotent")
    void testIdempotence() {
        LegGraph graph = FlightFixtureFactory.hubNetwork();
        WeightVector vector = WeightVector.of(4, 2, 9, 1);

        CombinedWeights once = engine.recompute(graph, vector);
        CombinedWeights twice = engine.recompute(graph, vector);
        assertTrue(once.sameWeights(twice));
        assertEquals(vector, twice.weightVector());
    }

    @Test
    @DisplayName("A new vector yields a new table; earlier tables are untouched")
    void testNoStaleWeights() {
        LegGraph graph = FlightFixtureFactory.triangle();
        CombinedWeights first = engine.recompute(graph, WeightVector.of(1, 1, 1, 1));
        double before = first.weight(0);

        CombinedWeights second = engine.recompute(graph, WeightVector.of(10, 1, 1, 1));
        assertNotEquals(before, second.weight(0));
        assertEquals(before, first.weight(0));
        assertTrue(first.isBoundTo(graph));
        assertTrue(second.isBoundTo(graph));
    }

    @Test
    @DisplayName("Empty graph is a legal no-op")
    void testEmptyGraph() {
        LegGraph graph = LegGraphLoader.load(List.of());
        CombinedWeights weights = engine.recompute(graph, WeightVector.of(1, 1, 1, 1));
        assertEquals(0, weights.size());
        assertFalse(weights.hasNegativeWeight());
    }

    @Test
    @DisplayName("Zero weight vector is accepted")
    void testZeroVector() {
        LegGraph graph = FlightFixtureFactory.triangle();
        CombinedWeights weights = engine.recompute(graph, WeightVector.of(0, 0, 0, 0));
        for (int edge = 0; edge < graph.edgeCount(); edge++) {
            assertEquals(0.0d, weights.weight(edge));
        }
    }

    @Test
    @DisplayName("Weight vector rejects negative and non-finite components")
    void testWeightVectorValidation() {
        assertThrows(IllegalArgumentException.class, () -> WeightVector.of(-1, 1, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> WeightVector.of(1, Double.NaN, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> WeightVector.of(1, 1, Double.POSITIVE_INFINITY, 1));
        assertThrows(IllegalArgumentException.class, () -> WeightVector.of(1, 1, 1, -0.5));
    }

    @Test
    @DisplayName("Explicit tables must match the graph edge count and be finite")
    void testExplicitTable() {
        LegGraph graph = FlightFixtureFactory.triangle();
        assertThrows(IllegalArgumentException.class, () -> CombinedWeights.explicit(graph, new double[2]));
        assertThrows(IllegalArgumentException.class,
                () -> CombinedWeights.explicit(graph, new double[]{1, Double.NaN, 1}));

        CombinedWeights explicit = CombinedWeights.explicit(graph, new double[]{1, -2, 3});
        assertTrue(explicit.hasNegativeWeight());
        assertNull(explicit.weightVector());
    }

    @Test
    @DisplayName("Concurrent queries with different vectors share one graph safely")
    void testConcurrentRecompute() throws Exception {
        LegGraph graph = FlightFixtureFactory.hubNetwork();
        CombinedWeights expectedCost = engine.recompute(graph, WeightVector.of(10, 1, 1, 1));
        CombinedWeights expectedTime = engine.recompute(graph, WeightVector.of(1, 10, 1, 1));

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Callable<Boolean> costTask = () -> engine.recompute(graph, WeightVector.of(10, 1, 1, 1)).sameWeights(expectedCost);
            Callable<Boolean> timeTask = () -> engine.recompute(graph, WeightVector.of(1, 10, 1, 1)).sameWeights(expectedTime);
            for (int i = 0; i < 50; i++) {
                Future<Boolean> a = executor.submit(costTask);
                Future<Boolean> b = executor.submit(timeTask);
                assertTrue(a.get());
                assertTrue(b.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
