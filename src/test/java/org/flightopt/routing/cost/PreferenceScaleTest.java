package org.flightopt.routing.cost;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Preference Scale Tests")
class PreferenceScaleTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("flightopt.preferences.min");
        System.clearProperty("flightopt.preferences.max");
    }

    @Test
    @DisplayName("Default scale is 1..10 with mid-scale default of 5")
    void testDefaults() {
        PreferenceScale scale = PreferenceScale.defaults();
        assertEquals(1, scale.min());
        assertEquals(10, scale.max());
        assertEquals(5, scale.defaultImportance());
        assertEquals(WeightVector.of(5, 5, 5, 5), scale.defaultWeights());
    }

    @Test
    @DisplayName("Ratings map one-to-one onto weight components")
    void testMapping() {
        WeightVector vector = PreferenceScale.defaults().toWeightVector(1, 2, 3, 10);
        assertEquals(1.0d, vector.getCostWeight());
        assertEquals(2.0d, vector.getTimeWeight());
        assertEquals(3.0d, vector.getLayoverWeight());
        assertEquals(10.0d, vector.getCo2Weight());
    }

    @Test
    @DisplayName("Out-of-range ratings are rejected")
    void testOutOfRange() {
        PreferenceScale scale = PreferenceScale.defaults();
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> scale.toWeightVector(0, 5, 5, 5));
        assertTrue(ex.getMessage().contains("cost"));
        assertThrows(IllegalArgumentException.class, () -> scale.toWeightVector(5, 11, 5, 5));
    }

    @Test
    @DisplayName("Bounds come from system properties; invalid values fall back")
    void testPropertyOverrides() {
        System.setProperty("flightopt.preferences.min", "0");
        System.setProperty("flightopt.preferences.max", "100");
        PreferenceScale wide = PreferenceScale.defaults();
        assertEquals(0, wide.min());
        assertEquals(100, wide.max());
        assertEquals(50, wide.defaultImportance());

        System.setProperty("flightopt.preferences.max", "not-a-number");
        assertEquals(10, PreferenceScale.defaults().max());

        System.setProperty("flightopt.preferences.min", "20");
        System.setProperty("flightopt.preferences.max", "5");
        PreferenceScale fallback = PreferenceScale.defaults();
        assertEquals(1, fallback.min());
        assertEquals(10, fallback.max());
    }

    @Test
    @DisplayName("Explicit bounds are validated")
    void testExplicitBounds() {
        assertThrows(IllegalArgumentException.class, () -> PreferenceScale.of(-1, 5));
        assertThrows(IllegalArgumentException.class, () -> PreferenceScale.of(6, 5));
        assertEquals(3, PreferenceScale.of(3, 3).defaultImportance());
    }
}
