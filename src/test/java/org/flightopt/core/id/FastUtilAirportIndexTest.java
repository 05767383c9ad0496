package org.flightopt.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilAirportIndexTest {

    @Test
    @DisplayName("Ids follow lexicographic code order regardless of input order")
    void testLexicographicIds() {
        AirportIndex index = AirportIndex.of(List.of("MAA", "BLR", "DEL", "BOM"));

        assertEquals(0, index.toInternal("BLR"));
        assertEquals(1, index.toInternal("BOM"));
        assertEquals(2, index.toInternal("DEL"));
        assertEquals(3, index.toInternal("MAA"));
        assertEquals("DEL", index.toExternal(2));
        assertEquals(4, index.size());
    }

    @Test
    @DisplayName("Duplicate codes collapse to one id")
    void testDuplicatesCollapse() {
        AirportIndex index = AirportIndex.of(Arrays.asList("DEL", "BOM", "DEL"));
        assertEquals(2, index.size());
        assertTrue(index.containsExternal("DEL"));
    }

    @Test
    @DisplayName("Membership checks in both directions")
    void testMembership() {
        AirportIndex index = AirportIndex.of(List.of("DEL", "BOM"));

        assertTrue(index.containsExternal("BOM"));
        assertFalse(index.containsExternal("CCU"));
        assertFalse(index.containsExternal(null));
        assertTrue(index.containsInternal(1));
        assertFalse(index.containsInternal(2));
        assertFalse(index.containsInternal(-1));
    }

    @Test
    @DisplayName("Unknown code and out-of-range id are rejected")
    void testUnknownLookups() {
        AirportIndex index = AirportIndex.of(List.of("DEL"));

        AirportIndex.UnknownAirportCodeException ex = assertThrows(
                AirportIndex.UnknownAirportCodeException.class,
                () -> index.toInternal("XXX")
        );
        assertTrue(ex.getMessage().contains("XXX"));
        assertThrows(IndexOutOfBoundsException.class, () -> index.toExternal(5));
    }

    @Test
    @DisplayName("Null collection and blank codes are rejected")
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilAirportIndex(null));
        assertThrows(IllegalArgumentException.class, () -> AirportIndex.of(List.of("DEL", " ")));
        assertThrows(IllegalArgumentException.class, () -> AirportIndex.of(Arrays.asList("DEL", null)));
    }

    @Test
    @DisplayName("Empty index is legal")
    void testEmptyIndex() {
        AirportIndex index = AirportIndex.of(List.of());
        assertEquals(0, index.size());
        assertFalse(index.containsInternal(0));
    }

    @Test
    @DisplayName("Concurrent reads see consistent mappings")
    void testConcurrentReads() throws InterruptedException {
        List<String> codes = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            codes.add(String.format("A%03d", i));
        }
        AirportIndex index = AirportIndex.of(codes);
        AtomicInteger failures = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    String code = String.format("A%03d", i);
                    if (index.toInternal(code) != i || !index.toExternal(i).equals(code)) {
                        failures.incrementAndGet();
                    }
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(0, failures.get());
    }
}
