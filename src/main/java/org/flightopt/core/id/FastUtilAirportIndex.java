package org.flightopt.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;
import java.util.TreeSet;

/**
 * {@link AirportIndex} backed by a fastutil open hash map for code lookup and a
 * plain array for the reverse direction.
 * <p>
 * Immutable once built; safe for concurrent reads.
 */
public class FastUtilAirportIndex implements AirportIndex {

    private static final int MISSING = -1;

    // code -> id, without boxing
    private final Object2IntOpenHashMap<String> forward;
    // id -> code
    private final String[] reverse;

    /**
     * Indexes the given airport codes in lexicographic order.
     */
    public FastUtilAirportIndex(Collection<String> airportCodes) {
        if (airportCodes == null) {
            throw new IllegalArgumentException("Airport codes cannot be null");
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String code : airportCodes) {
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("Airport code must be non-blank");
            }
            sorted.add(code);
        }

        this.forward = new Object2IntOpenHashMap<>(sorted.size());
        this.forward.defaultReturnValue(MISSING);
        this.reverse = sorted.toArray(new String[0]);
        for (int id = 0; id < reverse.length; id++) {
            forward.put(reverse[id], id);
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String airportCode) throws UnknownAirportCodeException {
        int id = forward.getInt(airportCode);
        if (id == MISSING) {
            throw new UnknownAirportCodeException("Airport code not found: " + airportCode);
        }
        return id;
    }

    @Override
    public String toExternal(int nodeId) {
        if (!containsInternal(nodeId)) {
            throw new IndexOutOfBoundsException("Node id out of bounds: " + nodeId);
        }
        return reverse[nodeId];
    }

    @Override
    public boolean containsExternal(String airportCode) {
        return airportCode != null && forward.containsKey(airportCode);
    }

    @Override
    public boolean containsInternal(int nodeId) {
        return nodeId >= 0 && nodeId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
