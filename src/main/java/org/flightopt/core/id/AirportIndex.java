package org.flightopt.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;

/**
 * Bidirectional mapping between airport codes and dense internal node ids.
 *
 * <p>Internal ids run from {@code 0} to {@code size() - 1} and follow the
 * lexicographic order of the airport codes, so the id of a code depends only
 * on the set of codes loaded.</p>
 */
public interface AirportIndex {

    /**
     * Converts an airport code to its internal node id.
     *
     * @param airportCode client-facing airport code.
     * @return internal node id.
     * @throws UnknownAirportCodeException if the code is not indexed.
     */
    int toInternal(String airportCode) throws UnknownAirportCodeException;

    /**
     * Converts an internal node id back to its airport code.
     *
     * @param nodeId internal node id.
     * @return airport code.
     * @throws IndexOutOfBoundsException if the id is outside the index.
     */
    String toExternal(int nodeId);

    /**
     * Checks whether an airport code is indexed.
     *
     * @param airportCode code to test.
     * @return true when the code is present.
     */
    boolean containsExternal(String airportCode);

    /**
     * Checks whether an internal id is within index bounds.
     */
    boolean containsInternal(int nodeId);

    /**
     * Returns the number of indexed airports.
     */
    int size();

    /**
     * Thrown when an airport code has no internal id.
     */
    @StandardException
    class UnknownAirportCodeException extends RuntimeException {
    }

    /**
     * Builds the default immutable index over a collection of airport codes.
     * Duplicates collapse to one entry.
     *
     * @param airportCodes codes to index; must be non-null and non-blank.
     * @return immutable index with lexicographically ordered ids.
     */
    static AirportIndex of(Collection<String> airportCodes) {
        return new FastUtilAirportIndex(airportCodes);
    }
}
