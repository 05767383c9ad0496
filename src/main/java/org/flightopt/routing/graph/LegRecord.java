package org.flightopt.routing.graph;

import lombok.Builder;
import lombok.Value;

/**
 * One raw leg row as supplied by a route data provider.
 *
 * <p>Numeric fields are boxed so that a provider can report a missing cell as
 * {@code null}; {@link LegGraphLoader} rejects such records.</p>
 */
@Value
@Builder
public class LegRecord {
    /** Origin airport code. */
    String origin;
    /** Destination airport code. */
    String destination;
    /** Ticket cost, non-negative. */
    Double cost;
    /** Flight duration in minutes, non-negative. */
    Double timeMinutes;
    /** Emissions in kilograms of CO2, non-negative. */
    Double co2Kg;
    Double originLatitude;
    Double originLongitude;
    Double destinationLatitude;
    Double destinationLongitude;
}
