package org.flightopt.routing.graph;

import org.flightopt.core.id.AirportIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds an immutable {@link LegGraph} from raw leg records.
 * <p>
 * Contract:
 * <ul>
 * <li>All records are validated before any graph structure is built; the first invalid
 * record aborts the load with {@link InvalidLegRecordException}.</li>
 * <li>A valid self-loop record (origin equals destination) registers its airport but adds
 * no leg, since no simple path can use it.</li>
 * <li>At most one leg is kept per ordered (origin, destination) pair. A later record
 * overwrites an earlier one for the same pair (last-write-wins).</li>
 * <li>An empty input yields an empty graph.</li>
 * </ul>
 */
public final class LegGraphLoader {
    private static final Logger LOG = LoggerFactory.getLogger(LegGraphLoader.class);

    private LegGraphLoader() {
    }

    /**
     * Validates the records and builds the graph.
     *
     * @param records legs in provider order.
     * @return immutable graph.
     * @throws InvalidLegRecordException on the first malformed record.
     */
    public static LegGraph load(List<LegRecord> records) {
        Objects.requireNonNull(records, "records");

        Map<PairKey, LegRecord> latestByPair = new LinkedHashMap<>();
        Set<String> codes = new HashSet<>();
        int overwritten = 0;
        int selfLoops = 0;
        for (int index = 0; index < records.size(); index++) {
            LegRecord record = records.get(index);
            validate(record, index);
            codes.add(record.getOrigin());
            codes.add(record.getDestination());
            if (record.getOrigin().equals(record.getDestination())) {
                // a simple path never uses a self loop; the airport stays routable
                selfLoops++;
                LOG.warn("Self-loop leg {} -> {} at record {} is kept out of search",
                        record.getOrigin(), record.getDestination(), index);
                continue;
            }
            LegRecord previous = latestByPair.put(new PairKey(record.getOrigin(), record.getDestination()), record);
            if (previous != null) {
                overwritten++;
                LOG.warn("Duplicate leg {} -> {} at record {} replaces an earlier record",
                        record.getOrigin(), record.getDestination(), index);
            }
        }

        AirportIndex index = AirportIndex.of(codes);

        List<IndexedLeg> legs = new ArrayList<>(latestByPair.size());
        for (LegRecord record : latestByPair.values()) {
            legs.add(new IndexedLeg(index.toInternal(record.getOrigin()), index.toInternal(record.getDestination()), record));
        }
        legs.sort(null);

        LegGraph graph = build(index, legs);
        LOG.info("Loaded leg graph: {} airports, {} legs ({} records, {} overwritten, {} self loops skipped)",
                graph.nodeCount(), graph.edgeCount(), records.size(), overwritten, selfLoops);
        return graph;
    }

    private static LegGraph build(AirportIndex index, List<IndexedLeg> legs) {
        int nodeCount = index.size();
        int edgeCount = legs.size();
        int[] firstEdge = new int[nodeCount + 1];
        int[] edgeOrigin = new int[edgeCount];
        int[] edgeTarget = new int[edgeCount];
        double[] cost = new double[edgeCount];
        double[] time = new double[edgeCount];
        double[] co2 = new double[edgeCount];
        double[] geometry = new double[edgeCount * 4];

        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            IndexedLeg leg = legs.get(edgeId);
            LegRecord record = leg.record();
            edgeOrigin[edgeId] = leg.originId();
            edgeTarget[edgeId] = leg.destinationId();
            cost[edgeId] = record.getCost();
            time[edgeId] = record.getTimeMinutes();
            co2[edgeId] = record.getCo2Kg();
            int base = edgeId << 2;
            geometry[base] = record.getOriginLatitude();
            geometry[base + 1] = record.getOriginLongitude();
            geometry[base + 2] = record.getDestinationLatitude();
            geometry[base + 3] = record.getDestinationLongitude();
            firstEdge[leg.originId() + 1]++;
        }
        // degree counts -> prefix offsets
        for (int node = 0; node < nodeCount; node++) {
            firstEdge[node + 1] += firstEdge[node];
        }
        return new LegGraph(index, firstEdge, edgeOrigin, edgeTarget, cost, time, co2, geometry);
    }

    private static void validate(LegRecord record, int index) {
        if (record == null) {
            throw new InvalidLegRecordException(InvalidLegRecordException.REASON_RECORD_REQUIRED, index, "record is null");
        }
        requireAirport(record.getOrigin(), "origin", index);
        requireAirport(record.getDestination(), "destination", index);
        requireNonNegative(record.getCost(), "cost", index);
        requireNonNegative(record.getTimeMinutes(), "time_minutes", index);
        requireNonNegative(record.getCo2Kg(), "co2_kg", index);
        requireFinite(record.getOriginLatitude(), "origin_latitude", index);
        requireFinite(record.getOriginLongitude(), "origin_longitude", index);
        requireFinite(record.getDestinationLatitude(), "destination_latitude", index);
        requireFinite(record.getDestinationLongitude(), "destination_longitude", index);
    }

    private static void requireAirport(String code, String field, int index) {
        if (code == null || code.isBlank()) {
            throw new InvalidLegRecordException(
                    InvalidLegRecordException.REASON_AIRPORT_REQUIRED,
                    index,
                    field + " airport code is missing"
            );
        }
    }

    private static void requireNonNegative(Double value, String field, int index) {
        requireFinite(value, field, index);
        if (value < 0.0d) {
            throw new InvalidLegRecordException(
                    InvalidLegRecordException.REASON_NEGATIVE_VALUE,
                    index,
                    field + " must be >= 0, got " + value
            );
        }
    }

    private static void requireFinite(Double value, String field, int index) {
        if (value == null) {
            throw new InvalidLegRecordException(
                    InvalidLegRecordException.REASON_FIELD_MISSING,
                    index,
                    field + " is missing"
            );
        }
        if (!Double.isFinite(value)) {
            throw new InvalidLegRecordException(
                    InvalidLegRecordException.REASON_NON_FINITE_VALUE,
                    index,
                    field + " must be finite, got " + value
            );
        }
    }

    private record PairKey(String origin, String destination) {
    }

    private record IndexedLeg(int originId, int destinationId, LegRecord record) implements Comparable<IndexedLeg> {
        @Override
        public int compareTo(IndexedLeg other) {
            int byOrigin = Integer.compare(originId, other.originId);
            if (byOrigin != 0) {
                return byOrigin;
            }
            return Integer.compare(destinationId, other.destinationId);
        }
    }
}
