package org.flightopt.routing.graph;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.flightopt.core.id.AirportIndex;

/**
 * Immutable directed leg graph.
 * <p>
 * Layout:
 * <ul>
 * <li>CSR (Compressed Sparse Row) adjacency: edges of node {@code n} occupy
 * {@code [firstEdge[n], firstEdge[n + 1])}, sorted by destination id.</li>
 * <li>SoA (Structure of Arrays) for raw leg attributes, indexed by edge id.</li>
 * <li>O(1) edge lookup by ordered (origin, destination) pair.</li>
 * </ul>
 * Coordinates are carried for renderers only and never read by search.
 * <p>
 * Instances are built by {@link LegGraphLoader} and never change afterwards, so one
 * graph can be shared by any number of concurrent queries.
 */
public final class LegGraph {

    /** Returned by {@link #findEdge(int, int)} when no leg connects the pair. */
    public static final int NO_EDGE = -1;

    @Getter
    @Accessors(fluent = true)
    private final AirportIndex airportIndex;

    // CSR index
    private final int[] firstEdge;
    private final int[] edgeOrigin;
    private final int[] edgeTarget;

    // Raw leg attributes
    private final double[] cost;
    private final double[] timeMinutes;
    private final double[] co2Kg;

    // Renderer-only geometry, 4 doubles per edge: originLat, originLon, destLat, destLon
    private final double[] geometry;

    private final Long2IntOpenHashMap edgeByPair;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    LegGraph(AirportIndex airportIndex,
             int[] firstEdge, int[] edgeOrigin, int[] edgeTarget,
             double[] cost, double[] timeMinutes, double[] co2Kg,
             double[] geometry) {
        this.airportIndex = airportIndex;
        this.nodeCount = airportIndex.size();
        this.edgeCount = edgeTarget.length;
        this.firstEdge = firstEdge;
        this.edgeOrigin = edgeOrigin;
        this.edgeTarget = edgeTarget;
        this.cost = cost;
        this.timeMinutes = timeMinutes;
        this.co2Kg = co2Kg;
        this.geometry = geometry;

        this.edgeByPair = new Long2IntOpenHashMap(edgeCount);
        this.edgeByPair.defaultReturnValue(NO_EDGE);
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            edgeByPair.put(pairKey(edgeOrigin[edgeId], edgeTarget[edgeId]), edgeId);
        }
    }

    // ========================================================================
    // TOPOLOGY
    // ========================================================================

    /**
     * First edge id leaving {@code nodeId}.
     */
    public int edgeRangeStart(int nodeId) {
        checkNode(nodeId);
        return firstEdge[nodeId];
    }

    /**
     * One past the last edge id leaving {@code nodeId}.
     */
    public int edgeRangeEnd(int nodeId) {
        checkNode(nodeId);
        return firstEdge[nodeId + 1];
    }

    public int getNodeDegree(int nodeId) {
        return edgeRangeEnd(nodeId) - edgeRangeStart(nodeId);
    }

    public int getEdgeOrigin(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeOrigin[edgeId];
    }

    public int getEdgeDestination(int edgeId) {
        assert edgeId >= 0 && edgeId < edgeCount : "Edge " + edgeId + " out of bounds";
        return edgeTarget[edgeId];
    }

    /**
     * Looks up the leg from {@code originId} to {@code destinationId}.
     *
     * @return edge id, or {@link #NO_EDGE} when the pair is not connected.
     */
    public int findEdge(int originId, int destinationId) {
        return edgeByPair.get(pairKey(originId, destinationId));
    }

    // ========================================================================
    // RAW ATTRIBUTES
    // ========================================================================

    public double getCost(int edgeId) {
        return cost[edgeId];
    }

    public double getTimeMinutes(int edgeId) {
        return timeMinutes[edgeId];
    }

    public double getCo2Kg(int edgeId) {
        return co2Kg[edgeId];
    }

    /**
     * Endpoint coordinates of one leg, for renderers.
     */
    public LegGeometry legGeometry(int edgeId) {
        if (edgeId < 0 || edgeId >= edgeCount) {
            throw new IndexOutOfBoundsException("Edge " + edgeId + " out of bounds");
        }
        int base = edgeId << 2;
        return new LegGeometry(
                airportIndex.toExternal(edgeOrigin[edgeId]),
                airportIndex.toExternal(edgeTarget[edgeId]),
                geometry[base],
                geometry[base + 1],
                geometry[base + 2],
                geometry[base + 3]
        );
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
        }
    }

    private static long pairKey(int originId, int destinationId) {
        return ((long) originId << 32) | (destinationId & 0xFFFFFFFFL);
    }

    /**
     * Renderer-facing leg coordinates.
     */
    public record LegGeometry(
            String origin,
            String destination,
            double originLatitude,
            double originLongitude,
            double destinationLatitude,
            double destinationLongitude
    ) {
        @Override
        public String toString() {
            return String.format("%s(%.4f, %.4f) -> %s(%.4f, %.4f)",
                    origin, originLatitude, originLongitude,
                    destination, destinationLatitude, destinationLongitude);
        }
    }
}
