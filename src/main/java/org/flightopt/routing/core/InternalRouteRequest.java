package org.flightopt.routing.core;

/**
 * Normalized search request in internal node-id space.
 *
 * @param sourceNodeId internal source node.
 * @param targetNodeId internal target node.
 * @param mask nodes and edges excluded from this search.
 */
record InternalRouteRequest(int sourceNodeId, int targetNodeId, SearchMask mask) {

    /**
     * Unmasked request.
     */
    static InternalRouteRequest of(int sourceNodeId, int targetNodeId) {
        return new InternalRouteRequest(sourceNodeId, targetNodeId, SearchMask.none());
    }
}
