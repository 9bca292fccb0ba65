package org.tobmap.routing.core;

import lombok.Builder;
import lombok.Value;
import org.tobmap.routing.profile.TravelMode;

/**
 * Client-facing route request.
 *
 * <p>Each endpoint is given either as an edge index or as a coordinate that
 * {@link RouteCore} snaps to the nearest edge. An edge index wins when both are set.</p>
 */
@Value
@Builder
public class RouteRequest {
    /** Start edge index. */
    Integer startEdge;
    /** End edge index. */
    Integer endEdge;
    /** Start coordinate, snapped when {@link #startEdge} is absent. */
    Double startLat;
    Double startLng;
    /** End coordinate, snapped when {@link #endEdge} is absent. */
    Double endLat;
    Double endLng;
    /** Travel mode. */
    TravelMode mode;
    /** Visited-node budget for this request; {@code null} keeps the planner default. */
    Integer maxVisitedNodes;

    public static RouteRequest between(int startEdge, int endEdge, TravelMode mode) {
        return RouteRequest.builder().startEdge(startEdge).endEdge(endEdge).mode(mode).build();
    }
}
