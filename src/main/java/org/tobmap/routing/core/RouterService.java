package org.tobmap.routing.core;

import org.tobmap.routing.snap.SnapMatch;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Public snap and route query contract.
 *
 * <p>Implementations perform deterministic input validation and throw reason-coded
 * runtime exceptions for contract failures. A snap miss, an unreachable end and an
 * exhausted budget are results, not failures.</p>
 */
public interface RouterService {

    /**
     * Index of the edge nearest to the coordinate, or empty when none lies within reach.
     */
    OptionalInt snap(double lat, double lng);

    /**
     * Nearest edge with its distance and projected point, or empty when none lies within reach.
     */
    Optional<SnapMatch> nearest(double lat, double lng);

    /**
     * Executes one edge-to-edge route request.
     */
    RouteResult route(RouteRequest request);
}
