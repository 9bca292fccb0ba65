package org.tobmap.routing.core;

import org.tobmap.routing.profile.TravelMode;

/**
 * Edge-to-edge route planner over one immutable graph.
 * <p>
 * Implementations keep no per-query state in fields, so one instance serves concurrent callers.
 * </p>
 */
public interface RoutePlanner {

    /**
     * Computes the least-cost route from {@code startEdge} to {@code endEdge} using the
     * planner's default visited-node budget.
     *
     * @throws RouteCoreException for invalid edge indices or a null mode.
     */
    RouteResult route(int startEdge, int endEdge, TravelMode mode);

    /**
     * Computes the least-cost route with an explicit visited-node budget
     * (non-positive means unbounded).
     *
     * @throws RouteCoreException for invalid edge indices or a null mode.
     */
    RouteResult route(int startEdge, int endEdge, TravelMode mode, int maxVisitedNodes);
}
