package org.tobmap.routing.core;

/**
 * Outcome of one route computation.
 */
public enum RouteStatus {
    /** A least-cost path was found. */
    FOUND,
    /** The search space was exhausted without reaching the end edge. */
    UNREACHABLE,
    /** The visited-node budget ran out before the search finished. */
    TRUNCATED
}
