package org.tobmap.routing.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Route planning output.
 *
 * @param status search outcome.
 * @param path edge indices from start edge to end edge inclusive (empty unless {@code FOUND}).
 * @param cost total cost including both end edges and turn penalties ({@code -1} unless {@code FOUND}).
 * @param visitedNodes count of settled nodes during search.
 */
public record RouteResult(RouteStatus status, int[] path, long cost, int visitedNodes) {

    public RouteResult {
        Objects.requireNonNull(status, "status");
        path = path == null ? new int[0] : path;
    }

    static RouteResult found(int[] path, long cost, int visitedNodes) {
        return new RouteResult(RouteStatus.FOUND, path, cost, visitedNodes);
    }

    static RouteResult unreachable(int visitedNodes) {
        return new RouteResult(RouteStatus.UNREACHABLE, new int[0], -1L, visitedNodes);
    }

    static RouteResult truncated(int visitedNodes) {
        return new RouteResult(RouteStatus.TRUNCATED, new int[0], -1L, visitedNodes);
    }

    public boolean isFound() {
        return status == RouteStatus.FOUND;
    }

    /**
     * Defensive copy of the edge path.
     */
    @Override
    public int[] path() {
        return path.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RouteResult other)) return false;
        return cost == other.cost
                && visitedNodes == other.visitedNodes
                && status == other.status
                && Arrays.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(status, cost, visitedNodes) + Arrays.hashCode(path);
    }

    @Override
    public String toString() {
        return "RouteResult[status=" + status + ", path=" + Arrays.toString(path)
                + ", cost=" + cost + ", visitedNodes=" + visitedNodes + "]";
    }
}
