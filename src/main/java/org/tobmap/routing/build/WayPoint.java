package org.tobmap.routing.build;

/**
 * One vertex of a way.
 *
 * @param lat latitude in degrees.
 * @param lng longitude in degrees.
 * @param nodeId external intersection id, or {@link #NO_NODE} for a plain shape point.
 */
public record WayPoint(double lat, double lng, long nodeId) {
    public static final long NO_NODE = Long.MIN_VALUE;

    public static WayPoint shape(double lat, double lng) {
        return new WayPoint(lat, lng, NO_NODE);
    }

    public static WayPoint node(long nodeId, double lat, double lng) {
        return new WayPoint(lat, lng, nodeId);
    }

    public boolean isIntersection() {
        return nodeId != NO_NODE;
    }
}
