package org.tobmap.routing.build;

import org.tobmap.routing.profile.TravelMode;

/**
 * Raw cost of one edge for one mode, before clamping into the packed 13-bit field.
 * A negative result excludes the mode from the edge.
 */
@FunctionalInterface
public interface EdgeCostFunction {

    double cost(double lengthMeters, WayTags tags, TravelMode mode);
}
