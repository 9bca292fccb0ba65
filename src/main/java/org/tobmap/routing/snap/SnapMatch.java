package org.tobmap.routing.snap;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable nearest-edge match.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SnapMatch {
    private final int edgeIndex;
    private final double distanceMeters;
    /** Closest point on the edge geometry. */
    private final double lat;
    private final double lng;
    /** Index of the closest segment within the edge geometry (0 = first segment). */
    private final int segmentIndex;

    @Override
    public String toString() {
        return String.format("SnapMatch[edge=%d, distance=%.2fm, at=(%.7f, %.7f), segment=%d]",
                edgeIndex, distanceMeters, lat, lng, segmentIndex);
    }
}
