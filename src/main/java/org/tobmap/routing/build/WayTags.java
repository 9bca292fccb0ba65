package org.tobmap.routing.build;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.tobmap.routing.graph.Interaction;
import org.tobmap.routing.profile.TravelMode;

import java.util.List;
import java.util.Map;

/**
 * Attributes of a way that drive costs, flags and metadata of its edges.
 */
@Value
@Builder
public class WayTags {
    @Builder.Default
    RoadClass roadClass = RoadClass.OTHER;

    @Singular
    List<String> names;

    /** Display/ranking priority in [0, 10]. */
    @Builder.Default
    int priority = 0;

    /** Travel only in the order the way lists its points. */
    @Builder.Default
    boolean oneWay = false;

    /** Car speed override in km/h; {@code null} keeps the road-class speed. */
    Double maxSpeedKmh;

    /**
     * Explicit per-mode access: {@code false} excludes the mode; {@code true} lets the default
     * speed table price a mode its road class would deny. Transit stays excluded.
     */
    @Singular("access")
    Map<TravelMode, Boolean> modeAccess;

    /** Control applying when arriving at an intersection along this way, by external node id. */
    @Singular("approach")
    Map<Long, Interaction> approachControls;

    /** Control applying when leaving an intersection along this way, by external node id. */
    @Singular("departure")
    Map<Long, Interaction> departureControls;

    public static WayTags of(RoadClass roadClass) {
        return WayTags.builder().roadClass(roadClass).build();
    }
}
