package org.tobmap.routing.build;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import org.tobmap.routing.graph.GraphStore;
import org.tobmap.routing.snap.SnapBuckets;

import java.util.List;

/**
 * Output of one offline build.
 */
@Value
@Builder
public class BuildResult {
    GraphStore graph;
    SnapBuckets snapBuckets;
    /** Non-fatal findings such as clamped costs. */
    List<String> warnings;
    /** Final edge indices of each input way, in way order. Read through {@link #edgesOfWay(long)}. */
    @Getter(AccessLevel.NONE)
    Long2ObjectMap<int[]> wayEdges;

    /**
     * Copy of the final edge indices of one input way, empty for an unknown way id.
     */
    public int[] edgesOfWay(long wayId) {
        int[] edges = wayEdges.get(wayId);
        return edges == null ? new int[0] : edges.clone();
    }
}
