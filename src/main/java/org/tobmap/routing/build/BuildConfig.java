package org.tobmap.routing.build;

import lombok.Builder;
import lombok.Value;
import org.tobmap.routing.snap.SnapConfig;

/**
 * Offline build settings.
 */
@Value
@Builder
public class BuildConfig {
    /** Graph name stored in the container. */
    @Builder.Default
    String name = "tobmap";

    /** Cell levels used for the snap buckets. */
    @Builder.Default
    SnapConfig snapConfig = SnapConfig.defaults();

    @Builder.Default
    EdgeCostFunction costFunction = new SpeedTableCostFunction();

    /** Order nodes by leaf cell id instead of first appearance. */
    @Builder.Default
    boolean sortNodesByCell = true;

    /** Order edges by the cell of their midpoint instead of creation order. */
    @Builder.Default
    boolean sortEdgesByCell = true;

    public static BuildConfig defaults() {
        return BuildConfig.builder().build();
    }
}
