package org.tobmap.routing.snap;

import lombok.Builder;
import lombok.Value;
import org.tobmap.core.cell.CellIndexer;

/**
 * Snap index levels and probing limits.
 * <p>
 * Levels are consumed when buckets are built; probing limits when they are queried.
 * Level defaults may be overridden with system properties {@value #PROP_OUTER_LEVEL}
 * and {@value #PROP_FINE_LEVEL}.
 * </p>
 */
@Value
@Builder
public class SnapConfig {
    public static final String PROP_OUTER_LEVEL = "tobmap.snap.outerLevel";
    public static final String PROP_FINE_LEVEL = "tobmap.snap.fineLevel";

    public static final int DEFAULT_OUTER_LEVEL = 4;
    public static final int DEFAULT_FINE_LEVEL = 16;

    /** Level of the dense outer buckets (at most 13). */
    @Builder.Default
    int outerLevel = readLevel(PROP_OUTER_LEVEL, DEFAULT_OUTER_LEVEL);

    /** Level of the fine cells stored inside buckets. */
    @Builder.Default
    int fineLevel = readLevel(PROP_FINE_LEVEL, DEFAULT_FINE_LEVEL);

    /** Neighbour rings probed around the query's fine cell. */
    @Builder.Default
    int maxFineRings = 3;

    /** Neighbour rings of whole outer buckets probed when the fine search finds nothing. */
    @Builder.Default
    int maxOuterRings = 1;

    /** Matches further away than this are dropped. */
    @Builder.Default
    double maxDistanceMeters = Double.POSITIVE_INFINITY;

    public static SnapConfig defaults() {
        return SnapConfig.builder().build();
    }

    /**
     * @throws IllegalArgumentException when levels or limits are out of range.
     */
    public SnapConfig validate() {
        if (outerLevel < 0 || outerLevel > 13) {
            throw new IllegalArgumentException("outerLevel must be in [0, 13], got " + outerLevel);
        }
        if (fineLevel <= outerLevel || fineLevel > CellIndexer.MAX_LEVEL) {
            throw new IllegalArgumentException(
                    "fineLevel must be in (" + outerLevel + ", " + CellIndexer.MAX_LEVEL + "], got " + fineLevel);
        }
        if (maxFineRings < 0 || maxOuterRings < 0) {
            throw new IllegalArgumentException("ring limits must be >= 0");
        }
        if (Double.isNaN(maxDistanceMeters) || maxDistanceMeters < 0.0d) {
            throw new IllegalArgumentException("maxDistanceMeters must be >= 0");
        }
        return this;
    }

    private static int readLevel(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
