package org.tobmap.routing.profile;

/**
 * Travel modality. The ordinal is the column of the mode in the per-edge cost table,
 * so constants must only ever be appended.
 */
public enum TravelMode {
    CAR,
    BIKE,
    WALK,
    TRANSIT;

    private static final TravelMode[] VALUES = values();

    public static int count() {
        return VALUES.length;
    }

    public static TravelMode fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            throw new IllegalArgumentException("Unknown travel mode index: " + index);
        }
        return VALUES[index];
    }
}
