package org.tobmap.routing.build;

import org.tobmap.routing.profile.TravelMode;

/**
 * Default cost model: travel time in seconds at a fixed speed per road class and mode.
 * <pre>
 * cost = length_m / (speed_kmh / 3.6)
 * </pre>
 * Car speed may be overridden by {@link WayTags#getMaxSpeedKmh()}. A mode the road class
 * denies but the way explicitly grants travels at the {@link RoadClass#OTHER} speed. Transit
 * never uses street edges.
 */
public final class SpeedTableCostFunction implements EdgeCostFunction {
    public static final double NOT_ALLOWED = -1.0d;

    private static final double KMH_TO_MPS = 1.0d / 3.6d;

    @Override
    public double cost(double lengthMeters, WayTags tags, TravelMode mode) {
        double speed = speedKmh(tags, mode);
        if (speed <= 0.0d) {
            return NOT_ALLOWED;
        }
        return lengthMeters / (speed * KMH_TO_MPS);
    }

    /**
     * Effective speed in km/h, or {@link #NOT_ALLOWED}.
     */
    public double speedKmh(WayTags tags, TravelMode mode) {
        if (mode == TravelMode.TRANSIT) {
            return NOT_ALLOWED;
        }
        if (mode == TravelMode.CAR && tags.getMaxSpeedKmh() != null && tags.getMaxSpeedKmh() > 0.0d) {
            return tags.getMaxSpeedKmh();
        }
        double speed = rowSpeed(speeds(tags.getRoadClass()), mode);
        if (speed <= 0.0d && Boolean.TRUE.equals(tags.getModeAccess().get(mode))) {
            return rowSpeed(speeds(RoadClass.OTHER), mode);
        }
        return speed;
    }

    private static double rowSpeed(double[] row, TravelMode mode) {
        return switch (mode) {
            case CAR -> row[0];
            case BIKE -> row[1];
            case WALK -> row[2];
            case TRANSIT -> NOT_ALLOWED;
        };
    }

    // {car, bike, walk} in km/h
    private static double[] speeds(RoadClass roadClass) {
        return switch (roadClass) {
            case MOTORWAY -> new double[]{100.0d, NOT_ALLOWED, NOT_ALLOWED};
            case TRUNK -> new double[]{80.0d, NOT_ALLOWED, NOT_ALLOWED};
            case PRIMARY -> new double[]{60.0d, 15.0d, 5.0d};
            case SECONDARY -> new double[]{50.0d, 15.0d, 5.0d};
            case TERTIARY -> new double[]{40.0d, 15.0d, 5.0d};
            case RESIDENTIAL, UNCLASSIFIED -> new double[]{30.0d, 15.0d, 5.0d};
            case SERVICE -> new double[]{20.0d, 15.0d, 5.0d};
            case LIVING_STREET -> new double[]{10.0d, 10.0d, 5.0d};
            case PEDESTRIAN -> new double[]{NOT_ALLOWED, 5.0d, 5.0d};
            case CYCLEWAY -> new double[]{NOT_ALLOWED, 20.0d, 5.0d};
            case FOOTWAY, PATH, STEPS -> new double[]{NOT_ALLOWED, 5.0d, 5.0d};
            case OTHER -> new double[]{30.0d, 15.0d, 5.0d};
        };
    }
}
