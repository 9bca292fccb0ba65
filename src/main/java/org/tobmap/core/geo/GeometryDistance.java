package org.tobmap.core.geo;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for distances on the earth's surface.
 * <p>
 * Polyline lengths use the haversine formulation. Point-to-segment distances use a local
 * equirectangular projection centred on the query point, which is accurate for the
 * street-scale segments the snap index compares.
 * </p>
 */
@UtilityClass
public final class GeometryDistance {
    public static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    /**
     * Computes great-circle distance in meters using haversine formulation.
     */
    public static double greatCircleDistanceMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.asin(Math.sqrt(clampedA));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    /**
     * Sums great-circle lengths of consecutive points {@code [from, to)} of a polyline.
     */
    public static double polylineLengthMeters(double[] lats, double[] lngs, int from, int to) {
        double length = 0.0d;
        for (int i = from + 1; i < to; i++) {
            length += greatCircleDistanceMeters(lats[i - 1], lngs[i - 1], lats[i], lngs[i]);
        }
        return length;
    }

    /**
     * Distance in meters from a query point to segment {@code a-b}.
     */
    public static double pointToSegmentMeters(
            double lat, double lng,
            double aLat, double aLng,
            double bLat, double bLng
    ) {
        double cosLat = Math.cos(Math.toRadians(lat));
        double ax = projectX(aLng, lng, cosLat);
        double ay = projectY(aLat, lat);
        double bx = projectX(bLng, lng, cosLat);
        double by = projectY(bLat, lat);
        double t = projectionFraction(ax, ay, bx, by);
        double px = ax + t * (bx - ax);
        double py = ay + t * (by - ay);
        return Math.hypot(px, py);
    }

    /**
     * Position in {@code [0, 1]} along segment {@code a-b} of the point closest to the query.
     */
    public static double projectionFraction(
            double lat, double lng,
            double aLat, double aLng,
            double bLat, double bLng
    ) {
        double cosLat = Math.cos(Math.toRadians(lat));
        return projectionFraction(
                projectX(aLng, lng, cosLat), projectY(aLat, lat),
                projectX(bLng, lng, cosLat), projectY(bLat, lat)
        );
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    public static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    /**
     * Checks that a pair is a finite latitude/longitude in degrees.
     */
    public static boolean isValidCoordinate(double latDeg, double lngDeg) {
        return Double.isFinite(latDeg) && Double.isFinite(lngDeg)
                && latDeg >= -90.0d && latDeg <= 90.0d
                && lngDeg >= -180.0d && lngDeg <= 180.0d;
    }

    // query point sits at the origin of the projected plane
    private static double projectionFraction(double ax, double ay, double bx, double by) {
        double dx = bx - ax;
        double dy = by - ay;
        double lengthSquared = dx * dx + dy * dy;
        if (lengthSquared == 0.0d) {
            return 0.0d;
        }
        double t = -(ax * dx + ay * dy) / lengthSquared;
        return clamp(t, 0.0d, 1.0d);
    }

    private static double projectX(double lngDeg, double originLngDeg, double cosOriginLat) {
        return Math.toRadians(normalizeDeltaLongitudeDegrees(lngDeg - originLngDeg))
                * cosOriginLat * EARTH_MEAN_RADIUS_METERS;
    }

    private static double projectY(double latDeg, double originLatDeg) {
        return Math.toRadians(latDeg - originLatDeg) * EARTH_MEAN_RADIUS_METERS;
    }

    /**
     * Clamps a value into inclusive {@code [min, max]} bounds.
     */
    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
