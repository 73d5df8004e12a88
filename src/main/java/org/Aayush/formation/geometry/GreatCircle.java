package org.Aayush.formation.geometry;

import lombok.experimental.UtilityClass;

/**
 * Spherical-earth helpers shared by pair discovery, corridor solving and flight following.
 *
 * <p>All distances are kilometers on a sphere of radius {@value #EARTH_RADIUS_KM} km; all
 * angles are degrees with 0 = north, increasing clockwise.</p>
 */
@UtilityClass
public class GreatCircle {
    public static final double EARTH_RADIUS_KM = 6_371.0d;

    /**
     * Computes great-circle distance in kilometers using haversine formulation.
     */
    public static double distanceKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
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
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceKm(GeoPoint from, GeoPoint to) {
        return distanceKm(from.lat(), from.lon(), to.lat(), to.lon());
    }

    /**
     * Initial bearing from point 1 toward point 2.
     *
     * @return bearing in {@code [0, 360)}.
     */
    public static double bearingDegrees(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLonRad = Math.toRadians(lon2Deg - lon1Deg);

        double y = Math.sin(deltaLonRad) * Math.cos(lat2Rad);
        double x = Math.cos(lat1Rad) * Math.sin(lat2Rad)
                - Math.sin(lat1Rad) * Math.cos(lat2Rad) * Math.cos(deltaLonRad);

        return normalizeBearing(Math.toDegrees(Math.atan2(y, x)));
    }

    public static double bearingDegrees(GeoPoint from, GeoPoint to) {
        return bearingDegrees(from.lat(), from.lon(), to.lat(), to.lon());
    }

    /**
     * Bearing halfway between two bearings along the shorter arc.
     *
     * <p>This is not the clockwise half-angle {@code ((b2 - b1 + 360) % 360) / 2 + b1}: for 350 and 10
     * it returns 0, not 180. For bearings exactly opposite the clockwise bisector is returned.</p>
     *
     * @return bisector bearing in {@code [0, 360)}.
     */
    public static double bisectorDegrees(double bearing1, double bearing2) {
        double diff = ((bearing2 - bearing1) % 360.0d + 360.0d) % 360.0d;
        if (diff > 180.0d) {
            diff -= 360.0d;
        }
        return normalizeBearing(bearing1 + diff / 2.0d);
    }

    /**
     * Forward geodesic projection from an origin along an initial bearing.
     *
     * @param origin start point.
     * @param bearingDeg initial bearing.
     * @param distanceKm travelled distance along the great circle (may be zero).
     * @return projected point with longitude normalized into {@code [-180, 180)}.
     */
    public static GeoPoint destinationPoint(GeoPoint origin, double bearingDeg, double distanceKm) {
        double latRad = Math.toRadians(origin.lat());
        double lonRad = Math.toRadians(origin.lon());
        double bearingRad = Math.toRadians(bearingDeg);
        double angular = distanceKm / EARTH_RADIUS_KM;

        double sinLat2 = Math.sin(latRad) * Math.cos(angular)
                + Math.cos(latRad) * Math.sin(angular) * Math.cos(bearingRad);
        double lat2Rad = Math.asin(clamp(sinLat2, -1.0d, 1.0d));
        double lon2Rad = lonRad + Math.atan2(
                Math.sin(bearingRad) * Math.sin(angular) * Math.cos(latRad),
                Math.cos(angular) - Math.sin(latRad) * Math.sin(lat2Rad)
        );

        return new GeoPoint(Math.toDegrees(lat2Rad), normalizeLongitude(Math.toDegrees(lon2Rad)));
    }

    /**
     * Absolute circular difference between two headings.
     *
     * @return difference in {@code [0, 180]}.
     */
    public static double headingDifferenceDegrees(double heading1, double heading2) {
        double diff = Math.abs(heading1 - heading2) % 360.0d;
        return diff > 180.0d ? 360.0d - diff : diff;
    }

    /**
     * Normalizes a bearing into {@code [0, 360)}.
     */
    public static double normalizeBearing(double bearingDeg) {
        double normalized = bearingDeg % 360.0d;
        if (normalized < 0.0d) {
            normalized += 360.0d;
        }
        // -1e-18 % 360 + 360 rounds to exactly 360.0
        return normalized >= 360.0d ? 0.0d : normalized;
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    /**
     * Normalizes an absolute longitude into {@code [-180, 180)}.
     */
    static double normalizeLongitude(double lonDeg) {
        double normalized = ((lonDeg + 180.0d) % 360.0d + 360.0d) % 360.0d - 180.0d;
        return normalized >= 180.0d ? -180.0d : normalized;
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
