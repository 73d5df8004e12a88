package org.Aayush.formation.geometry;

import java.util.Locale;

/**
 * Immutable geodetic position in decimal degrees.
 *
 * @param lat latitude in {@code [-90, 90]}.
 * @param lon longitude in {@code [-180, 180]}.
 */
public record GeoPoint(double lat, double lon) {
    private static final double MIN_LAT = -90.0d;
    private static final double MAX_LAT = 90.0d;
    private static final double MIN_LON = -180.0d;
    private static final double MAX_LON = 180.0d;

    public static GeoPoint of(double lat, double lon) {
        return new GeoPoint(lat, lon);
    }

    /**
     * Returns whether both coordinates are finite and inside geodetic bounds.
     */
    public boolean isValid() {
        return isValid(lat, lon);
    }

    /**
     * Validates a raw latitude/longitude pair without allocating.
     */
    public static boolean isValid(double lat, double lon) {
        return Double.isFinite(lat)
                && Double.isFinite(lon)
                && lat >= MIN_LAT && lat <= MAX_LAT
                && lon >= MIN_LON && lon <= MAX_LON;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.5f, %.5f)", lat, lon);
    }
}
