package org.Aayush.formation.trajectory;

import org.Aayush.formation.geometry.GeoPoint;

import java.util.Locale;

/**
 * Scheduled departure or arrival fix of a flight.
 *
 * @param airport airport code (IATA or ICAO), trimmed and upper-cased on construction.
 * @param lat airport latitude.
 * @param lon airport longitude.
 * @param epochSeconds scheduled time (UTC epoch seconds).
 */
public record FlightEndpoint(String airport, double lat, double lon, long epochSeconds) {

    public FlightEndpoint {
        if (airport != null) {
            airport = airport.trim().toUpperCase(Locale.ROOT);
        }
    }

    public GeoPoint point() {
        return new GeoPoint(lat, lon);
    }

    /**
     * Returns whether the fix carries an airport code and valid coordinates.
     */
    public boolean isResolvable() {
        return airport != null && !airport.isBlank() && GeoPoint.isValid(lat, lon);
    }
}
