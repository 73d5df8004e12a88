package org.Aayush.formation.trajectory;

import org.Aayush.formation.geometry.GeoPoint;

/**
 * One sampled position of a flight.
 *
 * @param lat latitude in degrees.
 * @param lon longitude in degrees.
 * @param epochSeconds sample time (UTC epoch seconds).
 */
public record TrajectoryNode(double lat, double lon, long epochSeconds) {

    public GeoPoint point() {
        return new GeoPoint(lat, lon);
    }
}
