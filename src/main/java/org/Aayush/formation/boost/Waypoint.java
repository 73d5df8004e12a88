package org.Aayush.formation.boost;

import org.Aayush.formation.geometry.GeoPoint;

/**
 * Tagged point of an optimized path.
 */
public record Waypoint(double lat, double lon, WaypointKind kind) {

    public static Waypoint of(GeoPoint point, WaypointKind kind) {
        return new Waypoint(point.lat(), point.lon(), kind);
    }

    public GeoPoint point() {
        return new GeoPoint(lat, lon);
    }
}
