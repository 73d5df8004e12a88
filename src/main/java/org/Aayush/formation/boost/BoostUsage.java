package org.Aayush.formation.boost;

import org.Aayush.formation.geometry.GeoPoint;

/**
 * One corridor stretch used by an optimized path.
 *
 * @param corridorIndex index of the corridor in the list offered to the flight.
 * @param entry entry point.
 * @param exit exit point.
 * @param entryDistanceKm entry position along the corridor.
 * @param exitDistanceKm exit position along the corridor.
 * @param distanceInBoostKm great-circle distance flown inside the corridor.
 * @param bearingDegrees corridor bearing.
 */
public record BoostUsage(
        int corridorIndex,
        GeoPoint entry,
        GeoPoint exit,
        double entryDistanceKm,
        double exitDistanceKm,
        double distanceInBoostKm,
        double bearingDegrees
) {
}
