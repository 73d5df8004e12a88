package org.Aayush.formation.boost;

import org.Aayush.formation.geometry.GeoPoint;

/**
 * Solved entry and exit on one corridor for a given origin and destination.
 *
 * @param entryDistanceKm entry position along the corridor.
 * @param exitDistanceKm exit position along the corridor.
 * @param entry entry point.
 * @param exit exit point.
 * @param weightedTime speed-weighted cost of origin to entry to exit to destination.
 */
public record CorridorTraversal(
        double entryDistanceKm,
        double exitDistanceKm,
        GeoPoint entry,
        GeoPoint exit,
        double weightedTime
) {
    public double boostedDistanceKm() {
        return exitDistanceKm - entryDistanceKm;
    }
}
