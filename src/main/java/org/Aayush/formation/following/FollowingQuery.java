package org.Aayush.formation.following;

import org.Aayush.formation.geometry.GeoPoint;

import java.util.Objects;

/**
 * Resolved departure-time query.
 *
 * @param originCode origin label.
 * @param origin origin coordinates.
 * @param destinationCode destination label.
 * @param destination destination coordinates.
 * @param scheduledDepartureEpochSeconds scheduled departure.
 * @param durationMinutes estimated block time, positive.
 */
public record FollowingQuery(
        String originCode,
        GeoPoint origin,
        String destinationCode,
        GeoPoint destination,
        long scheduledDepartureEpochSeconds,
        double durationMinutes
) {
    public FollowingQuery {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destination, "destination");
        if (!(durationMinutes > 0.0d) || !Double.isFinite(durationMinutes)) {
            throw new IllegalArgumentException("durationMinutes must be finite and > 0: " + durationMinutes);
        }
    }
}
