package org.Aayush.formation.boost;

import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.pairing.CompatiblePair;

import java.util.Objects;

/**
 * Straight geodesic stretch where formation flight is cheaper than solo flight.
 *
 * @param start corridor start point.
 * @param bearingDegrees initial bearing from {@code start}.
 * @param lengthKm corridor length.
 * @param sourcePair pair the corridor was derived from.
 * @param efficiencyScore ranking score, higher is better.
 */
public record BoostCorridor(
        GeoPoint start,
        double bearingDegrees,
        double lengthKm,
        CompatiblePair sourcePair,
        double efficiencyScore
) {
    public BoostCorridor {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(sourcePair, "sourcePair");
        if (!(lengthKm >= 0.0d) || !Double.isFinite(lengthKm)) {
            throw new IllegalArgumentException("lengthKm must be finite and >= 0: " + lengthKm);
        }
    }

    /**
     * Point at {@code distanceKm} along the corridor.
     */
    public GeoPoint pointAt(double distanceKm) {
        return GreatCircle.destinationPoint(start, bearingDegrees, distanceKm);
    }

    public GeoPoint end() {
        return pointAt(lengthKm);
    }
}
