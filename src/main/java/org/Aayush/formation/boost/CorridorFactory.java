package org.Aayush.formation.boost;

import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.pairing.CompatiblePair;
import org.Aayush.formation.pairing.PairKind;
import org.Aayush.formation.pairing.SharedEndpoint;
import org.Aayush.formation.trajectory.Flight;

import java.util.Objects;

/**
 * Derives one boost corridor from each compatible pair.
 *
 * <p>Intersecting pairs get a fixed-length corridor centered on the chord crossing. Similar pairs
 * get a corridor starting at the shared airport whose length is a share of the shorter route.
 * In both cases the corridor follows the bisector of the two route bearings.</p>
 */
public final class CorridorFactory {
    private final BoostPolicy policy;

    public CorridorFactory(BoostPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
    }

    public BoostCorridor fromPair(CompatiblePair pair) {
        Objects.requireNonNull(pair, "pair");
        Flight a = pair.flightA();
        Flight b = pair.flightB();
        double bisector = GreatCircle.bisectorDegrees(
                GreatCircle.bearingDegrees(a.departurePoint(), a.arrivalPoint()),
                GreatCircle.bearingDegrees(b.departurePoint(), b.arrivalPoint())
        );

        GeoPoint start;
        double length;
        if (pair.kind() == PairKind.INTERSECTING) {
            GeoPoint center = pair.intersection().orElseThrow().point();
            length = policy.getIntersectingLengthKm();
            start = GreatCircle.destinationPoint(center, GreatCircle.normalizeBearing(bisector + 180.0d), length / 2.0d);
        } else {
            start = pair.sharedEndpoint() == SharedEndpoint.DEPARTURE ? a.departurePoint() : a.arrivalPoint();
            length = Math.min(a.routeDistanceKm(), b.routeDistanceKm()) * policy.getSimilarLengthFactor();
        }
        return new BoostCorridor(start, bisector, length, pair, efficiency(pair));
    }

    /**
     * {@code (1 - angle / scale) * bonus}, where the bonus applies to intersecting pairs only.
     */
    double efficiency(CompatiblePair pair) {
        double angleScore = 1.0d - pair.angleDegrees() / policy.getEfficiencyAngleScaleDegrees();
        double typeScore = pair.kind() == PairKind.INTERSECTING ? policy.getIntersectingEfficiencyBonus() : 1.0d;
        return angleScore * typeScore;
    }
}
