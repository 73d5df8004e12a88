package org.Aayush.formation.pairing;

import org.Aayush.formation.geometry.ChordIntersection;
import org.Aayush.formation.trajectory.Flight;

import java.util.Objects;
import java.util.Optional;

/**
 * Two flights close enough in space and time to share a formation stretch.
 *
 * @param kind pair classification.
 * @param flightA first flight (lower catalog handle).
 * @param flightB second flight.
 * @param angleDegrees non-negative angle between the two course vectors.
 * @param sharedEndpoint airport the flights share; {@code NONE} for intersecting pairs.
 * @param intersection chord crossing, present iff {@code kind == INTERSECTING}.
 */
public record CompatiblePair(
        PairKind kind,
        Flight flightA,
        Flight flightB,
        double angleDegrees,
        SharedEndpoint sharedEndpoint,
        Optional<ChordIntersection> intersection
) {
    public CompatiblePair {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(flightA, "flightA");
        Objects.requireNonNull(flightB, "flightB");
        Objects.requireNonNull(sharedEndpoint, "sharedEndpoint");
        Objects.requireNonNull(intersection, "intersection");
        if (!(angleDegrees >= 0.0d)) {
            throw new IllegalArgumentException("angleDegrees must be >= 0: " + angleDegrees);
        }
        if ((kind == PairKind.INTERSECTING) != intersection.isPresent()) {
            throw new IllegalArgumentException("intersection must be present iff kind is INTERSECTING");
        }
        if ((kind == PairKind.INTERSECTING) != (sharedEndpoint == SharedEndpoint.NONE)) {
            throw new IllegalArgumentException("kind " + kind + " is inconsistent with shared endpoint " + sharedEndpoint);
        }
    }

    public static CompatiblePair similar(Flight flightA, Flight flightB, double angleDegrees, SharedEndpoint shared) {
        return new CompatiblePair(PairKind.SIMILAR, flightA, flightB, angleDegrees, shared, Optional.empty());
    }

    public static CompatiblePair intersecting(Flight flightA, Flight flightB, double angleDegrees, ChordIntersection crossing) {
        return new CompatiblePair(
                PairKind.INTERSECTING,
                flightA,
                flightB,
                angleDegrees,
                SharedEndpoint.NONE,
                Optional.of(crossing)
        );
    }

    public boolean involves(String flightId) {
        return flightA.getId().equals(flightId) || flightB.getId().equals(flightId);
    }
}
