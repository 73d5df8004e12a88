package org.Aayush.formation.geometry;

import lombok.experimental.UtilityClass;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Route-chord helpers that treat longitude/latitude as planar Cartesian coordinates.
 *
 * <p>This is a local approximation. It is adequate for short and medium chords away from the
 * poles and the anti-meridian, and it is not a true geodesic intersection. Pair discovery keeps
 * it so that crossing times and corridor centers stay comparable with recorded fixtures.</p>
 */
@UtilityClass
public class ChordGeometry {
    static final double PARALLEL_EPSILON = 1e-10d;

    /**
     * Intersects chord {@code p1 -> p2} with chord {@code p3 -> p4}.
     *
     * @return crossing point with both interpolation parameters, or empty for parallel,
     *         near-parallel and non-overlapping chords.
     */
    public static Optional<ChordIntersection> segmentIntersection(
            GeoPoint p1,
            GeoPoint p2,
            GeoPoint p3,
            GeoPoint p4
    ) {
        double x1 = p1.lon();
        double y1 = p1.lat();
        double x2 = p2.lon();
        double y2 = p2.lat();
        double x3 = p3.lon();
        double y3 = p3.lat();
        double x4 = p4.lon();
        double y4 = p4.lat();

        double denominator = (x1 - x2) * (y3 - y4) - (y1 - y2) * (x3 - x4);
        if (Math.abs(denominator) < PARALLEL_EPSILON) {
            return Optional.empty();
        }

        double t = ((x1 - x3) * (y3 - y4) - (y1 - y3) * (x3 - x4)) / denominator;
        double u = -((x1 - x2) * (y1 - y3) - (y1 - y2) * (x1 - x3)) / denominator;
        if (t < 0.0d || t > 1.0d || u < 0.0d || u > 1.0d) {
            return Optional.empty();
        }

        GeoPoint crossing = new GeoPoint(y1 + t * (y2 - y1), x1 + t * (x2 - x1));
        return Optional.of(new ChordIntersection(crossing, t, u));
    }

    /**
     * Angle between two course vectors, each taken as {@code arrival - departure} in lat/lon.
     *
     * @return angle in {@code [0, 90]}, or empty when either vector has zero length or the
     *         courses point in opposing senses (negative dot product).
     */
    public static OptionalDouble angleBetween(
            GeoPoint departureA,
            GeoPoint arrivalA,
            GeoPoint departureB,
            GeoPoint arrivalB
    ) {
        double latA = arrivalA.lat() - departureA.lat();
        double lonA = arrivalA.lon() - departureA.lon();
        double latB = arrivalB.lat() - departureB.lat();
        double lonB = arrivalB.lon() - departureB.lon();

        double magnitudeA = Math.hypot(latA, lonA);
        double magnitudeB = Math.hypot(latB, lonB);
        if (magnitudeA == 0.0d || magnitudeB == 0.0d) {
            return OptionalDouble.empty();
        }

        double dot = latA * latB + lonA * lonB;
        if (dot < 0.0d) {
            return OptionalDouble.empty();
        }

        double cosine = Math.max(-1.0d, Math.min(1.0d, dot / (magnitudeA * magnitudeB)));
        return OptionalDouble.of(Math.toDegrees(Math.acos(cosine)));
    }
}
