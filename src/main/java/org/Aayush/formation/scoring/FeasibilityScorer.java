package org.Aayush.formation.scoring;

import org.Aayush.formation.geometry.GreatCircle;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Converts a spatial/temporal/heading match between two trajectory nodes into a score in {@code [0, 1]}.
 *
 * <p>Without headings: {@code 0.5 * distance + 0.5 * time}. With both headings known and heading
 * scoring enabled: {@code 0.4 * distance + 0.4 * time + 0.2 * heading}. Stateless and thread-safe.</p>
 */
public final class FeasibilityScorer {
    private static final double METERS_PER_KM = 1_000.0d;

    private final FeasibilityPolicy policy;

    public FeasibilityScorer(FeasibilityPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
    }

    public FeasibilityPolicy policy() {
        return policy;
    }

    /**
     * Scores a node pair without heading information.
     */
    public double score(double distanceKm, long timeDifferenceSeconds) {
        return score(distanceKm, timeDifferenceSeconds, OptionalDouble.empty(), OptionalDouble.empty());
    }

    /**
     * Scores a node pair.
     *
     * @param distanceKm great-circle distance between the nodes.
     * @param timeDifferenceSeconds signed time difference, only the magnitude is used.
     * @param headingA heading of the first node, if known.
     * @param headingB heading of the second node, if known.
     * @return score in {@code [0, 1]}.
     */
    public double score(double distanceKm, long timeDifferenceSeconds, OptionalDouble headingA, OptionalDouble headingB) {
        double distanceScore = distanceScore(distanceKm);
        double timeScore = timeScore(timeDifferenceSeconds);
        OptionalDouble heading = headingSimilarity(headingA, headingB);
        if (heading.isPresent()) {
            return 0.4d * distanceScore + 0.4d * timeScore + 0.2d * heading.getAsDouble();
        }
        return 0.5d * distanceScore + 0.5d * timeScore;
    }

    double distanceScore(double distanceKm) {
        double distanceMeters = Math.abs(distanceKm) * METERS_PER_KM;
        return Math.max(0.0d, 1.0d - distanceMeters / (policy.getMaxDistanceKm() * METERS_PER_KM));
    }

    double timeScore(long timeDifferenceSeconds) {
        return Math.max(0.0d, 1.0d - Math.abs((double) timeDifferenceSeconds) / policy.getMaxTimeSeconds());
    }

    /**
     * Heading similarity in {@code [0, 1]}: 1 for identical headings, 0 for opposite ones.
     *
     * @return empty when heading scoring is disabled or either heading is unknown.
     */
    public OptionalDouble headingSimilarity(OptionalDouble headingA, OptionalDouble headingB) {
        if (!policy.isHeadingEnabled() || headingA.isEmpty() || headingB.isEmpty()) {
            return OptionalDouble.empty();
        }
        double diff = GreatCircle.headingDifferenceDegrees(headingA.getAsDouble(), headingB.getAsDouble());
        return OptionalDouble.of(Math.max(0.0d, 1.0d - diff / 180.0d));
    }

    /**
     * Returns whether a score passes the configured hard threshold.
     */
    public boolean accepts(double score) {
        return score >= policy.getMinScore();
    }
}
