package org.Aayush.formation.pairing;

import lombok.Builder;
import lombok.Value;
import org.Aayush.formation.config.PolicyProperties;

/**
 * Thresholds for candidate pair classification.
 */
@Value
@Builder(toBuilder = true)
public class PairingPolicy {
    static final String PROP_SIMILAR_ANGLE = PolicyProperties.PREFIX + "pairing.maxSimilarAngleDegrees";
    static final String PROP_INTERSECTING_ANGLE = PolicyProperties.PREFIX + "pairing.maxIntersectingAngleDegrees";
    static final String PROP_SIMILAR_MINUTES = PolicyProperties.PREFIX + "pairing.maxSimilarTimeMinutes";
    static final String PROP_INTERSECTION_SECONDS = PolicyProperties.PREFIX + "pairing.maxIntersectionTimeSeconds";

    @Builder.Default
    double maxSimilarAngleDegrees = 45.0d;

    @Builder.Default
    double maxIntersectingAngleDegrees = 10.0d;

    /** Wall-clock window for shared-airport schedules, wrapping at midnight. */
    @Builder.Default
    int maxSimilarTimeMinutes = 180;

    /** Maximum gap between the two flights' passage times at the crossing. */
    @Builder.Default
    long maxIntersectionTimeSeconds = 3_600L;

    /**
     * Built-in defaults with {@code formation.pairing.*} system-property overrides.
     */
    public static PairingPolicy defaults() {
        PairingPolicy base = PairingPolicy.builder().build();
        return PairingPolicy.builder()
                .maxSimilarAngleDegrees(PolicyProperties.readDouble(PROP_SIMILAR_ANGLE, base.maxSimilarAngleDegrees))
                .maxIntersectingAngleDegrees(
                        PolicyProperties.readDouble(PROP_INTERSECTING_ANGLE, base.maxIntersectingAngleDegrees))
                .maxSimilarTimeMinutes(PolicyProperties.readInt(PROP_SIMILAR_MINUTES, base.maxSimilarTimeMinutes))
                .maxIntersectionTimeSeconds(
                        PolicyProperties.readLong(PROP_INTERSECTION_SECONDS, base.maxIntersectionTimeSeconds))
                .build()
                .validate();
    }

    /**
     * Fails fast on out-of-range thresholds.
     *
     * @return this policy.
     */
    public PairingPolicy validate() {
        requireAngle("maxSimilarAngleDegrees", maxSimilarAngleDegrees);
        requireAngle("maxIntersectingAngleDegrees", maxIntersectingAngleDegrees);
        if (maxSimilarTimeMinutes < 0 || maxSimilarTimeMinutes > 720) {
            throw new IllegalArgumentException("maxSimilarTimeMinutes must be in [0, 720]: " + maxSimilarTimeMinutes);
        }
        if (maxIntersectionTimeSeconds < 0L) {
            throw new IllegalArgumentException("maxIntersectionTimeSeconds must be >= 0: " + maxIntersectionTimeSeconds);
        }
        return this;
    }

    private static void requireAngle(String name, double value) {
        if (!(value >= 0.0d && value <= 180.0d)) {
            throw new IllegalArgumentException(name + " must be in [0, 180]: " + value);
        }
    }
}
