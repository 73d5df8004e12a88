package org.Aayush.formation.boost;

import lombok.Builder;
import lombok.Value;
import org.Aayush.formation.config.PolicyProperties;

/**
 * Speeds, corridor sizing and solver limits for boost-zone path optimization.
 */
@Value
@Builder(toBuilder = true)
public class BoostPolicy {
    static final String PROP_BOOST_SPEED = PolicyProperties.PREFIX + "boost.boostSpeed";
    static final String PROP_MIN_SPAN_KM = PolicyProperties.PREFIX + "boost.minSpanKm";
    static final String PROP_MAX_CORRIDORS = PolicyProperties.PREFIX + "boost.maxCorridorsPerFlight";
    static final String PROP_CRUISE_KMH = PolicyProperties.PREFIX + "boost.cruiseSpeedKmh";
    static final String PROP_MAX_EVALUATIONS = PolicyProperties.PREFIX + "boost.solverMaxEvaluations";

    /** Relative speed outside corridors. */
    @Builder.Default
    double normalSpeed = 1.0d;

    /** Relative speed inside a corridor. */
    @Builder.Default
    double boostSpeed = 1.1d;

    /** Minimum distance flown inside a corridor once entered. */
    @Builder.Default
    double minSpanKm = 10.0d;

    /** Corridors considered per flight, highest efficiency first. */
    @Builder.Default
    int maxCorridorsPerFlight = 3;

    /** Cruise speed used to express weighted-distance savings as minutes. */
    @Builder.Default
    double cruiseSpeedKmh = 800.0d;

    /** Full length of a corridor centered on a chord crossing. */
    @Builder.Default
    double intersectingLengthKm = 400.0d;

    /** Share of the shorter route used as corridor length for similar pairs. */
    @Builder.Default
    double similarLengthFactor = 0.8d;

    /** Course angle at which corridor efficiency drops to zero. */
    @Builder.Default
    double efficiencyAngleScaleDegrees = 45.0d;

    /** Efficiency multiplier for corridors built from intersecting pairs. */
    @Builder.Default
    double intersectingEfficiencyBonus = 1.2d;

    /** Objective evaluations allowed per corridor solve. */
    @Builder.Default
    int solverMaxEvaluations = 2_000;

    /**
     * Built-in defaults with {@code formation.boost.*} system-property overrides.
     */
    public static BoostPolicy defaults() {
        BoostPolicy base = BoostPolicy.builder().build();
        return base.toBuilder()
                .boostSpeed(PolicyProperties.readDouble(PROP_BOOST_SPEED, base.boostSpeed))
                .minSpanKm(PolicyProperties.readDouble(PROP_MIN_SPAN_KM, base.minSpanKm))
                .maxCorridorsPerFlight(PolicyProperties.readInt(PROP_MAX_CORRIDORS, base.maxCorridorsPerFlight))
                .cruiseSpeedKmh(PolicyProperties.readDouble(PROP_CRUISE_KMH, base.cruiseSpeedKmh))
                .solverMaxEvaluations(PolicyProperties.readInt(PROP_MAX_EVALUATIONS, base.solverMaxEvaluations))
                .build()
                .validate();
    }

    /**
     * Fails fast on out-of-range values.
     *
     * @return this policy.
     */
    public BoostPolicy validate() {
        requirePositive("normalSpeed", normalSpeed);
        requirePositive("boostSpeed", boostSpeed);
        requirePositive("minSpanKm", minSpanKm);
        requirePositive("cruiseSpeedKmh", cruiseSpeedKmh);
        requirePositive("intersectingLengthKm", intersectingLengthKm);
        requirePositive("similarLengthFactor", similarLengthFactor);
        requirePositive("efficiencyAngleScaleDegrees", efficiencyAngleScaleDegrees);
        requirePositive("intersectingEfficiencyBonus", intersectingEfficiencyBonus);
        if (maxCorridorsPerFlight <= 0) {
            throw new IllegalArgumentException("maxCorridorsPerFlight must be > 0: " + maxCorridorsPerFlight);
        }
        if (solverMaxEvaluations <= 0) {
            throw new IllegalArgumentException("solverMaxEvaluations must be > 0: " + solverMaxEvaluations);
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0d) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite and > 0: " + value);
        }
    }
}
