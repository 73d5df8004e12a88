package org.Aayush.formation.following;

import lombok.Builder;
import lombok.Value;
import org.Aayush.formation.config.PolicyProperties;

import java.util.List;

/**
 * Tunables for the departure-offset sweep and the intercept/follow/leave search.
 */
@Value
@Builder(toBuilder = true)
public class FollowingPolicy {
    static final String PROP_EFFICIENCY_GAIN = PolicyProperties.PREFIX + "following.efficiencyGain";
    static final String PROP_MAX_DETOUR_KM = PolicyProperties.PREFIX + "following.maxDetourKm";
    static final String PROP_MAX_DIVERGENCE_KM = PolicyProperties.PREFIX + "following.maxDivergenceKm";
    static final String PROP_CRUISE_KMH = PolicyProperties.PREFIX + "following.cruiseSpeedKmh";
    static final String PROP_WINDOW_MINUTES = PolicyProperties.PREFIX + "following.candidateWindowMinutes";
    static final String PROP_MAX_CANDIDATES = PolicyProperties.PREFIX + "following.maxCandidates";

    /** Cost reduction while following, as a fraction of the followed distance. */
    @Builder.Default
    double efficiencyGain = 0.05d;

    /** Interception reach is twice this distance. */
    @Builder.Default
    double maxDetourKm = 200.0d;

    /** Allowed growth of distance-to-destination between consecutive followed nodes. */
    @Builder.Default
    double maxDivergenceKm = 100.0d;

    @Builder.Default
    double cruiseSpeedKmh = 800.0d;

    /** Departure offsets evaluated around the scheduled time, in minutes. */
    @Builder.Default
    List<Integer> offsetsMinutes = List.of(-60, -40, -20, 0, 20, 40, 60);

    /** Half-width of the window a partner's first node must fall in. */
    @Builder.Default
    int candidateWindowMinutes = 10;

    @Builder.Default
    double maxBearingDifferenceDegrees = 45.0d;

    @Builder.Default
    double maxInterceptionMinutes = 240.0d;

    /** Weight of the schedule mismatch term in the interception score. */
    @Builder.Default
    double interceptionTimeWeight = 0.1d;

    /** Partner flights examined per offset. */
    @Builder.Default
    int maxCandidates = 50;

    /** Spacing of synthesized path nodes. */
    @Builder.Default
    int nodeStepMinutes = 5;

    /**
     * Built-in defaults with {@code formation.following.*} system-property overrides.
     */
    public static FollowingPolicy defaults() {
        FollowingPolicy base = FollowingPolicy.builder().build();
        return base.toBuilder()
                .efficiencyGain(PolicyProperties.readDouble(PROP_EFFICIENCY_GAIN, base.efficiencyGain))
                .maxDetourKm(PolicyProperties.readDouble(PROP_MAX_DETOUR_KM, base.maxDetourKm))
                .maxDivergenceKm(PolicyProperties.readDouble(PROP_MAX_DIVERGENCE_KM, base.maxDivergenceKm))
                .cruiseSpeedKmh(PolicyProperties.readDouble(PROP_CRUISE_KMH, base.cruiseSpeedKmh))
                .candidateWindowMinutes(PolicyProperties.readInt(PROP_WINDOW_MINUTES, base.candidateWindowMinutes))
                .maxCandidates(PolicyProperties.readInt(PROP_MAX_CANDIDATES, base.maxCandidates))
                .build()
                .validate();
    }

    /**
     * Maximum distance from the origin to an interception node.
     */
    public double interceptionReachKm() {
        return maxDetourKm * 2.0d;
    }

    /**
     * Fails fast on out-of-range values.
     *
     * @return this policy.
     */
    public FollowingPolicy validate() {
        if (!(efficiencyGain >= 0.0d && efficiencyGain < 1.0d)) {
            throw new IllegalArgumentException("efficiencyGain must be in [0, 1): " + efficiencyGain);
        }
        requirePositive("maxDetourKm", maxDetourKm);
        requirePositive("maxDivergenceKm", maxDivergenceKm);
        requirePositive("cruiseSpeedKmh", cruiseSpeedKmh);
        requirePositive("maxInterceptionMinutes", maxInterceptionMinutes);
        if (!(maxBearingDifferenceDegrees >= 0.0d && maxBearingDifferenceDegrees <= 180.0d)) {
            throw new IllegalArgumentException(
                    "maxBearingDifferenceDegrees must be in [0, 180]: " + maxBearingDifferenceDegrees);
        }
        if (!(interceptionTimeWeight >= 0.0d) || !Double.isFinite(interceptionTimeWeight)) {
            throw new IllegalArgumentException("interceptionTimeWeight must be finite and >= 0: " + interceptionTimeWeight);
        }
        if (offsetsMinutes == null || offsetsMinutes.isEmpty()) {
            throw new IllegalArgumentException("offsetsMinutes must be non-empty");
        }
        if (candidateWindowMinutes < 0) {
            throw new IllegalArgumentException("candidateWindowMinutes must be >= 0: " + candidateWindowMinutes);
        }
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be > 0: " + maxCandidates);
        }
        if (nodeStepMinutes <= 0) {
            throw new IllegalArgumentException("nodeStepMinutes must be > 0: " + nodeStepMinutes);
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0d) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite and > 0: " + value);
        }
    }
}
