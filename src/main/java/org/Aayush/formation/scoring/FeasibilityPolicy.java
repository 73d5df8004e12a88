package org.Aayush.formation.scoring;

import lombok.Builder;
import lombok.Value;
import org.Aayush.formation.config.PolicyProperties;

/**
 * Thresholds for node-pair feasibility scoring and edge generation.
 */
@Value
@Builder(toBuilder = true)
public class FeasibilityPolicy {
    static final String PROP_MAX_DISTANCE_KM = PolicyProperties.PREFIX + "feasibility.maxDistanceKm";
    static final String PROP_MAX_TIME_SECONDS = PolicyProperties.PREFIX + "feasibility.maxTimeSeconds";
    static final String PROP_HEADING_ENABLED = PolicyProperties.PREFIX + "feasibility.headingEnabled";
    static final String PROP_MIN_SCORE = PolicyProperties.PREFIX + "feasibility.minScore";
    static final String PROP_MAX_CANDIDATES = PolicyProperties.PREFIX + "feasibility.maxCandidatesPerNode";

    /** Spatial neighborhood radius. */
    @Builder.Default
    double maxDistanceKm = 50.0d;

    /** Temporal neighborhood half-width. */
    @Builder.Default
    long maxTimeSeconds = 600L;

    /** Whether node headings contribute to the score. */
    @Builder.Default
    boolean headingEnabled = true;

    /** Hard cut applied to generated edges; 0 keeps everything. */
    @Builder.Default
    double minScore = 0.0d;

    /** Store results considered per node during edge generation. */
    @Builder.Default
    int maxCandidatesPerNode = 100;

    /**
     * Built-in defaults with {@code formation.feasibility.*} system-property overrides.
     */
    public static FeasibilityPolicy defaults() {
        FeasibilityPolicy base = FeasibilityPolicy.builder().build();
        return FeasibilityPolicy.builder()
                .maxDistanceKm(PolicyProperties.readDouble(PROP_MAX_DISTANCE_KM, base.maxDistanceKm))
                .maxTimeSeconds(PolicyProperties.readLong(PROP_MAX_TIME_SECONDS, base.maxTimeSeconds))
                .headingEnabled(PolicyProperties.readBoolean(PROP_HEADING_ENABLED, base.headingEnabled))
                .minScore(PolicyProperties.readDouble(PROP_MIN_SCORE, base.minScore))
                .maxCandidatesPerNode(PolicyProperties.readInt(PROP_MAX_CANDIDATES, base.maxCandidatesPerNode))
                .build()
                .validate();
    }

    /**
     * Fails fast on out-of-range thresholds.
     *
     * @return this policy.
     */
    public FeasibilityPolicy validate() {
        if (!(maxDistanceKm > 0.0d) || !Double.isFinite(maxDistanceKm)) {
            throw new IllegalArgumentException("maxDistanceKm must be finite and > 0: " + maxDistanceKm);
        }
        if (maxTimeSeconds <= 0L) {
            throw new IllegalArgumentException("maxTimeSeconds must be > 0: " + maxTimeSeconds);
        }
        if (!(minScore >= 0.0d && minScore <= 1.0d)) {
            throw new IllegalArgumentException("minScore must be in [0, 1]: " + minScore);
        }
        if (maxCandidatesPerNode <= 0) {
            throw new IllegalArgumentException("maxCandidatesPerNode must be > 0: " + maxCandidatesPerNode);
        }
        return this;
    }
}
