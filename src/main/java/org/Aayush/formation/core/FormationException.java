package org.Aayush.formation.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Request-contract failure raised by {@link FormationEngine}.
 *
 * <p>Every failure carries one of the {@code FE_*} reason codes below. The message is prefixed with
 * the code in brackets so log lines stay greppable. Failures inside the optimizers themselves
 * (solver non-convergence, empty candidate sets) are not exceptions; they surface as empty or
 * unboosted results.</p>
 */
@Getter
public final class FormationException extends RuntimeException {

    // ========== Path optimization ==========

    /** {@code optimizePaths} was called with a null pair list. */
    public static final String REASON_PAIRS_REQUIRED = "FE_PAIRS_REQUIRED";

    // ========== Departure recommendation: request shape ==========

    /** {@code recommendDeparture} was called with a null request. */
    public static final String REASON_DEPARTURE_REQUEST_REQUIRED = "FE_DEPARTURE_REQUEST_REQUIRED";
    /** Neither origin coordinates nor an origin airport code were supplied. */
    public static final String REASON_ORIGIN_REQUIRED = "FE_ORIGIN_REQUIRED";
    /** Neither destination coordinates nor a destination airport code were supplied. */
    public static final String REASON_DESTINATION_REQUIRED = "FE_DESTINATION_REQUIRED";

    // ========== Departure recommendation: endpoint resolution ==========

    /** An airport code is not present in the bound airport directory. */
    public static final String REASON_UNKNOWN_AIRPORT = "FE_UNKNOWN_AIRPORT";
    /** Explicit coordinates are non-finite or outside latitude/longitude range. */
    public static final String REASON_INVALID_COORDINATES = "FE_INVALID_COORDINATES";
    /** Origin and destination resolve to the same point. */
    public static final String REASON_DEGENERATE_ROUTE = "FE_DEGENERATE_ROUTE";

    // ========== Departure recommendation: overrides ==========

    /** A duration override is non-finite or not positive. */
    public static final String REASON_INVALID_DURATION = "FE_INVALID_DURATION";
    /** A distance override is non-finite or not positive. */
    public static final String REASON_INVALID_DISTANCE = "FE_INVALID_DISTANCE";

    private final String reasonCode;

    /**
     * @param reasonCode one of the {@code FE_*} codes; must be non-blank.
     * @param message detail appended after the bracketed code.
     */
    public FormationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = reasonCode;
    }

    private static String formatMessage(String reasonCode, String message) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + reasonCode + "] " + Objects.requireNonNull(message, "message");
    }
}
