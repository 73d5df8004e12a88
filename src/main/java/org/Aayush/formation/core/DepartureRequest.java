package org.Aayush.formation.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.formation.geometry.GeoPoint;

/**
 * Client-facing departure-time request.
 *
 * <p>Each endpoint is given either by coordinates or by an airport code resolved through the
 * engine's airport directory. Coordinates win when both are present.</p>
 */
@Value
@Builder
public class DepartureRequest {
    /** Origin airport code. */
    String originCode;
    /** Destination airport code. */
    String destinationCode;
    /** Explicit origin coordinates. */
    GeoPoint origin;
    /** Explicit destination coordinates. */
    GeoPoint destination;
    /** Scheduled departure (UTC epoch seconds). */
    long scheduledDepartureEpochSeconds;
    /** Block-time override in minutes; derived from distance at cruise speed when absent. */
    Double durationMinutes;
    /** Route distance override in kilometers, used only to derive the block time. */
    Double distanceKm;
}
