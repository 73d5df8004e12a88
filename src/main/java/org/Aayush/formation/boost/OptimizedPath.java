package org.Aayush.formation.boost;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Best path found for one flight against its available corridors.
 *
 * <p>The first waypoint is the departure and the last the arrival.</p>
 */
@Value
@Builder
public class OptimizedPath {
    String flightId;
    String routeLabel;
    String departureAirport;
    String arrivalAirport;
    /** Direct great-circle distance between the endpoints. */
    double originalDistanceKm;
    /** Sum of great-circle lengths between consecutive waypoints. */
    double optimizedDistanceKm;
    /** Speed-weighted cost of the chosen path. */
    double weightedTime;
    /** Never negative. */
    double timeSavingsMinutes;
    @Singular
    List<Waypoint> waypoints;
    @Singular
    List<BoostUsage> boostSegments;

    public int boostCount() {
        return boostSegments.size();
    }

    public boolean usesBoost() {
        return !boostSegments.isEmpty();
    }
}
