package org.Aayush.formation.trajectory;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;

import java.util.List;

/**
 * Scheduled flight with an optional sampled trajectory.
 *
 * <p>When {@code nodes} is empty the flight is summarized by its endpoints only.</p>
 */
@Value
@Builder
public class Flight {
    /** Unique flight identifier. */
    String id;
    /** Display label such as a flight number. */
    String routeLabel;
    /** Scheduled departure fix. */
    FlightEndpoint departure;
    /** Scheduled arrival fix. */
    FlightEndpoint arrival;
    /** Sampled positions ordered by non-decreasing timestamp. */
    @Singular("node")
    List<TrajectoryNode> nodes;

    public GeoPoint departurePoint() {
        return departure.point();
    }

    public GeoPoint arrivalPoint() {
        return arrival.point();
    }

    /**
     * Great-circle distance between scheduled endpoints in kilometers.
     */
    public double routeDistanceKm() {
        return GreatCircle.distanceKm(departurePoint(), arrivalPoint());
    }

    /**
     * Scheduled block time in seconds (may be zero or negative for inconsistent schedules).
     */
    public long scheduledDurationSeconds() {
        return arrival.epochSeconds() - departure.epochSeconds();
    }

    public boolean hasTrajectory() {
        return !nodes.isEmpty();
    }

    public boolean sharesDepartureWith(Flight other) {
        return departure.airport().equals(other.departure.airport());
    }

    public boolean sharesArrivalWith(Flight other) {
        return arrival.airport().equals(other.arrival.airport());
    }
}
