package org.Aayush.formation.trajectory;

import lombok.experimental.UtilityClass;
import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.time.TimeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generates evenly timed trajectory nodes for straight legs.
 *
 * <p>Positions are linear in latitude/longitude, which is adequate for the short legs this is used
 * for (detours and continuations) and for endpoint-only flights. Legs that cross the antimeridian
 * are not unwrapped.</p>
 */
@UtilityClass
public class TrajectorySynthesizer {

    /**
     * Samples a straight leg at roughly {@code stepMinutes} spacing.
     *
     * <p>The first node is {@code from} at {@code departureEpochSec}; the last node is {@code to} at
     * departure plus duration. At least two nodes are produced.</p>
     *
     * @param from leg start.
     * @param to leg end.
     * @param departureEpochSec time at {@code from}.
     * @param durationMinutes leg duration, must be finite and non-negative.
     * @param stepMinutes nominal spacing, must be positive.
     * @return sampled nodes ordered by time.
     */
    public static List<TrajectoryNode> interpolate(
            GeoPoint from,
            GeoPoint to,
            long departureEpochSec,
            double durationMinutes,
            int stepMinutes
    ) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!Double.isFinite(durationMinutes) || durationMinutes < 0.0d) {
            throw new IllegalArgumentException("durationMinutes must be finite and >= 0: " + durationMinutes);
        }
        if (stepMinutes <= 0) {
            throw new IllegalArgumentException("stepMinutes must be > 0: " + stepMinutes);
        }

        int steps = Math.max(1, (int) Math.ceil(durationMinutes / stepMinutes));
        double durationSeconds = durationMinutes * TimeUtils.SECONDS_PER_MINUTE;
        List<TrajectoryNode> nodes = new ArrayList<>(steps + 1);
        for (int i = 0; i <= steps; i++) {
            double fraction = (double) i / steps;
            double lat = from.lat() + (to.lat() - from.lat()) * fraction;
            double lon = from.lon() + (to.lon() - from.lon()) * fraction;
            long epoch = departureEpochSec + Math.round(durationSeconds * fraction);
            nodes.add(new TrajectoryNode(lat, lon, epoch));
        }
        return nodes;
    }

    /**
     * Returns the flight's own nodes, or a synthesized endpoint-to-endpoint trajectory when it has none.
     *
     * @return trajectory ordered by time, empty when the flight has no nodes and a non-positive schedule.
     */
    public static List<TrajectoryNode> trajectoryOf(Flight flight, int stepMinutes) {
        Objects.requireNonNull(flight, "flight");
        if (flight.hasTrajectory()) {
            return flight.getNodes();
        }
        long durationSeconds = flight.scheduledDurationSeconds();
        if (durationSeconds <= 0L) {
            return List.of();
        }
        return interpolate(
                flight.departurePoint(),
                flight.arrivalPoint(),
                flight.getDeparture().epochSeconds(),
                durationSeconds / (double) TimeUtils.SECONDS_PER_MINUTE,
                stepMinutes
        );
    }
}
