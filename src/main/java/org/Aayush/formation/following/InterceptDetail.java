package org.Aayush.formation.following;

import org.Aayush.formation.trajectory.TrajectoryNode;

/**
 * Where a followed partner is joined and left.
 *
 * @param interceptIndex partner node index where formation starts (never 0).
 * @param departureIndex partner node index where formation ends.
 * @param interceptNode partner node at {@code interceptIndex}.
 * @param leaveNode partner node at {@code departureIndex}.
 * @param partnerFlightId followed flight.
 * @param followingDistanceKm distance flown in formation.
 * @param segmentCostSolo cost of the followed stretch flown solo.
 * @param segmentCostConnected cost of the followed stretch in formation.
 * @param savings {@code segmentCostSolo - segmentCostConnected}.
 */
public record InterceptDetail(
        int interceptIndex,
        int departureIndex,
        TrajectoryNode interceptNode,
        TrajectoryNode leaveNode,
        String partnerFlightId,
        double followingDistanceKm,
        double segmentCostSolo,
        double segmentCostConnected,
        double savings
) {
}
