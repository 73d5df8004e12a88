package org.Aayush.formation.following;

import lombok.Builder;
import lombok.Value;
import org.Aayush.formation.trajectory.TrajectoryNode;

import java.util.List;
import java.util.Map;

/**
 * Recommended departure for one route together with the data needed to display it.
 */
@Value
@Builder
public class DepartureRecommendation {
    String originCode;
    String destinationCode;
    long scheduledDepartureEpochSeconds;
    long optimalDepartureEpochSeconds;
    /** {@code optimal - scheduled}, in minutes. */
    long offsetMinutes;
    FollowingResult optimal;
    /** Direct path at the scheduled time. */
    List<PathNode> originalPath;
    /** Trajectory of the followed flight, empty when none is followed. */
    List<TrajectoryNode> partnerPath;
    /** Every evaluated offset in evaluation order. */
    Map<Integer, FollowingResult> evaluations;
    double averageCost;
    double averageSavings;
    /** Percent by which the optimal cost undercuts the average evaluated cost. */
    double costReductionVsAverage;

    public double connectionRate() {
        return optimal.costAnalysis().connectionRate();
    }
}
