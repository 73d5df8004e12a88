package org.Aayush.formation.following;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating one departure time.
 *
 * <p>A result without a followed flight is a direct path with zero savings.</p>
 */
public record FollowingResult(
        long departureEpochSeconds,
        Optional<String> followedFlightId,
        List<PathNode> pathNodes,
        CostAnalysis costAnalysis,
        Optional<InterceptDetail> interceptDetail
) {
    public FollowingResult {
        Objects.requireNonNull(followedFlightId, "followedFlightId");
        Objects.requireNonNull(costAnalysis, "costAnalysis");
        Objects.requireNonNull(interceptDetail, "interceptDetail");
        pathNodes = List.copyOf(pathNodes);
        if (followedFlightId.isEmpty() && costAnalysis.savings() != 0.0d) {
            throw new IllegalArgumentException("direct result must have zero savings");
        }
        if (followedFlightId.isPresent() != interceptDetail.isPresent()) {
            throw new IllegalArgumentException("intercept detail must accompany a followed flight");
        }
    }

    public boolean isFollowing() {
        return followedFlightId.isPresent();
    }
}
