package org.Aayush.formation.following;

import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.time.TimeUtils;
import org.Aayush.formation.trajectory.StoredNode;
import org.Aayush.formation.trajectory.TrajectoryNode;
import org.Aayush.formation.trajectory.TrajectoryStore;
import org.Aayush.formation.trajectory.TrajectorySynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Recommends a departure time by intercepting, following and leaving an already scheduled flight.
 *
 * <p>For every departure offset the optimizer looks for partner flights that took off within the
 * candidate window and head roughly the same way, joins the best reachable partner node, follows
 * the partner until it starts to diverge from the destination, then flies direct. Following costs
 * {@code 1 - efficiencyGain} per kilometer. Stateless; concurrent calls share only the read-only store.</p>
 */
public final class FlightFollowingOptimizer {
    private static final Logger log = LoggerFactory.getLogger(FlightFollowingOptimizer.class);

    private final TrajectoryStore store;
    private final FollowingPolicy policy;

    public FlightFollowingOptimizer(TrajectoryStore store, FollowingPolicy policy) {
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy").validate();
    }

    /**
     * Sweeps all configured offsets and picks the cheapest departure with positive savings.
     *
     * <p>When no offset yields savings the scheduled time with the direct path is recommended.</p>
     */
    public DepartureRecommendation optimize(FollowingQuery query) {
        Objects.requireNonNull(query, "query");
        long scheduled = query.scheduledDepartureEpochSeconds();

        Map<Integer, FollowingResult> evaluations = new LinkedHashMap<>();
        FollowingResult best = null;
        int bestOffset = 0;
        for (int offset : policy.getOffsetsMinutes()) {
            FollowingResult result = evaluate(query, TimeUtils.addMinutes(scheduled, offset));
            evaluations.put(offset, result);
            CostAnalysis cost = result.costAnalysis();
            log.debug("Offset {} min: total cost {} ({}% savings)", offset, cost.totalCost(), cost.savingsPercent());
            if (cost.savingsPercent() > 0.0d && (best == null || cost.totalCost() < best.costAnalysis().totalCost())) {
                best = result;
                bestOffset = offset;
            }
        }

        if (best == null) {
            bestOffset = 0;
            best = evaluations.containsKey(0) ? evaluations.get(0) : direct(query, scheduled);
        }

        double costSum = 0.0d;
        double savingsSum = 0.0d;
        for (FollowingResult result : evaluations.values()) {
            costSum += result.costAnalysis().totalCost();
            savingsSum += result.costAnalysis().savings();
        }
        double averageCost = costSum / evaluations.size();
        double averageSavings = savingsSum / evaluations.size();
        double reduction = averageCost > 0.0d
                ? (averageCost - best.costAnalysis().totalCost()) / averageCost * 100.0d
                : 0.0d;

        List<TrajectoryNode> partnerPath = best.followedFlightId().map(store::trajectory).orElse(List.of());
        DepartureRecommendation recommendation = DepartureRecommendation.builder()
                .originCode(query.originCode())
                .destinationCode(query.destinationCode())
                .scheduledDepartureEpochSeconds(scheduled)
                .optimalDepartureEpochSeconds(TimeUtils.addMinutes(scheduled, bestOffset))
                .offsetMinutes(bestOffset)
                .optimal(best)
                .originalPath(direct(query, scheduled).pathNodes())
                .partnerPath(partnerPath)
                .evaluations(evaluations)
                .averageCost(averageCost)
                .averageSavings(averageSavings)
                .costReductionVsAverage(reduction)
                .build();

        log.info(
                "Departure {}->{}: offset {} min, following {}, savings {}%",
                query.originCode(),
                query.destinationCode(),
                bestOffset,
                best.followedFlightId().orElse("none"),
                best.costAnalysis().savingsPercent()
        );
        return recommendation;
    }

    /**
     * Evaluates one departure time against all eligible partners.
     *
     * @return the cheapest following result with positive savings, else the direct path.
     */
    public FollowingResult evaluate(FollowingQuery query, long departureEpochSec) {
        Objects.requireNonNull(query, "query");
        double routeBearing = GreatCircle.bearingDegrees(query.origin(), query.destination());
        FollowingResult best = null;
        for (Partner partner : findCandidates(departureEpochSec, routeBearing)) {
            Optional<FollowingResult> result = followPartner(query, departureEpochSec, partner);
            if (result.isEmpty()) {
                continue;
            }
            CostAnalysis cost = result.get().costAnalysis();
            if (cost.savingsPercent() > 0.0d && (best == null || cost.totalCost() < best.costAnalysis().totalCost())) {
                best = result.get();
            }
        }
        return best != null ? best : direct(query, departureEpochSec);
    }

    /**
     * Partners whose first node lies within the candidate window of {@code departureEpochSec}, that
     * have at least two nodes, and whose first-to-last bearing is close to the route bearing.
     */
    List<Partner> findCandidates(long departureEpochSec, double routeBearing) {
        long window = policy.getCandidateWindowMinutes() * TimeUtils.SECONDS_PER_MINUTE;
        List<StoredNode> inWindow = store.nodesBetween(departureEpochSec - window, departureEpochSec + window);

        List<String> started = new ArrayList<>();
        for (StoredNode node : inWindow) {
            if (node.index() == 0 && !started.contains(node.flightId())) {
                started.add(node.flightId());
                if (started.size() >= policy.getMaxCandidates()) {
                    break;
                }
            }
        }

        List<Partner> partners = new ArrayList<>(started.size());
        for (String flightId : started) {
            List<TrajectoryNode> nodes = store.trajectory(flightId);
            if (nodes.size() < 2) {
                continue;
            }
            double bearing = GreatCircle.bearingDegrees(nodes.get(0).point(), nodes.get(nodes.size() - 1).point());
            if (GreatCircle.headingDifferenceDegrees(bearing, routeBearing) <= policy.getMaxBearingDifferenceDegrees()) {
                partners.add(new Partner(flightId, nodes));
            }
        }
        return partners;
    }

    /**
     * Best partner node to join, never the partner's first node.
     *
     * <p>Nodes beyond the interception reach, in the past, or more than the interception limit ahead
     * are skipped. The score is {@code distance + weight * |minutesToNode - distance / cruise * 60|}.</p>
     */
    OptionalInt findInterceptPoint(GeoPoint origin, List<TrajectoryNode> nodes, long departureEpochSec) {
        int bestIndex = -1;
        double bestScore = Double.POSITIVE_INFINITY;
        for (int i = 1; i < nodes.size(); i++) {
            TrajectoryNode node = nodes.get(i);
            double distance = GreatCircle.distanceKm(origin, node.point());
            if (distance > policy.interceptionReachKm()) {
                continue;
            }
            double minutesToNode = TimeUtils.minutesBetween(departureEpochSec, node.epochSeconds());
            if (minutesToNode < 0.0d || minutesToNode > policy.getMaxInterceptionMinutes()) {
                continue;
            }
            double flyMinutes = distance / policy.getCruiseSpeedKmh() * 60.0d;
            double score = distance + policy.getInterceptionTimeWeight() * Math.abs(minutesToNode - flyMinutes);
            if (score < bestScore) {
                bestScore = score;
                bestIndex = i;
            }
        }
        return bestIndex < 0 ? OptionalInt.empty() : OptionalInt.of(bestIndex);
    }

    /**
     * Index at which to leave the partner: the node before the first step whose distance to the
     * destination grows by more than the divergence limit, else the partner's last node.
     */
    int findDeparturePoint(List<TrajectoryNode> nodes, int interceptIndex, GeoPoint destination) {
        double previous = GreatCircle.distanceKm(nodes.get(interceptIndex).point(), destination);
        for (int i = interceptIndex + 1; i < nodes.size(); i++) {
            double current = GreatCircle.distanceKm(nodes.get(i).point(), destination);
            if (current > previous + policy.getMaxDivergenceKm()) {
                return i - 1;
            }
            previous = current;
        }
        return nodes.size() - 1;
    }

    private Optional<FollowingResult> followPartner(FollowingQuery query, long departureEpochSec, Partner partner) {
        List<TrajectoryNode> nodes = partner.nodes();
        OptionalInt intercept = findInterceptPoint(query.origin(), nodes, departureEpochSec);
        if (intercept.isEmpty()) {
            return Optional.empty();
        }
        int interceptIndex = intercept.getAsInt();
        int leaveIndex = findDeparturePoint(nodes, interceptIndex, query.destination());
        TrajectoryNode interceptNode = nodes.get(interceptIndex);
        TrajectoryNode leaveNode = nodes.get(leaveIndex);

        double detour = GreatCircle.distanceKm(query.origin(), interceptNode.point());
        double following = 0.0d;
        for (int i = interceptIndex; i < leaveIndex; i++) {
            following += GreatCircle.distanceKm(nodes.get(i).point(), nodes.get(i + 1).point());
        }
        double continuation = GreatCircle.distanceKm(leaveNode.point(), query.destination());
        double connectedCost = following * (1.0d - policy.getEfficiencyGain());
        double total = detour + connectedCost + continuation;
        double solo = GreatCircle.distanceKm(query.origin(), query.destination());
        double savings = solo - total;
        double savingsPercent = solo > 0.0d ? savings / solo * 100.0d : 0.0d;
        if (!(savingsPercent > 0.0d)) {
            return Optional.empty();
        }

        List<TrajectoryNode> raw = new ArrayList<>();
        List<Boolean> followingFlags = new ArrayList<>();
        List<TrajectoryNode> detourNodes = TrajectorySynthesizer.interpolate(
                query.origin(),
                interceptNode.point(),
                departureEpochSec,
                TimeUtils.minutesBetween(departureEpochSec, interceptNode.epochSeconds()),
                policy.getNodeStepMinutes()
        );
        for (int i = 0; i < detourNodes.size() - 1; i++) {
            raw.add(detourNodes.get(i));
            followingFlags.add(Boolean.FALSE);
        }
        for (int i = interceptIndex; i <= leaveIndex; i++) {
            raw.add(nodes.get(i));
            followingFlags.add(Boolean.TRUE);
        }
        List<TrajectoryNode> continuationNodes = TrajectorySynthesizer.interpolate(
                leaveNode.point(),
                query.destination(),
                leaveNode.epochSeconds(),
                continuation / policy.getCruiseSpeedKmh() * 60.0d,
                policy.getNodeStepMinutes()
        );
        for (int i = 1; i < continuationNodes.size(); i++) {
            raw.add(continuationNodes.get(i));
            followingFlags.add(Boolean.FALSE);
        }

        List<PathNode> path = toPathNodes(raw, followingFlags);
        CostAnalysis cost = new CostAnalysis(
                solo,
                total,
                savings,
                savingsPercent,
                path.size() - 1,
                leaveIndex - interceptIndex
        );
        InterceptDetail detail = new InterceptDetail(
                interceptIndex,
                leaveIndex,
                interceptNode,
                leaveNode,
                partner.flightId(),
                following,
                following,
                connectedCost,
                following - connectedCost
        );
        return Optional.of(new FollowingResult(
                departureEpochSec,
                Optional.of(partner.flightId()),
                path,
                cost,
                Optional.of(detail)
        ));
    }

    private FollowingResult direct(FollowingQuery query, long departureEpochSec) {
        List<TrajectoryNode> raw = TrajectorySynthesizer.interpolate(
                query.origin(),
                query.destination(),
                departureEpochSec,
                query.durationMinutes(),
                policy.getNodeStepMinutes()
        );
        List<Boolean> flags = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            flags.add(Boolean.FALSE);
        }
        List<PathNode> path = toPathNodes(raw, flags);
        double solo = GreatCircle.distanceKm(query.origin(), query.destination());
        return new FollowingResult(
                departureEpochSec,
                Optional.empty(),
                path,
                CostAnalysis.direct(solo, path.size() - 1),
                Optional.empty()
        );
    }

    private static List<PathNode> toPathNodes(List<TrajectoryNode> raw, List<Boolean> following) {
        List<PathNode> path = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            TrajectoryNode node = raw.get(i);
            double segment = i + 1 < raw.size() ? GreatCircle.distanceKm(node.point(), raw.get(i + 1).point()) : 0.0d;
            path.add(new PathNode(node.lat(), node.lon(), node.epochSeconds(), i, segment, following.get(i)));
        }
        return path;
    }

    /**
     * Eligible flight to follow.
     */
    record Partner(String flightId, List<TrajectoryNode> nodes) {
    }
}
