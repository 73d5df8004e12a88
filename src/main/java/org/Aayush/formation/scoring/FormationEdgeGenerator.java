package org.Aayush.formation.scoring;

import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.trajectory.StoredNode;
import org.Aayush.formation.trajectory.TrajectoryNode;
import org.Aayush.formation.trajectory.TrajectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Generates node-level formation edges from a trajectory store.
 *
 * <p>Every stored node is visited in {@code (timestamp, flightId)} order and matched against its
 * spatio-temporal neighborhood. A node pair is emitted once, from the node whose flight id is
 * lexicographically smaller.</p>
 */
public final class FormationEdgeGenerator {
    private static final Logger log = LoggerFactory.getLogger(FormationEdgeGenerator.class);

    private final TrajectoryStore store;
    private final FeasibilityScorer scorer;

    public FormationEdgeGenerator(TrajectoryStore store, FeasibilityScorer scorer) {
        this.store = Objects.requireNonNull(store, "store");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    /**
     * Runs edge generation over the whole store.
     */
    public EdgeGenerationReport generate() {
        FeasibilityPolicy policy = scorer.policy();
        Map<String, List<TrajectoryNode>> trajectoryCache = new HashMap<>();
        List<StoredNode> nodes = store.nodesBetween(Long.MIN_VALUE, Long.MAX_VALUE);

        List<FormationEdge> edges = new ArrayList<>();
        long rejected = 0L;
        for (StoredNode stored : nodes) {
            TrajectoryNode node = stored.node();
            long t = node.epochSeconds();
            List<StoredNode> neighborhood = store.nearby(
                    node.point(),
                    policy.getMaxDistanceKm(),
                    t - policy.getMaxTimeSeconds(),
                    t + policy.getMaxTimeSeconds()
            );
            int limit = Math.min(neighborhood.size(), policy.getMaxCandidatesPerNode());
            rejected += neighborhood.size() - limit;

            OptionalDouble nodeHeading = OptionalDouble.empty();
            boolean nodeHeadingResolved = false;
            for (int i = 0; i < limit; i++) {
                StoredNode candidate = neighborhood.get(i);
                if (candidate.flightId().compareTo(stored.flightId()) <= 0) {
                    rejected++;
                    continue;
                }
                TrajectoryNode other = candidate.node();
                double distanceKm = GreatCircle.distanceKm(node.point(), other.point());
                long timeDifference = other.epochSeconds() - t;
                if (distanceKm > policy.getMaxDistanceKm() || Math.abs(timeDifference) > policy.getMaxTimeSeconds()) {
                    rejected++;
                    continue;
                }

                if (!nodeHeadingResolved) {
                    nodeHeading = nodeHeading(trajectoryCache, stored);
                    nodeHeadingResolved = true;
                }
                OptionalDouble candidateHeading = nodeHeading(trajectoryCache, candidate);
                OptionalDouble similarity = scorer.headingSimilarity(nodeHeading, candidateHeading);
                double score = scorer.score(distanceKm, timeDifference, nodeHeading, candidateHeading);
                if (!scorer.accepts(score)) {
                    rejected++;
                    continue;
                }

                edges.add(FormationEdge.builder()
                        .flightA(stored.flightId())
                        .flightB(candidate.flightId())
                        .nodeA(node)
                        .nodeB(other)
                        .distanceKm(distanceKm)
                        .timeDifferenceSeconds(timeDifference)
                        .headingA(nodeHeading)
                        .headingB(candidateHeading)
                        .headingSimilarity(similarity)
                        .feasibilityScore(score)
                        .build());
            }
        }

        edges.sort(Comparator.comparingDouble(FormationEdge::getFeasibilityScore).reversed());
        EdgeGenerationReport report = summarize(edges, nodes.size(), rejected);
        log.info(
                "Generated {} formation edges from {} nodes ({} candidates rejected)",
                report.edgesGenerated(),
                report.getNodesProcessed(),
                report.getCandidatesRejected()
        );
        return report;
    }

    /**
     * Heading of a node: toward the next node, else from the previous node, else unknown.
     */
    static OptionalDouble nodeHeading(List<TrajectoryNode> trajectory, int index) {
        if (index + 1 < trajectory.size()) {
            return OptionalDouble.of(GreatCircle.bearingDegrees(trajectory.get(index).point(), trajectory.get(index + 1).point()));
        }
        if (index > 0 && index < trajectory.size()) {
            return OptionalDouble.of(GreatCircle.bearingDegrees(trajectory.get(index - 1).point(), trajectory.get(index).point()));
        }
        return OptionalDouble.empty();
    }

    private OptionalDouble nodeHeading(Map<String, List<TrajectoryNode>> cache, StoredNode node) {
        if (!scorer.policy().isHeadingEnabled()) {
            return OptionalDouble.empty();
        }
        List<TrajectoryNode> trajectory = cache.computeIfAbsent(node.flightId(), store::trajectory);
        return nodeHeading(trajectory, node.index());
    }

    private static EdgeGenerationReport summarize(List<FormationEdge> edges, int nodesProcessed, long rejected) {
        double sum = 0.0d;
        double min = edges.isEmpty() ? 0.0d : Double.POSITIVE_INFINITY;
        double max = edges.isEmpty() ? 0.0d : Double.NEGATIVE_INFINITY;
        for (FormationEdge edge : edges) {
            double score = edge.getFeasibilityScore();
            sum += score;
            min = Math.min(min, score);
            max = Math.max(max, score);
        }
        return EdgeGenerationReport.builder()
                .edges(edges)
                .nodesProcessed(nodesProcessed)
                .candidatesRejected(rejected)
                .averageScore(edges.isEmpty() ? 0.0d : sum / edges.size())
                .minScore(min)
                .maxScore(max)
                .build();
    }
}
