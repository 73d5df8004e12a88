package org.Aayush.formation.following;

import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.trajectory.InMemoryTrajectoryStore;
import org.Aayush.formation.trajectory.TrajectoryNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.Aayush.formation.testutil.FlightFixtures.BASE_EPOCH;
import static org.Aayush.formation.testutil.FlightFixtures.MINUTE;
import static org.Aayush.formation.testutil.FlightFixtures.equatorTrack;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Flight-following departure optimizer")
class FlightFollowingOptimizerTest {
    private static final GeoPoint ORIGIN = GeoPoint.of(0.0d, 0.0d);
    private static final GeoPoint DESTINATION = GeoPoint.of(0.0d, 9.0d);
    /** 0.6 degrees of longitude on the equator. */
    private static final double STEP_KM = GreatCircle.distanceKm(0.0d, 0.0d, 0.0d, 0.6d);

    private static FollowingQuery query() {
        return new FollowingQuery("ORG", ORIGIN, "DST", DESTINATION, BASE_EPOCH, 75.0d);
    }

    /** Eastbound partner from the origin to the destination, one node every 5 minutes. */
    private static List<TrajectoryNode> eastboundPartner(long startEpoch) {
        return equatorTrack(0.0d, 0.6d, 16, startEpoch, 5 * MINUTE);
    }

    private static FlightFollowingOptimizer optimizer(InMemoryTrajectoryStore store) {
        return new FlightFollowingOptimizer(store, FollowingPolicy.builder().build());
    }

    @Nested
    @DisplayName("Departure sweep")
    class Sweep {

        @Test
        @DisplayName("Partner departing on schedule is followed from its second node to the destination")
        void testFollowOnSchedule() {
            InMemoryTrajectoryStore store = InMemoryTrajectoryStore.builder()
                    .flight("P1", eastboundPartner(BASE_EPOCH))
                    .build();

            DepartureRecommendation recommendation = optimizer(store).optimize(query());
            FollowingResult optimal = recommendation.getOptimal();
            CostAnalysis cost = optimal.costAnalysis();
            InterceptDetail detail = optimal.interceptDetail().orElseThrow();

            double solo = GreatCircle.distanceKm(ORIGIN, DESTINATION);
            double following = 14 * STEP_KM;
            assertEquals(0L, recommendation.getOffsetMinutes());
            assertEquals(BASE_EPOCH, recommendation.getOptimalDepartureEpochSeconds());
            assertEquals(Optional.of("P1"), optimal.followedFlightId());
            assertEquals(1, detail.interceptIndex());
            assertEquals(15, detail.departureIndex());
            assertEquals(following, detail.followingDistanceKm(), 1e-6);
            assertEquals(solo, cost.soloCost(), 1e-9);
            assertEquals(0.05d * following, cost.savings(), 1e-6);
            assertEquals(cost.savings() / solo * 100.0d, cost.savingsPercent(), 1e-9);
            assertEquals(14, cost.connectedSegments());

            List<PathNode> path = optimal.pathNodes();
            assertEquals(17, path.size());
            assertEquals(16, cost.totalSegments());
            assertFalse(path.get(0).following());
            assertFalse(path.get(16).following());
            for (int i = 1; i <= 15; i++) {
                assertTrue(path.get(i).following());
                assertEquals(i, path.get(i).timeIndex());
            }
            double flown = path.stream().mapToDouble(PathNode::segmentDistanceKm).sum();
            assertEquals(solo, flown, 1e-6);
            assertEquals(0.0d, path.get(16).segmentDistanceKm(), 0.0d);

            assertEquals(16, recommendation.getPartnerPath().size());
            assertEquals(7, recommendation.getEvaluations().size());
            assertEquals(14.0d * 100.0d / 16.0d, recommendation.connectionRate(), 1e-9);
            assertTrue(recommendation.getCostReductionVsAverage() > 0.0d);
        }

        @Test
        @DisplayName("Later partner moves the recommended departure to the matching offset")
        void testFollowAtLaterOffset() {
            InMemoryTrajectoryStore store = InMemoryTrajectoryStore.builder()
                    .flight("LATE", eastboundPartner(BASE_EPOCH + 15 * MINUTE))
                    .build();

            DepartureRecommendation recommendation = optimizer(store).optimize(query());

            assertEquals(20L, recommendation.getOffsetMinutes());
            assertEquals(BASE_EPOCH + 20 * MINUTE, recommendation.getOptimalDepartureEpochSeconds());
            assertEquals(Optional.of("LATE"), recommendation.getOptimal().followedFlightId());
            assertFalse(recommendation.getEvaluations().get(0).isFollowing());
        }

        @Test
        @DisplayName("No eligible partner keeps the scheduled departure and the direct path")
        void testNoCandidates() {
            DepartureRecommendation recommendation = optimizer(InMemoryTrajectoryStore.builder().build()).optimize(query());
            FollowingResult optimal = recommendation.getOptimal();

            assertEquals(BASE_EPOCH, recommendation.getOptimalDepartureEpochSeconds());
            assertEquals(0L, recommendation.getOffsetMinutes());
            assertTrue(optimal.followedFlightId().isEmpty());
            assertTrue(optimal.interceptDetail().isEmpty());
            assertEquals(0.0d, optimal.costAnalysis().savingsPercent(), 0.0d);
            assertEquals(0.0d, optimal.costAnalysis().connectionRate(), 0.0d);
            assertEquals(7, recommendation.getEvaluations().size());
            assertEquals(0.0d, recommendation.getCostReductionVsAverage(), 1e-9);
            assertEquals(0.0d, recommendation.getAverageSavings(), 0.0d);
            assertTrue(recommendation.getPartnerPath().isEmpty());
            // 75 minutes at 5-minute spacing
            assertEquals(16, optimal.pathNodes().size());
            assertEquals(recommendation.getOriginalPath(), optimal.pathNodes());
        }

        @Test
        @DisplayName("Opposite-heading partner is never followed")
        void testOppositeHeadingIgnored() {
            InMemoryTrajectoryStore store = InMemoryTrajectoryStore.builder()
                    .flight("WEST", equatorTrack(9.0d, -0.6d, 16, BASE_EPOCH, 5 * MINUTE))
                    .build();

            DepartureRecommendation recommendation = optimizer(store).optimize(query());
            assertFalse(recommendation.getOptimal().isFollowing());
        }

        @Test
        @DisplayName("Offset sweep without a zero offset falls back to a direct path at the scheduled time")
        void testSweepWithoutZeroOffset() {
            FlightFollowingOptimizer optimizer = new FlightFollowingOptimizer(
                    InMemoryTrajectoryStore.builder().build(),
                    FollowingPolicy.builder().offsetsMinutes(List.of(-30, 30)).build()
            );
            DepartureRecommendation recommendation = optimizer.optimize(query());

            assertEquals(BASE_EPOCH, recommendation.getOptimal().departureEpochSeconds());
            assertEquals(2, recommendation.getEvaluations().size());
        }
    }

    @Nested
    @DisplayName("Search steps")
    class Steps {

        @Test
        @DisplayName("Candidates need a first node inside the window and a compatible bearing")
        void testFindCandidates() {
            InMemoryTrajectoryStore store = InMemoryTrajectoryStore.builder()
                    .flight("IN", eastboundPartner(BASE_EPOCH + 10 * MINUTE))
                    .flight("OUT", eastboundPartner(BASE_EPOCH + 11 * MINUTE))
                    .flight("SINGLE", List.of(new TrajectoryNode(0.0d, 0.0d, BASE_EPOCH)))
                    .flight("NORTH", List.of(
                            new TrajectoryNode(0.0d, 0.0d, BASE_EPOCH),
                            new TrajectoryNode(5.0d, 0.0d, BASE_EPOCH + 30 * MINUTE)))
                    .build();

            List<FlightFollowingOptimizer.Partner> partners = optimizer(store).findCandidates(BASE_EPOCH, 90.0d);
            assertEquals(1, partners.size());
            assertEquals("IN", partners.get(0).flightId());
        }

        @Test
        @DisplayName("Candidate count is capped")
        void testCandidateCap() {
            InMemoryTrajectoryStore store = InMemoryTrajectoryStore.builder()
                    .flight("A", eastboundPartner(BASE_EPOCH))
                    .flight("B", eastboundPartner(BASE_EPOCH))
                    .build();
            FlightFollowingOptimizer capped = new FlightFollowingOptimizer(
                    store, FollowingPolicy.builder().maxCandidates(1).build());

            assertEquals(1, capped.findCandidates(BASE_EPOCH, 90.0d).size());
        }

        @Test
        @DisplayName("Interception skips the first node, past nodes and nodes out of reach")
        void testFindInterceptPoint() {
            FlightFollowingOptimizer optimizer = optimizer(InMemoryTrajectoryStore.builder().build());
            List<TrajectoryNode> partner = eastboundPartner(BASE_EPOCH);

            assertEquals(OptionalInt.of(1), optimizer.findInterceptPoint(ORIGIN, partner, BASE_EPOCH));
            // departing 12 minutes late leaves nodes 1 and 2 in the past
            assertEquals(OptionalInt.of(3), optimizer.findInterceptPoint(ORIGIN, partner, BASE_EPOCH + 12 * MINUTE));
            // all nodes within the 400 km reach are in the past
            assertTrue(optimizer.findInterceptPoint(ORIGIN, partner, BASE_EPOCH + 60 * MINUTE).isEmpty());
            assertTrue(optimizer.findInterceptPoint(GeoPoint.of(30.0d, 0.0d), partner, BASE_EPOCH).isEmpty());
        }

        @Test
        @DisplayName("Partner is left before the first step that diverges from the destination")
        void testFindDeparturePoint() {
            FlightFollowingOptimizer optimizer = optimizer(InMemoryTrajectoryStore.builder().build());
            List<TrajectoryNode> diverging = List.of(
                    new TrajectoryNode(0.0d, 0.0d, BASE_EPOCH),
                    new TrajectoryNode(0.0d, 1.0d, BASE_EPOCH + 10 * MINUTE),
                    new TrajectoryNode(0.0d, 2.0d, BASE_EPOCH + 20 * MINUTE),
                    new TrajectoryNode(6.0d, 2.0d, BASE_EPOCH + 60 * MINUTE)
            );

            assertEquals(2, optimizer.findDeparturePoint(diverging, 0, DESTINATION));
            assertEquals(15, optimizer.findDeparturePoint(eastboundPartner(BASE_EPOCH), 1, DESTINATION));
        }
    }

    // ========== Model Tests ==========

    @Test
    @DisplayName("Result and query records enforce their invariants")
    void testModelInvariants() {
        CostAnalysis withSavings = new CostAnalysis(100.0d, 90.0d, 10.0d, 10.0d, 4, 2);
        assertThrows(IllegalArgumentException.class,
                () -> new FollowingResult(BASE_EPOCH, Optional.empty(), List.of(), withSavings, Optional.empty()));
        assertThrows(IllegalArgumentException.class,
                () -> new FollowingResult(BASE_EPOCH, Optional.of("P"), List.of(), withSavings, Optional.empty()));
        assertThrows(IllegalArgumentException.class,
                () -> new FollowingQuery("A", ORIGIN, "B", DESTINATION, BASE_EPOCH, 0.0d));
        assertEquals(50.0d, withSavings.connectionRate(), 1e-12);
    }

    @Test
    @DisplayName("Invalid tunables fail fast")
    void testPolicyValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> FollowingPolicy.builder().efficiencyGain(1.0d).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> FollowingPolicy.builder().offsetsMinutes(List.of()).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> FollowingPolicy.builder().nodeStepMinutes(0).build().validate());
        assertEquals(400.0d, FollowingPolicy.builder().build().interceptionReachKm(), 0.0d);
    }
}
