package org.Aayush.formation.boost;

import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.pairing.CompatiblePair;
import org.Aayush.formation.trajectory.Flight;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.formation.testutil.FlightFixtures.BASE_EPOCH;
import static org.Aayush.formation.testutil.FlightFixtures.HOUR;
import static org.Aayush.formation.testutil.FlightFixtures.anySimilarPair;
import static org.Aayush.formation.testutil.FlightFixtures.flight;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Boost path optimizer")
class BoostPathOptimizerTest {
    private static final GeoPoint EQ_ORIGIN = GeoPoint.of(0.0d, 0.0d);
    private static final GeoPoint EQ_DESTINATION = GeoPoint.of(0.0d, 9.0d);

    private final BoostPathOptimizer optimizer = new BoostPathOptimizer(BoostPolicy.builder().build());

    private static Flight equatorFlight() {
        return flight("EQ1", "ORG", EQ_ORIGIN, BASE_EPOCH, "DST", EQ_DESTINATION, BASE_EPOCH + 2 * HOUR);
    }

    private static BoostCorridor eastbound(double startLon, double efficiency) {
        return new BoostCorridor(GeoPoint.of(0.0d, startLon), 90.0d, 200.0d, anySimilarPair(), efficiency);
    }

    private static BoostCorridor farSouth(double efficiency) {
        return new BoostCorridor(GeoPoint.of(-20.0d, 4.0d), 180.0d, 200.0d, anySimilarPair(), efficiency);
    }

    @Nested
    @DisplayName("Single flight")
    class SingleFlight {

        @Test
        @DisplayName("No corridors keeps the direct path")
        void testNoCorridors() {
            OptimizedPath path = optimizer.optimize(equatorFlight(), List.of());

            double direct = GreatCircle.distanceKm(EQ_ORIGIN, EQ_DESTINATION);
            assertFalse(path.usesBoost());
            assertEquals(2, path.getWaypoints().size());
            assertEquals(WaypointKind.DEPARTURE, path.getWaypoints().get(0).kind());
            assertEquals(WaypointKind.ARRIVAL, path.getWaypoints().get(1).kind());
            assertEquals(direct, path.getWeightedTime(), 1e-9);
            assertEquals(direct, path.getOptimizedDistanceKm(), 1e-9);
            assertEquals(0.0d, path.getTimeSavingsMinutes(), 0.0d);
        }

        @Test
        @DisplayName("Far-off perpendicular corridor gives no improvement")
        void testPerpendicularCorridorIgnored() {
            Flight flight = flight("F3", "AAA", GeoPoint.of(40.0d, -100.0d), BASE_EPOCH,
                    "BBB", GeoPoint.of(40.0d, -90.0d), BASE_EPOCH + 2 * HOUR);
            BoostCorridor perpendicular = new BoostCorridor(
                    GeoPoint.of(30.0d, -95.0d), 180.0d, 400.0d, anySimilarPair(), 1.0d);

            OptimizedPath path = optimizer.optimize(flight, List.of(perpendicular));

            assertFalse(path.usesBoost());
            assertEquals(2, path.getWaypoints().size());
            assertEquals(0.0d, path.getTimeSavingsMinutes(), 0.0d);
            assertEquals(path.getOriginalDistanceKm(), path.getWeightedTime(), 1e-9);
        }

        @Test
        @DisplayName("One on-route corridor is flown end to end")
        void testSingleCorridor() {
            OptimizedPath path = optimizer.optimize(equatorFlight(), List.of(eastbound(0.9d, 1.0d)));

            double direct = GreatCircle.distanceKm(EQ_ORIGIN, EQ_DESTINATION);
            double expected = direct - 200.0d + 200.0d / 1.1d;
            assertTrue(path.usesBoost());
            assertEquals(1, path.boostCount());
            assertEquals(4, path.getWaypoints().size());
            assertEquals(expected, path.getWeightedTime(), 0.5d);
            assertEquals((direct - path.getWeightedTime()) / 800.0d * 60.0d, path.getTimeSavingsMinutes(), 1e-9);

            BoostUsage usage = path.getBoostSegments().get(0);
            assertEquals(0, usage.corridorIndex());
            assertEquals(200.0d, usage.distanceInBoostKm(), 1.0d);
            assertEquals(90.0d, usage.bearingDegrees(), 0.0d);
        }

        @Test
        @DisplayName("Two on-route corridors are chained in order of proximity to the origin")
        void testChainedCorridors() {
            // offered farthest first so the chain order differs from the input order
            OptimizedPath path = optimizer.optimize(
                    equatorFlight(), List.of(eastbound(4.5d, 1.0d), eastbound(0.9d, 1.0d)));

            double direct = GreatCircle.distanceKm(EQ_ORIGIN, EQ_DESTINATION);
            double expected = direct - 400.0d + 400.0d / 1.1d;
            assertEquals(2, path.boostCount());
            assertEquals(6, path.getWaypoints().size());
            assertEquals(List.of(
                    WaypointKind.DEPARTURE,
                    WaypointKind.BOOST_ENTRY,
                    WaypointKind.BOOST_EXIT,
                    WaypointKind.BOOST_ENTRY,
                    WaypointKind.BOOST_EXIT,
                    WaypointKind.ARRIVAL
            ), path.getWaypoints().stream().map(Waypoint::kind).toList());
            assertEquals(1, path.getBoostSegments().get(0).corridorIndex());
            assertEquals(0, path.getBoostSegments().get(1).corridorIndex());
            assertEquals(expected, path.getWeightedTime(), 0.5d);
            assertEquals(direct, path.getOptimizedDistanceKm(), 1.0d);
            assertTrue(path.getTimeSavingsMinutes() > 2.5d);
        }

        @Test
        @DisplayName("Only the highest-efficiency corridors are considered")
        void testCorridorCap() {
            List<BoostCorridor> offered = List.of(
                    farSouth(0.9d), farSouth(0.8d), farSouth(0.7d), eastbound(0.9d, 0.1d));

            OptimizedPath capped = optimizer.optimize(equatorFlight(), offered);
            assertFalse(capped.usesBoost());

            BoostPathOptimizer roomy = new BoostPathOptimizer(BoostPolicy.builder().maxCorridorsPerFlight(4).build());
            OptimizedPath uncapped = roomy.optimize(equatorFlight(), offered);
            assertEquals(1, uncapped.boostCount());
            assertEquals(3, uncapped.getBoostSegments().get(0).corridorIndex());
        }
    }

    @Nested
    @DisplayName("Pair batches")
    class Batches {

        @Test
        @DisplayName("Both flights of a similar pair are optimized, best savings first")
        void testOptimizeAll() {
            CompatiblePair pair = anySimilarPair();
            List<OptimizedPath> paths = optimizer.optimizeAll(List.of(pair));

            assertEquals(2, paths.size());
            assertTrue(paths.get(0).getTimeSavingsMinutes() >= paths.get(1).getTimeSavingsMinutes());
            for (OptimizedPath path : paths) {
                assertTrue(path.usesBoost());
                assertTrue(path.getTimeSavingsMinutes() > 0.0d);
                assertTrue(path.getWeightedTime() < path.getOriginalDistanceKm());
                assertEquals("KSFO", path.getDepartureAirport());
            }
        }

        @Test
        void testEmptyBatch() {
            assertTrue(optimizer.optimizeAll(List.of()).isEmpty());
        }
    }
}
