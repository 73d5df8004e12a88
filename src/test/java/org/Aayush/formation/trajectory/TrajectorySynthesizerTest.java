package org.Aayush.formation.trajectory;

import org.Aayush.formation.geometry.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.Aayush.formation.testutil.FlightFixtures.BASE_EPOCH;
import static org.Aayush.formation.testutil.FlightFixtures.HOUR;
import static org.Aayush.formation.testutil.FlightFixtures.KJFK;
import static org.Aayush.formation.testutil.FlightFixtures.KSFO;
import static org.Aayush.formation.testutil.FlightFixtures.equatorTrack;
import static org.Aayush.formation.testutil.FlightFixtures.flight;
import static org.Aayush.formation.testutil.FlightFixtures.tracked;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Trajectory synthesis")
class TrajectorySynthesizerTest {

    // ========== Interpolation Tests ==========

    @ParameterizedTest
    @CsvSource({
            "60, 5, 13",
            "62, 5, 14",
            "3, 5, 2",
            "0, 5, 2",
            "10, 10, 2"
    })
    void testNodeCount(double durationMinutes, int step, int expectedNodes) {
        List<TrajectoryNode> nodes = TrajectorySynthesizer.interpolate(
                GeoPoint.of(0.0d, 0.0d), GeoPoint.of(0.0d, 10.0d), BASE_EPOCH, durationMinutes, step
        );
        assertEquals(expectedNodes, nodes.size());
    }

    @Test
    @DisplayName("Endpoints are exact and timestamps evenly spaced")
    void testEndpointsAndSpacing() {
        GeoPoint from = GeoPoint.of(10.0d, 20.0d);
        GeoPoint to = GeoPoint.of(14.0d, 28.0d);
        List<TrajectoryNode> nodes = TrajectorySynthesizer.interpolate(from, to, BASE_EPOCH, 20.0d, 5);

        assertEquals(5, nodes.size());
        assertEquals(from, nodes.get(0).point());
        assertEquals(BASE_EPOCH, nodes.get(0).epochSeconds());
        assertEquals(14.0d, nodes.get(4).lat(), 1e-12);
        assertEquals(28.0d, nodes.get(4).lon(), 1e-12);
        assertEquals(BASE_EPOCH + 1_200L, nodes.get(4).epochSeconds());
        assertEquals(11.0d, nodes.get(1).lat(), 1e-12);
        assertEquals(22.0d, nodes.get(1).lon(), 1e-12);
        for (int i = 1; i < nodes.size(); i++) {
            assertEquals(300L, nodes.get(i).epochSeconds() - nodes.get(i - 1).epochSeconds());
        }
    }

    @Test
    @DisplayName("Invalid duration or step is rejected")
    void testInvalidArguments() {
        GeoPoint p = GeoPoint.of(0.0d, 0.0d);
        assertThrows(IllegalArgumentException.class, () -> TrajectorySynthesizer.interpolate(p, p, 0L, -1.0d, 5));
        assertThrows(IllegalArgumentException.class, () -> TrajectorySynthesizer.interpolate(p, p, 0L, Double.NaN, 5));
        assertThrows(IllegalArgumentException.class, () -> TrajectorySynthesizer.interpolate(p, p, 0L, 10.0d, 0));
    }

    // ========== Flight Trajectory Tests ==========

    @Test
    @DisplayName("Tracked flights keep their own nodes")
    void testTrackedFlightKeepsNodes() {
        List<TrajectoryNode> nodes = equatorTrack(0.0d, 1.0d, 4, BASE_EPOCH, 600L);
        Flight flight = tracked("T1", "AAA", "BBB", nodes);
        assertSame(flight.getNodes(), TrajectorySynthesizer.trajectoryOf(flight, 5));
    }

    @Test
    @DisplayName("Endpoint-only flights are synthesized from schedule")
    void testEndpointOnlyFlightSynthesized() {
        Flight flight = flight("S1", "KSFO", KSFO, BASE_EPOCH, "KJFK", KJFK, BASE_EPOCH + 5 * HOUR);
        List<TrajectoryNode> nodes = TrajectorySynthesizer.trajectoryOf(flight, 5);

        assertEquals(61, nodes.size());
        assertEquals(KSFO, nodes.get(0).point());
        assertEquals(BASE_EPOCH + 5 * HOUR, nodes.get(60).epochSeconds());
    }

    @Test
    @DisplayName("Non-positive schedules produce no trajectory")
    void testNonPositiveScheduleYieldsEmpty() {
        Flight flight = flight("Z1", "KSFO", KSFO, BASE_EPOCH, "KJFK", KJFK, BASE_EPOCH);
        assertTrue(TrajectorySynthesizer.trajectoryOf(flight, 5).isEmpty());
    }
}
