package org.Aayush.formation.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Great-circle geometry")
class GreatCircleTest {

    private static final GeoPoint SFO = new GeoPoint(37.6213d, -122.3790d);
    private static final GeoPoint JFK = new GeoPoint(40.6413d, -73.7781d);

    @Nested
    @DisplayName("Distance")
    class Distance {

        @Test
        @DisplayName("SFO to JFK is about 4152 km")
        void testKnownDistance() {
            assertEquals(4_152.0d, GreatCircle.distanceKm(SFO, JFK), 5.0d);
        }

        @Test
        @DisplayName("One degree of longitude on the equator")
        void testEquatorDegree() {
            double expected = Math.toRadians(1.0d) * GreatCircle.EARTH_RADIUS_KM;
            assertEquals(expected, GreatCircle.distanceKm(0.0d, 0.0d, 0.0d, 1.0d), 1e-9);
        }

        @ParameterizedTest
        @CsvSource({
                "37.6213, -122.3790, 40.6413, -73.7781",
                "-33.8688, 151.2093, 51.4700, -0.4543",
                "0.0, 179.5, 0.0, -179.5",
                "89.9, 0.0, -89.9, 180.0"
        })
        void testSymmetry(double lat1, double lon1, double lat2, double lon2) {
            assertEquals(
                    GreatCircle.distanceKm(lat1, lon1, lat2, lon2),
                    GreatCircle.distanceKm(lat2, lon2, lat1, lon1),
                    1e-9
            );
        }

        @Test
        @DisplayName("Antimeridian crossing takes the short way")
        void testAntimeridian() {
            double distance = GreatCircle.distanceKm(0.0d, 179.5d, 0.0d, -179.5d);
            assertEquals(Math.toRadians(1.0d) * GreatCircle.EARTH_RADIUS_KM, distance, 1e-6);
        }
    }

    @Nested
    @DisplayName("Bearings")
    class Bearings {

        @ParameterizedTest
        @CsvSource({
                "0, 0, 1, 0, 0",
                "0, 0, 0, 1, 90",
                "0, 0, -1, 0, 180",
                "0, 0, 0, -1, 270"
        })
        void testCardinalBearings(double lat1, double lon1, double lat2, double lon2, double expected) {
            assertEquals(expected, GreatCircle.bearingDegrees(lat1, lon1, lat2, lon2), 1e-9);
        }

        @ParameterizedTest
        @CsvSource({
                "37.6213, -122.3790, 40.6413, -73.7781",
                "40.6413, -73.7781, 37.6213, -122.3790",
                "10.0, 10.0, 10.0, 9.999999",
                "-45.0, 170.0, -46.0, -170.0"
        })
        void testBearingRange(double lat1, double lon1, double lat2, double lon2) {
            double bearing = GreatCircle.bearingDegrees(lat1, lon1, lat2, lon2);
            assertTrue(bearing >= 0.0d && bearing < 360.0d, "bearing out of range: " + bearing);
        }

        @ParameterizedTest
        @CsvSource({
                "80, 100, 90",
                "350, 10, 0",
                "10, 350, 0",
                "0, 90, 45",
                "120, 120, 120"
        })
        void testBisectorTakesShorterArc(double b1, double b2, double expected) {
            double bisector = GreatCircle.bisectorDegrees(b1, b2);
            assertEquals(0.0d, GreatCircle.headingDifferenceDegrees(expected, bisector), 1e-9);
        }

        @ParameterizedTest
        @CsvSource({
                "10, 350, 20",
                "0, 180, 180",
                "90, 90, 0",
                "-30, 30, 60",
                "725, 5, 0"
        })
        void testHeadingDifference(double h1, double h2, double expected) {
            assertEquals(expected, GreatCircle.headingDifferenceDegrees(h1, h2), 1e-9);
        }

        @Test
        void testNormalizeBearing() {
            assertEquals(0.0d, GreatCircle.normalizeBearing(360.0d), 0.0d);
            assertEquals(350.0d, GreatCircle.normalizeBearing(-10.0d), 1e-12);
            assertEquals(5.0d, GreatCircle.normalizeBearing(725.0d), 1e-12);
        }
    }

    @Nested
    @DisplayName("Forward projection")
    class Projection {

        @Test
        @DisplayName("Projected point lies at the requested distance and bearing")
        void testDestinationPointRoundTrip() {
            GeoPoint start = new GeoPoint(37.0d, -122.0d);
            GeoPoint end = GreatCircle.destinationPoint(start, 135.0d, 400.0d);
            assertEquals(400.0d, GreatCircle.distanceKm(start, end), 1e-6);
            assertEquals(135.0d, GreatCircle.bearingDegrees(start, end), 1e-6);
        }

        @Test
        @DisplayName("Zero distance returns the origin")
        void testZeroDistance() {
            GeoPoint start = new GeoPoint(12.5d, 45.25d);
            GeoPoint end = GreatCircle.destinationPoint(start, 77.0d, 0.0d);
            assertEquals(start.lat(), end.lat(), 1e-12);
            assertEquals(start.lon(), end.lon(), 1e-12);
        }

        @Test
        @DisplayName("Longitude is normalized across the antimeridian")
        void testLongitudeNormalized() {
            GeoPoint end = GreatCircle.destinationPoint(new GeoPoint(0.0d, 179.9d), 90.0d, 111.195d);
            assertTrue(end.lon() >= -180.0d && end.lon() < 180.0d);
            assertEquals(-179.1d, end.lon(), 1e-3);
        }
    }
}
