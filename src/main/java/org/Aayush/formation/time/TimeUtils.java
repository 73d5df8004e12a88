package org.Aayush.formation.time;

import java.util.OptionalLong;

/**
 * Shared deterministic time helpers for schedule and trajectory logic.
 *
 * <p>All timestamps are Unix epoch seconds in UTC. Methods are safe for negative timestamps.</p>
 */
public final class TimeUtils {

    public static final long SECONDS_PER_MINUTE = 60L;
    public static final int MINUTES_PER_DAY = 1_440;

    private static final long SECONDS_PER_DAY = 86_400L;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns seconds elapsed since midnight (UTC).
     *
     * @param epochSec Unix timestamp in seconds (UTC).
     * @return seconds since midnight in range {@code [0, 86399]}.
     */
    public static long secondOfDay(long epochSec) {
        long timeOfDay = epochSec % SECONDS_PER_DAY;

        // Handle negative timestamps.
        if (timeOfDay < 0) {
            timeOfDay += SECONDS_PER_DAY;
        }

        return timeOfDay;
    }

    /**
     * Returns wall-clock minutes since midnight (UTC), truncating seconds.
     *
     * @param epochSec Unix timestamp in seconds (UTC).
     * @return minute of day in range {@code [0, 1439]}.
     */
    public static int minuteOfDay(long epochSec) {
        return (int) (secondOfDay(epochSec) / SECONDS_PER_MINUTE);
    }

    /**
     * Wall-clock distance between two timestamps, ignoring the date and wrapping at midnight.
     *
     * <p>23:30 and 00:15 are 45 minutes apart.</p>
     *
     * @return distance in minutes in range {@code [0, 720]}.
     */
    public static int circularMinuteDistance(long epochSecA, long epochSecB) {
        int diff = Math.abs(minuteOfDay(epochSecA) - minuteOfDay(epochSecB));
        return Math.min(diff, MINUTES_PER_DAY - diff);
    }

    /**
     * Linearly interpolates a timestamp between a scheduled departure and arrival.
     *
     * @param departureEpochSec scheduled departure.
     * @param arrivalEpochSec scheduled arrival.
     * @param fraction progress along the route, expected in {@code [0, 1]}.
     * @return interpolated timestamp, or empty when the scheduled duration is not positive.
     */
    public static OptionalLong interpolateEpochSeconds(long departureEpochSec, long arrivalEpochSec, double fraction) {
        long duration = arrivalEpochSec - departureEpochSec;
        if (duration <= 0L) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(departureEpochSec + Math.round(duration * fraction));
    }

    /**
     * Shifts a timestamp by whole minutes.
     *
     * @param epochSec base timestamp.
     * @param minutes minutes delta (can be negative).
     * @return shifted timestamp.
     */
    public static long addMinutes(long epochSec, long minutes) {
        return Math.addExact(epochSec, Math.multiplyExact(minutes, SECONDS_PER_MINUTE));
    }

    /**
     * Signed difference {@code later - earlier} in fractional minutes.
     */
    public static double minutesBetween(long earlierEpochSec, long laterEpochSec) {
        return (laterEpochSec - earlierEpochSec) / (double) SECONDS_PER_MINUTE;
    }

    /**
     * Validates non-decreasing ordering of a timestamp sequence.
     *
     * @param timestamps timeline to validate.
     * @return {@code true} when ordering is preserved; otherwise {@code false}.
     */
    public static boolean isNonDecreasing(long[] timestamps) {
        if (timestamps == null || timestamps.length < 2) {
            return true;
        }

        for (int i = 1; i < timestamps.length; i++) {
            if (timestamps[i] < timestamps[i - 1]) {
                return false;
            }
        }

        return true;
    }
}
