package org.Aayush.formation.trajectory;

import org.Aayush.formation.geometry.GeoPoint;

import java.util.List;

/**
 * Read-only access to sampled flight trajectories.
 *
 * <p>Implementations must be safe for concurrent reads. Time windows are inclusive on both ends.</p>
 */
public interface TrajectoryStore {

    /**
     * Nodes within {@code radiusKm} of {@code center} whose timestamp lies in
     * {@code [fromEpochSec, toEpochSec]}, nearest first.
     */
    List<StoredNode> nearby(GeoPoint center, double radiusKm, long fromEpochSec, long toEpochSec);

    /**
     * Full trajectory of one flight ordered by timestamp, or an empty list for unknown ids.
     */
    List<TrajectoryNode> trajectory(String flightId);

    /**
     * All nodes with timestamps in {@code [fromEpochSec, toEpochSec]}, ordered by timestamp then flight id.
     */
    List<StoredNode> nodesBetween(long fromEpochSec, long toEpochSec);

    /**
     * Ids of all stored flights in insertion order.
     */
    List<String> flightIds();
}
