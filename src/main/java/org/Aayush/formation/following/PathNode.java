package org.Aayush.formation.following;

/**
 * One node of a recommended path.
 *
 * @param lat latitude.
 * @param lon longitude.
 * @param epochSeconds time at the node.
 * @param timeIndex position in the path.
 * @param segmentDistanceKm distance to the next node, 0 for the last node.
 * @param following whether the node is flown in formation behind the partner.
 */
public record PathNode(
        double lat,
        double lon,
        long epochSeconds,
        int timeIndex,
        double segmentDistanceKm,
        boolean following
) {
}
