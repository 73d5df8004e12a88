package org.Aayush.formation.trajectory;

/**
 * Trajectory node returned by a store query together with its owner.
 *
 * @param flightId owning flight.
 * @param index position of the node in the owner's trajectory.
 * @param node sampled position.
 */
public record StoredNode(String flightId, int index, TrajectoryNode node) {
}
