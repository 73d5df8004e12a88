package org.Aayush.formation.scoring;

import lombok.Builder;
import lombok.Value;
import org.Aayush.formation.trajectory.TrajectoryNode;

import java.util.OptionalDouble;

/**
 * Node-level formation candidate between two flights.
 *
 * <p>{@code flightA} is always lexicographically smaller than {@code flightB}.</p>
 */
@Value
@Builder
public class FormationEdge {
    String flightA;
    String flightB;
    TrajectoryNode nodeA;
    TrajectoryNode nodeB;
    double distanceKm;
    /** {@code nodeB.epochSeconds - nodeA.epochSeconds}. */
    long timeDifferenceSeconds;
    OptionalDouble headingA;
    OptionalDouble headingB;
    OptionalDouble headingSimilarity;
    double feasibilityScore;
}
