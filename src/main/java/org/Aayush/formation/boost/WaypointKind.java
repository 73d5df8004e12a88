package org.Aayush.formation.boost;

/**
 * Role of a waypoint in an optimized path.
 */
public enum WaypointKind {
    DEPARTURE,
    BOOST_ENTRY,
    BOOST_EXIT,
    ARRIVAL
}
