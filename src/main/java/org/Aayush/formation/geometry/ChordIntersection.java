package org.Aayush.formation.geometry;

/**
 * Crossing of two route chords in lon/lat plane space.
 *
 * @param point crossing position.
 * @param t1 interpolation parameter along the first chord, in {@code [0, 1]}.
 * @param t2 interpolation parameter along the second chord, in {@code [0, 1]}.
 */
public record ChordIntersection(GeoPoint point, double t1, double t2) {
}
