package org.Aayush.formation.pairing;

/**
 * Classification of a compatible flight pair.
 */
public enum PairKind {
    /** Shares exactly one airport and flies a similar course. */
    SIMILAR,
    /** Shares no airport and the route chords cross at a common time. */
    INTERSECTING
}
