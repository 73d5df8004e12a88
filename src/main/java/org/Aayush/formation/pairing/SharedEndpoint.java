package org.Aayush.formation.pairing;

/**
 * Airport shared by the two flights of a pair.
 */
public enum SharedEndpoint {
    DEPARTURE,
    ARRIVAL,
    NONE
}
