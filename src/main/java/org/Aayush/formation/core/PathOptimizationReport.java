package org.Aayush.formation.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.formation.boost.OptimizedPath;

import java.util.List;

/**
 * Result of discovering pairs over the bound catalog and optimizing every paired flight.
 */
@Value
@Builder
public class PathOptimizationReport {
    /** Flights accepted into the catalog. */
    int totalFlights;
    /** Input flights skipped as unresolvable. */
    int skippedFlights;
    int pairsFound;
    int similarPairs;
    int intersectingPairs;
    int flightsOptimized;
    /** Paths sorted by time savings, largest first. */
    @Singular
    List<OptimizedPath> paths;
}
