package org.Aayush.formation.core;

import org.Aayush.formation.boost.OptimizedPath;
import org.Aayush.formation.following.DepartureRecommendation;
import org.Aayush.formation.pairing.CompatiblePair;
import org.Aayush.formation.pairing.PairDiscovery;
import org.Aayush.formation.scoring.EdgeGenerationReport;

import java.util.List;

/**
 * Public formation-matching service contract.
 *
 * <p>Implementations validate requests deterministically and throw {@link FormationException}
 * for contract failures.</p>
 */
public interface FormationService {

    /**
     * Finds similar and intersecting pairs among the bound flights.
     */
    PairDiscovery discoverPairs();

    /**
     * Optimizes every flight appearing in the given pairs.
     *
     * @return paths ranked by time savings, largest first.
     */
    List<OptimizedPath> optimizePaths(List<CompatiblePair> pairs);

    /**
     * Runs pair discovery followed by path optimization over the bound flights.
     */
    PathOptimizationReport optimizeFromFlights();

    /**
     * Generates node-level formation edges from the bound trajectory store.
     */
    EdgeGenerationReport formationEdges();

    /**
     * Recommends a departure time for a new flight.
     */
    DepartureRecommendation recommendDeparture(DepartureRequest request);
}
