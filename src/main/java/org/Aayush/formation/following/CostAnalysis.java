package org.Aayush.formation.following;

/**
 * Cost breakdown of one evaluated departure.
 *
 * @param soloCost direct great-circle distance origin to destination.
 * @param totalCost detour + discounted following + continuation, or the solo cost for a direct path.
 * @param savings {@code soloCost - totalCost}.
 * @param savingsPercent savings relative to the solo cost, 0 for a direct path.
 * @param totalSegments path node count minus one.
 * @param connectedSegments partner segments flown in formation.
 */
public record CostAnalysis(
        double soloCost,
        double totalCost,
        double savings,
        double savingsPercent,
        int totalSegments,
        int connectedSegments
) {

    static CostAnalysis direct(double soloCost, int totalSegments) {
        return new CostAnalysis(soloCost, soloCost, 0.0d, 0.0d, totalSegments, 0);
    }

    /**
     * Share of segments flown in formation, in percent.
     */
    public double connectionRate() {
        return totalSegments > 0 ? connectedSegments * 100.0d / totalSegments : 0.0d;
    }
}
