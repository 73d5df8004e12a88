package org.Aayush.formation.scoring;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Output of one edge-generation run.
 */
@Value
@Builder
public class EdgeGenerationReport {
    /** Edges sorted by descending feasibility score. */
    @Singular
    List<FormationEdge> edges;
    int nodesProcessed;
    /** Store candidates dropped (same flight, duplicate direction, out of range, below min score). */
    long candidatesRejected;
    double averageScore;
    double minScore;
    double maxScore;

    public int edgesGenerated() {
        return edges.size();
    }
}
