package org.Aayush.formation.pairing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one pair-discovery run over a flight catalog.
 */
@Value
@Builder
public class PairDiscovery {
    /** Similar pairs first, then intersecting pairs, each ordered by catalog handle pair. */
    @Singular
    List<CompatiblePair> pairs;
    int similarCount;
    int intersectingCount;
    /** Flight pairs actually classified. */
    long comparisons;
    /** Input flights dropped by the catalog as unresolvable. */
    int skippedFlights;

    public List<CompatiblePair> similarPairs() {
        return ofKind(PairKind.SIMILAR);
    }

    public List<CompatiblePair> intersectingPairs() {
        return ofKind(PairKind.INTERSECTING);
    }

    private List<CompatiblePair> ofKind(PairKind kind) {
        return pairs.stream().filter(pair -> pair.kind() == kind).collect(Collectors.toUnmodifiableList());
    }
}
