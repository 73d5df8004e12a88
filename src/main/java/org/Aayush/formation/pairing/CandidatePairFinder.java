package org.Aayush.formation.pairing;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.Aayush.formation.geometry.ChordGeometry;
import org.Aayush.formation.geometry.ChordIntersection;
import org.Aayush.formation.time.TimeUtils;
import org.Aayush.formation.trajectory.Flight;
import org.Aayush.formation.trajectory.FlightCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Discovers similar and intersecting flight pairs in a catalog.
 *
 * <p>Similar-pair discovery only compares flights bucketed under a common departure or arrival
 * airport, which yields exactly the pairs of a full pairwise scan. Intersecting pairs share no
 * airport, so they are found with a full {@code i < j} handle loop. Stateless and thread-safe.</p>
 */
public final class CandidatePairFinder {
    private static final Logger log = LoggerFactory.getLogger(CandidatePairFinder.class);

    private final PairingPolicy policy;

    public CandidatePairFinder(PairingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
    }

    /**
     * Runs similar and intersecting discovery over the catalog.
     */
    public PairDiscovery discover(FlightCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        long[] comparisons = new long[1];
        List<HandlePair> similar = findSimilar(catalog, comparisons);
        List<HandlePair> intersecting = findIntersecting(catalog, comparisons);

        PairDiscovery.PairDiscoveryBuilder builder = PairDiscovery.builder()
                .similarCount(similar.size())
                .intersectingCount(intersecting.size())
                .comparisons(comparisons[0])
                .skippedFlights(catalog.skippedCount());
        similar.forEach(handlePair -> builder.pair(handlePair.pair()));
        intersecting.forEach(handlePair -> builder.pair(handlePair.pair()));
        PairDiscovery discovery = builder.build();

        log.debug(
                "Pair discovery over {} flights: {} similar, {} intersecting, {} comparisons",
                catalog.size(),
                discovery.getSimilarCount(),
                discovery.getIntersectingCount(),
                discovery.getComparisons()
        );
        return discovery;
    }

    /**
     * Classifies two flights as a similar pair.
     *
     * @return the pair, or empty when the flights do not share exactly one airport, their courses
     *         diverge by more than the similar-angle limit, or the shared schedule times are too far apart.
     */
    public Optional<CompatiblePair> similarPair(Flight a, Flight b) {
        boolean sameDeparture = a.sharesDepartureWith(b);
        boolean sameArrival = a.sharesArrivalWith(b);
        if (sameDeparture == sameArrival) {
            return Optional.empty();
        }

        OptionalDouble angle = courseAngle(a, b);
        if (angle.isEmpty() || angle.getAsDouble() > policy.getMaxSimilarAngleDegrees()) {
            return Optional.empty();
        }

        long timeA = sameDeparture ? a.getDeparture().epochSeconds() : a.getArrival().epochSeconds();
        long timeB = sameDeparture ? b.getDeparture().epochSeconds() : b.getArrival().epochSeconds();
        if (TimeUtils.circularMinuteDistance(timeA, timeB) > policy.getMaxSimilarTimeMinutes()) {
            return Optional.empty();
        }

        SharedEndpoint shared = sameDeparture ? SharedEndpoint.DEPARTURE : SharedEndpoint.ARRIVAL;
        return Optional.of(CompatiblePair.similar(a, b, angle.getAsDouble(), shared));
    }

    /**
     * Classifies two flights as an intersecting pair.
     *
     * @return the pair, or empty when an airport is shared, the courses differ by more than the
     *         intersecting-angle limit, the chords do not cross, either schedule has a non-positive
     *         duration, or the passage times at the crossing are too far apart.
     */
    public Optional<CompatiblePair> intersectingPair(Flight a, Flight b) {
        if (a.sharesDepartureWith(b) || a.sharesArrivalWith(b)) {
            return Optional.empty();
        }

        OptionalDouble angle = courseAngle(a, b);
        if (angle.isEmpty() || angle.getAsDouble() > policy.getMaxIntersectingAngleDegrees()) {
            return Optional.empty();
        }

        Optional<ChordIntersection> crossing = ChordGeometry.segmentIntersection(
                a.departurePoint(),
                a.arrivalPoint(),
                b.departurePoint(),
                b.arrivalPoint()
        );
        if (crossing.isEmpty()) {
            return Optional.empty();
        }

        ChordIntersection intersection = crossing.get();
        OptionalLong timeA = TimeUtils.interpolateEpochSeconds(
                a.getDeparture().epochSeconds(), a.getArrival().epochSeconds(), intersection.t1());
        OptionalLong timeB = TimeUtils.interpolateEpochSeconds(
                b.getDeparture().epochSeconds(), b.getArrival().epochSeconds(), intersection.t2());
        if (timeA.isEmpty() || timeB.isEmpty()) {
            return Optional.empty();
        }
        if (Math.abs(timeA.getAsLong() - timeB.getAsLong()) > policy.getMaxIntersectionTimeSeconds()) {
            return Optional.empty();
        }
        return Optional.of(CompatiblePair.intersecting(a, b, angle.getAsDouble(), intersection));
    }

    private List<HandlePair> findSimilar(FlightCatalog catalog, long[] comparisons) {
        Object2ObjectOpenHashMap<String, IntArrayList> byDeparture = new Object2ObjectOpenHashMap<>();
        Object2ObjectOpenHashMap<String, IntArrayList> byArrival = new Object2ObjectOpenHashMap<>();
        for (int handle = 0; handle < catalog.size(); handle++) {
            Flight flight = catalog.flight(handle);
            byDeparture.computeIfAbsent(flight.getDeparture().airport(), key -> new IntArrayList()).add(handle);
            byArrival.computeIfAbsent(flight.getArrival().airport(), key -> new IntArrayList()).add(handle);
        }

        List<HandlePair> result = new ArrayList<>();
        // A pair sharing both airports is an identical route and is skipped in both passes,
        // so each remaining pair is reached from exactly one bucket.
        collectSimilar(catalog, byDeparture, true, result, comparisons);
        collectSimilar(catalog, byArrival, false, result, comparisons);
        result.sort(HandlePair.ORDER);
        return result;
    }

    private void collectSimilar(
            FlightCatalog catalog,
            Object2ObjectOpenHashMap<String, IntArrayList> buckets,
            boolean departureBuckets,
            List<HandlePair> sink,
            long[] comparisons
    ) {
        for (IntArrayList bucket : buckets.values()) {
            int size = bucket.size();
            for (int i = 0; i < size; i++) {
                int handleA = bucket.getInt(i);
                Flight a = catalog.flight(handleA);
                for (int j = i + 1; j < size; j++) {
                    int handleB = bucket.getInt(j);
                    Flight b = catalog.flight(handleB);
                    boolean otherShared = departureBuckets ? a.sharesArrivalWith(b) : a.sharesDepartureWith(b);
                    if (otherShared) {
                        continue;
                    }
                    comparisons[0]++;
                    similarPair(a, b).ifPresent(pair -> sink.add(new HandlePair(handleA, handleB, pair)));
                }
            }
        }
    }

    private List<HandlePair> findIntersecting(FlightCatalog catalog, long[] comparisons) {
        List<HandlePair> result = new ArrayList<>();
        int size = catalog.size();
        for (int i = 0; i < size; i++) {
            Flight a = catalog.flight(i);
            for (int j = i + 1; j < size; j++) {
                Flight b = catalog.flight(j);
                if (a.sharesDepartureWith(b) || a.sharesArrivalWith(b)) {
                    continue;
                }
                comparisons[0]++;
                int handleB = j;
                int handleA = i;
                intersectingPair(a, b).ifPresent(pair -> result.add(new HandlePair(handleA, handleB, pair)));
            }
        }
        return result;
    }

    private static OptionalDouble courseAngle(Flight a, Flight b) {
        return ChordGeometry.angleBetween(a.departurePoint(), a.arrivalPoint(), b.departurePoint(), b.arrivalPoint());
    }

    private record HandlePair(int handleA, int handleB, CompatiblePair pair) {
        static final Comparator<HandlePair> ORDER = Comparator
                .comparingInt(HandlePair::handleA)
                .thenComparingInt(HandlePair::handleB);
    }
}
