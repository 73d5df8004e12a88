package org.Aayush.formation.boost;

import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.pairing.CompatiblePair;
import org.Aayush.formation.trajectory.Flight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses, per flight, the cheapest of the direct path, one corridor, or two corridors in sequence.
 *
 * <p>Stateless and thread-safe; flights can be optimized concurrently.</p>
 */
public final class BoostPathOptimizer {
    private static final Logger log = LoggerFactory.getLogger(BoostPathOptimizer.class);

    private final BoostPolicy policy;
    private final CorridorFactory corridorFactory;
    private final CorridorSolver solver;

    public BoostPathOptimizer(BoostPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
        this.corridorFactory = new CorridorFactory(policy);
        this.solver = new CorridorSolver(policy);
    }

    /**
     * Builds one corridor per pair and optimizes every flight that appears in any pair.
     *
     * <p>Each flight is offered the corridors of the pairs it belongs to.</p>
     *
     * @return paths sorted by time savings, largest first; empty for empty input.
     */
    public List<OptimizedPath> optimizeAll(List<CompatiblePair> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        List<BoostCorridor> corridors = new ArrayList<>(pairs.size());
        Map<String, Flight> flights = new LinkedHashMap<>();
        for (CompatiblePair pair : pairs) {
            corridors.add(corridorFactory.fromPair(pair));
            flights.putIfAbsent(pair.flightA().getId(), pair.flightA());
            flights.putIfAbsent(pair.flightB().getId(), pair.flightB());
        }

        List<OptimizedPath> paths = new ArrayList<>(flights.size());
        for (Flight flight : flights.values()) {
            List<BoostCorridor> available = new ArrayList<>();
            for (BoostCorridor corridor : corridors) {
                if (corridor.sourcePair().involves(flight.getId())) {
                    available.add(corridor);
                }
            }
            paths.add(optimize(flight, available));
        }
        paths.sort(Comparator.comparingDouble(OptimizedPath::getTimeSavingsMinutes).reversed());

        log.debug("Optimized {} flights against {} corridors", paths.size(), corridors.size());
        return paths;
    }

    /**
     * Optimizes one flight.
     *
     * <p>If more corridors are offered than the policy allows, only the highest-efficiency ones are
     * kept; {@link BoostUsage#corridorIndex()} refers to positions in that kept list.</p>
     */
    public OptimizedPath optimize(Flight flight, List<BoostCorridor> corridors) {
        Objects.requireNonNull(flight, "flight");
        Objects.requireNonNull(corridors, "corridors");
        List<BoostCorridor> available = selectCorridors(corridors);

        GeoPoint origin = flight.departurePoint();
        GeoPoint destination = flight.arrivalPoint();
        double direct = GreatCircle.distanceKm(origin, destination);
        double baseline = direct / policy.getNormalSpeed();

        Candidate best = Candidate.direct(baseline);

        for (int i = 0; i < available.size(); i++) {
            Optional<CorridorTraversal> traversal = solver.solve(origin, destination, available.get(i));
            if (traversal.isPresent() && traversal.get().weightedTime() < best.weightedTime) {
                best = Candidate.single(i, traversal.get());
            }
        }

        List<Integer> byProximity = new ArrayList<>(available.size());
        for (int i = 0; i < available.size(); i++) {
            byProximity.add(i);
        }
        byProximity.sort(Comparator.comparingDouble(idx -> GreatCircle.distanceKm(origin, available.get(idx).start())));

        for (int i = 0; i < byProximity.size(); i++) {
            int firstIndex = byProximity.get(i);
            Optional<CorridorTraversal> first = solver.solve(origin, destination, available.get(firstIndex));
            if (first.isEmpty()) {
                continue;
            }
            CorridorTraversal leg1 = first.get();
            double leadIn = GreatCircle.distanceKm(origin, leg1.entry()) / policy.getNormalSpeed()
                    + GreatCircle.distanceKm(leg1.entry(), leg1.exit()) / policy.getBoostSpeed();
            for (int j = i + 1; j < byProximity.size(); j++) {
                int secondIndex = byProximity.get(j);
                Optional<CorridorTraversal> second = solver.solve(leg1.exit(), destination, available.get(secondIndex));
                if (second.isEmpty()) {
                    continue;
                }
                double total = leadIn + second.get().weightedTime();
                if (total < best.weightedTime) {
                    best = Candidate.chained(firstIndex, leg1, secondIndex, second.get(), total);
                }
            }
        }

        return toPath(flight, available, best, direct, baseline);
    }

    private List<BoostCorridor> selectCorridors(List<BoostCorridor> corridors) {
        if (corridors.size() <= policy.getMaxCorridorsPerFlight()) {
            return corridors;
        }
        List<BoostCorridor> ranked = new ArrayList<>(corridors);
        ranked.sort(Comparator.comparingDouble(BoostCorridor::efficiencyScore).reversed());
        return ranked.subList(0, policy.getMaxCorridorsPerFlight());
    }

    private OptimizedPath toPath(
            Flight flight,
            List<BoostCorridor> available,
            Candidate best,
            double direct,
            double baseline
    ) {
        OptimizedPath.OptimizedPathBuilder builder = OptimizedPath.builder()
                .flightId(flight.getId())
                .routeLabel(flight.getRouteLabel())
                .departureAirport(flight.getDeparture().airport())
                .arrivalAirport(flight.getArrival().airport())
                .originalDistanceKm(direct)
                .weightedTime(best.weightedTime);

        List<Waypoint> waypoints = new ArrayList<>();
        waypoints.add(Waypoint.of(flight.departurePoint(), WaypointKind.DEPARTURE));
        for (int k = 0; k < best.legs.size(); k++) {
            CorridorTraversal leg = best.legs.get(k);
            int corridorIndex = best.corridorIndices.get(k);
            waypoints.add(Waypoint.of(leg.entry(), WaypointKind.BOOST_ENTRY));
            waypoints.add(Waypoint.of(leg.exit(), WaypointKind.BOOST_EXIT));
            builder.boostSegment(new BoostUsage(
                    corridorIndex,
                    leg.entry(),
                    leg.exit(),
                    leg.entryDistanceKm(),
                    leg.exitDistanceKm(),
                    GreatCircle.distanceKm(leg.entry(), leg.exit()),
                    available.get(corridorIndex).bearingDegrees()
            ));
        }
        waypoints.add(Waypoint.of(flight.arrivalPoint(), WaypointKind.ARRIVAL));

        double realized = 0.0d;
        for (int k = 1; k < waypoints.size(); k++) {
            realized += GreatCircle.distanceKm(waypoints.get(k - 1).point(), waypoints.get(k).point());
        }
        double savedMinutes = (baseline - best.weightedTime) * policy.getNormalSpeed() / policy.getCruiseSpeedKmh() * 60.0d;

        return builder
                .waypoints(waypoints)
                .optimizedDistanceKm(realized)
                .timeSavingsMinutes(Math.max(0.0d, savedMinutes))
                .build();
    }

    /**
     * Best path found so far: zero, one or two corridor legs.
     */
    private static final class Candidate {
        private final double weightedTime;
        private final List<Integer> corridorIndices;
        private final List<CorridorTraversal> legs;

        private Candidate(double weightedTime, List<Integer> corridorIndices, List<CorridorTraversal> legs) {
            this.weightedTime = weightedTime;
            this.corridorIndices = corridorIndices;
            this.legs = legs;
        }

        static Candidate direct(double weightedTime) {
            return new Candidate(weightedTime, List.of(), List.of());
        }

        static Candidate single(int corridorIndex, CorridorTraversal leg) {
            return new Candidate(leg.weightedTime(), List.of(corridorIndex), List.of(leg));
        }

        static Candidate chained(int firstIndex, CorridorTraversal first, int secondIndex, CorridorTraversal second, double total) {
            return new Candidate(total, List.of(firstIndex, secondIndex), List.of(first, second));
        }
    }
}
