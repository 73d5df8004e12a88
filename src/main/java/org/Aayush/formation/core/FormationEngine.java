package org.Aayush.formation.core;

import lombok.Builder;
import org.Aayush.formation.boost.BoostPathOptimizer;
import org.Aayush.formation.boost.BoostPolicy;
import org.Aayush.formation.boost.OptimizedPath;
import org.Aayush.formation.following.DepartureRecommendation;
import org.Aayush.formation.following.FlightFollowingOptimizer;
import org.Aayush.formation.following.FollowingPolicy;
import org.Aayush.formation.following.FollowingQuery;
import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.pairing.CandidatePairFinder;
import org.Aayush.formation.pairing.CompatiblePair;
import org.Aayush.formation.pairing.PairDiscovery;
import org.Aayush.formation.pairing.PairingPolicy;
import org.Aayush.formation.scoring.EdgeGenerationReport;
import org.Aayush.formation.scoring.FeasibilityPolicy;
import org.Aayush.formation.scoring.FeasibilityScorer;
import org.Aayush.formation.scoring.FormationEdgeGenerator;
import org.Aayush.formation.trajectory.AirportDirectory;
import org.Aayush.formation.trajectory.FlightCatalog;
import org.Aayush.formation.trajectory.InMemoryTrajectoryStore;
import org.Aayush.formation.trajectory.TrajectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static org.Aayush.formation.core.FormationException.REASON_DEGENERATE_ROUTE;
import static org.Aayush.formation.core.FormationException.REASON_DEPARTURE_REQUEST_REQUIRED;
import static org.Aayush.formation.core.FormationException.REASON_DESTINATION_REQUIRED;
import static org.Aayush.formation.core.FormationException.REASON_INVALID_COORDINATES;
import static org.Aayush.formation.core.FormationException.REASON_INVALID_DISTANCE;
import static org.Aayush.formation.core.FormationException.REASON_INVALID_DURATION;
import static org.Aayush.formation.core.FormationException.REASON_ORIGIN_REQUIRED;
import static org.Aayush.formation.core.FormationException.REASON_PAIRS_REQUIRED;
import static org.Aayush.formation.core.FormationException.REASON_UNKNOWN_AIRPORT;

/**
 * Main formation-matching entry point.
 *
 * <p>The facade binds an immutable flight catalog, a trajectory store, an airport directory and the
 * component policies, validates client requests, and delegates to the pair finder, the boost-zone
 * optimizer, the edge generator and the flight-following optimizer. The engine holds no mutable
 * state and is safe for concurrent use.</p>
 */
public final class FormationEngine implements FormationService {
    private static final Logger log = LoggerFactory.getLogger(FormationEngine.class);

    private final FlightCatalog catalog;
    private final TrajectoryStore trajectoryStore;
    private final AirportDirectory airportDirectory;
    private final FollowingPolicy followingPolicy;

    private final CandidatePairFinder pairFinder;
    private final BoostPathOptimizer boostOptimizer;
    private final FormationEdgeGenerator edgeGenerator;
    private final FlightFollowingOptimizer followingOptimizer;

    /**
     * Creates the engine facade.
     *
     * @param catalog flights used for pair discovery and airport fallback.
     * @param trajectoryStore optional store; defaults to an in-memory store built from the catalog.
     * @param airportDirectory optional directory; defaults to catalog endpoints.
     * @param pairingPolicy optional pairing thresholds.
     * @param feasibilityPolicy optional edge-scoring thresholds.
     * @param boostPolicy optional boost-zone settings.
     * @param followingPolicy optional flight-following settings.
     */
    @Builder
    public FormationEngine(
            FlightCatalog catalog,
            TrajectoryStore trajectoryStore,
            AirportDirectory airportDirectory,
            PairingPolicy pairingPolicy,
            FeasibilityPolicy feasibilityPolicy,
            BoostPolicy boostPolicy,
            FollowingPolicy followingPolicy
    ) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.followingPolicy = followingPolicy == null ? FollowingPolicy.defaults() : followingPolicy.validate();
        this.trajectoryStore = trajectoryStore == null
                ? InMemoryTrajectoryStore.fromCatalog(catalog, this.followingPolicy.getNodeStepMinutes())
                : trajectoryStore;
        this.airportDirectory = airportDirectory == null ? AirportDirectory.fromCatalog(catalog) : airportDirectory;

        this.pairFinder = new CandidatePairFinder(pairingPolicy == null ? PairingPolicy.defaults() : pairingPolicy);
        this.boostOptimizer = new BoostPathOptimizer(boostPolicy == null ? BoostPolicy.defaults() : boostPolicy);
        this.edgeGenerator = new FormationEdgeGenerator(
                this.trajectoryStore,
                new FeasibilityScorer(feasibilityPolicy == null ? FeasibilityPolicy.defaults() : feasibilityPolicy)
        );
        this.followingOptimizer = new FlightFollowingOptimizer(this.trajectoryStore, this.followingPolicy);
    }

    @Override
    public PairDiscovery discoverPairs() {
        PairDiscovery discovery = pairFinder.discover(catalog);
        log.info(
                "Discovered {} pairs ({} similar, {} intersecting) over {} flights, {} skipped",
                discovery.getPairs().size(),
                discovery.getSimilarCount(),
                discovery.getIntersectingCount(),
                catalog.size(),
                discovery.getSkippedFlights()
        );
        return discovery;
    }

    /**
     * Optimizes every flight appearing in the given pairs.
     *
     * @return ranked paths; empty for an empty pair list.
     * @throws FormationException when {@code pairs} is null.
     */
    @Override
    public List<OptimizedPath> optimizePaths(List<CompatiblePair> pairs) {
        if (pairs == null) {
            throw new FormationException(REASON_PAIRS_REQUIRED, "pairs must be provided");
        }
        if (pairs.isEmpty()) {
            return List.of();
        }
        List<OptimizedPath> paths = boostOptimizer.optimizeAll(pairs);
        log.info("Optimized {} flights from {} pairs", paths.size(), pairs.size());
        return paths;
    }

    @Override
    public PathOptimizationReport optimizeFromFlights() {
        PairDiscovery discovery = discoverPairs();
        List<OptimizedPath> paths = optimizePaths(discovery.getPairs());
        return PathOptimizationReport.builder()
                .totalFlights(catalog.size())
                .skippedFlights(catalog.skippedCount())
                .pairsFound(discovery.getPairs().size())
                .similarPairs(discovery.getSimilarCount())
                .intersectingPairs(discovery.getIntersectingCount())
                .flightsOptimized(paths.size())
                .paths(paths)
                .build();
    }

    @Override
    public EdgeGenerationReport formationEdges() {
        return edgeGenerator.generate();
    }

    /**
     * Recommends a departure time for a new flight.
     *
     * @throws FormationException when the request is missing, an endpoint cannot be resolved, or an
     *                            override is not a finite positive number.
     */
    @Override
    public DepartureRecommendation recommendDeparture(DepartureRequest request) {
        return followingOptimizer.optimize(toQuery(request));
    }

    /**
     * Validates a departure request and resolves it into a following query.
     */
    FollowingQuery toQuery(DepartureRequest request) {
        if (request == null) {
            throw new FormationException(REASON_DEPARTURE_REQUEST_REQUIRED, "departure request must be provided");
        }
        GeoPoint origin = resolveEndpoint(request.getOrigin(), request.getOriginCode(), REASON_ORIGIN_REQUIRED, "origin");
        GeoPoint destination = resolveEndpoint(
                request.getDestination(),
                request.getDestinationCode(),
                REASON_DESTINATION_REQUIRED,
                "destination"
        );

        double distanceKm;
        if (request.getDistanceKm() != null) {
            distanceKm = requirePositive(request.getDistanceKm(), REASON_INVALID_DISTANCE, "distanceKm");
        } else {
            distanceKm = GreatCircle.distanceKm(origin, destination);
            if (!(distanceKm > 0.0d)) {
                throw new FormationException(REASON_DEGENERATE_ROUTE, "origin and destination coincide: " + origin);
            }
        }

        double durationMinutes = request.getDurationMinutes() != null
                ? requirePositive(request.getDurationMinutes(), REASON_INVALID_DURATION, "durationMinutes")
                : distanceKm / followingPolicy.getCruiseSpeedKmh() * 60.0d;

        return new FollowingQuery(
                label(request.getOriginCode(), origin),
                origin,
                label(request.getDestinationCode(), destination),
                destination,
                request.getScheduledDepartureEpochSeconds(),
                durationMinutes
        );
    }

    private GeoPoint resolveEndpoint(GeoPoint explicit, String code, String missingReason, String role) {
        if (explicit != null) {
            if (!explicit.isValid()) {
                throw new FormationException(REASON_INVALID_COORDINATES, role + " coordinates are invalid: " + explicit);
            }
            return explicit;
        }
        if (code == null || code.isBlank()) {
            throw new FormationException(missingReason, role + " requires coordinates or an airport code");
        }
        return airportDirectory.resolve(code)
                .orElseThrow(() -> new FormationException(REASON_UNKNOWN_AIRPORT, "unknown " + role + " airport: " + code));
    }

    private static double requirePositive(double value, String reasonCode, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new FormationException(reasonCode, name + " must be finite and > 0: " + value);
        }
        return value;
    }

    private static String label(String code, GeoPoint point) {
        return code == null || code.isBlank() ? point.toString() : code.trim().toUpperCase(Locale.ROOT);
    }
}
