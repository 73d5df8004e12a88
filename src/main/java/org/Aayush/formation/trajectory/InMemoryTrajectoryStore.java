package org.Aayush.formation.trajectory;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Aayush.formation.geometry.GeoPoint;
import org.Aayush.formation.geometry.GreatCircle;
import org.Aayush.formation.time.TimeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reference {@link TrajectoryStore} backed by time-sorted flat columns.
 *
 * <p>Every node is stored once in parallel primitive columns sorted by
 * {@code (timestamp, flightId, index)}. Time-window queries binary-search the timestamp column;
 * {@link #nearby} additionally filters by haversine distance. Instances are immutable.</p>
 */
public final class InMemoryTrajectoryStore implements TrajectoryStore {
    private final List<String> flightIds;
    private final List<List<TrajectoryNode>> trajectories;
    private final Object2IntOpenHashMap<String> handleById;

    private final long[] times;
    private final double[] lats;
    private final double[] lons;
    private final int[] owners;
    private final int[] indices;
    private final int skippedNodeCount;

    private InMemoryTrajectoryStore(Builder builder) {
        this.flightIds = List.copyOf(builder.flightIds);
        this.trajectories = List.copyOf(builder.trajectories);
        this.handleById = builder.handleById;
        this.skippedNodeCount = builder.skippedNodes;

        int total = builder.times.size();
        int[] order = new int[total];
        for (int i = 0; i < total; i++) {
            order[i] = i;
        }
        long[] rawTimes = builder.times.toLongArray();
        int[] rawOwners = builder.owners.toIntArray();
        int[] rawIndices = builder.indices.toIntArray();
        IntArrays.quickSort(order, (a, b) -> {
            int byTime = Long.compare(rawTimes[a], rawTimes[b]);
            if (byTime != 0) {
                return byTime;
            }
            int byFlight = flightIds.get(rawOwners[a]).compareTo(flightIds.get(rawOwners[b]));
            if (byFlight != 0) {
                return byFlight;
            }
            return Integer.compare(rawIndices[a], rawIndices[b]);
        });

        this.times = new long[total];
        this.lats = new double[total];
        this.lons = new double[total];
        this.owners = new int[total];
        this.indices = new int[total];
        for (int i = 0; i < total; i++) {
            int src = order[i];
            times[i] = rawTimes[src];
            lats[i] = builder.lats.getDouble(src);
            lons[i] = builder.lons.getDouble(src);
            owners[i] = rawOwners[src];
            indices[i] = rawIndices[src];
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a store from every catalog flight, synthesizing trajectories for endpoint-only flights.
     */
    public static InMemoryTrajectoryStore fromCatalog(FlightCatalog catalog, int stepMinutes) {
        Objects.requireNonNull(catalog, "catalog");
        Builder builder = builder();
        for (Flight flight : catalog.flights()) {
            List<TrajectoryNode> nodes = TrajectorySynthesizer.trajectoryOf(flight, stepMinutes);
            if (!nodes.isEmpty()) {
                builder.flight(flight.getId(), nodes);
            }
        }
        return builder.build();
    }

    @Override
    public List<StoredNode> nearby(GeoPoint center, double radiusKm, long fromEpochSec, long toEpochSec) {
        Objects.requireNonNull(center, "center");
        if (!(radiusKm >= 0.0d)) {
            throw new IllegalArgumentException("radiusKm must be >= 0: " + radiusKm);
        }
        IntArrayList hits = new IntArrayList();
        DoubleArrayList distances = new DoubleArrayList();
        for (int i = lowerBound(fromEpochSec); i < times.length && times[i] <= toEpochSec; i++) {
            double distance = GreatCircle.distanceKm(center.lat(), center.lon(), lats[i], lons[i]);
            if (distance <= radiusKm) {
                hits.add(i);
                distances.add(distance);
            }
        }

        int[] order = new int[hits.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        // Merge sort is stable: equidistant nodes stay in time order.
        double[] d = distances.toDoubleArray();
        IntArrays.mergeSort(order, (a, b) -> Double.compare(d[a], d[b]));

        List<StoredNode> sorted = new ArrayList<>(order.length);
        for (int idx : order) {
            sorted.add(toStoredNode(hits.getInt(idx)));
        }
        return sorted;
    }

    @Override
    public List<TrajectoryNode> trajectory(String flightId) {
        int handle = handleById.getInt(flightId);
        return handle < 0 ? List.of() : trajectories.get(handle);
    }

    @Override
    public List<StoredNode> nodesBetween(long fromEpochSec, long toEpochSec) {
        List<StoredNode> result = new ArrayList<>();
        for (int i = lowerBound(fromEpochSec); i < times.length && times[i] <= toEpochSec; i++) {
            result.add(toStoredNode(i));
        }
        return result;
    }

    @Override
    public List<String> flightIds() {
        return flightIds;
    }

    /**
     * Total stored node count.
     */
    public int nodeCount() {
        return times.length;
    }

    /**
     * Nodes dropped during build because of invalid coordinates.
     */
    public int skippedNodeCount() {
        return skippedNodeCount;
    }

    private StoredNode toStoredNode(int i) {
        return new StoredNode(flightIds.get(owners[i]), indices[i], new TrajectoryNode(lats[i], lons[i], times[i]));
    }

    private int lowerBound(long epochSec) {
        int lo = 0;
        int hi = times.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] < epochSec) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Mutable builder; not thread-safe.
     */
    public static final class Builder {
        private final List<String> flightIds = new ArrayList<>();
        private final List<List<TrajectoryNode>> trajectories = new ArrayList<>();
        private final Object2IntOpenHashMap<String> handleById = new Object2IntOpenHashMap<>();

        private final LongArrayList times = new LongArrayList();
        private final DoubleArrayList lats = new DoubleArrayList();
        private final DoubleArrayList lons = new DoubleArrayList();
        private final IntArrayList owners = new IntArrayList();
        private final IntArrayList indices = new IntArrayList();
        private int skippedNodes;

        private Builder() {
            handleById.defaultReturnValue(-1);
        }

        /**
         * Adds one flight trajectory.
         *
         * <p>Nodes with non-finite or out-of-range coordinates are dropped and counted.</p>
         *
         * @throws IllegalArgumentException on blank or duplicate ids or decreasing timestamps.
         */
        public Builder flight(String flightId, List<TrajectoryNode> nodes) {
            Objects.requireNonNull(nodes, "nodes");
            if (flightId == null || flightId.isBlank()) {
                throw new IllegalArgumentException("flightId must be non-blank");
            }
            if (handleById.containsKey(flightId)) {
                throw new IllegalArgumentException("duplicate flight id: " + flightId);
            }

            List<TrajectoryNode> accepted = new ArrayList<>(nodes.size());
            for (TrajectoryNode node : nodes) {
                Objects.requireNonNull(node, "node");
                if (!GeoPoint.isValid(node.lat(), node.lon())) {
                    skippedNodes++;
                    continue;
                }
                accepted.add(node);
            }
            long[] timeline = new long[accepted.size()];
            for (int i = 0; i < timeline.length; i++) {
                timeline[i] = accepted.get(i).epochSeconds();
            }
            if (!TimeUtils.isNonDecreasing(timeline)) {
                throw new IllegalArgumentException("trajectory of " + flightId + " is not time-ordered");
            }

            int handle = flightIds.size();
            flightIds.add(flightId);
            trajectories.add(List.copyOf(accepted));
            handleById.put(flightId, handle);
            for (int i = 0; i < accepted.size(); i++) {
                TrajectoryNode node = accepted.get(i);
                times.add(node.epochSeconds());
                lats.add(node.lat());
                lons.add(node.lon());
                owners.add(handle);
                indices.add(i);
            }
            return this;
        }

        public Builder flight(Flight flight) {
            Objects.requireNonNull(flight, "flight");
            return flight(flight.getId(), flight.getNodes());
        }

        public InMemoryTrajectoryStore build() {
            return new InMemoryTrajectoryStore(this);
        }
    }
}
