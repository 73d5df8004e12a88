package org.Aayush.formation.trajectory;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.experimental.StandardException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable arena of flights addressed by dense integer handles.
 *
 * <p>Handles run from {@code 0} to {@code size() - 1} in input order. Flights whose endpoints
 * cannot be resolved (blank airport code, non-finite or out-of-range coordinates) are skipped
 * at construction and reported through {@link #skippedFlightIds()}. This class is safe for
 * concurrent reads.</p>
 */
public final class FlightCatalog {
    private static final Logger log = LoggerFactory.getLogger(FlightCatalog.class);

    private final List<Flight> flights;
    private final Object2IntOpenHashMap<String> handleById;
    private final List<String> skippedFlightIds;

    private FlightCatalog(List<Flight> flights, Object2IntOpenHashMap<String> handleById, List<String> skippedFlightIds) {
        this.flights = flights;
        this.handleById = handleById;
        this.skippedFlightIds = skippedFlightIds;
    }

    /**
     * Builds a catalog from raw flights.
     *
     * @param input flights to index; null elements are rejected.
     * @return immutable catalog.
     * @throws IllegalArgumentException on blank or duplicate flight ids.
     */
    public static FlightCatalog of(Collection<Flight> input) {
        Objects.requireNonNull(input, "input");
        List<Flight> accepted = new ArrayList<>(input.size());
        List<String> skipped = new ArrayList<>();
        Object2IntOpenHashMap<String> index = new Object2IntOpenHashMap<>(input.size());
        index.defaultReturnValue(-1);

        for (Flight flight : input) {
            Objects.requireNonNull(flight, "flight");
            String id = flight.getId();
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("flight id must be non-blank");
            }
            if (index.containsKey(id) || skipped.contains(id)) {
                throw new IllegalArgumentException("duplicate flight id: " + id);
            }
            if (!isResolvable(flight)) {
                skipped.add(id);
                continue;
            }
            index.put(id, accepted.size());
            accepted.add(flight);
        }
        index.trim();

        if (!skipped.isEmpty()) {
            log.debug("Skipped {} unresolvable flights out of {}", skipped.size(), input.size());
        }
        return new FlightCatalog(List.copyOf(accepted), index, List.copyOf(skipped));
    }

    /**
     * Returns an empty catalog.
     */
    public static FlightCatalog empty() {
        return of(List.of());
    }

    public int size() {
        return flights.size();
    }

    /**
     * Returns the flight stored at one handle.
     *
     * @throws IndexOutOfBoundsException for handles outside {@code [0, size)}.
     */
    public Flight flight(int handle) {
        if (handle < 0 || handle >= flights.size()) {
            throw new IndexOutOfBoundsException("flight handle out of bounds: " + handle + " [0, " + flights.size() + ")");
        }
        return flights.get(handle);
    }

    /**
     * Maps a flight id to its handle.
     *
     * @throws UnknownFlightException when the id is not in the catalog.
     */
    public int handleOf(String flightId) {
        int handle = handleById.getInt(flightId);
        if (handle == -1) {
            throw new UnknownFlightException("flight id not found: " + flightId);
        }
        return handle;
    }

    public boolean contains(String flightId) {
        return flightId != null && handleById.containsKey(flightId);
    }

    public Optional<Flight> find(String flightId) {
        return contains(flightId) ? Optional.of(flights.get(handleById.getInt(flightId))) : Optional.empty();
    }

    /**
     * Flights in handle order.
     */
    public List<Flight> flights() {
        return flights;
    }

    /**
     * Ids of input flights rejected as unresolvable, in input order.
     */
    public List<String> skippedFlightIds() {
        return skippedFlightIds;
    }

    public int skippedCount() {
        return skippedFlightIds.size();
    }

    private static boolean isResolvable(Flight flight) {
        return flight.getDeparture() != null
                && flight.getArrival() != null
                && flight.getDeparture().isResolvable()
                && flight.getArrival().isResolvable();
    }

    /**
     * Thrown when a flight id is not present in the catalog.
     */
    @StandardException
    public static class UnknownFlightException extends RuntimeException {
    }
}
