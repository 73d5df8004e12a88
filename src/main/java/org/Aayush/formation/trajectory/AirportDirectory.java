package org.Aayush.formation.trajectory;

import org.Aayush.formation.geometry.GeoPoint;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves airport codes to coordinates.
 *
 * <p>Lookup order: explicit table, then the first catalog flight departing from the code, then the
 * first catalog flight arriving at it. Codes are matched trimmed and case-insensitively.</p>
 */
public final class AirportDirectory {
    private final Map<String, GeoPoint> table;
    private final FlightCatalog fallback;

    private AirportDirectory(Map<String, GeoPoint> table, FlightCatalog fallback) {
        this.table = table;
        this.fallback = fallback;
    }

    /**
     * Directory backed by an explicit code table only.
     */
    public static AirportDirectory of(Map<String, GeoPoint> airports) {
        return new AirportDirectory(normalize(airports), FlightCatalog.empty());
    }

    /**
     * Directory backed by an explicit table with catalog endpoints as fallback.
     */
    public static AirportDirectory of(Map<String, GeoPoint> airports, FlightCatalog catalog) {
        return new AirportDirectory(normalize(airports), Objects.requireNonNull(catalog, "catalog"));
    }

    /**
     * Directory that only reads catalog endpoints.
     */
    public static AirportDirectory fromCatalog(FlightCatalog catalog) {
        return of(Map.of(), catalog);
    }

    public Optional<GeoPoint> resolve(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String key = normalizeCode(code);
        GeoPoint explicit = table.get(key);
        if (explicit != null) {
            return Optional.of(explicit);
        }
        for (Flight flight : fallback.flights()) {
            if (key.equals(normalizeCode(flight.getDeparture().airport()))) {
                return Optional.of(flight.departurePoint());
            }
        }
        for (Flight flight : fallback.flights()) {
            if (key.equals(normalizeCode(flight.getArrival().airport()))) {
                return Optional.of(flight.arrivalPoint());
            }
        }
        return Optional.empty();
    }

    private static Map<String, GeoPoint> normalize(Map<String, GeoPoint> airports) {
        Objects.requireNonNull(airports, "airports");
        Map<String, GeoPoint> normalized = new HashMap<>(airports.size() * 2);
        airports.forEach((code, point) -> {
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("airport code must be non-blank");
            }
            if (point == null || !point.isValid()) {
                throw new IllegalArgumentException("invalid coordinates for airport " + code + ": " + point);
            }
            normalized.put(normalizeCode(code), point);
        });
        return Map.copyOf(normalized);
    }

    private static String normalizeCode(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
