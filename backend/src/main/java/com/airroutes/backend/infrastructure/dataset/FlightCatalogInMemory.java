package com.airroutes.backend.infrastructure.dataset;

import com.airroutes.backend.catalog.AirportDirectory;
import com.airroutes.backend.catalog.FlightCatalogReader;
import com.airroutes.backend.domain.Flight;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Flight catalog backed by the JSON dataset, loaded once at startup.
 *
 * Flights of every status are kept: filtering to scheduled, bookable
 * flights is the search's job.
 */
@Component
public class FlightCatalogInMemory implements FlightCatalogReader {

  private static final Logger log = LoggerFactory.getLogger(FlightCatalogInMemory.class);

  /**
   * Immutable list of all valid flights, sorted by departureTimeUtc then id.
   */
  private final List<Flight> flights;

  public FlightCatalogInMemory(FlightsDatasetLoader datasetLoader,
      AirportDirectory airportDirectory,
      FlightJsonMapper flightJsonMapper) {
    JsonNode entries = datasetLoader.readArray("flights");
    this.flights = parseFlights(entries, flightJsonMapper, airportDirectory);
    datasetLoader.requireEntries("flights", flights.size(), entries.size());
  }

  /**
   * Invalid records and repeated ids are skipped with a warning.
   */
  private List<Flight> parseFlights(JsonNode entries,
      FlightJsonMapper flightJsonMapper,
      AirportDirectory airportDirectory) {
    Map<String, Flight> byId = new LinkedHashMap<>();

    for (JsonNode node : entries) {
      flightJsonMapper.toFlight(node, airportDirectory::findByCode).ifPresent(flight -> {
        if (byId.putIfAbsent(flight.getFlightId(), flight) != null) {
          log.warn("Skipping flight with duplicate id {}", flight.getFlightId());
        }
      });
    }

    List<Flight> result = new ArrayList<>(byId.values());
    result.sort(Comparator.comparing(Flight::getDepartureTimeUtc).thenComparing(Flight::getFlightId));
    return List.copyOf(result);
  }

  // ---------------------------------------------------------------------------
  // Public API
  // ---------------------------------------------------------------------------

  @Override
  public List<Flight> loadCandidateFlights(Instant fromInclusive, Instant toExclusive) {
    Objects.requireNonNull(fromInclusive, "fromInclusive must not be null");
    Objects.requireNonNull(toExclusive, "toExclusive must not be null");

    return flights.stream()
        .filter(f -> !f.getDepartureTimeUtc().isBefore(fromInclusive))
        .filter(f -> f.getDepartureTimeUtc().isBefore(toExclusive))
        .toList();
  }
}
