package com.airroutes.backend.algorithms;

import com.airroutes.backend.domain.Flight;
import com.airroutes.backend.exception.InvalidInputException;

import java.util.*;

/**
 * Per-request read-side index over a flight snapshot.
 *
 * Responsibilities:
 *  - Validate the snapshot (unique ids, arrival after departure, non-negative price).
 *  - Group searchable flights by origin airport, sorted by departure time
 *    and then by flight id, so both search passes are map lookups plus a
 *    bounded scan.
 *  - Remember which airports appear anywhere in the snapshot.
 *
 * Instances are immutable and never shared between requests.
 */
public final class FlightGraphIndex {

  static final Comparator<Flight> DEPARTURE_ORDER =
      Comparator.comparing(Flight::getDepartureTimeUtc)
          .thenComparing(Flight::getFlightId);

  /**
   * origin airport code -> unmodifiable list of searchable departures,
   * sorted by {@link #DEPARTURE_ORDER}.
   */
  private final Map<String, List<Flight>> departuresByAirport;

  /**
   * Every airport code seen as origin or destination of a supplied flight,
   * including flights that are filtered out of the search.
   */
  private final Set<String> knownAirports;

  private final int searchableFlightCount;

  private FlightGraphIndex(Map<String, List<Flight>> departuresByAirport,
      Set<String> knownAirports,
      int searchableFlightCount) {
    this.departuresByAirport = departuresByAirport;
    this.knownAirports = knownAirports;
    this.searchableFlightCount = searchableFlightCount;
  }

  /**
   * Build an index over the given snapshot.
   *
   * @throws InvalidInputException if the snapshot violates a data-integrity rule
   */
  public static FlightGraphIndex build(Collection<Flight> flights) {
    Objects.requireNonNull(flights, "flights must not be null");

    validateSnapshot(flights);

    Map<String, List<Flight>> grouped = new HashMap<>();
    Set<String> airports = new HashSet<>();
    int searchable = 0;

    for (Flight flight : flights) {
      airports.add(flight.getOrigin().code());
      airports.add(flight.getDestination().code());

      if (!flight.isSearchable()) {
        continue;
      }
      grouped
          .computeIfAbsent(flight.getOrigin().code(), k -> new ArrayList<>())
          .add(flight);
      searchable++;
    }

    return new FlightGraphIndex(
        sortedUnmodifiable(grouped),
        Collections.unmodifiableSet(airports),
        searchable
    );
  }

  // ---------------------------------------------------------------------------
  // Snapshot validation
  // ---------------------------------------------------------------------------

  private static void validateSnapshot(Collection<Flight> flights) {
    Set<String> seenIds = new HashSet<>();

    for (Flight flight : flights) {
      if (flight == null) {
        throw new InvalidInputException("Flight snapshot contains a null entry");
      }
      if (!seenIds.add(flight.getFlightId())) {
        throw new InvalidInputException("Duplicate flight id in snapshot: " + flight.getFlightId());
      }
      if (!flight.getArrivalTimeUtc().isAfter(flight.getDepartureTimeUtc())) {
        throw new InvalidInputException(
            "Flight " + flight.getFlightId() + " does not arrive after it departs: departureUtc="
                + flight.getDepartureTimeUtc() + ", arrivalUtc=" + flight.getArrivalTimeUtc());
      }
      if (flight.getPrice().signum() < 0) {
        throw new InvalidInputException(
            "Flight " + flight.getFlightId() + " has a negative price: " + flight.getPrice());
      }
    }
  }

  private static Map<String, List<Flight>> sortedUnmodifiable(Map<String, List<Flight>> mutable) {
    Map<String, List<Flight>> result = new HashMap<>();
    for (Map.Entry<String, List<Flight>> entry : mutable.entrySet()) {
      List<Flight> departures = entry.getValue();
      departures.sort(DEPARTURE_ORDER);
      result.put(entry.getKey(), List.copyOf(departures));
    }
    return Collections.unmodifiableMap(result);
  }

  // ---------------------------------------------------------------------------
  // Public API
  // ---------------------------------------------------------------------------

  /**
   * Searchable flights departing the given airport, in departure order.
   * Airports without departures yield an empty list.
   */
  public List<Flight> departuresFrom(String airportCode) {
    List<Flight> departures = departuresByAirport.get(airportCode);
    return departures != null ? departures : List.of();
  }

  public boolean isKnownAirport(String airportCode) {
    return knownAirports.contains(airportCode);
  }

  public Set<String> getKnownAirports() {
    return knownAirports;
  }

  /**
   * Number of flights that passed the scheduled/bookable filter.
   */
  public int getSearchableFlightCount() {
    return searchableFlightCount;
  }
}
