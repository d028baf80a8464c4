package com.airroutes.backend.service;

import com.airroutes.backend.algorithms.FlightGraphIndex;
import com.airroutes.backend.algorithms.RouteRanker;
import com.airroutes.backend.algorithms.RouteSearchEngine;
import com.airroutes.backend.catalog.AirportDirectory;
import com.airroutes.backend.catalog.FlightCatalogReader;
import com.airroutes.backend.domain.Airport;
import com.airroutes.backend.domain.ConnectionPolicy;
import com.airroutes.backend.domain.Flight;
import com.airroutes.backend.domain.Route;
import com.airroutes.backend.domain.RoutePage;
import com.airroutes.backend.domain.SearchQuery;
import com.airroutes.backend.exception.InvalidInputException;
import com.airroutes.backend.exception.InvalidQueryException;
import com.airroutes.backend.exception.UnknownAirportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Application service responsible for orchestrating a route search:
 *  - validates the query before any graph work,
 *  - resolves the origin airport and its timezone,
 *  - computes the UTC departure window for the requested local date,
 *  - loads the candidate snapshot: the day, then the trailing window (room
 *    for the longest first leg), then the maximum connection time, so every
 *    second leg a late first leg can reach is visible,
 *  - builds a fresh index, runs the two-pass search and ranks the result.
 *
 * Nothing is cached between calls; every search sees its own snapshot.
 */
@Service
public class RouteSearchService {

  private static final Logger log = LoggerFactory.getLogger(RouteSearchService.class);

  private final AirportDirectory airportDirectory;
  private final FlightCatalogReader flightCatalog;
  private final RouteSearchEngine searchEngine;
  private final RouteRanker routeRanker;
  private final ConnectionPolicy connectionPolicy;
  private final Duration trailingWindow;

  public RouteSearchService(AirportDirectory airportDirectory,
      FlightCatalogReader flightCatalog,
      RouteSearchEngine searchEngine,
      RouteRanker routeRanker,
      ConnectionPolicy connectionPolicy,
      @Value("${airroutes.search.trailing-window:24h}") Duration trailingWindow) {
    this.airportDirectory = airportDirectory;
    this.flightCatalog = flightCatalog;
    this.searchEngine = searchEngine;
    this.routeRanker = routeRanker;
    this.connectionPolicy = Objects.requireNonNull(connectionPolicy, "connectionPolicy must not be null");
    this.trailingWindow = Objects.requireNonNull(trailingWindow, "trailingWindow must not be null");
    if (trailingWindow.isNegative()) {
      throw new IllegalArgumentException("trailingWindow must not be negative: " + trailingWindow);
    }
  }

  /**
   * Find, rank and paginate routes for the given query.
   *
   * An empty page is a normal outcome when no route exists.
   *
   * @throws InvalidQueryException   if the query is malformed
   * @throws UnknownAirportException if origin or destination is not known for the window
   * @throws InvalidInputException   if the catalog snapshot is inconsistent
   */
  public RoutePage findRoutes(SearchQuery query) {
    Objects.requireNonNull(query, "query must not be null");
    validate(query);

    Airport origin = airportDirectory.findByCode(query.originCode())
        .orElseThrow(() -> new UnknownAirportException(query.originCode()));
    airportDirectory.findByCode(query.destinationCode())
        .orElseThrow(() -> new UnknownAirportException(query.destinationCode()));

    Instant windowStartUtc = startOfDayUtc(origin, query.travelDate());
    Instant windowEndUtc = endOfDayUtc(origin, query.travelDate());

    Instant snapshotEndUtc = windowEndUtc.plus(trailingWindow).plus(connectionPolicy.maxConnection());
    List<Flight> candidates = flightCatalog.loadCandidateFlights(windowStartUtc, snapshotEndUtc);

    FlightGraphIndex index;
    try {
      index = FlightGraphIndex.build(candidates);
    } catch (InvalidInputException e) {
      log.error("Rejecting search {}->{} on {}: {}",
          query.originCode(), query.destinationCode(), query.travelDate(), e.getMessage());
      throw e;
    }

    List<Route> feasible = searchEngine.findFeasibleRoutes(
        index,
        query.originCode(),
        query.destinationCode(),
        windowStartUtc,
        windowEndUtc,
        connectionPolicy
    );

    RoutePage page = routeRanker.rank(feasible, query.criterion(), query.limit(), query.offset());

    log.info("Search {}->{} on {} by {}: {} candidates, {} searchable, {} feasible routes, returning {}",
        query.originCode(), query.destinationCode(), query.travelDate(), query.criterion(),
        candidates.size(), index.getSearchableFlightCount(), page.totalCount(), page.routes().size());

    return page;
  }

  private void validate(SearchQuery query) {
    if (query.originCode() == null || query.originCode().isBlank()) {
      throw new InvalidQueryException("origin must not be blank");
    }
    if (query.destinationCode() == null || query.destinationCode().isBlank()) {
      throw new InvalidQueryException("destination must not be blank");
    }
    if (query.originCode().equals(query.destinationCode())) {
      throw new InvalidQueryException("Origin and destination must differ: " + query.originCode());
    }
    if (query.travelDate() == null) {
      throw new InvalidQueryException("date must not be null");
    }
    if (query.criterion() == null) {
      throw new InvalidQueryException("criterion must not be null");
    }
    if (query.limit() <= 0) {
      throw new InvalidQueryException("limit must be positive, got " + query.limit());
    }
    if (query.offset() < 0) {
      throw new InvalidQueryException("offset must not be negative, got " + query.offset());
    }
  }

  /**
   * Convert the given travelDate (in origin's local timezone) into
   * the UTC instant at the start of that day.
   */
  private Instant startOfDayUtc(Airport origin, LocalDate travelDate) {
    ZonedDateTime startLocal = travelDate.atStartOfDay(origin.timezone());
    return startLocal.toInstant();
  }

  /**
   * Start of the next local day at the origin, in UTC. The window is
   * [startOfDay, nextDayStart).
   */
  private Instant endOfDayUtc(Airport origin, LocalDate travelDate) {
    ZonedDateTime nextDayStartLocal = travelDate.plusDays(1).atStartOfDay(origin.timezone());
    return nextDayStartLocal.toInstant();
  }
}
