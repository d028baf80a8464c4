package com.airroutes.backend.algorithms;

import com.airroutes.backend.domain.ConnectionPolicy;
import com.airroutes.backend.domain.Flight;
import com.airroutes.backend.domain.Route;
import com.airroutes.backend.exception.InvalidQueryException;
import com.airroutes.backend.exception.UnknownAirportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates every feasible route with at most one connection.
 *
 * Because routes are capped at two legs, there is no need for a general
 * shortest-path relaxation: the search is two passes over a
 * {@link FlightGraphIndex}:
 *  - DIRECT: origin departures that land at the destination,
 *  - CONNECTING: origin departures to any other airport, joined with that
 *    airport's departures to the destination inside the layover window.
 *
 * The engine holds no state; the index and the connection policy are
 * supplied on every call, so concurrent searches never share anything.
 */
@Component
public class RouteSearchEngine {

  private static final Logger log = LoggerFactory.getLogger(RouteSearchEngine.class);

  /**
   * Core search entry point.
   *
   * @param index                 index over the candidate snapshot
   * @param originCode            IATA code of origin airport
   * @param destinationCode       IATA code of destination airport
   * @param departureWindowStart  inclusive lower bound of first-leg departure, in UTC
   * @param departureWindowEnd    exclusive upper bound of first-leg departure, in UTC
   * @param policy                allowed layover window
   * @return feasible routes in discovery order (unranked)
   */
  public List<Route> findFeasibleRoutes(FlightGraphIndex index,
      String originCode,
      String destinationCode,
      Instant departureWindowStart,
      Instant departureWindowEnd,
      ConnectionPolicy policy) {

    Objects.requireNonNull(index, "index must not be null");
    Objects.requireNonNull(originCode, "originCode must not be null");
    Objects.requireNonNull(destinationCode, "destinationCode must not be null");
    Objects.requireNonNull(departureWindowStart, "departureWindowStart must not be null");
    Objects.requireNonNull(departureWindowEnd, "departureWindowEnd must not be null");
    Objects.requireNonNull(policy, "policy must not be null");

    if (originCode.equals(destinationCode)) {
      throw new InvalidQueryException("Origin and destination must differ: " + originCode);
    }
    if (!index.isKnownAirport(originCode)) {
      throw new UnknownAirportException(originCode);
    }
    if (!index.isKnownAirport(destinationCode)) {
      throw new UnknownAirportException(destinationCode);
    }

    SearchContext context = new SearchContext(
        index, originCode, destinationCode, departureWindowStart, departureWindowEnd, policy);

    List<Route> routes = new ArrayList<>();
    for (SearchPass pass : SearchPass.values()) {
      int before = routes.size();
      pass.run(this, context, routes);
      log.debug("{} pass {}->{} produced {} routes",
          pass, originCode, destinationCode, routes.size() - before);
    }

    return routes;
  }

  // ---------------------------------------------------------------------------
  // Direct pass
  // ---------------------------------------------------------------------------

  void collectDirectRoutes(SearchContext context, List<Route> accumulator) {
    for (Flight flight : firstLegCandidates(context)) {
      if (flight.getDestination().code().equals(context.destinationCode())) {
        accumulator.add(Route.direct(flight));
      }
    }
  }

  // ---------------------------------------------------------------------------
  // Connecting pass
  // ---------------------------------------------------------------------------

  void collectConnectingRoutes(SearchContext context, List<Route> accumulator) {
    for (Flight firstLeg : firstLegCandidates(context)) {
      String via = firstLeg.getDestination().code();

      // Direct arrivals belong to the other pass; self-loops only occur in bad data.
      if (via.equals(context.destinationCode()) || via.equals(context.originCode())) {
        continue;
      }

      addValidConnections(firstLeg, context.index().departuresFrom(via), context, accumulator);
    }
  }

  /**
   * Add a route for every flight in {@code candidateNextLegs} that departs
   * inside the layover window after {@code firstLeg} and lands at the
   * destination. Relies on the candidates being sorted by departure time.
   */
  private void addValidConnections(Flight firstLeg,
      List<Flight> candidateNextLegs,
      SearchContext context,
      List<Route> accumulator) {
    if (candidateNextLegs.isEmpty()) {
      return;
    }

    Instant arrivalUtc = firstLeg.getArrivalTimeUtc();
    Instant earliestDepartureUtc = arrivalUtc.plus(context.policy().minConnection());
    Instant latestDepartureUtc = arrivalUtc.plus(context.policy().maxConnection());

    int startIndex = findFirstDepartureNotBefore(candidateNextLegs, earliestDepartureUtc);
    if (startIndex < 0) {
      return;
    }

    for (int i = startIndex; i < candidateNextLegs.size(); i++) {
      Flight nextLeg = candidateNextLegs.get(i);

      // Sorted by departure: everything after this waits even longer.
      if (nextLeg.getDepartureTimeUtc().isAfter(latestDepartureUtc)) {
        break;
      }
      if (!nextLeg.getDestination().code().equals(context.destinationCode())) {
        continue;
      }
      if (nextLeg.getFlightId().equals(firstLeg.getFlightId())) {
        continue;
      }

      accumulator.add(Route.connecting(firstLeg, nextLeg));
    }
  }

  // ---------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------

  /**
   * Origin departures inside {@code [windowStart, windowEnd)}.
   */
  private List<Flight> firstLegCandidates(SearchContext context) {
    if (!context.windowEnd().isAfter(context.windowStart())) {
      return List.of();
    }
    List<Flight> departures = context.index().departuresFrom(context.originCode());

    int from = findFirstDepartureNotBefore(departures, context.windowStart());
    if (from < 0) {
      return List.of();
    }
    int to = findFirstDepartureNotBefore(departures, context.windowEnd());
    if (to < 0) {
      to = departures.size();
    }
    return departures.subList(from, to);
  }

  /**
   * Binary search helper: find the index of the first flight in 'flights'
   * whose departureTimeUtc is not before 'threshold'. Returns -1 if none.
   */
  static int findFirstDepartureNotBefore(List<Flight> flights, Instant threshold) {
    int lo = 0;
    int hi = flights.size() - 1;
    int result = -1;

    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      Instant departure = flights.get(mid).getDepartureTimeUtc();

      if (departure.isBefore(threshold)) {
        lo = mid + 1;
      } else {
        result = mid;
        hi = mid - 1;
      }
    }

    return result;
  }

  /**
   * Everything a pass needs for one search call.
   */
  record SearchContext(FlightGraphIndex index,
      String originCode,
      String destinationCode,
      Instant windowStart,
      Instant windowEnd,
      ConnectionPolicy policy) {
  }

  /**
   * The two passes, run in declaration order.
   */
  private enum SearchPass {

    DIRECT {
      @Override
      void run(RouteSearchEngine engine, SearchContext context, List<Route> accumulator) {
        engine.collectDirectRoutes(context, accumulator);
      }
    },
    CONNECTING {
      @Override
      void run(RouteSearchEngine engine, SearchContext context, List<Route> accumulator) {
        engine.collectConnectingRoutes(context, accumulator);
      }
    };

    abstract void run(RouteSearchEngine engine, SearchContext context, List<Route> accumulator);
  }
}
