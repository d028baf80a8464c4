package com.airroutes.backend.controller;

import com.airroutes.backend.domain.Flight;
import com.airroutes.backend.domain.RankingCriterion;
import com.airroutes.backend.domain.Route;
import com.airroutes.backend.domain.RoutePage;
import com.airroutes.backend.domain.SearchQuery;
import com.airroutes.backend.dto.FlightSegmentResponse;
import com.airroutes.backend.dto.LayoverResponse;
import com.airroutes.backend.dto.RouteResponse;
import com.airroutes.backend.dto.RouteSearchResponse;
import com.airroutes.backend.exception.InvalidQueryException;
import com.airroutes.backend.service.RouteSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * REST controller exposing the route search API.
 *
 *  GET /api/routes
 *      - origin, destination: IATA codes (case-insensitive)
 *      - date: ISO-8601 (YYYY-MM-DD), local date at the origin
 *      - criterion: "price" (default) or "duration"
 *      - limit: page size, defaults to airroutes.search.default-limit
 *      - offset: routes to skip, defaults to 0
 *
 * The response carries the ranked page plus the total feasible count so
 * clients can page through the result.
 */
@RestController
@RequestMapping("/api/routes")
public class RouteSearchController {

  private static final Logger log = LoggerFactory.getLogger(RouteSearchController.class);

  private static final DateTimeFormatter ISO_WITH_OFFSET = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

  private final RouteSearchService routeSearchService;
  private final int defaultLimit;

  public RouteSearchController(RouteSearchService routeSearchService,
      @Value("${airroutes.search.default-limit:20}") int defaultLimit) {
    this.routeSearchService = routeSearchService;
    this.defaultLimit = defaultLimit;
  }

  /**
   * Example:
   *   GET /api/routes?origin=KBP&destination=LWO&date=2024-05-10&criterion=duration&limit=10
   */
  @GetMapping
  public RouteSearchResponse search(
      @RequestParam("origin") String origin,
      @RequestParam("destination") String destination,
      @RequestParam("date")
      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
      @RequestParam(value = "criterion", defaultValue = "price") String criterion,
      @RequestParam(value = "limit", required = false) Integer limit,
      @RequestParam(value = "offset", defaultValue = "0") int offset
  ) {
    String originCode = origin.trim().toUpperCase(Locale.ROOT);
    String destinationCode = destination.trim().toUpperCase(Locale.ROOT);

    RankingCriterion rankingCriterion = RankingCriterion.fromParameter(criterion)
        .orElseThrow(() -> new InvalidQueryException(
            "Unknown criterion '" + criterion + "', expected 'price' or 'duration'"));

    int pageSize = limit != null ? limit : defaultLimit;

    log.info("Route search request: origin={}, destination={}, date={}, criterion={}, limit={}, offset={}",
        originCode, destinationCode, date, rankingCriterion, pageSize, offset);

    RoutePage page = routeSearchService.findRoutes(new SearchQuery(
        originCode, destinationCode, date, rankingCriterion, pageSize, offset));

    return new RouteSearchResponse(
        page.routes().stream().map(this::toResponse).toList(),
        page.totalCount(),
        page.limit(),
        page.offset()
    );
  }

  // ---------------------------------------------------------------------------
  // Mapping from domain Route -> API RouteResponse
  // ---------------------------------------------------------------------------

  private RouteResponse toResponse(Route route) {
    List<FlightSegmentResponse> segments = route.getLegs().stream()
        .map(this::toSegmentResponse)
        .toList();

    LayoverResponse layover = route.getConnectionAirport()
        .map(airport -> new LayoverResponse(
            airport.code(),
            route.getLayover().orElseThrow().toMinutes()))
        .orElse(null);

    return new RouteResponse(
        route.getLegIds(),
        segments,
        layover,
        route.getTotalDuration().toMinutes(),
        route.getTotalPrice(),
        route.getTransferCount()
    );
  }

  private FlightSegmentResponse toSegmentResponse(Flight flight) {
    return new FlightSegmentResponse(
        flight.getFlightId(),
        flight.getOrigin().code(),
        flight.getOrigin().city(),
        flight.getDestination().code(),
        flight.getDestination().city(),
        flight.getDepartureAtOriginLocal().format(ISO_WITH_OFFSET),
        flight.getArrivalAtDestinationLocal().format(ISO_WITH_OFFSET),
        flight.getPrice()
    );
  }
}
