package com.airroutes.backend.algorithms;

import com.airroutes.backend.domain.Airport;
import com.airroutes.backend.domain.ConnectionPolicy;
import com.airroutes.backend.domain.Flight;
import com.airroutes.backend.domain.FlightStatus;
import com.airroutes.backend.domain.Route;
import com.airroutes.backend.exception.InvalidQueryException;
import com.airroutes.backend.exception.UnknownAirportException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RouteSearchEngine}.
 *
 * Airports use UTC unless a test is about local time, so the timestamps in
 * each scenario read as wall-clock times. Every test builds its own
 * {@link FlightGraphIndex}; the engine itself is shared, as in production.
 */
class RouteSearchEngineTest {

  private static final ZoneId UTC = ZoneOffset.UTC;

  private static final ConnectionPolicy POLICY = ConnectionPolicy.ofMinutes(30, 360);

  private static final Instant DAY_START = Instant.parse("2024-05-11T00:00:00Z");
  private static final Instant DAY_END = Instant.parse("2024-05-12T00:00:00Z");

  private final RouteSearchEngine engine = new RouteSearchEngine();

  private final Airport kbp = airport("KBP", UTC);
  private final Airport ods = airport("ODS", UTC);
  private final Airport lwo = airport("LWO", UTC);
  private final Airport waw = airport("WAW", UTC);

  // ---------------------------------------------------------------------------
  // Worked examples
  // ---------------------------------------------------------------------------

  /**
   * One KBP->LWO flight 08:00-09:10 gives exactly one direct route.
   */
  @Test
  void search_shouldReturnSingleDirectRoute() {
    Flight direct = flight("PS101", kbp, lwo, "2024-05-11T08:00:00Z", "2024-05-11T09:10:00Z", 75);

    List<Route> result = search(List.of(direct), "KBP", "LWO");

    assertEquals(1, result.size());
    assertEquals(0, result.get(0).getTransferCount());
    assertEquals(List.of("PS101"), result.get(0).getLegIds());
  }

  /**
   * KBP->ODS arrives 08:20, ODS->LWO departs 09:10: 50 minutes >= 30, accepted.
   */
  @Test
  void search_shouldReturnConnectionWhenLayoverIsLongEnough() {
    Flight first = flight("PS201", kbp, ods, "2024-05-11T07:00:00Z", "2024-05-11T08:20:00Z", 60);
    Flight second = flight("PS202", ods, lwo, "2024-05-11T09:10:00Z", "2024-05-11T10:30:00Z", 55);

    List<Route> result = search(List.of(first, second), "KBP", "LWO");

    assertEquals(1, result.size());
    Route route = result.get(0);
    assertEquals(1, route.getTransferCount());
    assertEquals(List.of("PS201", "PS202"), route.getLegIds());
    assertEquals(Duration.ofMinutes(50), route.getLayover().orElseThrow());
  }

  /**
   * Same as above but the onward flight leaves 20 minutes after arrival.
   * No route, and no error either.
   */
  @Test
  void search_shouldReturnEmptyWhenLayoverIsTooShort() {
    Flight first = flight("PS201", kbp, ods, "2024-05-11T07:00:00Z", "2024-05-11T08:20:00Z", 60);
    Flight second = flight("PS202", ods, lwo, "2024-05-11T08:40:00Z", "2024-05-11T10:00:00Z", 55);

    List<Route> result = search(List.of(first, second), "KBP", "LWO");

    assertTrue(result.isEmpty());
  }

  @Test
  void search_shouldRejectSameOriginAndDestination() {
    Flight direct = flight("PS101", kbp, lwo, "2024-05-11T08:00:00Z", "2024-05-11T09:10:00Z", 75);

    assertThrows(InvalidQueryException.class, () -> search(List.of(direct), "KBP", "KBP"));
  }

  @Test
  void search_shouldRejectDestinationMissingFromSnapshot() {
    Flight direct = flight("PS101", kbp, lwo, "2024-05-11T08:00:00Z", "2024-05-11T09:10:00Z", 75);

    UnknownAirportException ex = assertThrows(UnknownAirportException.class,
        () -> search(List.of(direct), "KBP", "HRK"));
    assertEquals("HRK", ex.getAirportCode());
  }

  @Test
  void search_shouldRejectOriginMissingFromSnapshot() {
    Flight direct = flight("PS101", kbp, lwo, "2024-05-11T08:00:00Z", "2024-05-11T09:10:00Z", 75);

    UnknownAirportException ex = assertThrows(UnknownAirportException.class,
        () -> search(List.of(direct), "HRK", "LWO"));
    assertEquals("HRK", ex.getAirportCode());
  }

  // ---------------------------------------------------------------------------
  // Direct pass
  // ---------------------------------------------------------------------------

  @Test
  void search_shouldReturnEveryDirectDepartureOfTheDay() {
    Flight morning = flight("PS101", kbp, lwo, "2024-05-11T06:00:00Z", "2024-05-11T07:10:00Z", 75);
    Flight noon = flight("PS103", kbp, lwo, "2024-05-11T12:00:00Z", "2024-05-11T13:10:00Z", 70);
    Flight evening = flight("PS105", kbp, lwo, "2024-05-11T19:00:00Z", "2024-05-11T20:10:00Z", 65);

    List<Route> result = search(List.of(evening, morning, noon), "KBP", "LWO");

    assertEquals(3, result.size());
    assertTrue(result.stream().allMatch(r -> r.getTransferCount() == 0));
  }

  @Test
  void search_shouldOnlyStartFromFlightsInsideDepartureWindow() {
    Flight dayBefore = flight("PS100", kbp, lwo, "2024-05-10T23:59:00Z", "2024-05-11T01:10:00Z", 75);
    Flight atStart = flight("PS101", kbp, lwo, "2024-05-11T00:00:00Z", "2024-05-11T01:10:00Z", 75);
    Flight atEnd = flight("PS102", kbp, lwo, "2024-05-12T00:00:00Z", "2024-05-12T01:10:00Z", 75);

    List<Route> result = search(List.of(dayBefore, atStart, atEnd), "KBP", "LWO");

    assertEquals(List.of(Route.direct(atStart)), result,
        "Window is [start, end): start inclusive, end exclusive");
  }

  @Test
  void search_shouldIgnoreUnsearchableFlights() {
    Flight cancelled = new Flight("PS101", kbp, lwo,
        Instant.parse("2024-05-11T08:00:00Z"), Instant.parse("2024-05-11T09:10:00Z"),
        new BigDecimal("75.00"), 10, FlightStatus.CANCELLED);
    Flight soldOutSecondLeg = new Flight("PS202", ods, lwo,
        Instant.parse("2024-05-11T09:10:00Z"), Instant.parse("2024-05-11T10:30:00Z"),
        new BigDecimal("55.00"), 0, FlightStatus.SCHEDULED);
    Flight first = flight("PS201", kbp, ods, "2024-05-11T07:00:00Z", "2024-05-11T08:20:00Z", 60);

    List<Route> result = search(List.of(cancelled, soldOutSecondLeg, first), "KBP", "LWO");

    assertTrue(result.isEmpty(), "Cancelled and sold-out flights must never appear in a route");
  }

  // ---------------------------------------------------------------------------
  // Connecting pass
  // ---------------------------------------------------------------------------

  /**
   * Both ends of the layover window are inclusive.
   */
  @Test
  void search_shouldTreatLayoverBoundsAsInclusive() {
    Flight first = flight("PS201", kbp, ods, "2024-05-11T07:00:00Z", "2024-05-11T08:00:00Z", 60);
    Flight atMin = flight("PS202", ods, lwo, "2024-05-11T08:30:00Z", "2024-05-11T09:50:00Z", 55);
    Flight atMax = flight("PS204", ods, lwo, "2024-05-11T14:00:00Z", "2024-05-11T15:20:00Z", 55);
    Flight beyondMax = flight("PS206", ods, lwo, "2024-05-11T14:01:00Z", "2024-05-11T15:21:00Z", 55);
    Flight belowMin = flight("PS208", ods, lwo, "2024-05-11T08:29:00Z", "2024-05-11T09:49:00Z", 55);

    List<Route> result = search(List.of(first, atMin, atMax, beyondMax, belowMin), "KBP", "LWO");

    List<List<String>> legIds = result.stream().map(Route::getLegIds).toList();
    assertEquals(2, result.size());
    assertTrue(legIds.contains(List.of("PS201", "PS202")));
    assertTrue(legIds.contains(List.of("PS201", "PS204")));
  }

  @Test
  void search_shouldAllowSecondLegOnFollowingDay() {
    Flight lateFirst = flight("PS221", kbp, ods, "2024-05-11T21:00:00Z", "2024-05-11T22:20:00Z", 60);
    Flight nextDay = flight("PS222", ods, lwo, "2024-05-12T01:00:00Z", "2024-05-12T02:20:00Z", 55);

    List<Route> result = search(List.of(lateFirst, nextDay), "KBP", "LWO");

    assertEquals(1, result.size(), "Only the first leg is bound to the travel day");
  }

  @Test
  void search_shouldIgnoreSecondLegsToOtherAirports() {
    Flight first = flight("PS201", kbp, ods, "2024-05-11T07:00:00Z", "2024-05-11T08:20:00Z", 60);
    Flight elsewhere = flight("PS301", ods, waw, "2024-05-11T09:10:00Z", "2024-05-11T10:30:00Z", 80);
    Flight onward = flight("PS202", ods, lwo, "2024-05-11T11:00:00Z", "2024-05-11T12:20:00Z", 55);

    List<Route> result = search(List.of(first, elsewhere, onward), "KBP", "LWO");

    assertEquals(List.of(Route.connecting(first, onward)), result);
  }

  /**
   * A flight back to the origin cannot serve as a connection, even if
   * a later departure from the origin reaches the destination.
   */
  @Test
  void search_shouldNotConnectThroughOrigin() {
    Flight loop = flight("PS900", kbp, kbp, "2024-05-11T06:00:00Z", "2024-05-11T06:40:00Z", 20);
    Flight direct = flight("PS101", kbp, lwo, "2024-05-11T08:00:00Z", "2024-05-11T09:10:00Z", 75);

    List<Route> result = search(List.of(loop, direct), "KBP", "LWO");

    assertEquals(List.of(Route.direct(direct)), result);
  }

  @Test
  void search_shouldNotExtendDirectArrivalsIntoConnections() {
    Flight direct = flight("PS101", kbp, lwo, "2024-05-11T08:00:00Z", "2024-05-11T09:10:00Z", 75);
    Flight outOfLwo = flight("PS501", lwo, ods, "2024-05-11T10:00:00Z", "2024-05-11T11:10:00Z", 75);

    List<Route> result = search(List.of(direct, outOfLwo), "KBP", "LWO");

    assertEquals(1, result.size());
    assertEquals(0, result.get(0).getTransferCount());
  }

  /**
   * Kyiv local times: the first leg leaves at 23:30 and lands after midnight.
   * Absolute timestamps alone decide the connection.
   */
  @Test
  void search_shouldHandleArrivalAfterMidnight() {
    ZoneId kyiv = ZoneId.of("Europe/Kiev");
    Airport kbpLocal = airport("KBP", kyiv);
    Airport odsLocal = airport("ODS", kyiv);
    Airport lwoLocal = airport("LWO", kyiv);

    Flight overnight = localFlight("PS701", kbpLocal, odsLocal,
        "2024-05-11T23:30:00", "2024-05-12T00:50:00");
    Flight earlyMorning = localFlight("PS702", odsLocal, lwoLocal,
        "2024-05-12T02:00:00", "2024-05-12T03:20:00");

    Instant dayStart = LocalDateTime.parse("2024-05-11T00:00:00").atZone(kyiv).toInstant();
    Instant dayEnd = LocalDateTime.parse("2024-05-12T00:00:00").atZone(kyiv).toInstant();

    List<Route> result = engine.findFeasibleRoutes(
        FlightGraphIndex.build(List.of(overnight, earlyMorning)),
        "KBP", "LWO", dayStart, dayEnd, POLICY);

    assertEquals(1, result.size());
    assertEquals(Duration.ofMinutes(70), result.get(0).getLayover().orElseThrow());
  }

  @Test
  void search_shouldApplyTheSuppliedPolicy() {
    Flight first = flight("PS201", kbp, ods, "2024-05-11T07:00:00Z", "2024-05-11T08:20:00Z", 60);
    Flight second = flight("PS202", ods, lwo, "2024-05-11T09:10:00Z", "2024-05-11T10:30:00Z", 55);
    FlightGraphIndex index = FlightGraphIndex.build(List.of(first, second));

    List<Route> lenient = engine.findFeasibleRoutes(index, "KBP", "LWO", DAY_START, DAY_END,
        ConnectionPolicy.ofMinutes(30, 120));
    List<Route> strict = engine.findFeasibleRoutes(index, "KBP", "LWO", DAY_START, DAY_END,
        ConnectionPolicy.ofMinutes(60, 120));

    assertEquals(1, lenient.size());
    assertTrue(strict.isEmpty());
  }

  // ---------------------------------------------------------------------------
  // Properties over a denser network
  // ---------------------------------------------------------------------------

  /**
   * Hourly departures on every edge of a small network; each returned route
   * must still satisfy the structural and timing rules.
   */
  @Test
  void search_resultsShouldSatisfyRouteInvariants() {
    List<Airport> airports = List.of(kbp, ods, lwo, waw);
    List<Flight> flights = new ArrayList<>();
    int counter = 0;
    for (Airport from : airports) {
      for (Airport to : airports) {
        if (from == to) {
          continue;
        }
        for (int hour = 0; hour < 24; hour += 3) {
          Instant departure = DAY_START.plus(Duration.ofHours(hour)).plus(Duration.ofMinutes(counter % 50));
          flights.add(new Flight(
              "X" + (counter++),
              from,
              to,
              departure,
              departure.plus(Duration.ofMinutes(55 + (counter % 4) * 20)),
              BigDecimal.valueOf(40 + counter % 17),
              5,
              FlightStatus.SCHEDULED));
        }
      }
    }

    List<Route> result = search(flights, "KBP", "LWO");

    assertFalse(result.isEmpty());
    assertEquals(result.size(), result.stream().distinct().count(), "Passes must not overlap");

    for (Route route : result) {
      Flight first = route.getFirstLeg();
      Flight last = route.getLastLeg();
      assertEquals("KBP", first.getOrigin().code());
      assertEquals("LWO", last.getDestination().code());
      assertFalse(first.getDepartureTimeUtc().isBefore(DAY_START));
      assertTrue(first.getDepartureTimeUtc().isBefore(DAY_END));

      if (route.getTransferCount() == 1) {
        String via = first.getDestination().code();
        assertNotEquals("KBP", via);
        assertNotEquals("LWO", via);

        Duration layover = route.getLayover().orElseThrow();
        assertTrue(layover.compareTo(POLICY.minConnection()) >= 0, "layover below minimum: " + route);
        assertTrue(layover.compareTo(POLICY.maxConnection()) <= 0, "layover above maximum: " + route);
        assertFalse(last.getDepartureTimeUtc().isBefore(first.getArrivalTimeUtc().plus(POLICY.minConnection())));
      } else {
        assertEquals(1, route.getLegs().size());
      }
    }

    assertEquals(result, search(flights, "KBP", "LWO"), "Identical input must give identical output");
  }

  // ---------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------

  private List<Route> search(List<Flight> flights, String origin, String destination) {
    return engine.findFeasibleRoutes(
        FlightGraphIndex.build(flights), origin, destination, DAY_START, DAY_END, POLICY);
  }

  private static Airport airport(String code, ZoneId zone) {
    return new Airport(code, "Airport " + code, "City " + code, zone);
  }

  private static Flight flight(String id,
      Airport origin,
      Airport destination,
      String departureIsoUtc,
      String arrivalIsoUtc,
      double price) {
    return new Flight(
        id,
        origin,
        destination,
        Instant.parse(departureIsoUtc),
        Instant.parse(arrivalIsoUtc),
        BigDecimal.valueOf(price),
        10,
        FlightStatus.SCHEDULED
    );
  }

  private static Flight localFlight(String id,
      Airport origin,
      Airport destination,
      String departureLocal,
      String arrivalLocal) {
    return new Flight(
        id,
        origin,
        destination,
        LocalDateTime.parse(departureLocal).atZone(origin.timezone()).toInstant(),
        LocalDateTime.parse(arrivalLocal).atZone(destination.timezone()).toInstant(),
        new BigDecimal("60.00"),
        10,
        FlightStatus.SCHEDULED
    );
  }
}
