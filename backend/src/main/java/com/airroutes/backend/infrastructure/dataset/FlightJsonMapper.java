package com.airroutes.backend.infrastructure.dataset;

import com.airroutes.backend.domain.Airport;
import com.airroutes.backend.domain.Flight;
import com.airroutes.backend.domain.FlightStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Component
public class FlightJsonMapper {

  private static final Logger log = LoggerFactory.getLogger(FlightJsonMapper.class);

  private static final String STATUS_KEY = "status";

  private enum FlightJsonField {
    ID("id"),
    ORIGIN("origin"),
    DESTINATION("destination"),
    DEPARTURE_TIME("departureTime"),
    ARRIVAL_TIME("arrivalTime"),
    PRICE("price"),
    SEATS_AVAILABLE("seatsAvailable");

    private final String jsonKey;

    FlightJsonField(String jsonKey) {
      this.jsonKey = jsonKey;
    }

    public String jsonKey() {
      return jsonKey;
    }
  }

  // Small helper types to keep code readable
  private record AirportPair(Airport origin, Airport destination) {}
  private record TimeBounds(Instant departureUtc, Instant arrivalUtc) {}

  /**
   * Convert a single JSON node into a Flight, or empty if invalid.
   *
   * Departure and arrival are local date-times in the origin and destination
   * airport zones respectively. A missing "status" means SCHEDULED.
   *
   * @param node           flight JSON object
   * @param airportLookup  resolves a normalized IATA code to its airport
   */
  public Optional<Flight> toFlight(JsonNode node, Function<String, Optional<Airport>> airportLookup) {
    Map<FlightJsonField, String> raw = new EnumMap<>(FlightJsonField.class);
    for (FlightJsonField field : FlightJsonField.values()) {
      raw.put(field, textOrNull(node, field.jsonKey()));
    }

    List<FlightJsonField> missingFields = raw.entrySet().stream()
        .filter(e -> e.getValue() == null || e.getValue().isBlank())
        .map(Map.Entry::getKey)
        .toList();

    if (!missingFields.isEmpty()) {
      log.warn("Skipping flight due to missing fields {}. Raw values: {}", missingFields, raw);
      return Optional.empty();
    }

    String flightId = raw.get(FlightJsonField.ID).trim();

    Optional<AirportPair> airports = resolveAirports(
        flightId, raw.get(FlightJsonField.ORIGIN), raw.get(FlightJsonField.DESTINATION), airportLookup);
    if (airports.isEmpty()) {
      return Optional.empty();
    }

    Optional<TimeBounds> timeBounds = parseAndValidateTimes(
        flightId,
        raw.get(FlightJsonField.DEPARTURE_TIME),
        raw.get(FlightJsonField.ARRIVAL_TIME),
        airports.get());
    if (timeBounds.isEmpty()) {
      return Optional.empty();
    }

    Optional<BigDecimal> price = parsePrice(flightId, raw.get(FlightJsonField.PRICE));
    if (price.isEmpty()) {
      return Optional.empty();
    }

    Optional<Integer> seats = parseSeats(flightId, raw.get(FlightJsonField.SEATS_AVAILABLE));
    if (seats.isEmpty()) {
      return Optional.empty();
    }

    Optional<FlightStatus> status = parseStatus(flightId, textOrNull(node, STATUS_KEY));
    if (status.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(new Flight(
        flightId,
        airports.get().origin(),
        airports.get().destination(),
        timeBounds.get().departureUtc(),
        timeBounds.get().arrivalUtc(),
        price.get(),
        seats.get(),
        status.get()
    ));
  }

  private Optional<AirportPair> resolveAirports(String flightId,
      String originCode,
      String destinationCode,
      Function<String, Optional<Airport>> airportLookup) {
    Optional<Airport> origin = Airport.normalizeCode(originCode).flatMap(airportLookup);
    if (origin.isEmpty()) {
      log.warn("Skipping flight {} due to unknown origin airport code: {}", flightId, originCode);
      return Optional.empty();
    }

    Optional<Airport> destination = Airport.normalizeCode(destinationCode).flatMap(airportLookup);
    if (destination.isEmpty()) {
      log.warn("Skipping flight {} due to unknown destination airport code: {}", flightId, destinationCode);
      return Optional.empty();
    }

    return Optional.of(new AirportPair(origin.get(), destination.get()));
  }

  private Optional<TimeBounds> parseAndValidateTimes(String flightId,
      String departureText,
      String arrivalText,
      AirportPair airports) {
    try {
      Instant departureUtc = LocalDateTime.parse(departureText)
          .atZone(airports.origin().timezone())
          .toInstant();
      Instant arrivalUtc = LocalDateTime.parse(arrivalText)
          .atZone(airports.destination().timezone())
          .toInstant();

      if (!arrivalUtc.isAfter(departureUtc)) {
        log.warn(
            "Skipping flight {} because arrival time is not after departure. departureUtc={}, arrivalUtc={}",
            flightId, departureUtc, arrivalUtc
        );
        return Optional.empty();
      }

      return Optional.of(new TimeBounds(departureUtc, arrivalUtc));
    } catch (DateTimeParseException e) {
      log.warn("Skipping flight {} due to invalid datetime. departure='{}', arrival='{}'",
          flightId, departureText, arrivalText);
      return Optional.empty();
    }
  }

  private Optional<BigDecimal> parsePrice(String flightId, String priceText) {
    try {
      BigDecimal price = new BigDecimal(priceText.trim());
      if (price.signum() < 0) {
        log.warn("Skipping flight {} due to negative price '{}'", flightId, priceText);
        return Optional.empty();
      }
      return Optional.of(price);
    } catch (NumberFormatException e) {
      log.warn("Skipping flight {} due to invalid price '{}'", flightId, priceText);
      return Optional.empty();
    }
  }

  private Optional<Integer> parseSeats(String flightId, String seatsText) {
    try {
      int seats = Integer.parseInt(seatsText.trim());
      if (seats < 0) {
        log.warn("Skipping flight {} due to negative seat count '{}'", flightId, seatsText);
        return Optional.empty();
      }
      return Optional.of(seats);
    } catch (NumberFormatException e) {
      log.warn("Skipping flight {} due to invalid seat count '{}'", flightId, seatsText);
      return Optional.empty();
    }
  }

  private Optional<FlightStatus> parseStatus(String flightId, String statusText) {
    if (statusText == null || statusText.isBlank()) {
      return Optional.of(FlightStatus.SCHEDULED);
    }
    try {
      return Optional.of(FlightStatus.valueOf(statusText.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      log.warn("Skipping flight {} due to unknown status '{}'", flightId, statusText);
      return Optional.empty();
    }
  }

  private String textOrNull(JsonNode node, String fieldName) {
    JsonNode value = node.get(fieldName);
    return value != null && !value.isNull() ? value.asText() : null;
  }
}
