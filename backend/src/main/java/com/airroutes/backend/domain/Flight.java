package com.airroutes.backend.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Immutable snapshot of a single scheduled flight as supplied by the catalog.
 *
 * The constructor only rejects nulls: time ordering and price sign are
 * data-integrity concerns checked when a search index is built, so that a
 * corrupt snapshot fails the request instead of the catalog load.
 */
public class Flight {

  private final String flightId;
  private final Airport origin;
  private final Airport destination;
  private final Instant departureTimeUtc;
  private final Instant arrivalTimeUtc;
  private final BigDecimal price;
  private final int seatsAvailable;
  private final FlightStatus status;

  public Flight(String flightId,
      Airport origin,
      Airport destination,
      Instant departureTimeUtc,
      Instant arrivalTimeUtc,
      BigDecimal price,
      int seatsAvailable,
      FlightStatus status) {

    this.flightId = Objects.requireNonNull(flightId, "flightId must not be null");
    this.origin = Objects.requireNonNull(origin, "origin must not be null");
    this.destination = Objects.requireNonNull(destination, "destination must not be null");
    this.departureTimeUtc = Objects.requireNonNull(departureTimeUtc, "departureTimeUtc must not be null");
    this.arrivalTimeUtc = Objects.requireNonNull(arrivalTimeUtc, "arrivalTimeUtc must not be null");
    this.price = Objects.requireNonNull(price, "price must not be null");
    this.seatsAvailable = seatsAvailable;
    this.status = Objects.requireNonNull(status, "status must not be null");
  }

  public String getFlightId() {
    return flightId;
  }

  public Airport getOrigin() {
    return origin;
  }

  public Airport getDestination() {
    return destination;
  }

  public Instant getDepartureTimeUtc() {
    return departureTimeUtc;
  }

  public Instant getArrivalTimeUtc() {
    return arrivalTimeUtc;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public int getSeatsAvailable() {
    return seatsAvailable;
  }

  public FlightStatus getStatus() {
    return status;
  }

  public boolean isBookable() {
    return seatsAvailable > 0;
  }

  /**
   * A flight takes part in route search only while it is still scheduled
   * and has at least one seat left.
   */
  public boolean isSearchable() {
    return status == FlightStatus.SCHEDULED && isBookable();
  }

  /**
   * Departure time in the origin airport's local timezone.
   */
  public ZonedDateTime getDepartureAtOriginLocal() {
    return departureTimeUtc.atZone(origin.timezone());
  }

  /**
   * Arrival time in the destination airport's local timezone.
   */
  public ZonedDateTime getArrivalAtDestinationLocal() {
    return arrivalTimeUtc.atZone(destination.timezone());
  }

  @Override
  public String toString() {
    return flightId + " " + origin.code() + "->" + destination.code();
  }
}
