package com.airroutes.backend.domain;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable value object representing a bookable itinerary: one direct leg,
 * or two legs chained through a single connection airport.
 *
 * Two routes are equal when they use the same flights in the same order,
 * regardless of how they were produced. To represent "no possible journeys",
 * use an empty list of routes instead of a Route with zero legs.
 */
public final class Route {

  public static final int MAX_LEGS = 2;

  private final List<Flight> legs;
  private final List<String> legIds;

  public Route(List<Flight> legs) {
    Objects.requireNonNull(legs, "legs must not be null");
    if (legs.isEmpty() || legs.size() > MAX_LEGS) {
      throw new IllegalArgumentException(
          "Route must contain 1 to " + MAX_LEGS + " legs, got " + legs.size());
    }
    if (legs.size() == 2) {
      String arrivedAt = legs.get(0).getDestination().code();
      String departsFrom = legs.get(1).getOrigin().code();
      if (!arrivedAt.equals(departsFrom)) {
        throw new IllegalArgumentException(
            "Connecting legs must meet at the same airport: " + arrivedAt + " vs " + departsFrom);
      }
    }
    this.legs = List.copyOf(legs);
    this.legIds = this.legs.stream().map(Flight::getFlightId).toList();
  }

  public static Route direct(Flight flight) {
    return new Route(List.of(flight));
  }

  public static Route connecting(Flight firstLeg, Flight secondLeg) {
    return new Route(List.of(firstLeg, secondLeg));
  }

  /**
   * Legs in order from origin to final destination.
   */
  public List<Flight> getLegs() {
    return legs;
  }

  /**
   * Flight identifiers of the legs, in travel order. This is the route's identity.
   */
  public List<String> getLegIds() {
    return legIds;
  }

  public Flight getFirstLeg() {
    return legs.get(0);
  }

  public Flight getLastLeg() {
    return legs.get(legs.size() - 1);
  }

  /**
   * 0 for a direct flight, 1 for a connection.
   */
  public int getTransferCount() {
    return legs.size() - 1;
  }

  public BigDecimal getTotalPrice() {
    BigDecimal total = BigDecimal.ZERO;
    for (Flight flight : legs) {
      total = total.add(flight.getPrice());
    }
    return total;
  }

  /**
   * Total travel time from first departure to last arrival.
   */
  public Duration getTotalDuration() {
    return Duration.between(getFirstLeg().getDepartureTimeUtc(), getLastLeg().getArrivalTimeUtc());
  }

  public Instant getDepartureTimeUtc() {
    return getFirstLeg().getDepartureTimeUtc();
  }

  public Instant getArrivalTimeUtc() {
    return getLastLeg().getArrivalTimeUtc();
  }

  /**
   * Time between arrival of the first leg and departure of the second,
   * or empty for a direct route.
   */
  public Optional<Duration> getLayover() {
    if (legs.size() < 2) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(
        legs.get(0).getArrivalTimeUtc(),
        legs.get(1).getDepartureTimeUtc()));
  }

  public Optional<Airport> getConnectionAirport() {
    if (legs.size() < 2) {
      return Optional.empty();
    }
    return Optional.of(legs.get(0).getDestination());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Route other)) {
      return false;
    }
    return legIds.equals(other.legIds);
  }

  @Override
  public int hashCode() {
    return legIds.hashCode();
  }

  @Override
  public String toString() {
    return "Route" + legIds;
  }
}
