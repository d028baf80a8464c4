package com.airroutes.backend.catalog;

import com.airroutes.backend.domain.Flight;

import java.time.Instant;
import java.util.List;

/**
 * Source of candidate flights for a search.
 *
 * Implementations may pre-filter cancelled or sold-out flights, but the
 * search applies its own scheduled/bookable filter regardless.
 */
public interface FlightCatalogReader {

  /**
   * Return every flight departing in {@code [fromInclusive, toExclusive)}.
   * The returned list is a snapshot and must not change afterwards.
   */
  List<Flight> loadCandidateFlights(Instant fromInclusive, Instant toExclusive);
}
