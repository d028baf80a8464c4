package com.airroutes.backend.infrastructure.dataset;

import com.airroutes.backend.catalog.AirportDirectory;
import com.airroutes.backend.domain.Airport;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AirportDirectory} over the "airports" array of the dataset.
 * Lookups accept codes in any case and with surrounding blanks.
 */
@Component
public class AirportDirectoryInMemory implements AirportDirectory {

  private final Map<String, Airport> airportsByCode;

  public AirportDirectoryInMemory(FlightsDatasetLoader datasetLoader, AirportJsonMapper airportJsonMapper) {
    JsonNode entries = datasetLoader.readArray("airports");
    this.airportsByCode = airportJsonMapper.toAirportsByCode(entries);
    datasetLoader.requireEntries("airports", airportsByCode.size(), entries.size());
  }

  @Override
  public Optional<Airport> findByCode(String code) {
    return Airport.normalizeCode(code).map(airportsByCode::get);
  }

  /**
   * All airports, ordered by code.
   */
  @Override
  public Collection<Airport> findAll() {
    return airportsByCode.values();
  }
}
