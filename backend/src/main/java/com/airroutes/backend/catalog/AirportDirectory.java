package com.airroutes.backend.catalog;

import com.airroutes.backend.domain.Airport;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only lookup of airports by IATA code.
 */
public interface AirportDirectory {

  Optional<Airport> findByCode(String code);

  Collection<Airport> findAll();
}
