package com.airroutes.backend.controller;

import com.airroutes.backend.catalog.AirportDirectory;
import com.airroutes.backend.domain.Airport;
import com.airroutes.backend.dto.AirportSummaryDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

@RestController
@RequestMapping("/api/airports")
public class AirportController {

  private final AirportDirectory airportDirectory;

  public AirportController(AirportDirectory airportDirectory) {
    this.airportDirectory = airportDirectory;
  }

  @GetMapping
  public List<AirportSummaryDto> listAirports() {
    return airportDirectory.findAll().stream()
        .sorted(Comparator.comparing(Airport::code))
        .map(a -> new AirportSummaryDto(a.code(), a.name(), a.city()))
        .toList();
  }
}
