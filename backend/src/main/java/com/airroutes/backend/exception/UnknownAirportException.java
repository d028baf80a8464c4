package com.airroutes.backend.exception;

public class UnknownAirportException extends RouteSearchException {

  private static final String ERROR_CODE = "UNKNOWN_AIRPORT";

  private final String airportCode;

  public UnknownAirportException(String airportCode) {
    super(ERROR_CODE, "Unknown airport: " + airportCode);
    this.airportCode = airportCode;
  }

  public String getAirportCode() {
    return airportCode;
  }
}
