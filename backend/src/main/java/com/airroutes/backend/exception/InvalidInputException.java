package com.airroutes.backend.exception;

/**
 * The flight snapshot handed to the search is internally inconsistent
 * (duplicate identifiers, arrival not after departure, negative price).
 * The whole request fails; no partial result is produced.
 */
public class InvalidInputException extends RouteSearchException {

  private static final String ERROR_CODE = "INVALID_INPUT";

  public InvalidInputException(String message) {
    super(ERROR_CODE, message);
  }
}
