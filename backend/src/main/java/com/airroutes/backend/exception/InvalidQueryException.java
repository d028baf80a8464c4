package com.airroutes.backend.exception;

/**
 * The request itself is malformed or contradictory (same origin and
 * destination, non-positive limit, ...). Raised before any graph work.
 */
public class InvalidQueryException extends RouteSearchException {

  private static final String ERROR_CODE = "INVALID_QUERY";

  public InvalidQueryException(String message) {
    super(ERROR_CODE, message);
  }
}
