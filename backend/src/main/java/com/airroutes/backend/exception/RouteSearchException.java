package com.airroutes.backend.exception;

/**
 * Base type for failures of a route search. Carries a stable error code
 * that is surfaced to API clients.
 */
public class RouteSearchException extends RuntimeException {

  private final String errorCode;

  public RouteSearchException(String errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
