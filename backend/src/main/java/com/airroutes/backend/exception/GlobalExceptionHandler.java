package com.airroutes.backend.exception;

import com.airroutes.backend.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps search failures to HTTP responses. Unknown airports get their own
 * status so clients can tell them apart from an empty result.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidQueryException.class)
  public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryException ex) {
    log.warn("Bad request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
  }

  @ExceptionHandler(UnknownAirportException.class)
  public ResponseEntity<ErrorResponse> handleUnknownAirport(UnknownAirportException ex) {
    log.warn("Unknown airport: {}", ex.getAirportCode());
    return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
  }

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException ex) {
    log.error("Flight catalog integrity failure: {}", ex.getMessage());
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(),
        "Flight data is inconsistent, search could not be completed");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParam(MissingServletRequestParameterException ex) {
    log.warn("Missing parameter: {}", ex.getParameterName());
    return respond(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
        "Required parameter missing: " + ex.getParameterName());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    log.warn("Type mismatch: parameter={}", ex.getName());
    return respond(HttpStatus.BAD_REQUEST, "TYPE_MISMATCH",
        "Invalid value for parameter: " + ex.getName());
  }

  @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(Exception ex) {
    log.debug("Not found: {}", ex.getMessage());
    return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "No such endpoint");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    log.error("Unexpected error while handling request", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected server error");
  }

  private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(code, message));
  }
}
