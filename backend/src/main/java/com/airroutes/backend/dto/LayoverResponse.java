package com.airroutes.backend.dto;

/**
 * Layover at the connection airport between the two legs of a route.
 */
public record LayoverResponse(
    String airportCode,
    long durationMinutes
) {
}
