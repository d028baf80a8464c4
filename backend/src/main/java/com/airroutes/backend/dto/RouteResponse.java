package com.airroutes.backend.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * API response model for a single ranked route.
 * {@code layover} is null for direct routes.
 */
public record RouteResponse(
    List<String> flightIds,
    List<FlightSegmentResponse> segments,
    LayoverResponse layover,
    long totalDurationMinutes,
    BigDecimal totalPrice,
    int transferCount
) {
}
