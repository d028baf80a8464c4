package com.airroutes.backend.dto;

import java.util.List;

public record RouteSearchResponse(
    List<RouteResponse> routes,
    int totalCount,
    int limit,
    int offset
) {
}
