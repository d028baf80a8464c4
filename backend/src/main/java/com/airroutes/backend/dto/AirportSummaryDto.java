package com.airroutes.backend.dto;

public record AirportSummaryDto(
    String code,
    String name,
    String city
) {
}
