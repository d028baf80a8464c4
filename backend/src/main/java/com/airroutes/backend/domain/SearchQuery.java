package com.airroutes.backend.domain;

import java.time.LocalDate;

/**
 * A single route search request.
 *
 * @param originCode       IATA code of the departure airport
 * @param destinationCode  IATA code of the arrival airport
 * @param travelDate       first-leg departure date, local to the origin airport
 * @param criterion        primary ranking key
 * @param limit            page size, must be positive
 * @param offset           number of ranked routes to skip, must not be negative
 */
public record SearchQuery(
    String originCode,
    String destinationCode,
    LocalDate travelDate,
    RankingCriterion criterion,
    int limit,
    int offset
) {
}
