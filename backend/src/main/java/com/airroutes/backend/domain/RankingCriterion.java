package com.airroutes.backend.domain;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Primary ordering key selected by the caller.
 * Each constant knows how to compare two routes on its own key.
 */
public enum RankingCriterion {

  PRICE("price") {
    @Override
    public Comparator<Route> primaryOrder() {
      return Comparator.comparing(Route::getTotalPrice);
    }
  },
  DURATION("duration") {
    @Override
    public Comparator<Route> primaryOrder() {
      return Comparator.comparing(Route::getTotalDuration);
    }
  };

  private final String parameterName;

  RankingCriterion(String parameterName) {
    this.parameterName = parameterName;
  }

  public abstract Comparator<Route> primaryOrder();

  /**
   * Resolve a request parameter value ("price", "DURATION", ...) to a criterion.
   */
  public static Optional<RankingCriterion> fromParameter(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (RankingCriterion criterion : values()) {
      if (criterion.parameterName.equals(normalized)) {
        return Optional.of(criterion);
      }
    }
    return Optional.empty();
  }
}
