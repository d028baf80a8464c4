package com.airroutes.backend.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Allowed layover window at a connection airport, inclusive on both ends.
 */
public record ConnectionPolicy(Duration minConnection, Duration maxConnection) {

  public ConnectionPolicy {
    Objects.requireNonNull(minConnection, "minConnection must not be null");
    Objects.requireNonNull(maxConnection, "maxConnection must not be null");
    if (minConnection.isNegative()) {
      throw new IllegalArgumentException("minConnection must not be negative: " + minConnection);
    }
    if (maxConnection.compareTo(minConnection) < 0) {
      throw new IllegalArgumentException(
          "maxConnection " + maxConnection + " must not be shorter than minConnection " + minConnection);
    }
  }

  public static ConnectionPolicy ofMinutes(long minMinutes, long maxMinutes) {
    return new ConnectionPolicy(Duration.ofMinutes(minMinutes), Duration.ofMinutes(maxMinutes));
  }
}
