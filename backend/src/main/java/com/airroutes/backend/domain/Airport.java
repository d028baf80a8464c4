package com.airroutes.backend.domain;

import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * An airport the catalog knows about.
 *
 * Codes are three-letter IATA codes in upper case; every lookup in the
 * search compares codes by equality, so the form is enforced here rather
 * than at each call site. The zone is used to read local timestamps.
 */
public record Airport(String code, String name, String city, ZoneId timezone) {

  private static final Pattern IATA_CODE = Pattern.compile("[A-Z]{3}");

  public Airport {
    Objects.requireNonNull(code, "code must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(city, "city must not be null");
    Objects.requireNonNull(timezone, "timezone must not be null");
    if (!IATA_CODE.matcher(code).matches()) {
      throw new IllegalArgumentException("Airport code must be three upper-case letters: '" + code + "'");
    }
  }

  /**
   * Canonical form of a user- or dataset-supplied code ("kbp " -> "KBP"),
   * or empty if it cannot be an IATA code at all.
   */
  public static Optional<String> normalizeCode(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String candidate = raw.trim().toUpperCase(Locale.ROOT);
    return IATA_CODE.matcher(candidate).matches() ? Optional.of(candidate) : Optional.empty();
  }

  @Override
  public String toString() {
    return code;
  }
}
