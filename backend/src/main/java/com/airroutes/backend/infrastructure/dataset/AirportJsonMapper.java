package com.airroutes.backend.infrastructure.dataset;

import com.airroutes.backend.domain.Airport;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Binds entries of the "airports" array to {@link Airport}s.
 *
 * An entry is skipped, with a warning, when a field is blank, the code is
 * not a three-letter IATA code, or the zone id is unknown to the JVM.
 */
@Component
public class AirportJsonMapper {

  private static final Logger log = LoggerFactory.getLogger(AirportJsonMapper.class);

  @JsonIgnoreProperties(ignoreUnknown = true)
  record AirportEntry(String code, String name, String city, String timezone) {

    boolean hasBlankField() {
      return isBlank(code) || isBlank(name) || isBlank(city) || isBlank(timezone);
    }

    private static boolean isBlank(String value) {
      return value == null || value.isBlank();
    }
  }

  private final ObjectMapper objectMapper;

  public AirportJsonMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Bind a whole "airports" array. The first entry for a code wins; later
   * entries with the same code are dropped. Keys are sorted.
   */
  public SortedMap<String, Airport> toAirportsByCode(JsonNode airportsArray) {
    SortedMap<String, Airport> byCode = new TreeMap<>();
    for (JsonNode node : airportsArray) {
      toAirport(node).ifPresent(airport -> {
        Airport existing = byCode.putIfAbsent(airport.code(), airport);
        if (existing != null) {
          log.warn("Dropping airport '{}' ({}): code already taken by '{}'",
              airport.code(), airport.name(), existing.name());
        }
      });
    }
    return Collections.unmodifiableSortedMap(byCode);
  }

  public Optional<Airport> toAirport(JsonNode node) {
    AirportEntry entry;
    try {
      entry = objectMapper.treeToValue(node, AirportEntry.class);
    } catch (JsonProcessingException e) {
      log.warn("Skipping unreadable airport entry {}: {}", node, e.getOriginalMessage());
      return Optional.empty();
    }

    if (entry == null || entry.hasBlankField()) {
      log.warn("Skipping airport entry with blank fields: {}", entry);
      return Optional.empty();
    }

    Optional<String> code = Airport.normalizeCode(entry.code());
    if (code.isEmpty()) {
      log.warn("Skipping airport with non-IATA code '{}'", entry.code());
      return Optional.empty();
    }

    ZoneId zone;
    try {
      zone = ZoneId.of(entry.timezone().trim());
    } catch (DateTimeException e) {
      log.warn("Skipping airport {} with unknown timezone '{}'", code.get(), entry.timezone());
      return Optional.empty();
    }

    return Optional.of(new Airport(code.get(), entry.name().trim(), entry.city().trim(), zone));
  }
}
