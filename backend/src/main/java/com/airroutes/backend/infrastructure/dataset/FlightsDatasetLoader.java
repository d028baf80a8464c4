package com.airroutes.backend.infrastructure.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Locates the JSON dataset backing the in-memory catalog and reads named
 * top-level arrays from it ("airports", "flights").
 *
 * Both arrays go through the same failure rules: an unreadable document,
 * a missing array, or an array with no usable entry stops the application
 * at startup with an {@link IllegalStateException}.
 */
@Component
public class FlightsDatasetLoader {

  private static final Logger log = LoggerFactory.getLogger(FlightsDatasetLoader.class);

  private final Resource datasetResource;
  private final String location;
  private final ObjectMapper objectMapper;

  public FlightsDatasetLoader(
      @Value("${airroutes.dataset.location:classpath:static/flights.json}") String location,
      ResourceLoader resourceLoader,
      ObjectMapper objectMapper
  ) {
    this.location = location;
    this.objectMapper = objectMapper;
    this.datasetResource = resourceLoader.getResource(location);

    if (!this.datasetResource.exists()) {
      log.error("Flights dataset resource does not exist at location: {}", location);
      throw new IllegalStateException("Flights dataset not found at: " + location);
    }

    log.info("Configured flights dataset location: {}", location);
  }

  public InputStream openDatasetStream() throws IOException {
    return datasetResource.getInputStream();
  }

  /**
   * Parse the dataset and return the array stored under {@code arrayName}.
   */
  public JsonNode readArray(String arrayName) {
    try (InputStream is = openDatasetStream()) {
      JsonNode root = objectMapper.readTree(is);
      JsonNode array = root == null ? null : root.get(arrayName);

      if (array == null || !array.isArray()) {
        log.error("Dataset at {} is missing '{}' array", location, arrayName);
        throw new IllegalStateException("Dataset missing '" + arrayName + "' array");
      }
      return array;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read '" + arrayName + "' from dataset at " + location, e);
    }
  }

  /**
   * Fail when none of the entries of {@code arrayName} survived validation.
   */
  public void requireEntries(String arrayName, int validCount, int rawCount) {
    if (validCount == 0) {
      log.error("No valid '{}' entries in dataset at {} ({} raw entries)", arrayName, location, rawCount);
      throw new IllegalStateException("No valid '" + arrayName + "' entries found in dataset");
    }
    if (validCount < rawCount) {
      log.warn("Loaded {} of {} '{}' entries from {}", validCount, rawCount, arrayName, location);
    } else {
      log.info("Loaded {} '{}' entries from {}", validCount, arrayName, location);
    }
  }
}
