package com.airroutes.backend.config;

import com.airroutes.backend.domain.ConnectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SearchConfiguration {

  private static final Logger log = LoggerFactory.getLogger(SearchConfiguration.class);

  /**
   * Layover window applied to every connecting route. Read once at startup
   * and handed to the search engine on each call.
   */
  @Bean
  public ConnectionPolicy connectionPolicy(
      @Value("${airroutes.search.min-connection:45m}") Duration minConnection,
      @Value("${airroutes.search.max-connection:6h}") Duration maxConnection
  ) {
    ConnectionPolicy policy = new ConnectionPolicy(minConnection, maxConnection);
    log.info("Connection policy: min={}, max={}", minConnection, maxConnection);
    return policy;
  }
}
