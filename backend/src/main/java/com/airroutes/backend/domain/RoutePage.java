package com.airroutes.backend.domain;

import java.util.List;

/**
 * One page of ranked routes. {@code totalCount} is the size of the whole
 * deduplicated feasible set and does not depend on limit/offset.
 */
public record RoutePage(List<Route> routes, int totalCount, int limit, int offset) {

  public RoutePage {
    routes = List.copyOf(routes);
  }
}
