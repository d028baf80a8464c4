package com.airroutes.backend.algorithms;

import com.airroutes.backend.domain.RankingCriterion;
import com.airroutes.backend.domain.Route;
import com.airroutes.backend.domain.RoutePage;
import com.airroutes.backend.exception.InvalidQueryException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Orders, deduplicates and paginates feasible routes.
 *
 * The order is total, so identical inputs always produce identical pages:
 *  1. the caller's criterion (total price or total duration), ascending,
 *  2. fewer transfers first,
 *  3. earlier first departure,
 *  4. leg-id sequence, compared id by id.
 */
@Component
public class RouteRanker {

  static final Comparator<List<String>> LEG_ID_ORDER = (left, right) -> {
    int shared = Math.min(left.size(), right.size());
    for (int i = 0; i < shared; i++) {
      int cmp = left.get(i).compareTo(right.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(left.size(), right.size());
  };

  public RoutePage rank(Collection<Route> feasibleRoutes,
      RankingCriterion criterion,
      int limit,
      int offset) {

    Objects.requireNonNull(feasibleRoutes, "feasibleRoutes must not be null");
    Objects.requireNonNull(criterion, "criterion must not be null");

    if (limit <= 0) {
      throw new InvalidQueryException("limit must be positive, got " + limit);
    }
    if (offset < 0) {
      throw new InvalidQueryException("offset must not be negative, got " + offset);
    }

    // Route equality is its leg-id sequence, so the set drops duplicates.
    List<Route> ranked = new ArrayList<>(new LinkedHashSet<>(feasibleRoutes));
    ranked.sort(comparatorFor(criterion));

    int total = ranked.size();
    int fromIndex = (int) Math.min((long) offset, total);
    int toIndex = (int) Math.min((long) offset + limit, total);

    return new RoutePage(ranked.subList(fromIndex, toIndex), total, limit, offset);
  }

  static Comparator<Route> comparatorFor(RankingCriterion criterion) {
    return criterion.primaryOrder()
        .thenComparingInt(Route::getTransferCount)
        .thenComparing(Route::getDepartureTimeUtc)
        .thenComparing(Route::getLegIds, LEG_ID_ORDER);
  }
}
