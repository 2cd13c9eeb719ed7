// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// Solver results keyed by their constraint list. Entries expire after [#TTL] and the oldest insertion is evicted
/// first once the capacity is reached.
final class SolverCache {

  static final Duration TTL = Duration.ofHours(1);

  private record Entry(ConstraintSolver.SolverResult result, Instant storedAt) {
  }

  private final Map<String, Entry> entries = new LinkedHashMap<>();
  private final Clock clock;

  SolverCache(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  static String keyOf(List<TypeConstraint> constraints) {
    return constraints.stream().map(TypeConstraint::cacheKey).collect(Collectors.joining(",", "[", "]"));
  }

  Optional<ConstraintSolver.SolverResult> get(String key) {
    final Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (Duration.between(entry.storedAt(), clock.instant()).compareTo(TTL) > 0) {
      entries.remove(key);
      LOGGER.finer(() -> "Expired cached solution for " + key);
      return Optional.empty();
    }
    return Optional.of(entry.result());
  }

  void put(String key, ConstraintSolver.SolverResult result, int capacity) {
    if (capacity <= 0) {
      return;
    }
    if (!entries.containsKey(key)) {
      while (entries.size() >= capacity) {
        final String eldest = entries.keySet().iterator().next();
        entries.remove(eldest);
        LOGGER.finer(() -> "Evicted cached solution for " + eldest);
      }
    }
    entries.put(key, new Entry(result, clock.instant()));
  }

  int size() {
    return entries.size();
  }

  void clear() {
    entries.clear();
  }
}
