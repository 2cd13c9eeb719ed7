// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.negative.space.ConstraintSolver.SolverResult;
import io.github.simbo1905.negative.space.ConstraintSolver.SolverStats;
import io.github.simbo1905.negative.space.ConstraintSolver.SolverStatus;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SolverCacheTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static SolverResult result(double v) {
    return new SolverResult(SolverStatus.SUCCESS, List.of(Value.number(v)), 1, Optional.empty(),
        new SolverStats(0, 0, 0));
  }

  final MutableClock clock = new MutableClock(Instant.parse("2025-06-01T00:00:00Z"));
  final SolverCache cache = new SolverCache(clock);

  @Test
  void entriesExpireAfterAnHour() {
    cache.put("k", result(1), 10);
    clock.advance(Duration.ofMinutes(59));
    assertThat(cache.get("k")).hasValue(result(1));
    clock.advance(Duration.ofMinutes(2));
    assertThat(cache.get("k")).isEmpty();
    assertThat(cache.size()).isZero();
  }

  @Test
  void eldestEntryIsEvictedAtCapacity() {
    cache.put("a", result(1), 2);
    cache.put("b", result(2), 2);
    cache.put("c", result(3), 2);
    assertThat(cache.size()).isEqualTo(2);
    assertThat(cache.get("a")).isEmpty();
    assertThat(cache.get("c")).hasValue(result(3));

    cache.put("b", result(4), 2);
    assertThat(cache.get("b")).hasValue(result(4));
    assertThat(cache.get("c")).isPresent();
  }

  @Test
  void zeroCapacityStoresNothing() {
    cache.put("a", result(1), 0);
    assertThat(cache.size()).isZero();
  }

  @Test
  void keyIgnoresDescriptions() {
    final String plain = SolverCache.keyOf(List.of(TypeConstraint.range(1, 2), TypeConstraint.pattern("^a")));
    final String described = SolverCache.keyOf(List.of(new TypeConstraint.Range(1, 2, "small"),
        new TypeConstraint.Pattern("^a", "starts with a")));
    assertThat(described).isEqualTo(plain).startsWith("[").endsWith("]");
    assertThat(SolverCache.keyOf(List.of())).isEqualTo("[]");
  }
}
