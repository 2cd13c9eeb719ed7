// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.util.Comparator;
import java.util.Set;

/// Orders gaps for testing. All strategies sort stably so equal gaps keep universe order.
public enum PrioritizationStrategy {
  /// Highest priority first.
  BALANCED,
  /// Gaps next to covered regions first, then highest priority.
  BOUNDARY_FIRST,
  /// Smallest cardinality first with infinite last, then highest priority.
  CARDINALITY_FIRST;

  private static final Comparator<NegativeSpaceRegion> BY_PRIORITY =
      Comparator.comparingDouble(NegativeSpaceRegion::priority).reversed();

  Comparator<NegativeSpaceRegion> comparator(Set<String> boundaryGapIds) {
    return switch (this) {
      case BALANCED -> BY_PRIORITY;
      case BOUNDARY_FIRST -> Comparator.<NegativeSpaceRegion, Boolean>comparing(g -> !boundaryGapIds.contains(g.id()))
          .thenComparing(BY_PRIORITY);
      case CARDINALITY_FIRST -> Comparator.<NegativeSpaceRegion, Cardinality>comparing(NegativeSpaceRegion::cardinality,
          Cardinality::compare).thenComparing(BY_PRIORITY);
    };
  }
}
