// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;

import java.util.*;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// Computes the negative space of a universe, scores it and orders it for testing.
///
/// The negative space is the set difference by region id between the universe and the covered ids, so the covered
/// regions and the gaps together are exactly the universe and never share a region.
public final class GapEngine {

  static final List<String> BOUNDARY_KEYWORDS =
      List.of("boundary", "zero", "empty", "single", "min", "max", "infinity", "special");

  static final List<String> SPECIAL_KEYWORDS = List.of("special", "nan", "infinity", "null", "undefined");

  public static final String REASON_BOUNDARY = "boundary region, high bug probability";
  public static final String REASON_SPECIAL = "contains special values";
  public static final String REASON_INFINITE = "requires sampling strategy";
  public static final String REASON_SMALL = "small finite region, should be fully tested";
  public static final String REASON_UNTESTED = "untested region";

  /// @param minPriority gaps scoring below this are dropped
  /// @param maxGaps the most entries kept in the prioritized list
  /// @param includeInfinite when false infinite gaps are dropped
  /// @param strategy how the prioritized list is ordered
  public record GapDetectionOptions(double minPriority, int maxGaps, boolean includeInfinite,
                                    @NotNull PrioritizationStrategy strategy) {
    public static final GapDetectionOptions DEFAULTS =
        new GapDetectionOptions(0, Integer.MAX_VALUE, true, PrioritizationStrategy.BALANCED);

    public GapDetectionOptions {
      Objects.requireNonNull(strategy, "strategy must not be null");
      if (maxGaps < 0) {
        throw new IllegalArgumentException("maxGaps must not be negative: " + maxGaps);
      }
    }

    public GapDetectionOptions withStrategy(PrioritizationStrategy strategy) {
      return new GapDetectionOptions(minPriority, maxGaps, includeInfinite, strategy);
    }

    public GapDetectionOptions withMaxGaps(int maxGaps) {
      return new GapDetectionOptions(minPriority, maxGaps, includeInfinite, strategy);
    }
  }

  /// @param totalGaps the number of gaps after filtering
  /// @param boundaryGapCount gaps next to a covered region
  /// @param interiorGapCount all other gaps
  /// @param totalGapCardinality the infinite absorbing sum of the gap sizes
  /// @param averagePriority the mean score, 0 when there are no gaps
  /// @param highestPriorityGap the first gap with the top score
  public record GapStatistics(int totalGaps, int boundaryGapCount, int interiorGapCount,
                              @NotNull Cardinality totalGapCardinality, double averagePriority,
                              @NotNull Optional<NegativeSpaceRegion> highestPriorityGap) {
  }

  /// @param gaps the filtered gaps in universe order
  /// @param prioritizedGaps the gaps in strategy order, at most `maxGaps` of them
  /// @param boundaryGaps gaps next to a covered region
  /// @param interiorGaps the remaining gaps
  /// @param statistics aggregates over `gaps`
  public record GapAnalysis(@NotNull List<NegativeSpaceRegion> gaps,
                            @NotNull List<NegativeSpaceRegion> prioritizedGaps,
                            @NotNull List<NegativeSpaceRegion> boundaryGaps,
                            @NotNull List<NegativeSpaceRegion> interiorGaps,
                            @NotNull GapStatistics statistics) {
  }

  public GapAnalysis detectGaps(CoverageTracker tracker, GapDetectionOptions options) {
    return detectGaps(tracker.universe(), tracker.getCoveredRegionIds(), options);
  }

  public GapAnalysis detectGaps(List<TypeSpaceRegion> universe, Set<String> coveredIds) {
    return detectGaps(universe, coveredIds, GapDetectionOptions.DEFAULTS);
  }

  public GapAnalysis detectGaps(List<TypeSpaceRegion> universe, Set<String> coveredIds, GapDetectionOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    final var covered = universe.stream().filter(r -> coveredIds.contains(r.id())).toList();
    final List<NegativeSpaceRegion> gaps = negativeSpace(universe, coveredIds).stream()
        .map(this::score)
        .filter(g -> options.includeInfinite() || g.cardinality().isFinite())
        .filter(g -> g.priority() >= options.minPriority())
        .toList();

    final var boundaryGaps = new ArrayList<NegativeSpaceRegion>();
    final var interiorGaps = new ArrayList<NegativeSpaceRegion>();
    for (NegativeSpaceRegion gap : gaps) {
      if (covered.stream().anyMatch(c -> RegionAdjacency.areAdjacent(gap.region(), c))) {
        boundaryGaps.add(gap);
      } else {
        interiorGaps.add(gap);
      }
    }

    final Set<String> boundaryIds = new HashSet<>();
    boundaryGaps.forEach(g -> boundaryIds.add(g.id()));
    final var prioritized = new ArrayList<>(gaps);
    prioritized.sort(options.strategy().comparator(boundaryIds));
    final var limited = prioritized.subList(0, Math.min(options.maxGaps(), prioritized.size()));

    final var analysis = new GapAnalysis(gaps, List.copyOf(limited), List.copyOf(boundaryGaps),
        List.copyOf(interiorGaps), statistics(gaps, boundaryGaps.size(), interiorGaps.size()));
    LOGGER.fine(() -> "Found " + gaps.size() + " gaps in " + universe.size() + " regions, "
        + boundaryGaps.size() + " next to covered regions");
    return analysis;
  }

  /// Universe regions whose id is not covered, in universe order.
  public List<TypeSpaceRegion> negativeSpace(List<TypeSpaceRegion> universe, Set<String> coveredIds) {
    return universe.stream().filter(r -> !coveredIds.contains(r.id())).toList();
  }

  /// Gaps that sit next to the given tested region.
  public List<NegativeSpaceRegion> findAdjacentGaps(List<TypeSpaceRegion> universe, Set<String> coveredIds,
                                                    String testedRegionId) {
    final var tested = universe.stream().filter(r -> r.id().equals(testedRegionId)).findFirst();
    if (tested.isEmpty()) {
      return List.of();
    }
    return detectGaps(universe, coveredIds).gaps().stream()
        .filter(g -> RegionAdjacency.areAdjacent(g.region(), tested.get()))
        .toList();
  }

  public Optional<NegativeSpaceRegion> mostCriticalGap(List<TypeSpaceRegion> universe, Set<String> coveredIds) {
    return detectGaps(universe, coveredIds).prioritizedGaps().stream().findFirst();
  }

  public NegativeSpaceRegion score(TypeSpaceRegion region) {
    return new NegativeSpaceRegion(region, priority(region), reason(region));
  }

  /// Starts at 0.5, rewards boundary and special value regions and small regions, penalizes infinite ones.
  public double priority(TypeSpaceRegion region) {
    double priority = 0.5;
    if (isBoundaryRegion(region)) {
      priority += 0.3;
    }
    if (region.cardinality().isInfinite()) {
      priority -= 0.2;
    } else if (region.cardinality().isAtMost(10)) {
      priority += 0.2;
    } else if (region.cardinality().isAtMost(100)) {
      priority += 0.1;
    }
    if (containsSpecialValues(region)) {
      priority += 0.2;
    }
    return Math.max(0, Math.min(1, priority));
  }

  public String reason(TypeSpaceRegion region) {
    if (isBoundaryRegion(region)) {
      return REASON_BOUNDARY;
    }
    if (containsSpecialValues(region)) {
      return REASON_SPECIAL;
    }
    if (region.cardinality().isInfinite()) {
      return REASON_INFINITE;
    }
    if (region.cardinality().isAtMost(10)) {
      return REASON_SMALL;
    }
    return REASON_UNTESTED;
  }

  static boolean isBoundaryRegion(TypeSpaceRegion region) {
    final String id = region.id().toLowerCase(Locale.ROOT);
    final String description = Objects.requireNonNullElse(region.description(), "").toLowerCase(Locale.ROOT);
    return BOUNDARY_KEYWORDS.stream().anyMatch(k -> id.contains(k) || description.contains(k));
  }

  static boolean containsSpecialValues(TypeSpaceRegion region) {
    final String id = region.id().toLowerCase(Locale.ROOT);
    return SPECIAL_KEYWORDS.stream().anyMatch(id::contains);
  }

  private static GapStatistics statistics(List<NegativeSpaceRegion> gaps, int boundaryCount, int interiorCount) {
    final var total = Cardinality.sum(gaps.stream().map(NegativeSpaceRegion::cardinality).toList());
    final double average = gaps.stream().mapToDouble(NegativeSpaceRegion::priority).average().orElse(0);
    NegativeSpaceRegion highest = null;
    for (NegativeSpaceRegion gap : gaps) {
      if (highest == null || gap.priority() > highest.priority()) {
        highest = gap;
      }
    }
    return new GapStatistics(gaps.size(), boundaryCount, interiorCount, total, average, Optional.ofNullable(highest));
  }
}
