// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.util.*;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// Maps recorded calls of one function onto the regions of its universe.
///
/// The execution log is the only state. An instance belongs to one caller and is not safe for concurrent use.
public final class CoverageTracker {

  private final FunctionSignature signature;
  private final List<TypeSpaceRegion> universe;
  private final Clock clock;
  private final List<TestExecution> executions = new ArrayList<>();

  public CoverageTracker(FunctionSignature signature) {
    this(signature, new TypeUniverse().calculateUniverse(signature), Clock.systemUTC());
  }

  public CoverageTracker(FunctionSignature signature, List<TypeSpaceRegion> universe) {
    this(signature, universe, Clock.systemUTC());
  }

  CoverageTracker(FunctionSignature signature, List<TypeSpaceRegion> universe, Clock clock) {
    this.signature = Objects.requireNonNull(signature, "signature must not be null");
    this.universe = List.copyOf(Objects.requireNonNull(universe, "universe must not be null"));
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /// Coverage totals for the executions recorded so far.
  ///
  /// @param totalInputs the number of recorded executions
  /// @param regionsCovered the number of universe regions with at least one execution
  /// @param totalRegions the number of universe regions
  /// @param coveragePercentage covered cardinality over total cardinality. Empty when either side is infinite,
  ///                           100 for an empty universe.
  /// @param inputsByRegion argument lists grouped by region id in universe order
  /// @param uncoveredRegions regions no execution fell in, in universe order
  public record CoverageStats(int totalInputs,
                              int regionsCovered,
                              int totalRegions,
                              @NotNull OptionalDouble coveragePercentage,
                              @NotNull Map<String, List<List<Value>>> inputsByRegion,
                              @NotNull List<TypeSpaceRegion> uncoveredRegions) {
  }

  public FunctionSignature signature() {
    return signature;
  }

  public List<TypeSpaceRegion> universe() {
    return universe;
  }

  public TestExecution recordExecution(List<Value> args, TestOutput output) {
    Objects.requireNonNull(args, "args must not be null");
    Objects.requireNonNull(output, "output must not be null");
    final Set<String> regionIds = new LinkedHashSet<>();
    for (TypeSpaceRegion region : universe) {
      if (region.containsArguments(args)) {
        regionIds.add(region.id());
      }
    }
    if (regionIds.isEmpty()) {
      LOGGER.fine(() -> "Arguments " + args.stream().map(Value::render).toList() + " of " + signature.name()
          + " fall in no region");
    }
    final var execution = new TestExecution(args, output, clock.instant(), regionIds);
    executions.add(execution);
    LOGGER.finer(() -> "Recorded " + signature.name() + args.stream().map(Value::render).toList() + " in " + regionIds);
    return execution;
  }

  public TestExecution recordExecution(TestInput input, TestOutput output) {
    return recordExecution(input.args(), output);
  }

  public void recordExecutions(Map<List<Value>, TestOutput> batch) {
    batch.forEach(this::recordExecution);
  }

  public List<TestExecution> getExecutions() {
    return Collections.unmodifiableList(executions);
  }

  public List<TestExecution> getExecutionsForRegion(String regionId) {
    return executions.stream().filter(e -> e.regionIds().contains(regionId)).toList();
  }

  public Set<String> getCoveredRegionIds() {
    final Set<String> covered = new LinkedHashSet<>();
    executions.forEach(e -> covered.addAll(e.regionIds()));
    return covered;
  }

  public List<TypeSpaceRegion> getCoveredRegions() {
    final var covered = getCoveredRegionIds();
    return universe.stream().filter(r -> covered.contains(r.id())).toList();
  }

  public boolean isRegionCovered(String regionId) {
    return executions.stream().anyMatch(e -> e.regionIds().contains(regionId));
  }

  public void clear() {
    executions.clear();
  }

  public CoverageStats getCoverageStats() {
    final var coveredIds = getCoveredRegionIds();
    final Map<String, List<List<Value>>> inputsByRegion = new LinkedHashMap<>();
    for (TypeSpaceRegion region : universe) {
      for (TestExecution execution : executions) {
        if (execution.regionIds().contains(region.id())) {
          inputsByRegion.computeIfAbsent(region.id(), k -> new ArrayList<>()).add(execution.args());
        }
      }
    }
    final var covered = universe.stream().filter(r -> coveredIds.contains(r.id())).toList();
    final var uncovered = universe.stream().filter(r -> !coveredIds.contains(r.id())).toList();
    return new CoverageStats(
        executions.size(),
        covered.size(),
        universe.size(),
        coveragePercentage(TypeUniverse.totalCardinality(covered), TypeUniverse.totalCardinality(universe)),
        Collections.unmodifiableMap(inputsByRegion),
        uncovered);
  }

  static OptionalDouble coveragePercentage(Cardinality covered, Cardinality total) {
    if (covered instanceof Cardinality.Finite c && total instanceof Cardinality.Finite t) {
      return t.count() == 0 ? OptionalDouble.of(100d) : OptionalDouble.of(100d * c.count() / t.count());
    }
    return OptionalDouble.empty();
  }
}
