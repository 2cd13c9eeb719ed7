// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/// The [NegativeSpace] pipeline: universe, coverage, gaps, then test cases.
final class NegativeSpaceAnalyzer implements NegativeSpace {

  private final FunctionSignature signature;
  private final NegativeSpaceConfig config;
  private final @Nullable ConstraintSolver solver;
  private final boolean ownsSolver;
  private final List<TypeSpaceRegion> universe;
  private final GapEngine gapEngine = new GapEngine();

  NegativeSpaceAnalyzer(FunctionSignature signature, NegativeSpaceConfig config, @Nullable ConstraintSolver solver,
                        boolean ownsSolver) {
    this.signature = Objects.requireNonNull(signature, "signature must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.solver = solver;
    this.ownsSolver = ownsSolver;
    this.universe = new TypeUniverse().calculateUniverse(signature);
    LOGGER.fine(() -> "Universe of " + signature + " has " + universe.size() + " regions, cardinality "
        + TypeUniverse.totalCardinality(universe));
  }

  @Override
  public FunctionSignature signature() {
    return signature;
  }

  @Override
  public NegativeSpaceConfig config() {
    return config;
  }

  @Override
  public AnalysisResult analyze(List<List<Value>> observedInputs) {
    final var tracker = new CoverageTracker(signature, universe);
    observedInputs.forEach(args -> tracker.recordExecution(args, TestOutput.returned(Value.UNDEFINED)));
    return analyze(tracker);
  }

  @Override
  public AnalysisResult analyze(Map<List<Value>, TestOutput> observedCalls) {
    final var tracker = new CoverageTracker(signature, universe);
    tracker.recordExecutions(observedCalls);
    return analyze(tracker);
  }

  @Override
  public AnalysisResult analyze(CoverageTracker tracker) {
    if (!tracker.signature().equals(signature)) {
      throw new IllegalArgumentException("Tracker is for " + tracker.signature() + " not " + signature);
    }
    final var gapOptions = GapEngine.GapDetectionOptions.DEFAULTS.withMaxGaps(config.maxNegativeSpaceRegions());
    final var gaps = gapEngine.detectGaps(tracker, gapOptions);
    final var generationOptions = TestCaseGenerator.TestGenerationOptions.DEFAULTS
        .withMaxTests(config.maxBoundaryTests())
        .withSpecialValues(config.includeEdgeCases())
        .withSolver(config.smtSolverEnabled() && solver != null)
        .withSolverTimeout(config.timeoutMs());
    final var tests = new TestCaseGenerator(signature, solver).generateTests(gaps.prioritizedGaps(), generationOptions);
    final var coverage = tracker.getCoverageStats();
    LOGGER.info(() -> signature.name() + ": " + coverage.regionsCovered() + " of " + coverage.totalRegions()
        + " regions covered, " + gaps.statistics().totalGaps() + " gaps, " + tests.size() + " proposed tests");
    return new AnalysisResult(signature, tracker.universe(), coverage, gaps, tests);
  }

  @Override
  public void close() {
    if (ownsSolver && solver != null) {
      solver.close();
    }
  }

  @Override
  public String toString() {
    return "NegativeSpaceAnalyzer[" + signature + ", " + config + "]";
  }
}
