// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Finds the inputs a function's tests have never tried and proposes test cases for them.
///
/// The analysis partitions the input space of a [FunctionSignature] into regions, marks the regions the observed
/// inputs fall in, ranks the rest as gaps and walks the gaps' boundaries for concrete inputs:
///
/// ```java
/// final var signature = FunctionSignature.of("divide",
///     FunctionSignature.Parameter.of("a", TypeNode.primitive("number")),
///     FunctionSignature.Parameter.of("b", TypeNode.primitive("number")));
/// try (NegativeSpace analysis = NegativeSpace.forSignature(signature)) {
///   final var result = analysis.analyze(List.of(List.of(Value.number(6), Value.number(3))));
///   result.testCases().forEach(t -> System.out.println(t.description()));
/// }
/// ```
///
/// Logging uses `java.util.logging` under the name of this interface.
public sealed interface NegativeSpace extends AutoCloseable permits NegativeSpaceAnalyzer {

  Logger LOGGER = Logger.getLogger(NegativeSpace.class.getName());

  /// @param signature the analysed function
  /// @param universe every region of its input space
  /// @param coverage which regions the observed inputs covered
  /// @param gaps the uncovered regions, scored and ordered
  /// @param testCases proposed tests for the gaps
  record AnalysisResult(@NotNull FunctionSignature signature,
                        @NotNull List<TypeSpaceRegion> universe,
                        @NotNull CoverageTracker.CoverageStats coverage,
                        @NotNull GapEngine.GapAnalysis gaps,
                        @NotNull List<TestCaseGenerator.TestCase> testCases) {
    public AnalysisResult {
      Objects.requireNonNull(signature, "signature must not be null");
      universe = List.copyOf(universe);
      Objects.requireNonNull(coverage, "coverage must not be null");
      Objects.requireNonNull(gaps, "gaps must not be null");
      testCases = List.copyOf(testCases);
    }
  }

  /// An analysis with [NegativeSpaceConfig#fromSystemProperties()].
  static NegativeSpace forSignature(FunctionSignature signature) {
    return forSignature(signature, NegativeSpaceConfig.fromSystemProperties());
  }

  /// When the config enables the solver and the Z3 native library loads, the analysis owns a Z3 backed solver
  /// and closes it on [#close()].
  static NegativeSpace forSignature(FunctionSignature signature, NegativeSpaceConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    if (config.smtSolverEnabled()) {
      if (Z3Backend.isNativeAvailable()) {
        final var solver = new ConstraintSolver();
        solver.init(SmtBackend.SmtOptions.DEFAULTS.withTimeout(config.timeoutMs()));
        return new NegativeSpaceAnalyzer(signature, config, solver, true);
      }
      LOGGER.warning(() -> "Solver enabled for " + signature.name() + " but Z3 cannot be loaded, continuing without it");
    }
    return new NegativeSpaceAnalyzer(signature, config, null, false);
  }

  /// Uses the caller's solver, which must already be initialized and which the caller closes.
  static NegativeSpace forSignature(FunctionSignature signature, NegativeSpaceConfig config,
                                    @Nullable ConstraintSolver solver) {
    return new NegativeSpaceAnalyzer(signature, config, solver, false);
  }

  FunctionSignature signature();

  NegativeSpaceConfig config();

  /// Analyses a new tracker fed with the observed argument lists, each recorded as returning undefined.
  AnalysisResult analyze(List<List<Value>> observedInputs);

  /// Analyses observed calls together with what they produced.
  AnalysisResult analyze(Map<List<Value>, TestOutput> observedCalls);

  /// Analyses the executions already recorded in a tracker for this signature.
  AnalysisResult analyze(CoverageTracker tracker);

  @Override
  void close();
}
