// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// Turns gaps into test cases for the function under analysis.
///
/// Gaps are visited highest priority first. Each gap is walked with the [BoundaryWalker] and, when a solver is
/// available and enabled, its constraints are also solved for satisfying values.
public final class TestCaseGenerator {

  public enum ExpectedBehavior {SHOULD_RETURN, SHOULD_THROW, SHOULD_SATISFY}

  /// Orders for [#prioritizeTests].
  public enum TestOrdering {PRIORITY, BOUNDARY_FIRST, ERROR_FIRST}

  /// @param id the region id
  /// @param type the region type
  /// @param reason why the gap was ranked where it was
  public record RegionRef(@NotNull String id, @NotNull TypeNode type, @NotNull String reason) {
    public RegionRef {
      Objects.requireNonNull(id, "id must not be null");
      Objects.requireNonNull(type, "type must not be null");
      Objects.requireNonNull(reason, "reason must not be null");
    }
  }

  /// @param id `test-N`, unique per generator
  /// @param description a one line summary of the call and why it matters
  /// @param functionName the function under test
  /// @param inputs the call arguments
  /// @param expectedBehavior what the call is expected to do
  /// @param expectedValue a textual expectation matching the behavior
  /// @param priority the gap priority
  /// @param region the gap the case came from
  /// @param generated when the case was made
  /// @param explanation why the input was chosen, absent when explanations are off
  /// @param boundaryPoint true for walked inputs, false for solver values
  public record TestCase(@NotNull String id,
                         @NotNull String description,
                         @NotNull String functionName,
                         @NotNull List<Value> inputs,
                         @NotNull ExpectedBehavior expectedBehavior,
                         @NotNull String expectedValue,
                         double priority,
                         @NotNull RegionRef region,
                         @NotNull Instant generated,
                         @Nullable String explanation,
                         boolean boundaryPoint) {
    public TestCase {
      Objects.requireNonNull(id, "id must not be null");
      Objects.requireNonNull(description, "description must not be null");
      Objects.requireNonNull(functionName, "functionName must not be null");
      inputs = List.copyOf(inputs);
      Objects.requireNonNull(expectedBehavior, "expectedBehavior must not be null");
      Objects.requireNonNull(expectedValue, "expectedValue must not be null");
      Objects.requireNonNull(region, "region must not be null");
      Objects.requireNonNull(generated, "generated must not be null");
    }
  }

  public record TestGenerationOptions(int maxTests,
                                      double priorityThreshold,
                                      boolean includeExplanations,
                                      int explorationDepth,
                                      int maxInputsPerRegion,
                                      boolean includeSpecialValues,
                                      boolean useSolver,
                                      long solverTimeoutMs) {
    public static final TestGenerationOptions DEFAULTS =
        new TestGenerationOptions(Integer.MAX_VALUE, 0, true, 2, 10, true, false, 5000);

    public TestGenerationOptions {
      if (maxTests < 0) {
        throw new IllegalArgumentException("maxTests must not be negative: " + maxTests);
      }
      if (maxInputsPerRegion < 0) {
        throw new IllegalArgumentException("maxInputsPerRegion must not be negative: " + maxInputsPerRegion);
      }
      if (explorationDepth < 1 || explorationDepth > 3) {
        throw new IllegalArgumentException("explorationDepth must be 1, 2 or 3: " + explorationDepth);
      }
      if (solverTimeoutMs <= 0) {
        throw new IllegalArgumentException("solverTimeoutMs must be positive: " + solverTimeoutMs);
      }
    }

    public TestGenerationOptions withMaxTests(int maxTests) {
      return new TestGenerationOptions(maxTests, priorityThreshold, includeExplanations, explorationDepth,
          maxInputsPerRegion, includeSpecialValues, useSolver, solverTimeoutMs);
    }

    public TestGenerationOptions withPriorityThreshold(double priorityThreshold) {
      return new TestGenerationOptions(maxTests, priorityThreshold, includeExplanations, explorationDepth,
          maxInputsPerRegion, includeSpecialValues, useSolver, solverTimeoutMs);
    }

    public TestGenerationOptions withExplanations(boolean includeExplanations) {
      return new TestGenerationOptions(maxTests, priorityThreshold, includeExplanations, explorationDepth,
          maxInputsPerRegion, includeSpecialValues, useSolver, solverTimeoutMs);
    }

    public TestGenerationOptions withSpecialValues(boolean includeSpecialValues) {
      return new TestGenerationOptions(maxTests, priorityThreshold, includeExplanations, explorationDepth,
          maxInputsPerRegion, includeSpecialValues, useSolver, solverTimeoutMs);
    }

    public TestGenerationOptions withSolverTimeout(long solverTimeoutMs) {
      return new TestGenerationOptions(maxTests, priorityThreshold, includeExplanations, explorationDepth,
          maxInputsPerRegion, includeSpecialValues, useSolver, solverTimeoutMs);
    }

    public TestGenerationOptions withDepth(int explorationDepth) {
      return new TestGenerationOptions(maxTests, priorityThreshold, includeExplanations, explorationDepth,
          maxInputsPerRegion, includeSpecialValues, useSolver, solverTimeoutMs);
    }

    public TestGenerationOptions withSolver(boolean useSolver) {
      return new TestGenerationOptions(maxTests, priorityThreshold, includeExplanations, explorationDepth,
          maxInputsPerRegion, includeSpecialValues, useSolver, solverTimeoutMs);
    }
  }

  /// Priority bands are high at 0.8 and above, medium from 0.5 and low below that.
  public record TestGenerationStats(int totalTests,
                                    int highPriority,
                                    int mediumPriority,
                                    int lowPriority,
                                    @NotNull Map<String, Integer> testsByRegion,
                                    @NotNull Map<ExpectedBehavior, Integer> testsByBehavior,
                                    double averagePriority) {
  }

  private final FunctionSignature signature;
  private final BoundaryWalker walker;
  private final @Nullable ConstraintSolver solver;
  private final Clock clock;
  private int testCounter;

  public TestCaseGenerator(FunctionSignature signature) {
    this(signature, null);
  }

  /// @param solver used for constrained gaps when the options ask for it, may be null
  public TestCaseGenerator(FunctionSignature signature, @Nullable ConstraintSolver solver) {
    this(signature, solver, Clock.systemUTC());
  }

  TestCaseGenerator(FunctionSignature signature, @Nullable ConstraintSolver solver, Clock clock) {
    this.signature = Objects.requireNonNull(signature, "signature must not be null");
    this.walker = new BoundaryWalker(signature);
    this.solver = solver;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public List<TestCase> generateTests(List<NegativeSpaceRegion> gaps) {
    return generateTests(gaps, TestGenerationOptions.DEFAULTS);
  }

  public List<TestCase> generateTests(List<NegativeSpaceRegion> gaps, TestGenerationOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    final var ordered = gaps.stream()
        .filter(g -> g.priority() >= options.priorityThreshold())
        .sorted(Comparator.comparingDouble(NegativeSpaceRegion::priority).reversed())
        .toList();
    final var tests = new ArrayList<TestCase>();
    for (NegativeSpaceRegion gap : ordered) {
      if (tests.size() >= options.maxTests()) {
        break;
      }
      final int budget = Math.min(options.maxTests() - tests.size(), options.maxInputsPerRegion());
      tests.addAll(generateTestsForGap(gap, budget, options));
    }
    LOGGER.fine(() -> "Generated " + tests.size() + " tests for " + signature.name() + " from " + ordered.size()
        + " of " + gaps.size() + " gaps");
    return tests;
  }

  /// Test cases for one gap, at most `maxTests` of them. When the solver is used it may fill up to half of them;
  /// walked boundary inputs take the rest and come first.
  public List<TestCase> generateTestsForGap(NegativeSpaceRegion gap, int maxTests, TestGenerationOptions options) {
    if (maxTests <= 0) {
      return List.of();
    }
    final List<Value> solved = options.useSolver() ? solveValues(gap, Math.max(1, maxTests / 2), options) : List.of();
    final var walk = walker.walkBoundary(gap, new BoundaryWalker.BoundaryWalkOptions(
        Math.max(0, maxTests - solved.size()), options.includeSpecialValues(), options.explorationDepth()));
    final var tests = new ArrayList<TestCase>();
    final var seen = new HashSet<List<Value>>();
    for (int i = 0; i < walk.testInputs().size(); i++) {
      final TestInput input = walk.testInputs().get(i);
      final String explanation = options.includeExplanations() ? walk.explanations().get(i) : null;
      seen.add(input.args());
      tests.add(createTestCase(gap, input.args(), determineExpectedBehavior(gap, input.args()), explanation, true));
    }
    for (Value value : solved) {
      final List<Value> args = List.of(value);
      if (seen.add(args)) {
        final String explanation = options.includeExplanations()
            ? "satisfies the constraints of " + gap.id() + ": " + value.render() : null;
        tests.add(createTestCase(gap, args, ExpectedBehavior.SHOULD_SATISFY, explanation, false));
      }
    }
    return tests;
  }

  public TestGenerationStats statistics(List<TestCase> tests) {
    int high = 0;
    int medium = 0;
    int low = 0;
    final var byRegion = new LinkedHashMap<String, Integer>();
    final var byBehavior = new EnumMap<ExpectedBehavior, Integer>(ExpectedBehavior.class);
    for (ExpectedBehavior b : ExpectedBehavior.values()) {
      byBehavior.put(b, 0);
    }
    for (TestCase test : tests) {
      if (test.priority() >= 0.8) {
        high++;
      } else if (test.priority() >= 0.5) {
        medium++;
      } else {
        low++;
      }
      byRegion.merge(test.region().id(), 1, Integer::sum);
      byBehavior.merge(test.expectedBehavior(), 1, Integer::sum);
    }
    final double average = tests.stream().mapToDouble(TestCase::priority).average().orElse(0);
    return new TestGenerationStats(tests.size(), high, medium, low, Collections.unmodifiableMap(byRegion),
        Collections.unmodifiableMap(byBehavior), average);
  }

  /// A stable re-sort of generated tests. Ties keep their generation order.
  public List<TestCase> prioritizeTests(List<TestCase> tests, TestOrdering ordering) {
    final Comparator<TestCase> byPriority = Comparator.comparingDouble(TestCase::priority).reversed();
    final Comparator<TestCase> comparator = switch (ordering) {
      case PRIORITY -> byPriority;
      case BOUNDARY_FIRST -> Comparator.comparing((TestCase t) -> !isBoundaryReason(t.region().reason())).thenComparing(byPriority);
      case ERROR_FIRST -> Comparator.comparing((TestCase t) -> t.expectedBehavior() != ExpectedBehavior.SHOULD_THROW).thenComparing(byPriority);
    };
    return tests.stream().sorted(comparator).toList();
  }

  /// Special inputs in a gap ranked for its special values should throw, boundary gaps should return, and everything
  /// else should satisfy the function's contract.
  static ExpectedBehavior determineExpectedBehavior(NegativeSpaceRegion gap, List<Value> args) {
    final String reason = gap.reason().toLowerCase(Locale.ROOT);
    if (args.stream().anyMatch(TestCaseGenerator::isSpecialValue) && reason.contains("special")) {
      return ExpectedBehavior.SHOULD_THROW;
    }
    if (isBoundaryReason(reason)) {
      return ExpectedBehavior.SHOULD_RETURN;
    }
    return ExpectedBehavior.SHOULD_SATISFY;
  }

  /// NaN, the infinities, negative zero, null and undefined.
  static boolean isSpecialValue(Value value) {
    if (value instanceof Value.NumberValue n) {
      return n.isNaN() || !n.isFinite() || n.isNegativeZero();
    }
    return value instanceof Value.NullValue || value instanceof Value.UndefinedValue;
  }

  private static boolean isBoundaryReason(String reason) {
    return reason.toLowerCase(Locale.ROOT).contains("boundary");
  }

  private List<Value> solveValues(NegativeSpaceRegion gap, int budget, TestGenerationOptions options) {
    final TypeSpaceRegion region = gap.region();
    if (solver == null || !solver.isInitialized() || region.isCompound() || region.constraints().isEmpty()) {
      return List.of();
    }
    final var result = solver.solveForSatisfyingValues(region.type(), region.constraints(),
        ConstraintSolver.SolverOptions.DEFAULTS.withMaxSolutions(budget).withTimeout(options.solverTimeoutMs()));
    if (result.status() != ConstraintSolver.SolverStatus.SUCCESS) {
      LOGGER.fine(() -> "No solver values for " + region.id() + ": " + result.status()
          + result.error().map(e -> " " + e).orElse(""));
      return List.of();
    }
    final List<Value> values = result.values();
    return values.size() > budget ? values.subList(0, budget) : values;
  }

  private TestCase createTestCase(NegativeSpaceRegion gap, List<Value> args, ExpectedBehavior behavior,
                                  @Nullable String explanation, boolean boundaryPoint) {
    final String id = "test-" + (++testCounter);
    final var description = new StringBuilder("should handle ")
        .append(signature.name())
        .append(args.stream().map(Value::render).collect(Collectors.joining(", ", "(", ")")));
    if (behavior == ExpectedBehavior.SHOULD_THROW) {
      description.append(" (expect error)");
    }
    if (!gap.reason().isEmpty()) {
      description.append(" - ").append(gap.reason());
    }
    if (explanation != null) {
      description.append(" [").append(explanation).append(']');
    }
    return new TestCase(id, description.toString(), signature.name(), args, behavior, expectedValue(behavior, gap),
        gap.priority(), new RegionRef(gap.id(), gap.type(), gap.reason()), clock.instant(), explanation, boundaryPoint);
  }

  private String expectedValue(ExpectedBehavior behavior, NegativeSpaceRegion gap) {
    return switch (behavior) {
      case SHOULD_THROW -> "error: Expected error";
      case SHOULD_SATISFY -> "predicate: Value should be valid for " + gap.type().toTypeString();
      case SHOULD_RETURN -> "returns " + (signature.returnType() == null ? "unknown" : signature.returnType().toTypeString());
    };
  }
}
