// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/// A satisfiability backend the [ConstraintSolver] drives.
///
/// Translation is best effort. A constraint shape the backend cannot express becomes an always true expression
/// rather than an error. Solving returns a status and, when satisfiable, the model values of the variables in
/// translation order so the first entry belongs to the first constraint.
///
/// @param <E> the backend's expression type
public interface SmtBackend<E> extends AutoCloseable {

  enum SmtStatus {SAT, UNSAT, UNKNOWN}

  enum SmtSort {INT, REAL, STRING, BOOL}

  /// @param timeoutMs the per check limit passed to the backend
  /// @param produceModels whether models are requested
  /// @param logic an optional logic name such as `QF_S`
  /// @param randomSeed an optional seed that perturbs the search
  record SmtOptions(long timeoutMs, boolean produceModels, @Nullable String logic, @Nullable Integer randomSeed) {
    public static final SmtOptions DEFAULTS = new SmtOptions(5000, true, null, null);

    public SmtOptions {
      if (timeoutMs <= 0) {
        throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
      }
    }

    public SmtOptions withTimeout(long timeoutMs) {
      return new SmtOptions(timeoutMs, produceModels, logic, randomSeed);
    }

    public SmtOptions withRandomSeed(@Nullable Integer randomSeed) {
      return new SmtOptions(timeoutMs, produceModels, logic, randomSeed);
    }
  }

  record SmtVariable(@NotNull String name, @NotNull SmtSort sort) {
    public SmtVariable {
      Objects.requireNonNull(name, "name must not be null");
      Objects.requireNonNull(sort, "sort must not be null");
    }
  }

  /// @param expression the backend expression
  /// @param variables the variables the expression binds
  /// @param original the constraint it came from
  record SmtTranslation<E>(@NotNull E expression, @NotNull List<SmtVariable> variables, @NotNull TypeConstraint original) {
    public SmtTranslation {
      Objects.requireNonNull(expression, "expression must not be null");
      variables = List.copyOf(Objects.requireNonNull(variables, "variables must not be null"));
      Objects.requireNonNull(original, "original must not be null");
    }
  }

  /// @param status the check outcome
  /// @param assignments variable values in translation order, empty unless satisfiable
  record SmtSolution(@NotNull SmtStatus status, @NotNull Map<String, Value> assignments) {
    public SmtSolution {
      Objects.requireNonNull(status, "status must not be null");
      assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    public static SmtSolution of(SmtStatus status) {
      return new SmtSolution(status, Map.of());
    }

    public Optional<Value> firstValue() {
      return assignments.values().stream().findFirst();
    }
  }

  void init(SmtOptions options);

  boolean isInitialized();

  SmtTranslation<E> translateConstraint(TypeConstraint constraint, String varName);

  /// Checks the conjunction of the constraints with every exclusion value ruled out for the first variable.
  SmtSolution solve(List<TypeConstraint> constraints, List<Value> exclusions, SmtOptions options);

  /// Releases native resources. The backend may be initialized again afterwards.
  void dispose();

  @Override
  default void close() {
    dispose();
  }
}
