// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.negative.space.SmtBackend.SmtOptions;
import io.github.simbo1905.negative.space.SmtBackend.SmtSort;
import io.github.simbo1905.negative.space.SmtBackend.SmtStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/// Model parsing runs everywhere. Solving tests are skipped where the native library cannot load.
class Z3BackendTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  Z3Backend backend;

  Z3Backend ready() {
    assumeTrue(Z3Backend.isNativeAvailable(), "Z3 native library is not available");
    backend = new Z3Backend();
    backend.init(SmtOptions.DEFAULTS);
    return backend;
  }

  @AfterEach
  void tearDown() {
    if (backend != null) {
      backend.close();
    }
  }

  @Test
  void parsesNumbers() {
    assertThat(Z3Backend.parseNative("42")).isEqualTo(Value.number(42));
    assertThat(Z3Backend.parseNative("(- 3)")).isEqualTo(Value.number(-3));
    assertThat(Z3Backend.parseNative("1/4")).isEqualTo(Value.number(0.25));
    assertThat(Z3Backend.parseNative("(- 1/2)")).isEqualTo(Value.number(-0.5));
    assertThat(Z3Backend.parseNative("2.5?")).isEqualTo(Value.number(2.5));
  }

  @Test
  void parsesStringsAndBooleans() {
    assertThat(Z3Backend.parseNative("\"abc\"")).isEqualTo(Value.string("abc"));
    assertThat(Z3Backend.parseNative("\"say \"\"hi\"\"\"")).isEqualTo(Value.string("say \"hi\""));
    assertThat(Z3Backend.parseNative("\"\\u{41}b\"")).isEqualTo(Value.string("Ab"));
    assertThat(Z3Backend.parseNative("true")).isEqualTo(Value.TRUE);
    assertThat(Z3Backend.parseNative("false")).isEqualTo(Value.FALSE);
    assertThat(Z3Backend.parseNative("x!0")).isEqualTo(Value.string("x!0"));
  }

  @Test
  void sortFollowsTheConstraint() {
    assertThat(Z3Backend.sortOf(TypeConstraint.range(0, 1))).isEqualTo(SmtSort.INT);
    assertThat(Z3Backend.sortOf(TypeConstraint.length(0, 1))).isEqualTo(SmtSort.STRING);
    assertThat(Z3Backend.sortOf(TypeConstraint.pattern("a"))).isEqualTo(SmtSort.STRING);
    assertThat(Z3Backend.sortOf(TypeConstraint.oneOf(1, 2))).isEqualTo(SmtSort.INT);
    assertThat(Z3Backend.sortOf(TypeConstraint.oneOf(1.5))).isEqualTo(SmtSort.REAL);
    assertThat(Z3Backend.sortOf(TypeConstraint.oneOf("a"))).isEqualTo(SmtSort.STRING);
    assertThat(Z3Backend.sortOf(TypeConstraint.oneOf(true))).isEqualTo(SmtSort.BOOL);
  }

  @Test
  void uninitializedBackendRefusesWork() {
    final var cold = new Z3Backend();
    assertThat(cold.isInitialized()).isFalse();
    assertThatThrownBy(() -> cold.translateConstraint(TypeConstraint.range(0, 1), "x"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void rangeModelIsInsideTheRange() {
    final var solution = ready().solve(List.of(TypeConstraint.range(5, 9)), List.of(), SmtOptions.DEFAULTS);
    assertThat(solution.status()).isEqualTo(SmtStatus.SAT);
    assertThat(solution.firstValue()).hasValueSatisfying(v -> assertThat(TypeConstraint.range(5, 9).accepts(v)).isTrue());
  }

  @Test
  void fractionalRangeWithoutIntegersIsUnsat() {
    final var solution = ready().solve(List.of(TypeConstraint.range(0.2, 0.8)), List.of(), SmtOptions.DEFAULTS);
    assertThat(solution.status()).isEqualTo(SmtStatus.UNSAT);
    assertThat(solution.assignments()).isEmpty();
  }

  @Test
  void exclusionsForceANewValue() {
    final var constraints = List.<TypeConstraint>of(TypeConstraint.range(1, 2));
    final var first = ready().solve(constraints, List.of(), SmtOptions.DEFAULTS).firstValue().orElseThrow();
    final var second = backend.solve(constraints, List.of(first), SmtOptions.DEFAULTS).firstValue().orElseThrow();
    assertThat(second).isNotEqualTo(first);
    assertThat(backend.solve(constraints, List.of(first, second), SmtOptions.DEFAULTS).status())
        .isEqualTo(SmtStatus.UNSAT);
  }

  @Test
  void stringConstraintsCombine() {
    final var constraints = List.<TypeConstraint>of(TypeConstraint.length(3, 3), TypeConstraint.pattern("^ab"));
    final var value = ready().solve(constraints, List.of(), SmtOptions.DEFAULTS).firstValue().orElseThrow();
    assertThat(value).isInstanceOf(Value.StringValue.class);
    assertThat(((Value.StringValue) value).value()).hasSize(3).startsWith("ab");
  }

  @Test
  void exactPatternIsEquality() {
    final var value = ready().solve(List.of(TypeConstraint.pattern("^hello$")), List.of(), SmtOptions.DEFAULTS)
        .firstValue();
    assertThat(value).hasValue(Value.string("hello"));
  }

  @Test
  void enumerationPicksAMember() {
    final var constraints = List.<TypeConstraint>of(TypeConstraint.oneOf("red", "green"));
    final var solution = ready().solve(constraints, List.of(Value.string("red")), SmtOptions.DEFAULTS);
    assertThat(solution.firstValue()).hasValue(Value.string("green"));
    assertThat(backend.solve(List.of(TypeConstraint.oneOf()), List.of(), SmtOptions.DEFAULTS).status())
        .isEqualTo(SmtStatus.UNSAT);
  }

  @Test
  void disposeIsRepeatable() {
    ready().dispose();
    assertThat(backend.isInitialized()).isFalse();
    backend.dispose();
    backend.init(SmtOptions.DEFAULTS.withTimeout(1000));
    assertThat(backend.isInitialized()).isTrue();
  }
}
