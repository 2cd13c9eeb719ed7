// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardinalityTest {

  @Test
  void finiteArithmetic() {
    assertThat(Cardinality.of(6).times(Cardinality.of(2))).isEqualTo(Cardinality.of(12));
    assertThat(Cardinality.of(6).plus(Cardinality.of(2))).isEqualTo(Cardinality.of(8));
    assertThat(Cardinality.product(List.of())).isEqualTo(Cardinality.ONE);
    assertThat(Cardinality.sum(List.of())).isEqualTo(Cardinality.ZERO);
  }

  @Test
  void infiniteAbsorbs() {
    assertThat(Cardinality.of(0).times(Cardinality.INFINITE)).isEqualTo(Cardinality.INFINITE);
    assertThat(Cardinality.INFINITE.plus(Cardinality.ONE)).isEqualTo(Cardinality.INFINITE);
    assertThat(Cardinality.sum(List.of(Cardinality.ONE, Cardinality.INFINITE, Cardinality.of(3))))
        .isEqualTo(Cardinality.INFINITE);
  }

  @Test
  void overflowBecomesInfinite() {
    assertThat(Cardinality.of(Long.MAX_VALUE).plus(Cardinality.ONE)).isEqualTo(Cardinality.INFINITE);
    assertThat(Cardinality.of(Long.MAX_VALUE / 2).times(Cardinality.of(3))).isEqualTo(Cardinality.INFINITE);
  }

  @Test
  void compareSortsInfiniteLast() {
    final var list = new ArrayList<>(List.of(Cardinality.INFINITE, Cardinality.of(10), Cardinality.ONE));
    list.sort(Cardinality::compare);
    assertThat(list).containsExactly(Cardinality.ONE, Cardinality.of(10), Cardinality.INFINITE);
    assertThat(Cardinality.compare(Cardinality.INFINITE, Cardinality.INFINITE)).isZero();
  }

  @Test
  void limitsAndRendering() {
    assertThat(Cardinality.of(10).isAtMost(10)).isTrue();
    assertThat(Cardinality.of(11).isAtMost(10)).isFalse();
    assertThat(Cardinality.INFINITE.isAtMost(Long.MAX_VALUE)).isFalse();
    assertThat(Cardinality.of(42)).hasToString("42");
    assertThat(Cardinality.INFINITE).hasToString("infinite");
    assertThatThrownBy(() -> Cardinality.of(-1)).isInstanceOf(IllegalArgumentException.class);
  }
}
