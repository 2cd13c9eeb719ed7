// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class TypeLatticeTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  final TypeLattice lattice = new TypeLattice();

  final TypeNode number = TypeNode.primitive("number");
  final TypeNode string = TypeNode.primitive("string");
  final TypeNode bool = TypeNode.primitive("boolean");

  @Test
  void literalsSitBelowTheirPrimitive() {
    assertThat(lattice.isSubtype(TypeNode.literal("\"GET\""), string)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.literal("42"), number)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.literal("-1.5e3"), number)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.literal("0x1F"), number)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.literal("true"), bool)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.literal("42"), string)).isFalse();
    assertThat(lattice.isSubtype(TypeNode.literal("\"42\""), number)).isFalse();
  }

  @Test
  void nonNumericLiteralTextIsAStringLiteral() {
    assertThat(lattice.isSubtype(TypeNode.literal("NaN"), string)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.literal("NaN"), number)).isFalse();
    assertThat(lattice.isSubtype(TypeNode.literal(""), string)).isTrue();
  }

  @Test
  void topAndBottom() {
    assertThat(lattice.isSubtype(TypeNode.never(), number)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.never(), TypeNode.array(string))).isTrue();
    assertThat(lattice.isSubtype(number, TypeNode.any())).isTrue();
    assertThat(lattice.isSubtype(number, TypeNode.unknown())).isTrue();
    assertThat(lattice.isSubtype(TypeNode.any(), number)).isFalse();
    assertThat(lattice.isSubtype(TypeNode.any(), TypeNode.any())).isTrue();
  }

  @Test
  void unionsAndIntersections() {
    final var methods = TypeNode.union(TypeNode.literal("\"GET\""), TypeNode.literal("\"PUT\""));
    assertThat(lattice.isSubtype(methods, string)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.union(string, number), string)).isFalse();
    assertThat(lattice.isSubtype(number, TypeNode.union(string, number))).isTrue();
    assertThat(lattice.isSubtype(TypeNode.intersection(number, string), number)).isTrue();
    assertThat(lattice.isSubtype(TypeNode.intersection(bool, string), number)).isFalse();
  }

  @Test
  void arraysAreCovariant() {
    assertThat(lattice.isSubtype(TypeNode.array(TypeNode.literal("1")), TypeNode.array(number))).isTrue();
    assertThat(lattice.isSubtype(TypeNode.array(number), TypeNode.array(string))).isFalse();
  }

  @Test
  void objectsWithMoreMembersAreSubtypes() {
    final var point = TypeNode.object("Point", TypeNode.property("x", number), TypeNode.property("y", number));
    final var hasX = TypeNode.object("HasX", TypeNode.property("x", number));
    assertThat(lattice.isSubtype(point, hasX)).isTrue();
    assertThat(lattice.isSubtype(hasX, point)).isFalse();
  }

  @Test
  void joinPicksTheWiderSideOrAUnion() {
    assertThat(lattice.join(TypeNode.literal("1"), number)).isEqualTo(number);
    assertThat(lattice.join(number, TypeNode.literal("1"))).isEqualTo(number);
    final var joined = lattice.join(number, string);
    assertThat(joined.kind()).isEqualTo(TypeKind.UNION);
    assertThat(joined.children()).containsExactly(number, string);
  }

  @Test
  void meetPicksTheNarrowerSideOrAnIntersection() {
    assertThat(lattice.meet(TypeNode.literal("1"), number)).isEqualTo(TypeNode.literal("1"));
    final var met = lattice.meet(number, string);
    assertThat(met.kind()).isEqualTo(TypeKind.INTERSECTION);
    assertThat(met.children()).containsExactly(number, string);
  }

  @Test
  void widenGeneralizesLiteralsAndCollapsesUnions() {
    assertThat(lattice.widen(TypeNode.literal("\"a\""))).isEqualTo(string);
    final var widened = lattice.widen(TypeNode.union(TypeNode.literal("1"), TypeNode.literal("2")));
    assertThat(lattice.areEqual(widened, number)).isTrue();
    final var mixed = lattice.widen(TypeNode.union(TypeNode.literal("1"), TypeNode.literal("\"x\""), TypeNode.literal("3")));
    assertThat(mixed.kind()).isEqualTo(TypeKind.UNION);
    assertThat(mixed.children()).containsExactly(number, string);
    assertThat(lattice.widen(number)).isSameAs(number);
  }

  @Test
  void narrowAddsAConstraintWithoutTouchingTheInput() {
    final var narrowed = lattice.narrow(number, TypeConstraint.range(0, 10));
    assertThat(narrowed.constraints()).containsExactly(TypeConstraint.range(0, 10));
    assertThat(number.constraints()).isEmpty();
    assertThat(lattice.areEqual(narrowed, number)).isTrue();
  }

  @Test
  void areEqualIsStructural() {
    assertThat(lattice.areEqual(TypeNode.array(number), TypeNode.array(number))).isTrue();
    assertThat(lattice.areEqual(TypeNode.array(number), TypeNode.array(string))).isFalse();
    assertThat(lattice.areEqual(TypeNode.property("x", number), TypeNode.property("y", number))).isFalse();
    assertThat(lattice.isSupertype(number, TypeNode.literal("7"))).isTrue();
  }

  @Test
  void unnamedKindRendersTheSameInEveryLocale() {
    final Locale saved = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      final var unnamed = new TypeNode(TypeKind.PRIMITIVE, null, List.of(), List.of(), null);
      assertThat(unnamed.toTypeString()).isEqualTo("primitive");
      assertThat(new TypeNode(TypeKind.LITERAL, null, List.of(), List.of(), null).toTypeString()).isEqualTo("literal");
    } finally {
      Locale.setDefault(saved);
    }
  }
}
