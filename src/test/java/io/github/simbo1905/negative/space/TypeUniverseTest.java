// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.negative.space.FunctionSignature.Parameter;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TypeUniverseTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  final TypeUniverse universe = new TypeUniverse();

  static TypeSpaceRegion region(List<TypeSpaceRegion> regions, String id) {
    return regions.stream().filter(r -> r.id().equals(id)).findFirst()
        .orElseThrow(() -> new AssertionError("no region " + id + " in " + regions));
  }

  @Test
  void unconstrainedNumberHasZeroAndSpecialRegions() {
    final var regions = universe.calculateUniverse(TypeNode.primitive("number"));
    assertThat(regions).extracting(TypeSpaceRegion::id).containsExactly(
        "number-special", "number-negative-infinity", "number-negative", "number-zero", "number-positive",
        "number-positive-infinity");
    assertThat(region(regions, "number-zero").cardinality()).isEqualTo(Cardinality.ONE);
    assertThat(region(regions, "number-special").cardinality()).isEqualTo(Cardinality.of(7));
    assertThat(region(regions, "number-positive").isInfinite()).isTrue();
  }

  @Test
  void numberRegionsClassifyValues() {
    final var regions = universe.calculateUniverse(TypeNode.primitive("number"));
    assertThat(region(regions, "number-zero").contains(Value.number(0))).isTrue();
    assertThat(region(regions, "number-zero").contains(Value.number(-0d))).isFalse();
    assertThat(region(regions, "number-special").contains(Value.number(-0d))).isTrue();
    assertThat(region(regions, "number-special").contains(Value.number(Double.NaN))).isTrue();
    assertThat(region(regions, "number-positive").contains(Value.number(5))).isTrue();
    assertThat(region(regions, "number-positive").contains(Value.number(1e300))).isFalse();
    assertThat(region(regions, "number-positive-infinity").contains(Value.number(1e300))).isTrue();
    assertThat(region(regions, "number-negative").contains(Value.number(-3.5))).isTrue();
    assertThat(region(regions, "number-negative").contains(Value.string("-3"))).isFalse();
  }

  @Test
  void rangeConstraintGivesOneCountedRegion() {
    final var regions = universe.calculateUniverse(TypeNode.primitive("number", TypeConstraint.range(0, 10)));
    assertThat(regions).hasSize(1);
    final var range = regions.get(0);
    assertThat(range.id()).isEqualTo("number-range-0-10");
    assertThat(range.kind()).isEqualTo(RegionKind.NUMBER_RANGE);
    assertThat(range.cardinality()).isEqualTo(Cardinality.of(11));
    assertThat(range.contains(Value.number(10))).isTrue();
    assertThat(range.contains(Value.number(11))).isFalse();
  }

  @Test
  void fractionalRangeIsInfinite() {
    final var regions = universe.calculateUniverse(TypeNode.primitive("number", TypeConstraint.range(0, 0.5)));
    assertThat(regions.get(0).id()).isEqualTo("number-range-0-0.5");
    assertThat(regions.get(0).isInfinite()).isTrue();
  }

  @Test
  void stringPartitions() {
    final var regions = universe.calculateUniverse(TypeNode.primitive("string"));
    assertThat(regions).extracting(TypeSpaceRegion::id).containsExactly(
        "string-empty", "string-special", "string-single", "string-short", "string-medium", "string-long",
        "string-very-long");
    assertThat(region(regions, "string-special").cardinality()).isEqualTo(Cardinality.of(4));
    assertThat(region(regions, "string-short").contains(Value.string("hello"))).isTrue();
    assertThat(region(regions, "string-medium").contains(Value.string("x".repeat(11)))).isTrue();
  }

  @Test
  void constrainedStringReplacesTheLengthBands() {
    final var type = TypeNode.primitive("string", TypeConstraint.length(3, 8), TypeConstraint.pattern("^[a-z]+$"));
    final var regions = universe.calculateUniverse(type);
    assertThat(regions).extracting(TypeSpaceRegion::id).containsExactly(
        "string-empty", "string-special", "string-length-3-8", "string-pattern---a-z---");
    assertThat(region(regions, "string-length-3-8").contains(Value.string("abcd"))).isTrue();
    assertThat(region(regions, "string-length-3-8").contains(Value.string("ab"))).isFalse();
  }

  @Test
  void booleanNullAndUndefined() {
    assertThat(universe.calculateUniverse(TypeNode.primitive("boolean")))
        .extracting(TypeSpaceRegion::id).containsExactly("boolean-true", "boolean-false");
    assertThat(universe.calculateUniverse(TypeNode.primitive("null")))
        .extracting(TypeSpaceRegion::id).containsExactly("null");
    assertThat(universe.calculateUniverse(TypeNode.primitive("void")))
        .extracting(TypeSpaceRegion::id).containsExactly("undefined");
    assertThat(universe.calculateUniverse(TypeNode.primitive("symbol")))
        .extracting(TypeSpaceRegion::id).containsExactly("unknown-primitive");
  }

  @Test
  void literalGivesASingleRegion() {
    final var regions = universe.calculateUniverse(TypeNode.literal("\"GET\""));
    assertThat(regions).hasSize(1);
    assertThat(regions.get(0).id()).isEqualTo("literal-\"GET\"");
    assertThat(regions.get(0).cardinality()).isEqualTo(Cardinality.ONE);
    assertThat(regions.get(0).contains(Value.string("GET"))).isTrue();
    assertThat(regions.get(0).contains(Value.string("PUT"))).isFalse();
  }

  @Test
  void unionConcatenatesMembers() {
    final var regions = universe.calculateUniverse(TypeNode.union(TypeNode.primitive("boolean"), TypeNode.primitive("null")));
    assertThat(regions).extracting(TypeSpaceRegion::id).containsExactly("boolean-true", "boolean-false", "null");
    assertThat(TypeUniverse.totalCardinality(regions)).isEqualTo(Cardinality.of(3));
  }

  @Test
  void intersectionTakesTheSmallestMember() {
    final var regions = universe.calculateUniverse(
        TypeNode.intersection(TypeNode.primitive("string"), TypeNode.primitive("boolean")));
    assertThat(regions).extracting(TypeSpaceRegion::id).containsExactly("boolean-true", "boolean-false");
  }

  @Test
  void arraysAndObjectsAreSplitBySize() {
    final var arrays = universe.calculateUniverse(TypeNode.array(TypeNode.primitive("number")));
    assertThat(arrays).extracting(TypeSpaceRegion::id).containsExactly("array-empty", "array-single", "array-multiple");
    assertThat(arrays.get(2).contains(Value.array(Value.number(1), Value.number(2)))).isTrue();

    final var point = TypeNode.object("Point",
        TypeNode.property("x", TypeNode.primitive("number")), TypeNode.property("y", TypeNode.primitive("number")));
    final var objects = universe.calculateUniverse(point);
    assertThat(objects).extracting(TypeSpaceRegion::id).containsExactly("object-empty", "object-partial", "object-complete");
    final var partial = new Value.ObjectValue(Map.of("x", Value.number(1)));
    final var complete = Value.of(Map.of("x", 1, "y", 2));
    assertThat(region(objects, "object-partial").contains(partial)).isTrue();
    assertThat(region(objects, "object-complete").contains(partial)).isFalse();
    assertThat(region(objects, "object-complete").contains(complete)).isTrue();
  }

  @Test
  void topBottomAndUnknownTypes() {
    assertThat(universe.calculateUniverse(TypeNode.never())).isEmpty();
    final var any = universe.calculateUniverse(TypeNode.any());
    assertThat(any).extracting(TypeSpaceRegion::id).containsExactly("any-universe");
    assertThat(any.get(0).isInfinite()).isTrue();
    assertThat(universe.calculateUniverse(TypeNode.tuple(TypeNode.primitive("number"))))
        .extracting(TypeSpaceRegion::id).containsExactly("unknown");
  }

  @Test
  void noParametersGiveTheVoidRegion() {
    final var regions = universe.calculateUniverse(FunctionSignature.of("now"));
    assertThat(regions).hasSize(1);
    assertThat(regions.get(0).id()).isEqualTo("void-input");
    assertThat(regions.get(0).containsArguments(List.of())).isTrue();
    assertThat(regions.get(0).containsArguments(List.of(Value.number(1)))).isFalse();
  }

  @Test
  void singleParameterUsesItsOwnUniverse() {
    final var regions = universe.calculateUniverse(
        FunctionSignature.of("f", Parameter.of("x", TypeNode.primitive("boolean"))));
    assertThat(regions).extracting(TypeSpaceRegion::id).containsExactly("boolean-true", "boolean-false");
  }

  @Test
  void untypedParameterIsUnknown() {
    final var regions = universe.calculateUniverse(
        FunctionSignature.of("f", new Parameter("x", null, false)));
    assertThat(regions).extracting(TypeSpaceRegion::id).containsExactly("unknown");
  }

  @Test
  void twoParametersGiveTheCartesianProduct() {
    final var signature = FunctionSignature.of("f",
        Parameter.of("x", TypeNode.primitive("number")), Parameter.of("y", TypeNode.primitive("boolean")));
    final var regions = universe.calculateUniverse(signature);
    assertThat(regions).hasSize(12);
    assertThat(regions.get(0).id()).isEqualTo("number-special" + TypeSpaceRegion.PRODUCT_SEPARATOR + "boolean-true");
    for (TypeSpaceRegion region : regions) {
      assertThat(region.kind()).isEqualTo(RegionKind.COMPOUND);
      assertThat(region.id().split(TypeSpaceRegion.PRODUCT_SEPARATOR)).hasSize(2);
      if (region.components().get(0).isInfinite()) {
        assertThat(region.cardinality()).isEqualTo(Cardinality.INFINITE);
      } else {
        assertThat(region.cardinality()).isEqualTo(region.components().get(0).cardinality());
      }
    }
    final var zeroTrue = region(regions, "number-zero×boolean-true");
    assertThat(zeroTrue.description()).isEqualTo("x: zero, y: true");
    assertThat(zeroTrue.containsArguments(List.of(Value.number(0), Value.TRUE))).isTrue();
    assertThat(zeroTrue.containsArguments(List.of(Value.number(0), Value.FALSE))).isFalse();
    assertThat(zeroTrue.containsArguments(List.of(Value.number(0)))).isFalse();
  }
}
