// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.util.List;

/// Fixed value lists shared by the universe partitioning and the boundary walker.
final class SpecialValues {

  static final double MAX_SAFE_INTEGER = 9007199254740991d;
  static final double MIN_SAFE_INTEGER = -9007199254740991d;
  static final double EPSILON = Math.ulp(1.0d);

  /// NaN, both infinities, both zeros and the extreme doubles.
  static final List<Value> NUMBERS = List.of(
      Value.number(Double.NaN),
      Value.number(Double.POSITIVE_INFINITY),
      Value.number(Double.NEGATIVE_INFINITY),
      Value.number(0d),
      Value.number(-0d),
      Value.number(Double.MAX_VALUE),
      Value.number(Double.MIN_VALUE));

  /// The empty string, a null byte, a zero width space and a byte order mark.
  static final List<Value> STRINGS = List.of(
      Value.string(""),
      Value.string("\0"),
      Value.string("\u200B"),
      Value.string("\uFEFF"));

  static final List<Value> BOOLEANS = List.of(Value.TRUE, Value.FALSE);

  static final List<Value> NUMBER_BOUNDARIES = List.of(
      Value.number(0d),
      Value.number(1d),
      Value.number(-1d),
      Value.number(MIN_SAFE_INTEGER),
      Value.number(MAX_SAFE_INTEGER),
      Value.number(Double.MIN_VALUE),
      Value.number(Double.MAX_VALUE),
      Value.number(EPSILON),
      Value.number(-EPSILON));

  static final List<Value> STRING_BOUNDARIES = List.of(
      Value.string(""),
      Value.string("a"),
      Value.string("ab"),
      Value.string("abc"),
      Value.string("a".repeat(10)),
      Value.string("a".repeat(100)),
      Value.string("a".repeat(1000)),
      Value.string("a".repeat(10000)),
      Value.string("\n"),
      Value.string("\r\n"),
      Value.string("\t"),
      Value.string(" "),
      Value.string("   "),
      Value.string("\u00e9\u00e8\u00ea"),
      Value.string("\uD83D\uDE00"));

  static final List<Value> ARRAY_BOUNDARIES = List.of(
      Value.array(),
      Value.array(Value.NULL),
      Value.array(Value.UNDEFINED),
      Value.array(Value.number(0), Value.number(1)));

  static final List<Value> OBJECT_BOUNDARIES = List.of(
      new Value.ObjectValue(java.util.Map.of()),
      Value.NULL,
      Value.UNDEFINED);

  private SpecialValues() {
  }

  /// Special values for a primitive name, empty for names without a special set.
  static List<Value> forPrimitive(String name) {
    return switch (name) {
      case "number" -> NUMBERS;
      case "string" -> STRINGS;
      case "boolean" -> BOOLEANS;
      default -> List.of();
    };
  }
}
