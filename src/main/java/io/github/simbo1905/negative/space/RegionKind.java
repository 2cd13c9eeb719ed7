// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.util.function.BiPredicate;

import static io.github.simbo1905.negative.space.SpecialValues.MAX_SAFE_INTEGER;
import static io.github.simbo1905.negative.space.SpecialValues.MIN_SAFE_INTEGER;

/// The kind of a [TypeSpaceRegion], fixed when the region is built. Each kind knows its value family and how to
/// decide whether a single runtime value lies inside a region of that kind. The region supplies the payload the
/// decision needs: its constraints, its literal type or its declared object members.
///
/// Regions of different kinds may overlap. `-Infinity` lies in both [#NUMBER_SPECIAL] and [#NUMBER_NEGATIVE_INFINITY].
public enum RegionKind {
  NUMBER_SPECIAL(Family.NUMBER, (r, v) -> v instanceof Value.NumberValue n
      && (n.isNaN() || !n.isFinite() || n.isNegativeZero())),
  NUMBER_NEGATIVE_INFINITY(Family.NUMBER, (r, v) -> v instanceof Value.NumberValue n && n.value() < MIN_SAFE_INTEGER),
  NUMBER_NEGATIVE(Family.NUMBER, (r, v) -> v instanceof Value.NumberValue n
      && n.value() >= MIN_SAFE_INTEGER && n.value() < 0),
  NUMBER_ZERO(Family.NUMBER, (r, v) -> v instanceof Value.NumberValue n && n.value() == 0 && !n.isNegativeZero()),
  NUMBER_POSITIVE(Family.NUMBER, (r, v) -> v instanceof Value.NumberValue n
      && n.value() > 0 && n.value() <= MAX_SAFE_INTEGER),
  NUMBER_POSITIVE_INFINITY(Family.NUMBER, (r, v) -> v instanceof Value.NumberValue n && n.value() > MAX_SAFE_INTEGER),
  NUMBER_RANGE(Family.NUMBER, RegionKind::acceptedByConstraints),

  STRING_EMPTY(Family.STRING, (r, v) -> stringLength(v) == 0),
  STRING_SPECIAL(Family.STRING, (r, v) -> SpecialValues.STRINGS.contains(v)),
  STRING_SINGLE(Family.STRING, (r, v) -> stringLength(v) == 1),
  STRING_SHORT(Family.STRING, (r, v) -> between(stringLength(v), 2, 10)),
  STRING_MEDIUM(Family.STRING, (r, v) -> between(stringLength(v), 11, 100)),
  STRING_LONG(Family.STRING, (r, v) -> between(stringLength(v), 101, 1000)),
  STRING_VERY_LONG(Family.STRING, (r, v) -> stringLength(v) > 1000),
  STRING_LENGTH(Family.STRING, RegionKind::acceptedByConstraints),
  STRING_PATTERN(Family.STRING, RegionKind::acceptedByConstraints),

  BOOLEAN_TRUE(Family.BOOLEAN, (r, v) -> Value.TRUE.equals(v)),
  BOOLEAN_FALSE(Family.BOOLEAN, (r, v) -> Value.FALSE.equals(v)),

  NULL(Family.NULL, (r, v) -> v instanceof Value.NullValue),
  UNDEFINED(Family.UNDEFINED, (r, v) -> v instanceof Value.UndefinedValue),
  LITERAL(Family.LITERAL, (r, v) -> r.type().name() != null && Literals.valueOf(r.type().name()).equals(v)),

  ARRAY_EMPTY(Family.ARRAY, (r, v) -> arraySize(v) == 0),
  ARRAY_SINGLE(Family.ARRAY, (r, v) -> arraySize(v) == 1),
  ARRAY_MULTIPLE(Family.ARRAY, (r, v) -> arraySize(v) >= 2),
  ARRAY_LENGTH(Family.ARRAY, RegionKind::acceptedByConstraints),

  OBJECT_EMPTY(Family.OBJECT, (r, v) -> v instanceof Value.ObjectValue o && o.members().isEmpty()),
  OBJECT_PARTIAL(Family.OBJECT, (r, v) -> v instanceof Value.ObjectValue o && !o.members().isEmpty()
      && !hasAllDeclaredMembers(r, o)),
  OBJECT_COMPLETE(Family.OBJECT, (r, v) -> v instanceof Value.ObjectValue o && !o.members().isEmpty()
      && hasAllDeclaredMembers(r, o)),

  ANY(Family.ANY, (r, v) -> true),
  UNKNOWN(Family.UNKNOWN, (r, v) -> true),
  UNKNOWN_PRIMITIVE(Family.UNKNOWN, (r, v) -> true),
  /// The single region of a function without parameters. Only an empty argument list falls in it.
  VOID_INPUT(Family.VOID, (r, v) -> false),
  /// A Cartesian product region. Membership is decided per argument by the component regions.
  COMPOUND(Family.COMPOUND, (r, v) -> false);

  /// The value family a region kind partitions.
  public enum Family {
    NUMBER, STRING, BOOLEAN, NULL, UNDEFINED, LITERAL, ARRAY, OBJECT, ANY, UNKNOWN, VOID, COMPOUND
  }

  private final Family family;
  private final BiPredicate<TypeSpaceRegion, Value> membership;

  RegionKind(Family family, BiPredicate<TypeSpaceRegion, Value> membership) {
    this.family = family;
    this.membership = membership;
  }

  public Family family() {
    return family;
  }

  boolean contains(TypeSpaceRegion region, Value value) {
    return membership.test(region, value);
  }

  private static boolean acceptedByConstraints(TypeSpaceRegion region, Value value) {
    return !region.constraints().isEmpty() && region.constraints().stream().allMatch(c -> c.accepts(value));
  }

  private static int stringLength(Value v) {
    return v instanceof Value.StringValue s ? s.value().length() : -1;
  }

  private static int arraySize(Value v) {
    return v instanceof Value.ArrayValue a ? a.elements().size() : -1;
  }

  private static boolean between(int n, int min, int max) {
    return n >= min && n <= max;
  }

  private static boolean hasAllDeclaredMembers(TypeSpaceRegion region, Value.ObjectValue o) {
    return region.type().children().stream()
        .map(TypeNode::property)
        .allMatch(o.members()::containsKey);
  }
}
