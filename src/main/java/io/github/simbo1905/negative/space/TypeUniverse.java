// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.util.*;
import java.util.stream.Collectors;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// Partitions a type into regions with a cardinality.
///
/// Numbers, strings and booleans get fixed partitions. Constraints replace the default bands with one region per
/// constraint. Composite types are coarse: arrays and objects are split by size, unions concatenate their members'
/// universes and an intersection takes the universe of its smallest member as an approximation of the true
/// intersection. A signature with several parameters is the Cartesian product of the parameter universes.
public final class TypeUniverse {

  private final TypeLattice lattice;

  public TypeUniverse() {
    this(new TypeLattice());
  }

  public TypeUniverse(TypeLattice lattice) {
    this.lattice = Objects.requireNonNull(lattice, "lattice must not be null");
  }

  public List<TypeSpaceRegion> calculateUniverse(TypeNode type) {
    Objects.requireNonNull(type, "type must not be null");
    final List<TypeSpaceRegion> regions = switch (type.kind()) {
      case PRIMITIVE -> primitiveUniverse(type);
      case LITERAL -> literalUniverse(type);
      case UNION -> type.children().stream().flatMap(member -> calculateUniverse(member).stream()).toList();
      case INTERSECTION -> intersectionUniverse(type);
      case ARRAY -> arrayUniverse(type);
      case OBJECT -> objectUniverse(type);
      case ANY -> List.of(TypeSpaceRegion.of("any-universe", RegionKind.ANY, type, Cardinality.INFINITE, "any value"));
      case NEVER -> List.of();
      case UNKNOWN, TUPLE, FUNCTION, GENERIC -> unknownUniverse(type);
    };
    LOGGER.finer(() -> "Universe of " + type.toTypeString() + ": " + regions);
    return regions;
  }

  /// No parameters give the single `void-input` region. One parameter gives that parameter's universe.
  /// Several give the Cartesian product of the parameter universes in declaration order.
  public List<TypeSpaceRegion> calculateUniverse(FunctionSignature signature) {
    Objects.requireNonNull(signature, "signature must not be null");
    final var parameters = signature.parameters();
    if (parameters.isEmpty()) {
      return List.of(TypeSpaceRegion.of("void-input", RegionKind.VOID_INPUT, TypeNode.never(), Cardinality.ONE,
          "call with no arguments"));
    }
    final List<List<TypeSpaceRegion>> perParameter = parameters.stream()
        .map(p -> calculateUniverse(parameterType(signature, p)))
        .toList();
    if (perParameter.size() == 1) {
      return perParameter.get(0);
    }
    final var names = signature.parameterNames();
    List<List<TypeSpaceRegion>> combinations = List.of(List.of());
    for (List<TypeSpaceRegion> universe : perParameter) {
      final List<List<TypeSpaceRegion>> next = new ArrayList<>(combinations.size() * universe.size());
      for (List<TypeSpaceRegion> prefix : combinations) {
        for (TypeSpaceRegion region : universe) {
          final var combination = new ArrayList<>(prefix);
          combination.add(region);
          next.add(combination);
        }
      }
      combinations = next;
    }
    final var product = combinations.stream().map(c -> compound(c, names)).toList();
    LOGGER.fine(() -> "Universe of " + signature + " has " + product.size() + " compound regions");
    return product;
  }

  /// Sum of the region cardinalities, infinite when any region is.
  public static Cardinality totalCardinality(Collection<TypeSpaceRegion> regions) {
    return Cardinality.sum(regions.stream().map(TypeSpaceRegion::cardinality).toList());
  }

  private TypeNode parameterType(FunctionSignature signature, FunctionSignature.Parameter parameter) {
    if (parameter.type() == null) {
      LOGGER.fine(() -> "Parameter " + parameter.name() + " of " + signature.name() + " has no type, treating it as unknown");
      return TypeNode.unknown();
    }
    return parameter.type();
  }

  private static TypeSpaceRegion compound(List<TypeSpaceRegion> components, List<String> names) {
    final String id = components.stream().map(TypeSpaceRegion::id)
        .collect(Collectors.joining(TypeSpaceRegion.PRODUCT_SEPARATOR));
    final Cardinality cardinality = Cardinality.product(components.stream().map(TypeSpaceRegion::cardinality).toList());
    final List<TypeConstraint> constraints = components.stream()
        .flatMap(c -> c.constraints().stream())
        .distinct()
        .toList();
    final var description = new StringJoiner(", ");
    for (int i = 0; i < components.size(); i++) {
      final var component = components.get(i);
      description.add(names.get(i) + ": " + Objects.requireNonNullElse(component.description(), component.id()));
    }
    final TypeNode type = TypeNode.tuple(components.stream().map(TypeSpaceRegion::type).toArray(TypeNode[]::new));
    return new TypeSpaceRegion(id, RegionKind.COMPOUND, type, constraints, cardinality, description.toString(), components);
  }

  private List<TypeSpaceRegion> primitiveUniverse(TypeNode type) {
    final String name = Objects.requireNonNullElse(type.name(), "");
    return switch (name) {
      case "number", "bigint" -> numberUniverse(type);
      case "string" -> stringUniverse(type);
      case "boolean" -> List.of(
          TypeSpaceRegion.of("boolean-true", RegionKind.BOOLEAN_TRUE, type, Cardinality.ONE, "true"),
          TypeSpaceRegion.of("boolean-false", RegionKind.BOOLEAN_FALSE, type, Cardinality.ONE, "false"));
      case "null" -> List.of(TypeSpaceRegion.of("null", RegionKind.NULL, type, Cardinality.ONE, "null"));
      case "undefined", "void" ->
          List.of(TypeSpaceRegion.of("undefined", RegionKind.UNDEFINED, type, Cardinality.ONE, "undefined"));
      default -> {
        LOGGER.fine(() -> "No partition for primitive " + name + ", using a catch all region");
        yield List.of(TypeSpaceRegion.of("unknown-primitive", RegionKind.UNKNOWN_PRIMITIVE, type, Cardinality.INFINITE,
            "values of primitive type " + name));
      }
    };
  }

  private List<TypeSpaceRegion> numberUniverse(TypeNode type) {
    final var ranges = type.constraints().stream()
        .filter(TypeConstraint.Range.class::isInstance)
        .map(TypeConstraint.Range.class::cast)
        .toList();
    if (!ranges.isEmpty()) {
      return ranges.stream().map(range -> TypeSpaceRegion.of(
          "number-range-" + JsFormat.number(range.min()) + "-" + JsFormat.number(range.max()),
          RegionKind.NUMBER_RANGE, type, List.of(range), rangeCardinality(range),
          "numbers from " + JsFormat.number(range.min()) + " to " + JsFormat.number(range.max()))).toList();
    }
    return List.of(
        TypeSpaceRegion.of("number-special", RegionKind.NUMBER_SPECIAL, type,
            Cardinality.of(SpecialValues.NUMBERS.size()), "NaN, Infinity, -Infinity, 0, -0 and the extreme doubles"),
        TypeSpaceRegion.of("number-negative-infinity", RegionKind.NUMBER_NEGATIVE_INFINITY, type, Cardinality.INFINITE,
            "negative numbers beyond the safe integer range"),
        TypeSpaceRegion.of("number-negative", RegionKind.NUMBER_NEGATIVE, type, Cardinality.INFINITE,
            "negative numbers within the safe integer range"),
        TypeSpaceRegion.of("number-zero", RegionKind.NUMBER_ZERO, type, Cardinality.ONE, "zero"),
        TypeSpaceRegion.of("number-positive", RegionKind.NUMBER_POSITIVE, type, Cardinality.INFINITE,
            "positive numbers within the safe integer range"),
        TypeSpaceRegion.of("number-positive-infinity", RegionKind.NUMBER_POSITIVE_INFINITY, type, Cardinality.INFINITE,
            "positive numbers beyond the safe integer range"));
  }

  static Cardinality rangeCardinality(TypeConstraint.Range range) {
    if (!range.isIntegral()) {
      return Cardinality.INFINITE;
    }
    if (range.max() < range.min()) {
      return Cardinality.ZERO;
    }
    final double span = range.max() - range.min() + 1;
    return span < Long.MAX_VALUE ? Cardinality.of((long) span) : Cardinality.INFINITE;
  }

  private List<TypeSpaceRegion> stringUniverse(TypeNode type) {
    final var regions = new ArrayList<TypeSpaceRegion>();
    regions.add(TypeSpaceRegion.of("string-empty", RegionKind.STRING_EMPTY, type, Cardinality.ONE, "the empty string"));
    regions.add(TypeSpaceRegion.of("string-special", RegionKind.STRING_SPECIAL, type,
        Cardinality.of(SpecialValues.STRINGS.size()), "null byte, zero width space and byte order mark"));
    final var shaping = type.constraints().stream()
        .filter(c -> c instanceof TypeConstraint.Length || c instanceof TypeConstraint.Pattern)
        .toList();
    if (shaping.isEmpty()) {
      regions.add(TypeSpaceRegion.of("string-single", RegionKind.STRING_SINGLE, type, Cardinality.INFINITE,
          "one character strings"));
      regions.add(TypeSpaceRegion.of("string-short", RegionKind.STRING_SHORT, type, Cardinality.INFINITE,
          "strings of 2 to 10 characters"));
      regions.add(TypeSpaceRegion.of("string-medium", RegionKind.STRING_MEDIUM, type, Cardinality.INFINITE,
          "strings of 11 to 100 characters"));
      regions.add(TypeSpaceRegion.of("string-long", RegionKind.STRING_LONG, type, Cardinality.INFINITE,
          "strings of 101 to 1000 characters"));
      regions.add(TypeSpaceRegion.of("string-very-long", RegionKind.STRING_VERY_LONG, type, Cardinality.INFINITE,
          "strings longer than 1000 characters"));
      return regions;
    }
    for (TypeConstraint constraint : shaping) {
      if (constraint instanceof TypeConstraint.Length length) {
        regions.add(TypeSpaceRegion.of("string-length-" + length.min() + "-" + length.maxText(), RegionKind.STRING_LENGTH,
            type, List.of(length), Cardinality.INFINITE,
            "strings of " + length.min() + " to " + length.maxText() + " characters"));
      } else if (constraint instanceof TypeConstraint.Pattern pattern) {
        regions.add(TypeSpaceRegion.of("string-pattern-" + pattern.regex().replaceAll("\\W", "-"),
            RegionKind.STRING_PATTERN, type, List.of(pattern), Cardinality.INFINITE,
            "strings containing a match for /" + pattern.regex() + "/"));
      }
    }
    return regions;
  }

  private List<TypeSpaceRegion> literalUniverse(TypeNode type) {
    final String text = Objects.requireNonNullElse(type.name(), "");
    final String base = lattice.widen(type).toTypeString();
    return List.of(TypeSpaceRegion.of("literal-" + text, RegionKind.LITERAL, type, Cardinality.ONE,
        "the " + base + " literal " + text));
  }

  private List<TypeSpaceRegion> intersectionUniverse(TypeNode type) {
    if (type.children().isEmpty()) {
      LOGGER.fine(() -> "Intersection without members, using the unknown universe");
      return unknownUniverse(type);
    }
    List<TypeSpaceRegion> smallest = null;
    Cardinality smallestTotal = null;
    for (TypeNode member : type.children()) {
      final var universe = calculateUniverse(member);
      final var total = totalCardinality(universe);
      if (smallest == null || Cardinality.compare(total, smallestTotal) < 0) {
        smallest = universe;
        smallestTotal = total;
      }
    }
    return smallest;
  }

  private List<TypeSpaceRegion> arrayUniverse(TypeNode type) {
    final TypeNode element = Objects.requireNonNullElseGet(type.elementType(), TypeNode::unknown);
    final String elementName = element.toTypeString();
    final var lengths = type.constraints().stream()
        .filter(TypeConstraint.Length.class::isInstance)
        .map(TypeConstraint.Length.class::cast)
        .toList();
    if (!lengths.isEmpty()) {
      return lengths.stream().map(length -> TypeSpaceRegion.of(
          "array-length-" + length.min() + "-" + length.maxText(), RegionKind.ARRAY_LENGTH, type, List.of(length),
          Cardinality.INFINITE, "arrays of " + length.min() + " to " + length.maxText() + " " + elementName + " elements"))
          .toList();
    }
    return List.of(
        TypeSpaceRegion.of("array-empty", RegionKind.ARRAY_EMPTY, type, Cardinality.ONE, "the empty array"),
        TypeSpaceRegion.of("array-single", RegionKind.ARRAY_SINGLE, type, Cardinality.INFINITE,
            "arrays with one " + elementName + " element"),
        TypeSpaceRegion.of("array-multiple", RegionKind.ARRAY_MULTIPLE, type, Cardinality.INFINITE,
            "arrays with two or more " + elementName + " elements"));
  }

  private List<TypeSpaceRegion> objectUniverse(TypeNode type) {
    final String shape = type.toTypeString();
    return List.of(
        TypeSpaceRegion.of("object-empty", RegionKind.OBJECT_EMPTY, type, Cardinality.ONE, "an object with no members"),
        TypeSpaceRegion.of("object-partial", RegionKind.OBJECT_PARTIAL, type, Cardinality.INFINITE,
            "objects lacking some members of " + shape),
        TypeSpaceRegion.of("object-complete", RegionKind.OBJECT_COMPLETE, type, Cardinality.INFINITE,
            "objects with every member of " + shape));
  }

  private List<TypeSpaceRegion> unknownUniverse(TypeNode type) {
    return List.of(TypeSpaceRegion.of("unknown", RegionKind.UNKNOWN, type, Cardinality.INFINITE,
        "unconstrained values of " + type.toTypeString()));
  }
}
