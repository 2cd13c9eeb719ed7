// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;
import static io.github.simbo1905.negative.space.SpecialValues.*;

/// Turns a gap into concrete inputs that sit on or just past its edges.
///
/// Depth 1 emits the canonical boundary values of the gap's value family and, when enabled, that family's special
/// values. Depth 2 adds values just outside the gap along its own edge. Depth 3 adds a capped sample of canonical
/// boundaries combined with special values. Inputs are deduplicated keeping the first occurrence so a shallower walk
/// is always a prefix of a deeper one.
///
/// For a compound region one parameter is varied at a time while the others hold their first canonical value.
public final class BoundaryWalker {

  static final int COMBINATION_LIMIT = 64;

  static final int LONGEST_GENERATED_STRING = 100_000;

  /// @param maxInputs the most inputs returned
  /// @param includeSpecialValues whether the special values of the family are added at depth 1
  /// @param depth 1, 2 or 3
  public record BoundaryWalkOptions(int maxInputs, boolean includeSpecialValues, int depth) {
    public static final BoundaryWalkOptions DEFAULTS = new BoundaryWalkOptions(50, true, 2);

    /// Defaults for [BoundaryWalker#walkBetweenRegions].
    public static final BoundaryWalkOptions BETWEEN_DEFAULTS = new BoundaryWalkOptions(20, true, 1);

    public BoundaryWalkOptions {
      if (maxInputs < 0) {
        throw new IllegalArgumentException("maxInputs must not be negative: " + maxInputs);
      }
      if (depth < 1 || depth > 3) {
        throw new IllegalArgumentException("depth must be 1, 2 or 3: " + depth);
      }
    }

    public BoundaryWalkOptions withDepth(int depth) {
      return new BoundaryWalkOptions(maxInputs, includeSpecialValues, depth);
    }

    public BoundaryWalkOptions withMaxInputs(int maxInputs) {
      return new BoundaryWalkOptions(maxInputs, includeSpecialValues, depth);
    }
  }

  /// @param testInputs the generated inputs
  /// @param explanations one explanation per input, same order
  /// @param regionsExplored ids of the regions the walk touched
  /// @param boundaryPointCount the number of inputs
  public record BoundaryWalkResult(@NotNull List<TestInput> testInputs,
                                   @NotNull List<String> explanations,
                                   @NotNull List<String> regionsExplored,
                                   int boundaryPointCount) {
  }

  private record Candidate(String parameterName, Value value, List<Value> args, String explanation) {
  }

  private final List<String> parameterNames;

  public BoundaryWalker() {
    this(null);
  }

  /// @param signature supplies parameter names for the generated inputs, may be null
  public BoundaryWalker(@Nullable FunctionSignature signature) {
    this.parameterNames = signature == null ? List.of() : signature.parameterNames();
  }

  public BoundaryWalkResult walkBoundary(NegativeSpaceRegion gap) {
    return walkBoundary(gap, BoundaryWalkOptions.DEFAULTS);
  }

  public BoundaryWalkResult walkBoundary(NegativeSpaceRegion gap, BoundaryWalkOptions options) {
    Objects.requireNonNull(gap, "gap must not be null");
    Objects.requireNonNull(options, "options must not be null");
    final TypeSpaceRegion region = gap.region();
    final var candidates = new LinkedHashMap<List<Value>, Candidate>();
    final var explored = new LinkedHashSet<String>();
    explored.add(region.id());

    if (region.kind() == RegionKind.VOID_INPUT) {
      offer(candidates, new Candidate("none", Value.UNDEFINED, List.of(), "call with no arguments"));
    } else if (region.isCompound()) {
      walkCompound(region, options, candidates, explored);
    } else {
      final String name = parameterName(0);
      for (Value v : canonicalValues(region, options.includeSpecialValues())) {
        offer(candidates, new Candidate(name, v, List.of(v), explain(v, region.id())));
      }
      if (options.depth() > 1) {
        for (Value v : outsideValues(region)) {
          offer(candidates, new Candidate(name, v, List.of(v), "just outside " + region.id() + ": " + v.render()));
        }
      }
      if (options.depth() > 2) {
        for (Value v : combinationValues(region)) {
          offer(candidates, new Candidate(name, v, List.of(v), "combination for " + region.id() + ": " + v.render()));
        }
      }
    }

    final var kept = candidates.values().stream().limit(options.maxInputs()).toList();
    final var inputs = kept.stream().map(c -> new TestInput(c.parameterName(), c.value(), region.id(), c.args())).toList();
    final var explanations = kept.stream().map(Candidate::explanation).toList();
    LOGGER.fine(() -> "Walked " + region.id() + " at depth " + options.depth() + ": " + inputs.size() + " of "
        + candidates.size() + " inputs kept");
    return new BoundaryWalkResult(inputs, explanations, List.copyOf(explored), inputs.size());
  }

  /// A fixed list of values chosen by the pair of primitive type names of the two regions.
  public BoundaryWalkResult walkBetweenRegions(NegativeSpaceRegion a, NegativeSpaceRegion b) {
    return walkBetweenRegions(a, b, BoundaryWalkOptions.BETWEEN_DEFAULTS);
  }

  public BoundaryWalkResult walkBetweenRegions(NegativeSpaceRegion a, NegativeSpaceRegion b, BoundaryWalkOptions options) {
    final String typeA = typeName(a.region());
    final String typeB = typeName(b.region());
    final var values = new ArrayList<Value>();
    if ("number".equals(typeA) || "number".equals(typeB)) {
      values.addAll(List.of(Value.number(0), Value.number(-1), Value.number(1), Value.number(MIN_SAFE_INTEGER),
          Value.number(MAX_SAFE_INTEGER), Value.number(Double.MIN_VALUE), Value.number(Double.MAX_VALUE),
          Value.number(Double.NEGATIVE_INFINITY), Value.number(Double.POSITIVE_INFINITY), Value.number(Double.NaN)));
    }
    if ("string".equals(typeA) || "string".equals(typeB)) {
      values.addAll(List.of(Value.string(""), Value.string("a"), Value.string("\0"), Value.string("\n"),
          Value.string(" ".repeat(1000))));
    }
    if ("boolean".equals(typeA) || "boolean".equals(typeB)) {
      values.addAll(BOOLEANS);
    }
    final String name = parameterName(0);
    final var kept = values.stream().limit(options.maxInputs()).toList();
    final var inputs = kept.stream().map(v -> new TestInput(name, v, a.id(), List.of(v))).toList();
    final var explanations = kept.stream()
        .map(v -> "boundary between " + a.id() + " and " + b.id() + ": " + v.render())
        .toList();
    return new BoundaryWalkResult(inputs, explanations, List.of(a.id(), b.id()), inputs.size());
  }

  /// Canonical boundary values of a type, without reference to any region.
  public List<Value> generateAllBoundaries(TypeNode type) {
    return switch (type.kind()) {
      case PRIMITIVE -> switch (Objects.requireNonNullElse(type.name(), "")) {
        case "number" -> distinct(NUMBER_BOUNDARIES, NUMBERS, rangeEdges(type.constraints()));
        case "string" -> distinct(STRING_BOUNDARIES, STRINGS);
        case "boolean" -> BOOLEANS;
        case "null" -> List.of(Value.NULL);
        case "undefined", "void" -> List.of(Value.UNDEFINED);
        default -> List.of();
      };
      case LITERAL -> type.name() == null ? List.of() : List.of(Literals.valueOf(type.name()));
      case UNION -> distinct(type.children().stream().flatMap(member -> generateAllBoundaries(member).stream()).toList());
      case ARRAY -> ARRAY_BOUNDARIES;
      case OBJECT -> distinct(objectSamples(type), OBJECT_BOUNDARIES);
      default -> List.of();
    };
  }

  /// The human readable reason a value is interesting.
  public static String explain(Value value, String regionId) {
    if (value instanceof Value.NumberValue n) {
      final double d = n.value();
      if (n.isNaN()) {
        return "NaN - not equal to itself, breaks arithmetic";
      } else if (d == Double.POSITIVE_INFINITY) {
        return "Infinity - above every finite number";
      } else if (d == Double.NEGATIVE_INFINITY) {
        return "-Infinity - below every finite number";
      } else if (n.isNegativeZero()) {
        return "-0 - negative zero, equal to 0 yet distinct";
      } else if (d == 0) {
        return "0 - between the negative and positive numbers";
      } else if (d == MAX_SAFE_INTEGER) {
        return "MAX_SAFE_INTEGER - largest exactly representable integer";
      } else if (d == MIN_SAFE_INTEGER) {
        return "MIN_SAFE_INTEGER - smallest exactly representable integer";
      } else if (d == Double.MAX_VALUE) {
        return "MAX_VALUE - largest finite number";
      } else if (d == Double.MIN_VALUE) {
        return "MIN_VALUE - smallest positive number";
      }
    } else if (value instanceof Value.StringValue s) {
      final String str = s.value();
      if (str.isEmpty()) {
        return "empty string";
      } else if (str.length() == 1 && str.charAt(0) != '\0' && str.charAt(0) != '\n') {
        return "one character string";
      } else if (str.indexOf('\n') >= 0) {
        return "contains a newline";
      } else if (str.indexOf('\0') >= 0) {
        return "contains a null byte";
      }
    } else if (value instanceof Value.BooleanValue b) {
      return "boolean " + b.value();
    } else if (value instanceof Value.NullValue) {
      return "null";
    } else if (value instanceof Value.UndefinedValue) {
      return "undefined";
    }
    return "boundary value " + value.render() + " in region " + regionId;
  }

  private void walkCompound(TypeSpaceRegion region, BoundaryWalkOptions options,
                            Map<List<Value>, Candidate> candidates, Set<String> explored) {
    final var components = region.components();
    final List<List<Value>> canonical = components.stream()
        .map(c -> canonicalValues(c, options.includeSpecialValues()))
        .toList();
    final List<Value> base = canonical.stream()
        .map(values -> values.isEmpty() ? Value.UNDEFINED : values.get(0))
        .toList();
    components.forEach(c -> explored.add(c.id()));

    for (int i = 0; i < components.size(); i++) {
      for (Value v : canonical.get(i)) {
        offer(candidates, vary(base, i, v, explain(v, components.get(i).id())));
      }
    }
    if (options.depth() > 1) {
      for (int i = 0; i < components.size(); i++) {
        for (Value v : outsideValues(components.get(i))) {
          offer(candidates, vary(base, i, v, "just outside " + components.get(i).id() + ": " + v.render()));
        }
      }
    }
    if (options.depth() > 2) {
      final List<List<Value>> axes = new ArrayList<>();
      for (int i = 0; i < components.size(); i++) {
        final var axis = new ArrayList<Value>();
        canonical.get(i).stream().limit(3).forEach(axis::add);
        combinationValues(components.get(i)).stream().limit(2).forEach(axis::add);
        axes.add(axis.isEmpty() ? List.of(Value.UNDEFINED) : axis);
      }
      int emitted = 0;
      for (List<Value> args : cartesian(axes)) {
        if (emitted++ >= COMBINATION_LIMIT) {
          break;
        }
        offer(candidates, new Candidate(String.join(", ", names(components.size())), new Value.ArrayValue(args), args,
            "combination for " + region.id()));
      }
    }
  }

  private Candidate vary(List<Value> base, int index, Value v, String explanation) {
    final var args = new ArrayList<>(base);
    args.set(index, v);
    return new Candidate(parameterName(index), v, args, parameterName(index) + ": " + explanation);
  }

  private static void offer(Map<List<Value>, Candidate> candidates, Candidate candidate) {
    candidates.putIfAbsent(candidate.args(), candidate);
  }

  private String parameterName(int index) {
    return index < parameterNames.size() ? parameterNames.get(index) : "arg" + index;
  }

  private List<String> names(int count) {
    final var names = new ArrayList<String>(count);
    for (int i = 0; i < count; i++) {
      names.add(parameterName(i));
    }
    return names;
  }

  static List<Value> canonicalValues(TypeSpaceRegion region, boolean includeSpecial) {
    return switch (region.kind().family()) {
      case NUMBER -> distinct(rangeEdges(region.constraints()), NUMBER_BOUNDARIES, includeSpecial ? NUMBERS : List.of());
      case STRING -> distinct(stringEdges(region.constraints()), STRING_BOUNDARIES, includeSpecial ? STRINGS : List.of());
      case BOOLEAN -> BOOLEANS;
      case NULL -> List.of(Value.NULL);
      case UNDEFINED -> List.of(Value.UNDEFINED);
      case LITERAL -> {
        final String text = Objects.requireNonNullElse(region.type().name(), "");
        yield distinct(List.of(Literals.valueOf(text)),
            includeSpecial ? SpecialValues.forPrimitive(Literals.primitiveOf(text)) : List.of());
      }
      case ARRAY -> distinct(arrayEdges(region.constraints()), ARRAY_BOUNDARIES);
      case OBJECT -> distinct(objectSamples(region.type()), OBJECT_BOUNDARIES);
      case ANY, UNKNOWN -> List.of(Value.number(0), Value.string(""), Value.FALSE, Value.NULL, Value.UNDEFINED,
          Value.array(), new Value.ObjectValue(Map.of()), Value.number(Double.NaN));
      case VOID, COMPOUND -> List.of();
    };
  }

  static List<Value> outsideValues(TypeSpaceRegion region) {
    return switch (region.kind()) {
      case NUMBER_POSITIVE -> numbers(0, -EPSILON, Double.MIN_VALUE);
      case NUMBER_NEGATIVE -> numbers(0, EPSILON, -Double.MIN_VALUE);
      case NUMBER_ZERO -> numbers(-EPSILON, EPSILON, -0d);
      case NUMBER_POSITIVE_INFINITY -> numbers(MAX_SAFE_INTEGER, MAX_SAFE_INTEGER + 2, Double.POSITIVE_INFINITY);
      case NUMBER_NEGATIVE_INFINITY -> numbers(MIN_SAFE_INTEGER, MIN_SAFE_INTEGER - 2, Double.NEGATIVE_INFINITY);
      case NUMBER_SPECIAL -> numbers(Math.nextDown(Double.MAX_VALUE), 2 * Double.MIN_VALUE, -Double.MAX_VALUE);
      case NUMBER_RANGE -> {
        final var values = new ArrayList<Value>();
        for (TypeConstraint c : region.constraints()) {
          if (c instanceof TypeConstraint.Range r) {
            if (Double.isFinite(r.min())) {
              values.add(Value.number(r.min() - 1));
              values.add(Value.number(Math.nextDown(r.min())));
            }
            if (Double.isFinite(r.max())) {
              values.add(Value.number(r.max() + 1));
              values.add(Value.number(Math.nextUp(r.max())));
            }
          }
        }
        yield distinct(values);
      }
      case STRING_EMPTY -> strings("a", "ab");
      case STRING_SINGLE -> strings("", "ab");
      case STRING_SHORT -> strings("a", "a".repeat(11));
      case STRING_MEDIUM -> strings("a".repeat(10), "a".repeat(101));
      case STRING_LONG -> strings("a".repeat(100), "a".repeat(1001));
      case STRING_VERY_LONG -> strings("a".repeat(1000));
      case STRING_SPECIAL -> strings(" ", "\u200C", "\0\0");
      case STRING_PATTERN -> strings("", "\0");
      case STRING_LENGTH -> {
        final var values = new ArrayList<Value>();
        for (TypeConstraint c : region.constraints()) {
          if (c instanceof TypeConstraint.Length l) {
            if (l.min() > 0 && l.min() <= LONGEST_GENERATED_STRING) {
              values.add(Value.string("a".repeat(l.min() - 1)));
            }
            if (l.isBounded() && l.max() < LONGEST_GENERATED_STRING) {
              values.add(Value.string("a".repeat(l.max() + 1)));
            }
          }
        }
        yield distinct(values);
      }
      case BOOLEAN_TRUE -> List.of(Value.FALSE, Value.number(1), Value.string("true"));
      case BOOLEAN_FALSE -> List.of(Value.TRUE, Value.number(0), Value.string(""));
      case NULL -> List.of(Value.UNDEFINED, Value.number(0), Value.string(""));
      case UNDEFINED -> List.of(Value.NULL);
      case LITERAL -> literalNeighbours(Literals.valueOf(Objects.requireNonNullElse(region.type().name(), "")));
      case ARRAY_EMPTY -> List.of(Value.array(Value.number(0)));
      case ARRAY_SINGLE -> List.of(Value.array(), Value.array(Value.number(0), Value.number(0)));
      case ARRAY_MULTIPLE -> List.of(Value.array(Value.number(0)));
      case ARRAY_LENGTH -> {
        final var values = new ArrayList<Value>();
        for (TypeConstraint c : region.constraints()) {
          if (c instanceof TypeConstraint.Length l) {
            if (l.min() > 0 && l.min() <= LONGEST_GENERATED_STRING) {
              values.add(zeros(l.min() - 1));
            }
            if (l.isBounded() && l.max() < LONGEST_GENERATED_STRING) {
              values.add(zeros(l.max() + 1));
            }
          }
        }
        yield distinct(values);
      }
      case OBJECT_EMPTY, OBJECT_PARTIAL, OBJECT_COMPLETE -> List.of(Value.NULL, Value.array());
      default -> List.of();
    };
  }

  static List<Value> combinationValues(TypeSpaceRegion region) {
    final var values = new ArrayList<Value>();
    switch (region.kind().family()) {
      case NUMBER -> {
        for (Value b : numbers(0, 1, -1, MAX_SAFE_INTEGER, MIN_SAFE_INTEGER, Double.MAX_VALUE)) {
          final double d = ((Value.NumberValue) b).value();
          values.add(Value.number(Math.nextUp(d)));
          values.add(Value.number(Math.nextDown(d)));
        }
      }
      case STRING -> {
        for (String b : List.of("", "a", "ab")) {
          for (Value s : STRINGS) {
            final String special = ((Value.StringValue) s).value();
            values.add(Value.string(b + special));
            values.add(Value.string(special + b));
          }
          values.add(Value.string(b + "\n"));
        }
      }
      case ARRAY -> {
        values.add(Value.array(Value.number(Double.NaN)));
        values.add(Value.array(Value.NULL, Value.UNDEFINED));
        values.add(Value.array(Value.array()));
        values.add(Value.array(Value.string(""), Value.number(-0d)));
      }
      case OBJECT -> {
        final var members = new LinkedHashMap<String, Value>();
        region.type().children().forEach(p -> members.put(p.property(), Value.NULL));
        values.add(new Value.ObjectValue(members));
      }
      default -> {
        // no combinations for discrete families
      }
    }
    return distinct(values).stream().limit(COMBINATION_LIMIT).toList();
  }

  private static List<Value> rangeEdges(List<TypeConstraint> constraints) {
    final var values = new ArrayList<Value>();
    for (TypeConstraint c : constraints) {
      if (c instanceof TypeConstraint.Range r) {
        if (Double.isFinite(r.min())) {
          values.add(Value.number(r.min()));
          values.add(Value.number(r.min() + 1));
        }
        if (Double.isFinite(r.max())) {
          values.add(Value.number(r.max()));
          values.add(Value.number(r.max() - 1));
        }
      }
    }
    return values;
  }

  private static List<Value> stringEdges(List<TypeConstraint> constraints) {
    final var values = new ArrayList<Value>();
    for (TypeConstraint c : constraints) {
      if (c instanceof TypeConstraint.Length l) {
        if (l.min() <= LONGEST_GENERATED_STRING) {
          values.add(Value.string("a".repeat(l.min())));
        }
        if (l.isBounded() && l.max() <= LONGEST_GENERATED_STRING) {
          values.add(Value.string("a".repeat(l.max())));
        }
      } else if (c instanceof TypeConstraint.Pattern p) {
        patternSample(p.regex()).ifPresent(s -> values.add(Value.string(s)));
      }
    }
    return values;
  }

  private static List<Value> arrayEdges(List<TypeConstraint> constraints) {
    final var values = new ArrayList<Value>();
    for (TypeConstraint c : constraints) {
      if (c instanceof TypeConstraint.Length l) {
        if (l.min() <= LONGEST_GENERATED_STRING) {
          values.add(zeros(l.min()));
        }
        if (l.isBounded() && l.max() <= LONGEST_GENERATED_STRING) {
          values.add(zeros(l.max()));
        }
      }
    }
    return values;
  }

  /// The literal text of an anchored pattern without metacharacters, e.g. `abc` for `^abc$`.
  static Optional<String> patternSample(String regex) {
    String body = regex;
    if (body.startsWith("^")) {
      body = body.substring(1);
    }
    if (body.endsWith("$") && !body.endsWith("\\$")) {
      body = body.substring(0, body.length() - 1);
    }
    for (char c : body.toCharArray()) {
      if ("\\[](){}.*+?|^$".indexOf(c) >= 0) {
        return Optional.empty();
      }
    }
    return Optional.of(body);
  }

  private static List<Value> objectSamples(TypeNode type) {
    final var values = new ArrayList<Value>();
    final var complete = new LinkedHashMap<String, Value>();
    for (TypeNode property : type.children()) {
      final var region = new TypeUniverse().calculateUniverse(property).stream().findFirst();
      final Value sample = region.map(r -> canonicalValues(r, false))
          .filter(v -> !v.isEmpty())
          .map(v -> v.get(0))
          .orElse(Value.NULL);
      complete.put(property.property(), sample);
    }
    if (!complete.isEmpty()) {
      values.add(new Value.ObjectValue(complete));
      final var partial = new LinkedHashMap<>(complete);
      partial.remove(partial.keySet().iterator().next());
      values.add(new Value.ObjectValue(partial));
    }
    return values;
  }

  private static List<Value> literalNeighbours(Value literal) {
    if (literal instanceof Value.NumberValue n && n.isFinite()) {
      return numbers(n.value() - 1, n.value() + 1);
    } else if (literal instanceof Value.StringValue s) {
      return strings("", s.value() + " ", s.value().toUpperCase(Locale.ROOT));
    } else if (literal instanceof Value.BooleanValue b) {
      return List.of(Value.bool(!b.value()));
    }
    return List.of();
  }

  private static String typeName(TypeSpaceRegion region) {
    final TypeSpaceRegion first = region.isCompound() ? region.components().get(0) : region;
    return first.kind() == RegionKind.LITERAL
        ? Literals.primitiveOf(Objects.requireNonNullElse(first.type().name(), ""))
        : Objects.requireNonNullElse(first.type().name(), first.type().kind().name().toLowerCase(Locale.ROOT));
  }

  private static Value zeros(int n) {
    return new Value.ArrayValue(Collections.nCopies(n, Value.number(0)));
  }

  private static List<Value> numbers(double... ds) {
    return Arrays.stream(ds).mapToObj(Value::number).map(Value.class::cast).toList();
  }

  private static List<Value> strings(String... ss) {
    return Arrays.stream(ss).map(Value::string).map(Value.class::cast).toList();
  }

  @SafeVarargs
  private static List<Value> distinct(List<Value>... lists) {
    final var seen = new LinkedHashSet<Value>();
    for (List<Value> list : lists) {
      seen.addAll(list);
    }
    return List.copyOf(seen);
  }

  private static List<List<Value>> cartesian(List<List<Value>> axes) {
    List<List<Value>> result = List.of(List.of());
    for (List<Value> axis : axes) {
      final var next = new ArrayList<List<Value>>();
      for (List<Value> prefix : result) {
        for (Value v : axis) {
          final var combination = new ArrayList<>(prefix);
          combination.add(v);
          next.add(combination);
          if (next.size() >= COMBINATION_LIMIT) {
            break;
          }
        }
        if (next.size() >= COMBINATION_LIMIT) {
          break;
        }
      }
      result = next;
    }
    return result;
  }
}
