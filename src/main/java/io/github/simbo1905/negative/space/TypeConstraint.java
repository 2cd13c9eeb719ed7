// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// A restriction of exactly one dimension of a type. Constraints on the same node are conjunctive.
/// The optional description is free text carried for reports. It never takes part in [#cacheKey()].
public sealed interface TypeConstraint permits TypeConstraint.Range, TypeConstraint.Length,
    TypeConstraint.Pattern, TypeConstraint.Enumeration {

  static Range range(double min, double max) {
    return new Range(min, max, null);
  }

  static Length length(int min, int max) {
    return new Length(min, max, null);
  }

  static Length minLength(int min) {
    return new Length(min, Length.UNBOUNDED, null);
  }

  static Pattern pattern(String regex) {
    return new Pattern(regex, null);
  }

  static Enumeration oneOf(Object... values) {
    return new Enumeration(java.util.Arrays.stream(values).map(Value::of).toList(), null);
  }

  /// One of `range`, `length`, `pattern` or `enum`.
  String tag();

  @Nullable String description();

  /// Deterministic serialization of the fields that matter for this tag only.
  String cacheKey();

  /// Whether a concrete value satisfies this constraint. Values of the wrong shape never do.
  boolean accepts(Value value);

  /// Inclusive numeric bounds. Use infinities for an open side.
  record Range(double min, double max, @Nullable String description) implements TypeConstraint {
    public Range {
      if (Double.isNaN(min) || Double.isNaN(max)) {
        throw new IllegalArgumentException("Range bounds must not be NaN: " + min + ".." + max);
      }
    }

    /// True when both bounds are finite whole numbers so the range can be counted.
    public boolean isIntegral() {
      return Double.isFinite(min) && Double.isFinite(max) && min == Math.rint(min) && max == Math.rint(max);
    }

    @Override
    public String tag() {
      return "range";
    }

    @Override
    public String cacheKey() {
      return "{\"type\":\"range\",\"min\":" + JsFormat.number(min) + ",\"max\":" + JsFormat.number(max) + "}";
    }

    @Override
    public boolean accepts(Value value) {
      return value instanceof Value.NumberValue n && !n.isNaN() && n.value() >= min && n.value() <= max;
    }
  }

  /// Inclusive length bounds on a string or an array.
  record Length(int min, int max, @Nullable String description) implements TypeConstraint {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public Length {
      if (min < 0) {
        throw new IllegalArgumentException("Minimum length must not be negative: " + min);
      }
    }

    public boolean isBounded() {
      return max != UNBOUNDED;
    }

    String maxText() {
      return isBounded() ? Integer.toString(max) : "Infinity";
    }

    @Override
    public String tag() {
      return "length";
    }

    @Override
    public String cacheKey() {
      return "{\"type\":\"length\",\"min\":" + min + ",\"max\":" + maxText() + "}";
    }

    @Override
    public boolean accepts(Value value) {
      final int size;
      if (value instanceof Value.StringValue s) {
        size = s.value().length();
      } else if (value instanceof Value.ArrayValue a) {
        size = a.elements().size();
      } else {
        return false;
      }
      return size >= min && size <= max;
    }
  }

  /// A regular expression that a string must contain a match for.
  record Pattern(@NotNull String regex, @Nullable String description) implements TypeConstraint {
    public Pattern {
      Objects.requireNonNull(regex, "regex must not be null");
    }

    @Override
    public String tag() {
      return "pattern";
    }

    @Override
    public String cacheKey() {
      return "{\"type\":\"pattern\",\"pattern\":" + JsFormat.quote(regex) + "}";
    }

    @Override
    public boolean accepts(Value value) {
      if (!(value instanceof Value.StringValue s)) {
        return false;
      }
      try {
        return java.util.regex.Pattern.compile(regex).matcher(s.value()).find();
      } catch (PatternSyntaxException e) {
        LOGGER.fine(() -> "Pattern " + regex + " does not compile so nothing matches it: " + e.getDescription());
        return false;
      }
    }
  }

  /// A closed set of permitted values.
  record Enumeration(@NotNull List<Value> values, @Nullable String description) implements TypeConstraint {
    public Enumeration {
      values = List.copyOf(Objects.requireNonNull(values, "values must not be null"));
    }

    @Override
    public String tag() {
      return "enum";
    }

    @Override
    public String cacheKey() {
      return values.stream().map(v -> v instanceof Value.StringValue sv ? JsFormat.quote(sv.value()) : v.render())
          .collect(Collectors.joining(",", "{\"type\":\"enum\",\"values\":[", "]}"));
    }

    @Override
    public boolean accepts(Value value) {
      return values.contains(value);
    }
  }
}
