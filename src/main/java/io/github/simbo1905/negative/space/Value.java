// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Array;
import java.util.*;
import java.util.stream.Collectors;

/// A runtime value of the function under analysis. This is the closed set of shapes a dynamically typed argument can take.
///
/// Record equality on [NumberValue] compares bit patterns through `Double.compare` so `NaN` equals `NaN` and
/// `-0` differs from `0`. Both properties matter when deduplicating boundary values.
public sealed interface Value permits Value.NumberValue, Value.StringValue, Value.BooleanValue,
    Value.NullValue, Value.UndefinedValue, Value.ArrayValue, Value.ObjectValue {

  NullValue NULL = new NullValue();

  UndefinedValue UNDEFINED = new UndefinedValue();

  BooleanValue TRUE = new BooleanValue(true);

  BooleanValue FALSE = new BooleanValue(false);

  static NumberValue number(double value) {
    return new NumberValue(value);
  }

  static StringValue string(String value) {
    return new StringValue(value);
  }

  static BooleanValue bool(boolean value) {
    return value ? TRUE : FALSE;
  }

  static ArrayValue array(Value... elements) {
    return new ArrayValue(List.of(elements));
  }

  /// Converts a plain Java object. Lists and arrays become [ArrayValue], maps become [ObjectValue] keyed by `String.valueOf(key)`.
  static Value of(Object o) {
    if (o == null) {
      return NULL;
    } else if (o instanceof Value v) {
      return v;
    } else if (o instanceof Number n) {
      return new NumberValue(n.doubleValue());
    } else if (o instanceof CharSequence s) {
      return new StringValue(s.toString());
    } else if (o instanceof Character c) {
      return new StringValue(c.toString());
    } else if (o instanceof Boolean b) {
      return bool(b);
    } else if (o instanceof Collection<?> c) {
      return new ArrayValue(c.stream().map(Value::of).toList());
    } else if (o.getClass().isArray()) {
      final int length = Array.getLength(o);
      final var elements = new ArrayList<Value>(length);
      for (int i = 0; i < length; i++) {
        elements.add(of(Array.get(o, i)));
      }
      return new ArrayValue(elements);
    } else if (o instanceof Map<?, ?> m) {
      final var members = new LinkedHashMap<String, Value>();
      m.forEach((k, v) -> members.put(String.valueOf(k), of(v)));
      return new ObjectValue(members);
    }
    throw new IllegalArgumentException("Unsupported value type: " + o.getClass().getName());
  }

  /// The JavaScript `typeof` style name: number, string, boolean, null, undefined, array or object.
  String typeName();

  /// JavaScript-like source rendering used in descriptions and explanations.
  String render();

  record NumberValue(double value) implements Value {
    public boolean isNaN() {
      return Double.isNaN(value);
    }

    public boolean isNegativeZero() {
      return value == 0 && Double.doubleToRawLongBits(value) != 0L;
    }

    public boolean isFinite() {
      return Double.isFinite(value);
    }

    public boolean isInteger() {
      return isFinite() && value == Math.rint(value);
    }

    @Override
    public String typeName() {
      return "number";
    }

    @Override
    public String render() {
      return isNegativeZero() ? "-0" : JsFormat.number(value);
    }
  }

  record StringValue(@NotNull String value) implements Value {
    public StringValue {
      Objects.requireNonNull(value, "string value must not be null");
    }

    @Override
    public String typeName() {
      return "string";
    }

    @Override
    public String render() {
      return JsFormat.quote(JsFormat.abbreviate(value, 40));
    }
  }

  record BooleanValue(boolean value) implements Value {
    @Override
    public String typeName() {
      return "boolean";
    }

    @Override
    public String render() {
      return Boolean.toString(value);
    }
  }

  record NullValue() implements Value {
    @Override
    public String typeName() {
      return "null";
    }

    @Override
    public String render() {
      return "null";
    }
  }

  record UndefinedValue() implements Value {
    @Override
    public String typeName() {
      return "undefined";
    }

    @Override
    public String render() {
      return "undefined";
    }
  }

  record ArrayValue(@NotNull List<Value> elements) implements Value {
    public ArrayValue {
      elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
    }

    @Override
    public String typeName() {
      return "array";
    }

    @Override
    public String render() {
      return elements.stream().map(Value::render).collect(Collectors.joining(", ", "[", "]"));
    }
  }

  /// Member order is preserved as given.
  record ObjectValue(@NotNull Map<String, Value> members) implements Value {
    public ObjectValue {
      Objects.requireNonNull(members, "members must not be null");
      members.values().forEach(v -> Objects.requireNonNull(v, "member values must not be null"));
      members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
    }

    @Override
    public String typeName() {
      return "object";
    }

    @Override
    public String render() {
      if (members.isEmpty()) {
        return "{}";
      }
      return members.entrySet().stream()
          .map(e -> e.getKey() + ": " + e.getValue().render())
          .collect(Collectors.joining(", ", "{ ", " }"));
    }
  }
}
