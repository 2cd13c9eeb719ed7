// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueTest {

  @Test
  void numbersKeepNaNAndNegativeZeroApart() {
    assertThat(Value.number(-0d).isNegativeZero()).isTrue();
    assertThat(Value.number(0d).isNegativeZero()).isFalse();
    assertThat(Value.number(-0d)).isNotEqualTo(Value.number(0d));
    assertThat(Value.number(Double.NaN)).isEqualTo(Value.number(Double.NaN));
    assertThat(Value.number(3).isInteger()).isTrue();
    assertThat(Value.number(3.5).isInteger()).isFalse();
    assertThat(Value.number(Double.POSITIVE_INFINITY).isFinite()).isFalse();
  }

  @Test
  void rendersLikeJavaScript() {
    assertThat(Value.number(5).render()).isEqualTo("5");
    assertThat(Value.number(0.1).render()).isEqualTo("0.1");
    assertThat(Value.number(-0d).render()).isEqualTo("-0");
    assertThat(Value.number(Double.NaN).render()).isEqualTo("NaN");
    assertThat(Value.number(Double.NEGATIVE_INFINITY).render()).isEqualTo("-Infinity");
    assertThat(Value.number(1e21).render()).isEqualTo("1e+21");
    assertThat(Value.number(1e-7).render()).isEqualTo("1e-7");
    assertThat(Value.number(Double.MIN_VALUE).render()).isEqualTo("5e-324");
    assertThat(Value.number(9007199254740991d).render()).isEqualTo("9007199254740991");
    assertThat(Value.string("a\"b\n").render()).isEqualTo("\"a\\\"b\\n\"");
    assertThat(Value.string("\u200B").render()).isEqualTo("\"\\u200b\"");
    assertThat(Value.array(Value.NULL, Value.UNDEFINED, Value.TRUE).render()).isEqualTo("[null, undefined, true]");
    assertThat(new Value.ObjectValue(Map.of()).render()).isEqualTo("{}");
  }

  @Test
  void longStringsAreAbbreviated() {
    final String rendered = Value.string("a".repeat(1000)).render();
    assertThat(rendered).startsWith("\"" + "a".repeat(40)).contains("(1000 chars)");
  }

  @Test
  void convertsPlainJavaObjects() {
    assertThat(Value.of(null)).isEqualTo(Value.NULL);
    assertThat(Value.of(7)).isEqualTo(Value.number(7));
    assertThat(Value.of('c')).isEqualTo(Value.string("c"));
    assertThat(Value.of(List.of(1, "x"))).isEqualTo(Value.array(Value.number(1), Value.string("x")));
    assertThat(Value.of(new int[]{1, 2})).isEqualTo(Value.array(Value.number(1), Value.number(2)));
    final var members = new LinkedHashMap<String, Object>();
    members.put("b", true);
    members.put("a", null);
    final var object = (Value.ObjectValue) Value.of(members);
    assertThat(object.members().keySet()).containsExactly("b", "a");
    assertThat(object.render()).isEqualTo("{ b: true, a: null }");
    assertThat(Value.of(Value.UNDEFINED)).isSameAs(Value.UNDEFINED);
    assertThatThrownBy(() -> Value.of(new Object())).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void typeNames() {
    assertThat(List.of(Value.number(1), Value.string(""), Value.TRUE, Value.NULL, Value.UNDEFINED, Value.array(),
        new Value.ObjectValue(Map.of())))
        .extracting(Value::typeName)
        .containsExactly("number", "string", "boolean", "null", "undefined", "array", "object");
  }
}
