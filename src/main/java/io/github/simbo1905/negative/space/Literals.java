// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.math.BigInteger;
import java.util.regex.Pattern;

/// Classifies the source text of a literal type. A literal is a boolean when its text is `true` or `false`,
/// a number when its text is a numeric literal, and a string otherwise (quoted or not).
final class Literals {

  private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern RADIX = Pattern.compile("0([xX][0-9a-fA-F]+|[bB][01]+|[oO][0-7]+)");
  private static final Pattern INFINITY = Pattern.compile("[+-]?Infinity");

  private Literals() {
  }

  static boolean isQuoted(String text) {
    return text.length() >= 2 && (text.charAt(0) == '"' || text.charAt(0) == '\'' || text.charAt(0) == '`')
        && text.charAt(text.length() - 1) == text.charAt(0);
  }

  static boolean isNumeric(String text) {
    final String t = text.strip();
    return DECIMAL.matcher(t).matches() || RADIX.matcher(t).matches() || INFINITY.matcher(t).matches();
  }

  /// The primitive name the literal belongs to: `string`, `number` or `boolean`.
  static String primitiveOf(String text) {
    if (isQuoted(text)) {
      return "string";
    }
    if ("true".equals(text) || "false".equals(text)) {
      return "boolean";
    }
    return isNumeric(text) ? "number" : "string";
  }

  /// The runtime value a literal type denotes.
  static Value valueOf(String text) {
    return switch (primitiveOf(text)) {
      case "boolean" -> Value.bool(Boolean.parseBoolean(text));
      case "number" -> Value.number(parseNumber(text.strip()));
      default -> Value.string(isQuoted(text) ? text.substring(1, text.length() - 1) : text);
    };
  }

  private static double parseNumber(String t) {
    if (INFINITY.matcher(t).matches()) {
      return t.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    if (RADIX.matcher(t).matches()) {
      final int radix = switch (Character.toLowerCase(t.charAt(1))) {
        case 'x' -> 16;
        case 'b' -> 2;
        default -> 8;
      };
      return new BigInteger(t.substring(2), radix).doubleValue();
    }
    return Double.parseDouble(t);
  }
}
