// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.math.BigDecimal;

/// Formats numbers and strings the way a JavaScript runtime prints them so region ids and
/// descriptions read the same as the functions under analysis.
final class JsFormat {

  private JsFormat() {
  }

  static String number(double d) {
    if (Double.isNaN(d)) {
      return "NaN";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "Infinity" : "-Infinity";
    }
    if (d == 0) {
      return "0";
    }
    if (Math.abs(d) == Double.MIN_VALUE) {
      return d > 0 ? "5e-324" : "-5e-324";
    }
    final double abs = Math.abs(d);
    if (abs >= 1e21 || abs < 1e-6) {
      // Java prints 1.0E-7 where JavaScript prints 1e-7
      final String java = Double.toString(d);
      final int e = java.indexOf('E');
      String mantissa = java.substring(0, e);
      if (mantissa.endsWith(".0")) {
        mantissa = mantissa.substring(0, mantissa.length() - 2);
      }
      final String exponent = java.substring(e + 1);
      return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  /// A double quoted, escaped string literal.
  static String quote(String s) {
    final var sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20 || (c >= 0x200B && c <= 0x200F) || c == 0xFEFF) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  /// Long values are abbreviated to keep descriptions readable.
  static String abbreviate(String s, int max) {
    if (s.length() <= max) {
      return s;
    }
    return s.substring(0, max) + "...(" + s.length() + " chars)";
  }
}
