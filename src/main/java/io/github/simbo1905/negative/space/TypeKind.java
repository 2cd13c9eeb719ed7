// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

/// The structural kind of a [TypeNode].
public enum TypeKind {
  PRIMITIVE,
  LITERAL,
  UNION,
  INTERSECTION,
  ARRAY,
  TUPLE,
  OBJECT,
  FUNCTION,
  GENERIC,
  UNKNOWN,
  ANY,
  /// The empty type. It has no values.
  NEVER
}
