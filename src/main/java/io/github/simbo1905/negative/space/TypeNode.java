// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/// An abstract type as produced by a source analysis front end.
///
/// Composite kinds (union, intersection, array, tuple, object) carry their members in `children` in declaration order.
/// For an object the children are property nodes: each child carries the member name in `property`.
/// Constraints are conjunctive and their order carries no meaning.
///
/// @param kind the structural kind
/// @param name the primitive name (`number`, `string`, `boolean`, `null`, `undefined`), the literal text, or a type name
/// @param children the ordered member types
/// @param constraints value restrictions on this node
/// @param property the member name when this node is a property of an object type
public record TypeNode(@NotNull TypeKind kind,
                       @Nullable String name,
                       @NotNull List<TypeNode> children,
                       @NotNull List<TypeConstraint> constraints,
                       @Nullable String property) {

  public TypeNode {
    Objects.requireNonNull(kind, "kind must not be null");
    children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
    constraints = List.copyOf(Objects.requireNonNull(constraints, "constraints must not be null"));
  }

  public static TypeNode primitive(String name, TypeConstraint... constraints) {
    Objects.requireNonNull(name, "primitive name must not be null");
    return new TypeNode(TypeKind.PRIMITIVE, name, List.of(), List.of(constraints), null);
  }

  /// A literal type. String literals keep their quotes, e.g. `"\"GET\""`, numbers and booleans are bare text.
  public static TypeNode literal(String text) {
    Objects.requireNonNull(text, "literal text must not be null");
    return new TypeNode(TypeKind.LITERAL, text, List.of(), List.of(), null);
  }

  public static TypeNode union(TypeNode... members) {
    return new TypeNode(TypeKind.UNION, null, List.of(members), List.of(), null);
  }

  public static TypeNode intersection(TypeNode... members) {
    return new TypeNode(TypeKind.INTERSECTION, null, List.of(members), List.of(), null);
  }

  public static TypeNode array(TypeNode element, TypeConstraint... constraints) {
    return new TypeNode(TypeKind.ARRAY, null, List.of(element), List.of(constraints), null);
  }

  public static TypeNode tuple(TypeNode... elements) {
    return new TypeNode(TypeKind.TUPLE, null, List.of(elements), List.of(), null);
  }

  public static TypeNode object(String name, TypeNode... properties) {
    for (TypeNode p : properties) {
      if (p.property() == null) {
        throw new IllegalArgumentException("Object members must be property nodes: " + p);
      }
    }
    return new TypeNode(TypeKind.OBJECT, name, List.of(properties), List.of(), null);
  }

  /// Binds a member name to a type for use inside [#object].
  public static TypeNode property(String propertyName, TypeNode type) {
    Objects.requireNonNull(propertyName, "property name must not be null");
    return new TypeNode(type.kind(), type.name(), type.children(), type.constraints(), propertyName);
  }

  public static TypeNode any() {
    return new TypeNode(TypeKind.ANY, "any", List.of(), List.of(), null);
  }

  public static TypeNode unknown() {
    return new TypeNode(TypeKind.UNKNOWN, "unknown", List.of(), List.of(), null);
  }

  public static TypeNode never() {
    return new TypeNode(TypeKind.NEVER, "never", List.of(), List.of(), null);
  }

  /// A copy of this node with one more constraint.
  public TypeNode withConstraint(TypeConstraint constraint) {
    Objects.requireNonNull(constraint, "constraint must not be null");
    final var more = new ArrayList<>(constraints);
    more.add(constraint);
    return new TypeNode(kind, name, children, more, property);
  }

  public boolean isPrimitive(String primitiveName) {
    return kind == TypeKind.PRIMITIVE && primitiveName.equals(name);
  }

  /// The element type of an array, when one was given.
  public @Nullable TypeNode elementType() {
    return kind == TypeKind.ARRAY && !children.isEmpty() ? children.get(0) : null;
  }

  /// Compact TypeScript-like rendering used in descriptions and log output.
  public String toTypeString() {
    return switch (kind) {
      case PRIMITIVE, LITERAL, GENERIC -> Objects.requireNonNullElse(name, kind.name().toLowerCase(Locale.ROOT));
      case UNION -> children.stream().map(TypeNode::toTypeString).collect(Collectors.joining(" | "));
      case INTERSECTION -> children.stream().map(TypeNode::toTypeString).collect(Collectors.joining(" & "));
      case ARRAY -> (children.isEmpty() ? "unknown" : children.get(0).toTypeString()) + "[]";
      case TUPLE -> children.stream().map(TypeNode::toTypeString).collect(Collectors.joining(", ", "[", "]"));
      case OBJECT -> name != null ? name : children.stream()
          .map(c -> c.property() + ": " + c.toTypeString())
          .collect(Collectors.joining("; ", "{ ", " }"));
      case FUNCTION -> Objects.requireNonNullElse(name, "Function");
      case UNKNOWN -> "unknown";
      case ANY -> "any";
      case NEVER -> "never";
    };
  }
}
