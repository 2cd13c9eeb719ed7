// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.negative.space.NegativeSpace.LOGGER;

/// The partial order of types under subtyping.
///
/// Every operation is total. Combinations the rules do not cover are "not a subtype" and their join or meet
/// becomes a union or an intersection node.
public final class TypeLattice {

  /// Rules are checked in this order:
  ///
  /// 1. structurally equal types are subtypes of each other
  /// 2. `never` is below everything
  /// 3. everything is below `any` and `unknown`
  /// 4. `any` is below nothing else
  /// 5. a literal is below the primitive its value belongs to
  /// 6. a union is below `b` when every member is
  /// 7. an intersection is below `b` when at least one member is
  /// 8. `a` is below a union when it is below one of its members
  /// 9. arrays are covariant in their element type
  /// 10. an object is below another when it declares every member of the other with a subtype
  public boolean isSubtype(TypeNode a, TypeNode b) {
    Objects.requireNonNull(a, "a must not be null");
    Objects.requireNonNull(b, "b must not be null");
    if (areEqual(a, b)) {
      return true;
    }
    if (a.kind() == TypeKind.NEVER) {
      return true;
    }
    if (b.kind() == TypeKind.ANY || b.kind() == TypeKind.UNKNOWN) {
      return true;
    }
    if (a.kind() == TypeKind.ANY) {
      return false;
    }
    if (a.kind() == TypeKind.LITERAL && b.kind() == TypeKind.PRIMITIVE) {
      return a.name() != null && b.name() != null && Literals.primitiveOf(a.name()).equals(b.name());
    }
    if (a.kind() == TypeKind.UNION) {
      return a.children().stream().allMatch(member -> isSubtype(member, b));
    }
    if (a.kind() == TypeKind.INTERSECTION) {
      return a.children().stream().anyMatch(member -> isSubtype(member, b));
    }
    if (b.kind() == TypeKind.UNION) {
      return b.children().stream().anyMatch(member -> isSubtype(a, member));
    }
    if (a.kind() == TypeKind.ARRAY && b.kind() == TypeKind.ARRAY) {
      final TypeNode elementA = a.elementType();
      final TypeNode elementB = b.elementType();
      return elementA != null && elementB != null && isSubtype(elementA, elementB);
    }
    if (a.kind() == TypeKind.OBJECT && b.kind() == TypeKind.OBJECT) {
      return b.children().stream().allMatch(wanted -> a.children().stream()
          .filter(have -> Objects.equals(have.property(), wanted.property()))
          .findFirst()
          .map(have -> isSubtype(have, wanted))
          .orElse(false));
    }
    LOGGER.finer(() -> "No subtype rule for " + a.toTypeString() + " <: " + b.toTypeString());
    return false;
  }

  public boolean isSupertype(TypeNode a, TypeNode b) {
    return isSubtype(b, a);
  }

  /// Least upper bound. The wider side when the two are related, otherwise their union.
  public TypeNode join(TypeNode a, TypeNode b) {
    if (areEqual(a, b)) {
      return a;
    }
    if (isSubtype(a, b)) {
      return b;
    }
    if (isSubtype(b, a)) {
      return a;
    }
    return TypeNode.union(a, b);
  }

  /// Greatest lower bound. The narrower side when the two are related, otherwise their intersection.
  public TypeNode meet(TypeNode a, TypeNode b) {
    if (areEqual(a, b)) {
      return a;
    }
    if (isSubtype(a, b)) {
      return a;
    }
    if (isSubtype(b, a)) {
      return b;
    }
    return TypeNode.intersection(a, b);
  }

  /// Generalizes a literal to its primitive. Union members are widened and structurally equal results merged,
  /// down to a single node when they all collapse.
  public TypeNode widen(TypeNode type) {
    return switch (type.kind()) {
      case LITERAL -> type.name() == null ? type : TypeNode.primitive(Literals.primitiveOf(type.name()));
      case UNION -> {
        final List<TypeNode> unique = new ArrayList<>();
        for (TypeNode member : type.children()) {
          final TypeNode widened = widen(member);
          if (unique.stream().noneMatch(u -> areEqual(u, widened))) {
            unique.add(widened);
          }
        }
        yield unique.size() == 1 ? unique.get(0) : TypeNode.union(unique.toArray(TypeNode[]::new));
      }
      default -> type;
    };
  }

  /// Adds one constraint. The input node is left untouched.
  public TypeNode narrow(TypeNode type, TypeConstraint constraint) {
    return type.withConstraint(constraint);
  }

  /// Structural equality on kind, name, member name and children. Constraints are ignored.
  public boolean areEqual(TypeNode a, TypeNode b) {
    if (a.kind() != b.kind()
        || !Objects.equals(a.name(), b.name())
        || !Objects.equals(a.property(), b.property())
        || a.children().size() != b.children().size()) {
      return false;
    }
    for (int i = 0; i < a.children().size(); i++) {
      if (!areEqual(a.children().get(i), b.children().get(i))) {
        return false;
      }
    }
    return true;
  }
}
