// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/// A named subset of a type's universe.
///
/// The `id` is the only key used to compare covered and uncovered regions. For a region of a multi parameter
/// signature the id is the `×` join of the component ids in parameter order, and `components` holds those
/// component regions so membership never has to be recovered by splitting the id.
///
/// @param id unique within one universe
/// @param kind decides value membership
/// @param type the type this region partitions
/// @param constraints constraints that shaped the region
/// @param cardinality the number of values in the region
/// @param description human readable summary
/// @param components the per parameter regions of a compound region, otherwise empty
public record TypeSpaceRegion(@NotNull String id,
                              @NotNull RegionKind kind,
                              @NotNull TypeNode type,
                              @NotNull List<TypeConstraint> constraints,
                              @NotNull Cardinality cardinality,
                              @Nullable String description,
                              @NotNull List<TypeSpaceRegion> components) {

  public static final String PRODUCT_SEPARATOR = "×";

  public TypeSpaceRegion {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(cardinality, "cardinality must not be null");
    constraints = List.copyOf(Objects.requireNonNull(constraints, "constraints must not be null"));
    components = List.copyOf(Objects.requireNonNull(components, "components must not be null"));
    if (kind == RegionKind.COMPOUND && components.isEmpty()) {
      throw new IllegalArgumentException("A compound region needs components: " + id);
    }
  }

  static TypeSpaceRegion of(String id, RegionKind kind, TypeNode type, Cardinality cardinality, String description) {
    return new TypeSpaceRegion(id, kind, type, type.constraints(), cardinality, description, List.of());
  }

  static TypeSpaceRegion of(String id, RegionKind kind, TypeNode type, List<TypeConstraint> constraints,
                            Cardinality cardinality, String description) {
    return new TypeSpaceRegion(id, kind, type, constraints, cardinality, description, List.of());
  }

  public boolean isCompound() {
    return kind == RegionKind.COMPOUND;
  }

  public boolean isInfinite() {
    return cardinality.isInfinite();
  }

  /// Whether a single value lies in this region. Always false for compound and void regions.
  public boolean contains(Value value) {
    return kind.contains(this, value);
  }

  /// Whether a call with these positional arguments falls in this region. A missing argument is `undefined`.
  public boolean containsArguments(List<Value> args) {
    if (kind == RegionKind.VOID_INPUT) {
      return args.isEmpty();
    }
    if (kind == RegionKind.COMPOUND) {
      for (int i = 0; i < components.size(); i++) {
        if (!components.get(i).contains(argument(args, i))) {
          return false;
        }
      }
      return true;
    }
    return contains(argument(args, 0));
  }

  private static Value argument(List<Value> args, int index) {
    return index < args.size() ? args.get(index) : Value.UNDEFINED;
  }

  @Override
  public String toString() {
    return id + " (" + cardinality + ")";
  }
}
