// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/// An untested region with its bug probability score. Only the [GapEngine] creates these.
///
/// @param region the untested universe region
/// @param priority the score in `[0,1]`, higher means test first
/// @param reason why the region matters
public record NegativeSpaceRegion(@NotNull TypeSpaceRegion region, double priority, @NotNull String reason) {

  public NegativeSpaceRegion {
    Objects.requireNonNull(region, "region must not be null");
    Objects.requireNonNull(reason, "reason must not be null");
    if (!(priority >= 0 && priority <= 1)) {
      throw new IllegalArgumentException("Priority must be in [0,1]: " + priority);
    }
  }

  public String id() {
    return region.id();
  }

  public Cardinality cardinality() {
    return region.cardinality();
  }

  public TypeNode type() {
    return region.type();
  }
}
