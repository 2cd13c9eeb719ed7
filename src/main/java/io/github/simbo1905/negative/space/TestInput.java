// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/// A concrete input proposed for a region.
///
/// @param parameterName the parameter the value is for
/// @param value the value of that parameter
/// @param region the id of the region the input targets
/// @param args the full argument list of the call
public record TestInput(@NotNull String parameterName,
                        @NotNull Value value,
                        @NotNull String region,
                        @NotNull List<Value> args) {

  public TestInput {
    Objects.requireNonNull(parameterName, "parameterName must not be null");
    Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(region, "region must not be null");
    args = List.copyOf(Objects.requireNonNull(args, "args must not be null"));
  }
}
