// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// One observed call of the function under analysis.
///
/// @param args the positional arguments
/// @param output the result or the failure
/// @param timestamp when the call was recorded
/// @param regionIds the universe regions the arguments fell in, computed once when recorded
public record TestExecution(@NotNull List<Value> args,
                            @NotNull TestOutput output,
                            @NotNull Instant timestamp,
                            @NotNull Set<String> regionIds) {

  public TestExecution {
    args = List.copyOf(Objects.requireNonNull(args, "args must not be null"));
    Objects.requireNonNull(output, "output must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    regionIds = Set.copyOf(Objects.requireNonNull(regionIds, "regionIds must not be null"));
  }
}
