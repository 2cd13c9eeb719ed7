// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/// What a recorded call produced.
public sealed interface TestOutput permits TestOutput.Returned, TestOutput.Threw {

  static Returned returned(Object value) {
    return new Returned(Value.of(value));
  }

  static Threw threw(Throwable t) {
    return new Threw(t.getClass().getSimpleName(), Objects.requireNonNullElse(t.getMessage(), ""));
  }

  record Returned(@NotNull Value value) implements TestOutput {
    public Returned {
      Objects.requireNonNull(value, "value must not be null");
    }
  }

  record Threw(@NotNull String errorType, @NotNull String message) implements TestOutput {
    public Threw {
      Objects.requireNonNull(errorType, "errorType must not be null");
      Objects.requireNonNull(message, "message must not be null");
    }
  }
}
