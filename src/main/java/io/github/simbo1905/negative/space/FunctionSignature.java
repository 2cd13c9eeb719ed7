// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// The abstract signature of a function under analysis as handed over by a source analysis front end.
///
/// @param name the function name
/// @param parameters the parameters in declaration order
/// @param returnType the declared return type, if known
public record FunctionSignature(@NotNull String name,
                                @NotNull List<Parameter> parameters,
                                @Nullable TypeNode returnType) {

  public FunctionSignature {
    Objects.requireNonNull(name, "function name must not be null");
    parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
  }

  public static FunctionSignature of(String name, Parameter... parameters) {
    return new FunctionSignature(name, Arrays.asList(parameters), null);
  }

  /// A parameter. A `null` type means the front end could not resolve it and the parameter is treated as unknown.
  public record Parameter(@NotNull String name, @Nullable TypeNode type, boolean optional) {
    public Parameter {
      Objects.requireNonNull(name, "parameter name must not be null");
    }

    public static Parameter of(String name, TypeNode type) {
      return new Parameter(name, type, false);
    }
  }

  public List<String> parameterNames() {
    return parameters.stream().map(Parameter::name).toList();
  }

  @Override
  public String toString() {
    return name + parameters.stream()
        .map(p -> p.name() + (p.optional() ? "?" : "") + ": " + (p.type() == null ? "unknown" : p.type().toTypeString()))
        .collect(Collectors.joining(", ", "(", ")"));
  }
}
