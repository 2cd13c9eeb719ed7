// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import java.util.Locale;

/// Limits and switches for [NegativeSpace#analyze]. Each setting can be overridden by a system property named
/// `negative.space.<setting>`, for example `-Dnegative.space.smtSolverEnabled=true`.
///
/// @param maxNegativeSpaceRegions the most gaps kept after prioritization
/// @param maxBoundaryTests the most test cases generated
/// @param timeoutMs the solver time limit per constrained gap
/// @param includeEdgeCases whether special values are added to the walked inputs
/// @param smtSolverEnabled whether constrained gaps are also solved for satisfying values
public record NegativeSpaceConfig(int maxNegativeSpaceRegions,
                                  int maxBoundaryTests,
                                  long timeoutMs,
                                  boolean includeEdgeCases,
                                  boolean smtSolverEnabled) {

  static final String PREFIX = "negative.space.";

  public static final NegativeSpaceConfig DEFAULTS = new NegativeSpaceConfig(1000, 100, 30_000, true, false);

  public NegativeSpaceConfig {
    if (maxNegativeSpaceRegions < 0) {
      throw new IllegalArgumentException("maxNegativeSpaceRegions must not be negative: " + maxNegativeSpaceRegions);
    }
    if (maxBoundaryTests < 0) {
      throw new IllegalArgumentException("maxBoundaryTests must not be negative: " + maxBoundaryTests);
    }
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
    }
  }

  /// The defaults with any `negative.space.*` system property applied.
  public static NegativeSpaceConfig fromSystemProperties() {
    return new NegativeSpaceConfig(
        intProperty("maxNegativeSpaceRegions", DEFAULTS.maxNegativeSpaceRegions()),
        intProperty("maxBoundaryTests", DEFAULTS.maxBoundaryTests()),
        longProperty("timeoutMs", DEFAULTS.timeoutMs()),
        booleanProperty("includeEdgeCases", DEFAULTS.includeEdgeCases()),
        booleanProperty("smtSolverEnabled", DEFAULTS.smtSolverEnabled()));
  }

  public NegativeSpaceConfig withSmtSolverEnabled(boolean smtSolverEnabled) {
    return new NegativeSpaceConfig(maxNegativeSpaceRegions, maxBoundaryTests, timeoutMs, includeEdgeCases, smtSolverEnabled);
  }

  public NegativeSpaceConfig withMaxBoundaryTests(int maxBoundaryTests) {
    return new NegativeSpaceConfig(maxNegativeSpaceRegions, maxBoundaryTests, timeoutMs, includeEdgeCases, smtSolverEnabled);
  }

  public NegativeSpaceConfig withIncludeEdgeCases(boolean includeEdgeCases) {
    return new NegativeSpaceConfig(maxNegativeSpaceRegions, maxBoundaryTests, timeoutMs, includeEdgeCases, smtSolverEnabled);
  }

  private static int intProperty(String name, int defaultValue) {
    final String text = System.getProperty(PREFIX + name);
    if (text == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(text.strip());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + PREFIX + name + ": " + text + ". Must be an integer", e);
    }
  }

  private static long longProperty(String name, long defaultValue) {
    final String text = System.getProperty(PREFIX + name);
    if (text == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(text.strip());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + PREFIX + name + ": " + text + ". Must be an integer", e);
    }
  }

  private static boolean booleanProperty(String name, boolean defaultValue) {
    final String text = System.getProperty(PREFIX + name);
    if (text == null) {
      return defaultValue;
    }
    return switch (text.strip().toLowerCase(Locale.ROOT)) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException("Invalid " + PREFIX + name + ": " + text + ". Must be one of: [true, false]");
    };
  }
}
