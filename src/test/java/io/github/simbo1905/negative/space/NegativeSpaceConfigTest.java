// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.negative.space;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NegativeSpaceConfigTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static final List<String> SETTINGS = List.of("maxNegativeSpaceRegions", "maxBoundaryTests", "timeoutMs",
      "includeEdgeCases", "smtSolverEnabled");

  @AfterEach
  void clearProperties() {
    SETTINGS.forEach(s -> System.clearProperty(NegativeSpaceConfig.PREFIX + s));
  }

  @Test
  void defaultsWithoutProperties() {
    assertThat(NegativeSpaceConfig.fromSystemProperties()).isEqualTo(NegativeSpaceConfig.DEFAULTS);
    assertThat(NegativeSpaceConfig.DEFAULTS.maxNegativeSpaceRegions()).isEqualTo(1000);
    assertThat(NegativeSpaceConfig.DEFAULTS.maxBoundaryTests()).isEqualTo(100);
    assertThat(NegativeSpaceConfig.DEFAULTS.timeoutMs()).isEqualTo(30_000);
    assertThat(NegativeSpaceConfig.DEFAULTS.includeEdgeCases()).isTrue();
    assertThat(NegativeSpaceConfig.DEFAULTS.smtSolverEnabled()).isFalse();
  }

  @Test
  void propertiesOverrideDefaults() {
    System.setProperty("negative.space.maxBoundaryTests", " 12 ");
    System.setProperty("negative.space.timeoutMs", "750");
    System.setProperty("negative.space.smtSolverEnabled", "TRUE");
    System.setProperty("negative.space.includeEdgeCases", "false");

    final var config = NegativeSpaceConfig.fromSystemProperties();
    assertThat(config.maxBoundaryTests()).isEqualTo(12);
    assertThat(config.timeoutMs()).isEqualTo(750);
    assertThat(config.smtSolverEnabled()).isTrue();
    assertThat(config.includeEdgeCases()).isFalse();
    assertThat(config.maxNegativeSpaceRegions()).isEqualTo(1000);
  }

  @Test
  void invalidIntegerIsRejected() {
    System.setProperty("negative.space.maxNegativeSpaceRegions", "lots");
    assertThatThrownBy(NegativeSpaceConfig::fromSystemProperties)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid negative.space.maxNegativeSpaceRegions: lots. Must be an integer");
  }

  @Test
  void invalidBooleanIsRejected() {
    System.setProperty("negative.space.smtSolverEnabled", "yes");
    assertThatThrownBy(NegativeSpaceConfig::fromSystemProperties)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid negative.space.smtSolverEnabled: yes. Must be one of: [true, false]");
  }

  @Test
  void outOfRangeValuesAreRejected() {
    System.setProperty("negative.space.timeoutMs", "0");
    assertThatThrownBy(NegativeSpaceConfig::fromSystemProperties).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> NegativeSpaceConfig.DEFAULTS.withMaxBoundaryTests(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void withersChangeOneSetting() {
    final var config = NegativeSpaceConfig.DEFAULTS.withSmtSolverEnabled(true).withIncludeEdgeCases(false);
    assertThat(config).isEqualTo(new NegativeSpaceConfig(1000, 100, 30_000, false, true));
  }
}
