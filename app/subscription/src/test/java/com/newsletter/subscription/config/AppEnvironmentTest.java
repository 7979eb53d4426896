package com.newsletter.subscription.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AppEnvironmentTest {

  @Test
  void unsetOrBlankMeansLocal() {
    assertThat(AppEnvironment.parse(null)).isEqualTo(AppEnvironment.LOCAL);
    assertThat(AppEnvironment.parse("  ")).isEqualTo(AppEnvironment.LOCAL);
  }

  @Test
  void parsesIgnoringCase() {
    assertThat(AppEnvironment.parse("LOCAL")).isEqualTo(AppEnvironment.LOCAL);
    assertThat(AppEnvironment.parse("Production")).isEqualTo(AppEnvironment.PRODUCTION);
    assertThat(AppEnvironment.PRODUCTION.asString()).isEqualTo("production");
  }

  @Test
  void rejectsUnknownValue() {
    assertThatThrownBy(() -> AppEnvironment.parse("qa"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessage("qa is not a supported environment. Use either `local` or `production`.");
  }
}
