package com.newsletter.subscription.config;

import java.util.Locale;

public enum AppEnvironment {
  LOCAL("local"),
  PRODUCTION("production");

  private final String value;

  AppEnvironment(String value) {
    this.value = value;
  }

  public String asString() {
    return value;
  }

  /** Unset or blank means {@link #LOCAL}; anything unrecognized is a configuration error. */
  public static AppEnvironment parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return LOCAL;
    }
    final String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (AppEnvironment environment : values()) {
      if (environment.value.equals(normalized)) {
        return environment;
      }
    }
    throw new ConfigurationException(
        raw + " is not a supported environment. Use either `local` or `production`.");
  }
}
