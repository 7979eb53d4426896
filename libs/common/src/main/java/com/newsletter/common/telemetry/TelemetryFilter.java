package com.newsletter.common.telemetry;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Severity filter built from a directive list such as {@code info,com.newsletter=debug}.
 *
 * <p>A bare level applies to the root logger; {@code logger=level} applies to that logger and its
 * children. When no bare level is given the root stays at INFO.
 */
public final class TelemetryFilter {

  public static final String ENV_VAR = "APP_LOG";

  private final Level rootLevel;
  private final Map<String, Level> loggerLevels;

  private TelemetryFilter(Level rootLevel, Map<String, Level> loggerLevels) {
    this.rootLevel = rootLevel;
    this.loggerLevels = Collections.unmodifiableMap(loggerLevels);
  }

  public static TelemetryFilter parse(String directives) {
    return tryParse(directives)
        .orElseThrow(
            () -> new IllegalArgumentException("invalid log filter directives: " + directives));
  }

  public static Optional<TelemetryFilter> tryParse(String directives) {
    if (directives == null || directives.isBlank()) {
      return Optional.empty();
    }
    Level root = null;
    final Map<String, Level> levels = new LinkedHashMap<>();
    for (String raw : directives.split(",")) {
      final String directive = raw.trim();
      if (directive.isEmpty()) {
        continue;
      }
      final int separator = directive.lastIndexOf('=');
      if (separator < 0) {
        root = Level.toLevel(directive, null);
        if (root == null) {
          return Optional.empty();
        }
        continue;
      }
      final String loggerName = directive.substring(0, separator).trim();
      final Level level = Level.toLevel(directive.substring(separator + 1).trim(), null);
      if (loggerName.isEmpty() || level == null) {
        return Optional.empty();
      }
      levels.put(loggerName, level);
    }
    if (root == null && levels.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new TelemetryFilter(root == null ? Level.INFO : root, levels));
  }

  /** Reads {@value #ENV_VAR}; an absent or unparsable value yields {@code fallback}. */
  public static TelemetryFilter fromEnvironment(Map<String, String> environment, String fallback) {
    return tryParse(environment.get(ENV_VAR)).orElseGet(() -> parse(fallback));
  }

  public Level rootLevel() {
    return rootLevel;
  }

  public Map<String, Level> loggerLevels() {
    return loggerLevels;
  }

  void applyTo(LoggerContext context) {
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
    loggerLevels.forEach((name, level) -> context.getLogger(name).setLevel(level));
  }

  @Override
  public String toString() {
    return "TelemetryFilter{root=" + rootLevel + ", loggers=" + loggerLevels + "}";
  }
}
