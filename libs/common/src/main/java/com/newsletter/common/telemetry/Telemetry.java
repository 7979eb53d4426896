/*
 * Where: common observability bootstrap
 * What: builds the JSON log subscriber and installs it into the process-wide Logback context
 * Why: every service log line, including request_id from the MDC, must go through one sink
 */
package com.newsletter.common.telemetry;

import ch.qos.logback.classic.LoggerContext;
import java.io.OutputStream;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

public final class Telemetry {

  public static final String DEFAULT_FILTER = "info";

  private static final TelemetryInstaller GLOBAL = new TelemetryInstaller(Telemetry::globalContext);

  private Telemetry() {}

  public static TelemetrySubscriber subscriber(
      String serviceName, TelemetryFilter filter, OutputStream sink) {
    return new TelemetrySubscriber(serviceName, filter, sink);
  }

  /**
   * Installs {@code subscriber} as the process-wide sink and routes java.util.logging into SLF4J.
   *
   * @throws IllegalStateException when a subscriber was already installed in this process
   */
  public static void installGlobal(TelemetrySubscriber subscriber) {
    GLOBAL.install(subscriber);
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
  }

  public static boolean isGlobalInstalled() {
    return GLOBAL.isInstalled();
  }

  private static LoggerContext globalContext() {
    final ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      throw new IllegalStateException(
          "Logback is not the bound SLF4J provider: " + factory.getClass().getName());
    }
    return context;
  }
}
