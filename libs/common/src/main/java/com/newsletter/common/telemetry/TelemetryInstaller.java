package com.newsletter.common.telemetry;

import ch.qos.logback.classic.LoggerContext;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

final class TelemetryInstaller {

  private final AtomicBoolean installed = new AtomicBoolean();
  private final Supplier<LoggerContext> contextSupplier;

  TelemetryInstaller(Supplier<LoggerContext> contextSupplier) {
    this.contextSupplier = contextSupplier;
  }

  void install(TelemetrySubscriber subscriber) {
    if (!installed.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "a telemetry subscriber is already installed; install '"
              + subscriber.serviceName()
              + "' once at process start");
    }
    subscriber.attachTo(contextSupplier.get());
  }

  boolean isInstalled() {
    return installed.get();
  }
}
