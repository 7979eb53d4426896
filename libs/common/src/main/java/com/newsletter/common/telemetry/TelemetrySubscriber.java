package com.newsletter.common.telemetry;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;
import java.util.Objects;
import net.logstash.logback.encoder.LogstashEncoder;

/**
 * A JSON event sink: one record per event, carrying the service name and every MDC entry of the
 * thread that logged it.
 */
public final class TelemetrySubscriber {

  static final String APPENDER_NAME = "json";

  private final String serviceName;
  private final TelemetryFilter filter;
  private final OutputStream sink;

  TelemetrySubscriber(String serviceName, TelemetryFilter filter, OutputStream sink) {
    this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.sink = new NonClosingOutputStream(Objects.requireNonNull(sink, "sink"));
  }

  public String serviceName() {
    return serviceName;
  }

  /** Replaces whatever configuration {@code context} had with this subscriber. */
  void attachTo(LoggerContext context) {
    context.reset();

    final LogstashEncoder encoder = new LogstashEncoder();
    encoder.setContext(context);
    encoder.setIncludeMdc(true);
    encoder.setCustomFields(customFields());
    encoder.start();

    final OutputStreamAppender<ILoggingEvent> appender = new OutputStreamAppender<>();
    appender.setName(APPENDER_NAME);
    appender.setContext(context);
    appender.setEncoder(encoder);
    appender.setOutputStream(sink);
    appender.start();

    context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
    filter.applyTo(context);
  }

  private String customFields() {
    try {
      return new ObjectMapper().writeValueAsString(Map.of("name", serviceName));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("service name cannot be rendered as JSON", ex);
    }
  }

  // LoggerContext.reset() stops appenders, which closes their stream; stdout must survive that.
  private static final class NonClosingOutputStream extends OutputStream {

    private final OutputStream delegate;

    NonClosingOutputStream(OutputStream delegate) {
      this.delegate = delegate;
    }

    @Override
    public void write(int b) throws IOException {
      delegate.write(b);
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
      delegate.write(bytes, offset, length);
    }

    @Override
    public void flush() throws IOException {
      delegate.flush();
    }

    @Override
    public void close() throws IOException {
      delegate.flush();
    }
  }
}
