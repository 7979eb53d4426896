package com.newsletter.subscription;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * A started server. {@link #port()} is the port actually bound, which differs from the configured
 * one when that was 0.
 */
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "the application context is shared with the caller that started it")
public record RunningServer(ConfigurableApplicationContext context, int port)
    implements AutoCloseable {

  @Override
  public void close() {
    context.close();
  }
}
