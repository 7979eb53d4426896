package com.newsletter.subscription.config;

public record ServerSettings(String host, Integer port) {

  static final int RANDOM_PORT = 0;
  private static final int MAX_PORT = 65_535;

  public ServerSettings {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("server.host is required");
    }
    if (port == null) {
      throw new IllegalArgumentException("server.port is required");
    }
    if (port < 0 || port > MAX_PORT) {
      throw new IllegalArgumentException("server.port must be within 0..65535 but was " + port);
    }
  }

  /** {@code host:port}, the address the listener binds to. */
  public String socketAddress() {
    return host + ":" + port;
  }

  /** Same host, port 0: the OS picks a free port at bind time. */
  public ServerSettings withRandomPort() {
    return new ServerSettings(host, RANDOM_PORT);
  }
}
