package com.newsletter.subscription;

import com.newsletter.subscription.config.ServerSettings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.core.Ordered;

/** Binds the embedded server to the resolved host and port, after Boot's own customizers. */
class ServerListenerCustomizer
    implements WebServerFactoryCustomizer<ConfigurableWebServerFactory>, Ordered {

  private final ServerSettings server;

  ServerListenerCustomizer(ServerSettings server) {
    this.server = server;
  }

  @Override
  public void customize(ConfigurableWebServerFactory factory) {
    final InetAddress address;
    try {
      address = InetAddress.getByName(server.host());
    } catch (UnknownHostException ex) {
      throw new ServerBindException("cannot resolve server host " + server.host(), ex);
    }
    factory.setAddress(address);
    factory.setPort(server.port());
  }

  @Override
  public int getOrder() {
    return Ordered.LOWEST_PRECEDENCE;
  }
}
