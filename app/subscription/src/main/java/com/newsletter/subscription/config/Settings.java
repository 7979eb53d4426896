package com.newsletter.subscription.config;

import java.util.Objects;

/** Immutable application settings, resolved once at startup by {@link ConfigurationResolver}. */
public record Settings(ServerSettings server, DatabaseSettings database) {

  public Settings {
    Objects.requireNonNull(server, "server");
    Objects.requireNonNull(database, "database");
  }

  public Settings withServer(ServerSettings replacement) {
    return new Settings(replacement, database);
  }

  public Settings withDatabase(DatabaseSettings replacement) {
    return new Settings(server, replacement);
  }
}
