package com.newsletter.subscription.repository;

import com.newsletter.subscription.config.DatabaseSettings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public final class DatabasePools {

  private DatabasePools() {}

  /**
   * Opens a Hikari pool against {@code settings}. The pool connects eagerly, so an unreachable
   * database fails here rather than on the first request.
   */
  public static HikariDataSource connect(DatabaseSettings settings) {
    final HikariConfig config = new HikariConfig();
    config.setPoolName("subscription-" + settings.name());
    config.setJdbcUrl(settings.jdbcUrl());
    config.setUsername(settings.user().name());
    config.setPassword(settings.user().password().expose());
    config.setConnectionTimeout(settings.acquireTimeout().toMillis());
    return new HikariDataSource(config);
  }
}
