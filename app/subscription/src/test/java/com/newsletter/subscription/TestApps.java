/*
 * Where: subscription integration tests
 * What: spawns a fully wired server against its own freshly created PostgreSQL database
 * Why: integration tests run in parallel without sharing rows
 */
package com.newsletter.subscription;

import com.newsletter.common.telemetry.Telemetry;
import com.newsletter.common.telemetry.TelemetryFilter;
import com.newsletter.subscription.config.ConfigurationResolver;
import com.newsletter.subscription.config.DatabaseSettings;
import com.newsletter.subscription.config.Settings;
import com.newsletter.subscription.repository.DatabasePools;
import com.newsletter.subscription.repository.SchemaMigrations;
import com.zaxxer.hikari.HikariDataSource;
import java.io.OutputStream;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;

public final class TestApps {

  static final String TEST_LOG_VAR = "TEST_LOG";

  // one container per JVM; every spawned app gets its own database inside it
  private static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine");

  private TestApps() {}

  public static TestApp spawn() {
    installTelemetry();
    startPostgres();

    final Settings base =
        new ConfigurationResolver(
                Map.of(
                    "APP_ENVIRONMENT", "local",
                    "APP_DATABASE__HOST", POSTGRES.getHost(),
                    "APP_DATABASE__PORT",
                        String.valueOf(POSTGRES.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT)),
                    "APP_DATABASE__USER__NAME", POSTGRES.getUsername(),
                    "APP_DATABASE__USER__PASSWORD", POSTGRES.getPassword(),
                    "APP_DATABASE__MIGRATE_ON_STARTUP", "false"))
            .resolve();
    final Settings settings =
        base.withServer(base.server().withRandomPort())
            .withDatabase(base.database().withName(UUID.randomUUID().toString()));

    createDatabase(settings.database());
    final HikariDataSource pool = DatabasePools.connect(settings.database());
    SchemaMigrations.apply(pool);

    final RunningServer server = SubscriptionServer.build(settings, pool).start();
    return new TestApp("http://" + settings.server().host() + ":" + server.port(), pool);
  }

  private static void createDatabase(DatabaseSettings database) {
    final DatabaseSettings maintenance = database.maintenance();
    final DriverManagerDataSource dataSource =
        new DriverManagerDataSource(
            maintenance.jdbcUrl(),
            maintenance.user().name(),
            maintenance.user().password().expose());
    new JdbcTemplate(dataSource).execute("CREATE DATABASE \"" + database.name() + "\"");
  }

  private static synchronized void installTelemetry() {
    if (Telemetry.isGlobalInstalled()) {
      return;
    }
    final OutputStream sink =
        System.getenv(TEST_LOG_VAR) != null ? System.out : OutputStream.nullOutputStream();
    Telemetry.installGlobal(
        Telemetry.subscriber(
            "test",
            TelemetryFilter.fromEnvironment(System.getenv(), Telemetry.DEFAULT_FILTER),
            sink));
  }

  private static synchronized void startPostgres() {
    if (!POSTGRES.isRunning()) {
      POSTGRES.start();
    }
  }
}
