package com.newsletter.subscription.repository;

import static net.logstash.logback.argument.StructuredArguments.kv;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SchemaMigrations {

  public static final String LOCATION = "classpath:db/migration";

  private static final Logger logger = LoggerFactory.getLogger(SchemaMigrations.class);

  private SchemaMigrations() {}

  /** Applies pending migrations from {@value #LOCATION} in version order. */
  public static MigrateResult apply(DataSource dataSource) {
    final MigrateResult result =
        Flyway.configure().dataSource(dataSource).locations(LOCATION).load().migrate();
    logger.info(
        "schema migrations applied {} {}",
        kv("migrations_executed", result.migrationsExecuted),
        kv("target_version", result.targetSchemaVersion));
    return result;
  }
}
