/*
 * Where: subscription entry point
 * What: telemetry, configuration, pool, migrations and listener, in that order
 * Why: any failure before the listener is bound is fatal and reported once
 */
package com.newsletter.subscription;

import static net.logstash.logback.argument.StructuredArguments.kv;

import com.newsletter.common.config.ClockConfig;
import com.newsletter.common.telemetry.Telemetry;
import com.newsletter.common.telemetry.TelemetryFilter;
import com.newsletter.subscription.config.ConfigurationResolver;
import com.newsletter.subscription.config.Settings;
import com.newsletter.subscription.repository.DatabasePools;
import com.newsletter.subscription.repository.SchemaMigrations;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.Import;

@SpringBootApplication(
    exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@Import(ClockConfig.class)
public class SubscriptionApplication {

  static final String SERVICE_NAME = "subscription";

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionApplication.class);

  public static void main(String[] args) {
    Telemetry.installGlobal(
        Telemetry.subscriber(
            SERVICE_NAME,
            TelemetryFilter.fromEnvironment(System.getenv(), Telemetry.DEFAULT_FILTER),
            System.out));
    try {
      final Settings settings = ConfigurationResolver.fromSystemEnvironment().resolve();
      final HikariDataSource pool = DatabasePools.connect(settings.database());
      if (settings.database().migrateOnStartup()) {
        SchemaMigrations.apply(pool);
      }
      final RunningServer server = SubscriptionServer.build(settings, pool).start();
      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    server.close();
                    pool.close();
                  },
                  "subscription-shutdown"));
      logger.info(
          "listening {} {}", kv("host", settings.server().host()), kv("port", server.port()));
    } catch (RuntimeException ex) {
      logger.error("subscription service failed to start", ex);
      System.exit(1);
    }
  }
}
