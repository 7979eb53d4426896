/*
 * Where: subscription bootstrap
 * What: assembles the Spring MVC application around an already opened pool and starts the listener
 * Why: main and the test harness start identical servers from Settings plus a pool
 */
package com.newsletter.subscription;

import com.newsletter.subscription.config.Settings;
import java.net.BindException;
import javax.sql.DataSource;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.boot.web.server.WebServerException;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.support.GenericApplicationContext;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public final class SubscriptionServer {

  private final SpringApplication application;
  private final Settings settings;

  private SubscriptionServer(SpringApplication application, Settings settings) {
    this.application = application;
    this.settings = settings;
  }

  /**
   * Prepares a server for {@code settings} that shares {@code pool}. Nothing is bound until {@link
   * #start()}. The pool stays owned by the caller and is not closed with the server.
   */
  public static SubscriptionServer build(Settings settings, DataSource pool) {
    System.setProperty(LoggingSystem.SYSTEM_PROPERTY, LoggingSystem.NONE);
    final SpringApplication application = new SpringApplication(SubscriptionApplication.class);
    application.setBannerMode(Banner.Mode.OFF);
    application.setRegisterShutdownHook(false);
    application.addInitializers(new SharedStateInitializer(settings, pool));
    return new SubscriptionServer(application, settings);
  }

  /**
   * Starts the application and returns once the listener is bound; requests are served on the
   * embedded server's own threads.
   *
   * @throws ServerBindException when the configured address cannot be bound
   */
  public RunningServer start() {
    final ConfigurableApplicationContext context;
    try {
      context = application.run();
    } catch (RuntimeException ex) {
      throw translateBindFailure(ex);
    }
    final int port = ((WebServerApplicationContext) context).getWebServer().getPort();
    return new RunningServer(context, port);
  }

  private RuntimeException translateBindFailure(RuntimeException ex) {
    for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
      if (cause instanceof ServerBindException bindException) {
        return bindException;
      }
      if (cause instanceof WebServerException || cause instanceof BindException) {
        return new ServerBindException(
            "failed to bind " + settings.server().socketAddress(), ex);
      }
    }
    return ex;
  }

  private static final class SharedStateInitializer
      implements ApplicationContextInitializer<GenericApplicationContext> {

    private final Settings settings;
    private final DataSource pool;

    SharedStateInitializer(Settings settings, DataSource pool) {
      this.settings = settings;
      this.pool = pool;
    }

    @Override
    public void initialize(GenericApplicationContext context) {
      final JdbcTemplate jdbcTemplate = new JdbcTemplate(pool);
      jdbcTemplate.setQueryTimeout(settings.database().queryTimeoutSeconds());

      context.registerBean(Settings.class, () -> settings);
      // empty destroy method: the caller closes the pool, not the context
      context.registerBean(
          "dataSource", DataSource.class, () -> pool, bd -> bd.setDestroyMethodName(""));
      context.registerBean(JdbcTemplate.class, () -> jdbcTemplate);
      context.registerBean(
          NamedParameterJdbcTemplate.class, () -> new NamedParameterJdbcTemplate(jdbcTemplate));
      context.registerBean(
          ServerListenerCustomizer.class, () -> new ServerListenerCustomizer(settings.server()));
    }
  }
}
