/*
 * Where: subscription configuration
 * What: merges base.yaml, <environment>.yaml and APP_* variables into Settings
 * Why: every component reads the same typed, immutable settings instead of looking things up itself
 */
package com.newsletter.subscription.config;

import com.newsletter.common.SecretString;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.PropertySourcesPlaceholdersResolver;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.convert.ApplicationConversionService;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Resolves {@link Settings} from an ordered list of sources; later sources win per key.
 *
 * <ol>
 *   <li>{@code base.yaml}
 *   <li>{@code local.yaml} or {@code production.yaml}, selected by {@value #ENVIRONMENT_VAR}
 *   <li>variables named {@code APP_<SECTION>__<KEY>}, e.g. {@code APP_DATABASE__USER__PASSWORD}
 * </ol>
 *
 * <p>Files are read from {@value #DEFAULT_LOCATION} unless {@value #CONFIGURATION_DIR_VAR} names
 * another resource location.
 */
public class ConfigurationResolver {

  public static final String ENVIRONMENT_VAR = "APP_ENVIRONMENT";
  public static final String CONFIGURATION_DIR_VAR = "APP_CONFIGURATION_DIR";
  static final String DEFAULT_LOCATION = "classpath:configuration/";
  static final String BASE_FILE = "base.yaml";

  private static final String OVERRIDE_PREFIX = "APP_";
  private static final String OVERRIDE_SEPARATOR = "__";

  private final Map<String, String> environment;
  private final ResourceLoader resourceLoader = new DefaultResourceLoader();
  private final YamlPropertySourceLoader yamlLoader = new YamlPropertySourceLoader();

  public ConfigurationResolver(Map<String, String> environment) {
    this.environment = Map.copyOf(environment);
  }

  public static ConfigurationResolver fromSystemEnvironment() {
    return new ConfigurationResolver(System.getenv());
  }

  public Settings resolve() {
    final AppEnvironment appEnvironment = AppEnvironment.parse(environment.get(ENVIRONMENT_VAR));
    final String location = configurationLocation();

    final List<PropertySource<?>> layers = new ArrayList<>();
    layers.addAll(loadYaml(location, BASE_FILE));
    layers.addAll(loadYaml(location, appEnvironment.asString() + ".yaml"));
    layers.add(environmentOverrides());

    final MutablePropertySources sources = new MutablePropertySources();
    for (PropertySource<?> layer : layers) {
      sources.addFirst(layer);
    }

    final Binder binder =
        new Binder(
            ConfigurationPropertySources.from(sources),
            new PropertySourcesPlaceholdersResolver(sources),
            conversionService());
    return new Settings(
        bindSection(binder, "server", ServerSettings.class),
        bindSection(binder, "database", DatabaseSettings.class));
  }

  /** Maps {@code APP_DATABASE__MIGRATE_ON_STARTUP} to {@code database.migrate-on-startup}. */
  static String toPropertyName(String variable) {
    final String[] parts = variable.substring(OVERRIDE_PREFIX.length()).split(OVERRIDE_SEPARATOR);
    final StringBuilder name = new StringBuilder();
    for (String part : parts) {
      if (part.isEmpty()) {
        return null;
      }
      if (name.length() > 0) {
        name.append('.');
      }
      name.append(part.toLowerCase(Locale.ROOT).replace('_', '-'));
    }
    return name.toString();
  }

  private String configurationLocation() {
    final String configured = environment.get(CONFIGURATION_DIR_VAR);
    if (configured == null || configured.isBlank()) {
      return DEFAULT_LOCATION;
    }
    return configured.endsWith("/") ? configured : configured + "/";
  }

  private List<PropertySource<?>> loadYaml(String location, String fileName) {
    final Resource resource = resourceLoader.getResource(location + fileName);
    if (!resource.exists()) {
      throw new ConfigurationException(
          "configuration file not found: " + resource.getDescription());
    }
    try {
      return yamlLoader.load(fileName, resource);
    } catch (IOException | RuntimeException ex) {
      throw new ConfigurationException(
          "failed to parse configuration file: " + resource.getDescription(), ex);
    }
  }

  private PropertySource<?> environmentOverrides() {
    final Map<String, Object> overrides = new LinkedHashMap<>();
    environment.forEach(
        (variable, value) -> {
          if (!variable.startsWith(OVERRIDE_PREFIX)
              || !variable.substring(OVERRIDE_PREFIX.length()).contains(OVERRIDE_SEPARATOR)) {
            return;
          }
          final String propertyName = toPropertyName(variable);
          if (propertyName != null) {
            overrides.put(propertyName, value);
          }
        });
    return new MapPropertySource("environment-overrides", overrides);
  }

  private <T> T bindSection(Binder binder, String section, Class<T> type) {
    try {
      return binder
          .bind(section, Bindable.of(type))
          .orElseThrow(
              () -> new ConfigurationException("missing configuration section '" + section + "'"));
    } catch (BindException ex) {
      // the cause chain carries the offending key; BindException's own message never echoes values
      throw new ConfigurationException(
          "invalid configuration section '" + section + "': " + ex.getMessage(), ex);
    }
  }

  private static ApplicationConversionService conversionService() {
    final ApplicationConversionService conversionService = new ApplicationConversionService();
    conversionService.addConverter(String.class, SecretString.class, SecretString::new);
    return conversionService;
  }
}
