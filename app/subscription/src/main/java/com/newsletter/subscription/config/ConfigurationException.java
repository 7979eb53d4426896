/*
 * Where: subscription configuration
 * What: the single failure type of configuration resolution
 * Why: startup aborts on any configuration problem, so callers need one type to report
 */
package com.newsletter.subscription.config;

public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
