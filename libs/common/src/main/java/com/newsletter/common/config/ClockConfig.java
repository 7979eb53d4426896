/*
 * Where: common Spring configuration
 * What: exposes a UTC Clock bean
 * Why: services stamp records with Instant.now(clock) so tests can pin time
 */
package com.newsletter.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  public Clock utcClock() {
    return Clock.systemUTC();
  }
}
