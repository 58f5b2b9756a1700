/*
 * Where: shared configuration
 * What: Fallback UTC Clock for services that do not declare their own
 * Why: Summary timestamps are rendered as UTC ISO-8601, and a fixed clock can replace this one
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  /** Backs off when the context already holds a {@link Clock}, e.g. a fixed one in a test. */
  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock utcClock() {
    return Clock.systemUTC();
  }
}
