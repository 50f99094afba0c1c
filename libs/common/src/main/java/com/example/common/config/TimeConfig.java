/*
 * Where: common configuration
 * What: Exposes a UTC Clock bean
 * Why: Services and tests inject time instead of reading the system clock
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
