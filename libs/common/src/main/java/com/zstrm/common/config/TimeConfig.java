/*
 * Where: shared configuration
 * What: exposes a UTC Clock bean
 * Why: every lease, grace window and schedule decision reads time through one injectable source
 */
package com.zstrm.common.config;

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
