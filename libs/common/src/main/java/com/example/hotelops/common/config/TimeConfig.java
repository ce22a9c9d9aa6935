/*
 * Where: shared configuration
 * What: Exposes a UTC Clock bean
 * Why: Every timestamp the services write comes from one injectable clock
 */
package com.example.hotelops.common.config;

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
