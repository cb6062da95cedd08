package io.axis.backend.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Single UTC clock for audit timestamps and change history. */
@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.system(ZoneOffset.UTC);
  }
}
