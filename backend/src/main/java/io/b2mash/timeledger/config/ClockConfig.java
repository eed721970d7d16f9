package io.b2mash.timeledger.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class ClockConfig {

  /** All instants are taken and stored in UTC. Conversion to the display zone is per query. */
  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
