package dev.archivist.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Pipeline-wide infrastructure: declarative retries for storage listing, cron-triggered runs and
 * an injectable {@link Clock}.
 */
@Configuration
@EnableRetry
@EnableScheduling
public class PipelineConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
