package io.caseworks.backend.config;

import io.caseworks.backend.rulepack.RulePackVersionCollisionException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfig {

  /**
   * Retries a rule pack insert whose version was claimed by a write outside the version counter.
   * Each attempt allocates again past the stored maximum.
   */
  @Bean
  RetryTemplate rulePackVersionRetryTemplate() {
    return RetryTemplate.builder()
        .maxAttempts(3)
        .fixedBackoff(50)
        .retryOn(RulePackVersionCollisionException.class)
        .build();
  }
}
