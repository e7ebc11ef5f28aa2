package com.flamingo.ai.contentextraction.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring for the extraction service.
 *
 * <p>The aspect backs the {@code extraction.chunk}, {@code extraction.digest} and {@code
 * extraction.batch} timers declared with {@code @Timed} on {@code ContentExtractionServiceImpl}.
 * It only sees calls made through the Spring proxy; per-document batch work is timed by the
 * service itself as {@code extraction.document.duration}.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
