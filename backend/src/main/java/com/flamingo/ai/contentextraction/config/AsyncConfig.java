package com.flamingo.ai.contentextraction.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs one chunk-and-flatten pipeline per document of a batch. */
  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(Math.max(2, Runtime.getRuntime().availableProcessors()));
    executor.setMaxPoolSize(Math.max(4, Runtime.getRuntime().availableProcessors() * 2));
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("extract-");
    executor.initialize();
    return executor;
  }
}
