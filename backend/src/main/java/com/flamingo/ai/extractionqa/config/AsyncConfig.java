package com.flamingo.ai.extractionqa.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Worker pools for the two validation fan-out phases.
 *
 * <p>Problem detection is CPU-bound and sized to the configured detection parallelism. Secondary
 * extraction is I/O-bound and capped separately so the secondary provider never sees more than
 * {@code extraction-concurrency} calls in flight from one instance.
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final ValidationConfig validationConfig;

  @Bean(name = "problemDetectionExecutor")
  public ThreadPoolTaskExecutor problemDetectionExecutor() {
    int size = validationConfig.getCrossValidation().getDetectionParallelism();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("qa-detect-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "secondaryExtractionExecutor")
  public ThreadPoolTaskExecutor secondaryExtractionExecutor() {
    int size = validationConfig.getCrossValidation().getExtractionConcurrency();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("qa-extract-");
    executor.initialize();
    return executor;
  }

  /** Fires per-page extraction timeouts. */
  @Bean(name = "validationTimeoutScheduler")
  public ThreadPoolTaskScheduler validationTimeoutScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("qa-timeout-");
    scheduler.initialize();
    return scheduler;
  }
}
