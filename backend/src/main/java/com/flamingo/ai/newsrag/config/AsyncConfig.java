package com.flamingo.ai.newsrag.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background ingestion runs. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Ingestion passes run one at a time; embedding batches stay sequential across passes. */
  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(4);
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    return executor;
  }
}
