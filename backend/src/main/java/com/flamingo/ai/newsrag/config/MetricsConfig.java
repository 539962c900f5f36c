package com.flamingo.ai.newsrag.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Backs the {@code @Timed} timers of the news pipeline ({@code llm.*}, {@code session.*}, {@code
 * vector_index.*}, {@code chat.message}, {@code ingestion.pass}). The {@code application=news-rag}
 * tag comes from {@code management.metrics.tags}.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
