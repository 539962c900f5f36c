package com.flamingo.ai.newsrag.config;

import com.flamingo.ai.newsrag.exception.EmbeddingException;
import com.flamingo.ai.newsrag.service.resilience.RetryPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Retry policy used by the embedding client. */
@Configuration
@RequiredArgsConstructor
public class EmbeddingConfig {

  private final RagConfig ragConfig;

  @Bean
  public RetryPolicy embeddingRetryPolicy() {
    RagConfig.Embedding.Retry retry = ragConfig.getEmbedding().getRetry();
    return new RetryPolicy(
        "embedding",
        retry.getMaxAttempts(),
        retry.getBaseDelay(),
        retry.getBackoffUnit(),
        EmbeddingConfig::isRetryable);
  }

  static boolean isRetryable(Throwable t) {
    return t instanceof EmbeddingException e && e.isRetryable();
  }
}
