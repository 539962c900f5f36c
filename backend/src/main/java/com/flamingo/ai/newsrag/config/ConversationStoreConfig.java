package com.flamingo.ai.newsrag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.newsrag.conversation.ConversationStore;
import com.flamingo.ai.newsrag.conversation.InMemoryConversationStore;
import com.flamingo.ai.newsrag.conversation.RedisConversationStore;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the conversation store with {@code rag.conversation.store}: {@code redis} (default) uses
 * the Spring Boot managed {@link StringRedisTemplate} from {@code spring.data.redis.*}, {@code
 * memory} keeps sessions in the JVM.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ConversationStoreConfig {

  private final RagConfig ragConfig;

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(
      name = "rag.conversation.store",
      havingValue = "redis",
      matchIfMissing = true)
  public ConversationStore redisConversationStore(
      StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper, Clock clock) {
    log.info("Using Redis conversation store");
    return new RedisConversationStore(stringRedisTemplate, objectMapper, ragConfig, clock);
  }

  @Bean
  @ConditionalOnProperty(name = "rag.conversation.store", havingValue = "memory")
  public ConversationStore inMemoryConversationStore(Clock clock) {
    log.info("Using in-memory conversation store");
    return new InMemoryConversationStore(ragConfig, clock);
  }
}
