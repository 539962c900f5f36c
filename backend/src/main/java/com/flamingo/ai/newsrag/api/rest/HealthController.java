package com.flamingo.ai.newsrag.api.rest;

import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.conversation.ConversationStore;
import com.flamingo.ai.newsrag.vectorindex.VectorIndex;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks with component status. */
@RestController
@RequestMapping("/health")
public class HealthController {

  private final VectorIndex vectorIndex;
  private final ConversationStore conversationStore;
  private final RagConfig ragConfig;
  private final Clock clock;
  private final String openAiApiKey;

  public HealthController(
      VectorIndex vectorIndex,
      ConversationStore conversationStore,
      RagConfig ragConfig,
      Clock clock,
      @Value("${langchain4j.openai.api-key:}") String openAiApiKey) {
    this.vectorIndex = vectorIndex;
    this.conversationStore = conversationStore;
    this.ragConfig = ragConfig;
    this.clock = clock;
    this.openAiApiKey = openAiApiKey;
  }

  /** Returns UP with 200, or DEGRADED with 503 when the index or the store is unreachable. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    boolean indexUp = vectorIndex.isAvailable();
    boolean storeUp = conversationStore.isAvailable();

    Map<String, String> services = new LinkedHashMap<>();
    services.put("vectorIndex", indexUp ? "healthy" : "unhealthy");
    services.put("conversationStore", storeUp ? "healthy" : "unhealthy");
    services.put("embeddingApi", configured(ragConfig.getEmbedding().getApiKey()));
    services.put("llmApi", configured(openAiApiKey));

    boolean healthy = indexUp && storeUp;
    Map<String, Object> health = new HashMap<>();
    health.put("status", healthy ? "UP" : "DEGRADED");
    health.put("timestamp", clock.instant());
    health.put("service", "news-rag");
    health.put("services", services);
    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
        .body(health);
  }

  private static String configured(String key) {
    return key != null && !key.isBlank() ? "configured" : "not_configured";
  }
}
