package com.flamingo.ai.newsrag.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.conversation.ConversationStore;
import com.flamingo.ai.newsrag.vectorindex.VectorIndex;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {

  private MockMvc mockMvc;

  @Mock private VectorIndex vectorIndex;

  @Mock private ConversationStore conversationStore;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setApiKey("jina-key");
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new HealthController(
                    vectorIndex, conversationStore, ragConfig, Clock.systemUTC(), ""))
            .build();
  }

  @Test
  @DisplayName("Should report UP when index and store are reachable")
  void shouldReportUp_whenDependenciesHealthy() throws Exception {
    when(vectorIndex.isAvailable()).thenReturn(true);
    when(conversationStore.isAvailable()).thenReturn(true);

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.services.embeddingApi").value("configured"))
        .andExpect(jsonPath("$.services.llmApi").value("not_configured"));
  }

  @Test
  @DisplayName("Should report DEGRADED with 503 when the store is down")
  void shouldReportDegraded_whenStoreDown() throws Exception {
    when(vectorIndex.isAvailable()).thenReturn(true);
    when(conversationStore.isAvailable()).thenReturn(false);

    mockMvc
        .perform(get("/health"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value("DEGRADED"))
        .andExpect(jsonPath("$.services.conversationStore").value("unhealthy"));
  }
}
