package com.flamingo.ai.newsrag.config;

import com.flamingo.ai.newsrag.agent.ChatStreamingAgent;
import com.flamingo.ai.newsrag.agent.NewsClassificationAgent;
import com.flamingo.ai.newsrag.agent.QueryExpansionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** News classification gate. Uses ChatModel for structured output. */
  @Bean
  public NewsClassificationAgent newsClassificationAgent(ChatModel chatModel) {
    return AiServices.builder(NewsClassificationAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public QueryExpansionAgent queryExpansionAgent(ChatModel chatModel) {
    return AiServices.builder(QueryExpansionAgent.class).chatModel(chatModel).build();
  }

  /**
   * Chat streaming agent for streaming grounded answers. Uses StreamingChatModel for token-by-token
   * streaming.
   */
  @Bean
  public ChatStreamingAgent chatStreamingAgent(StreamingChatModel streamingChatModel) {
    return AiServices.builder(ChatStreamingAgent.class)
        .streamingChatModel(streamingChatModel)
        .build();
  }
}
