package com.flamingo.ai.newsrag.agent;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.service.TokenStream;
import java.util.List;

/**
 * AI agent for streaming chat responses.
 *
 * <p>The service layer builds the full message list (system prompt, prior turns, article context
 * and question) and passes it in, so the agent carries no prompt annotations.
 */
public interface ChatStreamingAgent {

  /**
   * Streams a chat response given the full conversation context.
   *
   * @param messages system, prior turn and current user messages
   * @return TokenStream for streaming the response
   */
  TokenStream chat(List<ChatMessage> messages);
}
