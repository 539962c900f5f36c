package com.flamingo.ai.newsrag.service.chat;

import com.flamingo.ai.newsrag.api.dto.response.StreamEventResponse;
import java.util.UUID;
import reactor.core.publisher.Flux;

/** Service interface for answering chat messages about the news. */
public interface ChatService {

  /**
   * Answers a message in one response. The session is created when absent.
   *
   * @param sessionId the session ID
   * @param message the user's message
   * @return the answer and the articles it was grounded on
   * @throws com.flamingo.ai.newsrag.exception.InvalidRequestException if the input is invalid
   */
  ChatResult sendMessage(UUID sessionId, String message);

  /**
   * Streams an answer as events: metadata, sources (when any), content increments, then complete.
   * Failures after validation end the stream with a single error event.
   *
   * @param sessionId the session ID
   * @param message the user's message
   * @return a Flux of stream events
   * @throws com.flamingo.ai.newsrag.exception.InvalidRequestException if the input is invalid
   */
  Flux<StreamEventResponse> streamMessage(UUID sessionId, String message);
}
