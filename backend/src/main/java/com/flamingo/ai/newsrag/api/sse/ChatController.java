package com.flamingo.ai.newsrag.api.sse;

import com.flamingo.ai.newsrag.api.dto.request.ChatRequest;
import com.flamingo.ai.newsrag.api.dto.response.ChatHistoryResponse;
import com.flamingo.ai.newsrag.api.dto.response.ChatMessageResponse;
import com.flamingo.ai.newsrag.api.dto.response.ChatResponse;
import com.flamingo.ai.newsrag.api.dto.response.SessionResponse;
import com.flamingo.ai.newsrag.api.dto.response.StreamEventResponse;
import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.domain.ChatSession;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.service.chat.ChatService;
import com.flamingo.ai.newsrag.service.session.SessionService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for chat interactions with SSE streaming support. */
@RestController
@RequestMapping("/api/chat")
@Slf4j
public class ChatController {

  private final ChatService chatService;
  private final SessionService sessionService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  public ChatController(
      ChatService chatService,
      SessionService sessionService,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.chatService = chatService;
    this.sessionService = sessionService;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /**
   * Answers a chat message in a single response.
   *
   * @param request the chat request containing the session ID and message
   * @return the answer with its sources
   */
  @PostMapping("/message")
  public ResponseEntity<ChatResponse> sendMessage(@Valid @RequestBody ChatRequest request) {
    return ResponseEntity.ok(
        ChatResponse.fromResult(
            chatService.sendMessage(request.getSessionId(), request.getMessage())));
  }

  /**
   * Streams a chat response using Server-Sent Events.
   *
   * @param request the chat request containing the session ID and message
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamEventResponse> streamMessage(@Valid @RequestBody ChatRequest request) {
    UUID sessionId = request.getSessionId();
    Flux<StreamEventResponse> events = chatService.streamMessage(sessionId, request.getMessage());

    log.info("Starting chat stream for session {}", sessionId);
    activeConnections.incrementAndGet();

    return events
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream completed for session {}", sessionId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Chat stream error for session {}: {}", sessionId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Chat stream cancelled for session {}", sessionId);
            });
  }

  /**
   * Gets chat history for a session.
   *
   * @param sessionId the session ID
   * @param limit maximum number of messages (default from configuration)
   * @return the session and its most recent messages, oldest first
   */
  @GetMapping("/history/{sessionId}")
  public ResponseEntity<ChatHistoryResponse> getChatHistory(
      @PathVariable UUID sessionId, @RequestParam(required = false) Integer limit) {
    int effectiveLimit =
        limit != null && limit > 0 ? limit : ragConfig.getConversation().getDefaultHistoryLimit();

    ChatSession session = sessionService.getSession(sessionId);
    List<ConversationMessage> messages = sessionService.getHistory(sessionId, effectiveLimit);

    return ResponseEntity.ok(
        ChatHistoryResponse.builder()
            .sessionId(sessionId)
            .session(SessionResponse.fromSession(session))
            .messages(messages.stream().map(ChatMessageResponse::fromMessage).toList())
            .count(messages.size())
            .build());
  }

  /** Clears a session's metadata and history. */
  @DeleteMapping("/history/{sessionId}")
  public ResponseEntity<Map<String, Object>> clearChatHistory(@PathVariable UUID sessionId) {
    sessionService.deleteSession(sessionId);
    return ResponseEntity.ok(
        Map.of("message", "Chat history cleared successfully", "sessionId", sessionId));
  }
}
