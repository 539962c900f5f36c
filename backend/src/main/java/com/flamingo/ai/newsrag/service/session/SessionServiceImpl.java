package com.flamingo.ai.newsrag.service.session;

import com.flamingo.ai.newsrag.conversation.ConversationStore;
import com.flamingo.ai.newsrag.domain.ChatSession;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.exception.SessionNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the SessionService over the conversation store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionServiceImpl implements SessionService {

  private final ConversationStore conversationStore;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "session.create", description = "Time to create a session")
  public ChatSession createSession() {
    UUID sessionId = UUID.randomUUID();
    ChatSession session = conversationStore.createSession(sessionId);
    meterRegistry.counter("session.created").increment();

    log.info("Created session with ID: {}", sessionId);
    return session;
  }

  @Override
  @Timed(value = "session.get", description = "Time to get a session")
  public ChatSession getSession(UUID sessionId) {
    return conversationStore
        .getSession(sessionId)
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  @Override
  public ChatSession getOrCreateSession(UUID sessionId) {
    return conversationStore
        .getSession(sessionId)
        .orElseGet(
            () -> {
              log.info("Session {} not found, creating it", sessionId);
              meterRegistry.counter("session.created").increment();
              return conversationStore.createSession(sessionId);
            });
  }

  @Override
  @Timed(value = "session.delete", description = "Time to delete a session")
  public void deleteSession(UUID sessionId) {
    conversationStore.deleteSession(sessionId);

    log.info("Deleted session: {}", sessionId);
    meterRegistry.counter("session.deleted").increment();
  }

  @Override
  @Timed(value = "session.history", description = "Time to read session history")
  public List<ConversationMessage> getHistory(UUID sessionId, int limit) {
    getSession(sessionId);
    return conversationStore.getMessages(sessionId, limit);
  }
}
