package com.flamingo.ai.newsrag.conversation;

import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.domain.ChatSession;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link ConversationStore} with the same expiry rules as the Redis store.
 *
 * <p>Sessions and message lists are two caches with their own write-based expiry. Appending a
 * message rewrites the list entry, which restarts the history TTL; the session entry is only
 * counted in place, so its TTL stays anchored at creation.
 */
public class InMemoryConversationStore implements ConversationStore {

  private final Cache<UUID, SessionEntry> sessions;
  private final Cache<UUID, List<ConversationMessage>> messages;
  private final RagConfig.Conversation config;
  private final Clock clock;

  public InMemoryConversationStore(RagConfig ragConfig, Clock clock) {
    this.config = ragConfig.getConversation();
    this.clock = clock;
    this.sessions =
        Caffeine.newBuilder()
            .expireAfterWrite(config.getSessionTtl())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .scheduler(Scheduler.systemScheduler())
            .executor(Runnable::run)
            .build();
    this.messages =
        Caffeine.newBuilder()
            .expireAfterWrite(config.getHistoryTtl())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .scheduler(Scheduler.systemScheduler())
            .executor(Runnable::run)
            .build();
  }

  @Override
  public ChatSession createSession(UUID sessionId) {
    SessionEntry entry = new SessionEntry(clock.instant());
    sessions.put(sessionId, entry);
    return entry.toSession(sessionId);
  }

  @Override
  public Optional<ChatSession> getSession(UUID sessionId) {
    return Optional.ofNullable(sessions.getIfPresent(sessionId))
        .map(entry -> entry.toSession(sessionId));
  }

  @Override
  public void deleteSession(UUID sessionId) {
    sessions.invalidate(sessionId);
    messages.invalidate(sessionId);
  }

  @Override
  public void appendMessage(UUID sessionId, ConversationMessage message) {
    if (message.getTimestamp() == null) {
      message.setTimestamp(clock.instant());
    }
    messages
        .asMap()
        .compute(
            sessionId,
            (id, existing) -> prepend(existing, message, config.getMaxStoredMessages()));
    SessionEntry entry = sessions.getIfPresent(sessionId);
    if (entry != null) {
      entry.increment();
    }
  }

  @Override
  public List<ConversationMessage> getMessages(UUID sessionId, int limit) {
    List<ConversationMessage> newestFirst = messages.getIfPresent(sessionId);
    if (newestFirst == null || limit <= 0) {
      return List.of();
    }
    List<ConversationMessage> result =
        new ArrayList<>(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
    Collections.reverse(result);
    return result;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  /** Drops every expired entry now instead of waiting for the scheduler. */
  @VisibleForTesting
  void evictExpired() {
    sessions.cleanUp();
    messages.cleanUp();
  }

  @VisibleForTesting
  long sessionEntries() {
    return sessions.estimatedSize();
  }

  @VisibleForTesting
  long messageListEntries() {
    return messages.estimatedSize();
  }

  private static List<ConversationMessage> prepend(
      List<ConversationMessage> existing, ConversationMessage message, int maxSize) {
    List<ConversationMessage> updated = new ArrayList<>();
    updated.add(message);
    if (existing != null) {
      updated.addAll(existing.subList(0, Math.max(0, Math.min(existing.size(), maxSize - 1))));
    }
    return Collections.unmodifiableList(updated);
  }

  private static final class SessionEntry {
    private final Instant createdAt;
    private long messagesCount;

    private SessionEntry(Instant createdAt) {
      this.createdAt = createdAt;
    }

    private synchronized void increment() {
      messagesCount++;
    }

    private synchronized ChatSession toSession(UUID id) {
      return ChatSession.builder().id(id).createdAt(createdAt).messagesCount(messagesCount).build();
    }
  }
}
