package com.flamingo.ai.newsrag.conversation;

import com.flamingo.ai.newsrag.domain.ChatSession;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.exception.ConversationStoreException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-session metadata and chat history. Session metadata and the message list are separate
 * resources with their own expiry; {@link ChatSession#getMessagesCount()} counts appends and may
 * exceed the number of messages still stored.
 *
 * <p>Operations touch a single session only. Failures surface as {@link
 * ConversationStoreException}.
 */
public interface ConversationStore {

  /** Creates or overwrites the session metadata with a zero message count. */
  ChatSession createSession(UUID sessionId);

  Optional<ChatSession> getSession(UUID sessionId);

  /** Removes the metadata and the message list. */
  void deleteSession(UUID sessionId);

  /**
   * Prepends a message to the session's list, increments the message count and resets the list's
   * expiry. A message without a timestamp is stamped with the current time.
   */
  void appendMessage(UUID sessionId, ConversationMessage message);

  /**
   * The most recent {@code limit} messages, oldest first.
   *
   * @return messages, empty when the list is absent or expired
   */
  List<ConversationMessage> getMessages(UUID sessionId, int limit);

  /** Whether the backing store answers. Never throws. */
  boolean isAvailable();
}
