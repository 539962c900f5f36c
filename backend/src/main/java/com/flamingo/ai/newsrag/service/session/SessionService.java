package com.flamingo.ai.newsrag.service.session;

import com.flamingo.ai.newsrag.domain.ChatSession;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import java.util.List;
import java.util.UUID;

/** Service interface for chat session management. */
public interface SessionService {

  /**
   * Creates a new session with a fresh id.
   *
   * @return the created session
   */
  ChatSession createSession();

  /**
   * Gets a session by ID.
   *
   * @param sessionId the session ID
   * @return the session
   * @throws com.flamingo.ai.newsrag.exception.SessionNotFoundException if absent or expired
   */
  ChatSession getSession(UUID sessionId);

  /**
   * Returns the session, creating it when absent or expired.
   *
   * @param sessionId the session ID chosen by the caller
   * @return the existing or new session
   */
  ChatSession getOrCreateSession(UUID sessionId);

  /**
   * Deletes a session and its history. Deleting an unknown session is a no-op.
   *
   * @param sessionId the session ID
   */
  void deleteSession(UUID sessionId);

  /**
   * Gets the most recent messages of a session, oldest first.
   *
   * @param sessionId the session ID
   * @param limit maximum number of messages
   * @return the messages
   * @throws com.flamingo.ai.newsrag.exception.SessionNotFoundException if absent or expired
   */
  List<ConversationMessage> getHistory(UUID sessionId, int limit);
}
