package com.flamingo.ai.newsrag.domain;

import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session metadata. Expires independently of the message list, so {@code messagesCount} may exceed
 * the number of messages still stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

  private UUID id;

  private Instant createdAt;

  /** Number of message appends since creation. */
  private long messagesCount;
}
