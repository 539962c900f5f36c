package com.flamingo.ai.newsrag.api.dto.response;

import com.flamingo.ai.newsrag.domain.ChatSession;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

  private UUID id;
  private Instant createdAt;
  private long messagesCount;

  public static SessionResponse fromSession(ChatSession session) {
    return SessionResponse.builder()
        .id(session.getId())
        .createdAt(session.getCreatedAt())
        .messagesCount(session.getMessagesCount())
        .build();
  }
}
