package com.flamingo.ai.newsrag.api.dto.response;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a session's chat history, oldest message first. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatHistoryResponse {

  private UUID sessionId;
  private SessionResponse session;
  private List<ChatMessageResponse> messages;
  private int count;
}
