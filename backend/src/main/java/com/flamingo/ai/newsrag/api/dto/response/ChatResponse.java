package com.flamingo.ai.newsrag.api.dto.response;

import com.flamingo.ai.newsrag.domain.SourceReference;
import com.flamingo.ai.newsrag.service.chat.ChatResult;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a buffered chat answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

  private UUID sessionId;
  private String message;
  private List<SourceReference> sources;
  private Instant timestamp;

  public static ChatResponse fromResult(ChatResult result) {
    return ChatResponse.builder()
        .sessionId(result.sessionId())
        .message(result.message())
        .sources(result.sources())
        .timestamp(result.timestamp())
        .build();
  }
}
