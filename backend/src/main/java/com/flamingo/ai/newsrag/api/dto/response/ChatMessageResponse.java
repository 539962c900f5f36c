package com.flamingo.ai.newsrag.api.dto.response;

import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.domain.MessageRole;
import com.flamingo.ai.newsrag.domain.SourceReference;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one history entry. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {

  private MessageRole role;
  private String content;
  private List<SourceReference> sources;
  private Instant timestamp;

  public static ChatMessageResponse fromMessage(ConversationMessage message) {
    return ChatMessageResponse.builder()
        .role(message.getRole())
        .content(message.getContent())
        .sources(message.getSources() != null ? message.getSources() : List.of())
        .timestamp(message.getTimestamp())
        .build();
  }
}
