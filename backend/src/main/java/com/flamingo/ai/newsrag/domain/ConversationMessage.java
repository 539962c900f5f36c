package com.flamingo.ai.newsrag.domain;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of a session's chat history. Appended, never mutated. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessage {

  private MessageRole role;

  private String content;

  @Builder.Default private List<SourceReference> sources = List.of();

  private Instant timestamp;

  public static ConversationMessage user(String content, Instant timestamp) {
    return ConversationMessage.builder()
        .role(MessageRole.USER)
        .content(content)
        .timestamp(timestamp)
        .build();
  }

  public static ConversationMessage assistant(
      String content, List<SourceReference> sources, Instant timestamp) {
    return ConversationMessage.builder()
        .role(MessageRole.ASSISTANT)
        .content(content)
        .sources(sources != null ? sources : List.of())
        .timestamp(timestamp)
        .build();
  }
}
