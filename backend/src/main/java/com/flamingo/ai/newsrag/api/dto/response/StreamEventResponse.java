package com.flamingo.ai.newsrag.api.dto.response;

import com.flamingo.ai.newsrag.domain.SourceReference;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for SSE chat events. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamEventResponse {

  public static final String METADATA = "metadata";
  public static final String SOURCES = "sources";
  public static final String CONTENT = "content";
  public static final String COMPLETE = "complete";
  public static final String ERROR = "error";

  /** Event type: metadata, sources, content, complete, error. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** Creates the opening metadata event. */
  public static StreamEventResponse metadata(UUID sessionId, Instant timestamp) {
    return StreamEventResponse.builder()
        .eventType(METADATA)
        .data(new MetadataData(sessionId, timestamp))
        .build();
  }

  /** Creates a sources event. */
  public static StreamEventResponse sources(List<SourceReference> sources) {
    return StreamEventResponse.builder().eventType(SOURCES).data(new SourcesData(sources)).build();
  }

  /** Creates a content event carrying one text increment. */
  public static StreamEventResponse content(String content) {
    return StreamEventResponse.builder().eventType(CONTENT).data(new ContentData(content)).build();
  }

  /** Creates the completion event with the full answer. */
  public static StreamEventResponse complete(String fullResponse, List<SourceReference> sources) {
    return StreamEventResponse.builder()
        .eventType(COMPLETE)
        .data(new CompleteData(fullResponse, sources))
        .build();
  }

  /** Creates an error event. */
  public static StreamEventResponse error(String errorId, String message) {
    return StreamEventResponse.builder()
        .eventType(ERROR)
        .data(new ErrorData(errorId, message))
        .build();
  }

  /** Metadata event data. */
  @Data
  @AllArgsConstructor
  public static class MetadataData {
    private UUID sessionId;
    private Instant timestamp;
  }

  /** Sources event data. */
  @Data
  @AllArgsConstructor
  public static class SourcesData {
    private List<SourceReference> sources;
  }

  /** Content event data. */
  @Data
  @AllArgsConstructor
  public static class ContentData {
    private String content;
  }

  /** Complete event data. */
  @Data
  @AllArgsConstructor
  public static class CompleteData {
    private String fullResponse;
    private List<SourceReference> sources;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String message;
  }
}
