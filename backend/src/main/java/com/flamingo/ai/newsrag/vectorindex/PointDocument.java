package com.flamingo.ai.newsrag.vectorindex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Article chunk as stored in the news index: payload fields plus the embedding. Search responses
 * leave {@code vector} out of {@code _source}, so it is null on read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PointDocument {

  private String title;
  private String link;
  private String content;
  private String source;
  private String timestamp;
  private List<Float> vector;

  static PointDocument from(VectorPoint point) {
    PointPayload payload = point.payload();
    return PointDocument.builder()
        .title(payload.title())
        .link(payload.link())
        .content(payload.content())
        .source(payload.source())
        .timestamp(payload.timestamp())
        .vector(point.vector())
        .build();
  }

  PointPayload toPayload() {
    return new PointPayload(title, link, content, source, timestamp);
  }
}
