package com.flamingo.ai.newsrag.api.dto.response;

import com.flamingo.ai.newsrag.service.ingestion.IngestionReport;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO summarising an ingestion pass. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

  private int articlesSeen;
  private int articlesSkipped;
  private int chunksProduced;
  private int pointsStored;
  private int failedChunks;
  private Instant timestamp;

  public static IngestionResponse fromReport(IngestionReport report, Instant timestamp) {
    return IngestionResponse.builder()
        .articlesSeen(report.articlesSeen())
        .articlesSkipped(report.articlesSkipped())
        .chunksProduced(report.chunksProduced())
        .pointsStored(report.pointsStored())
        .failedChunks(report.failedChunks())
        .timestamp(timestamp)
        .build();
  }
}
