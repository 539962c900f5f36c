package com.flamingo.ai.newsrag.service.ingestion;

/**
 * Outcome of one ingestion pass.
 *
 * @param articlesSeen articles handed to the pass
 * @param articlesSkipped articles without content
 * @param chunksProduced chunks cut from the remaining articles
 * @param pointsStored points written to the vector index
 * @param failedChunks chunks whose embedding failed permanently
 */
public record IngestionReport(
    int articlesSeen,
    int articlesSkipped,
    int chunksProduced,
    int pointsStored,
    int failedChunks) {

  static IngestionReport empty() {
    return new IngestionReport(0, 0, 0, 0, 0);
  }
}
