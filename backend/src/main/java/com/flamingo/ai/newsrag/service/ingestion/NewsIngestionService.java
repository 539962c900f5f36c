package com.flamingo.ai.newsrag.service.ingestion;

import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.domain.Article;
import com.flamingo.ai.newsrag.domain.Chunk;
import com.flamingo.ai.newsrag.service.chunking.TextChunker;
import com.flamingo.ai.newsrag.service.embedding.EmbeddingService;
import com.flamingo.ai.newsrag.vectorindex.PointIdGenerator;
import com.flamingo.ai.newsrag.vectorindex.PointPayload;
import com.flamingo.ai.newsrag.vectorindex.VectorIndex;
import com.flamingo.ai.newsrag.vectorindex.VectorPoint;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Builds the news vector collection: chunk articles, embed the chunks in paced batches and upsert
 * the resulting points. Passes never overlap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NewsIngestionService {

  private final ArticleSource articleSource;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final PointIdGenerator pointIdGenerator;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final ReentrantLock passLock = new ReentrantLock();

  /** Fetches articles from the article source and ingests them. */
  public IngestionReport run() {
    List<Article> articles = articleSource.fetchArticles();
    if (articles.isEmpty()) {
      log.warn("No articles found, skipping ingestion");
      return IngestionReport.empty();
    }
    return ingest(articles);
  }

  /** Runs {@link #run()} on the ingestion executor. */
  @Async("ingestionExecutor")
  public void runAsync() {
    try {
      run();
    } catch (RuntimeException e) {
      log.error("Background ingestion failed: {}", e.getMessage(), e);
      meterRegistry.counter("ingestion.failures").increment();
    }
  }

  @Timed(value = "ingestion.pass", description = "Time for one ingestion pass")
  public IngestionReport ingest(List<Article> articles) {
    passLock.lock();
    try {
      return doIngest(articles);
    } finally {
      passLock.unlock();
    }
  }

  private IngestionReport doIngest(List<Article> articles) {
    log.info("=== Starting ingestion of {} articles ===", articles.size());
    vectorIndex.ensureCollection(
        vectorIndex.getCollectionName(), ragConfig.getEmbedding().getDimensions());

    int skipped = 0;
    List<Chunk> chunks = new ArrayList<>();
    Map<String, Article> byLink = new HashMap<>();
    for (Article article : articles) {
      if (!article.hasContent()) {
        skipped++;
        continue;
      }
      byLink.putIfAbsent(article.link(), article);
      chunks.addAll(textChunker.chunk(article));
    }
    log.info(
        "Chunked {} articles into {} chunks ({} skipped)",
        articles.size() - skipped,
        chunks.size(),
        skipped);

    if (chunks.isEmpty()) {
      return new IngestionReport(articles.size(), skipped, 0, 0, 0);
    }

    List<List<Float>> vectors =
        embeddingService.embedBatch(chunks.stream().map(Chunk::text).toList());

    String timestamp = clock.instant().toString();
    int contentLimit = ragConfig.getVectorIndex().getPayloadContentLimit();
    String sourceLabel = ragConfig.getIngestion().getSourceLabel();
    List<VectorPoint> points = new ArrayList<>();
    int failed = 0;
    for (int i = 0; i < chunks.size(); i++) {
      List<Float> vector = vectors.get(i);
      if (vector == null) {
        failed++;
        continue;
      }
      Chunk chunk = chunks.get(i);
      Article article = byLink.get(chunk.sourceArticleLink());
      String title = article != null && article.title() != null ? article.title() : "Untitled";
      String content =
          chunk.text().length() > contentLimit
              ? chunk.text().substring(0, contentLimit)
              : chunk.text();
      points.add(
          new VectorPoint(
              pointIdGenerator.nextId(),
              vector,
              new PointPayload(
                  title,
                  chunk.sourceArticleLink() != null ? chunk.sourceArticleLink() : "",
                  content,
                  sourceLabel,
                  timestamp)));
    }

    vectorIndex.upsert(points);

    IngestionReport report =
        new IngestionReport(articles.size(), skipped, chunks.size(), points.size(), failed);
    meterRegistry.counter("ingestion.points.stored").increment(points.size());
    meterRegistry.counter("ingestion.chunks.failed").increment(failed);
    log.info("=== Ingestion finished: {} ===", report);
    return report;
  }
}
