package com.flamingo.ai.newsrag.service.embedding;

import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.exception.EmbeddingException;
import com.flamingo.ai.newsrag.service.chunking.TextChunker;
import com.flamingo.ai.newsrag.service.resilience.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Generates embeddings through the configured {@link EmbeddingProvider}.
 *
 * <p>Inputs are validated and cleaned before they are sent. Every provider call goes through the
 * embedding {@link RetryPolicy}. Batches are processed strictly one after another.
 */
@Service
@Slf4j
public class EmbeddingService {

  private static final int PREPARED_MAX_LENGTH = 8000;
  private static final int SENTENCE_CUT_THRESHOLD = 7000;

  private final EmbeddingProvider provider;
  private final TextChunker textChunker;
  private final RetryPolicy retryPolicy;
  private final RagConfig.Embedding config;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      EmbeddingProvider provider,
      TextChunker textChunker,
      @Qualifier("embeddingRetryPolicy") RetryPolicy retryPolicy,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.provider = provider;
    this.textChunker = textChunker;
    this.retryPolicy = retryPolicy;
    this.config = ragConfig.getEmbedding();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds the valid texts among {@code texts}, one vector per valid text, in input order.
   *
   * @throws EmbeddingException of kind VALIDATION when no text is valid, or the provider failure
   */
  public List<List<Float>> embed(List<String> texts) {
    if (texts == null || texts.isEmpty()) {
      throw new EmbeddingException(
          EmbeddingException.Kind.VALIDATION, "No valid texts provided for embedding");
    }
    List<String> valid = texts.stream().filter(this::isValidInput).toList();
    if (valid.size() != texts.size()) {
      log.warn(
          "Dropped {} invalid texts before embedding ({} of {} remain)",
          texts.size() - valid.size(),
          valid.size(),
          texts.size());
    }
    if (valid.isEmpty()) {
      throw new EmbeddingException(
          EmbeddingException.Kind.VALIDATION, "No valid texts provided for embedding");
    }
    return embedWithRetry(valid.stream().map(this::prepare).toList());
  }

  /** Embeds a single query text. */
  public List<Float> embedQuery(String query) {
    return embed(List.of(query)).get(0);
  }

  /**
   * Sends the inputs to the provider under the retry policy. Authentication failures abort on the
   * first attempt; a validation failure that survives the last attempt is logged with the request
   * and the provider response before it propagates.
   */
  public List<List<Float>> embedWithRetry(List<String> inputs) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<List<Float>> vectors = retryPolicy.execute(() -> provider.embed(inputs));
      meterRegistry.counter("embedding.requests.success").increment();
      return vectors;
    } catch (EmbeddingException e) {
      meterRegistry
          .counter("embedding.requests.failure", "kind", e.getKind().name().toLowerCase())
          .increment();
      if (e.getKind() == EmbeddingException.Kind.VALIDATION) {
        logValidationDiagnostics(inputs, e);
      }
      throw e;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /** Batches with the configured size and inter-batch delay. */
  public List<List<Float>> embedBatch(List<String> texts) {
    return embedBatch(texts, config.getBatchSize(), config.getBatchDelay());
  }

  /**
   * Embeds texts in sequential batches of {@code batchSize}, pausing {@code delay} between batches.
   *
   * <p>A failed batch is retried one item at a time. Items that are invalid, or that still fail on
   * their own, yield {@code null} at their position, so the result always has the input's length.
   * Authentication failures are not isolated and propagate.
   */
  public List<List<Float>> embedBatch(List<String> texts, int batchSize, Duration delay) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1");
    }
    List<List<Float>> results = new ArrayList<>(texts.size());
    int failed = 0;

    for (int start = 0; start < texts.size(); start += batchSize) {
      if (start > 0) {
        pause(delay);
      }
      int end = Math.min(start + batchSize, texts.size());
      List<List<Float>> batchResults = embedSingleBatch(texts.subList(start, end), start);
      for (List<Float> vector : batchResults) {
        if (vector == null) {
          failed++;
        }
      }
      results.addAll(batchResults);
    }

    if (failed > 0) {
      meterRegistry.counter("embedding.batch.failed_items").increment(failed);
      log.warn("Batch embedding finished with {} of {} items failed", failed, texts.size());
    } else {
      log.info("Batch embedding finished for {} items", texts.size());
    }
    return results;
  }

  private List<List<Float>> embedSingleBatch(List<String> batch, int offset) {
    List<List<Float>> results = new ArrayList<>(batch.size());
    List<Integer> validPositions = new ArrayList<>();
    List<String> prepared = new ArrayList<>();
    for (int i = 0; i < batch.size(); i++) {
      results.add(null);
      String text = batch.get(i);
      if (isValidInput(text)) {
        validPositions.add(i);
        prepared.add(prepare(text));
      } else {
        log.warn(
            "Skipping invalid text at index {} (length {})",
            offset + i,
            text == null ? 0 : text.trim().length());
      }
    }
    if (prepared.isEmpty()) {
      return results;
    }

    try {
      List<List<Float>> vectors = embedWithRetry(prepared);
      for (int i = 0; i < validPositions.size(); i++) {
        results.set(validPositions.get(i), vectors.get(i));
      }
      return results;
    } catch (EmbeddingException e) {
      if (e.getKind() == EmbeddingException.Kind.AUTHENTICATION) {
        throw e;
      }
      log.warn(
          "Batch at offset {} failed ({}), retrying {} items individually",
          offset,
          e.getMessage(),
          prepared.size());
    }

    for (int i = 0; i < validPositions.size(); i++) {
      if (i > 0) {
        pause(config.getItemDelay());
      }
      int position = validPositions.get(i);
      try {
        results.set(position, embedWithRetry(List.of(prepared.get(i))).get(0));
      } catch (EmbeddingException e) {
        if (e.getKind() == EmbeddingException.Kind.AUTHENTICATION) {
          throw e;
        }
        log.error("Failed to embed item at index {}: {}", offset + position, e.getMessage());
      }
    }
    return results;
  }

  /**
   * Cosine similarity of two vectors of equal dimension.
   *
   * @return a value in [-1, 1], or 0 when either vector has zero magnitude
   * @throws IllegalArgumentException when the dimensions differ
   */
  public static double cosineSimilarity(List<Float> a, List<Float> b) {
    if (a.size() != b.size()) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.size() + " vs " + b.size());
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    return Math.max(-1.0, Math.min(1.0, similarity));
  }

  boolean isValidInput(String text) {
    if (text == null) {
      return false;
    }
    int length = text.trim().length();
    return length > 0 && length <= config.getMaxInputLength();
  }

  /** Cleans text and trims it to a provider-safe length, preferring a sentence boundary. */
  String prepare(String text) {
    String cleaned = textChunker.clean(text);
    if (cleaned.length() <= PREPARED_MAX_LENGTH) {
      return cleaned;
    }
    String truncated = cleaned.substring(0, PREPARED_MAX_LENGTH);
    int lastSentenceEnd =
        Math.max(
            truncated.lastIndexOf(". "),
            Math.max(truncated.lastIndexOf("! "), truncated.lastIndexOf("? ")));
    if (lastSentenceEnd > SENTENCE_CUT_THRESHOLD) {
      return truncated.substring(0, lastSentenceEnd + 1);
    }
    return truncated;
  }

  private void logValidationDiagnostics(List<String> inputs, EmbeddingException e) {
    int[] lengths = inputs.stream().mapToInt(String::length).toArray();
    String preview = inputs.isEmpty() ? "" : inputs.get(0);
    if (preview.length() > 200) {
      preview = preview.substring(0, 200) + "...";
    }
    log.error(
        "Embedding validation failed after {} attempts: status={}, inputs={}, lengths={},"
            + " firstInput=\"{}\", response={}",
        retryPolicy.getMaxAttempts(),
        e.getStatusCode(),
        inputs.size(),
        Arrays.toString(lengths),
        preview,
        e.getResponseBody());
  }

  private void pause(Duration duration) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingException(
          EmbeddingException.Kind.PROVIDER, "Interrupted while pacing embedding requests", e);
    }
  }
}
