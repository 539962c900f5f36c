package com.flamingo.ai.newsrag.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the news RAG pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private VectorIndex vectorIndex = new VectorIndex();
  private Retrieval retrieval = new Retrieval();
  private Generation generation = new Generation();
  private Conversation conversation = new Conversation();
  private Ingestion ingestion = new Ingestion();
  private Errors errors = new Errors();

  @Getter
  @Setter
  public static class Chunking {
    /** Cleaned texts shorter than this produce no chunks. */
    private int minLength = 10;

    /** Target upper bound when packing sentences into a chunk. */
    private int softLimit = 7500;

    /** Hard upper bound; longer chunks are dropped. */
    private int maxLength = 8000;
  }

  @Getter
  @Setter
  public static class Embedding {
    private String baseUrl = "https://api.jina.ai/v1";
    private String apiKey = "";
    private String model = "jina-embeddings-v2-base-en";
    private int dimensions = 768;

    /** Provider-side input limit in characters (after trimming). */
    private int maxInputLength = 8192;

    private int batchSize = 5;
    private Duration batchDelay = Duration.ofSeconds(2);

    /** Pause between items when a failed batch is retried one text at a time. */
    private Duration itemDelay = Duration.ofSeconds(1);

    private Duration requestTimeout = Duration.ofSeconds(60);
    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
      private int maxAttempts = 3;

      /** Paid before every attempt, including the first, to stay under provider rate limits. */
      private Duration baseDelay = Duration.ofSeconds(1);

      /** Attempt n (n &gt; 1) additionally waits 2^(n-1) times this unit. */
      private Duration backoffUnit = Duration.ofSeconds(1);
    }
  }

  @Getter
  @Setter
  public static class VectorIndex {
    private String collection = "news_embeddings";
    private double scoreThreshold = 0.7;

    /** Article content stored in a point payload is truncated to this many characters. */
    private int payloadContentLimit = 1000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private boolean queryExpansionEnabled = true;
  }

  @Getter
  @Setter
  public static class Generation {
    private double temperature = 0.7;
    private double topP = 0.95;
    private int maxOutputTokens = 1024;
    private Duration timeout = Duration.ofSeconds(60);
    private Duration streamTimeout = Duration.ofSeconds(120);

    /** Number of prior messages included as conversation context. */
    private int historyWindow = 10;
  }

  @Getter
  @Setter
  public static class Conversation {
    /** Backing store: "redis" (default) or "memory". */
    private String store = "redis";

    private Duration sessionTtl = Duration.ofHours(24);
    private Duration historyTtl = Duration.ofHours(1);
    private int defaultHistoryLimit = 50;

    /** Older messages beyond this many are trimmed from a session's list on append. */
    private int maxStoredMessages = 500;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private List<String> feeds =
        new ArrayList<>(
            List.of(
                "http://feeds.bbci.co.uk/news/rss.xml",
                "https://feeds.npr.org/1004/rss.xml",
                "https://www.theguardian.com/world/rss"));

    private int maxArticles = 50;
    private boolean runOnStartup = false;
    private String sourceLabel = "news_ingestion";
    private Duration fetchTimeout = Duration.ofSeconds(15);
  }

  @Getter
  @Setter
  public static class Errors {
    /** Echo internal exception messages to callers. Keep false in production. */
    private boolean includeDetails = false;
  }
}
