package com.flamingo.ai.newsrag.service.chat;

import com.flamingo.ai.newsrag.api.dto.response.StreamEventResponse;
import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.conversation.ConversationStore;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.domain.SourceReference;
import com.flamingo.ai.newsrag.exception.InvalidRequestException;
import com.flamingo.ai.newsrag.exception.LlmServiceException;
import com.flamingo.ai.newsrag.exception.VectorIndexException;
import com.flamingo.ai.newsrag.service.embedding.EmbeddingService;
import com.flamingo.ai.newsrag.service.llm.NewsLlmService;
import com.flamingo.ai.newsrag.service.session.SessionService;
import com.flamingo.ai.newsrag.vectorindex.ScoredPoint;
import com.flamingo.ai.newsrag.vectorindex.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Retrieval-augmented chat over the news index.
 *
 * <p>Per message: resolve the session and read recent history, ask the model whether the question
 * is news-related, and only then expand the query, embed it and search the vector index. An empty
 * search falls back to a context-free answer. The user and assistant messages are recorded after
 * the answer is produced; recording failures are logged and never fail the answer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  static final int MAX_MESSAGE_LENGTH = 10_000;
  static final String UNTITLED = "Untitled";
  static final String GENERIC_ERROR = "Failed to process message";

  private final SessionService sessionService;
  private final ConversationStore conversationStore;
  private final NewsLlmService llmService;
  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  @Timed(value = "chat.message", description = "Time to answer a chat message")
  public ChatResult sendMessage(UUID sessionId, String message) {
    String query = validate(sessionId, message);
    Instant receivedAt = clock.instant();
    log.info("Processing chat message for session {} ({} chars)", sessionId, query.length());

    List<ConversationMessage> history = prepareSession(sessionId);
    List<ScoredPoint> retrieved = retrieve(query);
    String answer = llmService.generateAnswer(query, retrieved, history);
    List<SourceReference> sources = toSources(retrieved);

    record(sessionId, query, receivedAt, answer, sources);
    meterRegistry.counter("chat.messages", "mode", "buffered").increment();
    return new ChatResult(sessionId, answer, sources, clock.instant());
  }

  @Override
  public Flux<StreamEventResponse> streamMessage(UUID sessionId, String message) {
    String query = validate(sessionId, message);
    Instant receivedAt = clock.instant();
    log.info("Processing streaming chat message for session {}", sessionId);

    StringBuffer answer = new StringBuffer();
    AtomicBoolean recorded = new AtomicBoolean(false);
    AtomicReference<List<SourceReference>> recordedSources = new AtomicReference<>(List.of());

    Runnable recordOnce =
        () -> {
          if (recorded.compareAndSet(false, true)) {
            record(sessionId, query, receivedAt, answer.toString(), recordedSources.get());
          }
        };

    Flux<StreamEventResponse> body =
        Mono.fromCallable(() -> prepareAnswer(sessionId, query))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMapMany(
                prepared -> {
                  List<SourceReference> sources = toSources(prepared.retrieved());
                  recordedSources.set(sources);
                  Flux<StreamEventResponse> sourcesEvent =
                      sources.isEmpty()
                          ? Flux.empty()
                          : Flux.just(StreamEventResponse.sources(sources));
                  Flux<StreamEventResponse> content =
                      llmService
                          .streamAnswer(query, prepared.retrieved(), prepared.history())
                          .doOnNext(answer::append)
                          .map(StreamEventResponse::content);
                  Mono<StreamEventResponse> complete =
                      Mono.fromSupplier(
                          () -> StreamEventResponse.complete(answer.toString(), sources));
                  return Flux.concat(sourcesEvent, content, complete)
                      .doOnComplete(recordOnce);
                });

    Duration streamTimeout = ragConfig.getGeneration().getStreamTimeout();
    // one shared timer for every item, so the limit caps the whole stream
    Mono<Long> deadline = Mono.delay(streamTimeout).cache();

    return Flux.concat(Flux.just(StreamEventResponse.metadata(sessionId, receivedAt)), body)
        .timeout(deadline, event -> deadline)
        .onErrorResume(e -> Flux.just(toErrorEvent(sessionId, e)))
        .doOnCancel(
            () -> {
              log.info(
                  "Stream cancelled for session {} after {} chars", sessionId, answer.length());
              meterRegistry.counter("chat.stream.cancelled").increment();
              if (answer.length() > 0) {
                recordOnce.run();
              }
            })
        .doOnComplete(() -> meterRegistry.counter("chat.messages", "mode", "streamed").increment());
  }

  private PreparedAnswer prepareAnswer(UUID sessionId, String query) {
    List<ConversationMessage> history = prepareSession(sessionId);
    return new PreparedAnswer(history, retrieve(query));
  }

  /** Resolves or creates the session and reads recent history before the new turn. */
  private List<ConversationMessage> prepareSession(UUID sessionId) {
    sessionService.getOrCreateSession(sessionId);
    return conversationStore.getMessages(
        sessionId, ragConfig.getGeneration().getHistoryWindow());
  }

  /** Classifies the query and, when news-related, searches the index. Empty means no context. */
  List<ScoredPoint> retrieve(String query) {
    if (!llmService.isNewsRelated(query)) {
      log.info("Query is not news-related, answering without retrieval");
      meterRegistry.counter("chat.retrieval.skipped").increment();
      return List.of();
    }

    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    String searchQuery =
        retrieval.isQueryExpansionEnabled() ? llmService.expandQuery(query) : query;
    List<Float> queryVector = embeddingService.embedQuery(searchQuery);
    List<ScoredPoint> results =
        vectorIndex.search(
            queryVector, retrieval.getTopK(), ragConfig.getVectorIndex().getScoreThreshold());

    log.info(
        "Retrieval completed: documentsFound={}, averageScore={}",
        results.size(),
        results.stream().mapToDouble(ScoredPoint::score).average().orElse(0));
    if (results.isEmpty()) {
      meterRegistry.counter("chat.retrieval.empty").increment();
    }
    return results;
  }

  private void record(
      UUID sessionId,
      String query,
      Instant receivedAt,
      String answer,
      List<SourceReference> sources) {
    try {
      conversationStore.appendMessage(sessionId, ConversationMessage.user(query, receivedAt));
      conversationStore.appendMessage(
          sessionId, ConversationMessage.assistant(answer, sources, clock.instant()));
    } catch (RuntimeException e) {
      log.warn("Failed to record exchange for session {}: {}", sessionId, e.getMessage());
      meterRegistry.counter("chat.history.append.failures").increment();
    }
  }

  private StreamEventResponse toErrorEvent(UUID sessionId, Throwable e) {
    String errorId = UUID.randomUUID().toString().substring(0, 8);
    log.error("[{}] Chat stream failed for session {}: {}", errorId, sessionId, e.getMessage(), e);
    meterRegistry
        .counter("chat.errors", "error_type", e.getClass().getSimpleName())
        .increment();
    return StreamEventResponse.error(errorId, userMessage(e));
  }

  private String userMessage(Throwable e) {
    if (ragConfig.getErrors().isIncludeDetails()) {
      return e.getMessage();
    }
    if (e instanceof LlmServiceException llmException) {
      return llmException.getUserMessage();
    }
    if (e instanceof VectorIndexException indexException) {
      return indexException.getUserMessage();
    }
    return GENERIC_ERROR;
  }

  static List<SourceReference> toSources(List<ScoredPoint> points) {
    return points.stream()
        .map(
            point ->
                new SourceReference(
                    point.payload().title() != null && !point.payload().title().isBlank()
                        ? point.payload().title()
                        : UNTITLED,
                    point.payload().link(),
                    point.score()))
        .toList();
  }

  private static String validate(UUID sessionId, String message) {
    if (sessionId == null) {
      throw new InvalidRequestException("Session ID is required");
    }
    if (message == null || message.isBlank()) {
      throw new InvalidRequestException("Message is required and must be a non-empty string");
    }
    String trimmed = message.trim();
    if (trimmed.length() > MAX_MESSAGE_LENGTH) {
      throw new InvalidRequestException(
          "Message must not exceed " + MAX_MESSAGE_LENGTH + " characters");
    }
    return trimmed;
  }

  private record PreparedAnswer(List<ConversationMessage> history, List<ScoredPoint> retrieved) {}
}
