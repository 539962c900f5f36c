package com.flamingo.ai.newsrag.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.newsrag.api.dto.response.StreamEventResponse;
import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.conversation.ConversationStore;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.domain.MessageRole;
import com.flamingo.ai.newsrag.domain.SourceReference;
import com.flamingo.ai.newsrag.exception.ConversationStoreException;
import com.flamingo.ai.newsrag.exception.InvalidRequestException;
import com.flamingo.ai.newsrag.exception.LlmServiceException;
import com.flamingo.ai.newsrag.service.embedding.EmbeddingService;
import com.flamingo.ai.newsrag.service.llm.NewsLlmService;
import com.flamingo.ai.newsrag.service.session.SessionService;
import com.flamingo.ai.newsrag.vectorindex.PointPayload;
import com.flamingo.ai.newsrag.vectorindex.ScoredPoint;
import com.flamingo.ai.newsrag.vectorindex.VectorIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ChatServiceImpl Tests")
class ChatServiceImplTest {

  private static final Instant NOW = Instant.parse("2024-11-05T10:00:00Z");
  private static final List<Float> QUERY_VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private SessionService sessionService;

  @Mock private ConversationStore conversationStore;

  @Mock private NewsLlmService llmService;

  @Mock private EmbeddingService embeddingService;

  @Mock private VectorIndex vectorIndex;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private ChatServiceImpl chatService;
  private UUID sessionId;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    chatService =
        new ChatServiceImpl(
            sessionService,
            conversationStore,
            llmService,
            embeddingService,
            vectorIndex,
            ragConfig,
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));
    sessionId = UUID.randomUUID();
    when(conversationStore.getMessages(eq(sessionId), anyInt())).thenReturn(List.of());
  }

  private static ScoredPoint point(long id, double score, String title) {
    return new ScoredPoint(
        id,
        score,
        new PointPayload(
            title,
            "https://news.example.com/" + id,
            title + " body",
            "news_ingestion",
            NOW.toString()));
  }

  private void givenNewsQuery(String query, List<ScoredPoint> hits) {
    when(llmService.isNewsRelated(query)).thenReturn(true);
    when(llmService.expandQuery(query)).thenReturn(query + " keywords");
    when(embeddingService.embedQuery(query + " keywords")).thenReturn(QUERY_VECTOR);
    when(vectorIndex.search(QUERY_VECTOR, 5, 0.7)).thenReturn(hits);
  }

  @Nested
  @DisplayName("Buffered messages")
  class BufferedMessages {

    @Test
    @DisplayName("Should cite only the retrieved election articles")
    void shouldReturnElectionSources_whenAskingAboutElection() {
      // Given
      String query = "Who won the election?";
      List<ScoredPoint> hits =
          List.of(point(1, 0.91, "Election results"), point(2, 0.84, "Record turnout"));
      givenNewsQuery(query, hits);
      when(llmService.generateAnswer(eq(query), eq(hits), anyList()))
          .thenReturn("Candidate A won.");

      // When
      ChatResult result = chatService.sendMessage(sessionId, "  " + query + "  ");

      // Then
      assertThat(result.message()).isEqualTo("Candidate A won.");
      assertThat(result.sources())
          .containsExactly(
              new SourceReference("Election results", "https://news.example.com/1", 0.91),
              new SourceReference("Record turnout", "https://news.example.com/2", 0.84));
      assertThat(result.sessionId()).isEqualTo(sessionId);
      verify(sessionService).getOrCreateSession(sessionId);
    }

    @Test
    @DisplayName("Should answer without retrieval when the question is not news")
    void shouldSkipRetrieval_whenQueryNotNewsRelated() {
      // Given
      when(llmService.isNewsRelated("What is 2+2?")).thenReturn(false);
      when(llmService.generateAnswer(eq("What is 2+2?"), eq(List.of()), anyList()))
          .thenReturn("4");

      // When
      ChatResult result = chatService.sendMessage(sessionId, "What is 2+2?");

      // Then
      assertThat(result.message()).isEqualTo("4");
      assertThat(result.sources()).isEmpty();
      verify(llmService, never()).expandQuery(anyString());
      verify(embeddingService, never()).embedQuery(anyString());
      verify(vectorIndex, never()).search(anyList(), anyInt(), anyDouble());
      assertThat(meterRegistry.counter("chat.retrieval.skipped").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fall back to a context-free answer when nothing clears the threshold")
    void shouldAnswerWithoutContext_whenRetrievalEmpty() {
      // Given
      givenNewsQuery("Latest on the strike?", List.of());
      when(llmService.generateAnswer(eq("Latest on the strike?"), eq(List.of()), anyList()))
          .thenReturn("I have no recent articles on that.");

      // When
      ChatResult result = chatService.sendMessage(sessionId, "Latest on the strike?");

      // Then
      assertThat(result.sources()).isEmpty();
      assertThat(meterRegistry.counter("chat.retrieval.empty").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should embed the raw query when expansion is disabled")
    void shouldEmbedRawQuery_whenExpansionDisabled() {
      ragConfig.getRetrieval().setQueryExpansionEnabled(false);
      when(llmService.isNewsRelated("markets")).thenReturn(true);
      when(embeddingService.embedQuery("markets")).thenReturn(QUERY_VECTOR);
      when(vectorIndex.search(QUERY_VECTOR, 5, 0.7)).thenReturn(List.of());

      chatService.retrieve("markets");

      verify(llmService, never()).expandQuery(anyString());
      verify(embeddingService).embedQuery("markets");
    }

    @Test
    @DisplayName("Should record the user turn then the assistant turn with sources")
    void shouldRecordBothMessages_whenAnswered() {
      // Given
      List<ScoredPoint> hits = List.of(point(1, 0.9, "  "));
      givenNewsQuery("Any news?", hits);
      when(llmService.generateAnswer(anyString(), anyList(), anyList())).thenReturn("Yes.");

      // When
      chatService.sendMessage(sessionId, "Any news?");

      // Then
      ArgumentCaptor<ConversationMessage> captor =
          ArgumentCaptor.forClass(ConversationMessage.class);
      verify(conversationStore, times(2)).appendMessage(eq(sessionId), captor.capture());
      ConversationMessage user = captor.getAllValues().get(0);
      ConversationMessage assistant = captor.getAllValues().get(1);
      assertThat(user.getRole()).isEqualTo(MessageRole.USER);
      assertThat(user.getContent()).isEqualTo("Any news?");
      assertThat(assistant.getRole()).isEqualTo(MessageRole.ASSISTANT);
      assertThat(assistant.getSources())
          .extracting(SourceReference::title)
          .containsExactly("Untitled");
    }

    @Test
    @DisplayName("Should still answer when recording history fails")
    void shouldReturnAnswer_whenHistoryAppendFails() {
      when(llmService.isNewsRelated(anyString())).thenReturn(false);
      when(llmService.generateAnswer(anyString(), anyList(), anyList())).thenReturn("Hello.");
      doThrow(new ConversationStoreException("redis down", new RuntimeException()))
          .when(conversationStore)
          .appendMessage(eq(sessionId), any(ConversationMessage.class));

      ChatResult result = chatService.sendMessage(sessionId, "Hi");

      assertThat(result.message()).isEqualTo("Hello.");
      assertThat(meterRegistry.counter("chat.history.append.failures").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject missing session id, blank and over-long messages")
    void shouldThrowInvalidRequest_whenInputInvalid() {
      assertThatThrownBy(() -> chatService.sendMessage(null, "hello"))
          .isInstanceOf(InvalidRequestException.class)
          .hasMessage("Session ID is required");
      assertThatThrownBy(() -> chatService.sendMessage(sessionId, "   "))
          .isInstanceOf(InvalidRequestException.class);
      assertThatThrownBy(() -> chatService.sendMessage(sessionId, "x".repeat(10_001)))
          .isInstanceOf(InvalidRequestException.class);
      verify(llmService, never()).isNewsRelated(anyString());
    }
  }

  @Nested
  @DisplayName("Streaming messages")
  class StreamingMessages {

    @Test
    @DisplayName("Should emit metadata, sources, content and complete in order")
    void shouldEmitEventsInOrder_whenStreaming() {
      // Given
      String query = "Who won the election?";
      List<ScoredPoint> hits = List.of(point(1, 0.91, "Election results"));
      givenNewsQuery(query, hits);
      when(llmService.streamAnswer(eq(query), eq(hits), anyList()))
          .thenReturn(Flux.just("Candidate ", "A won."));

      // When / Then
      StepVerifier.create(chatService.streamMessage(sessionId, query))
          .assertNext(event -> assertThat(event.getEventType()).isEqualTo("metadata"))
          .assertNext(
              event -> {
                assertThat(event.getEventType()).isEqualTo("sources");
                assertThat(((StreamEventResponse.SourcesData) event.getData()).getSources())
                    .hasSize(1);
              })
          .assertNext(
              event ->
                  assertThat(((StreamEventResponse.ContentData) event.getData()).getContent())
                      .isEqualTo("Candidate "))
          .assertNext(
              event ->
                  assertThat(((StreamEventResponse.ContentData) event.getData()).getContent())
                      .isEqualTo("A won."))
          .assertNext(
              event -> {
                assertThat(event.getEventType()).isEqualTo("complete");
                assertThat(((StreamEventResponse.CompleteData) event.getData()).getFullResponse())
                    .isEqualTo("Candidate A won.");
              })
          .verifyComplete();

      verify(conversationStore, times(2)).appendMessage(eq(sessionId), any());
    }

    @Test
    @DisplayName("Should omit the sources event when nothing was retrieved")
    void shouldSkipSourcesEvent_whenNoRetrieval() {
      when(llmService.isNewsRelated("Hi")).thenReturn(false);
      when(llmService.streamAnswer(eq("Hi"), eq(List.of()), anyList()))
          .thenReturn(Flux.just("Hello"));

      StepVerifier.create(
              chatService.streamMessage(sessionId, "Hi").map(StreamEventResponse::getEventType))
          .expectNext("metadata", "content", "complete")
          .verifyComplete();
    }

    @Test
    @DisplayName("Should end with an error event and record nothing when generation fails")
    void shouldEmitErrorEvent_whenGenerationFails() {
      // Given
      when(llmService.isNewsRelated("Hi")).thenReturn(false);
      when(llmService.streamAnswer(anyString(), anyList(), anyList()))
          .thenReturn(Flux.error(new LlmServiceException("upstream 500")));

      // When / Then
      StepVerifier.create(chatService.streamMessage(sessionId, "Hi"))
          .assertNext(event -> assertThat(event.getEventType()).isEqualTo("metadata"))
          .assertNext(
              event -> {
                assertThat(event.getEventType()).isEqualTo("error");
                StreamEventResponse.ErrorData data =
                    (StreamEventResponse.ErrorData) event.getData();
                assertThat(data.getErrorId()).hasSize(8);
                assertThat(data.getMessage()).contains("temporarily unavailable");
              })
          .verifyComplete();
      verify(conversationStore, never()).appendMessage(any(), any());
    }

    @Test
    @DisplayName("Should surface retrieval failures as an error event")
    void shouldEmitErrorEvent_whenClassificationFails() {
      when(llmService.isNewsRelated("Hi")).thenThrow(new IllegalStateException("boom"));

      StepVerifier.create(
              chatService.streamMessage(sessionId, "Hi").map(StreamEventResponse::getEventType))
          .expectNext("metadata", "error")
          .verifyComplete();
    }

    @Test
    @DisplayName("Should end with an error event when tokens keep arriving past the deadline")
    void shouldEmitErrorEvent_whenStreamExceedsTimeout() {
      // Given
      ragConfig.getGeneration().setStreamTimeout(Duration.ofSeconds(1));
      when(llmService.isNewsRelated("Hi")).thenReturn(false);
      when(llmService.streamAnswer(anyString(), anyList(), anyList()))
          .thenAnswer(
              invocation ->
                  Flux.interval(Duration.ofMillis(400)).take(6).map(tick -> "token" + tick));

      // When / Then
      StepVerifier.withVirtualTime(
              () ->
                  chatService
                      .streamMessage(sessionId, "Hi")
                      .map(StreamEventResponse::getEventType))
          .expectSubscription()
          .expectNext("metadata")
          .thenAwait(Duration.ofSeconds(1))
          .expectNext("content", "content", "error")
          .verifyComplete();
      verify(conversationStore, never()).appendMessage(any(), any());
      assertThat(meterRegistry.counter("chat.errors", "error_type", "TimeoutException").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record a partial answer once when the client cancels")
    void shouldRecordPartialAnswerOnce_whenCancelled() {
      // Given
      when(llmService.isNewsRelated("Tell me a story")).thenReturn(false);
      when(llmService.streamAnswer(anyString(), anyList(), anyList()))
          .thenReturn(Flux.concat(Flux.just("Once "), Flux.never()));

      // When
      StepVerifier.create(chatService.streamMessage(sessionId, "Tell me a story"))
          .assertNext(event -> assertThat(event.getEventType()).isEqualTo("metadata"))
          .assertNext(event -> assertThat(event.getEventType()).isEqualTo("content"))
          .thenCancel()
          .verify(Duration.ofSeconds(5));

      // Then
      ArgumentCaptor<ConversationMessage> captor =
          ArgumentCaptor.forClass(ConversationMessage.class);
      verify(conversationStore, times(2)).appendMessage(eq(sessionId), captor.capture());
      assertThat(captor.getAllValues().get(1).getContent()).isEqualTo("Once ");
      assertThat(meterRegistry.counter("chat.stream.cancelled").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject invalid input before streaming")
    void shouldThrowInvalidRequest_whenStreamingBlankMessage() {
      assertThatThrownBy(() -> chatService.streamMessage(sessionId, ""))
          .isInstanceOf(InvalidRequestException.class);
    }
  }
}
