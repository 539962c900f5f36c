package com.flamingo.ai.newsrag.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.exception.EmbeddingException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("JinaEmbeddingClient Tests")
class JinaEmbeddingClientTest {

  private RagConfig ragConfig;
  private AtomicReference<ClientRequest> lastRequest;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getEmbedding().setApiKey("test-key");
    ragConfig.getEmbedding().setBaseUrl("https://embeddings.example.com/v1");
    lastRequest = new AtomicReference<>();
  }

  private JinaEmbeddingClient clientReturning(HttpStatus status, String body) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  lastRequest.set(request);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                          .body(body)
                          .build());
                });
    return new JinaEmbeddingClient(ragConfig, builder);
  }

  private static EmbeddingException.Kind kindOf(Throwable t) {
    return ((EmbeddingException) t).getKind();
  }

  @Test
  @DisplayName("Should return one vector per input in order")
  void shouldReturnVectors_whenProviderResponds() {
    // Given
    JinaEmbeddingClient client =
        clientReturning(
            HttpStatus.OK,
            """
            {"model":"jina-embeddings-v2-base-en",
             "usage":{"total_tokens":12},
             "data":[{"index":0,"embedding":[0.1,0.2]},{"index":1,"embedding":[0.3,0.4]}]}
            """);

    // When
    List<List<Float>> vectors = client.embed(List.of("first", "second"));

    // Then
    assertThat(vectors).containsExactly(List.of(0.1f, 0.2f), List.of(0.3f, 0.4f));
    ClientRequest request = lastRequest.get();
    assertThat(request.url().toString()).isEqualTo("https://embeddings.example.com/v1/embeddings");
    assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer test-key");
  }

  @Test
  @DisplayName("Should classify 401 as an authentication failure")
  void shouldThrowAuthentication_whenUnauthorized() {
    JinaEmbeddingClient client =
        clientReturning(HttpStatus.UNAUTHORIZED, "{\"detail\":\"invalid key\"}");

    assertThatThrownBy(() -> client.embed(List.of("text")))
        .isInstanceOf(EmbeddingException.class)
        .satisfies(e -> assertThat(kindOf(e)).isEqualTo(EmbeddingException.Kind.AUTHENTICATION))
        .satisfies(e -> assertThat(e.getMessage()).contains("JINA_API_KEY"));
  }

  @Test
  @DisplayName("Should classify 422 as validation and keep the response body")
  void shouldThrowValidation_whenUnprocessable() {
    JinaEmbeddingClient client =
        clientReturning(HttpStatus.UNPROCESSABLE_ENTITY, "{\"detail\":\"input too long\"}");

    assertThatThrownBy(() -> client.embed(List.of("text")))
        .isInstanceOf(EmbeddingException.class)
        .satisfies(
            e -> {
              assertThat(kindOf(e)).isEqualTo(EmbeddingException.Kind.VALIDATION);
              assertThat(((EmbeddingException) e).getStatusCode()).isEqualTo(422);
              assertThat(((EmbeddingException) e).getResponseBody()).contains("input too long");
            });
  }

  @Test
  @DisplayName("Should classify 429 as rate limiting and 5xx as provider failure")
  void shouldClassifyRetryableStatuses() {
    JinaEmbeddingClient limited = clientReturning(HttpStatus.TOO_MANY_REQUESTS, "{}");
    JinaEmbeddingClient failing = clientReturning(HttpStatus.BAD_GATEWAY, "{}");

    assertThatThrownBy(() -> limited.embed(List.of("t")))
        .satisfies(e -> assertThat(kindOf(e)).isEqualTo(EmbeddingException.Kind.RATE_LIMIT));
    assertThatThrownBy(() -> failing.embed(List.of("t")))
        .satisfies(e -> assertThat(kindOf(e)).isEqualTo(EmbeddingException.Kind.PROVIDER));
  }

  @Test
  @DisplayName("Should reject a response with the wrong number of vectors")
  void shouldThrowProvider_whenVectorCountMismatches() {
    JinaEmbeddingClient client =
        clientReturning(HttpStatus.OK, "{\"data\":[{\"embedding\":[0.1]}]}");

    assertThatThrownBy(() -> client.embed(List.of("a", "b")))
        .isInstanceOf(EmbeddingException.class)
        .satisfies(e -> assertThat(kindOf(e)).isEqualTo(EmbeddingException.Kind.PROVIDER));
  }

  @Test
  @DisplayName("Should reject a response without data")
  void shouldThrowProvider_whenDataMissing() {
    JinaEmbeddingClient client = clientReturning(HttpStatus.OK, "{\"model\":\"m\"}");

    assertThatThrownBy(() -> client.embed(List.of("a")))
        .isInstanceOf(EmbeddingException.class)
        .hasMessageContaining("Invalid response format");
  }
}
