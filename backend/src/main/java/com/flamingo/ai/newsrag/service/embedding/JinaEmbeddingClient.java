package com.flamingo.ai.newsrag.service.embedding;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.exception.EmbeddingException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * HTTP client for the Jina AI embeddings endpoint ({@code POST /embeddings}). Encapsulates all
 * WebClient communication and maps HTTP failures onto {@link EmbeddingException.Kind}.
 */
@Component
@Slf4j
public class JinaEmbeddingClient implements EmbeddingProvider {

  private final WebClient webClient;
  private final String model;
  private final Duration timeout;

  public JinaEmbeddingClient(RagConfig ragConfig) {
    this(ragConfig, WebClient.builder());
  }

  JinaEmbeddingClient(RagConfig ragConfig, WebClient.Builder builder) {
    RagConfig.Embedding embedding = ragConfig.getEmbedding();
    this.model = embedding.getModel();
    this.timeout = embedding.getRequestTimeout();
    this.webClient =
        builder
            .baseUrl(embedding.getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + embedding.getApiKey())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
    log.info(
        "Jina embedding client initialized: baseUrl={}, model={}",
        embedding.getBaseUrl(),
        model);
  }

  @Override
  public List<List<Float>> embed(List<String> inputs) {
    EmbeddingRequest request = new EmbeddingRequest(model, inputs, "float");
    EmbeddingResponse response;
    try {
      response =
          webClient
              .post()
              .uri("/embeddings")
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(request)
              .retrieve()
              .bodyToMono(EmbeddingResponse.class)
              .timeout(timeout)
              .block();
    } catch (WebClientResponseException e) {
      throw translate(e);
    } catch (RuntimeException e) {
      throw new EmbeddingException(
          EmbeddingException.Kind.PROVIDER,
          "Failed to generate embeddings: " + e.getMessage(),
          e);
    }

    if (response == null || response.data() == null) {
      throw new EmbeddingException(
          EmbeddingException.Kind.PROVIDER, "Invalid response format from embedding provider");
    }
    if (response.data().size() != inputs.size()) {
      throw new EmbeddingException(
          EmbeddingException.Kind.PROVIDER,
          "Embedding provider returned "
              + response.data().size()
              + " vectors for "
              + inputs.size()
              + " inputs");
    }

    List<List<Float>> vectors =
        response.data().stream()
            .map(
                item -> {
                  if (item.embedding() == null) {
                    throw new EmbeddingException(
                        EmbeddingException.Kind.PROVIDER, "Invalid embedding format in response");
                  }
                  return item.embedding();
                })
            .toList();

    log.info(
        "Generated embeddings for {} texts (model={}, dimensions={}, usage={})",
        inputs.size(),
        response.model(),
        vectors.isEmpty() ? 0 : vectors.get(0).size(),
        response.usage());
    return vectors;
  }

  private EmbeddingException translate(WebClientResponseException e) {
    int status = e.getStatusCode().value();
    String body = e.getResponseBodyAsString();
    log.error("Embedding API error: status={}, body={}", status, body);

    EmbeddingException.Kind kind;
    String message;
    if (status == 401 || status == 403) {
      kind = EmbeddingException.Kind.AUTHENTICATION;
      message = "Invalid embedding API key. Please check JINA_API_KEY.";
    } else if (status == 422) {
      kind = EmbeddingException.Kind.VALIDATION;
      message = "Embedding API validation error: " + body;
    } else if (status == 429) {
      kind = EmbeddingException.Kind.RATE_LIMIT;
      message = "Embedding rate limit exceeded. Please try again later.";
    } else {
      kind = EmbeddingException.Kind.PROVIDER;
      message = "Failed to generate embeddings: HTTP " + status;
    }
    return new EmbeddingException(kind, message, status, body, e);
  }

  record EmbeddingRequest(
      String model, List<String> input, @JsonProperty("encoding_format") String encodingFormat) {}

  /** Provider response: {@code {data: [{embedding: [...]}], usage, model}}. */
  record EmbeddingResponse(List<EmbeddingData> data, Map<String, Object> usage, String model) {}

  record EmbeddingData(List<Float> embedding) {}
}
