package com.flamingo.ai.newsrag.service.llm;

import com.flamingo.ai.newsrag.agent.ChatStreamingAgent;
import com.flamingo.ai.newsrag.agent.NewsClassificationAgent;
import com.flamingo.ai.newsrag.agent.QueryExpansionAgent;
import com.flamingo.ai.newsrag.agent.dto.NewsClassificationResult;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.domain.MessageRole;
import com.flamingo.ai.newsrag.exception.LlmServiceException;
import com.flamingo.ai.newsrag.vectorindex.ScoredPoint;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Generative model operations used by the chat orchestrator: the news gate, query expansion, and
 * buffered or streamed answers with optional article context.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NewsLlmService {

  static final String SYSTEM_PROMPT =
      """
      You are a helpful news assistant. When recent news articles are provided, answer from them \
      and mention which articles you used. If the articles do not cover the question, say so \
      briefly. Keep answers concise and factual.""";

  private final NewsClassificationAgent classificationAgent;
  private final QueryExpansionAgent queryExpansionAgent;
  private final ChatStreamingAgent chatStreamingAgent;
  private final ChatModel chatModel;
  private final MeterRegistry meterRegistry;

  /**
   * Asks the model whether the question concerns current events.
   *
   * @throws LlmServiceException when the model call fails
   */
  @Timed(value = "llm.classify", description = "Time to classify a query")
  @CircuitBreaker(name = "llm", fallbackMethod = "isNewsRelatedFallback")
  public boolean isNewsRelated(String query) {
    NewsClassificationResult result = classificationAgent.classify(query);
    boolean newsRelated = result != null && result.newsRelated();
    log.debug(
        "Classified query as newsRelated={} ({})",
        newsRelated,
        result != null ? result.reasoning() : "no result");
    meterRegistry.counter("llm.classification", "news", String.valueOf(newsRelated)).increment();
    return newsRelated;
  }

  @SuppressWarnings("unused")
  private boolean isNewsRelatedFallback(String query, Throwable t) {
    throw toLlmException("News classification failed", t);
  }

  /**
   * Returns {@code query} followed by model-suggested keywords. Falls back to the query alone when
   * expansion fails.
   */
  @Timed(value = "llm.expand", description = "Time to expand a query")
  public String expandQuery(String query) {
    try {
      String expansion = queryExpansionAgent.expand(query);
      String searchQuery = (query + " " + (expansion != null ? expansion : "")).trim();
      log.debug("Expanded query '{}' to '{}'", query, searchQuery);
      return searchQuery;
    } catch (RuntimeException e) {
      log.warn("Query expansion failed, using original query: {}", e.getMessage());
      meterRegistry.counter("llm.expansion.failures").increment();
      return query.trim();
    }
  }

  /**
   * Generates a complete answer. With an empty {@code articles} list the answer is context-free.
   *
   * @throws LlmServiceException when the model call fails or returns no text
   */
  @Timed(value = "llm.generate", description = "Time to generate an answer")
  @CircuitBreaker(name = "llm", fallbackMethod = "generateAnswerFallback")
  public String generateAnswer(
      String query, List<ScoredPoint> articles, List<ConversationMessage> history) {
    ChatResponse response = chatModel.chat(buildMessages(query, articles, history));
    if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
      throw new LlmServiceException("Invalid response format from language model");
    }
    meterRegistry.counter("llm.answers", "mode", "buffered").increment();
    return response.aiMessage().text();
  }

  @SuppressWarnings("unused")
  private String generateAnswerFallback(
      String query, List<ScoredPoint> articles, List<ConversationMessage> history, Throwable t) {
    throw toLlmException("Answer generation failed", t);
  }

  /**
   * Streams an answer as text increments. Generation starts on subscription. After cancellation
   * further increments from the model are dropped.
   */
  public Flux<String> streamAnswer(
      String query, List<ScoredPoint> articles, List<ConversationMessage> history) {
    List<ChatMessage> messages = buildMessages(query, articles, history);
    return Flux.defer(
        () -> {
          Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
          AtomicBoolean cancelled = new AtomicBoolean(false);
          try {
            chatStreamingAgent
                .chat(messages)
                .onPartialResponse(
                    token -> {
                      if (cancelled.get()) {
                        return;
                      }
                      var result = sink.tryEmitNext(token);
                      if (result.isFailure()) {
                        log.warn("Failed to emit token: {}", result);
                      }
                    })
                .onCompleteResponse(
                    response -> {
                      meterRegistry.counter("llm.answers", "mode", "streamed").increment();
                      sink.tryEmitComplete();
                    })
                .onError(
                    error -> {
                      log.error("Error during answer streaming: {}", error.getMessage(), error);
                      sink.tryEmitError(toLlmException("Answer streaming failed", error));
                    })
                .start();
          } catch (RuntimeException e) {
            return Flux.error(toLlmException("Answer streaming failed", e));
          }
          return sink.asFlux().doOnCancel(() -> cancelled.set(true));
        });
  }

  /**
   * System prompt, prior turns, then the question. With articles the question is preceded by a
   * block of {@code Title: ...\nContent: ...} entries.
   */
  List<ChatMessage> buildMessages(
      String query, List<ScoredPoint> articles, List<ConversationMessage> history) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(SYSTEM_PROMPT));

    if (history != null) {
      for (ConversationMessage message : history) {
        if (message.getContent() == null || message.getContent().isBlank()) {
          continue;
        }
        if (message.getRole() == MessageRole.USER) {
          messages.add(UserMessage.from(message.getContent()));
        } else {
          messages.add(AiMessage.from(message.getContent()));
        }
      }
    }

    messages.add(UserMessage.from(buildPrompt(query, articles)));
    return messages;
  }

  static String buildPrompt(String query, List<ScoredPoint> articles) {
    if (articles == null || articles.isEmpty()) {
      return query;
    }
    StringBuilder prompt = new StringBuilder("Based on these recent news articles:\n\n");
    for (int i = 0; i < articles.size(); i++) {
      if (i > 0) {
        prompt.append("\n\n");
      }
      ScoredPoint article = articles.get(i);
      prompt
          .append("Title: ")
          .append(article.payload().title())
          .append("\nContent: ")
          .append(article.payload().content());
    }
    prompt.append("\n\nUser Question: ").append(query);
    return prompt.toString();
  }

  static LlmServiceException toLlmException(String message, Throwable t) {
    if (t instanceof LlmServiceException llmException) {
      return llmException;
    }
    boolean rateLimited = isRateLimited(t);
    return new LlmServiceException(message + ": " + t.getMessage(), rateLimited, t);
  }

  private static boolean isRateLimited(Throwable t) {
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (current instanceof RateLimitException) {
        return true;
      }
      if (current instanceof HttpException he && he.statusCode() == 429) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }
}
