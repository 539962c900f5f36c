package com.flamingo.ai.newsrag.service.embedding;

import com.flamingo.ai.newsrag.exception.EmbeddingException;
import java.util.List;

/**
 * Remote embedding model behind a request/response contract. One call, no retries.
 *
 * <p>Implementations translate provider failures into {@link EmbeddingException} with the matching
 * {@link EmbeddingException.Kind}.
 */
public interface EmbeddingProvider {

  /**
   * Embeds the given inputs in one request.
   *
   * @param inputs texts to embed, already validated and cleaned
   * @return one vector per input, in input order
   * @throws EmbeddingException on any failure
   */
  List<List<Float>> embed(List<String> inputs);
}
