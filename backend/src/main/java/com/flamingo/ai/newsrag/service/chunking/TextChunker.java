package com.flamingo.ai.newsrag.service.chunking;

import com.flamingo.ai.newsrag.domain.Article;
import com.flamingo.ai.newsrag.domain.Chunk;
import java.util.List;

/**
 * Turns raw article text into provider-safe chunks.
 *
 * <p>Implementations are deterministic, side-effect free and safe for concurrent use.
 */
public interface TextChunker {

  /**
   * Normalises text: strips control, zero-width and non-printable characters, applies NFC and
   * collapses whitespace. Idempotent.
   *
   * @param text raw text, may be null
   * @return cleaned text, empty for null input
   */
  String clean(String text);

  /**
   * Splits text into ordered chunks whose lengths lie within the configured bounds.
   *
   * @param text raw text, may be null
   * @return chunk texts, empty when the cleaned text is too short
   */
  List<String> chunkText(String text);

  /**
   * Chunks an article's content and tags every chunk with the article link.
   *
   * @param article the article
   * @return ordered chunks
   */
  default List<Chunk> chunk(Article article) {
    return chunkText(article.content()).stream()
        .map(text -> new Chunk(text, article.link()))
        .toList();
  }
}
