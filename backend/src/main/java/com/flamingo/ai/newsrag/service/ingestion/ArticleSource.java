package com.flamingo.ai.newsrag.service.ingestion;

import com.flamingo.ai.newsrag.domain.Article;
import java.util.List;

/** Supplier of news articles for ingestion. Implementations deduplicate by link. */
public interface ArticleSource {

  /**
   * Fetches the current articles. Sources that cannot be reached are skipped, never thrown.
   *
   * @return articles, possibly with empty content
   */
  List<Article> fetchArticles();

  /** Human-readable locations this source reads from. */
  List<String> describeSources();
}
