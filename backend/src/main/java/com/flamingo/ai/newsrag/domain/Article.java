package com.flamingo.ai.newsrag.domain;

/**
 * A news article handed over by an article source. The link is the natural key.
 *
 * @param title headline, may be null
 * @param link canonical article URL
 * @param content article body or summary, may be empty
 */
public record Article(String title, String link, String content) {

  public boolean hasContent() {
    return content != null && !content.isBlank();
  }
}
