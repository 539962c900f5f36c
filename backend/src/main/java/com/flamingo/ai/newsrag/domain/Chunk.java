package com.flamingo.ai.newsrag.domain;

/**
 * A cleaned, size-bounded slice of article text ready for embedding.
 *
 * @param text chunk text
 * @param sourceArticleLink link of the article the chunk was cut from
 */
public record Chunk(String text, String sourceArticleLink) {}
