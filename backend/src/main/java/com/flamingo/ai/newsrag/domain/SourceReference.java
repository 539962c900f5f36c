package com.flamingo.ai.newsrag.domain;

/**
 * An article cited by an answer.
 *
 * @param title article title, "Untitled" when the payload had none
 * @param link article URL
 * @param score cosine similarity of the retrieved chunk
 */
public record SourceReference(String title, String link, double score) {}
