package com.flamingo.ai.newsrag.vectorindex;

/**
 * Metadata stored next to each vector.
 *
 * @param title article title
 * @param link article link
 * @param content chunk text, truncated at ingestion
 * @param source ingestion label
 * @param timestamp ISO-8601 ingestion time
 */
public record PointPayload(
    String title, String link, String content, String source, String timestamp) {}
