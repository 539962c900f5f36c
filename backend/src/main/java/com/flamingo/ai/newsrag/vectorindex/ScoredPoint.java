package com.flamingo.ai.newsrag.vectorindex;

/** Search hit with its cosine similarity to the query. */
public record ScoredPoint(long id, double score, PointPayload payload) {}
