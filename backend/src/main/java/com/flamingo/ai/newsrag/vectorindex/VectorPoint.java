package com.flamingo.ai.newsrag.vectorindex;

import java.util.List;

/** Embedded chunk ready for upsert. */
public record VectorPoint(long id, List<Float> vector, PointPayload payload) {}
