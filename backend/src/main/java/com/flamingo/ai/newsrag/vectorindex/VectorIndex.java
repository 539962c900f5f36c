package com.flamingo.ai.newsrag.vectorindex;

import com.flamingo.ai.newsrag.exception.VectorIndexException;
import java.util.List;

/**
 * Similarity-search collection of embedded news chunks. Implementations do not retry; failures
 * surface as {@link VectorIndexException}.
 */
public interface VectorIndex {

  /** Name of the collection that upserts and searches target. */
  String getCollectionName();

  /**
   * Creates the collection with cosine distance if it does not exist. An existing collection with a
   * different dimension is deleted and recreated, losing its points.
   */
  void ensureCollection(String name, int dimension);

  /** Writes points, overwriting by id. Returns once the points are visible to search. */
  void upsert(List<VectorPoint> points);

  /**
   * Top-k points by cosine similarity, best first, none scoring below {@code scoreThreshold}.
   *
   * @return matching points, empty when nothing clears the threshold
   */
  List<ScoredPoint> search(List<Float> queryVector, int k, double scoreThreshold);

  void deleteCollection(String name);

  /** Number of points in the collection, 0 when it does not exist. */
  long count();

  /** Whether the backing service answers. Never throws. */
  boolean isAvailable();
}
