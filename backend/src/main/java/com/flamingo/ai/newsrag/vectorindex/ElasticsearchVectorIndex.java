package com.flamingo.ai.newsrag.vectorindex;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.exception.VectorIndexException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * {@link VectorIndex} backed by an Elasticsearch index with a cosine {@code dense_vector} field.
 *
 * <p>Elasticsearch reports cosine knn scores as {@code (1 + cos) / 2}; hits are converted back to
 * raw cosine similarity before thresholding. Collection changes take the write lock, upserts and
 * searches the read lock, so a recreate never interleaves with a write from this process.
 */
@Service
@Slf4j
public class ElasticsearchVectorIndex implements VectorIndex {

  static final String VECTOR_FIELD = "vector";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String collectionName;
  private final ReadWriteLock collectionLock = new ReentrantReadWriteLock();

  @Autowired
  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, RagConfig ragConfig) {
    this(elasticsearchClient, meterRegistry, ragConfig.getVectorIndex().getCollection());
  }

  /** Constructor for testing - allows setting the collection name. */
  @VisibleForTesting
  ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, String collectionName) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.collectionName = collectionName;
  }

  @Override
  public String getCollectionName() {
    return collectionName;
  }

  @Override
  public void ensureCollection(String name, int dimension) {
    collectionLock.writeLock().lock();
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(name)).value();
      if (!exists) {
        createCollection(name, dimension);
        log.info("Created collection '{}' with dimension {}", name, dimension);
        return;
      }

      Integer existingDimension = readDimension(name);
      if (existingDimension != null && existingDimension == dimension) {
        log.debug("Collection '{}' exists with dimension {}", name, dimension);
        return;
      }

      log.warn(
          "Collection '{}' has dimension {} but {} is required; recreating it",
          name,
          existingDimension,
          dimension);
      elasticsearchClient.indices().delete(d -> d.index(name));
      createCollection(name, dimension);
      meterRegistry.counter("vector_index.recreated").increment();
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to ensure collection '{}': {}", name, e.getMessage(), e);
      throw new VectorIndexException("Failed to ensure collection '" + name + "'", e);
    } finally {
      collectionLock.writeLock().unlock();
    }
  }

  private void createCollection(String name, int dimension) throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("title", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("link", Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("source", Property.of(p -> p.keyword(k -> k)));
    properties.put("timestamp", Property.of(p -> p.date(d -> d)));
    properties.put(
        VECTOR_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(dimension)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));

    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(name)
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  private Integer readDimension(String name) throws IOException {
    var response = elasticsearchClient.indices().getMapping(g -> g.index(name));
    var indexMapping = response.get(name);
    if (indexMapping == null || indexMapping.mappings() == null) {
      return null;
    }
    Property vector = indexMapping.mappings().properties().get(VECTOR_FIELD);
    if (vector == null || !vector.isDenseVector()) {
      return null;
    }
    return vector.denseVector().dims();
  }

  @Override
  @Timed(value = "vector_index.upsert", description = "Time to upsert points")
  public void upsert(List<VectorPoint> points) {
    if (points.isEmpty()) {
      return;
    }
    collectionLock.readLock().lock();
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (VectorPoint point : points) {
        PointDocument document = PointDocument.from(point);
        bulkBuilder.operations(
            op ->
                op.index(
                    idx ->
                        idx.index(collectionName)
                            .id(String.valueOf(point.id()))
                            .document(document)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        List<String> reasons = new ArrayList<>();
        for (BulkResponseItem item : response.items()) {
          if (item.error() != null) {
            reasons.add(item.id() + ": " + item.error().reason());
          }
        }
        meterRegistry.counter("vector_index.upsert.errors").increment();
        throw new VectorIndexException(
            "Failed to upsert " + reasons.size() + " points: " + reasons);
      }
      meterRegistry.counter("vector_index.upserted").increment(points.size());
      log.debug("Upserted {} points to {}", points.size(), collectionName);
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to upsert points to {}: {}", collectionName, e.getMessage(), e);
      throw new VectorIndexException("Failed to upsert points", e);
    } finally {
      collectionLock.readLock().unlock();
    }
  }

  @Override
  @Timed(value = "vector_index.search", description = "Time for vector search")
  public List<ScoredPoint> search(List<Float> queryVector, int k, double scoreThreshold) {
    if (k <= 0) {
      return List.of();
    }
    collectionLock.readLock().lock();
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(collectionName)
                      .knn(
                          knn ->
                              knn.field(VECTOR_FIELD)
                                  .queryVector(queryVector)
                                  .k(k)
                                  .numCandidates(Math.max(k * 2, 50))
                                  .similarity((float) scoreThreshold))
                      .source(src -> src.filter(f -> f.excludes(VECTOR_FIELD)))
                      .size(k));
      SearchResponse<PointDocument> response =
          elasticsearchClient.search(request, PointDocument.class);

      List<ScoredPoint> results = toScoredPoints(response.hits().hits(), scoreThreshold);
      meterRegistry.counter("vector_index.search").increment();
      log.info(
          "Vector search on {} returned {} hits, {} above threshold {}",
          collectionName,
          response.hits().hits().size(),
          results.size(),
          scoreThreshold);
      return results.size() > k ? results.subList(0, k) : results;
    } catch (IOException | ElasticsearchException e) {
      log.error("Vector search failed for {}: {}", collectionName, e.getMessage(), e);
      throw new VectorIndexException("Vector search failed", e);
    } finally {
      collectionLock.readLock().unlock();
    }
  }

  private List<ScoredPoint> toScoredPoints(List<Hit<PointDocument>> hits, double scoreThreshold) {
    List<ScoredPoint> points = new ArrayList<>();
    for (Hit<PointDocument> hit : hits) {
      if (hit.score() == null || hit.source() == null) {
        continue;
      }
      double cosine = toCosine(hit.score());
      if (cosine < scoreThreshold) {
        continue;
      }
      points.add(
          new ScoredPoint(Long.parseLong(hit.id()), cosine, hit.source().toPayload()));
    }
    points.sort(Comparator.comparingDouble(ScoredPoint::score).reversed());
    return points;
  }

  /** Elasticsearch cosine score {@code (1 + cos) / 2} back to cosine similarity. */
  static double toCosine(double score) {
    return 2 * score - 1;
  }

  @Override
  public void deleteCollection(String name) {
    collectionLock.writeLock().lock();
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(name)).value();
      if (exists) {
        elasticsearchClient.indices().delete(d -> d.index(name));
        log.info("Deleted collection '{}'", name);
      }
    } catch (IOException | ElasticsearchException e) {
      throw new VectorIndexException("Failed to delete collection '" + name + "'", e);
    } finally {
      collectionLock.writeLock().unlock();
    }
  }

  @Override
  public long count() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(collectionName)).value();
      if (!exists) {
        return 0;
      }
      return elasticsearchClient.count(c -> c.index(collectionName)).count();
    } catch (IOException | ElasticsearchException e) {
      throw new VectorIndexException("Failed to count points in " + collectionName, e);
    }
  }

  @Override
  public boolean isAvailable() {
    try {
      return elasticsearchClient.ping().value();
    } catch (IOException | RuntimeException e) {
      log.warn("Elasticsearch ping failed: {}", e.getMessage());
      return false;
    }
  }
}
