package com.flamingo.ai.ragengine.service.vector;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.ragengine.config.RagConfig;
import com.flamingo.ai.ragengine.exception.ProviderException;
import com.flamingo.ai.ragengine.model.ChunkMetadata;
import com.flamingo.ai.ragengine.model.RetrievedMatch;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed vector index.
 *
 * <p>Chunks are stored with their text and metadata next to a cosine {@code dense_vector} field and
 * searched with approximate kNN. Writes use {@code refresh=wait_for} so a query issued right after
 * an upsert sees it.
 */
@Service
@Slf4j
@ConditionalOnProperty(
    name = "rag.vector-index.type",
    havingValue = "elasticsearch",
    matchIfMissing = true)
public class ElasticsearchVectorIndex extends AbstractVectorIndex {

  static final String STORE = "elasticsearch";
  private static final String EMBEDDING_FIELD = "embedding";
  /** Elasticsearch rejects kNN requests with more than this many candidates. */
  static final int MAX_NUM_CANDIDATES = 10_000;

  private final ElasticsearchClient elasticsearchClient;
  private final String indexName;
  private final int vectorDimensions;

  @Autowired
  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient, RagConfig ragConfig, MeterRegistry meterRegistry) {
    this(
        elasticsearchClient,
        meterRegistry,
        ragConfig.getVectorIndex().getIndexName(),
        ragConfig.getVectorIndex().getDimensions());
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(meterRegistry);
    this.elasticsearchClient = elasticsearchClient;
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  public String getIndexName() {
    return indexName;
  }

  @Override
  protected String getStoreName() {
    return STORE;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            indexName);
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(indexProperties())));
        indices.create(request);
        log.info("Created Elasticsearch index: {}", indexName);
      } else {
        log.debug("Elasticsearch index '{}' already exists", indexName);
      }
    } catch (Exception e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  @VisibleForTesting
  Map<String, Property> indexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // documentId and userId MUST be keyword type for exact-match filters
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("userId", Property.of(p -> p.keyword(k -> k)));
    properties.put("fileName", Property.of(p -> p.keyword(k -> k)));
    properties.put("fileType", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("startChar", Property.of(p -> p.integer(i -> i)));
    properties.put("endChar", Property.of(p -> p.integer(i -> i)));
    properties.put("text", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("createdAt", Property.of(p -> p.date(d -> d)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "elasticsearch.upsert", description = "Time to upsert chunk vectors")
  @CircuitBreaker(name = "elasticsearch")
  public void upsert(List<VectorRecord> records) {
    super.upsert(records);
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  public List<RetrievedMatch> query(List<Float> vector, int topK, VectorFilter filter) {
    return super.query(vector, topK, filter);
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public void deleteByIds(List<String> ids) {
    super.deleteByIds(ids);
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete chunks by filter")
  @CircuitBreaker(name = "elasticsearch")
  public void deleteByFilter(VectorFilter filter) {
    super.deleteByFilter(filter);
  }

  @Override
  protected void upsertBatch(List<VectorRecord> batch) {
    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (VectorRecord record : batch) {
      Map<String, Object> document = toDocument(record);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(indexName).id(record.id()).document(document)));
    }
    executeBulk(bulkBuilder.build(), "index");
  }

  @Override
  protected List<RetrievedMatch> doQuery(List<Float> vector, int topK, VectorFilter filter) {
    SearchRequest request = buildVectorSearchRequest(vector, topK, filter);
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<RetrievedMatch> matches = mapHits(response.hits().hits());
      log.debug("[vectorSearch] index={} topK={} returned={}", indexName, topK, matches.size());
      return matches;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", indexName, e.getMessage(), e);
      throw new ProviderException(STORE, "Vector search failed: " + e.getMessage(), e);
    }
  }

  @Override
  protected void doDeleteByIds(List<String> ids) {
    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (String id : ids) {
      bulkBuilder.operations(op -> op.delete(d -> d.index(indexName).id(id)));
    }
    executeBulk(bulkBuilder.build(), "delete");
  }

  @Override
  protected void doDeleteByFilter(VectorFilter filter) {
    Query query = buildFilterQuery(filter);
    DeleteByQueryRequest request =
        DeleteByQueryRequest.of(d -> d.index(indexName).query(query).refresh(true));
    try {
      elasticsearchClient.deleteByQuery(request);
    } catch (IOException e) {
      log.error("Failed to delete from {} with {}: {}", indexName, filter, e.getMessage(), e);
      throw new ProviderException(STORE, "Delete by filter failed: " + e.getMessage(), e);
    }
  }

  @VisibleForTesting
  SearchRequest buildVectorSearchRequest(List<Float> vector, int topK, VectorFilter filter) {
    int size = Math.min(topK, MAX_NUM_CANDIDATES);
    int numCandidates = Math.min(Math.max(size * 2, 10), MAX_NUM_CANDIDATES);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k -> {
                      k.field(EMBEDDING_FIELD)
                          .queryVector(vector)
                          .k(size)
                          .numCandidates(numCandidates);
                      if (!filter.isEmpty()) {
                        k.filter(buildFilterQuery(filter));
                      }
                      return k;
                    })
                .size(size));
  }

  @VisibleForTesting
  Query buildFilterQuery(VectorFilter filter) {
    return Query.of(
        q ->
            q.bool(
                b -> {
                  if (filter.hasDocumentIds()) {
                    List<FieldValue> values =
                        filter.documentIds().stream().map(FieldValue::of).toList();
                    b.filter(f -> f.terms(t -> t.field("documentId").terms(v -> v.value(values))));
                  }
                  if (filter.hasUserId()) {
                    b.filter(f -> f.term(t -> t.field("userId").value(filter.userId())));
                  }
                  return b;
                }));
  }

  private void executeBulk(BulkRequest request, String operation) {
    try {
      BulkResponse response = elasticsearchClient.bulk(request);
      if (response.errors()) {
        long failed = response.items().stream().filter(item -> item.error() != null).count();
        log.warn(
            "{} of {} bulk {} operations failed in {}",
            failed,
            response.items().size(),
            operation,
            indexName);
        throw new ProviderException(
            STORE, "Bulk " + operation + " failed for " + failed + " item(s) in " + indexName);
      }
    } catch (IOException e) {
      log.error("Bulk {} failed for {}: {}", operation, indexName, e.getMessage(), e);
      throw new ProviderException(STORE, "Bulk " + operation + " failed: " + e.getMessage(), e);
    }
  }

  private Map<String, Object> toDocument(VectorRecord record) {
    ChunkMetadata metadata = record.metadata();
    Map<String, Object> document = new HashMap<>();
    document.put(EMBEDDING_FIELD, record.vector());
    document.put("text", metadata.text());
    document.put("documentId", metadata.documentId());
    document.put("userId", metadata.userId());
    document.put("chunkIndex", metadata.chunkIndex());
    putIfPresent(document, "startChar", metadata.startChar());
    putIfPresent(document, "endChar", metadata.endChar());
    putIfPresent(document, "pageNumber", metadata.pageNumber());
    putIfPresent(document, "fileName", metadata.fileName());
    putIfPresent(document, "fileType", metadata.fileType());
    if (metadata.createdAt() != null) {
      document.put("createdAt", metadata.createdAt().toString());
    }
    return document;
  }

  private static void putIfPresent(Map<String, Object> document, String field, Object value) {
    if (value != null) {
      document.put(field, value);
    }
  }

  @SuppressWarnings("unchecked")
  private List<RetrievedMatch> mapHits(List<Hit<Map>> hits) {
    List<RetrievedMatch> matches = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null) {
        continue;
      }
      double relevance = hit.score() != null ? hit.score() : 0.0;
      matches.add(new RetrievedMatch(hit.id(), relevanceToCosine(relevance), toMetadata(source)));
    }
    return matches;
  }

  private ChunkMetadata toMetadata(Map<String, Object> source) {
    Object createdAt = source.get("createdAt");
    return ChunkMetadata.builder()
        .text((String) source.get("text"))
        .documentId((String) source.get("documentId"))
        .userId((String) source.get("userId"))
        .chunkIndex(intValue(source.get("chunkIndex"), 0))
        .startChar(integerValue(source.get("startChar")))
        .endChar(integerValue(source.get("endChar")))
        .pageNumber(integerValue(source.get("pageNumber")))
        .fileName((String) source.get("fileName"))
        .fileType((String) source.get("fileType"))
        .createdAt(createdAt != null ? Instant.parse(createdAt.toString()) : null)
        .build();
  }

  private static Integer integerValue(Object value) {
    return value instanceof Number n ? n.intValue() : null;
  }

  private static int intValue(Object value, int defaultValue) {
    return value instanceof Number n ? n.intValue() : defaultValue;
  }
}
