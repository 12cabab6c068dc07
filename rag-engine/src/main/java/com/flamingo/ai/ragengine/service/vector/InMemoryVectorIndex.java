package com.flamingo.ai.ragengine.service.vector;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import com.flamingo.ai.ragengine.model.ChunkMetadata;
import com.flamingo.ai.ragengine.model.RetrievedMatch;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.logical.And;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Process-local vector index on LangChain4j's {@link InMemoryEmbeddingStore}. Nothing is
 * persisted; used for local runs and tests.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "rag.vector-index.type", havingValue = "in-memory")
public class InMemoryVectorIndex extends AbstractVectorIndex {

  static final String STORE = "in-memory";

  private final InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();

  public InMemoryVectorIndex(MeterRegistry meterRegistry) {
    super(meterRegistry);
  }

  @Override
  protected String getStoreName() {
    return STORE;
  }

  @Override
  protected int getVectorDimensions() {
    return 0;
  }

  @Override
  protected synchronized void upsertBatch(List<VectorRecord> batch) {
    List<String> ids = new ArrayList<>(batch.size());
    List<Embedding> embeddings = new ArrayList<>(batch.size());
    List<TextSegment> segments = new ArrayList<>(batch.size());
    for (VectorRecord record : batch) {
      ids.add(record.id());
      embeddings.add(Embedding.from(record.vector()));
      segments.add(TextSegment.from(record.metadata().text(), toMetadata(record.metadata())));
    }
    // the store appends, so replace existing ids explicitly
    store.removeAll(ids);
    store.addAll(ids, embeddings, segments);
  }

  @Override
  protected List<RetrievedMatch> doQuery(List<Float> vector, int topK, VectorFilter filter) {
    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(vector))
            .maxResults(topK)
            .minScore(0.0);
    if (!filter.isEmpty()) {
      request.filter(toFilter(filter));
    }

    List<RetrievedMatch> matches = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : store.search(request.build()).matches()) {
      matches.add(
          new RetrievedMatch(
              match.embeddingId(),
              relevanceToCosine(match.score()),
              fromSegment(match.embedded())));
    }
    return matches;
  }

  @Override
  protected synchronized void doDeleteByIds(List<String> ids) {
    store.removeAll(ids);
  }

  @Override
  protected synchronized void doDeleteByFilter(VectorFilter filter) {
    store.removeAll(toFilter(filter));
  }

  private Filter toFilter(VectorFilter filter) {
    Filter documentFilter =
        filter.hasDocumentIds() ? metadataKey("documentId").isIn(filter.documentIds()) : null;
    Filter userFilter =
        filter.hasUserId() ? metadataKey("userId").isEqualTo(filter.userId()) : null;
    if (documentFilter != null && userFilter != null) {
      return new And(documentFilter, userFilter);
    }
    return documentFilter != null ? documentFilter : userFilter;
  }

  private static Metadata toMetadata(ChunkMetadata metadata) {
    Map<String, Object> values = new HashMap<>();
    putIfPresent(values, "documentId", metadata.documentId());
    putIfPresent(values, "userId", metadata.userId());
    values.put("chunkIndex", metadata.chunkIndex());
    putIfPresent(values, "startChar", metadata.startChar());
    putIfPresent(values, "endChar", metadata.endChar());
    putIfPresent(values, "pageNumber", metadata.pageNumber());
    putIfPresent(values, "fileName", metadata.fileName());
    putIfPresent(values, "fileType", metadata.fileType());
    if (metadata.createdAt() != null) {
      values.put("createdAt", metadata.createdAt().toEpochMilli());
    }
    return Metadata.from(values);
  }

  private static void putIfPresent(Map<String, Object> values, String key, Object value) {
    if (value != null) {
      values.put(key, value);
    }
  }

  private static ChunkMetadata fromSegment(TextSegment segment) {
    Metadata metadata = segment.metadata();
    Long createdAt = metadata.getLong("createdAt");
    Integer chunkIndex = metadata.getInteger("chunkIndex");
    return ChunkMetadata.builder()
        .text(segment.text())
        .documentId(metadata.getString("documentId"))
        .userId(metadata.getString("userId"))
        .chunkIndex(chunkIndex != null ? chunkIndex : 0)
        .startChar(metadata.getInteger("startChar"))
        .endChar(metadata.getInteger("endChar"))
        .pageNumber(metadata.getInteger("pageNumber"))
        .fileName(metadata.getString("fileName"))
        .fileType(metadata.getString("fileType"))
        .createdAt(createdAt != null ? Instant.ofEpochMilli(createdAt) : null)
        .build();
  }
}
