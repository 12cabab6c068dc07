package com.flamingo.ai.ragengine.service.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.KnnSearch;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.ragengine.exception.ProviderException;
import com.flamingo.ai.ragengine.model.ChunkMetadata;
import com.flamingo.ai.ragengine.model.RetrievedMatch;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ElasticsearchVectorIndexTest {

  private static final String INDEX = "test-chunks";

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private ElasticsearchVectorIndex index;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    index = new ElasticsearchVectorIndex(elasticsearchClient, meterRegistry, INDEX, 3);
  }

  private static VectorRecord record(String id) {
    ChunkMetadata metadata =
        ChunkMetadata.builder()
            .text("text of " + id)
            .documentId("doc-1")
            .userId("user-1")
            .chunkIndex(0)
            .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    return new VectorRecord(id, List.of(0.1f, 0.2f, 0.3f), metadata);
  }

  private static BulkResponse bulkResponse(boolean errors) {
    return BulkResponse.of(b -> b.errors(errors).took(1).items(List.of()));
  }

  @Test
  @DisplayName("should skip index creation when the client has no indices API")
  void shouldSkipInitWithoutIndicesClient() {
    index.initIndex();

    verify(elasticsearchClient).indices();
  }

  @Test
  @DisplayName("should map filter fields as keywords and the embedding as a cosine vector")
  void shouldDefineIndexMapping() {
    Map<String, Property> properties = index.indexProperties();

    assertThat(properties.get("documentId").isKeyword()).isTrue();
    assertThat(properties.get("userId").isKeyword()).isTrue();
    assertThat(properties.get("text").isText()).isTrue();
    assertThat(properties.get("embedding").isDenseVector()).isTrue();
    assertThat(properties.get("embedding").denseVector().dims()).isEqualTo(3);
  }

  @Nested
  @DisplayName("upsert")
  class UpsertTests {

    @Test
    @DisplayName("should send batches of 100 with refresh wait_for")
    void shouldBulkIndexInBatches() throws IOException {
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(bulkResponse(false));
      List<VectorRecord> records = new ArrayList<>();
      for (int i = 0; i < 150; i++) {
        records.add(record("doc-1-chunk-" + i));
      }

      index.upsert(records);

      ArgumentCaptor<BulkRequest> captor = ArgumentCaptor.forClass(BulkRequest.class);
      verify(elasticsearchClient, times(2)).bulk(captor.capture());
      List<BulkRequest> requests = captor.getAllValues();
      assertThat(requests.get(0).operations()).hasSize(100);
      assertThat(requests.get(1).operations()).hasSize(50);
      assertThat(requests.get(0).refresh()).isEqualTo(Refresh.WaitFor);
      assertThat(requests.get(0).operations().get(0).index().id()).isEqualTo("doc-1-chunk-0");
      assertThat(requests.get(0).operations().get(0).index().index()).isEqualTo(INDEX);
      assertThat(meterRegistry.counter("vector_index.upserted", "store", "elasticsearch").count())
          .isEqualTo(150.0);
    }

    @Test
    @DisplayName("should fail when the bulk response reports errors")
    void shouldFailOnBulkErrors() throws IOException {
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(bulkResponse(true));

      assertThatThrownBy(() -> index.upsert(List.of(record("a"))))
          .isInstanceOf(ProviderException.class);
    }

    @Test
    @DisplayName("should reject vectors with the wrong dimensions before calling Elasticsearch")
    void shouldRejectWrongDimensions() throws IOException {
      VectorRecord wrong =
          new VectorRecord("a", List.of(1f, 2f), ChunkMetadata.builder().text("t").build());

      assertThatThrownBy(() -> index.upsert(List.of(wrong)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("expected 3");
      verify(elasticsearchClient, never()).bulk(any(BulkRequest.class));
    }
  }

  @Nested
  @DisplayName("query")
  class QueryTests {

    @Test
    @DisplayName("should build a kNN request with candidates and size")
    void shouldBuildKnnRequest() {
      SearchRequest request =
          index.buildVectorSearchRequest(List.of(0.1f, 0.2f, 0.3f), 5, VectorFilter.none());

      KnnSearch knn = request.knn().get(0);
      assertThat(request.index()).containsExactly(INDEX);
      assertThat(knn.field()).isEqualTo("embedding");
      assertThat(knn.k()).isEqualTo(5);
      assertThat(knn.numCandidates()).isEqualTo(10);
      assertThat(knn.filter()).isEmpty();
      assertThat(request.size()).isEqualTo(5);
    }

    @Test
    @DisplayName("should attach the metadata filter to the kNN clause")
    void shouldAttachFilterToKnn() {
      SearchRequest request =
          index.buildVectorSearchRequest(
              List.of(0.1f, 0.2f, 0.3f), 20, new VectorFilter(List.of("doc-1"), "user-1"));

      KnnSearch knn = request.knn().get(0);
      assertThat(knn.numCandidates()).isEqualTo(40);
      assertThat(knn.filter()).hasSize(1);
      assertThat(knn.filter().get(0).isBool()).isTrue();
    }

    @Test
    @DisplayName("should cap kNN candidates at the Elasticsearch limit for large topK")
    void shouldCapCandidates() {
      SearchRequest nearCap =
          index.buildVectorSearchRequest(List.of(0.1f, 0.2f, 0.3f), 6000, VectorFilter.none());
      SearchRequest overCap =
          index.buildVectorSearchRequest(List.of(0.1f, 0.2f, 0.3f), 20_000, VectorFilter.none());

      assertThat(nearCap.knn().get(0).k()).isEqualTo(6000);
      assertThat(nearCap.knn().get(0).numCandidates()).isEqualTo(10_000);
      assertThat(overCap.knn().get(0).k()).isEqualTo(10_000);
      assertThat(overCap.knn().get(0).numCandidates()).isEqualTo(10_000);
      assertThat(overCap.size()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("should filter documentId with terms and userId with term")
    void shouldBuildFilterQuery() {
      Query query = index.buildFilterQuery(new VectorFilter(List.of("doc-1", "doc-2"), "user-1"));

      List<Query> filters = query.bool().filter();
      assertThat(filters).hasSize(2);
      assertThat(filters.get(0).terms().field()).isEqualTo("documentId");
      assertThat(filters.get(0).terms().terms().value())
          .extracting(FieldValue::stringValue)
          .containsExactly("doc-1", "doc-2");
      assertThat(filters.get(1).term().field()).isEqualTo("userId");
      assertThat(filters.get(1).term().value().stringValue()).isEqualTo("user-1");
    }

    @Test
    @DisplayName("should convert hit relevance back to cosine similarity")
    @SuppressWarnings({"unchecked", "rawtypes"})
    void shouldMapHits() throws IOException {
      Map<String, Object> source = new HashMap<>();
      source.put("text", "Photosynthesis converts light.");
      source.put("documentId", "doc-1");
      source.put("userId", "user-1");
      source.put("chunkIndex", 2);
      source.put("pageNumber", 3);
      source.put("createdAt", "2024-01-01T00:00:00Z");
      Hit<Map> hit = Hit.of(h -> h.index(INDEX).id("doc-1-chunk-2").score(0.9).source(source));
      SearchResponse<Map> response =
          SearchResponse.of(
              r ->
                  r.took(3)
                      .timedOut(false)
                      .shards(s -> s.total(1).successful(1).failed(0))
                      .hits(h -> h.hits(List.of(hit))));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(response);

      List<RetrievedMatch> matches = index.query(List.of(0.1f, 0.2f, 0.3f), 5, null);

      assertThat(matches).hasSize(1);
      RetrievedMatch match = matches.get(0);
      assertThat(match.id()).isEqualTo("doc-1-chunk-2");
      assertThat(match.score()).isCloseTo(0.8, within(1e-9));
      assertThat(match.text()).isEqualTo("Photosynthesis converts light.");
      assertThat(match.metadata().chunkIndex()).isEqualTo(2);
      assertThat(match.metadata().pageNumber()).isEqualTo(3);
      assertThat(match.metadata().startChar()).isNull();
      assertThat(match.metadata().createdAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("should wrap I/O failures as provider errors")
    void shouldWrapSearchFailure() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(() -> index.query(List.of(0.1f, 0.2f, 0.3f), 5, null))
          .isInstanceOf(ProviderException.class)
          .hasMessageContaining("connection refused");
    }
  }

  @Nested
  @DisplayName("delete")
  class DeleteTests {

    @Test
    @DisplayName("should delete by query for a document")
    void shouldDeleteByDocument() throws IOException {
      index.deleteByFilter(VectorFilter.forDocument("doc-1"));

      ArgumentCaptor<DeleteByQueryRequest> captor =
          ArgumentCaptor.forClass(DeleteByQueryRequest.class);
      verify(elasticsearchClient).deleteByQuery(captor.capture());
      DeleteByQueryRequest request = captor.getValue();
      assertThat(request.index()).containsExactly(INDEX);
      assertThat(request.refresh()).isTrue();
      assertThat(request.query().bool().filter().get(0).terms().field()).isEqualTo("documentId");
    }

    @Test
    @DisplayName("should refuse an unrestricted delete")
    void shouldRejectEmptyFilter() throws IOException {
      assertThatThrownBy(() -> index.deleteByFilter(VectorFilter.none()))
          .isInstanceOf(IllegalArgumentException.class);
      verify(elasticsearchClient, never()).deleteByQuery(any(DeleteByQueryRequest.class));
    }

    @Test
    @DisplayName("should bulk delete by id")
    void shouldDeleteByIds() throws IOException {
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(bulkResponse(false));

      index.deleteByIds(List.of("a", "b"));

      ArgumentCaptor<BulkRequest> captor = ArgumentCaptor.forClass(BulkRequest.class);
      verify(elasticsearchClient).bulk(captor.capture());
      assertThat(captor.getValue().operations()).hasSize(2);
      assertThat(captor.getValue().operations().get(0).isDelete()).isTrue();
    }
  }
}
