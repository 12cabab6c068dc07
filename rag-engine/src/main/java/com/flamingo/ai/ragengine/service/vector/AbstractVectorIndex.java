package com.flamingo.ai.ragengine.service.vector;

import com.flamingo.ai.ragengine.model.RetrievedMatch;
import com.google.common.collect.Lists;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for vector index implementations.
 *
 * <p>Validates arguments, splits upserts into batches of {@value #UPSERT_BATCH_SIZE} and records
 * metrics. Subclasses only talk to their store.
 */
@Slf4j
public abstract class AbstractVectorIndex implements VectorIndex {

  public static final int UPSERT_BATCH_SIZE = 100;

  protected final MeterRegistry meterRegistry;

  protected AbstractVectorIndex(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /** Short store name used in logs and metric tags. */
  protected abstract String getStoreName();

  /** Expected vector length, or 0 when the store accepts any length. */
  protected abstract int getVectorDimensions();

  protected abstract void upsertBatch(List<VectorRecord> batch);

  protected abstract List<RetrievedMatch> doQuery(
      List<Float> vector, int topK, VectorFilter filter);

  protected abstract void doDeleteByIds(List<String> ids);

  protected abstract void doDeleteByFilter(VectorFilter filter);

  @Override
  public void upsert(List<VectorRecord> records) {
    if (records == null || records.isEmpty()) {
      return;
    }
    records.forEach(this::validate);

    List<List<VectorRecord>> batches = Lists.partition(records, UPSERT_BATCH_SIZE);
    for (List<VectorRecord> batch : batches) {
      upsertBatch(batch);
      meterRegistry
          .counter("vector_index.upserted", "store", getStoreName())
          .increment(batch.size());
    }
    log.debug(
        "Upserted {} vectors into {} in {} batches",
        records.size(),
        getStoreName(),
        batches.size());
  }

  @Override
  public List<RetrievedMatch> query(List<Float> vector, int topK, VectorFilter filter) {
    if (vector == null || vector.isEmpty()) {
      throw new IllegalArgumentException("Query vector must not be empty");
    }
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be greater than 0");
    }

    List<RetrievedMatch> matches =
        new ArrayList<>(doQuery(vector, topK, filter == null ? VectorFilter.none() : filter));
    matches.sort(Comparator.comparingDouble(RetrievedMatch::score).reversed());
    meterRegistry.counter("vector_index.queried", "store", getStoreName()).increment();
    return matches.size() > topK ? List.copyOf(matches.subList(0, topK)) : matches;
  }

  @Override
  public void deleteByIds(List<String> ids) {
    if (ids == null || ids.isEmpty()) {
      return;
    }
    doDeleteByIds(ids);
    meterRegistry.counter("vector_index.deleted", "store", getStoreName()).increment(ids.size());
  }

  @Override
  public void deleteByFilter(VectorFilter filter) {
    if (filter == null || filter.isEmpty()) {
      throw new IllegalArgumentException("deleteByFilter requires a documentId or userId filter");
    }
    doDeleteByFilter(filter);
    log.info("Deleted vectors from {} matching {}", getStoreName(), filter);
    meterRegistry.counter("vector_index.deleted", "store", getStoreName()).increment();
  }

  /** Converts a {@code (1 + cosine) / 2} relevance score back to cosine similarity. */
  protected static double relevanceToCosine(double relevance) {
    return 2 * relevance - 1;
  }

  private void validate(VectorRecord record) {
    if (record.id() == null || record.id().isBlank()) {
      throw new IllegalArgumentException("Vector record id must not be blank");
    }
    if (record.vector() == null || record.vector().isEmpty()) {
      throw new IllegalArgumentException("Vector record " + record.id() + " has no vector");
    }
    int dimensions = getVectorDimensions();
    if (dimensions > 0 && record.vector().size() != dimensions) {
      throw new IllegalArgumentException(
          "Vector record "
              + record.id()
              + " has "
              + record.vector().size()
              + " dimensions, expected "
              + dimensions);
    }
  }
}
