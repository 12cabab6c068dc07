package com.flamingo.ai.ragengine.service.vector;

import com.flamingo.ai.ragengine.model.RetrievedMatch;
import java.util.List;

/** Similarity-searchable store of chunk vectors and their metadata. */
public interface VectorIndex {

  /** Inserts or replaces records by id, in batches of at most 100. */
  void upsert(List<VectorRecord> records);

  /**
   * Returns up to {@code topK} records most similar to {@code vector}, best first, restricted by
   * {@code filter}. Scores are cosine similarities.
   */
  List<RetrievedMatch> query(List<Float> vector, int topK, VectorFilter filter);

  void deleteByIds(List<String> ids);

  /**
   * Deletes every record matching {@code filter}.
   *
   * @throws IllegalArgumentException if the filter is empty, which would match the whole index
   */
  void deleteByFilter(VectorFilter filter);
}
