package com.flamingo.ai.ragengine.service.retrieval;

import com.flamingo.ai.ragengine.config.RagConfig;
import com.flamingo.ai.ragengine.service.vector.VectorFilter;
import lombok.Builder;

/**
 * Per-call retrieval parameters.
 *
 * @param topK number of candidates fetched from the vector index
 * @param minScore minimum score a match must reach before the fallback cascade kicks in
 * @param filter metadata restriction, never {@code null}
 * @param useHybrid blend keyword scores into the semantic scores when the query has keywords
 * @param semanticWeight weight of the vector similarity in the blended score
 * @param keywordWeight weight of the keyword score in the blended score
 */
@Builder(toBuilder = true)
public record RetrievalOptions(
    int topK,
    double minScore,
    VectorFilter filter,
    boolean useHybrid,
    double semanticWeight,
    double keywordWeight) {

  public RetrievalOptions {
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be greater than 0");
    }
    filter = filter == null ? VectorFilter.none() : filter;
  }

  public static RetrievalOptions defaults(RagConfig.Retrieval retrieval) {
    return new RetrievalOptions(
        retrieval.getTopK(),
        retrieval.getMinScore(),
        VectorFilter.none(),
        retrieval.isHybridEnabled(),
        retrieval.getSemanticWeight(),
        retrieval.getKeywordWeight());
  }
}
