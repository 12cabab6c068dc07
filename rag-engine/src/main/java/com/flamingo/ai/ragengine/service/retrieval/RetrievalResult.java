package com.flamingo.ai.ragengine.service.retrieval;

import com.flamingo.ai.ragengine.model.RetrievedMatch;
import java.util.List;

/**
 * Matches selected for a query, best first.
 *
 * @param matches selected matches in descending score order
 * @param appliedThreshold score threshold that selected the matches, {@code null} when none did
 * @param fallbackLevel stage of the relevance cascade that produced the matches
 */
public record RetrievalResult(
    List<RetrievedMatch> matches, Double appliedThreshold, FallbackLevel fallbackLevel) {

  public RetrievalResult {
    matches = List.copyOf(matches);
  }

  static RetrievalResult empty() {
    return new RetrievalResult(List.of(), null, FallbackLevel.NONE);
  }

  public boolean isEmpty() {
    return matches.isEmpty();
  }
}
