package com.flamingo.ai.ragengine.service.query;

import java.util.List;

/**
 * Preprocessed form of a user query.
 *
 * @param original the query exactly as received
 * @param normalized lowercased, trimmed, whitespace-collapsed query
 * @param keywords significant tokens in query order, stop words and short tokens removed
 * @param cleaned keywords joined by single spaces, or {@code normalized} when there are none
 */
public record QueryPreprocessingResult(
    String original, String normalized, List<String> keywords, String cleaned) {

  public QueryPreprocessingResult {
    keywords = List.copyOf(keywords);
  }

  static QueryPreprocessingResult empty(String original) {
    return new QueryPreprocessingResult(original == null ? "" : original, "", List.of(), "");
  }

  public boolean hasKeywords() {
    return !keywords.isEmpty();
  }
}
