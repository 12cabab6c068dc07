package com.flamingo.ai.ragengine.model;

/**
 * A candidate chunk returned from the vector index.
 *
 * <p>The score is cosine similarity in semantic mode or a blended score in hybrid mode. Higher is
 * more relevant; blended scores are not guaranteed to stay below 1.0.
 */
public record RetrievedMatch(String id, double score, ChunkMetadata metadata) {

  public RetrievedMatch withScore(double newScore) {
    return new RetrievedMatch(id, newScore, metadata);
  }

  /** Stored chunk text, never {@code null}. */
  public String text() {
    return metadata != null && metadata.text() != null ? metadata.text() : "";
  }
}
