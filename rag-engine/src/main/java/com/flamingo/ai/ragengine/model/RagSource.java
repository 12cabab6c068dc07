package com.flamingo.ai.ragengine.model;

/** A retrieved chunk cited by an answer. */
public record RagSource(String text, double score, ChunkMetadata metadata) {

  public static RagSource from(RetrievedMatch match) {
    return new RagSource(match.text(), match.score(), match.metadata());
  }
}
