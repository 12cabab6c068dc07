package com.flamingo.ai.ragengine.service.retrieval;

/** Which stage of the relevance cascade produced a retrieval result. */
public enum FallbackLevel {
  /** Matches cleared the requested minimum score. */
  PRIMARY,

  /** Matches cleared one of the lowered thresholds. */
  RELAXED,

  /** No threshold produced a match; the best raw candidates were taken regardless of score. */
  UNFILTERED,

  /** The index returned no candidates at all. */
  NONE
}
