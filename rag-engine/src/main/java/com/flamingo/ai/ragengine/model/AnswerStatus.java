package com.flamingo.ai.ragengine.model;

/** How the answer text of a {@link RagResult} was produced. */
public enum AnswerStatus {
  /** A generation backend produced the answer from the retrieved context. */
  GENERATED,

  /** Every generation backend failed; the answer is the retrieved context itself. */
  CONTEXT_ONLY
}
