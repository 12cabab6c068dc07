package com.flamingo.ai.ragengine.model;

import com.flamingo.ai.ragengine.service.generation.BackendId;
import java.util.List;

/**
 * Result of answering one question.
 *
 * @param answer generated answer, or the raw context when status is {@link
 *     AnswerStatus#CONTEXT_ONLY}
 * @param sources cited chunks in descending score order, numbered from 1 in the context
 * @param context numbered context block supplied to the generation backend
 * @param model backend that produced the answer, {@code null} when none did
 * @param status whether the answer was generated
 */
public record RagResult(
    String answer,
    List<RagSource> sources,
    String context,
    BackendId model,
    AnswerStatus status) {

  public RagResult {
    sources = List.copyOf(sources);
  }

  public boolean isGenerated() {
    return status == AnswerStatus.GENERATED;
  }
}
