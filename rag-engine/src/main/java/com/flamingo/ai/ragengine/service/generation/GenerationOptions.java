package com.flamingo.ai.ragengine.service.generation;

import lombok.Builder;

/**
 * Caller options for one generation. {@code null} fields fall back to the configured defaults.
 *
 * @param strategy fallback chain or a named backend
 * @param preferredBackend when set, only this backend is tried and its failure propagates
 * @param temperature sampling temperature
 * @param maxTokens maximum output tokens
 */
@Builder
public record GenerationOptions(
    GenerationStrategy strategy,
    BackendId preferredBackend,
    Double temperature,
    Integer maxTokens) {

  public static GenerationOptions defaults() {
    return new GenerationOptions(null, null, null, null);
  }
}
