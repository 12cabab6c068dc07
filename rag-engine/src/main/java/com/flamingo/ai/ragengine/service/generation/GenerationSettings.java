package com.flamingo.ai.ragengine.service.generation;

/** Sampling parameters passed to a single backend call. */
public record GenerationSettings(double temperature, int maxTokens) {

  public GenerationSettings {
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be greater than 0");
    }
  }
}
