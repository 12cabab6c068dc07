package com.flamingo.ai.ragengine.service.generation;

/** A text-generation provider the router can dispatch to. */
public interface GenerationBackend {

  BackendId id();

  /** Whether credentials are available. Unconfigured backends are never called. */
  boolean isConfigured();

  /**
   * Generates a completion for {@code prompt}.
   *
   * @return the generated text
   * @throws com.flamingo.ai.ragengine.exception.ProviderException on any provider failure
   */
  String generate(String prompt, GenerationSettings settings);
}
