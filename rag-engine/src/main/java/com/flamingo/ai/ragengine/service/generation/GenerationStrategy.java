package com.flamingo.ai.ragengine.service.generation;

/** How the router picks a backend: walk the fallback chain or use one named backend. */
public enum GenerationStrategy {
  FALLBACK(null),
  OPENAI(BackendId.OPENAI),
  ANTHROPIC(BackendId.ANTHROPIC),
  GEMINI(BackendId.GEMINI);

  private final BackendId backend;

  GenerationStrategy(BackendId backend) {
    this.backend = backend;
  }

  /** The single backend this strategy targets, or {@code null} for {@link #FALLBACK}. */
  public BackendId getBackend() {
    return backend;
  }
}
