package com.flamingo.ai.ragengine.service.generation;

/**
 * Outcome of one backend attempt. A successful result has non-blank {@code text} and no {@code
 * error}; a failed one has an {@code error} and no text.
 */
public record GenerationResult(String text, BackendId backend, Throwable error) {

  public static GenerationResult success(BackendId backend, String text) {
    return new GenerationResult(text, backend, null);
  }

  public static GenerationResult failure(BackendId backend, Throwable error) {
    return new GenerationResult(null, backend, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
