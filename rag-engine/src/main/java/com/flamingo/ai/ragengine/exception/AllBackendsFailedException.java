package com.flamingo.ai.ragengine.exception;

import com.flamingo.ai.ragengine.service.generation.GenerationResult;
import java.util.List;
import java.util.stream.Collectors;

/** Exception thrown when every attempted generation backend failed. */
public class AllBackendsFailedException extends RuntimeException {

  private final List<GenerationResult> attempts;

  public AllBackendsFailedException(List<GenerationResult> attempts) {
    super(describe(attempts));
    this.attempts = List.copyOf(attempts);
    attempts.stream()
        .map(GenerationResult::error)
        .filter(error -> error != null)
        .forEach(this::addSuppressed);
  }

  /** One failed result per backend that was attempted, in attempt order. */
  public List<GenerationResult> getAttempts() {
    return attempts;
  }

  private static String describe(List<GenerationResult> attempts) {
    if (attempts.isEmpty()) {
      return "No generation backend is configured";
    }
    return "All generation backends failed: "
        + attempts.stream()
            .map(
                attempt ->
                    attempt.backend().getId()
                        + " ("
                        + (attempt.error() != null ? attempt.error().getMessage() : "unknown")
                        + ")")
            .collect(Collectors.joining(", "));
  }
}
