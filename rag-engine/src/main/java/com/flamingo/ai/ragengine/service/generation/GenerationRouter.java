package com.flamingo.ai.ragengine.service.generation;

import com.flamingo.ai.ragengine.config.RagConfig;
import com.flamingo.ai.ragengine.exception.AllBackendsFailedException;
import com.flamingo.ai.ragengine.exception.ProviderException;
import com.flamingo.ai.ragengine.exception.ProviderUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches a prompt to the generation backends.
 *
 * <p>With a preferred backend, or a strategy naming one, only that backend is tried and its
 * failure propagates. Otherwise backends are tried one after another in {@link BackendId} order;
 * unconfigured ones are skipped, a failure moves on to the next, and the first success is
 * returned. When every attempted backend failed an {@link AllBackendsFailedException} carries the
 * individual failures.
 *
 * <p>Each backend call runs inside its own circuit breaker ({@code generation-<id>}); an open
 * circuit counts as that backend failing. A backend is never retried against itself.
 */
@Slf4j
public class GenerationRouter {

  private final List<GenerationBackend> backends;
  private final CircuitBreakerRegistry circuitBreakerRegistry;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public GenerationRouter(
      List<GenerationBackend> backends,
      CircuitBreakerRegistry circuitBreakerRegistry,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.backends = backends.stream().sorted(Comparator.comparing(GenerationBackend::id)).toList();
    this.circuitBreakerRegistry = circuitBreakerRegistry;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Generates text for {@code prompt}.
   *
   * @return the successful result
   * @throws ProviderException if a single targeted backend fails or is not configured
   * @throws AllBackendsFailedException if the fallback chain is exhausted
   */
  public GenerationResult generate(String prompt, GenerationOptions options) {
    if (prompt == null || prompt.isBlank()) {
      throw new IllegalArgumentException("Prompt must not be empty");
    }
    GenerationOptions effective = options != null ? options : GenerationOptions.defaults();
    GenerationSettings settings = resolveSettings(effective);

    BackendId target = resolveTarget(effective);
    if (target != null) {
      GenerationBackend backend = backend(target);
      if (!backend.isConfigured()) {
        throw new ProviderUnavailableException(target.getId());
      }
      log.info("Generating with {} (no fallback)", target.getId());
      return attempt(backend, prompt, settings);
    }

    List<GenerationResult> failures = new ArrayList<>();
    for (GenerationBackend backend : backends) {
      if (!backend.isConfigured()) {
        log.debug("Skipping unconfigured backend {}", backend.id().getId());
        continue;
      }
      try {
        GenerationResult result = attempt(backend, prompt, settings);
        log.info("Generated answer with {}", backend.id().getId());
        return result;
      } catch (ProviderException e) {
        log.warn("Backend {} failed, trying next: {}", backend.id().getId(), e.getMessage());
        failures.add(GenerationResult.failure(backend.id(), e));
      }
    }

    throw new AllBackendsFailedException(failures);
  }

  /** Configured backends in fallback order. */
  public List<BackendId> availableBackends() {
    return backends.stream()
        .filter(GenerationBackend::isConfigured)
        .map(GenerationBackend::id)
        .toList();
  }

  private GenerationResult attempt(
      GenerationBackend backend, String prompt, GenerationSettings settings) {
    String backendId = backend.id().getId();
    CircuitBreaker circuitBreaker =
        circuitBreakerRegistry.circuitBreaker("generation-" + backendId);
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      String text = circuitBreaker.executeSupplier(() -> backend.generate(prompt, settings));
      if (text == null || text.isBlank()) {
        throw new ProviderException(backendId, "Generation response contained no text");
      }
      record(sample, backendId, "success");
      return GenerationResult.success(backend.id(), text);
    } catch (ProviderException e) {
      record(sample, backendId, "failure");
      throw e;
    } catch (CallNotPermittedException e) {
      record(sample, backendId, "rejected");
      throw new ProviderException(backendId, "Circuit breaker is open", e);
    } catch (RuntimeException e) {
      record(sample, backendId, "failure");
      throw new ProviderException(backendId, "Generation failed: " + e.getMessage(), e);
    }
  }

  private void record(Timer.Sample sample, String backendId, String outcome) {
    sample.stop(meterRegistry.timer("generation.duration", "backend", backendId));
    meterRegistry
        .counter("generation.attempt", "backend", backendId, "outcome", outcome)
        .increment();
  }

  private BackendId resolveTarget(GenerationOptions options) {
    if (options.preferredBackend() != null) {
      return options.preferredBackend();
    }
    GenerationStrategy strategy =
        options.strategy() != null ? options.strategy() : ragConfig.getGeneration().getStrategy();
    return strategy != null ? strategy.getBackend() : null;
  }

  private GenerationSettings resolveSettings(GenerationOptions options) {
    RagConfig.Generation defaults = ragConfig.getGeneration();
    return new GenerationSettings(
        options.temperature() != null ? options.temperature() : defaults.getTemperature(),
        options.maxTokens() != null ? options.maxTokens() : defaults.getMaxTokens());
  }

  private GenerationBackend backend(BackendId id) {
    return backends.stream()
        .filter(backend -> backend.id() == id)
        .findFirst()
        .orElseThrow(() -> new ProviderUnavailableException(id.getId()));
  }
}
