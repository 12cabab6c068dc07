package com.flamingo.ai.ragengine.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ragengine.config.RagConfig;
import com.flamingo.ai.ragengine.exception.AllBackendsFailedException;
import com.flamingo.ai.ragengine.exception.ProviderException;
import com.flamingo.ai.ragengine.exception.ProviderUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GenerationRouterTest {

  private static final String PROMPT = "Answer the question.";

  @Mock private GenerationBackend openAi;
  @Mock private GenerationBackend anthropic;
  @Mock private GenerationBackend gemini;

  private CircuitBreakerRegistry circuitBreakerRegistry;
  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private GenerationRouter router;

  @BeforeEach
  void setUp() {
    lenient().when(openAi.id()).thenReturn(BackendId.OPENAI);
    lenient().when(anthropic.id()).thenReturn(BackendId.ANTHROPIC);
    lenient().when(gemini.id()).thenReturn(BackendId.GEMINI);
    lenient().when(openAi.isConfigured()).thenReturn(true);
    lenient().when(anthropic.isConfigured()).thenReturn(true);
    lenient().when(gemini.isConfigured()).thenReturn(true);

    circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    // deliberately out of order; the router sorts by backend id
    router =
        new GenerationRouter(
            List.of(gemini, openAi, anthropic), circuitBreakerRegistry, ragConfig, meterRegistry);
  }

  @Nested
  @DisplayName("fallback chain")
  class FallbackTests {

    @Test
    @DisplayName("should return the first backend's answer")
    void shouldUseFirstBackend() {
      when(openAi.generate(anyString(), any())).thenReturn("from openai");

      GenerationResult result = router.generate(PROMPT, GenerationOptions.defaults());

      assertThat(result.text()).isEqualTo("from openai");
      assertThat(result.backend()).isEqualTo(BackendId.OPENAI);
      assertThat(result.isSuccess()).isTrue();
      verify(anthropic, never()).generate(anyString(), any());
    }

    @Test
    @DisplayName("should move to the next backend after a failure and stop at the first success")
    void shouldFallBackOnFailure() {
      when(openAi.generate(anyString(), any()))
          .thenThrow(new ProviderException("openai", "rate limited"));
      when(anthropic.generate(anyString(), any())).thenReturn("from anthropic");

      GenerationResult result = router.generate(PROMPT, null);

      assertThat(result.backend()).isEqualTo(BackendId.ANTHROPIC);
      assertThat(result.text()).isEqualTo("from anthropic");
      verify(gemini, never()).generate(anyString(), any());
    }

    @Test
    @DisplayName("should treat a blank response as a failure")
    void shouldTreatBlankAsFailure() {
      when(openAi.generate(anyString(), any())).thenReturn("   ");
      when(anthropic.generate(anyString(), any())).thenReturn("real answer");

      GenerationResult result = router.generate(PROMPT, null);

      assertThat(result.backend()).isEqualTo(BackendId.ANTHROPIC);
    }

    @Test
    @DisplayName("should wrap unexpected exceptions and keep falling back")
    void shouldWrapUnexpectedExceptions() {
      when(openAi.generate(anyString(), any())).thenThrow(new IllegalStateException("boom"));
      when(anthropic.generate(anyString(), any())).thenReturn("ok");

      assertThat(router.generate(PROMPT, null).backend()).isEqualTo(BackendId.ANTHROPIC);
    }

    @Test
    @DisplayName("should skip unconfigured backends without counting them as attempts")
    void shouldSkipUnconfigured() {
      when(openAi.isConfigured()).thenReturn(false);
      when(anthropic.isConfigured()).thenReturn(false);
      when(gemini.generate(anyString(), any())).thenReturn("from gemini");

      GenerationResult result = router.generate(PROMPT, null);

      assertThat(result.backend()).isEqualTo(BackendId.GEMINI);
      verify(openAi, never()).generate(anyString(), any());
    }

    @Test
    @DisplayName("should report every attempted failure in order when all fail")
    void shouldThrowWhenAllFail() {
      when(openAi.generate(anyString(), any())).thenThrow(new ProviderException("openai", "a"));
      when(anthropic.generate(anyString(), any()))
          .thenThrow(new ProviderException("anthropic", "b"));
      when(gemini.generate(anyString(), any())).thenThrow(new ProviderException("gemini", "c"));

      assertThatThrownBy(() -> router.generate(PROMPT, null))
          .isInstanceOfSatisfying(
              AllBackendsFailedException.class,
              e -> {
                assertThat(e.getAttempts())
                    .extracting(GenerationResult::backend)
                    .containsExactly(BackendId.OPENAI, BackendId.ANTHROPIC, BackendId.GEMINI);
                assertThat(e.getAttempts()).noneMatch(GenerationResult::isSuccess);
              });
    }

    @Test
    @DisplayName("should fail with no attempts when nothing is configured")
    void shouldThrowWhenNothingConfigured() {
      when(openAi.isConfigured()).thenReturn(false);
      when(anthropic.isConfigured()).thenReturn(false);
      when(gemini.isConfigured()).thenReturn(false);

      assertThatThrownBy(() -> router.generate(PROMPT, null))
          .isInstanceOfSatisfying(
              AllBackendsFailedException.class, e -> assertThat(e.getAttempts()).isEmpty());
    }

    @Test
    @DisplayName("should treat an open circuit as a failure of that backend")
    void shouldSkipOpenCircuit() {
      circuitBreakerRegistry.circuitBreaker("generation-openai").transitionToOpenState();
      when(anthropic.generate(anyString(), any())).thenReturn("from anthropic");

      GenerationResult result = router.generate(PROMPT, null);

      assertThat(result.backend()).isEqualTo(BackendId.ANTHROPIC);
      verify(openAi, never()).generate(anyString(), any());
      assertThat(
              meterRegistry
                  .counter("generation.attempt", "backend", "openai", "outcome", "rejected")
                  .count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("targeted backend")
  class TargetedTests {

    @Test
    @DisplayName("should propagate a preferred backend's failure without falling back")
    void shouldNotFallBackFromPreferred() {
      when(anthropic.generate(anyString(), any()))
          .thenThrow(new ProviderException("anthropic", "overloaded"));
      GenerationOptions options =
          GenerationOptions.builder().preferredBackend(BackendId.ANTHROPIC).build();

      assertThatThrownBy(() -> router.generate(PROMPT, options))
          .isInstanceOf(ProviderException.class)
          .hasMessageContaining("overloaded");
      verify(openAi, never()).generate(anyString(), any());
      verify(gemini, never()).generate(anyString(), any());
    }

    @Test
    @DisplayName("should fail fast when the preferred backend is not configured")
    void shouldFailForUnconfiguredPreferred() {
      when(gemini.isConfigured()).thenReturn(false);
      GenerationOptions options =
          GenerationOptions.builder().preferredBackend(BackendId.GEMINI).build();

      assertThatThrownBy(() -> router.generate(PROMPT, options))
          .isInstanceOf(ProviderUnavailableException.class);
      verify(openAi, never()).generate(anyString(), any());
    }

    @Test
    @DisplayName("should use only the backend named by the strategy")
    void shouldUseStrategyBackend() {
      when(gemini.generate(anyString(), any())).thenReturn("from gemini");
      GenerationOptions options =
          GenerationOptions.builder().strategy(GenerationStrategy.GEMINI).build();

      assertThat(router.generate(PROMPT, options).backend()).isEqualTo(BackendId.GEMINI);
      verify(openAi, never()).generate(anyString(), any());
    }

    @Test
    @DisplayName("should use the configured strategy when the caller sets none")
    void shouldUseConfiguredStrategy() {
      ragConfig.getGeneration().setStrategy(GenerationStrategy.ANTHROPIC);
      when(anthropic.generate(anyString(), any()))
          .thenThrow(new ProviderException("anthropic", "down"));

      assertThatThrownBy(() -> router.generate(PROMPT, null))
          .isInstanceOf(ProviderException.class)
          .isNotInstanceOf(AllBackendsFailedException.class);
      verify(openAi, never()).generate(anyString(), any());
    }
  }

  @Nested
  @DisplayName("settings")
  class SettingsTests {

    @Test
    @DisplayName("should apply configured defaults")
    void shouldApplyDefaults() {
      when(openAi.generate(anyString(), any())).thenReturn("ok");

      router.generate(PROMPT, null);

      ArgumentCaptor<GenerationSettings> captor = ArgumentCaptor.forClass(GenerationSettings.class);
      verify(openAi).generate(eq(PROMPT), captor.capture());
      assertThat(captor.getValue().temperature()).isEqualTo(0.7);
      assertThat(captor.getValue().maxTokens()).isEqualTo(2000);
    }

    @Test
    @DisplayName("should apply caller overrides")
    void shouldApplyOverrides() {
      when(openAi.generate(anyString(), any())).thenReturn("ok");
      GenerationOptions options =
          GenerationOptions.builder().temperature(0.1).maxTokens(64).build();

      router.generate(PROMPT, options);

      ArgumentCaptor<GenerationSettings> captor = ArgumentCaptor.forClass(GenerationSettings.class);
      verify(openAi).generate(anyString(), captor.capture());
      assertThat(captor.getValue()).isEqualTo(new GenerationSettings(0.1, 64));
    }

    @Test
    @DisplayName("should reject a blank prompt")
    void shouldRejectBlankPrompt() {
      assertThatThrownBy(() -> router.generate(" ", null))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  @DisplayName("should list configured backends in fallback order")
  void shouldListAvailableBackends() {
    when(anthropic.isConfigured()).thenReturn(false);

    assertThat(router.availableBackends()).containsExactly(BackendId.OPENAI, BackendId.GEMINI);
  }

  @Test
  @DisplayName("should record attempt outcomes per backend")
  void shouldRecordMetrics() {
    when(openAi.generate(anyString(), any())).thenThrow(new ProviderException("openai", "x"));
    when(anthropic.generate(anyString(), any())).thenReturn("ok");

    router.generate(PROMPT, null);

    assertThat(
            meterRegistry
                .counter("generation.attempt", "backend", "openai", "outcome", "failure")
                .count())
        .isEqualTo(1.0);
    assertThat(
            meterRegistry
                .counter("generation.attempt", "backend", "anthropic", "outcome", "success")
                .count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.timer("generation.duration", "backend", "anthropic").count())
        .isEqualTo(1);
  }
}
