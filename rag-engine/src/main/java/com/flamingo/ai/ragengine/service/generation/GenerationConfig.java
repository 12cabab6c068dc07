package com.flamingo.ai.ragengine.service.generation;

import com.flamingo.ai.ragengine.config.RagConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the generation backends into the router in fallback order. */
@Configuration
@Slf4j
public class GenerationConfig {

  @Bean
  public GenerationRouter generationRouter(
      OpenAiGenerationBackend openAi,
      AnthropicGenerationBackend anthropic,
      GeminiGenerationBackend gemini,
      CircuitBreakerRegistry circuitBreakerRegistry,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    GenerationRouter router =
        new GenerationRouter(
            List.of(openAi, anthropic, gemini), circuitBreakerRegistry, ragConfig, meterRegistry);
    log.info("Generation backends available: {}", router.availableBackends());
    return router;
  }
}
