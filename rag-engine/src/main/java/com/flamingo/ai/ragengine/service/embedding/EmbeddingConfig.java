package com.flamingo.ai.ragengine.service.embedding;

import com.flamingo.ai.ragengine.config.ProviderProperties;
import com.flamingo.ai.ragengine.config.RagConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/** Wires the OpenAI embedding model and the cache in front of it. */
@Configuration
@Slf4j
public class EmbeddingConfig {

  @Bean
  @ConditionalOnExpression("!'${providers.openai.api-key:}'.isBlank()")
  public EmbeddingModel embeddingModel(ProviderProperties providerProperties) {
    ProviderProperties.OpenAi openai = providerProperties.getOpenai();
    return OpenAiEmbeddingModel.builder()
        .apiKey(openai.getApiKey())
        .modelName(openai.getEmbeddingModel())
        .dimensions(openai.getEmbeddingDimensions())
        .timeout(openai.getTimeout())
        .build();
  }

  /** The provider the rest of the engine injects: cached unless the cache is disabled. */
  @Bean
  @Primary
  public EmbeddingProvider embeddingProvider(
      OpenAiEmbeddingProvider openAiEmbeddingProvider,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    RagConfig.EmbeddingCache cacheConfig = ragConfig.getEmbeddingCache();
    if (!cacheConfig.isEnabled()) {
      log.info("Embedding cache disabled");
      return openAiEmbeddingProvider;
    }
    Cache<String, List<Float>> cache =
        Caffeine.newBuilder().maximumSize(cacheConfig.getMaximumSize()).build();
    return new CachingEmbeddingProvider(openAiEmbeddingProvider, cache, meterRegistry);
  }
}
