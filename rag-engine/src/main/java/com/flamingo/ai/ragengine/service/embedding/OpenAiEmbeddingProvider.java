package com.flamingo.ai.ragengine.service.embedding;

import com.flamingo.ai.ragengine.config.ProviderProperties;
import com.flamingo.ai.ragengine.exception.ProviderException;
import com.flamingo.ai.ragengine.exception.ProviderUnavailableException;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Embedding provider backed by OpenAI's embedding API through LangChain4j.
 *
 * <p>The {@link EmbeddingModel} bean only exists when an OpenAI key is configured; without it every
 * call fails with {@link ProviderUnavailableException}. Batches go out as a single {@code
 * embedAll} request.
 */
@Service
@Slf4j
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

  static final String PROVIDER = "openai";

  private final EmbeddingModel embeddingModel;
  private final ProviderProperties.OpenAi settings;
  private final MeterRegistry meterRegistry;

  @Autowired
  public OpenAiEmbeddingProvider(
      ObjectProvider<EmbeddingModel> embeddingModel,
      ProviderProperties providerProperties,
      MeterRegistry meterRegistry) {
    this(embeddingModel.getIfAvailable(), providerProperties.getOpenai(), meterRegistry);
  }

  @VisibleForTesting
  OpenAiEmbeddingProvider(
      EmbeddingModel embeddingModel,
      ProviderProperties.OpenAi settings,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.settings = settings;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "embedding.embed", description = "Time to embed a single text")
  @CircuitBreaker(name = "openai")
  public List<Float> embed(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Cannot embed empty text");
    }
    return embedBatch(List.of(text)).get(0);
  }

  @Override
  @Timed(value = "embedding.embedBatch", description = "Time to embed a batch of texts")
  @CircuitBreaker(name = "openai")
  public List<List<Float>> embedBatch(List<String> texts) {
    if (texts == null || texts.isEmpty()) {
      return List.of();
    }
    ensureConfigured();

    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      if (text == null || text.isBlank()) {
        throw new IllegalArgumentException("Cannot embed empty text at position " + i);
      }
      segments.add(TextSegment.from(truncate(text, i)));
    }

    log.debug("Calling OpenAI embedding API for {} texts", segments.size());
    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new ProviderException(PROVIDER, "Embedding request failed: " + e.getMessage(), e);
    }

    List<List<Float>> vectors = toVectors(response, segments.size());
    meterRegistry.counter("embedding.requests.success").increment();
    return vectors;
  }

  @Override
  public int dimensions() {
    return settings.getEmbeddingDimensions();
  }

  private void ensureConfigured() {
    if (!settings.isConfigured() || embeddingModel == null) {
      throw new ProviderUnavailableException(PROVIDER);
    }
  }

  private String truncate(String text, int position) {
    int max = settings.getMaxInputChars();
    if (text.length() <= max) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        position,
        text.length(),
        max);
    return text.substring(0, max);
  }

  private List<List<Float>> toVectors(Response<List<Embedding>> response, int expected) {
    if (response == null || response.content() == null || response.content().isEmpty()) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new ProviderException(PROVIDER, "Embedding response was empty");
    }
    List<Embedding> embeddings = response.content();
    if (embeddings.size() != expected) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new ProviderException(
          PROVIDER,
          "Embedding response has " + embeddings.size() + " vectors for " + expected + " inputs");
    }

    List<List<Float>> vectors = new ArrayList<>(expected);
    for (Embedding embedding : embeddings) {
      if (embedding == null || embedding.vector() == null || embedding.vector().length == 0) {
        meterRegistry.counter("embedding.requests.failure").increment();
        throw new ProviderException(PROVIDER, "Embedding response contained an empty vector");
      }
      vectors.add(toFloatList(embedding.vector()));
    }
    return vectors;
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
