package com.flamingo.ai.ragengine.service.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-through cache in front of another {@link EmbeddingProvider}, keyed by exact text.
 *
 * <p>A miss calls the delegate and writes the vector back. Batch calls embed only the texts that
 * are not cached, still as one delegate request. Failed calls cache nothing. Cached vectors are
 * stored and returned as unmodifiable copies.
 */
@Slf4j
@RequiredArgsConstructor
public class CachingEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingProvider delegate;
  private final Cache<String, List<Float>> cache;
  private final MeterRegistry meterRegistry;

  @Override
  public List<Float> embed(String text) {
    List<Float> cached = text == null ? null : cache.getIfPresent(text);
    if (cached != null) {
      log.debug("Embedding cache hit ({} chars)", text.length());
      meterRegistry.counter("embedding.cache.hit").increment();
      return cached;
    }

    meterRegistry.counter("embedding.cache.miss").increment();
    List<Float> vector = List.copyOf(delegate.embed(text));
    cache.put(text, vector);
    return vector;
  }

  @Override
  public List<List<Float>> embedBatch(List<String> texts) {
    if (texts == null || texts.isEmpty()) {
      return List.of();
    }
    if (texts.contains(null)) {
      throw new IllegalArgumentException("Cannot embed null text");
    }

    Map<String, List<Float>> vectors = new HashMap<>(cache.getAllPresent(texts));
    List<String> misses = new ArrayList<>();
    for (String text : new LinkedHashSet<>(texts)) {
      if (!vectors.containsKey(text)) {
        misses.add(text);
      }
    }

    long hits = texts.stream().filter(vectors::containsKey).count();
    meterRegistry.counter("embedding.cache.hit").increment(hits);
    meterRegistry.counter("embedding.cache.miss").increment(texts.size() - hits);
    log.debug("Embedding cache: {} hits, {} distinct misses", hits, misses.size());

    if (!misses.isEmpty()) {
      List<List<Float>> fresh = delegate.embedBatch(misses);
      for (int i = 0; i < misses.size(); i++) {
        List<Float> vector = List.copyOf(fresh.get(i));
        cache.put(misses.get(i), vector);
        vectors.put(misses.get(i), vector);
      }
    }

    List<List<Float>> result = new ArrayList<>(texts.size());
    for (String text : texts) {
      result.add(vectors.get(text));
    }
    return result;
  }

  @Override
  public int dimensions() {
    return delegate.dimensions();
  }
}
