package com.flamingo.ai.ragengine.service.retrieval;

import com.flamingo.ai.ragengine.config.RagConfig;
import com.flamingo.ai.ragengine.model.RetrievedMatch;
import com.flamingo.ai.ragengine.service.query.QueryPreprocessingResult;
import com.flamingo.ai.ragengine.service.query.QueryPreprocessor;
import com.flamingo.ai.ragengine.service.vector.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieves chunks for a query: one semantic top-K query against the vector index, optional
 * keyword re-ranking, then score filtering with a progressive relevance fallback.
 *
 * <p>Hybrid mode only re-orders the candidates the semantic query found; it never adds new ones.
 * Each candidate's score becomes {@code semanticWeight * cosine + keywordWeight * keywordScore}.
 *
 * <p>Filtering keeps matches scoring at least {@code minScore}. When nothing passes but candidates
 * exist, the thresholds {@code minScore * relaxationFactor} and then each configured fallback
 * threshold are tried in order, stopping at the first that keeps a match. If all come up empty the
 * best {@code unfilteredFallbackCount} candidates are returned regardless of score. An empty
 * candidate set yields an empty result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridRetriever {

  private final VectorIndex vectorIndex;
  private final QueryPreprocessor queryPreprocessor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves matches for a preprocessed query.
   *
   * @param query the preprocessed query, supplies the keywords for hybrid scoring
   * @param embedding the query vector
   * @param options retrieval parameters
   * @return selected matches with the cascade stage that produced them
   */
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve chunks for a query")
  public RetrievalResult retrieve(
      QueryPreprocessingResult query, List<Float> embedding, RetrievalOptions options) {
    List<RetrievedMatch> candidates =
        vectorIndex.query(embedding, options.topK(), options.filter());
    if (candidates.isEmpty()) {
      log.warn("Vector index returned no candidates (filter={})", options.filter());
      meterRegistry.counter("retrieval.fallback", "level", FallbackLevel.NONE.name()).increment();
      return RetrievalResult.empty();
    }

    List<RetrievedMatch> scored =
        options.useHybrid() && query.hasKeywords()
            ? blend(candidates, query.keywords(), options)
            : sortDescending(candidates);

    RetrievalResult result = applyThresholds(scored, options.minScore());
    meterRegistry
        .counter("retrieval.fallback", "level", result.fallbackLevel().name())
        .increment();
    return result;
  }

  private List<RetrievedMatch> blend(
      List<RetrievedMatch> candidates, List<String> keywords, RetrievalOptions options) {
    List<RetrievedMatch> blended = new ArrayList<>(candidates.size());
    for (RetrievedMatch candidate : candidates) {
      double keywordScore = queryPreprocessor.calculateKeywordScore(keywords, candidate.text());
      double score =
          options.semanticWeight() * candidate.score() + options.keywordWeight() * keywordScore;
      log.debug(
          "Candidate {}: semantic={} keyword={} blended={}",
          candidate.id(),
          candidate.score(),
          keywordScore,
          score);
      blended.add(candidate.withScore(score));
    }
    return sortDescending(blended);
  }

  private RetrievalResult applyThresholds(List<RetrievedMatch> scored, double minScore) {
    List<RetrievedMatch> primary = atLeast(scored, minScore);
    if (!primary.isEmpty()) {
      return new RetrievalResult(primary, minScore, FallbackLevel.PRIMARY);
    }

    log.warn("No chunks scored above {}; relaxing threshold", minScore);
    for (double threshold : fallbackThresholds(minScore)) {
      List<RetrievedMatch> relaxed = atLeast(scored, threshold);
      if (!relaxed.isEmpty()) {
        log.info("Relaxed threshold {} kept {} chunks", threshold, relaxed.size());
        return new RetrievalResult(relaxed, threshold, FallbackLevel.RELAXED);
      }
    }

    int count = Math.min(ragConfig.getRetrieval().getUnfilteredFallbackCount(), scored.size());
    log.info("No threshold kept a chunk; using top {} candidates regardless of score", count);
    return new RetrievalResult(scored.subList(0, count), null, FallbackLevel.UNFILTERED);
  }

  private List<Double> fallbackThresholds(double minScore) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    List<Double> thresholds = new ArrayList<>();
    thresholds.add(minScore * retrieval.getRelaxationFactor());
    thresholds.addAll(retrieval.getFallbackThresholds());
    return thresholds;
  }

  private static List<RetrievedMatch> atLeast(List<RetrievedMatch> matches, double threshold) {
    return matches.stream().filter(match -> match.score() >= threshold).toList();
  }

  private static List<RetrievedMatch> sortDescending(List<RetrievedMatch> matches) {
    List<RetrievedMatch> sorted = new ArrayList<>(matches);
    sorted.sort(Comparator.comparingDouble(RetrievedMatch::score).reversed());
    return sorted;
  }
}
