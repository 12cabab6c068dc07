package com.flamingo.ai.ragengine.config;

import com.flamingo.ai.ragengine.service.generation.GenerationStrategy;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the RAG pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Generation generation = new Generation();
  private EmbeddingCache embeddingCache = new EmbeddingCache();
  private VectorIndex vectorIndex = new VectorIndex();

  @Getter
  @Setter
  public static class Chunking {
    private int targetTokens = 500;
    private int overlapTokens = 50;

    /** Fold chunks smaller than {@link #minChunkTokens} into their predecessor after splitting. */
    private boolean mergeSmallChunks = false;

    private int minChunkTokens = 100;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private double minScore = 0.3;
    private boolean hybridEnabled = true;
    private double semanticWeight = 0.7;
    private double keywordWeight = 0.3;

    /** First relaxed threshold is {@code minScore * relaxationFactor}. */
    private double relaxationFactor = 0.5;

    /** Absolute thresholds tried after the relative one, in order. */
    private List<Double> fallbackThresholds = new ArrayList<>(List.of(0.1, 0.05));

    /** Candidates returned regardless of score when every threshold comes up empty. */
    private int unfilteredFallbackCount = 3;
  }

  @Getter
  @Setter
  public static class Generation {
    private GenerationStrategy strategy = GenerationStrategy.FALLBACK;
    private double temperature = 0.7;
    private int maxTokens = 2000;
  }

  @Getter
  @Setter
  public static class EmbeddingCache {
    private boolean enabled = true;
    private long maximumSize = 10_000;
  }

  @Getter
  @Setter
  public static class VectorIndex {
    /** Backing store: "elasticsearch" (default) or "in-memory". */
    private String type = "elasticsearch";

    private String indexName = "rag-chunks";
    private int dimensions = 1536;
  }
}
