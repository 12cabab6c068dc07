package com.flamingo.ai.ragengine.service.rag;

import com.flamingo.ai.ragengine.service.generation.GenerationOptions;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Options for {@link RagService#answer}. Unset fields use the values from {@code RagConfig}. */
@Value
@Builder(toBuilder = true)
public class RagQueryOptions {

  /** Restrict retrieval to these documents. */
  List<String> documentIds;

  /** Restrict retrieval to chunks owned by this user. */
  String userId;

  Integer topK;
  Double minScore;
  Boolean useHybrid;
  Double semanticWeight;
  Double keywordWeight;
  GenerationOptions generationOptions;

  public static RagQueryOptions defaults() {
    return RagQueryOptions.builder().build();
  }
}
