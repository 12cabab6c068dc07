package com.flamingo.ai.ragengine.service.embedding;

import java.util.List;

/** Turns text into fixed-length embedding vectors. */
public interface EmbeddingProvider {

  /**
   * Embeds a single text.
   *
   * @throws com.flamingo.ai.ragengine.exception.ProviderUnavailableException if no credentials are
   *     configured
   * @throws com.flamingo.ai.ragengine.exception.ProviderException if the provider call fails or
   *     returns an unusable response
   */
  List<Float> embed(String text);

  /**
   * Embeds many texts in one provider request. The result has one vector per input, in input
   * order.
   */
  List<List<Float>> embedBatch(List<String> texts);

  /** Length of the vectors this provider returns. */
  int dimensions();
}
