package com.flamingo.ai.ragengine.service.rag;

import com.flamingo.ai.ragengine.config.RagConfig;
import com.flamingo.ai.ragengine.exception.AllBackendsFailedException;
import com.flamingo.ai.ragengine.exception.IndexingException;
import com.flamingo.ai.ragengine.exception.InvalidQueryException;
import com.flamingo.ai.ragengine.exception.NoRelevantContentException;
import com.flamingo.ai.ragengine.exception.ProviderException;
import com.flamingo.ai.ragengine.model.AnswerStatus;
import com.flamingo.ai.ragengine.model.ChunkMetadata;
import com.flamingo.ai.ragengine.model.DocumentChunk;
import com.flamingo.ai.ragengine.model.RagResult;
import com.flamingo.ai.ragengine.model.RagSource;
import com.flamingo.ai.ragengine.service.embedding.EmbeddingProvider;
import com.flamingo.ai.ragengine.service.generation.GenerationOptions;
import com.flamingo.ai.ragengine.service.generation.GenerationResult;
import com.flamingo.ai.ragengine.service.generation.GenerationRouter;
import com.flamingo.ai.ragengine.service.query.QueryPreprocessingResult;
import com.flamingo.ai.ragengine.service.query.QueryPreprocessor;
import com.flamingo.ai.ragengine.service.retrieval.HybridRetriever;
import com.flamingo.ai.ragengine.service.retrieval.RetrievalOptions;
import com.flamingo.ai.ragengine.service.retrieval.RetrievalResult;
import com.flamingo.ai.ragengine.service.vector.VectorFilter;
import com.flamingo.ai.ragengine.service.vector.VectorIndex;
import com.flamingo.ai.ragengine.service.vector.VectorRecord;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the engine: indexes document chunks and answers questions over them.
 *
 * <p>Answering runs preprocess, embed, retrieve, prompt and generate in sequence. Generation
 * failures are absorbed: the caller then gets the retrieved context itself as the answer with
 * status {@link AnswerStatus#CONTEXT_ONLY}. Every other failure propagates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RagService {

  private final EmbeddingProvider embeddingProvider;
  private final VectorIndex vectorIndex;
  private final QueryPreprocessor queryPreprocessor;
  private final HybridRetriever hybridRetriever;
  private final GenerationRouter generationRouter;
  private final RagPromptBuilder promptBuilder;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Answers {@code query} from the indexed chunks.
   *
   * @param query the user's question
   * @param options filters and tuning; {@code null} uses the defaults
   * @return the answer with its sources and context
   * @throws InvalidQueryException if the query is blank
   * @throws NoRelevantContentException if the index holds no candidate chunk for the query
   * @throws ProviderException if embedding or vector search fails
   */
  @Timed(value = "rag.answer", description = "Time to answer a question")
  public RagResult answer(String query, RagQueryOptions options) {
    if (query == null || query.isBlank()) {
      throw new InvalidQueryException("Query must not be empty");
    }
    RagQueryOptions effective = options != null ? options : RagQueryOptions.defaults();

    QueryPreprocessingResult preprocessed = queryPreprocessor.preprocess(query);
    log.info("Answering query, keywords: {}", preprocessed.keywords());

    List<Float> embedding = embeddingProvider.embed(query);
    RetrievalResult retrieval =
        hybridRetriever.retrieve(preprocessed, embedding, toRetrievalOptions(effective));
    if (retrieval.isEmpty()) {
      meterRegistry.counter("rag.no_relevant_content").increment();
      throw new NoRelevantContentException("No relevant document chunks found for the query");
    }

    List<RagSource> sources = retrieval.matches().stream().map(RagSource::from).toList();
    String context = promptBuilder.buildContext(retrieval.matches());
    String prompt = promptBuilder.buildPrompt(query, context);

    RagResult result = generate(prompt, context, sources, effective.getGenerationOptions());
    meterRegistry.counter("rag.answer.completed", "status", result.status().name()).increment();
    return result;
  }

  public RagResult answer(String query) {
    return answer(query, RagQueryOptions.defaults());
  }

  /**
   * Embeds and stores the chunks of one document. Vector ids are {@code
   * <documentId>-chunk-<chunkIndex>}, so re-indexing a document replaces its chunks.
   *
   * @throws IllegalArgumentException if the document or user id is blank
   * @throws IndexingException if embedding or the index write fails
   */
  @Timed(value = "rag.indexChunks", description = "Time to embed and index document chunks")
  public void indexChunks(
      List<DocumentChunk> chunks, String documentId, String userId, IndexMetadata metadata) {
    if (chunks == null || chunks.isEmpty()) {
      return;
    }
    if (documentId == null || documentId.isBlank() || userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("Document ID and User ID are required");
    }
    IndexMetadata indexMetadata = metadata != null ? metadata : IndexMetadata.none();

    try {
      List<String> texts = chunks.stream().map(DocumentChunk::text).toList();
      List<List<Float>> embeddings = embeddingProvider.embedBatch(texts);
      if (embeddings.size() != chunks.size()) {
        throw new IndexingException(
            documentId,
            String.format(
                "Mismatch between chunks (%d) and embeddings (%d)",
                chunks.size(), embeddings.size()));
      }

      Instant createdAt = Instant.now();
      List<VectorRecord> records = new ArrayList<>(chunks.size());
      for (int i = 0; i < chunks.size(); i++) {
        DocumentChunk chunk = chunks.get(i);
        records.add(
            new VectorRecord(
                vectorId(documentId, chunk.chunkIndex()),
                embeddings.get(i),
                toMetadata(chunk, documentId, userId, indexMetadata, createdAt)));
      }
      vectorIndex.upsert(records);
      log.info("Indexed {} chunks for document {}", records.size(), documentId);
    } catch (IndexingException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to index chunks for document {}: {}", documentId, e.getMessage(), e);
      throw new IndexingException(
          documentId, "Failed to index document chunks: " + e.getMessage(), e);
    }
  }

  static String vectorId(String documentId, int chunkIndex) {
    return documentId + "-chunk-" + chunkIndex;
  }

  private RagResult generate(
      String prompt, String context, List<RagSource> sources, GenerationOptions options) {
    try {
      GenerationResult generated = generationRouter.generate(prompt, options);
      return new RagResult(
          generated.text(), sources, context, generated.backend(), AnswerStatus.GENERATED);
    } catch (ProviderException | AllBackendsFailedException e) {
      log.warn("Generation failed, returning context-only answer: {}", e.getMessage());
      meterRegistry.counter("rag.answer.context_only").increment();
      return new RagResult(context, sources, context, null, AnswerStatus.CONTEXT_ONLY);
    }
  }

  private RetrievalOptions toRetrievalOptions(RagQueryOptions options) {
    RagConfig.Retrieval defaults = ragConfig.getRetrieval();
    return RetrievalOptions.builder()
        .topK(options.getTopK() != null ? options.getTopK() : defaults.getTopK())
        .minScore(options.getMinScore() != null ? options.getMinScore() : defaults.getMinScore())
        .useHybrid(
            options.getUseHybrid() != null ? options.getUseHybrid() : defaults.isHybridEnabled())
        .semanticWeight(
            options.getSemanticWeight() != null
                ? options.getSemanticWeight()
                : defaults.getSemanticWeight())
        .keywordWeight(
            options.getKeywordWeight() != null
                ? options.getKeywordWeight()
                : defaults.getKeywordWeight())
        .filter(new VectorFilter(options.getDocumentIds(), options.getUserId()))
        .build();
  }

  private static ChunkMetadata toMetadata(
      DocumentChunk chunk,
      String documentId,
      String userId,
      IndexMetadata metadata,
      Instant createdAt) {
    return ChunkMetadata.builder()
        .text(chunk.text())
        .documentId(documentId)
        .userId(userId)
        .chunkIndex(chunk.chunkIndex())
        .startChar(chunk.startChar())
        .endChar(chunk.endChar())
        .pageNumber(chunk.pageNumber())
        .fileName(metadata.fileName())
        .fileType(metadata.fileType())
        .createdAt(createdAt)
        .build();
  }
}
