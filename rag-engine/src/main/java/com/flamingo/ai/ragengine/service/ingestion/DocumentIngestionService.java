package com.flamingo.ai.ragengine.service.ingestion;

import com.flamingo.ai.ragengine.config.RagConfig;
import com.flamingo.ai.ragengine.exception.IndexingException;
import com.flamingo.ai.ragengine.model.DocumentChunk;
import com.flamingo.ai.ragengine.service.chunking.SentenceChunker;
import com.flamingo.ai.ragengine.service.rag.IndexMetadata;
import com.flamingo.ai.ragengine.service.rag.RagService;
import com.flamingo.ai.ragengine.service.vector.VectorFilter;
import com.flamingo.ai.ragengine.service.vector.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns extracted document text into indexed chunks: chunk, optionally merge small chunks, then
 * embed and index through {@link RagService#indexChunks}.
 *
 * <p>{@link #ingestAsync} runs the same work on the {@code documentProcessingExecutor} pool and
 * reports the outcome through the returned future, which completes exceptionally on failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  private final SentenceChunker chunker;
  private final RagService ragService;
  private final VectorIndex vectorIndex;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "ingestion.ingest", description = "Time to chunk and index a document")
  public IngestionResult ingest(IngestionRequest request) {
    if (request.documentId() == null || request.documentId().isBlank()) {
      throw new IllegalArgumentException("Document ID is required");
    }
    long start = System.nanoTime();
    log.info("Ingesting document {} ({} chars)", request.documentId(), length(request.text()));

    try {
      List<DocumentChunk> chunks = chunk(request);
      ragService.indexChunks(
          chunks,
          request.documentId(),
          request.userId(),
          new IndexMetadata(request.fileName(), request.fileType()));

      Duration duration = Duration.ofNanos(System.nanoTime() - start);
      log.info(
          "Ingested document {}: {} chunks in {} ms",
          request.documentId(),
          chunks.size(),
          duration.toMillis());
      meterRegistry.counter("ingestion.success").increment();
      return new IngestionResult(request.documentId(), chunks.size(), duration);
    } catch (RuntimeException e) {
      meterRegistry.counter("ingestion.failure").increment();
      throw e;
    }
  }

  /**
   * Ingests on the document processing pool.
   *
   * @return a future completing with the result, or exceptionally with the ingestion error
   */
  @Async("documentProcessingExecutor")
  public CompletableFuture<IngestionResult> ingestAsync(IngestionRequest request) {
    // ingest() runs here without the @Timed proxy.
    Timer.Sample sample = Timer.start(meterRegistry);
    String outcome = "none";
    try {
      return CompletableFuture.completedFuture(ingest(request));
    } catch (RuntimeException e) {
      outcome = e.getClass().getSimpleName();
      log.error("Failed to ingest document {}: {}", request.documentId(), e.getMessage(), e);
      return CompletableFuture.failedFuture(e);
    } finally {
      sample.stop(
          Timer.builder("ingestion.ingest")
              .description("Time to chunk and index a document")
              .tag("class", getClass().getName())
              .tag("method", "ingestAsync")
              .tag("exception", outcome)
              .register(meterRegistry));
    }
  }

  /** Deletes every indexed chunk of a document. */
  @Timed(value = "ingestion.remove", description = "Time to remove a document's chunks")
  public void removeDocument(String documentId) {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("Document ID is required");
    }
    try {
      vectorIndex.deleteByFilter(VectorFilter.forDocument(documentId));
    } catch (RuntimeException e) {
      throw new IndexingException(documentId, "Failed to remove document: " + e.getMessage(), e);
    }
    log.info("Removed document {} from the index", documentId);
  }

  private List<DocumentChunk> chunk(IngestionRequest request) {
    RagConfig.Chunking config = ragConfig.getChunking();
    List<DocumentChunk> chunks =
        chunker.chunkWithPages(
            request.text(),
            request.pageBreaks(),
            config.getTargetTokens(),
            config.getOverlapTokens(),
            request.documentId());
    if (config.isMergeSmallChunks()) {
      chunks = chunker.mergeSmallChunks(chunks, config.getMinChunkTokens());
    }
    return chunks;
  }

  private static int length(String text) {
    return text == null ? 0 : text.length();
  }
}
