package com.flamingo.ai.ragengine.service.ingestion;

import java.util.List;
import lombok.Builder;

/**
 * A document's extracted text to be chunked and indexed.
 *
 * @param documentId owning document
 * @param userId owning user
 * @param text full extracted text
 * @param pageBreaks ascending offsets where new pages begin, empty when not page-aware
 * @param fileName original file name, optional
 * @param fileType MIME type or extension, optional
 */
@Builder
public record IngestionRequest(
    String documentId,
    String userId,
    String text,
    List<Integer> pageBreaks,
    String fileName,
    String fileType) {

  public IngestionRequest {
    pageBreaks = pageBreaks == null ? List.of() : List.copyOf(pageBreaks);
  }
}
