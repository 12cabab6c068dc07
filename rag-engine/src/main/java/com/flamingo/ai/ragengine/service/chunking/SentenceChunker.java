package com.flamingo.ai.ragengine.service.chunking;

import com.flamingo.ai.ragengine.exception.InvalidChunkingParameterException;
import com.flamingo.ai.ragengine.model.DocumentChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits extracted document text into overlapping, sentence-bounded chunks sized by estimated
 * token count.
 *
 * <p>Sentences are accumulated greedily into a buffer. When the next sentence would push the
 * buffer over the target size, the buffer is emitted as a chunk and the next buffer starts with
 * the trailing {@code overlapTokens / targetTokens} fraction of the emitted buffer's characters.
 * Chunks therefore never exceed the target by more than one sentence.
 *
 * <p>Token counts are estimated as {@code ceil(chars / 4)}; no tokenizer is involved. The class is
 * stateless and safe for concurrent use.
 */
@Service
@Slf4j
public class SentenceChunker {

  public static final int DEFAULT_TARGET_TOKENS = 500;
  public static final int DEFAULT_OVERLAP_TOKENS = 50;
  public static final int DEFAULT_MIN_CHUNK_TOKENS = 100;

  private static final int CHARS_PER_TOKEN = 4;

  /** A run of non-terminal characters closed by terminal punctuation or by the end of input. */
  private static final Pattern SENTENCE = Pattern.compile("[^.!?]+(?:[.!?]+|$)");

  /** Estimated token count of {@code text}: {@code ceil(length / 4)}. */
  public static int estimateTokens(CharSequence text) {
    if (text == null) {
      return 0;
    }
    return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }

  public List<DocumentChunk> chunk(String text) {
    return chunk(text, DEFAULT_TARGET_TOKENS, DEFAULT_OVERLAP_TOKENS, null);
  }

  public List<DocumentChunk> chunk(String text, int targetTokens, int overlapTokens) {
    return chunk(text, targetTokens, overlapTokens, null);
  }

  /**
   * Chunks {@code text} into sentence-bounded segments.
   *
   * @param text the extracted document text
   * @param targetTokens maximum estimated tokens per chunk before a new chunk is started
   * @param overlapTokens tokens carried from the end of one chunk into the next
   * @param documentId optional document id stamped on every chunk
   * @return chunks with contiguous zero-based indexes, empty for blank input
   * @throws InvalidChunkingParameterException if the sizes are inconsistent
   */
  public List<DocumentChunk> chunk(
      String text, int targetTokens, int overlapTokens, String documentId) {
    validateSizes(targetTokens, overlapTokens);
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<DocumentChunk> chunks = chunkSlice(text, 0, targetTokens, overlapTokens, null, documentId);
    log.debug(
        "Chunked {} chars into {} chunks (target={}, overlap={})",
        text.length(),
        chunks.size(),
        targetTokens,
        overlapTokens);
    return chunks;
  }

  /**
   * Page-aware variant: slices {@code text} at the given page boundaries, chunks each page on its
   * own and renumbers the chunks globally. Offsets stay relative to the full text.
   *
   * @param text the extracted document text
   * @param pageBreaks ascending character offsets where a new page begins
   * @param targetTokens maximum estimated tokens per chunk
   * @param overlapTokens tokens carried between consecutive chunks of the same page
   * @param documentId optional document id stamped on every chunk
   * @return chunks tagged with their 1-based page number
   */
  public List<DocumentChunk> chunkWithPages(
      String text,
      List<Integer> pageBreaks,
      int targetTokens,
      int overlapTokens,
      String documentId) {
    if (pageBreaks == null || pageBreaks.isEmpty()) {
      return chunk(text, targetTokens, overlapTokens, documentId);
    }
    validateSizes(targetTokens, overlapTokens);
    if (text == null || text.isBlank()) {
      return List.of();
    }
    validatePageBreaks(pageBreaks, text.length());

    List<DocumentChunk> result = new ArrayList<>();
    int pageStart = 0;
    int pageNumber = 1;
    for (int pageBreak : pageBreaks) {
      appendPage(
          result,
          text,
          pageStart,
          pageBreak,
          pageNumber++,
          targetTokens,
          overlapTokens,
          documentId);
      pageStart = pageBreak;
    }
    if (pageStart < text.length()) {
      appendPage(
          result,
          text,
          pageStart,
          text.length(),
          pageNumber,
          targetTokens,
          overlapTokens,
          documentId);
    }

    log.debug("Chunked {} pages into {} chunks", pageNumber, result.size());
    return result;
  }

  /**
   * Folds every chunk smaller than {@code minChunkTokens} into the chunk before it, then
   * renumbers. A small first chunk has nothing to merge into and is kept.
   */
  public List<DocumentChunk> mergeSmallChunks(List<DocumentChunk> chunks, int minChunkTokens) {
    if (minChunkTokens < 0) {
      throw new InvalidChunkingParameterException(
          "minChunkTokens", "Minimum chunk size must be non-negative");
    }
    if (chunks == null || chunks.isEmpty()) {
      return List.of();
    }

    List<DocumentChunk> merged = new ArrayList<>();
    DocumentChunk current = null;
    for (DocumentChunk chunk : chunks) {
      if (current != null && estimateTokens(chunk.text()) < minChunkTokens) {
        current =
            current.toBuilder()
                .text(current.text() + " " + chunk.text())
                .endChar(chunk.endChar())
                .build();
      } else {
        if (current != null) {
          merged.add(current);
        }
        current = chunk;
      }
    }
    merged.add(current);

    List<DocumentChunk> renumbered = new ArrayList<>(merged.size());
    for (int i = 0; i < merged.size(); i++) {
      renumbered.add(merged.get(i).toBuilder().chunkIndex(i).build());
    }
    if (renumbered.size() < chunks.size()) {
      log.debug("Merged {} chunks into {}", chunks.size(), renumbered.size());
    }
    return renumbered;
  }

  private void appendPage(
      List<DocumentChunk> result,
      String text,
      int start,
      int end,
      int pageNumber,
      int targetTokens,
      int overlapTokens,
      String documentId) {
    String page = text.substring(start, end);
    if (page.isBlank()) {
      return;
    }
    for (DocumentChunk chunk :
        chunkSlice(page, start, targetTokens, overlapTokens, pageNumber, documentId)) {
      result.add(chunk.toBuilder().chunkIndex(result.size()).build());
    }
  }

  /** Chunks {@code slice}, whose first character sits at {@code offset} in the original text. */
  private List<DocumentChunk> chunkSlice(
      String slice,
      int offset,
      int targetTokens,
      int overlapTokens,
      Integer pageNumber,
      String documentId) {
    if (estimateTokens(slice) <= targetTokens) {
      return List.of(
          new DocumentChunk(
              slice.trim(), 0, offset, offset + slice.length(), pageNumber, documentId));
    }

    List<DocumentChunk> chunks = new ArrayList<>();
    StringBuilder buffer = new StringBuilder();
    int bufferStart = 0;

    Matcher matcher = SENTENCE.matcher(slice);
    while (matcher.find()) {
      String sentence = matcher.group();
      boolean overflows =
          buffer.length() > 0
              && estimateTokens(buffer) + estimateTokens(sentence) > targetTokens;
      if (overflows) {
        emit(chunks, buffer, offset + bufferStart, pageNumber, documentId);

        int overlapChars =
            (int) Math.floor((double) overlapTokens / targetTokens * buffer.length());
        String carried = overlapChars > 0 ? buffer.substring(buffer.length() - overlapChars) : "";
        buffer.setLength(0);
        buffer.append(carried).append(sentence);
        bufferStart = matcher.start() - carried.length();
      } else {
        if (buffer.length() == 0) {
          bufferStart = matcher.start();
        }
        buffer.append(sentence);
      }
    }
    emit(chunks, buffer, offset + bufferStart, pageNumber, documentId);
    return chunks;
  }

  private void emit(
      List<DocumentChunk> chunks,
      StringBuilder buffer,
      int startChar,
      Integer pageNumber,
      String documentId) {
    String text = buffer.toString().trim();
    if (text.isEmpty()) {
      return;
    }
    chunks.add(
        new DocumentChunk(
            text, chunks.size(), startChar, startChar + buffer.length(), pageNumber, documentId));
  }

  private void validateSizes(int targetTokens, int overlapTokens) {
    if (targetTokens <= 0) {
      throw new InvalidChunkingParameterException(
          "targetTokens", "Chunk size must be greater than 0");
    }
    if (overlapTokens < 0 || overlapTokens >= targetTokens) {
      throw new InvalidChunkingParameterException(
          "overlapTokens", "Overlap must be non-negative and less than chunk size");
    }
  }

  private void validatePageBreaks(List<Integer> pageBreaks, int textLength) {
    int previous = 0;
    for (Integer pageBreak : pageBreaks) {
      if (pageBreak == null || pageBreak < previous || pageBreak > textLength) {
        throw new InvalidChunkingParameterException(
            "pageBreaks",
            "Page breaks must be ascending offsets within the text (0.." + textLength + ")");
      }
      previous = pageBreak;
    }
  }
}
