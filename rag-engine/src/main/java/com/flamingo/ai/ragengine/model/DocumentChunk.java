package com.flamingo.ai.ragengine.model;

import lombok.Builder;

/**
 * A bounded slice of a document's extracted text, the atomic unit of retrieval.
 *
 * <p>{@code startChar} and {@code endChar} are offsets into the original extracted text. After
 * {@code mergeSmallChunks} the text of a merged chunk is the concatenation of its parts, so it may
 * be one separator longer than {@code endChar - startChar}.
 *
 * @param text trimmed chunk text
 * @param chunkIndex zero-based, contiguous position within the document
 * @param startChar inclusive start offset in the original text
 * @param endChar exclusive end offset in the original text
 * @param pageNumber 1-based page the chunk came from, or {@code null} when not page-aware
 * @param documentId owning document, or {@code null} before ingestion assigns one
 */
@Builder(toBuilder = true)
public record DocumentChunk(
    String text,
    int chunkIndex,
    int startChar,
    int endChar,
    Integer pageNumber,
    String documentId) {}
