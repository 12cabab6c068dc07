package com.flamingo.ai.ragengine.model;

import java.time.Instant;
import lombok.Builder;

/** Metadata stored alongside each chunk vector, including the chunk text itself. */
@Builder(toBuilder = true)
public record ChunkMetadata(
    String text,
    String documentId,
    String userId,
    int chunkIndex,
    Integer startChar,
    Integer endChar,
    Integer pageNumber,
    String fileName,
    String fileType,
    Instant createdAt) {}
