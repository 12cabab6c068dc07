package com.flamingo.ai.ragengine.service.ingestion;

import java.time.Duration;

/** Outcome of ingesting one document. */
public record IngestionResult(String documentId, int chunkCount, Duration duration) {}
