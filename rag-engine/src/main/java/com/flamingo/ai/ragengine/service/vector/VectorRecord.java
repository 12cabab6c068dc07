package com.flamingo.ai.ragengine.service.vector;

import com.flamingo.ai.ragengine.model.ChunkMetadata;
import java.util.List;

/** One entry written to the vector index. Writing an existing id replaces it. */
public record VectorRecord(String id, List<Float> vector, ChunkMetadata metadata) {}
