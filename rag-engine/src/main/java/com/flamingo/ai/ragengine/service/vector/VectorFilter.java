package com.flamingo.ai.ragengine.service.vector;

import java.util.List;

/**
 * Metadata restriction applied to queries and deletes: {@code documentId} in {@code documentIds}
 * and {@code userId} equal to {@code userId}. A {@code null} or empty part does not restrict.
 */
public record VectorFilter(List<String> documentIds, String userId) {

  private static final VectorFilter NONE = new VectorFilter(List.of(), null);

  public VectorFilter {
    documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    userId = userId == null || userId.isBlank() ? null : userId;
  }

  public static VectorFilter none() {
    return NONE;
  }

  public static VectorFilter forDocument(String documentId) {
    return new VectorFilter(List.of(documentId), null);
  }

  public boolean hasDocumentIds() {
    return !documentIds.isEmpty();
  }

  public boolean hasUserId() {
    return userId != null;
  }

  public boolean isEmpty() {
    return !hasDocumentIds() && !hasUserId();
  }
}
