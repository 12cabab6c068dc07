package com.flamingo.ai.ragengine.service.rag;

/** Document-level metadata stored on every chunk vector of a document. */
public record IndexMetadata(String fileName, String fileType) {

  public static IndexMetadata none() {
    return new IndexMetadata(null, null);
  }
}
