package com.flamingo.ai.ragengine.exception;

/** Exception thrown when chunks of a document cannot be embedded or written to the index. */
public class IndexingException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public IndexingException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public IndexingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
