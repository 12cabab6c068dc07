package com.flamingo.ai.ragengine.exception;

/** Exception thrown when retrieval finds no candidate chunks at all for a query. */
public class NoRelevantContentException extends RuntimeException {

  private final String userMessage;

  public NoRelevantContentException(String message) {
    super(message);
    this.userMessage =
        "No relevant content was found in your documents. Try rephrasing the question.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
