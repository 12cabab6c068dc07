package com.flamingo.ai.ragengine.exception;

/** Exception thrown when a query is empty or otherwise unusable. Caller error, never retried. */
public class InvalidQueryException extends RuntimeException {

  private final String userMessage;

  public InvalidQueryException(String message) {
    super(message);
    this.userMessage = "Please enter a question.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
