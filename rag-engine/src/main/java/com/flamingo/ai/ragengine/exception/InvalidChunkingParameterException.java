package com.flamingo.ai.ragengine.exception;

/** Exception thrown when chunking is invoked with inconsistent size, overlap or page arguments. */
public class InvalidChunkingParameterException extends IllegalArgumentException {

  private final String parameter;

  public InvalidChunkingParameterException(String parameter, String message) {
    super(message);
    this.parameter = parameter;
  }

  public String getParameter() {
    return parameter;
  }
}
