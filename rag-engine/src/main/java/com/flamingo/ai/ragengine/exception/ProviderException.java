package com.flamingo.ai.ragengine.exception;

/**
 * Exception thrown when an external provider (embedding, vector index or generation backend)
 * fails or returns an unusable response.
 */
public class ProviderException extends RuntimeException {

  private final String provider;
  private final String userMessage;

  public ProviderException(String provider, String message) {
    super(message);
    this.provider = provider;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public ProviderException(String provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  protected ProviderException(String provider, String message, String userMessage) {
    super(message);
    this.provider = provider;
    this.userMessage = userMessage;
  }

  public String getProvider() {
    return provider;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
