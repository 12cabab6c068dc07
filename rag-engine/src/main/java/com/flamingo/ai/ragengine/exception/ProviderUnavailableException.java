package com.flamingo.ai.ragengine.exception;

/** Exception thrown when a provider is used without credentials configured. */
public class ProviderUnavailableException extends ProviderException {

  public ProviderUnavailableException(String provider) {
    super(
        provider,
        "Provider " + provider + " is not configured: no API key available",
        "AI service is not configured.");
  }
}
