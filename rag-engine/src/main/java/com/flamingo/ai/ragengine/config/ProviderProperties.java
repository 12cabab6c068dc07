package com.flamingo.ai.ragengine.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Credentials and endpoints of the external services the engine talks to.
 *
 * <p>Bound once at startup and handed to each adapter through its constructor. A provider whose
 * API key is blank reports itself as not configured; nothing fails until it is actually used.
 */
@Configuration
@ConfigurationProperties(prefix = "providers")
@Getter
@Setter
public class ProviderProperties {

  private OpenAi openai = new OpenAi();
  private Anthropic anthropic = new Anthropic();
  private Gemini gemini = new Gemini();
  private Elasticsearch elasticsearch = new Elasticsearch();

  @Getter
  @Setter
  public static class OpenAi {
    private String apiKey = "";
    private String chatModel = "gpt-4-turbo-preview";
    private String embeddingModel = "text-embedding-3-large";
    private int embeddingDimensions = 1536;

    /** text-embedding-3 accepts 8191 tokens; at ~4 chars/token this keeps a margin. */
    private int maxInputChars = 30_000;

    private Duration timeout = Duration.ofSeconds(60);

    public boolean isConfigured() {
      return apiKey != null && !apiKey.isBlank();
    }
  }

  @Getter
  @Setter
  public static class Anthropic {
    private String apiKey = "";
    private String chatModel = "claude-3-5-sonnet-20241022";
    private Duration timeout = Duration.ofSeconds(60);

    public boolean isConfigured() {
      return apiKey != null && !apiKey.isBlank();
    }
  }

  @Getter
  @Setter
  public static class Gemini {
    private String apiKey = "";
    private String chatModel = "gemini-pro";
    private Duration timeout = Duration.ofSeconds(60);

    public boolean isConfigured() {
      return apiKey != null && !apiKey.isBlank();
    }
  }

  @Getter
  @Setter
  public static class Elasticsearch {
    private String host = "localhost";
    private int port = 9200;
    private String scheme = "http";
  }
}
