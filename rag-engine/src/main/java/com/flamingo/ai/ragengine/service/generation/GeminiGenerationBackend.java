package com.flamingo.ai.ragengine.service.generation;

import com.flamingo.ai.ragengine.config.ProviderProperties;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Google AI Gemini. */
@Component
public class GeminiGenerationBackend extends ChatModelGenerationBackend {

  @Autowired
  public GeminiGenerationBackend(ProviderProperties providerProperties) {
    this(buildModel(providerProperties.getGemini()));
  }

  @VisibleForTesting
  GeminiGenerationBackend(ChatModel chatModel) {
    super(chatModel);
  }

  @Override
  public BackendId id() {
    return BackendId.GEMINI;
  }

  private static ChatModel buildModel(ProviderProperties.Gemini gemini) {
    if (!gemini.isConfigured()) {
      return null;
    }
    return GoogleAiGeminiChatModel.builder()
        .apiKey(gemini.getApiKey())
        .modelName(gemini.getChatModel())
        .timeout(gemini.getTimeout())
        .build();
  }
}
