package com.flamingo.ai.ragengine.service.generation;

import com.flamingo.ai.ragengine.config.ProviderProperties;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** OpenAI chat completions. */
@Component
public class OpenAiGenerationBackend extends ChatModelGenerationBackend {

  @Autowired
  public OpenAiGenerationBackend(ProviderProperties providerProperties) {
    this(buildModel(providerProperties.getOpenai()));
  }

  @VisibleForTesting
  OpenAiGenerationBackend(ChatModel chatModel) {
    super(chatModel);
  }

  @Override
  public BackendId id() {
    return BackendId.OPENAI;
  }

  private static ChatModel buildModel(ProviderProperties.OpenAi openai) {
    if (!openai.isConfigured()) {
      return null;
    }
    return OpenAiChatModel.builder()
        .apiKey(openai.getApiKey())
        .modelName(openai.getChatModel())
        .timeout(openai.getTimeout())
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
