package com.flamingo.ai.ragengine.service.generation;

import com.flamingo.ai.ragengine.config.ProviderProperties;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Anthropic messages API. */
@Component
public class AnthropicGenerationBackend extends ChatModelGenerationBackend {

  @Autowired
  public AnthropicGenerationBackend(ProviderProperties providerProperties) {
    this(buildModel(providerProperties.getAnthropic()));
  }

  @VisibleForTesting
  AnthropicGenerationBackend(ChatModel chatModel) {
    super(chatModel);
  }

  @Override
  public BackendId id() {
    return BackendId.ANTHROPIC;
  }

  private static ChatModel buildModel(ProviderProperties.Anthropic anthropic) {
    if (!anthropic.isConfigured()) {
      return null;
    }
    return AnthropicChatModel.builder()
        .apiKey(anthropic.getApiKey())
        .modelName(anthropic.getChatModel())
        .timeout(anthropic.getTimeout())
        .build();
  }
}
