package com.flamingo.ai.ragengine.service.generation;

import com.flamingo.ai.ragengine.exception.ProviderException;
import com.flamingo.ai.ragengine.exception.ProviderUnavailableException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Generation backend over a LangChain4j {@link ChatModel}. The model is only built when the
 * backend is configured; temperature and output length are set per request.
 */
@Slf4j
public abstract class ChatModelGenerationBackend implements GenerationBackend {

  private final ChatModel chatModel;

  protected ChatModelGenerationBackend(ChatModel chatModel) {
    this.chatModel = chatModel;
  }

  @Override
  public boolean isConfigured() {
    return chatModel != null;
  }

  @Override
  public String generate(String prompt, GenerationSettings settings) {
    if (chatModel == null) {
      throw new ProviderUnavailableException(id().getId());
    }

    ChatRequest request =
        ChatRequest.builder()
            .messages(UserMessage.from(prompt))
            .temperature(settings.temperature())
            .maxOutputTokens(settings.maxTokens())
            .build();

    ChatResponse response;
    try {
      response = chatModel.chat(request);
    } catch (RuntimeException e) {
      throw new ProviderException(id().getId(), "Generation request failed: " + e.getMessage(), e);
    }

    AiMessage message = response != null ? response.aiMessage() : null;
    String text = message != null ? message.text() : null;
    if (text == null || text.isBlank()) {
      throw new ProviderException(id().getId(), "Generation response contained no text");
    }
    log.debug("{} generated {} chars", id().getId(), text.length());
    return text;
  }
}
