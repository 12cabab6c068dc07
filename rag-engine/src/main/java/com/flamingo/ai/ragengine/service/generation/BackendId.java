package com.flamingo.ai.ragengine.service.generation;

/** Generation backends, declared in fallback priority order. */
public enum BackendId {
  OPENAI("openai"),
  ANTHROPIC("anthropic"),
  GEMINI("gemini");

  private final String id;

  BackendId(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }
}
