package com.flamingo.ai.ragengine.service.rag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.ragengine.model.ChunkMetadata;
import com.flamingo.ai.ragengine.model.RetrievedMatch;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RagPromptBuilderTest {

  private final RagPromptBuilder promptBuilder = new RagPromptBuilder();

  private static RetrievedMatch match(String text) {
    return new RetrievedMatch("id", 0.5, ChunkMetadata.builder().text(text).build());
  }

  @Test
  @DisplayName("should number context passages from one in the given order")
  void shouldNumberContext() {
    String context = promptBuilder.buildContext(List.of(match("Alpha."), match("Beta.")));

    assertThat(context).isEqualTo("[1] Alpha.\n\n[2] Beta.");
  }

  @Test
  @DisplayName("should produce an empty context for no matches")
  void shouldHandleNoMatches() {
    assertThat(promptBuilder.buildContext(List.of())).isEmpty();
  }

  @Test
  @DisplayName("should place context before the question and ask for citations")
  void shouldBuildPrompt() {
    String prompt = promptBuilder.buildPrompt("Why is the sky blue?", "[1] Rayleigh scattering.");

    assertThat(prompt)
        .startsWith("You are a helpful AI assistant")
        .contains("Context from documents:\n[1] Rayleigh scattering.")
        .contains("Question: Why is the sky blue?")
        .contains("[1], [2]")
        .doesNotContain("{{");
    assertThat(prompt.indexOf("Rayleigh")).isLessThan(prompt.indexOf("Question:"));
  }

  @Test
  @DisplayName("should keep template markers inside context and question verbatim")
  void shouldNotExpandMarkersInValues() {
    String context = "[1] Template syntax uses {{question}} and {{current_date}} markers.";
    String question = "What does %s or {{context}} mean?";

    String prompt = promptBuilder.buildPrompt(question, context);

    assertThat(prompt)
        .contains("Context from documents:\n" + context + "\n")
        .contains("Question: " + question);
  }
}
