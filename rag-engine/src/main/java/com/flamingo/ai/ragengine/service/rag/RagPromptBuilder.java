package com.flamingo.ai.ragengine.service.rag;

import com.flamingo.ai.ragengine.model.RetrievedMatch;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/** Builds the numbered context block and the grounding prompt sent to the generation backend. */
@Component
public class RagPromptBuilder {

  /** Slots: context, then question. Filled in one pass so neither value is re-scanned. */
  private static final String GROUNDING_PROMPT =
      """
          You are a helpful AI assistant that answers questions based on the provided \
          document context.

          Context from documents:
          %s

          Question: %s

          Please provide a comprehensive answer based on the context above. If the context \
          doesn't contain enough information to answer the question, please say so. Include \
          citations to the relevant passages using [1], [2], etc.""";

  /** Numbers the matches from 1 in the given order: {@code "[1] text\n\n[2] text"}. */
  public String buildContext(List<RetrievedMatch> matches) {
    return IntStream.range(0, matches.size())
        .mapToObj(i -> "[" + (i + 1) + "] " + matches.get(i).text())
        .collect(Collectors.joining("\n\n"));
  }

  public String buildPrompt(String question, String context) {
    return String.format(GROUNDING_PROMPT, context, question);
  }
}
