package com.gentoro.kbo.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.KboException;
import com.gentoro.kbo.model.LlmClient;
import com.gentoro.kbo.prompt.PromptRepository;
import com.gentoro.kbo.utility.JacksonUtility;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the rows of a statistics query into the text shown to the user.
 *
 * <p>With a model the rows are phrased by the answer-rendering prompt; row order is part of the
 * answer and the prompt forbids reordering. Without a model, or when the model fails, the rows are
 * printed as a numbered list in their original order.
 */
public class AnswerRenderer {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(AnswerRenderer.class);

  static final int MAX_LISTED_ROWS = 20;

  private final LlmClient llmClient;
  private final PromptRepository prompts;

  public AnswerRenderer(Optional<LlmClient> llmClient, PromptRepository prompts) {
    this.llmClient = llmClient.orElse(null);
    this.prompts = prompts;
  }

  public String render(String question, List<JsonNode> rows) {
    if (llmClient != null) {
      try {
        String answer =
            llmClient.chat(
                prompts
                    .get(PromptRepository.ANSWER_RENDERING)
                    .render(Map.of("question", question, "rows", toJson(rows))));
        if (answer != null && !answer.isBlank()) {
          return answer.trim();
        }
        log.warn("Model returned an empty answer, listing rows instead");
      } catch (KboException e) {
        log.warn(
            "Answer rendering failed, listing rows instead: {}", ExceptionUtil.toErrorDetails(e));
      }
    }
    return plainSummary(rows);
  }

  private static String toJson(List<JsonNode> rows) {
    try {
      return JacksonUtility.getJsonMapper().writerWithDefaultPrettyPrinter().writeValueAsString(rows);
    } catch (JsonProcessingException e) {
      return rows.toString();
    }
  }

  /** One line per row, {@code column: value} pairs in row order, nulls left out. */
  static String plainSummary(List<JsonNode> rows) {
    StringBuilder sb = new StringBuilder();
    int shown = Math.min(rows.size(), MAX_LISTED_ROWS);
    for (int i = 0; i < shown; i++) {
      sb.append(i + 1).append(". ").append(describe(rows.get(i))).append('\n');
    }
    if (rows.size() > shown) {
      sb.append("... 외 ").append(rows.size() - shown).append("건\n");
    }
    return sb.toString().trim();
  }

  private static String describe(JsonNode row) {
    StringBuilder sb = new StringBuilder();
    Iterator<Map.Entry<String, JsonNode>> fields = row.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().isNull() || field.getValue().isContainerNode()) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(field.getKey()).append(": ").append(field.getValue().asText());
    }
    return sb.toString();
  }
}
