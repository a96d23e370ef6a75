package com.gentoro.kbo.orchestrator;

import com.gentoro.kbo.classifier.Classification;
import com.gentoro.kbo.exception.LlmException;
import com.gentoro.kbo.model.LlmClient;
import com.gentoro.kbo.prompt.PromptRepository;
import com.gentoro.kbo.schema.IntentIndex;
import java.util.Map;

/** Asks the model for the pseudo-SQL statement that answers a statistics question. */
public class SqlGenerator {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(SqlGenerator.class);

  static final int MAX_ATTEMPTS = 2;

  private final LlmClient llmClient;
  private final PromptRepository prompts;
  private final IntentIndex intentIndex;
  private final String season;

  public SqlGenerator(
      LlmClient llmClient, PromptRepository prompts, IntentIndex intentIndex, String season) {
    this.llmClient = llmClient;
    this.prompts = prompts;
    this.intentIndex = intentIndex;
    this.season = season;
  }

  /**
   * Raw model output. It is not validated here; the compiler decides whether it is usable.
   *
   * @throws LlmException when the model fails or keeps returning nothing
   */
  public String generate(String question, Classification classification) {
    String tableHint =
        classification
            .optionalTableHint()
            .map(t -> "참고: 이 질문은 " + t + " 테이블과 가장 관련이 있습니다.\n")
            .orElse("");
    var messages =
        prompts
            .get(PromptRepository.SQL_GENERATION)
            .render(
                Map.of(
                    "season", season,
                    "schema", intentIndex.schemaHints(question),
                    "table_hint", tableHint,
                    "question", question));

    int attempts = 0;
    while (++attempts <= MAX_ATTEMPTS) {
      String result = llmClient.chat(messages);
      if (result != null && !result.isBlank()) {
        log.debug("Generated pseudo-SQL on attempt {}: {}", attempts, result);
        return result;
      }
      log.warn("Model returned no pseudo-SQL (attempt {}/{})", attempts, MAX_ATTEMPTS);
    }
    throw new LlmException("Model returned no pseudo-SQL after " + MAX_ATTEMPTS + " attempts");
  }
}
