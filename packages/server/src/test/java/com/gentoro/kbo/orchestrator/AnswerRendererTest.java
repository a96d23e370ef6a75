package com.gentoro.kbo.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.prompt.PromptRepository;
import com.gentoro.kbo.support.Json;
import com.gentoro.kbo.support.ScriptedLlmClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnswerRendererTest {

  @Test
  @DisplayName("the plain summary keeps row order and skips nulls")
  void plainSummary() {
    List<JsonNode> rows =
        Json.rows(
            """
            [{"player_name": "임찬규", "era": 2.9, "hra": null},
             {"player_name": "문동주", "era": 3.5, "hra": null}]
            """);

    assertEquals(
        "1. player_name: 임찬규, era: 2.9\n2. player_name: 문동주, era: 3.5",
        AnswerRenderer.plainSummary(rows));
  }

  @Test
  @DisplayName("long results are cut with a count of the rest")
  void truncated() {
    List<JsonNode> rows = new ArrayList<>();
    for (int i = 0; i < AnswerRenderer.MAX_LISTED_ROWS + 3; i++) {
      rows.add(Json.node("{\"n\": " + i + "}"));
    }

    String text = AnswerRenderer.plainSummary(rows);

    assertEquals("... 외 3건", text.substring(text.lastIndexOf('\n') + 1));
  }

  @Test
  @DisplayName("a blank model reply falls back to the plain summary")
  void blankReply() {
    AnswerRenderer renderer =
        new AnswerRenderer(Optional.of(new ScriptedLlmClient().reply(" ")), PromptRepository.loadDefault());

    assertEquals("1. n: 1", renderer.render("q", List.of(Json.node("{\"n\": 1}"))));
  }
}
