package com.gentoro.kbo.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.model.LlmClient;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PromptRepositoryTest {

  @Test
  @DisplayName("the bundled templates load and render every placeholder")
  void bundledTemplates() {
    PromptRepository repository = PromptRepository.loadDefault();

    assertEquals(Set.of("sql_generation", "answer_rendering"), repository.names());
    List<LlmClient.Message> messages =
        repository
            .get(PromptRepository.SQL_GENERATION)
            .render(
                Map.of(
                    "season", 2025,
                    "schema", "player_season_stats(player_name, team, hra)",
                    "table_hint", "",
                    "question", "한화 타율 1위는?"));

    assertEquals(2, messages.size());
    assertEquals(LlmClient.Role.SYSTEM, messages.get(0).role());
    assertTrue(messages.get(0).content().contains("gyear = '2025'"));
    assertTrue(messages.get(0).content().contains("player_season_stats(player_name, team, hra)"));
    assertTrue(messages.get(1).content().contains("질문: 한화 타율 1위는?"));
    assertFalse(messages.get(1).content().contains("{{"));
  }

  @Test
  @DisplayName("names are looked up with or without a leading slash")
  void leadingSlash() {
    PromptRepository repository = PromptRepository.load(List.of("/answer_rendering"));

    assertSame(repository.get("answer_rendering"), repository.get("/answer_rendering"));
    assertEquals("answer_rendering", repository.get("answer_rendering").name());
  }

  @Test
  @DisplayName("unknown or missing templates are configuration errors")
  void unknown() {
    PromptRepository repository = PromptRepository.loadDefault();

    assertThrows(ConfigException.class, () -> repository.get("summarize"));
    assertThrows(ConfigException.class, () -> repository.get("/"));
    assertThrows(ConfigException.class, () -> PromptRepository.load(List.of("does_not_exist")));
  }
}
