package com.gentoro.kbo.orchestrator;

import static com.gentoro.kbo.support.GameFixtures.TODAY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.KboAssistant;
import com.gentoro.kbo.classifier.Category;
import com.gentoro.kbo.handler.NoDataMessages;
import com.gentoro.kbo.model.LlmClient;
import com.gentoro.kbo.store.RowValues;
import com.gentoro.kbo.support.FakeGameDataClient;
import com.gentoro.kbo.support.Fixtures;
import com.gentoro.kbo.support.GameFixtures;
import com.gentoro.kbo.support.InMemoryRemoteStore;
import com.gentoro.kbo.support.ScriptedLlmClient;
import java.util.Optional;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnswerServiceTest {

  private static final String LEADER_SQL =
      """
      ```sql
      SELECT player_name, hra FROM player_season_stats
      WHERE team = '한화' AND gyear = '2025'
      ORDER BY hra DESC LIMIT 1;
      ```""";
  private static final String KT_HOME_RUNS_SQL =
      "SELECT player_name, hr FROM player_season_stats WHERE team = 'KT' ORDER BY hr DESC LIMIT 1;";

  private final InMemoryRemoteStore store =
      Fixtures.statsStore()
          .table("game_schedule", GameFixtures.GAME_SCHEDULE)
          .table("game_result", GameFixtures.GAME_RESULT);
  private final ScriptedLlmClient llm = new ScriptedLlmClient();

  private AnswerService service(Optional<LlmClient> llmClient) {
    return new AnswerService(
        KboAssistant.buildContext(new BaseConfiguration(), store, new FakeGameDataClient(), llmClient));
  }

  private AnswerService service() {
    return service(Optional.of(llm));
  }

  @Test
  @DisplayName("a ranking question returns the single qualified leader, phrased by the model")
  void qualifiedLeader() {
    llm.reply(LEADER_SQL, "한화 타율 1위는 문현빈 선수로 0.320입니다.");
    AnswerService answers = service();

    Answer answer = answers.resolve("한화 타율 1위 선수는?", TODAY);

    assertEquals(Category.GENERIC_QUERY, answer.category());
    assertEquals("한화 타율 1위는 문현빈 선수로 0.320입니다.", answer.text());
    assertEquals(1, answer.rows().size());
    JsonNode row = answer.rows().get(0);
    assertEquals("문현빈", RowValues.text(row, "player_name"));
    assertFalse(RowValues.isNull(row, "hra"));
    assertTrue(RowValues.number(row, "ab") >= 310);
    assertEquals(LEADER_SQL, answer.optionalPseudoSql().orElseThrow());

    String renderPrompt = llm.conversations().get(1).get(1).content();
    assertTrue(renderPrompt.contains("문현빈"), renderPrompt);
    assertFalse(renderPrompt.contains("노시환"), renderPrompt);
  }

  @Test
  @DisplayName("rejected pseudo-SQL gives the apology without querying the store")
  void rejectedStatement() {
    llm.reply("DELETE FROM player_season_stats WHERE team = '한화';");
    AnswerService answers = service();
    int callsAtStartup = store.calls();

    Answer answer = answers.resolve("한화 선수 다 지워줘", TODAY);

    assertEquals(NoDataMessages.APOLOGY, answer.text());
    assertEquals(callsAtStartup, store.calls());
    assertTrue(answer.rows().isEmpty());
  }

  @Test
  @DisplayName("a model that declines to write SQL also gives the apology")
  void declined() {
    llm.reply("DB_ERROR: 지원하지 않는 질문입니다.");

    assertEquals(NoDataMessages.APOLOGY, service().answer("한국시리즈 MVP 역대 목록", TODAY));
  }

  @Test
  @DisplayName("no rows give the no-data text chosen from the question")
  void noRows() {
    llm.reply(KT_HOME_RUNS_SQL);

    assertEquals(NoDataMessages.NO_PLAYER, service().answer("KT 홈런 1위 선수는?", TODAY));
    assertEquals(1, llm.calls());
  }

  @Test
  @DisplayName("an unreachable store gives the unavailable text")
  void storeUnavailable() {
    llm.reply(KT_HOME_RUNS_SQL);
    AnswerService answers = service();
    store.failing("player_season_stats");

    assertEquals(NoDataMessages.UNAVAILABLE, answers.answer("KT 홈런 1위 선수는?", TODAY));
  }

  @Test
  @DisplayName("without a model, or with a failing one, statistics questions are unavailable")
  void noModel() {
    assertEquals(
        NoDataMessages.UNAVAILABLE, service(Optional.empty()).answer("한화 타율 1위 선수는?", TODAY));
    assertEquals(NoDataMessages.UNAVAILABLE, service().answer("한화 타율 1위 선수는?", TODAY));
  }

  @Test
  @DisplayName("a failing renderer falls back to listing the rows")
  void rendererFallback() {
    llm.reply(LEADER_SQL);

    String text = service().answer("한화 타율 1위 선수는?", TODAY);

    assertTrue(text.startsWith("1. "), text);
    assertTrue(text.contains("player_name: 문현빈"), text);
  }

  @Test
  @DisplayName("game questions go to their handler and never reach the model")
  void handlerDispatch() {
    Answer answer = service().resolve("오늘 경기 일정 알려줘", TODAY);

    assertEquals(Category.DAILY_SCHEDULE, answer.category());
    assertTrue(answer.text().startsWith("📅 2025년 07월 15일 KBO 경기 일정 (1경기)"), answer.text());
    assertEquals(0, llm.calls());
  }

  @Test
  @DisplayName("blank questions get the apology")
  void blankQuestion() {
    assertEquals(NoDataMessages.APOLOGY, service().answer("   ", TODAY));
    assertEquals(NoDataMessages.APOLOGY, service().answer(null, TODAY));
  }

  @Test
  @DisplayName("player names are indexed once at start-up")
  void playerIndexAtStartup() {
    service();

    assertEquals(1, store.queriesOn("player_season_stats").size());
  }
}
