package com.gentoro.kbo.handler;

import static com.gentoro.kbo.support.GameFixtures.TODAY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.kbo.entity.EntityExtractor;
import com.gentoro.kbo.entity.PlayerNameIndex;
import com.gentoro.kbo.entity.TeamDirectory;
import com.gentoro.kbo.game.ScheduleRepository;
import com.gentoro.kbo.support.FakeGameDataClient;
import com.gentoro.kbo.support.GameFixtures;
import com.gentoro.kbo.support.InMemoryRemoteStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FutureGameDetailHandlerTest {

  private final EntityExtractor extractor =
      new EntityExtractor(TeamDirectory.loadDefault(), PlayerNameIndex.empty());
  private final InMemoryRemoteStore store = GameFixtures.scheduleStore();
  private final FakeGameDataClient gameData =
      new FakeGameDataClient().preview(GameFixtures.HANWHA_LOTTE_0716, GameFixtures.HANWHA_LOTTE_PREVIEW);
  private final FutureGameDetailHandler handler =
      new FutureGameDetailHandler(new ScheduleRepository(store), gameData);

  private String ask(String question) {
    return handler.handle(new HandlerRequest(question, extractor.extract(question, TODAY), TODAY));
  }

  @Test
  @DisplayName("starting pitchers come from the preview with their season line")
  void startingPitchers() {
    String answer = ask("내일 한화 선발투수 누구야?");

    assertEquals(
        """
        ⚾ 2025-07-16 사직 - 롯데 vs 한화
        • 롯데 선발: 박세웅 (등번호 21)
        • 한화 선발: 폰세 (등번호 30)
          - 박세웅 시즌 성적: 7승 6패, ERA 4.10
          - 폰세 시즌 성적: 12승 1패, ERA 1.85
        """,
        answer);
  }

  @Test
  @DisplayName("lineups list each side's batting order")
  void lineups() {
    String answer = ask("내일 한화 라인업 알려줘");

    assertTrue(answer.contains("• 롯데 라인업:\n  중견수: 황성빈 (0번)\n  우익수: 레이예스 (29번)"), answer);
    assertTrue(answer.contains("• 한화 라인업:\n  좌익수: 문현빈 (51번)"), answer);
  }

  @Test
  @DisplayName("venue and start time come from the schedule row")
  void venueAndTime() {
    String answer = ask("내일 두산 경기 어디서 해?");

    assertEquals("🏟️ 2025-07-16 - 두산 vs LG\n• 경기장: 잠실\n• 경기시간: 18:30\n", answer);
    assertTrue(gameData.requested().isEmpty());
  }

  @Test
  @DisplayName("a general question covers every game of the day")
  void general() {
    String answer = ask("내일 경기 정보");

    assertTrue(answer.contains("📅 2025-07-16 - 롯데 vs 한화"), answer);
    assertTrue(answer.contains("• 한화 선발: 폰세"), answer);
    assertTrue(answer.contains("📅 2025-07-16 - 두산 vs LG"), answer);
  }

  @Test
  @DisplayName("without a date the team's games over the coming week are covered")
  void upcomingWeek() {
    String answer = ask("한화 선발투수 누구야?");

    assertTrue(answer.indexOf("2025-07-15 대전 - 한화 vs 삼성") < answer.indexOf("2025-07-16 사직"), answer);
    assertTrue(answer.contains("• 선발투수 정보를 가져올 수 없습니다."), answer);
  }

  @Test
  @DisplayName("missing previews and missing games degrade to fixed texts")
  void degraded() {
    gameData.failing(GameFixtures.HANWHA_LOTTE_0716);
    String answer = ask("내일 한화 선발");
    assertTrue(answer.contains("• 선발투수 정보를 가져올 수 없습니다."), answer);
    assertFalse(answer.contains("폰세"), answer);

    assertEquals(NoDataMessages.NO_MATCHING_GAME, ask("2025-07-13 한화 선발투수"));
    store.failingEverything();
    assertEquals(NoDataMessages.NO_MATCHING_GAME, ask("내일 한화 선발투수"));
  }
}
