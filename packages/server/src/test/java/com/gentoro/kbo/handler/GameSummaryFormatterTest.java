package com.gentoro.kbo.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.gentoro.kbo.game.GameRecord;
import com.gentoro.kbo.game.GameRecordAnalyzer;
import com.gentoro.kbo.game.ScheduledGame;
import com.gentoro.kbo.support.GameFixtures;
import com.gentoro.kbo.support.Json;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GameSummaryFormatterTest {

  private final GameSummaryFormatter formatter = new GameSummaryFormatter();

  private static ScheduledGame game(Integer home, Integer away, String winner, String detailStatus) {
    return new ScheduledGame(
        "20250714LGHH02025", LocalDate.of(2025, 7, 14), "2025-07-14T18:30:00", "대전", "HH", "한화",
        "LG", "LG", home, away, winner, "RESULT", detailStatus);
  }

  private static GameRecord.PitcherLine none() {
    return new GameRecord.PitcherLine(null, null, 0, 0, 0, 0, null);
  }

  @Test
  @DisplayName("a box score reads as result, momentum, starters and notes")
  void recordSummary() {
    GameRecord record = new GameRecordAnalyzer().analyze(Json.node(GameFixtures.HANWHA_LG_RECORD));

    assertEquals(
        """
        📅 2025년 07월 14일 대전에서 열린 LG 트윈스 vs 한화 이글스 경기 결과입니다.
        🏆 한화 이글스 5 - 3 LG 트윈스로 승리했습니다.
        ⚾ 경기 흐름: LG 트윈스은 고른 득점, 한화 이글스은 초반-후반 득점을 보였습니다.
        🎯 선발 투수: LG 트윈스 임찬규 (6이닝) vs 한화 이글스 류현진 (6 ⅔이닝)
        💥 홈런: 노시환(7회 3점)
        🔥 결승타: 노시환(7회 2사 1,2루서 좌월 홈런)""",
        formatter.recordSummary(record));
  }

  @Test
  @DisplayName("a drawn record and a bad date are rendered as such")
  void drawnRecord() {
    GameRecord record =
        new GameRecord(
            "2025-07-14", "잠실", "두산 베어스", "KIA 타이거즈", 4, 4, "고른 득점", "고른 득점",
            none(), none(), List.of(), List.of(), List.of(), List.of());

    assertEquals(
        """
        📅 2025-07-14 잠실에서 열린 KIA 타이거즈 vs 두산 베어스 경기 결과입니다.
        🤝 KIA 타이거즈 4 - 4 두산 베어스 무승부로 끝났습니다.
        ⚾ 경기 흐름: KIA 타이거즈은 고른 득점, 두산 베어스은 고른 득점을 보였습니다.""",
        formatter.recordSummary(record));
  }

  @Test
  @DisplayName("basic summaries follow the game's status")
  void basicSummary() {
    assertEquals(
        """
        📅 2025년 07월 14일 대전에서 열린 LG vs 한화 경기
        🏆 한화 5 - 3 LG로 승리
        ⚾ 경기 상태: 종료""",
        formatter.basicSummary(game(5, 3, "HOME", ScheduledGame.STATUS_FINAL)));
    assertEquals(
        """
        📅 2025년 07월 14일 대전에서 열린 LG vs 한화 경기
        🏆 LG 2 - 2 한화
        ⚾ 경기 상태: 종료""",
        formatter.basicSummary(game(2, 2, "DRAW", ScheduledGame.STATUS_FINAL)));
    assertEquals(
        """
        📅 2025년 07월 14일 대전에서 열린 LG vs 한화 경기
        ⏰ 경기 시간: 18:30
        📋 경기가 예정되어 있습니다.
        🏟️ 경기장: 대전
        ⚾ LG vs 한화의 경기를 기대해주세요!""",
        formatter.basicSummary(game(null, null, "", ScheduledGame.STATUS_SCHEDULED)));
    assertEquals(
        """
        📅 2025년 07월 14일 대전에서 열린 LG vs 한화 경기
        🔥 현재 경기가 진행 중입니다!
        📊 현재 점수: LG 1 - 0 한화
        ⚾ 실시간 경기 상황을 확인해보세요!""",
        formatter.basicSummary(game(0, 1, "", ScheduledGame.STATUS_LIVE)));
    assertEquals(
        """
        📅 2025년 07월 14일 대전에서 열린 LG vs 한화 경기
        📋 경기 정보를 확인해주세요. (상태코드: 3)""",
        formatter.basicSummary(game(null, null, "", "3")));
  }

  @Test
  @DisplayName("status codes and dates get Korean labels")
  void labels() {
    assertEquals("예정", GameSummaryFormatter.statusLabel("BEFORE"));
    assertEquals("진행중", GameSummaryFormatter.statusLabel("LIVE"));
    assertEquals("종료", GameSummaryFormatter.statusLabel("RESULT"));
    assertEquals("CANCEL", GameSummaryFormatter.statusLabel("CANCEL"));
    assertEquals("날짜 미상", GameSummaryFormatter.koreanDate(null));
    assertEquals("2025년 07월 01일", GameSummaryFormatter.koreanDate(LocalDate.of(2025, 7, 1)));
  }
}
