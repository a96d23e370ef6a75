package com.gentoro.kbo.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.kbo.support.GameFixtures;
import com.gentoro.kbo.support.InMemoryRemoteStore;
import com.gentoro.kbo.support.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GamePreviewTest {

  @Test
  @DisplayName("standings, starters, key players and lineups are read from the preview")
  void fromPreview() {
    GamePreview preview = GamePreview.from(Json.node(GameFixtures.HANWHA_LOTTE_PREVIEW));

    assertEquals(3, preview.homeStanding().rank());
    assertEquals("0.610", preview.awayStanding().winRate());
    assertEquals("폰세", preview.awayStarter().name());
    assertEquals("30", preview.awayStarter().backNumber());
    assertEquals(12, preview.awayStarter().wins());
    assertTrue(preview.awayStarter().hasEra());
    assertEquals("레이예스", preview.homeKeyPlayer().name());
    assertEquals(4, preview.homeWins());
    assertEquals(2, preview.homeLineup().size());
    assertEquals("좌익수", preview.awayLineup().get(0).position());
    assertTrue(preview.hasStarters());
    assertTrue(preview.hasLineups());
  }

  @Test
  @DisplayName("missing sections read as unknown")
  void sparsePreview() {
    GamePreview preview =
        GamePreview.from(
            Json.node(
                """
                {"homeStandings": {"rank": "-"},
                 "homeStarter": {"playerInfo": {"name": "신인"}, "currentSeasonStats": {"era": "0.00"}}}
                """));

    assertNull(preview.homeStanding().rank());
    assertNull(preview.awayStanding().winRate());
    assertFalse(preview.homeStarter().hasEra());
    assertFalse(preview.awayStarter().isKnown());
    assertTrue(preview.hasStarters());
    assertFalse(preview.hasLineups());
  }

  @Test
  @DisplayName("standings come from the latest season of the team")
  void standings() {
    InMemoryRemoteStore store = GameFixtures.scheduleStore();
    TeamStanding doosan = new StandingsRepository(store).forTeam("두산").orElseThrow();

    assertEquals(9, doosan.ranking());
    assertEquals(0.420, doosan.winRate());
    assertEquals(1, doosan.recentWins());
    assertTrue(new StandingsRepository(store).forTeam("NC").isEmpty());
  }
}
