package com.gentoro.kbo.game;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.exception.GameApiException;
import java.util.Optional;

/** Read-only game endpoints keyed by game id (e.g. {@code 20250920HHKT02025}). */
public interface GameDataClient {

  /**
   * Box-score record of a started or finished game.
   *
   * @return the {@code recordData} object, empty when the game has no record yet
   * @throws GameApiException on transport or HTTP failure
   */
  Optional<JsonNode> getRecord(String gameId);

  /**
   * Pre-game preview: standings, starters, key players, lineups.
   *
   * @return the {@code previewData} object, empty when the API has none
   * @throws GameApiException on transport or HTTP failure
   */
  Optional<JsonNode> getPreview(String gameId);
}
