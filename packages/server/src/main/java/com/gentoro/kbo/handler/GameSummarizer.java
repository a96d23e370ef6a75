package com.gentoro.kbo.handler;

import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.KboException;
import com.gentoro.kbo.game.GameDataClient;
import com.gentoro.kbo.game.GameRecordAnalyzer;
import com.gentoro.kbo.game.ScheduledGame;

/**
 * Summary of one game: the box-score digest when the game API has a record for it, otherwise the
 * basic summary from the schedule row. A failing game API degrades to the basic summary.
 */
public class GameSummarizer {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(GameSummarizer.class);

  private final GameDataClient gameData;
  private final GameRecordAnalyzer analyzer;
  private final GameSummaryFormatter formatter;

  public GameSummarizer(GameDataClient gameData, GameRecordAnalyzer analyzer, GameSummaryFormatter formatter) {
    this.gameData = gameData;
    this.analyzer = analyzer;
    this.formatter = formatter;
  }

  public String summarize(ScheduledGame game) {
    if (game.gameId() == null) {
      return formatter.basicSummary(game);
    }
    try {
      return gameData
          .getRecord(game.gameId())
          .map(record -> formatter.recordSummary(analyzer.analyze(record)))
          .orElseGet(() -> formatter.basicSummary(game));
    } catch (KboException e) {
      log.warn(
          "Record unavailable for game {}, using schedule summary: {}",
          game.gameId(),
          ExceptionUtil.extractErrorMessage(e));
      return formatter.basicSummary(game);
    }
  }

  public GameSummaryFormatter formatter() {
    return formatter;
  }
}
