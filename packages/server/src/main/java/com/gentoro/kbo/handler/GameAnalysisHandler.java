package com.gentoro.kbo.handler;

import com.gentoro.kbo.classifier.Category;
import com.gentoro.kbo.entity.Team;
import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.game.ScheduleRepository;
import com.gentoro.kbo.game.ScheduledGame;
import java.util.List;
import java.util.Optional;

/** One team's game on a day, or its most recent game when no day is given. */
public class GameAnalysisHandler implements CategoryHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(GameAnalysisHandler.class);

  private final ScheduleRepository schedule;
  private final GameSummarizer summarizer;

  public GameAnalysisHandler(ScheduleRepository schedule, GameSummarizer summarizer) {
    this.schedule = schedule;
    this.summarizer = summarizer;
  }

  @Override
  public Category category() {
    return Category.GAME_ANALYSIS;
  }

  @Override
  public String handle(HandlerRequest request) {
    Optional<Team> team = request.entities().firstTeam();
    if (team.isEmpty()) {
      return NoDataMessages.NO_GAME_INFO;
    }
    try {
      Optional<ScheduledGame> game = find(team.get(), request);
      if (game.isEmpty()) {
        return NoDataMessages.NO_GAME_INFO;
      }
      log.debug("Analyzing game {} for {}", game.get().gameId(), team.get().code());
      return summarizer.summarize(game.get());
    } catch (StoreException e) {
      log.warn("Schedule unavailable: {}", ExceptionUtil.extractErrorMessage(e));
      return NoDataMessages.NO_GAME_INFO;
    }
  }

  private Optional<ScheduledGame> find(Team team, HandlerRequest request) {
    if (request.date().isPresent()) {
      return schedule.forTeamOn(team, request.date().get());
    }
    if (request.range().isPresent()) {
      List<ScheduledGame> games = schedule.forTeamBetween(team, request.range().get());
      return games.stream()
          .filter(g -> g.gameDate() != null && !g.gameDate().isAfter(request.today()))
          .reduce((first, second) -> second);
    }
    return schedule.latestForTeam(team, request.today());
  }
}
