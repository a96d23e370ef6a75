package com.gentoro.kbo.handler;

import com.gentoro.kbo.classifier.Category;
import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.game.ScheduleRepository;
import com.gentoro.kbo.game.ScheduledGame;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Results of every game on one day. Games are summarized one by one; a game whose record cannot be
 * fetched falls back to its schedule summary and the batch carries on.
 */
public class DailyResultsAnalysisHandler implements CategoryHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(DailyResultsAnalysisHandler.class);

  private final ScheduleRepository schedule;
  private final GameSummarizer summarizer;

  public DailyResultsAnalysisHandler(ScheduleRepository schedule, GameSummarizer summarizer) {
    this.schedule = schedule;
    this.summarizer = summarizer;
  }

  @Override
  public Category category() {
    return Category.DAILY_RESULTS_ANALYSIS;
  }

  @Override
  public String handle(HandlerRequest request) {
    LocalDate requested = request.date().orElse(null);
    try {
      Optional<LocalDate> day = resolveDay(request);
      if (day.isEmpty()) {
        return NoDataMessages.noGames(requested, request.today());
      }
      List<ScheduledGame> games = schedule.onDate(day.get());
      if (games.isEmpty()) {
        return NoDataMessages.noGames(day.get(), request.today());
      }
      log.debug("Summarizing {} game(s) on {}", games.size(), day.get());
      List<String> summaries = new ArrayList<>();
      for (ScheduledGame game : games) {
        summaries.add(summarizer.summarize(game));
      }
      return render(day.get(), games, summaries);
    } catch (StoreException e) {
      log.warn("Schedule unavailable: {}", ExceptionUtil.extractErrorMessage(e));
      return NoDataMessages.noGames(requested, request.today());
    }
  }

  /** The resolved day; for a range its last day up to today; with no date the latest game day. */
  private Optional<LocalDate> resolveDay(HandlerRequest request) {
    if (request.date().isPresent()) {
      return request.date();
    }
    LocalDate until =
        request.range().map(r -> r.to().isAfter(request.today()) ? request.today() : r.to())
            .orElse(request.today());
    Optional<LocalDate> latest = schedule.latestDate(until);
    if (request.range().isPresent()) {
      return latest.filter(request.range().get()::contains);
    }
    return latest;
  }

  static String render(LocalDate day, List<ScheduledGame> games, List<String> summaries) {
    StringBuilder sb = new StringBuilder();
    sb.append("📅 ").append(GameSummaryFormatter.koreanDate(day)).append(" KBO 경기 결과 (")
        .append(games.size()).append("경기)\n");
    sb.append(GameSummaryFormatter.RULE).append("\n\n");
    for (int i = 0; i < summaries.size(); i++) {
      sb.append("🏟️ 경기 ").append(i + 1).append(":\n").append(summaries.get(i)).append("\n\n");
    }
    long homeWins = games.stream().filter(ScheduledGame::homeWon).count();
    long awayWins = games.stream().filter(ScheduledGame::awayWon).count();
    sb.append("📊 경기 결과 요약:\n");
    sb.append("   홈팀 승리: ").append(homeWins).append("경기\n");
    sb.append("   원정팀 승리: ").append(awayWins).append("경기\n");
    return sb.toString();
  }
}
