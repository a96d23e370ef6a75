package com.gentoro.kbo.handler;

import com.gentoro.kbo.classifier.Category;
import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.game.ScheduleRepository;
import com.gentoro.kbo.game.ScheduledGame;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Every game of a day (or of each day in a range), with venue, start time and status. */
public class DailyScheduleHandler implements CategoryHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(DailyScheduleHandler.class);

  private final ScheduleRepository schedule;

  public DailyScheduleHandler(ScheduleRepository schedule) {
    this.schedule = schedule;
  }

  @Override
  public Category category() {
    return Category.DAILY_SCHEDULE;
  }

  @Override
  public String handle(HandlerRequest request) {
    LocalDate day = request.date().orElse(request.today());
    try {
      List<ScheduledGame> games =
          request.range().isPresent() ? schedule.between(request.range().get()) : schedule.onDate(day);
      if (games.isEmpty()) {
        return NoDataMessages.noGames(request.range().isPresent() ? null : day, request.today());
      }
      List<String> blocks = new ArrayList<>();
      byDay(games).forEach((date, dayGames) -> blocks.add(render(date, dayGames)));
      return String.join("\n", blocks);
    } catch (StoreException e) {
      log.warn("Schedule unavailable: {}", ExceptionUtil.extractErrorMessage(e));
      return NoDataMessages.noGames(day, request.today());
    }
  }

  static Map<LocalDate, List<ScheduledGame>> byDay(List<ScheduledGame> games) {
    Map<LocalDate, List<ScheduledGame>> days = new LinkedHashMap<>();
    for (ScheduledGame game : games) {
      days.computeIfAbsent(game.gameDate(), d -> new ArrayList<>()).add(game);
    }
    return days;
  }

  String render(LocalDate date, List<ScheduledGame> games) {
    StringBuilder sb = new StringBuilder();
    sb.append("📅 ").append(GameSummaryFormatter.koreanDate(date)).append(" KBO 경기 일정 (")
        .append(games.size()).append("경기)\n");
    sb.append(GameSummaryFormatter.RULE).append("\n\n");
    int i = 1;
    for (ScheduledGame game : games) {
      sb.append("🏟️ 경기 ").append(i++).append(": ").append(game.awayName()).append(" vs ")
          .append(game.homeName()).append('\n');
      sb.append("   📍 경기장: ").append(game.stadium()).append('\n');
      sb.append("   ⏰ 경기시간: ").append(game.startTime().orElse("시간 미정")).append('\n');
      sb.append("   📋 상태: ").append(GameSummaryFormatter.statusLabel(game.statusCode())).append("\n\n");
    }
    return sb.toString();
  }
}
