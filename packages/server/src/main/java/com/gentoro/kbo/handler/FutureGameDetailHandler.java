package com.gentoro.kbo.handler;

import com.gentoro.kbo.classifier.Category;
import com.gentoro.kbo.entity.DateRange;
import com.gentoro.kbo.entity.Team;
import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.KboException;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.game.GameDataClient;
import com.gentoro.kbo.game.GamePreview;
import com.gentoro.kbo.game.ScheduleRepository;
import com.gentoro.kbo.game.ScheduledGame;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Details of upcoming games: starting pitchers, lineups, venue and start time, or all of them.
 * Games are those of the named teams, or every game, on the resolved day or in the upcoming week.
 */
public class FutureGameDetailHandler implements CategoryHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(FutureGameDetailHandler.class);

  static final int LINEUP_SIZE = 9;

  enum Detail {
    PITCHER(List.of("선발투수", "선발", "투수", "starting pitcher", "starter")),
    LINEUP(List.of("라인업", "출전", "선수", "lineup")),
    VENUE_TIME(List.of("어디서", "경기장", "언제", "몇시", "시간", "venue", "what time")),
    GENERAL(List.of());

    final List<String> keywords;

    Detail(List<String> keywords) {
      this.keywords = keywords;
    }

    static Detail of(String question) {
      String text = question == null ? "" : question.toLowerCase(Locale.ROOT);
      for (Detail detail : values()) {
        if (detail.keywords.stream().anyMatch(text::contains)) {
          return detail;
        }
      }
      return GENERAL;
    }
  }

  private final ScheduleRepository schedule;
  private final GameDataClient gameData;

  public FutureGameDetailHandler(ScheduleRepository schedule, GameDataClient gameData) {
    this.schedule = schedule;
    this.gameData = gameData;
  }

  @Override
  public Category category() {
    return Category.FUTURE_GAME_DETAIL;
  }

  @Override
  public String handle(HandlerRequest request) {
    List<ScheduledGame> games;
    try {
      games = games(request);
    } catch (StoreException e) {
      log.warn("Schedule unavailable: {}", ExceptionUtil.extractErrorMessage(e));
      return NoDataMessages.NO_MATCHING_GAME;
    }
    if (games.isEmpty()) {
      return NoDataMessages.NO_MATCHING_GAME;
    }
    Detail detail = Detail.of(request.question());
    log.debug("Rendering {} detail for {} game(s)", detail, games.size());
    List<String> responses = new ArrayList<>();
    for (ScheduledGame game : games) {
      responses.add(
          switch (detail) {
            case PITCHER -> pitchers(game);
            case LINEUP -> lineups(game);
            case VENUE_TIME -> venueAndTime(game);
            case GENERAL -> general(game);
          });
    }
    return String.join("\n", responses);
  }

  private List<ScheduledGame> games(HandlerRequest request) {
    DateRange window = request.upcomingWindow();
    if (!request.entities().hasTeam()) {
      return window.isSingleDay() ? schedule.onDate(window.from()) : schedule.between(window);
    }
    Map<String, ScheduledGame> unique = new LinkedHashMap<>();
    for (Team team : request.entities().teams()) {
      for (ScheduledGame game : schedule.forTeamBetween(team, window)) {
        unique.putIfAbsent(game.gameId() == null ? game.toString() : game.gameId(), game);
      }
    }
    List<ScheduledGame> games = new ArrayList<>(unique.values());
    games.sort(
        Comparator.comparing(
            ScheduledGame::gameDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())));
    return games;
  }

  private Optional<GamePreview> preview(ScheduledGame game) {
    if (game.gameId() == null) {
      return Optional.empty();
    }
    try {
      return gameData.getPreview(game.gameId()).map(GamePreview::from);
    } catch (KboException e) {
      log.warn("Preview unavailable for game {}: {}", game.gameId(), ExceptionUtil.extractErrorMessage(e));
      return Optional.empty();
    }
  }

  private static String title(ScheduledGame game) {
    return game.gameDate() + " " + game.stadium() + " - " + game.homeName() + " vs " + game.awayName() + "\n";
  }

  String pitchers(ScheduledGame game) {
    StringBuilder sb = new StringBuilder("⚾ ").append(title(game));
    Optional<GamePreview> preview = preview(game).filter(GamePreview::hasStarters);
    if (preview.isEmpty()) {
      return sb.append("• 선발투수 정보를 가져올 수 없습니다.\n").toString();
    }
    GamePreview.Starter home = preview.get().homeStarter();
    GamePreview.Starter away = preview.get().awayStarter();
    starterLine(sb, game.homeName(), home);
    starterLine(sb, game.awayName(), away);
    seasonLine(sb, home);
    seasonLine(sb, away);
    return sb.toString();
  }

  private static void starterLine(StringBuilder sb, String team, GamePreview.Starter starter) {
    sb.append("• ").append(team).append(" 선발: ")
        .append(starter.isKnown() ? starter.name() : "미정")
        .append(" (등번호 ").append(starter.backNumber() == null ? "N/A" : starter.backNumber())
        .append(")\n");
  }

  private static void seasonLine(StringBuilder sb, GamePreview.Starter starter) {
    if (starter.hasEra()) {
      sb.append("  - ").append(starter.isKnown() ? starter.name() : "").append(" 시즌 성적: ")
          .append(starter.wins()).append("승 ").append(starter.losses()).append("패, ERA ")
          .append(starter.era()).append('\n');
    }
  }

  String lineups(ScheduledGame game) {
    StringBuilder sb = new StringBuilder("📋 ").append(title(game));
    Optional<GamePreview> preview = preview(game).filter(GamePreview::hasLineups);
    if (preview.isEmpty()) {
      return sb.append("• 라인업 정보를 가져올 수 없습니다.\n").toString();
    }
    lineup(sb, game.homeName(), preview.get().homeLineup());
    lineup(sb, game.awayName(), preview.get().awayLineup());
    return sb.toString();
  }

  private static void lineup(StringBuilder sb, String team, List<GamePreview.LineupEntry> entries) {
    if (entries.isEmpty()) {
      return;
    }
    sb.append("• ").append(team).append(" 라인업:\n");
    for (GamePreview.LineupEntry entry : entries.subList(0, Math.min(LINEUP_SIZE, entries.size()))) {
      sb.append("  ").append(entry.position()).append(": ").append(entry.playerName())
          .append(" (").append(entry.backNumber()).append("번)\n");
    }
  }

  static String venueAndTime(ScheduledGame game) {
    return "🏟️ " + game.gameDate() + " - " + game.homeName() + " vs " + game.awayName() + "\n"
        + "• 경기장: " + game.stadium() + "\n"
        + "• 경기시간: " + game.startTime().orElse("시간 미정") + "\n";
  }

  String general(ScheduledGame game) {
    StringBuilder sb = new StringBuilder();
    sb.append("📅 ").append(game.gameDate()).append(" - ").append(game.homeName()).append(" vs ")
        .append(game.awayName()).append('\n');
    sb.append("• 경기장: ").append(game.stadium()).append('\n');
    sb.append("• 경기시간: ").append(game.startTime().orElse("시간 미정")).append('\n');
    preview(game)
        .filter(GamePreview::hasStarters)
        .ifPresent(
            p -> {
              if (p.homeStarter().isKnown()) {
                sb.append("• ").append(game.homeName()).append(" 선발: ").append(p.homeStarter().name()).append('\n');
              }
              if (p.awayStarter().isKnown()) {
                sb.append("• ").append(game.awayName()).append(" 선발: ").append(p.awayStarter().name()).append('\n');
              }
            });
    return sb.toString();
  }
}
