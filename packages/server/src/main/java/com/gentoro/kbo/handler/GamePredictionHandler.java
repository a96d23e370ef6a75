package com.gentoro.kbo.handler;

import com.gentoro.kbo.classifier.Category;
import com.gentoro.kbo.entity.Team;
import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.KboException;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.game.GameDataClient;
import com.gentoro.kbo.game.GamePreview;
import com.gentoro.kbo.game.ScheduleRepository;
import com.gentoro.kbo.game.ScheduledGame;
import com.gentoro.kbo.game.StandingsRepository;
import com.gentoro.kbo.game.TeamStanding;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Predicts upcoming games.
 *
 * <p>With a team named, the team's next game is predicted (or its game on the resolved day).
 * Without one, every game of the resolved day, or of the upcoming week, is predicted under a
 * common title. Each game uses the game API preview when there is one and falls back to a
 * heuristic over the standings table.
 */
public class GamePredictionHandler implements CategoryHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(GamePredictionHandler.class);

  private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM월 dd일");

  /** Title words checked in order; the first one found in the question names the title. */
  private static final List<Map.Entry<String, String>> TITLES =
      List.of(
          Map.entry("내일", "내일 경기 예측"),
          Map.entry("모레", "모레 경기 예측"),
          Map.entry("글피", "글피 경기 예측"),
          Map.entry("다음 주", "다음 주 경기 예측"),
          Map.entry("이번 주", "이번 주 경기 예측"),
          Map.entry("앞으로", "앞으로 남은 경기 예측"),
          Map.entry("오늘", "오늘 경기 예측"));

  private final ScheduleRepository schedule;
  private final StandingsRepository standings;
  private final GameDataClient gameData;

  public GamePredictionHandler(
      ScheduleRepository schedule, StandingsRepository standings, GameDataClient gameData) {
    this.schedule = schedule;
    this.standings = standings;
    this.gameData = gameData;
  }

  @Override
  public Category category() {
    return Category.GAME_PREDICTION;
  }

  @Override
  public String handle(HandlerRequest request) {
    try {
      return request.entities().hasTeam() ? forTeams(request) : forDay(request);
    } catch (StoreException e) {
      log.warn("Prediction data unavailable: {}", ExceptionUtil.extractErrorMessage(e));
      return NoDataMessages.NO_PREDICTION_DATA;
    }
  }

  private String forTeams(HandlerRequest request) {
    List<Team> teams = request.entities().teams();
    for (Team team : teams) {
      Optional<ScheduledGame> game =
          request.date().isPresent()
              ? schedule.forTeamOn(team, request.date().get())
              : schedule.nextForTeam(team, request.today());
      if (game.isPresent()) {
        return predict(game.get());
      }
    }
    return teams.stream().map(Team::name).collect(Collectors.joining(", "))
        + "의 다음 경기 일정을 찾을 수 없습니다.";
  }

  private String forDay(HandlerRequest request) {
    List<ScheduledGame> games =
        request.date().isPresent()
            ? schedule.onDate(request.date().get())
            : schedule.between(request.upcomingWindow());
    if (games.isEmpty()) {
      return NoDataMessages.NO_GAMES_FOR_PREDICTION;
    }
    List<String> predictions = new ArrayList<>();
    for (ScheduledGame game : games) {
      predictions.add("🏟️ " + game.homeName() + " vs " + game.awayName() + "\n" + predict(game));
    }
    String title = title(request.question(), games);
    if (games.size() == 1) {
      return "📅 " + title + "\n\n" + predictions.get(0);
    }
    return "📅 " + title + " (" + games.size() + "경기)\n\n" + String.join("\n\n", predictions);
  }

  static String title(String question, List<ScheduledGame> games) {
    String text = question == null ? "" : question.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, String> entry : TITLES) {
      if (text.contains(entry.getKey())) {
        return entry.getValue();
      }
    }
    if (!games.isEmpty() && games.get(0).gameDate() != null) {
      return MONTH_DAY.format(games.get(0).gameDate()) + " 경기 예측";
    }
    return "경기 예측";
  }

  String predict(ScheduledGame game) {
    Optional<GamePreview> preview = preview(game);
    return preview.isPresent() ? fromPreview(game, preview.get()) : fromStandings(game);
  }

  private Optional<GamePreview> preview(ScheduledGame game) {
    if (game.gameId() == null) {
      return Optional.empty();
    }
    try {
      return gameData.getPreview(game.gameId()).map(GamePreview::from);
    } catch (KboException e) {
      log.warn(
          "Preview unavailable for game {}, using standings: {}",
          game.gameId(),
          ExceptionUtil.extractErrorMessage(e));
      return Optional.empty();
    }
  }

  private static String header(ScheduledGame game) {
    return "📅 " + game.gameDate() + " " + game.stadium() + "에서 열리는 " + game.homeName() + " vs "
        + game.awayName() + " 경기";
  }

  static String fromPreview(ScheduledGame game, GamePreview preview) {
    String home = game.homeName();
    String away = game.awayName();
    StringBuilder sb = new StringBuilder(header(game)).append(" 예측\n\n");

    sb.append("🏆 팀 순위 및 성적:\n");
    sb.append("• ").append(home).append(": ").append(orNa(preview.homeStanding().rank()))
        .append("위 (승률 ").append(orNa(preview.homeStanding().winRate())).append(")\n");
    sb.append("• ").append(away).append(": ").append(orNa(preview.awayStanding().rank()))
        .append("위 (승률 ").append(orNa(preview.awayStanding().winRate())).append(")\n\n");

    sb.append("⚾ 선발투수:\n");
    sb.append("• ").append(home).append(" - ").append(orNa(preview.homeStarter().name()))
        .append(" (ERA ").append(orNa(preview.homeStarter().era())).append(")\n");
    sb.append("• ").append(away).append(" - ").append(orNa(preview.awayStarter().name()))
        .append(" (ERA ").append(orNa(preview.awayStarter().era())).append(")\n\n");

    sb.append("🔥 주요 선수:\n");
    sb.append("• ").append(home).append(" - ").append(orNa(preview.homeKeyPlayer().name()))
        .append(" (타율 ").append(orNa(preview.homeKeyPlayer().battingAverage())).append(")\n");
    sb.append("• ").append(away).append(" - ").append(orNa(preview.awayKeyPlayer().name()))
        .append(" (타율 ").append(orNa(preview.awayKeyPlayer().battingAverage())).append(")\n\n");

    sb.append("📊 시즌 상대전적:\n");
    sb.append("• ").append(home).append(' ').append(preview.homeWins()).append("승 ")
        .append(preview.awayWins()).append("패 ").append(away).append("\n\n");

    sb.append("🎯 경기 예상:\n");
    Integer homeRank = preview.homeStanding().rank();
    Integer awayRank = preview.awayStanding().rank();
    if (homeRank != null && awayRank != null && !homeRank.equals(awayRank)) {
      boolean homeAhead = homeRank < awayRank;
      sb.append("• ").append(homeAhead ? home : away).append("이 순위상 우세 (")
          .append(homeAhead ? homeRank : awayRank).append("위 vs ")
          .append(homeAhead ? awayRank : homeRank).append("위)\n");
    } else {
      sb.append("• 양팀 순위가 비슷함 (").append(orNa(homeRank)).append("위 vs ")
          .append(orNa(awayRank)).append("위)\n");
    }
    sb.append("• ").append(home).append("의 홈구장 우세\n");

    Double homeEra = era(preview.homeStarter().era());
    Double awayEra = era(preview.awayStarter().era());
    if (homeEra != null && awayEra != null && !homeEra.equals(awayEra)) {
      boolean homeBetter = homeEra < awayEra;
      sb.append("• ").append(homeBetter ? home : away).append(" 선발투수가 상대적으로 우수 (ERA ")
          .append(homeBetter ? homeEra : awayEra).append(" vs ")
          .append(homeBetter ? awayEra : homeEra).append(")\n");
    }
    return sb.toString();
  }

  private static Double era(String text) {
    if (text == null) {
      return null;
    }
    try {
      return Double.parseDouble(text.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String orNa(Object value) {
    return value == null ? "N/A" : value.toString();
  }

  String fromStandings(ScheduledGame game) {
    Optional<TeamStanding> home = standings.forTeam(game.homeName());
    Optional<TeamStanding> away = standings.forTeam(game.awayName());
    if (home.isEmpty() || away.isEmpty()) {
      return header(game) + "\n\n팀 통계 데이터를 찾을 수 없습니다.";
    }
    return standingsPrediction(game, home.get(), away.get());
  }

  /**
   * One point per advantage of the home side: better rank, higher win rate, higher OPS, lower ERA.
   * Three or more favours the home team, one or less the away team, two is a close game.
   */
  static String standingsPrediction(ScheduledGame game, TeamStanding home, TeamStanding away) {
    int advantage = 0;
    if (home.ranking() < away.ranking()) {
      advantage++;
    }
    if (home.winRate() > away.winRate()) {
      advantage++;
    }
    if (home.offenseOps() > away.offenseOps()) {
      advantage++;
    }
    if (home.defenseEra() < away.defenseEra()) {
      advantage++;
    }
    String homeName = game.homeName();
    String awayName = game.awayName();
    String prediction;
    String confidence;
    if (advantage >= 3) {
      prediction = "🏆 " + homeName + " 승리 예상";
      confidence = "높음";
    } else if (advantage <= 1) {
      prediction = "🏆 " + awayName + " 승리 예상";
      confidence = "높음";
    } else {
      prediction = "⚖️ 접전 예상";
      confidence = "보통";
    }
    return String.format(
        Locale.ROOT,
        """
        %s 예측

        🏟️ 경기 정보:
        • 날짜: %s
        • 경기장: %s
        • 홈팀: %s
        • 원정팀: %s

        📊 상대전적 분석:
        • %s: %d위 (승률 %.3f)
        • %s: %d위 (승률 %.3f)

        ⚾ 공격력 비교:
        • %s OPS: %.3f
        • %s OPS: %.3f

        🥎 수비력 비교:
        • %s ERA: %.2f
        • %s ERA: %.2f

        📈 최근 5경기:
        • %s: %s (%d승)
        • %s: %s (%d승)

        🎯 예측 결과: %s (신뢰도: %s)

        💡 팁: 실제 경기 결과는 예측과 다를 수 있으니 경기를 직접 관람해보세요!""",
        header(game),
        game.gameDate(),
        game.stadium(),
        homeName,
        awayName,
        homeName, home.ranking(), home.winRate(),
        awayName, away.ranking(), away.winRate(),
        homeName, home.offenseOps(),
        awayName, away.offenseOps(),
        homeName, home.defenseEra(),
        awayName, away.defenseEra(),
        homeName, home.lastFiveGames(), home.recentWins(),
        awayName, away.lastFiveGames(), away.recentWins(),
        prediction,
        confidence);
  }
}
