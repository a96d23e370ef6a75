package com.gentoro.kbo.handler;

import com.gentoro.kbo.game.GameRecord;
import com.gentoro.kbo.game.ScheduledGame;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/** Korean text renderings of single games. Stateless. */
public class GameSummaryFormatter {
  static final DateTimeFormatter KOREAN_DATE = DateTimeFormatter.ofPattern("yyyy년 MM월 dd일");
  static final DateTimeFormatter RECORD_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
  static final String RULE = "=".repeat(50);

  public static String koreanDate(LocalDate date) {
    return date == null ? "날짜 미상" : KOREAN_DATE.format(date);
  }

  public String recordSummary(GameRecord record) {
    List<String> lines = new ArrayList<>();
    lines.add(
        "📅 " + recordDate(record.date()) + " " + record.stadium() + "에서 열린 "
            + record.awayTeam() + " vs " + record.homeTeam() + " 경기 결과입니다.");
    if (record.homeScore() == record.awayScore()) {
      lines.add(
          "🤝 " + record.awayTeam() + " " + record.awayScore() + " - " + record.homeScore() + " "
              + record.homeTeam() + " 무승부로 끝났습니다.");
    } else if (record.homeWon()) {
      lines.add(winLine(record.homeTeam(), record.homeScore(), record.awayScore(), record.awayTeam()));
    } else {
      lines.add(winLine(record.awayTeam(), record.awayScore(), record.homeScore(), record.homeTeam()));
    }
    lines.add(
        "⚾ 경기 흐름: " + record.awayTeam() + "은 " + record.awayMomentum() + ", "
            + record.homeTeam() + "은 " + record.homeMomentum() + "을 보였습니다.");
    if (record.awayStarter().isKnown() && record.homeStarter().isKnown()) {
      lines.add(
          "🎯 선발 투수: " + record.awayTeam() + " " + record.awayStarter().name()
              + " (" + record.awayStarter().innings() + "이닝) vs " + record.homeTeam() + " "
              + record.homeStarter().name() + " (" + record.homeStarter().innings() + "이닝)");
    }
    if (!record.homeRuns().isEmpty()) {
      lines.add("💥 홈런: " + String.join(", ", record.homeRuns()));
    }
    if (!record.winningHits().isEmpty()) {
      lines.add("🔥 결승타: " + String.join(", ", record.winningHits()));
    }
    return String.join("\n", lines);
  }

  private static String winLine(String winner, int winScore, int loseScore, String loser) {
    return "🏆 " + winner + " " + winScore + " - " + loseScore + " " + loser + "로 승리했습니다.";
  }

  private static String recordDate(String date) {
    if (date == null || date.isBlank()) {
      return "날짜 미상";
    }
    try {
      return KOREAN_DATE.format(LocalDate.parse(date, RECORD_DATE));
    } catch (DateTimeParseException e) {
      return date;
    }
  }

  /** Summary from the schedule row alone, used before a game starts or when no record exists. */
  public String basicSummary(ScheduledGame game) {
    String away = game.awayName();
    String home = game.homeName();
    StringBuilder sb = new StringBuilder();
    sb.append("📅 ").append(koreanDate(game.gameDate())).append(' ').append(game.stadium())
        .append("에서 열린 ").append(away).append(" vs ").append(home).append(" 경기\n");
    int as = game.awayScoreOrZero();
    int hs = game.homeScoreOrZero();
    switch (game.detailStatusCode()) {
      case ScheduledGame.STATUS_SCHEDULED -> {
        game.startTime().ifPresent(t -> sb.append("⏰ 경기 시간: ").append(t).append('\n'));
        sb.append("📋 경기가 예정되어 있습니다.\n");
        sb.append("🏟️ 경기장: ").append(game.stadium()).append('\n');
        sb.append("⚾ ").append(away).append(" vs ").append(home).append("의 경기를 기대해주세요!");
      }
      case ScheduledGame.STATUS_LIVE -> {
        sb.append("🔥 현재 경기가 진행 중입니다!\n");
        if (hs > 0 || as > 0) {
          sb.append("📊 현재 점수: ").append(away).append(' ').append(as).append(" - ").append(hs)
              .append(' ').append(home).append('\n');
        }
        sb.append("⚾ 실시간 경기 상황을 확인해보세요!");
      }
      case ScheduledGame.STATUS_FINAL -> {
        if (game.homeWon()) {
          sb.append("🏆 ").append(home).append(' ').append(hs).append(" - ").append(as).append(' ')
              .append(away).append("로 승리");
        } else if (game.awayWon()) {
          sb.append("🏆 ").append(away).append(' ').append(as).append(" - ").append(hs).append(' ')
              .append(home).append("로 승리");
        } else {
          sb.append("🏆 ").append(away).append(' ').append(as).append(" - ").append(hs).append(' ')
              .append(home);
        }
        sb.append("\n⚾ 경기 상태: 종료");
      }
      default -> {
        if (hs > 0 || as > 0) {
          sb.append("📊 점수: ").append(away).append(' ').append(as).append(" - ").append(hs)
              .append(' ').append(home).append('\n');
        }
        sb.append("📋 경기 정보를 확인해주세요. (상태코드: ").append(game.detailStatusCode()).append(')');
      }
    }
    return sb.toString();
  }

  public static String statusLabel(String statusCode) {
    return switch (statusCode == null ? "" : statusCode) {
      case "BEFORE" -> "예정";
      case "LIVE" -> "진행중";
      case "RESULT" -> "종료";
      default -> statusCode;
    };
  }
}
