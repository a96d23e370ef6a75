package com.gentoro.kbo.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.store.RowValues;
import com.gentoro.kbo.utility.JacksonUtility;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * One row of {@code game_schedule}.
 *
 * @param detailStatusCode the game API's status code: {@code 0} scheduled, {@code 2} live, {@code
 *     4} final. Taken from the stored {@code game_data} when present, otherwise derived from
 *     {@code status_code}.
 */
public record ScheduledGame(
    String gameId,
    LocalDate gameDate,
    String gameDateTime,
    String stadium,
    String homeCode,
    String homeName,
    String awayCode,
    String awayName,
    Integer homeScore,
    Integer awayScore,
    String winner,
    String statusCode,
    String detailStatusCode) {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(ScheduledGame.class);

  public static final String STATUS_SCHEDULED = "0";
  public static final String STATUS_LIVE = "2";
  public static final String STATUS_FINAL = "4";

  public static ScheduledGame fromRow(JsonNode row) {
    String statusCode = RowValues.text(row, "status_code", "");
    return new ScheduledGame(
        RowValues.text(row, "game_id"),
        parseDate(RowValues.text(row, "game_date")),
        RowValues.text(row, "game_date_time"),
        RowValues.text(row, "stadium", ""),
        RowValues.text(row, "home_team_code"),
        RowValues.text(row, "home_team_name", ""),
        RowValues.text(row, "away_team_code"),
        RowValues.text(row, "away_team_name", ""),
        score(row, "home_team_score"),
        score(row, "away_team_score"),
        RowValues.text(row, "winner", ""),
        statusCode,
        detailStatus(row.get("game_data")).orElseGet(() -> fromStatusCode(statusCode)));
  }

  private static Integer score(JsonNode row, String column) {
    Double value = RowValues.number(row, column);
    return value == null ? null : value.intValue();
  }

  private static LocalDate parseDate(String value) {
    if (value == null || value.length() < 10) {
      return null;
    }
    try {
      return LocalDate.parse(value.substring(0, 10));
    } catch (DateTimeParseException e) {
      log.debug("Unparseable game_date '{}'", value);
      return null;
    }
  }

  /** {@code game_data} is a JSON column, but some loaders stored it as a JSON string. */
  private static Optional<String> detailStatus(JsonNode gameData) {
    JsonNode data = gameData;
    if (data != null && data.isTextual()) {
      try {
        data = JacksonUtility.getJsonMapper().readTree(data.asText());
      } catch (JsonProcessingException e) {
        log.debug("game_data is not JSON: {}", e.getOriginalMessage());
        return Optional.empty();
      }
    }
    if (data == null || !data.hasNonNull("statusCode")) {
      return Optional.empty();
    }
    return Optional.of(data.get("statusCode").asText());
  }

  private static String fromStatusCode(String statusCode) {
    return switch (statusCode) {
      case "LIVE" -> STATUS_LIVE;
      case "RESULT" -> STATUS_FINAL;
      default -> STATUS_SCHEDULED;
    };
  }

  public boolean homeWon() {
    return "HOME".equals(winner);
  }

  public boolean awayWon() {
    return "AWAY".equals(winner);
  }

  public int homeScoreOrZero() {
    return homeScore == null ? 0 : homeScore;
  }

  public int awayScoreOrZero() {
    return awayScore == null ? 0 : awayScore;
  }

  /** {@code HH:mm} of the start time, or empty when unknown. */
  public Optional<String> startTime() {
    if (gameDateTime == null || gameDateTime.length() < 16) {
      return Optional.empty();
    }
    return Optional.of(gameDateTime.substring(11, 16));
  }

  public boolean involves(String teamName) {
    return teamName.equals(homeName) || teamName.equals(awayName);
  }
}
