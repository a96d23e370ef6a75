package com.gentoro.kbo.game;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/** Turns a {@code recordData} payload into a {@link GameRecord}. */
public class GameRecordAnalyzer {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(GameRecordAnalyzer.class);

  static final String NO_DATA = "데이터 없음";
  static final String NO_RUNS = "득점 없음";
  static final String EARLY_ONLY = "초반 집중 득점";
  static final String LATE_ONLY = "후반 역전";
  static final String EARLY_AND_LATE = "초반-후반 득점";
  static final String SPREAD = "고른 득점";

  public GameRecord analyze(JsonNode recordData) {
    JsonNode info = recordData.path("gameInfo");
    JsonNode scoreBoard = recordData.path("scoreBoard");
    JsonNode pitchers = recordData.path("pitchersBoxscore");

    List<String> homeRuns = new ArrayList<>();
    List<String> stolenBases = new ArrayList<>();
    List<String> errors = new ArrayList<>();
    List<String> winningHits = new ArrayList<>();
    for (JsonNode record : recordData.path("etcRecords")) {
      String result = record.path("result").asText("");
      switch (record.path("how").asText("")) {
        case "홈런" -> homeRuns.add(result);
        case "도루" -> stolenBases.add(result);
        case "실책" -> errors.add(result);
        case "결승타" -> winningHits.add(result);
        default -> {
          // other notes (e.g. 병살타) are not summarized
        }
      }
    }

    GameRecord record =
        new GameRecord(
            info.path("gdate").asText(""),
            info.path("stadium").asText(""),
            teamName(info, "h"),
            teamName(info, "a"),
            scoreBoard.path("rheb").path("home").path("r").asInt(0),
            scoreBoard.path("rheb").path("away").path("r").asInt(0),
            momentum(innings(scoreBoard.path("inn").path("home"))),
            momentum(innings(scoreBoard.path("inn").path("away"))),
            starter(pitchers.path("home")),
            starter(pitchers.path("away")),
            homeRuns,
            stolenBases,
            errors,
            winningHits);
    log.debug("Analyzed record {} {}-{} {}", record.awayTeam(), record.awayScore(), record.homeScore(), record.homeTeam());
    return record;
  }

  private static String teamName(JsonNode info, String side) {
    String full = info.path(side + "FullName").asText("");
    return full.isBlank() ? info.path(side + "Name").asText("") : full;
  }

  /** Runs per inning; non-numeric cells such as {@code "-"} or {@code "X"} count as zero. */
  private static List<Integer> innings(JsonNode cells) {
    List<Integer> runs = new ArrayList<>();
    for (JsonNode cell : cells) {
      runs.add(cell.isNumber() ? cell.asInt() : parseOrZero(cell.asText()));
    }
    return runs;
  }

  private static int parseOrZero(String text) {
    return text.matches("\\d+") ? Integer.parseInt(text) : 0;
  }

  /**
   * Scoring pattern of one team. Innings 1-3 are early, 4-6 middle, 7 and later late.
   */
  public static String momentum(List<Integer> innings) {
    if (innings.isEmpty()) {
      return NO_DATA;
    }
    List<Integer> scoring = new ArrayList<>();
    for (int i = 0; i < innings.size(); i++) {
      if (innings.get(i) > 0) {
        scoring.add(i + 1);
      }
    }
    if (scoring.isEmpty()) {
      return NO_RUNS;
    }
    if (scoring.size() == 1) {
      return scoring.get(0) + "회에만 득점";
    }
    boolean early = scoring.stream().anyMatch(i -> i <= 3);
    boolean middle = scoring.stream().anyMatch(i -> i >= 4 && i <= 6);
    boolean late = scoring.stream().anyMatch(i -> i >= 7);
    if (early && !middle && !late) {
      return EARLY_ONLY;
    }
    if (late && !early && !middle) {
      return LATE_ONLY;
    }
    if (early && late) {
      return EARLY_AND_LATE;
    }
    return SPREAD;
  }

  /** The pitcher with the most whole innings is taken as the starter. */
  private static GameRecord.PitcherLine starter(JsonNode pitchers) {
    JsonNode best = null;
    double bestInnings = -1;
    for (JsonNode pitcher : pitchers) {
      double innings = wholeInnings(pitcher.path("inn").asText(""));
      if (innings > bestInnings) {
        best = pitcher;
        bestInnings = innings;
      }
    }
    if (best == null) {
      return new GameRecord.PitcherLine("", "", 0, 0, 0, 0, "0.00");
    }
    return new GameRecord.PitcherLine(
        best.path("name").asText(""),
        best.path("inn").asText(""),
        best.path("hit").asInt(0),
        best.path("r").asInt(0),
        best.path("kk").asInt(0),
        best.path("bb").asInt(0),
        best.path("era").asText("0.00"));
  }

  private static double wholeInnings(String innings) {
    String first = innings.trim().split("\\s+")[0];
    try {
      return first.isEmpty() ? 0 : Double.parseDouble(first);
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
