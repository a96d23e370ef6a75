package com.gentoro.kbo.game;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/** The parts of a {@code previewData} payload the prediction and detail answers use. */
public record GamePreview(
    Standing homeStanding,
    Standing awayStanding,
    Starter homeStarter,
    Starter awayStarter,
    KeyPlayer homeKeyPlayer,
    KeyPlayer awayKeyPlayer,
    int homeWins,
    int awayWins,
    List<LineupEntry> homeLineup,
    List<LineupEntry> awayLineup) {

  /** {@code rank} is null when the API leaves it out. */
  public record Standing(Integer rank, String winRate) {}

  public record Starter(String name, String backNumber, String era, int wins, int losses) {
    public boolean isKnown() {
      return name != null && !name.isBlank();
    }

    /** A season ERA worth quoting; {@code 0.00} means the pitcher has no innings yet. */
    public boolean hasEra() {
      return era != null && !era.isBlank() && !"0.00".equals(era);
    }
  }

  public record KeyPlayer(String name, String battingAverage) {}

  public record LineupEntry(String position, String playerName, String backNumber) {}

  public GamePreview {
    homeLineup = List.copyOf(homeLineup);
    awayLineup = List.copyOf(awayLineup);
  }

  public static GamePreview from(JsonNode previewData) {
    JsonNode vs = previewData.path("seasonVsResult");
    return new GamePreview(
        standing(previewData.path("homeStandings")),
        standing(previewData.path("awayStandings")),
        starter(previewData.path("homeStarter")),
        starter(previewData.path("awayStarter")),
        keyPlayer(previewData.path("homeTopPlayer")),
        keyPlayer(previewData.path("awayTopPlayer")),
        vs.path("hw").asInt(0),
        vs.path("aw").asInt(0),
        lineup(previewData.path("homeTeamLineUp")),
        lineup(previewData.path("awayTeamLineUp")));
  }

  private static Standing standing(JsonNode node) {
    JsonNode rank = node.path("rank");
    return new Standing(
        rank.isNumber() || rank.asText("").matches("\\d+") ? rank.asInt() : null,
        textOrNull(node.path("wra")));
  }

  private static Starter starter(JsonNode node) {
    JsonNode info = node.path("playerInfo");
    JsonNode stats = node.path("currentSeasonStats");
    return new Starter(
        textOrNull(info.path("name")),
        textOrNull(info.path("backnum")),
        textOrNull(stats.path("era")),
        stats.path("w").asInt(0),
        stats.path("l").asInt(0));
  }

  private static KeyPlayer keyPlayer(JsonNode node) {
    return new KeyPlayer(
        textOrNull(node.path("playerInfo").path("name")),
        textOrNull(node.path("currentSeasonStats").path("hra")));
  }

  private static List<LineupEntry> lineup(JsonNode node) {
    List<LineupEntry> entries = new ArrayList<>();
    for (JsonNode player : node.path("fullLineUp")) {
      entries.add(
          new LineupEntry(
              player.path("positionName").asText("N/A"),
              player.path("playerName").asText("N/A"),
              player.path("backnum").asText("N/A")));
    }
    return entries;
  }

  private static String textOrNull(JsonNode node) {
    return node.isMissingNode() || node.isNull() ? null : node.asText();
  }

  public boolean hasStarters() {
    return homeStarter.isKnown() || awayStarter.isKnown();
  }

  public boolean hasLineups() {
    return !homeLineup.isEmpty() || !awayLineup.isEmpty();
  }
}
