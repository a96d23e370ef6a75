package com.gentoro.kbo.game;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.store.RowValues;

/** A team's line in {@code game_result}. */
public record TeamStanding(
    String teamName,
    int ranking,
    double winRate,
    double offenseOps,
    double defenseEra,
    String lastFiveGames) {

  public static TeamStanding fromRow(JsonNode row) {
    return new TeamStanding(
        RowValues.text(row, "team_name", ""),
        RowValues.integer(row, "ranking", 0),
        doubleOrZero(row, "wra"),
        doubleOrZero(row, "offense_ops"),
        doubleOrZero(row, "defense_era"),
        RowValues.text(row, "last_five_games", ""));
  }

  private static double doubleOrZero(JsonNode row, String column) {
    Double value = RowValues.number(row, column);
    return value == null ? 0.0 : value;
  }

  /** Wins among the last five games, encoded as a string of {@code W}, {@code L} and {@code D}. */
  public int recentWins() {
    return (int) lastFiveGames.chars().filter(c -> c == 'W').count();
  }
}
