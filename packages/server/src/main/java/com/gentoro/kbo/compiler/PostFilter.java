package com.gentoro.kbo.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.store.RowValues;
import java.util.Map;

/** Business rule applied to fetched rows before any sort or limit. */
public sealed interface PostFilter {

  boolean test(JsonNode row);

  String describe();

  /** Drops rows whose column is null. */
  record NotNull(String column, String reason) implements PostFilter {
    @Override
    public boolean test(JsonNode row) {
      return !RowValues.isNull(row, column);
    }

    @Override
    public String describe() {
      return column + " IS NOT NULL (" + reason + ")";
    }
  }

  /**
   * Keeps rows whose column is at least a minimum. The minimum is looked up by the row's team when
   * {@code minimumByTeam} has an entry for it, otherwise {@code defaultMinimum} applies.
   */
  record AtLeast(
      String column, String teamColumn, Map<String, Integer> minimumByTeam, int defaultMinimum)
      implements PostFilter {

    public AtLeast {
      minimumByTeam = Map.copyOf(minimumByTeam);
    }

    public int minimumFor(JsonNode row) {
      String team = teamColumn == null ? null : RowValues.text(row, teamColumn);
      return team == null ? defaultMinimum : minimumByTeam.getOrDefault(team, defaultMinimum);
    }

    @Override
    public boolean test(JsonNode row) {
      Double value = RowValues.number(row, column);
      return value != null && value >= minimumFor(row);
    }

    @Override
    public String describe() {
      return minimumByTeam.isEmpty()
          ? column + " >= " + defaultMinimum
          : column + " >= per-team minimum " + minimumByTeam;
    }
  }
}
