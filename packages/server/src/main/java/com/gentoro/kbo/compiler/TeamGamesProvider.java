package com.gentoro.kbo.compiler;

import java.util.Map;

/** Games played per team, keyed by the short team name used in {@code player_season_stats}. */
@FunctionalInterface
public interface TeamGamesProvider {

  Map<String, Integer> gamesByTeam(String season);
}
