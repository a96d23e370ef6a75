package com.gentoro.kbo.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.entity.Team;
import com.gentoro.kbo.entity.TeamDirectory;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.store.RemoteStore;
import com.gentoro.kbo.store.RowValues;
import com.gentoro.kbo.store.StoreQuery;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Team games played, taken as the largest {@code gamenum} of any player on the team. Teams the
 * store knows nothing about, or every team when the store is unreachable, fall back to the games
 * configured in the team catalog.
 */
public class StoreTeamGamesProvider implements TeamGamesProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(StoreTeamGamesProvider.class);

  static final String TABLE = "player_season_stats";

  private final RemoteStore store;
  private final TeamDirectory teams;

  public StoreTeamGamesProvider(RemoteStore store, TeamDirectory teams) {
    this.store = store;
    this.teams = teams;
  }

  @Override
  public Map<String, Integer> gamesByTeam(String season) {
    Map<String, Integer> games = new LinkedHashMap<>();
    try {
      for (JsonNode row : store.select(StoreQuery.on(TABLE).eq("gyear", season).build())) {
        String team = RowValues.text(row, "team");
        int played = RowValues.integer(row, "gamenum", 0);
        if (team != null && played > 0) {
          games.merge(team, played, Math::max);
        }
      }
    } catch (StoreException e) {
      log.warn("Team games unavailable for season {}, using catalog values: {}", season, e.getMessage());
    }
    for (Team team : teams.teams()) {
      games.putIfAbsent(team.name(), team.games());
    }
    return games;
  }
}
