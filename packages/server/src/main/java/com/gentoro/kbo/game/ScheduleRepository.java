package com.gentoro.kbo.game;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.entity.DateRange;
import com.gentoro.kbo.entity.Team;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.store.OrderSpec;
import com.gentoro.kbo.store.RemoteStore;
import com.gentoro.kbo.store.StoreQuery;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only lookups on {@code game_schedule} used by the specialized handlers. Every method throws
 * {@link StoreException} when the store cannot be reached; callers decide how to degrade.
 */
public class ScheduleRepository {
  static final String TABLE = "game_schedule";

  private static final Comparator<ScheduledGame> BY_DATE =
      Comparator.comparing(
          ScheduledGame::gameDate, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()));

  private final RemoteStore store;

  public ScheduleRepository(RemoteStore store) {
    this.store = store;
  }

  public List<ScheduledGame> onDate(LocalDate date) {
    return games(
        StoreQuery.on(TABLE)
            .eq("game_date", date.toString())
            .order(OrderSpec.asc("game_date_time"))
            .build());
  }

  public List<ScheduledGame> between(DateRange range) {
    return games(
        StoreQuery.on(TABLE)
            .gte("game_date", range.from().toString())
            .lte("game_date", range.to().toString())
            .order(OrderSpec.asc("game_date"))
            .build());
  }

  /** The most recent game date on or before {@code day}. */
  public Optional<LocalDate> latestDate(LocalDate day) {
    return games(
            StoreQuery.on(TABLE)
                .lte("game_date", day.toString())
                .order(OrderSpec.desc("game_date"))
                .limit(1)
                .build())
        .stream()
        .map(ScheduledGame::gameDate)
        .filter(d -> d != null)
        .findFirst();
  }

  /** The team's game on a date, home games looked up first. */
  public Optional<ScheduledGame> forTeamOn(Team team, LocalDate date) {
    for (String column : List.of("home_team_code", "away_team_code")) {
      List<ScheduledGame> found =
          games(StoreQuery.on(TABLE).eq(column, team.code()).eq("game_date", date.toString()).build());
      if (!found.isEmpty()) {
        return Optional.of(found.get(0));
      }
    }
    return Optional.empty();
  }

  /** The team's latest game on or before {@code day}, home or away. */
  public Optional<ScheduledGame> latestForTeam(Team team, LocalDate day) {
    List<ScheduledGame> candidates = new ArrayList<>();
    for (String column : List.of("home_team_code", "away_team_code")) {
      candidates.addAll(
          games(
              StoreQuery.on(TABLE)
                  .eq(column, team.code())
                  .lte("game_date", day.toString())
                  .order(OrderSpec.desc("game_date"))
                  .limit(1)
                  .build()));
    }
    return candidates.stream().max(BY_DATE);
  }

  /** The team's next game on or after {@code day}, home or away. */
  public Optional<ScheduledGame> nextForTeam(Team team, LocalDate day) {
    List<ScheduledGame> candidates = new ArrayList<>();
    for (String column : List.of("home_team_name", "away_team_name")) {
      candidates.addAll(
          games(
              StoreQuery.on(TABLE)
                  .eq(column, team.name())
                  .gte("game_date", day.toString())
                  .order(OrderSpec.asc("game_date"))
                  .limit(1)
                  .build()));
    }
    return candidates.stream().min(BY_DATE);
  }

  /** Every game of the team inside the range, in date order. */
  public List<ScheduledGame> forTeamBetween(Team team, DateRange range) {
    List<ScheduledGame> found = new ArrayList<>();
    for (String column : List.of("home_team_name", "away_team_name")) {
      found.addAll(
          games(
              StoreQuery.on(TABLE)
                  .eq(column, team.name())
                  .gte("game_date", range.from().toString())
                  .lte("game_date", range.to().toString())
                  .build()));
    }
    found.sort(BY_DATE);
    return found;
  }

  private List<ScheduledGame> games(StoreQuery query) {
    List<ScheduledGame> games = new ArrayList<>();
    for (JsonNode row : store.select(query)) {
      games.add(ScheduledGame.fromRow(row));
    }
    return games;
  }
}
