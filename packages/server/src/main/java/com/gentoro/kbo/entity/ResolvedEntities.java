package com.gentoro.kbo.entity;

import java.util.List;
import java.util.Optional;

/** Entities found in one question. Created per question and never mutated. */
public record ResolvedEntities(DateResolution dates, List<Team> teams, List<String> players) {
  public ResolvedEntities {
    dates = dates == null ? DateResolution.none() : dates;
    teams = teams == null ? List.of() : List.copyOf(teams);
    players = players == null ? List.of() : List.copyOf(players);
  }

  public boolean hasTeam() {
    return !teams.isEmpty();
  }

  public Optional<Team> firstTeam() {
    return teams.isEmpty() ? Optional.empty() : Optional.of(teams.get(0));
  }

  public boolean hasDate() {
    return dates.isResolved();
  }
}
