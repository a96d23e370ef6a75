package com.gentoro.kbo.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A KBO club as described in {@code catalog/teams.yaml}.
 *
 * @param code canonical team code used by the schedule table (e.g. {@code HH})
 * @param name short name used by the season and standings tables (e.g. {@code 한화})
 * @param fullName name with nickname (e.g. {@code 한화 이글스})
 * @param stadium home stadium
 * @param games fallback games-played count for the qualified-batter threshold
 * @param aliases every surface form that should resolve to this team
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Team(
    @JsonProperty("code") String code,
    @JsonProperty("name") String name,
    @JsonProperty("fullName") String fullName,
    @JsonProperty("stadium") String stadium,
    @JsonProperty("games") int games,
    @JsonProperty("aliases") List<String> aliases) {

  public Team {
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
  }
}
