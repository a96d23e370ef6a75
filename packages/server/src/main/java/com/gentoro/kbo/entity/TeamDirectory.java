package com.gentoro.kbo.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable alias table mapping every surface form of a club to exactly one {@link Team}.
 *
 * <p>Text scanning is longest-alias-first: once a span of the question is claimed by an alias, no
 * shorter alias can match inside it, so {@code 한화이글스} is one match and not two. Latin aliases
 * are matched case-insensitively and only on word boundaries.
 */
public final class TeamDirectory {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(TeamDirectory.class);

  public static final String DEFAULT_RESOURCE = "catalog/teams.yaml";

  private final List<Team> teams;
  private final Map<String, Team> byCode;
  private final Map<String, Team> byAlias;
  private final List<String> aliasesLongestFirst;

  public TeamDirectory(List<Team> teams) {
    this.teams = List.copyOf(teams);
    Map<String, Team> codes = new LinkedHashMap<>();
    Map<String, Team> aliases = new LinkedHashMap<>();
    for (Team team : teams) {
      codes.put(team.code().toUpperCase(Locale.ROOT), team);
      register(aliases, team.name(), team);
      register(aliases, team.fullName(), team);
      team.aliases().forEach(alias -> register(aliases, alias, team));
    }
    this.byCode = Collections.unmodifiableMap(codes);
    this.byAlias = Collections.unmodifiableMap(aliases);
    List<String> ordered = new ArrayList<>(aliases.keySet());
    ordered.sort(Comparator.comparingInt(String::length).reversed());
    this.aliasesLongestFirst = List.copyOf(ordered);
  }

  private static void register(Map<String, Team> aliases, String alias, Team team) {
    if (alias == null || alias.isBlank()) {
      return;
    }
    String key = alias.trim().toLowerCase(Locale.ROOT);
    Team previous = aliases.putIfAbsent(key, team);
    if (previous != null && !previous.code().equals(team.code())) {
      throw new ConfigException(
          "Alias '" + alias + "' is mapped to both " + previous.code() + " and " + team.code());
    }
  }

  /** Load the directory from a classpath YAML resource. */
  public static TeamDirectory load(String resource) {
    try (InputStream in = TeamDirectory.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Team catalog not found on classpath: " + resource);
      }
      Catalog catalog = JacksonUtility.getYamlMapper().readValue(in, Catalog.class);
      log.debug("Loaded {} teams from {}", catalog.teams.size(), resource);
      return new TeamDirectory(catalog.teams);
    } catch (IOException e) {
      throw new ConfigException("Could not read team catalog " + resource, e);
    }
  }

  public static TeamDirectory loadDefault() {
    return load(DEFAULT_RESOURCE);
  }

  public List<Team> teams() {
    return teams;
  }

  public Set<String> codes() {
    return byCode.keySet();
  }

  public boolean isTeamCode(String value) {
    return value != null && byCode.containsKey(value.trim().toUpperCase(Locale.ROOT));
  }

  /** True when the value is a team code or any registered alias. */
  public boolean isTeamReference(String value) {
    return isTeamCode(value) || resolve(value).isPresent();
  }

  public Optional<Team> byCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byCode.get(code.trim().toUpperCase(Locale.ROOT)));
  }

  /** Resolve one complete alias (not a sentence) to its team. */
  public Optional<Team> resolve(String alias) {
    if (alias == null || alias.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(byAlias.get(alias.trim().toLowerCase(Locale.ROOT)));
  }

  /** Resolve either an alias or a code. */
  public Optional<Team> resolveAny(String value) {
    Optional<Team> team = resolve(value);
    return team.isPresent() ? team : byCode(value);
  }

  /**
   * Find every team mentioned in free text, in order of first appearance, without duplicates.
   */
  public List<Team> findAll(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    boolean[] claimed = new boolean[lower.length()];
    Map<Integer, Team> hits = new TreeMap<>();
    for (String alias : aliasesLongestFirst) {
      int from = 0;
      while (true) {
        int at = lower.indexOf(alias, from);
        if (at < 0) {
          break;
        }
        int end = at + alias.length();
        if (isFree(claimed, at, end) && onBoundary(lower, alias, at, end)) {
          for (int i = at; i < end; i++) {
            claimed[i] = true;
          }
          hits.put(at, byAlias.get(alias));
        }
        from = at + 1;
      }
    }
    List<Team> result = new ArrayList<>();
    for (Team team : hits.values()) {
      if (!result.contains(team)) {
        result.add(team);
      }
    }
    return result;
  }

  public Optional<Team> findFirst(String text) {
    List<Team> all = findAll(text);
    return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
  }

  private static boolean isFree(boolean[] claimed, int start, int end) {
    for (int i = start; i < end; i++) {
      if (claimed[i]) {
        return false;
      }
    }
    return true;
  }

  private static boolean onBoundary(String text, String alias, int start, int end) {
    if (!isAsciiLetter(alias.charAt(0))) {
      return true;
    }
    boolean leftOk = start == 0 || !isAsciiLetterOrDigit(text.charAt(start - 1));
    boolean rightOk = end >= text.length() || !isAsciiLetterOrDigit(text.charAt(end));
    return leftOk && rightOk;
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isAsciiLetterOrDigit(char c) {
    return isAsciiLetter(c) || (c >= '0' && c <= '9');
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class Catalog {
    @JsonProperty("teams")
    List<Team> teams = new ArrayList<>();
  }
}
