package com.gentoro.kbo.compiler;

import com.gentoro.kbo.entity.Team;
import com.gentoro.kbo.entity.TeamDirectory;
import com.gentoro.kbo.exception.CompileException;
import com.gentoro.kbo.exception.UnsupportedTableException;
import com.gentoro.kbo.schema.ColumnDescriptor;
import com.gentoro.kbo.schema.SchemaCatalog;
import com.gentoro.kbo.schema.TableDescriptor;
import com.gentoro.kbo.store.StoreQuery;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns model-authored pseudo-SQL into a {@link CompiledPlan} the REST store can run.
 *
 * <p>Compilation is pure apart from the team-games lookup used by the qualified-batter threshold,
 * which is only consulted for batting-average questions. A plan is never produced for a statement
 * the parser rejects, so rejected text never reaches the store.
 */
public class QueryCompiler {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(QueryCompiler.class);

  static final String STATS_TABLE = "player_season_stats";
  static final String PLAYER_COLUMN = "player_name";
  static final String SEASON_COLUMN = "gyear";
  static final String TEAM_COLUMN = "team";
  static final String AVERAGE_COLUMN = "hra";
  static final String ERA_COLUMN = "era";
  static final String PLATE_APPEARANCES_COLUMN = "ab";

  private static final List<String> AVERAGE_WORDS = List.of("타율", "batting average");
  private static final int MAX_OPERATIONS = 50;

  private final SchemaCatalog catalog;
  private final TeamDirectory teams;
  private final TeamGamesProvider teamGames;
  private final CompilerSettings settings;
  private final PseudoSqlParser parser;
  private final RoleInference roleInference;

  public QueryCompiler(
      SchemaCatalog catalog,
      TeamDirectory teams,
      TeamGamesProvider teamGames,
      CompilerSettings settings) {
    this.catalog = catalog;
    this.teams = teams;
    this.teamGames = teamGames;
    this.settings = settings;
    this.parser = new PseudoSqlParser();
    this.roleInference = new RoleInference(catalog, settings.roleWeights());
  }

  public ParseResult parse(String pseudoSql) {
    return parser.parse(pseudoSql);
  }

  /**
   * Compile one statement.
   *
   * @throws CompileException when the text is not a single supported SELECT, or names a column the
   *     table does not have in a filter or sort
   * @throws UnsupportedTableException when the table is not in the catalog
   */
  public CompiledPlan compile(String pseudoSql, String question) {
    ParseResult result = parser.parse(pseudoSql);
    if (result instanceof ParseResult.Err err) {
      CompileException ex = new CompileException(err.error().reason());
      ex.withContext("text", err.error().text());
      throw ex;
    }
    ParsedQuery query = ((ParseResult.Ok) result).query();
    TableDescriptor table =
        catalog.table(query.table()).orElseThrow(() -> new UnsupportedTableException(query.table()));
    validateColumns(query, table);

    Map<String, String> equalities = new LinkedHashMap<>();
    Map<String, List<String>> memberships = new LinkedHashMap<>();
    query.equalities().forEach((column, value) -> equalities.put(column, normalize(table, column, value)));
    query.memberships().forEach(
        (column, values) -> {
          Set<String> normalized = new LinkedHashSet<>();
          values.forEach(v -> normalized.add(normalize(table, column, v)));
          memberships.put(column, new ArrayList<>(normalized));
        });

    List<String> playerNames = stripTeamsFromPlayers(equalities, memberships);
    memberships.entrySet().removeIf(e -> e.getValue().isEmpty());
    // a one-value membership is an equality
    new ArrayList<>(memberships.keySet()).forEach(
        column -> {
          if (memberships.get(column).size() == 1) {
            equalities.put(column, memberships.remove(column).get(0));
          }
        });

    boolean statsTable = STATS_TABLE.equals(table.name());
    if (statsTable && !equalities.containsKey(SEASON_COLUMN) && !memberships.containsKey(SEASON_COLUMN)) {
      equalities.put(SEASON_COLUMN, settings.season());
    }

    PlayerRole role = statsTable ? roleInference.infer(query, question) : PlayerRole.BOTH;
    List<PostFilter> postFilters =
        statsTable && playerNames.isEmpty()
            ? derivePostFilters(query, question, role, equalities, memberships)
            : List.of();

    List<Map<String, String>> combinations = combinations(equalities, memberships);
    Locality locality =
        !postFilters.isEmpty() || combinations.size() > 1 ? Locality.CLIENT : Locality.SERVER;

    List<StoreQuery> operations = new ArrayList<>();
    for (Map<String, String> combination : combinations) {
      StoreQuery.Builder builder = StoreQuery.on(table.name());
      combination.forEach(builder::eq);
      query.ranges().forEach(r -> builder.range(r.column(), r.comparison(), r.value()));
      query.notNull().forEach(builder::notNull);
      if (locality == Locality.SERVER) {
        builder.order(query.order()).limit(query.limit());
      }
      operations.add(builder.build());
    }

    CompiledPlan plan =
        new CompiledPlan(
            table.name(),
            role,
            operations,
            postFilters,
            query.order(),
            query.limit(),
            locality,
            playerNames,
            query);
    log.debug(
        "Compiled {} -> {} operation(s), role={}, locality={}, filters={}",
        table.name(),
        operations.size(),
        role,
        locality,
        postFilters.stream().map(PostFilter::describe).toList());
    return plan;
  }

  private static void validateColumns(ParsedQuery query, TableDescriptor table) {
    for (String column : query.filteredColumns()) {
      if (!table.hasColumn(column)) {
        throw new CompileException("Unknown column '" + column + "' in table " + table.name());
      }
    }
    query.optionalOrder().ifPresent(
        order -> {
          if (!table.hasColumn(order.column())) {
            throw new CompileException(
                "Unknown sort column '" + order.column() + "' in table " + table.name());
          }
        });
  }

  /** Team literals are rewritten to the representation the column stores. */
  private String normalize(TableDescriptor table, String column, String value) {
    Optional<ColumnDescriptor> descriptor = table.column(column);
    if (descriptor.isEmpty()) {
      return value;
    }
    if (descriptor.get().isTeamName()) {
      return teams.resolveAny(value).map(Team::name).orElse(value);
    }
    if (descriptor.get().isTeamCode()) {
      return teams.resolveAny(value).map(Team::code).orElse(value);
    }
    return value;
  }

  /** Drops team codes and aliases from player predicates and returns the remaining names. */
  private List<String> stripTeamsFromPlayers(
      Map<String, String> equalities, Map<String, List<String>> memberships) {
    List<String> names = new ArrayList<>();
    String single = equalities.get(PLAYER_COLUMN);
    if (single != null) {
      if (teams.isTeamReference(single)) {
        log.debug("Dropping team reference '{}' used as a player name", single);
        equalities.remove(PLAYER_COLUMN);
      } else {
        names.add(single);
      }
    }
    List<String> many = memberships.get(PLAYER_COLUMN);
    if (many != null) {
      List<String> kept = many.stream().filter(v -> !teams.isTeamReference(v)).toList();
      if (kept.size() != many.size()) {
        log.debug("Dropping team references from player list {}", many);
      }
      memberships.put(PLAYER_COLUMN, new ArrayList<>(kept));
      names.addAll(kept);
    }
    return List.copyOf(names);
  }

  private List<PostFilter> derivePostFilters(
      ParsedQuery query,
      String question,
      PlayerRole role,
      Map<String, String> equalities,
      Map<String, List<String>> memberships) {
    List<PostFilter> filters = new ArrayList<>();
    if (role == PlayerRole.BATTER) {
      filters.add(new PostFilter.NotNull(AVERAGE_COLUMN, "batters only"));
    } else if (role == PlayerRole.PITCHER) {
      filters.add(new PostFilter.NotNull(ERA_COLUMN, "pitchers only"));
    }
    if (role != PlayerRole.PITCHER && asksForAverage(query, question)) {
      if (role == PlayerRole.BOTH) {
        filters.add(new PostFilter.NotNull(AVERAGE_COLUMN, "average required"));
      }
      filters.add(qualifiedBatterFilter(seasonOf(equalities), namedTeams(equalities, memberships)));
    }
    return filters;
  }

  private static boolean asksForAverage(ParsedQuery query, String question) {
    if (query.references(AVERAGE_COLUMN)) {
      return true;
    }
    String lower = question == null ? "" : question.toLowerCase(Locale.ROOT);
    return AVERAGE_WORDS.stream().anyMatch(lower::contains);
  }

  private String seasonOf(Map<String, String> equalities) {
    return equalities.getOrDefault(SEASON_COLUMN, settings.season());
  }

  private static List<String> namedTeams(
      Map<String, String> equalities, Map<String, List<String>> memberships) {
    List<String> named = new ArrayList<>();
    if (equalities.containsKey(TEAM_COLUMN)) {
      named.add(equalities.get(TEAM_COLUMN));
    }
    named.addAll(memberships.getOrDefault(TEAM_COLUMN, List.of()));
    return named;
  }

  /**
   * Plate appearances of at least {@code ceil(factor x games)}. With teams named each row is held
   * to its own team's threshold; otherwise the league-average threshold applies.
   */
  PostFilter.AtLeast qualifiedBatterFilter(String season, List<String> namedTeams) {
    Map<String, Integer> games = teamGames.gamesByTeam(season);
    if (!namedTeams.isEmpty()) {
      Map<String, Integer> minimums = new LinkedHashMap<>();
      for (String team : namedTeams) {
        Integer played = games.get(team);
        if (played != null) {
          minimums.put(team, threshold(played));
        }
      }
      return new PostFilter.AtLeast(
          PLATE_APPEARANCES_COLUMN, TEAM_COLUMN, minimums, leagueThreshold(games));
    }
    return new PostFilter.AtLeast(PLATE_APPEARANCES_COLUMN, null, Map.of(), leagueThreshold(games));
  }

  private int leagueThreshold(Map<String, Integer> games) {
    if (games.isEmpty()) {
      return 0;
    }
    double average = games.values().stream().mapToInt(Integer::intValue).average().orElse(0);
    return threshold(average);
  }

  int threshold(double games) {
    return BigDecimal.valueOf(settings.qualifiedPaFactor())
        .multiply(BigDecimal.valueOf(games))
        .setScale(0, RoundingMode.CEILING)
        .intValueExact();
  }

  /** Cartesian product of memberships, each combined with the plain equalities. */
  private static List<Map<String, String>> combinations(
      Map<String, String> equalities, Map<String, List<String>> memberships) {
    List<Map<String, String>> result = new ArrayList<>();
    result.add(new LinkedHashMap<>(equalities));
    for (Map.Entry<String, List<String>> membership : memberships.entrySet()) {
      List<Map<String, String>> next = new ArrayList<>();
      for (Map<String, String> partial : result) {
        for (String value : membership.getValue()) {
          Map<String, String> extended = new LinkedHashMap<>(partial);
          extended.put(membership.getKey(), value);
          next.add(extended);
        }
      }
      result = next;
      if (result.size() > MAX_OPERATIONS) {
        throw new CompileException("Too many IN alternatives, at most " + MAX_OPERATIONS + " are supported");
      }
    }
    return result;
  }
}
