package com.gentoro.kbo.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.compiler.CompiledPlan;
import com.gentoro.kbo.compiler.CompilerSettings;
import com.gentoro.kbo.compiler.Locality;
import com.gentoro.kbo.compiler.PlayerRole;
import com.gentoro.kbo.compiler.QueryCompiler;
import com.gentoro.kbo.compiler.StoreTeamGamesProvider;
import com.gentoro.kbo.entity.TeamDirectory;
import com.gentoro.kbo.schema.SchemaCatalog;
import com.gentoro.kbo.support.Fixtures;
import com.gentoro.kbo.support.InMemoryRemoteStore;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExecutionAdapterTest {

  private static final TeamDirectory TEAMS = TeamDirectory.loadDefault();

  private final InMemoryRemoteStore store = Fixtures.statsStore();
  private final QueryCompiler compiler =
      new QueryCompiler(
          SchemaCatalog.loadDefault(),
          TEAMS,
          new StoreTeamGamesProvider(store, TEAMS),
          CompilerSettings.defaults());
  private final ExecutionAdapter executor = new ExecutionAdapter(store);

  private static List<String> names(QueryOutcome outcome) {
    return outcome.rowsOrEmpty().stream().map(r -> RowValues.text(r, "player_name")).toList();
  }

  @Test
  @DisplayName("qualified batting leader: filter, then sort, then limit")
  void qualifiedBattingLeader() {
    CompiledPlan plan =
        compiler.compile(
            "SELECT player_name, hra FROM player_season_stats WHERE team = '한화' "
                + "ORDER BY hra DESC LIMIT 1;",
            "한화 타율 1위 선수는?");

    QueryOutcome outcome = executor.execute(plan);

    assertEquals(List.of("문현빈"), names(outcome));
    JsonNode leader = outcome.rowsOrEmpty().get(0);
    assertFalse(RowValues.isNull(leader, "hra"));
    assertTrue(RowValues.number(leader, "ab") >= Math.ceil(3.1 * 100));
  }

  @Test
  @DisplayName("pitcher rankings drop batters before sorting")
  void pitcherRanking() {
    CompiledPlan plan =
        compiler.compile(
            "SELECT player_name, era FROM player_season_stats ORDER BY era ASC LIMIT 5;",
            "평균자책점 순위");

    assertEquals(List.of("임찬규", "문동주"), names(executor.execute(plan)));
  }

  @Test
  @DisplayName("rows from several operations are merged and de-duplicated")
  void mergeAndDeduplicate() {
    StoreQuery hanwha = StoreQuery.on("player_season_stats").eq("team", "한화").eq("gyear", "2025").build();
    CompiledPlan plan =
        new CompiledPlan(
            "player_season_stats",
            PlayerRole.BOTH,
            List.of(hanwha, hanwha),
            List.of(),
            OrderSpec.desc("hr"),
            2,
            Locality.CLIENT,
            List.of(),
            null);

    assertEquals(List.of("노시환", "채은성"), names(executor.execute(plan)));
    assertEquals(2, store.calls());
  }

  @Test
  @DisplayName("server-side plans return the store's ordering untouched")
  void serverSide() {
    CompiledPlan plan =
        compiler.compile(
            "SELECT * FROM player_season_stats WHERE player_name = '문현빈' ORDER BY hr DESC;",
            "문현빈 성적");

    QueryOutcome outcome = executor.execute(plan);

    assertEquals(Locality.SERVER, plan.locality());
    assertEquals(1, outcome.rowsOrEmpty().size());
    assertEquals("2025", RowValues.text(outcome.rowsOrEmpty().get(0), "gyear"));
  }

  @Test
  @DisplayName("no matching rows is an empty outcome, not a failure")
  void emptyOutcome() {
    CompiledPlan plan =
        compiler.compile("SELECT * FROM player_season_stats WHERE player_name = '류현진';", "류현진");

    QueryOutcome outcome = executor.execute(plan);

    assertTrue(outcome.isEmpty());
    assertFalse(outcome.isUnavailable());
  }

  @Test
  @DisplayName("a store failure becomes DataUnavailable")
  void storeFailure() {
    CompiledPlan plan =
        compiler.compile("SELECT * FROM player_season_stats ORDER BY hr DESC LIMIT 3;", "홈런 순위");
    store.failing("player_season_stats");

    QueryOutcome outcome = executor.execute(plan);

    assertTrue(outcome.isUnavailable());
    assertTrue(outcome.rowsOrEmpty().isEmpty());
  }

  @Test
  @DisplayName("executing the same plan twice gives the same rows")
  void idempotent() {
    CompiledPlan plan =
        compiler.compile(
            "SELECT * FROM player_season_stats WHERE team IN ('한화', 'LG') ORDER BY hr DESC LIMIT 3;",
            "한화 LG 홈런");

    assertEquals(names(executor.execute(plan)), names(executor.execute(plan)));
  }
}
