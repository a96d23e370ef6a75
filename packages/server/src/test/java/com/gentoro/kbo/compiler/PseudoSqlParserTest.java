package com.gentoro.kbo.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.kbo.store.Comparison;
import com.gentoro.kbo.store.OrderSpec;
import com.gentoro.kbo.store.RangeFilter;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PseudoSqlParserTest {

  private final PseudoSqlParser parser = new PseudoSqlParser();

  private ParsedQuery ok(String text) {
    ParseResult result = parser.parse(text);
    assertInstanceOf(ParseResult.Ok.class, result, () -> "rejected: " + result);
    return ((ParseResult.Ok) result).query();
  }

  private CompileError err(String text) {
    ParseResult result = parser.parse(text);
    assertInstanceOf(ParseResult.Err.class, result, () -> "accepted: " + result);
    return ((ParseResult.Err) result).error();
  }

  @Test
  @DisplayName("reads a fenced ranking query")
  void fencedRankingQuery() {
    ParsedQuery query =
        ok(
            """
            ```sql
            SELECT player_name, hra FROM player_season_stats
            WHERE team = '한화' AND gyear = '2025'
            ORDER BY hra DESC
            LIMIT 1;
            ```
            """);

    assertEquals("player_season_stats", query.table());
    assertEquals(List.of("player_name", "hra"), query.selectColumns());
    assertEquals(Map.of("team", "한화", "gyear", "2025"), query.equalities());
    assertEquals(OrderSpec.desc("hra"), query.order());
    assertEquals(1, query.limit());
  }

  @Test
  @DisplayName("table aliases and qualified columns are stripped")
  void aliases() {
    ParsedQuery query =
        ok("SELECT p.player_name, p.hr AS homers FROM player_season_stats AS p "
            + "WHERE p.hr >= 20 ORDER BY p.hr DESC NULLS LAST");

    assertEquals(List.of("player_name", "hr"), query.selectColumns());
    assertEquals(List.of(new RangeFilter("hr", Comparison.GTE, "20")), query.ranges());
    assertEquals(OrderSpec.desc("hr"), query.order());
    assertNull(query.limit());
  }

  @Test
  @DisplayName("an OR chain on one column becomes a membership")
  void orChainBecomesMembership() {
    ParsedQuery query =
        ok("SELECT * FROM game_result WHERE (team_name = 'LG' OR team_name = '두산') AND year = '2025';");

    assertEquals(List.of("*"), query.selectColumns());
    assertEquals(Map.of("team_name", List.of("LG", "두산")), query.memberships());
    assertEquals(Map.of("year", "2025"), query.equalities());
  }

  @Test
  @DisplayName("IN lists, IS NOT NULL and quoted literals")
  void membershipAndNotNull() {
    ParsedQuery query =
        ok("SELECT player_name FROM player_season_stats "
            + "WHERE player_name IN ('김도영', 'O''Neil', \"문보경\") AND era IS NOT NULL");

    assertEquals(List.of("김도영", "O'Neil", "문보경"), query.memberships().get("player_name"));
    assertEquals(Set.of("era"), query.notNull());
    assertEquals(Set.of("player_name", "era"), query.filteredColumns());
  }

  @Test
  @DisplayName("separators inside literals are not treated as syntax")
  void literalsAreMasked() {
    ParsedQuery query = ok("SELECT * FROM player_season_stats WHERE player_name = 'a; SELECT b' LIMIT 3");

    assertEquals("a; SELECT b", query.equalities().get("player_name"));
    assertEquals(3, query.limit());
  }

  @Test
  @DisplayName("prose around the statement is ignored")
  void surroundingProse() {
    ParsedQuery query =
        ok("""
            다음 쿼리를 사용하세요:
            SELECT hr FROM player_season_stats LIMIT 5;
            감사합니다
            """);

    assertEquals("player_season_stats", query.table());
    assertEquals(5, query.limit());
  }

  @Test
  @DisplayName("only the first ORDER BY key is kept")
  void secondaryOrderKeysIgnored() {
    ParsedQuery query = ok("SELECT * FROM player_season_stats ORDER BY hr DESC, rbi DESC");

    assertEquals(OrderSpec.desc("hr"), query.order());
  }

  @Test
  @DisplayName("model-reported errors and empty output are rejected")
  void modelErrors() {
    assertEquals("model reported DB_ERROR", err("DB_ERROR: 해당 데이터가 없습니다").reason());
    assertEquals("empty model output", err("   ").reason());
    assertEquals("empty model output", err(null).reason());
  }

  @Test
  @DisplayName("write statements and multiple statements are rejected")
  void writesAndMultipleStatements() {
    assertEquals(
        "only SELECT statements are supported", err("DELETE FROM player_season_stats;").reason());
    assertEquals(
        "only SELECT statements are supported",
        err("SELECT * FROM player_season_stats; DROP TABLE player_season_stats;").reason());
    assertEquals(
        "more than one statement",
        err("SELECT * FROM player_season_stats; SELECT * FROM game_result;").reason());
    assertEquals("no SELECT statement found", err("잘 모르겠습니다").reason());
  }

  @Test
  @DisplayName("unsupported clauses are named in the error")
  void unsupportedClauses() {
    assertEquals(
        "unsupported clause: GROUP BY",
        err("SELECT team FROM player_season_stats GROUP BY team").reason());
    assertEquals(
        "unsupported clause: JOIN",
        err("SELECT * FROM player_season_stats p JOIN game_result r ON p.team = r.team_name").reason());
    assertEquals(
        "sub-queries are not supported",
        err("SELECT * FROM player_season_stats WHERE hr > (SELECT hr FROM player_season_stats)").reason());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "SELECT MAX(hr) FROM player_season_stats",
        "SELECT * FROM player_season_stats WHERE team <> 'LG'",
        "SELECT * FROM player_season_stats WHERE hr > 'many'",
        "SELECT * FROM player_season_stats WHERE team = 'LG' AND hr > 1 OR hr < 5",
        "SELECT * FROM player_season_stats WHERE team = 'LG' OR hr = 3",
        "SELECT * FROM player_season_stats WHERE team = 'LG' AND team = '두산'",
        "SELECT * FROM player_season_stats WHERE player_name = 'unterminated",
        "SELECT * FROM player_season_stats LIMIT 5 ORDER BY hr",
        "SELECT * FROM player_season_stats LIMIT ten",
        "SELECT * FROM player_season_stats WHERE",
        "SELECT * FROM player_season_stats WHERE hr LIKE '%1%'",
        "SELECT * FROM player_season_stats WHERE (hr > 1"
      })
  @DisplayName("statements outside the supported grammar are rejected")
  void unsupportedGrammar(String text) {
    CompileError error = err(text);
    assertFalse(error.reason().isBlank());
  }

  @Test
  @DisplayName("the rejected text is carried with the error")
  void errorCarriesText() {
    CompileError error = err("```sql\nUPDATE player_season_stats SET hr = 1;\n```");
    assertTrue(error.text().contains("UPDATE player_season_stats"));
  }
}
