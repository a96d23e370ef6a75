package com.gentoro.kbo.compiler;

import com.gentoro.kbo.schema.SchemaCatalog;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a stat query is about pitchers or batters.
 *
 * <p>Evidence comes from exact column tokens: the {@code ORDER BY} key, the projected columns and
 * the filtered columns. Vocabulary words found in the question text count as mentions. The role
 * with the higher score wins; a tie, including no evidence at all, yields {@link PlayerRole#BOTH}.
 */
public final class RoleInference {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(RoleInference.class);

  private final Set<String> pitcherTerms;
  private final Set<String> batterTerms;
  private final RoleWeights weights;

  public RoleInference(SchemaCatalog catalog, RoleWeights weights) {
    this(catalog.pitcherTerms(), catalog.batterTerms(), weights);
  }

  public RoleInference(Set<String> pitcherTerms, Set<String> batterTerms, RoleWeights weights) {
    this.pitcherTerms = Set.copyOf(pitcherTerms);
    this.batterTerms = Set.copyOf(batterTerms);
    this.weights = weights;
  }

  public PlayerRole infer(ParsedQuery query, String question) {
    Score score = new Score();
    query.optionalOrder().ifPresent(o -> score.add(o.column(), weights.orderBy()));
    query.selectColumns().forEach(c -> score.add(c, weights.select()));
    query.filteredColumns().forEach(c -> score.add(c, weights.mention()));
    if (question != null) {
      String lower = question.toLowerCase(Locale.ROOT);
      // column-like terms ("hr", "era") are too short to be trusted as substrings of free text
      pitcherTerms.stream().filter(t -> isWord(t) && lower.contains(t)).forEach(t -> score.pitcher += weights.mention());
      batterTerms.stream().filter(t -> isWord(t) && lower.contains(t)).forEach(t -> score.batter += weights.mention());
    }
    PlayerRole role =
        score.pitcher > score.batter
            ? PlayerRole.PITCHER
            : score.batter > score.pitcher ? PlayerRole.BATTER : PlayerRole.BOTH;
    log.debug("Role scores pitcher={} batter={} -> {}", score.pitcher, score.batter, role);
    return role;
  }

  /** Korean vocabulary entries; column tokens are ASCII. */
  private static boolean isWord(String term) {
    return term.chars().anyMatch(c -> Character.UnicodeBlock.of(c) == Character.UnicodeBlock.HANGUL_SYLLABLES);
  }

  private final class Score {
    int pitcher;
    int batter;

    void add(String column, int weight) {
      String token = column.toLowerCase(Locale.ROOT);
      if (pitcherTerms.contains(token)) {
        pitcher += weight;
      } else if (batterTerms.contains(token)) {
        batter += weight;
      }
    }
  }
}
