package com.gentoro.kbo.game;

import java.util.List;

/**
 * Digest of a game's box score.
 *
 * @param date game date as {@code yyyyMMdd}, as the record API reports it
 * @param homeMomentum scoring pattern over the innings, see {@link GameRecordAnalyzer#momentum}
 */
public record GameRecord(
    String date,
    String stadium,
    String homeTeam,
    String awayTeam,
    int homeScore,
    int awayScore,
    String homeMomentum,
    String awayMomentum,
    PitcherLine homeStarter,
    PitcherLine awayStarter,
    List<String> homeRuns,
    List<String> stolenBases,
    List<String> errors,
    List<String> winningHits) {

  public GameRecord {
    homeRuns = List.copyOf(homeRuns);
    stolenBases = List.copyOf(stolenBases);
    errors = List.copyOf(errors);
    winningHits = List.copyOf(winningHits);
  }

  /** A pitcher's line in the box score. {@code innings} keeps the API's text form, e.g. {@code 6 ⅔}. */
  public record PitcherLine(
      String name, String innings, int hits, int runs, int strikeouts, int walks, String era) {

    public boolean isKnown() {
      return name != null && !name.isBlank();
    }
  }

  public boolean homeWon() {
    return homeScore > awayScore;
  }
}
