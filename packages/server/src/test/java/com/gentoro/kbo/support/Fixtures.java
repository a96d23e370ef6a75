package com.gentoro.kbo.support;

/** Store rows shared by compiler, executor and end-to-end tests. */
public final class Fixtures {
  private Fixtures() {}

  /**
   * 2025 season stats. Hanwha has played 100 games (qualified at 310 at-bats), LG 101. Noh Si-hwan
   * leads on average but is not qualified; Moon Dong-ju is a pitcher without a batting line.
   */
  public static final String PLAYER_SEASON_STATS =
      """
      [
        {"player_id": 1, "player_name": "문현빈", "gyear": "2025", "team": "한화", "gamenum": 100,
         "hra": 0.320, "ab": 400, "hr": 12, "rbi": 70, "era": null},
        {"player_id": 2, "player_name": "노시환", "gyear": "2025", "team": "한화", "gamenum": 60,
         "hra": 0.340, "ab": 200, "hr": 20, "rbi": 55, "era": null},
        {"player_id": 3, "player_name": "문동주", "gyear": "2025", "team": "한화", "gamenum": 22,
         "hra": null, "ab": null, "hr": null, "rbi": null, "era": 3.50, "w": 9},
        {"player_id": 4, "player_name": "채은성", "gyear": "2025", "team": "한화", "gamenum": 95,
         "hra": 0.300, "ab": 350, "hr": 15, "rbi": 80, "era": null},
        {"player_id": 5, "player_name": "신민재", "gyear": "2025", "team": "LG", "gamenum": 101,
         "hra": 0.330, "ab": 380, "hr": 3, "rbi": 40, "era": null},
        {"player_id": 6, "player_name": "임찬규", "gyear": "2025", "team": "LG", "gamenum": 25,
         "hra": null, "ab": null, "hr": null, "rbi": null, "era": 2.90, "w": 11},
        {"player_id": 7, "player_name": "문현빈", "gyear": "2024", "team": "한화", "gamenum": 120,
         "hra": 0.270, "ab": 300, "hr": 5, "rbi": 40, "era": null}
      ]
      """;

  public static InMemoryRemoteStore statsStore() {
    return new InMemoryRemoteStore().table("player_season_stats", PLAYER_SEASON_STATS);
  }
}
