package com.gentoro.kbo.support;

import java.time.LocalDate;

/**
 * A week of schedule rows around {@link #TODAY} (Tuesday 2025-07-15), with a box score, a preview
 * and standings for some of the games.
 */
public final class GameFixtures {
  private GameFixtures() {}

  public static final LocalDate TODAY = LocalDate.of(2025, 7, 15);

  public static final String HANWHA_LG_0714 = "20250714LGHH02025";
  public static final String DOOSAN_KIA_0714 = "20250714OBHT02025";
  public static final String SAMSUNG_HANWHA_0715 = "20250715SSHH02025";
  public static final String HANWHA_LOTTE_0716 = "20250716HHLT02025";
  public static final String LG_DOOSAN_0716 = "20250716LGOB02025";
  public static final String HANWHA_KT_0710 = "20250710HHKT02025";

  public static final String GAME_SCHEDULE =
      """
      [
        {"game_id": "20250710HHKT02025", "game_date": "2025-07-10", "game_date_time": "2025-07-10T18:30:00",
         "stadium": "수원", "home_team_code": "KT", "home_team_name": "KT", "away_team_code": "HH",
         "away_team_name": "한화", "home_team_score": 2, "away_team_score": 7, "winner": "AWAY",
         "status_code": "RESULT", "game_data": {"statusCode": "4"}},
        {"game_id": "20250714LGHH02025", "game_date": "2025-07-14", "game_date_time": "2025-07-14T18:30:00",
         "stadium": "대전", "home_team_code": "HH", "home_team_name": "한화", "away_team_code": "LG",
         "away_team_name": "LG", "home_team_score": 5, "away_team_score": 3, "winner": "HOME",
         "status_code": "RESULT", "game_data": {"statusCode": "4"}},
        {"game_id": "20250714OBHT02025", "game_date": "2025-07-14", "game_date_time": "2025-07-14T17:00:00",
         "stadium": "광주", "home_team_code": "HT", "home_team_name": "KIA", "away_team_code": "OB",
         "away_team_name": "두산", "home_team_score": 2, "away_team_score": 6, "winner": "AWAY",
         "status_code": "RESULT", "game_data": "{\\"statusCode\\": \\"4\\"}"},
        {"game_id": "20250715SSHH02025", "game_date": "2025-07-15", "game_date_time": "2025-07-15T18:30:00",
         "stadium": "대전", "home_team_code": "HH", "home_team_name": "한화", "away_team_code": "SS",
         "away_team_name": "삼성", "home_team_score": null, "away_team_score": null, "winner": null,
         "status_code": "BEFORE", "game_data": null},
        {"game_id": "20250716HHLT02025", "game_date": "2025-07-16", "game_date_time": "2025-07-16T18:30:00",
         "stadium": "사직", "home_team_code": "LT", "home_team_name": "롯데", "away_team_code": "HH",
         "away_team_name": "한화", "home_team_score": null, "away_team_score": null, "winner": null,
         "status_code": "BEFORE", "game_data": {"statusCode": "0"}},
        {"game_id": "20250716LGOB02025", "game_date": "2025-07-16", "game_date_time": "2025-07-16T18:30:00",
         "stadium": "잠실", "home_team_code": "OB", "home_team_name": "두산", "away_team_code": "LG",
         "away_team_name": "LG", "home_team_score": null, "away_team_score": null, "winner": null,
         "status_code": "BEFORE", "game_data": {"statusCode": "0"}}
      ]
      """;

  public static final String GAME_RESULT =
      """
      [
        {"team_id": "LG", "team_name": "LG", "year": "2025", "ranking": 1, "wra": 0.610,
         "offense_ops": 0.780, "defense_era": 3.60, "last_five_games": "WWLWW"},
        {"team_id": "OB", "team_name": "두산", "year": "2025", "ranking": 9, "wra": 0.420,
         "offense_ops": 0.700, "defense_era": 4.80, "last_five_games": "LLWLD"},
        {"team_id": "OB", "team_name": "두산", "year": "2024", "ranking": 4, "wra": 0.520,
         "offense_ops": 0.750, "defense_era": 4.10, "last_five_games": "WWWWW"}
      ]
      """;

  /** Box score of Hanwha 5 - 3 LG on 2025-07-14. */
  public static final String HANWHA_LG_RECORD =
      """
      {
        "gameInfo": {"gdate": "20250714", "stadium": "대전", "hFullName": "한화 이글스",
                     "aFullName": "LG 트윈스", "hName": "한화", "aName": "LG"},
        "scoreBoard": {
          "rheb": {"home": {"r": 5, "h": 9}, "away": {"r": 3, "h": 7}},
          "inn": {"home": [0, 2, 0, 0, 0, 0, 3, 0, "-"], "away": [1, 0, 0, 0, 2, 0, 0, 0, 0]}
        },
        "pitchersBoxscore": {
          "home": [
            {"name": "류현진", "inn": "6 ⅔", "hit": 5, "r": 2, "kk": 7, "bb": 1, "era": "3.12"},
            {"name": "김서현", "inn": "1", "hit": 0, "r": 0, "kk": 2, "bb": 0, "era": "2.10"}
          ],
          "away": [
            {"name": "임찬규", "inn": "6", "hit": 7, "r": 4, "kk": 4, "bb": 2, "era": "2.90"},
            {"name": "유영찬", "inn": "2", "hit": 2, "r": 1, "kk": 1, "bb": 0, "era": "3.30"}
          ]
        },
        "etcRecords": [
          {"how": "홈런", "result": "노시환(7회 3점)"},
          {"how": "결승타", "result": "노시환(7회 2사 1,2루서 좌월 홈런)"},
          {"how": "도루", "result": "이원석(2회)"},
          {"how": "실책", "result": "오지환(5회)"},
          {"how": "병살타", "result": "문보경(3회)"}
        ]
      }
      """;

  /** Preview of Lotte (home) vs Hanwha on 2025-07-16. */
  public static final String HANWHA_LOTTE_PREVIEW =
      """
      {
        "homeStandings": {"rank": 3, "wra": "0.560"},
        "awayStandings": {"rank": 1, "wra": "0.610"},
        "homeStarter": {"playerInfo": {"name": "박세웅", "backnum": "21"},
                        "currentSeasonStats": {"era": "4.10", "w": 7, "l": 6}},
        "awayStarter": {"playerInfo": {"name": "폰세", "backnum": "30"},
                        "currentSeasonStats": {"era": "1.85", "w": 12, "l": 1}},
        "homeTopPlayer": {"playerInfo": {"name": "레이예스"}, "currentSeasonStats": {"hra": "0.330"}},
        "awayTopPlayer": {"playerInfo": {"name": "문현빈"}, "currentSeasonStats": {"hra": "0.320"}},
        "seasonVsResult": {"hw": 4, "aw": 5},
        "homeTeamLineUp": {"fullLineUp": [
          {"positionName": "중견수", "playerName": "황성빈", "backnum": "0"},
          {"positionName": "우익수", "playerName": "레이예스", "backnum": "29"}
        ]},
        "awayTeamLineUp": {"fullLineUp": [
          {"positionName": "좌익수", "playerName": "문현빈", "backnum": "51"}
        ]}
      }
      """;

  public static InMemoryRemoteStore scheduleStore() {
    return new InMemoryRemoteStore().table("game_schedule", GAME_SCHEDULE).table("game_result", GAME_RESULT);
  }
}
