package com.gentoro.kbo.handler;

import com.gentoro.kbo.entity.ResolvedEntities;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Fixed texts used when a valid question has no data behind it. */
public final class NoDataMessages {
  public static final String NO_GAMES_TODAY =
      "오늘은 경기가 없습니다. 다른 날짜의 경기를 확인해보세요! 😊";
  public static final String NO_GAMES_TOMORROW =
      "내일은 경기가 없습니다. 다른 날짜의 경기를 확인해보세요! 😊";
  public static final String NO_GAMES_ON_DATE =
      "해당 날짜에는 경기 정보가 없습니다. 다른 날짜를 조회해주세요! 😊";
  public static final String NO_PLAYER =
      "해당 조건에 맞는 선수 정보가 없습니다. 다른 조건으로 검색해보세요! 😊";
  public static final String NO_RANKING =
      "해당 조건의 팀 순위 정보를 찾을 수 없습니다. 다른 조건으로 검색해보세요! 😊";
  public static final String NO_PREDICTION_DATA =
      "경기 예측을 위한 데이터가 부족합니다. 팀명을 포함해서 다시 질문해주세요! 😊";
  public static final String NO_GAMES_FOR_PREDICTION =
      "해당 날짜에 경기가 없습니다. 다른 날짜의 경기를 확인해보세요! 😊";
  public static final String NO_MATCHING_GAME = "해당 조건에 맞는 경기를 찾을 수 없습니다.";
  public static final String NO_GAME_INFO = "해당 조건에 맞는 경기 정보를 찾을 수 없습니다.";
  public static final String GENERIC =
      "해당 질문에 대한 데이터를 찾을 수 없습니다. 다른 질문을 시도해보세요! 😊";
  public static final String UNAVAILABLE =
      "데이터를 일시적으로 불러올 수 없습니다. 잠시 후 다시 시도해주세요! 😊";
  public static final String APOLOGY =
      "죄송합니다. 질문을 이해하지 못했습니다. 다른 표현으로 다시 질문해주세요.";

  private static final List<String> SCHEDULE_WORDS = List.of("경기", "일정", "스케줄", "오늘", "내일", "어제");
  private static final List<String> PLAYER_WORDS = List.of("선수", "선발", "타자", "투수", "성적", "기록", "통계");
  private static final List<String> RANKING_WORDS = List.of("순위", "등수", "우승", "포스트시즌", "플레이오프");
  private static final List<String> PREDICTION_WORDS =
      List.of("이길", "질 것", "예상", "승부", "누가", "어떤 팀", "결과", "예측", "이길거같", "질거같", "승리", "패배");
  private static final Pattern PLAYER_NAME = Pattern.compile("([가-힣]{2,4})(?= 선수|의|이|가|은|는)");

  private NoDataMessages() {}

  /** No games on {@code date}; today and tomorrow get their own wording. */
  public static String noGames(LocalDate date, LocalDate today) {
    if (date == null || date.equals(today)) {
      return NO_GAMES_TODAY;
    }
    if (date.equals(today.plusDays(1))) {
      return NO_GAMES_TOMORROW;
    }
    return NO_GAMES_ON_DATE;
  }

  public static String noPlayer(String name) {
    return "'" + name + "' 선수 정보를 찾을 수 없습니다. 선수 이름을 다시 확인해주세요! 😊";
  }

  /** The no-data text for a stat question, picked from the question's wording. */
  public static String forQuestion(String question, ResolvedEntities entities) {
    String text = question == null ? "" : question;
    if (SCHEDULE_WORDS.stream().anyMatch(text::contains)) {
      if (text.contains("오늘")) {
        return NO_GAMES_TODAY;
      }
      return text.contains("내일") ? NO_GAMES_TOMORROW : NO_GAMES_ON_DATE;
    }
    if (PLAYER_WORDS.stream().anyMatch(text::contains)) {
      if (entities != null && !entities.players().isEmpty()) {
        return noPlayer(entities.players().get(0));
      }
      Matcher name = PLAYER_NAME.matcher(text);
      while (name.find()) {
        if (!PLAYER_WORDS.contains(name.group(1))) {
          return noPlayer(name.group(1));
        }
      }
      return NO_PLAYER;
    }
    if (RANKING_WORDS.stream().anyMatch(text::contains)) {
      return NO_RANKING;
    }
    if (PREDICTION_WORDS.stream().anyMatch(text::contains)) {
      return NO_PREDICTION_DATA;
    }
    return GENERIC;
  }
}
