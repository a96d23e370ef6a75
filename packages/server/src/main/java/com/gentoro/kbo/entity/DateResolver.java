package com.gentoro.kbo.entity;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the date a question talks about, relative to an injected "today".
 *
 * <p>Precedence, first match wins:
 *
 * <ol>
 *   <li>explicit calendar dates ({@code 2025-09-25}, {@code 2025년 9월 25일}, {@code 9월 25일},
 *       {@code 9/25}, {@code 25일})
 *   <li>offsets ({@code 3일 전}, {@code 2 days after})
 *   <li>named relative terms, weekday forms first ({@code 다음 주 금요일}, {@code next friday}), then
 *       single words ({@code 내일}, {@code yesterday}, {@code 다음 주})
 *   <li>open ranges ({@code 이번 주}, {@code 앞으로}, {@code upcoming})
 * </ol>
 *
 * <p>Never throws. Impossible calendar values such as {@code 2/30} are skipped and the next rule is
 * tried.
 */
public final class DateResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(DateResolver.class);

  private static final Pattern FULL_KOREAN =
      Pattern.compile("(\\d{4})\\s*년\\s*(\\d{1,2})\\s*월\\s*(\\d{1,2})\\s*일");
  private static final Pattern ISO = Pattern.compile("(?<!\\d)(\\d{4})[-.](\\d{1,2})[-.](\\d{1,2})(?!\\d)");
  private static final Pattern MONTH_DAY_KOREAN =
      Pattern.compile("(?<!\\d)(\\d{1,2})\\s*월\\s*(\\d{1,2})\\s*일");
  private static final Pattern MONTH_DAY_SLASH = Pattern.compile("(?<![\\d/])(\\d{1,2})/(\\d{1,2})(?![\\d/])");
  private static final Pattern DAY_ONLY =
      Pattern.compile("(?<![\\d월])(\\d{1,2})\\s*일(?!\\s*(?:전|후|뒤|동안|간))");

  private static final Pattern OFFSET_KOREAN = Pattern.compile("(\\d{1,3})\\s*일\\s*(전|후|뒤)");
  private static final Pattern OFFSET_ENGLISH =
      Pattern.compile("(\\d{1,3})\\s*days?\\s*(ago|before|after|later|from now)", Pattern.CASE_INSENSITIVE);

  private static final Pattern WEEKDAY_KOREAN =
      Pattern.compile("(이번\\s*주|다음\\s*주|지난\\s*주|저번\\s*주|담주)?\\s*([월화수목금토일])요일");
  private static final Pattern WEEKDAY_ENGLISH =
      Pattern.compile(
          "\\b(this|next|last)\\s+(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Map<String, DayOfWeek> KOREAN_DAYS =
      Map.of(
          "월", DayOfWeek.MONDAY,
          "화", DayOfWeek.TUESDAY,
          "수", DayOfWeek.WEDNESDAY,
          "목", DayOfWeek.THURSDAY,
          "금", DayOfWeek.FRIDAY,
          "토", DayOfWeek.SATURDAY,
          "일", DayOfWeek.SUNDAY);

  /** Single-word relative terms, longest and most specific first. */
  private static final List<Map.Entry<String, Integer>> RELATIVE_TERMS =
      List.of(
          Map.entry("day after tomorrow", 2),
          Map.entry("day before yesterday", -2),
          Map.entry("그저께", -2),
          Map.entry("그제", -2),
          Map.entry("글피", 3),
          Map.entry("모레", 2),
          Map.entry("어제", -1),
          Map.entry("오늘", 0),
          Map.entry("내일", 1),
          Map.entry("yesterday", -1),
          Map.entry("tonight", 0),
          Map.entry("today", 0),
          Map.entry("tomorrow", 1),
          Map.entry("다음 주", 7),
          Map.entry("다음주", 7),
          Map.entry("next week", 7));

  private static final List<String> WEEK_RANGE_TERMS = List.of("이번 주", "이번주", "this week");
  private static final List<String> UPCOMING_TERMS = List.of("앞으로", "upcoming", "남은 경기");

  /** Days covered by an open "upcoming" range, today included. */
  public static final int UPCOMING_DAYS = 7;

  public DateResolution resolve(String question, LocalDate today) {
    if (question == null || question.isBlank()) {
      return DateResolution.none();
    }
    String text = question.toLowerCase(Locale.ROOT);

    LocalDate explicit = explicitDate(text, today);
    if (explicit != null) {
      return DateResolution.of(explicit, DateResolution.Source.EXPLICIT);
    }
    LocalDate offset = offsetDate(text, today);
    if (offset != null) {
      return DateResolution.of(offset, DateResolution.Source.OFFSET);
    }
    LocalDate weekday = weekdayDate(text, today);
    if (weekday != null) {
      return DateResolution.of(weekday, DateResolution.Source.WEEKDAY);
    }
    for (Map.Entry<String, Integer> term : RELATIVE_TERMS) {
      if (text.contains(term.getKey())) {
        return DateResolution.of(today.plusDays(term.getValue()), DateResolution.Source.RELATIVE);
      }
    }
    if (WEEK_RANGE_TERMS.stream().anyMatch(text::contains)) {
      return DateResolution.of(new DateRange(today, today.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY))));
    }
    if (UPCOMING_TERMS.stream().anyMatch(text::contains)) {
      return DateResolution.of(new DateRange(today, today.plusDays(UPCOMING_DAYS)));
    }
    return DateResolution.none();
  }

  private LocalDate explicitDate(String text, LocalDate today) {
    LocalDate date = firstValid(FULL_KOREAN.matcher(text), m -> date(m.group(1), m.group(2), m.group(3)));
    if (date == null) {
      date = firstValid(ISO.matcher(text), m -> date(m.group(1), m.group(2), m.group(3)));
    }
    if (date == null) {
      date = firstValid(
          MONTH_DAY_KOREAN.matcher(text),
          m -> date(String.valueOf(today.getYear()), m.group(1), m.group(2)));
    }
    if (date == null) {
      date = firstValid(
          MONTH_DAY_SLASH.matcher(text),
          m -> date(String.valueOf(today.getYear()), m.group(1), m.group(2)));
    }
    if (date == null) {
      date = firstValid(
          DAY_ONLY.matcher(text),
          m -> date(String.valueOf(today.getYear()), String.valueOf(today.getMonthValue()), m.group(1)));
    }
    return date;
  }

  private LocalDate offsetDate(String text, LocalDate today) {
    Matcher korean = OFFSET_KOREAN.matcher(text);
    if (korean.find()) {
      int days = Integer.parseInt(korean.group(1));
      return "전".equals(korean.group(2)) ? today.minusDays(days) : today.plusDays(days);
    }
    Matcher english = OFFSET_ENGLISH.matcher(text);
    if (english.find()) {
      int days = Integer.parseInt(english.group(1));
      String direction = english.group(2).toLowerCase(Locale.ROOT);
      return direction.equals("ago") || direction.equals("before")
          ? today.minusDays(days)
          : today.plusDays(days);
    }
    return null;
  }

  private LocalDate weekdayDate(String text, LocalDate today) {
    Matcher korean = WEEKDAY_KOREAN.matcher(text);
    if (korean.find()) {
      String qualifier = korean.group(1) == null ? "" : korean.group(1).replaceAll("\\s", "");
      int weekShift = switch (qualifier) {
        case "다음주", "담주" -> 1;
        case "지난주", "저번주" -> -1;
        default -> 0;
      };
      return dayInWeek(today, KOREAN_DAYS.get(korean.group(2)), weekShift);
    }
    Matcher english = WEEKDAY_ENGLISH.matcher(text);
    if (english.find()) {
      int weekShift = switch (english.group(1).toLowerCase(Locale.ROOT)) {
        case "next" -> 1;
        case "last" -> -1;
        default -> 0;
      };
      DayOfWeek day = DayOfWeek.valueOf(english.group(2).toUpperCase(Locale.ROOT));
      return dayInWeek(today, day, weekShift);
    }
    return null;
  }

  /** The given weekday inside the Monday-to-Sunday week of {@code today}, shifted by whole weeks. */
  private static LocalDate dayInWeek(LocalDate today, DayOfWeek day, int weekShift) {
    LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    return monday.plusDays(day.getValue() - 1L).plusWeeks(weekShift);
  }

  private interface DateFromMatch {
    LocalDate apply(Matcher matcher);
  }

  private static LocalDate firstValid(Matcher matcher, DateFromMatch factory) {
    while (matcher.find()) {
      try {
        return factory.apply(matcher);
      } catch (DateTimeException | NumberFormatException e) {
        log.debug("Skipping impossible date '{}': {}", matcher.group(), e.getMessage());
      }
    }
    return null;
  }

  private static LocalDate date(String year, String month, String day) {
    return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
  }
}
