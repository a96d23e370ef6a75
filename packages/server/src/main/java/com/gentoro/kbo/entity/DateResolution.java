package com.gentoro.kbo.entity;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Outcome of date extraction: one day, one closed range, or nothing. Never both a date and a range.
 */
public record DateResolution(LocalDate date, DateRange range, Source source) {

  public enum Source {
    EXPLICIT,
    OFFSET,
    RELATIVE,
    WEEKDAY,
    RANGE,
    NONE
  }

  private static final DateResolution NONE = new DateResolution(null, null, Source.NONE);

  public DateResolution {
    if (date != null && range != null) {
      throw new IllegalArgumentException("A resolution is either a date or a range");
    }
  }

  public static DateResolution none() {
    return NONE;
  }

  public static DateResolution of(LocalDate date, Source source) {
    return new DateResolution(date, null, source);
  }

  public static DateResolution of(DateRange range) {
    return new DateResolution(null, range, Source.RANGE);
  }

  public boolean isResolved() {
    return date != null || range != null;
  }

  public Optional<LocalDate> optionalDate() {
    return Optional.ofNullable(date);
  }

  public Optional<DateRange> optionalRange() {
    return Optional.ofNullable(range);
  }

  /** The single day, or a range collapsed to its bounds; empty when nothing was resolved. */
  public Optional<DateRange> asRange() {
    if (range != null) {
      return Optional.of(range);
    }
    return date == null ? Optional.empty() : Optional.of(DateRange.of(date));
  }
}
