package com.gentoro.kbo.entity;

import java.time.LocalDate;
import java.util.Objects;

/** Closed date interval, both ends inclusive. */
public record DateRange(LocalDate from, LocalDate to) {
  public DateRange {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (to.isBefore(from)) {
      throw new IllegalArgumentException("Range end " + to + " is before start " + from);
    }
  }

  public static DateRange of(LocalDate day) {
    return new DateRange(day, day);
  }

  public boolean contains(LocalDate day) {
    return !day.isBefore(from) && !day.isAfter(to);
  }

  public boolean isSingleDay() {
    return from.equals(to);
  }
}
