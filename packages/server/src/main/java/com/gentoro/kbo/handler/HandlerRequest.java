package com.gentoro.kbo.handler;

import com.gentoro.kbo.entity.DateRange;
import com.gentoro.kbo.entity.DateResolver;
import com.gentoro.kbo.entity.ResolvedEntities;
import java.time.LocalDate;
import java.util.Optional;

/** A classified question with its entities and the day it is asked on. */
public record HandlerRequest(String question, ResolvedEntities entities, LocalDate today) {

  public Optional<LocalDate> date() {
    return entities.dates().optionalDate();
  }

  public Optional<DateRange> range() {
    return entities.dates().optionalRange();
  }

  /** The resolved day or range, or today through the upcoming window when nothing was resolved. */
  public DateRange upcomingWindow() {
    return entities
        .dates()
        .asRange()
        .orElseGet(() -> new DateRange(today, today.plusDays(DateResolver.UPCOMING_DAYS)));
  }

  public boolean mentions(String word) {
    return question != null && question.contains(word);
  }
}
