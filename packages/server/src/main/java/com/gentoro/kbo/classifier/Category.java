package com.gentoro.kbo.classifier;

/** Resolution strategy a question is routed to. */
public enum Category {
  DAILY_SCHEDULE,
  DAILY_RESULTS_ANALYSIS,
  GAME_PREDICTION,
  FUTURE_GAME_DETAIL,
  GAME_ANALYSIS,
  GENERIC_QUERY
}
