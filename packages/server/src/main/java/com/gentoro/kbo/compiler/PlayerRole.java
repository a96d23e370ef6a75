package com.gentoro.kbo.compiler;

/** Whether a player-stat query is about pitchers, batters, or cannot tell. */
public enum PlayerRole {
  PITCHER,
  BATTER,
  BOTH
}
