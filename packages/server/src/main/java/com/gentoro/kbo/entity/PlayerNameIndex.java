package com.gentoro.kbo.entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of known player names used to spot players in free text.
 *
 * <p>All names contained in the text are collected and returned longest first. A shorter name
 * whose every occurrence lies inside a longer accepted name is dropped, so a three-character name
 * is never masked by (or reported alongside) a two-character name it contains.
 */
public final class PlayerNameIndex {
  private static final PlayerNameIndex EMPTY = new PlayerNameIndex(List.of());

  private final List<String> namesLongestFirst;

  public PlayerNameIndex(Collection<String> names) {
    Set<String> unique = new LinkedHashSet<>();
    for (String name : names) {
      if (name != null && name.strip().length() >= 2) {
        unique.add(name.strip());
      }
    }
    List<String> ordered = new ArrayList<>(unique);
    ordered.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
    this.namesLongestFirst = List.copyOf(ordered);
  }

  public static PlayerNameIndex empty() {
    return EMPTY;
  }

  public int size() {
    return namesLongestFirst.size();
  }

  public boolean contains(String name) {
    return name != null && namesLongestFirst.contains(name.strip());
  }

  /**
   * Find player candidates in {@code text}. Values that are team codes or team aliases are never
   * returned.
   */
  public List<String> find(String text, TeamDirectory teams) {
    if (text == null || text.isBlank() || namesLongestFirst.isEmpty()) {
      return List.of();
    }
    boolean[] claimed = new boolean[text.length()];
    List<String> found = new ArrayList<>();
    for (String name : namesLongestFirst) {
      if (teams != null && teams.isTeamReference(name)) {
        continue;
      }
      boolean accepted = false;
      int from = 0;
      while (true) {
        int at = text.indexOf(name, from);
        if (at < 0) {
          break;
        }
        int end = at + name.length();
        if (!isClaimed(claimed, at, end)) {
          for (int i = at; i < end; i++) {
            claimed[i] = true;
          }
          accepted = true;
        }
        from = at + 1;
      }
      if (accepted) {
        found.add(name);
      }
    }
    return List.copyOf(found);
  }

  private static boolean isClaimed(boolean[] claimed, int start, int end) {
    for (int i = start; i < end; i++) {
      if (claimed[i]) {
        return true;
      }
    }
    return false;
  }
}
