package com.gentoro.kbo.store;

/** {@code column <op> value}; the value is kept as text and sent verbatim. */
public record RangeFilter(String column, Comparison comparison, String value) {
  @Override
  public String toString() {
    return column + " " + comparison.symbol() + " " + value;
  }
}
