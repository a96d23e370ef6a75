package com.gentoro.kbo.store;

/** Numeric comparison operators the store can apply server-side. */
public enum Comparison {
  GT(">", "gt"),
  GTE(">=", "gte"),
  LT("<", "lt"),
  LTE("<=", "lte");

  private final String symbol;
  private final String restOperator;

  Comparison(String symbol, String restOperator) {
    this.symbol = symbol;
    this.restOperator = restOperator;
  }

  public String symbol() {
    return symbol;
  }

  /** Operator keyword in the REST filter dialect, e.g. {@code gte} in {@code ab=gte.400}. */
  public String restOperator() {
    return restOperator;
  }

  public static Comparison fromSymbol(String symbol) {
    for (Comparison c : values()) {
      if (c.symbol.equals(symbol)) {
        return c;
      }
    }
    throw new IllegalArgumentException("Unknown comparison: " + symbol);
  }
}
