package com.gentoro.kbo.store;

import java.util.Objects;

/** Sort key and direction. */
public record OrderSpec(String column, boolean descending) {
  public OrderSpec {
    Objects.requireNonNull(column, "column");
  }

  public static OrderSpec desc(String column) {
    return new OrderSpec(column, true);
  }

  public static OrderSpec asc(String column) {
    return new OrderSpec(column, false);
  }
}
