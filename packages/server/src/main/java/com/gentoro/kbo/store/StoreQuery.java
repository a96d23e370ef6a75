package com.gentoro.kbo.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One read against the remote store: equality, range and not-null filters on a single table, with
 * optional server-side ordering and limit. This is everything the store understands.
 */
public record StoreQuery(
    String table,
    Map<String, String> equalities,
    List<RangeFilter> ranges,
    Set<String> notNull,
    OrderSpec order,
    Integer limit) {

  public StoreQuery {
    equalities = Collections.unmodifiableMap(new LinkedHashMap<>(equalities));
    ranges = List.copyOf(ranges);
    notNull = Collections.unmodifiableSet(new LinkedHashSet<>(notNull));
  }

  public static Builder on(String table) {
    return new Builder(table);
  }

  public Optional<OrderSpec> optionalOrder() {
    return Optional.ofNullable(order);
  }

  public Optional<Integer> optionalLimit() {
    return Optional.ofNullable(limit);
  }

  public Builder toBuilder() {
    Builder b = new Builder(table);
    b.equalities.putAll(equalities);
    b.ranges.addAll(ranges);
    b.notNull.addAll(notNull);
    b.order = order;
    b.limit = limit;
    return b;
  }

  public static final class Builder {
    private final String table;
    private final Map<String, String> equalities = new LinkedHashMap<>();
    private final List<RangeFilter> ranges = new ArrayList<>();
    private final Set<String> notNull = new LinkedHashSet<>();
    private OrderSpec order;
    private Integer limit;

    private Builder(String table) {
      this.table = table;
    }

    public Builder eq(String column, String value) {
      equalities.put(column, value);
      return this;
    }

    public Builder range(String column, Comparison comparison, String value) {
      ranges.add(new RangeFilter(column, comparison, value));
      return this;
    }

    public Builder gte(String column, String value) {
      return range(column, Comparison.GTE, value);
    }

    public Builder lte(String column, String value) {
      return range(column, Comparison.LTE, value);
    }

    public Builder notNull(String column) {
      notNull.add(column);
      return this;
    }

    public Builder order(OrderSpec order) {
      this.order = order;
      return this;
    }

    public Builder limit(Integer limit) {
      this.limit = limit;
      return this;
    }

    public StoreQuery build() {
      return new StoreQuery(table, equalities, ranges, notNull, order, limit);
    }
  }
}
