package com.gentoro.kbo.compiler;

import com.gentoro.kbo.store.OrderSpec;
import com.gentoro.kbo.store.RangeFilter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural reading of one {@code SELECT} statement. Column names are lower-case and stripped of
 * table aliases; literals are unquoted.
 *
 * @param selectColumns projected columns, {@code *} when everything is selected
 * @param equalities {@code column = 'literal'} predicates
 * @param memberships {@code column IN (...)} predicates, also built from {@code OR} chains on one
 *     column
 * @param ranges numeric comparisons
 * @param notNull columns with an {@code IS NOT NULL} predicate
 * @param order first {@code ORDER BY} key, or null
 * @param limit {@code LIMIT} value, or null
 * @param text the statement as it was parsed
 */
public record ParsedQuery(
    String table,
    List<String> selectColumns,
    Map<String, String> equalities,
    Map<String, List<String>> memberships,
    List<RangeFilter> ranges,
    Set<String> notNull,
    OrderSpec order,
    Integer limit,
    String text) {

  public ParsedQuery {
    selectColumns = List.copyOf(selectColumns);
    equalities = Collections.unmodifiableMap(new LinkedHashMap<>(equalities));
    Map<String, List<String>> copy = new LinkedHashMap<>();
    memberships.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    memberships = Collections.unmodifiableMap(copy);
    ranges = List.copyOf(ranges);
    notNull = Collections.unmodifiableSet(new LinkedHashSet<>(notNull));
  }

  public Optional<OrderSpec> optionalOrder() {
    return Optional.ofNullable(order);
  }

  public Optional<Integer> optionalLimit() {
    return Optional.ofNullable(limit);
  }

  /** Every column the WHERE clause constrains. */
  public Set<String> filteredColumns() {
    Set<String> columns = new LinkedHashSet<>(equalities.keySet());
    columns.addAll(memberships.keySet());
    ranges.forEach(r -> columns.add(r.column()));
    columns.addAll(notNull);
    return columns;
  }

  /** True when the column appears anywhere in the statement. */
  public boolean references(String column) {
    return selectColumns.contains(column)
        || filteredColumns().contains(column)
        || (order != null && order.column().equals(column));
  }
}
