package com.gentoro.kbo.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.store.RangeFilter;
import com.gentoro.kbo.store.RemoteStore;
import com.gentoro.kbo.store.RowValues;
import com.gentoro.kbo.store.StoreQuery;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Store fake that evaluates queries the way the REST store does: equality, range and not-null
 * filters, then order (nulls last) and limit. Every query is recorded.
 */
public class InMemoryRemoteStore implements RemoteStore {
  private final Map<String, List<JsonNode>> tables = new HashMap<>();
  private final Set<String> failingTables = new HashSet<>();
  private final List<StoreQuery> queries = new ArrayList<>();
  private boolean failAll;

  public InMemoryRemoteStore table(String name, List<JsonNode> rows) {
    tables.put(name, new ArrayList<>(rows));
    return this;
  }

  public InMemoryRemoteStore table(String name, String jsonArray) {
    return table(name, Json.rows(jsonArray));
  }

  public InMemoryRemoteStore failing(String table) {
    failingTables.add(table);
    return this;
  }

  public InMemoryRemoteStore failingEverything() {
    failAll = true;
    return this;
  }

  public List<StoreQuery> queries() {
    return queries;
  }

  public int calls() {
    return queries.size();
  }

  public List<StoreQuery> queriesOn(String table) {
    return queries.stream().filter(q -> q.table().equals(table)).toList();
  }

  @Override
  public synchronized List<JsonNode> select(StoreQuery query) {
    queries.add(query);
    if (failAll || failingTables.contains(query.table())) {
      throw new StoreException("HTTP 503 from store: unavailable");
    }
    List<JsonNode> rows = new ArrayList<>();
    for (JsonNode row : tables.getOrDefault(query.table(), List.of())) {
      if (matches(row, query)) {
        rows.add(row);
      }
    }
    query
        .optionalOrder()
        .ifPresent(
            order -> {
              Comparator<JsonNode> nullsLast =
                  Comparator.comparing(r -> RowValues.isNull(r, order.column()));
              rows.sort(nullsLast.thenComparing(RowValues.comparator(order)));
            });
    int limit = query.optionalLimit().orElse(rows.size());
    return List.copyOf(rows.subList(0, Math.min(limit, rows.size())));
  }

  private static boolean matches(JsonNode row, StoreQuery query) {
    for (Map.Entry<String, String> eq : query.equalities().entrySet()) {
      if (!eq.getValue().equals(RowValues.text(row, eq.getKey()))) {
        return false;
      }
    }
    for (RangeFilter range : query.ranges()) {
      if (!inRange(row, range)) {
        return false;
      }
    }
    for (String column : query.notNull()) {
      if (RowValues.isNull(row, column)) {
        return false;
      }
    }
    return true;
  }

  private static boolean inRange(JsonNode row, RangeFilter range) {
    if (RowValues.isNull(row, range.column())) {
      return false;
    }
    int cmp;
    Double number = RowValues.number(row, range.column());
    if (number != null && isNumber(range.value())) {
      cmp = Double.compare(number, Double.parseDouble(range.value()));
    } else {
      cmp = RowValues.text(row, range.column()).compareTo(range.value());
    }
    return switch (range.comparison()) {
      case GT -> cmp > 0;
      case GTE -> cmp >= 0;
      case LT -> cmp < 0;
      case LTE -> cmp <= 0;
    };
  }

  private static boolean isNumber(String value) {
    try {
      Double.parseDouble(value);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
