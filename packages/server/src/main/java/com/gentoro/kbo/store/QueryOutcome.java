package com.gentoro.kbo.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** What a plan execution produced: rows (possibly none), or a marker that the store failed. */
public sealed interface QueryOutcome {

  record Rows(List<JsonNode> rows) implements QueryOutcome {
    public Rows {
      rows = List.copyOf(rows);
    }
  }

  record DataUnavailable(String reason) implements QueryOutcome {}

  static QueryOutcome rows(List<JsonNode> rows) {
    return new Rows(rows);
  }

  static QueryOutcome unavailable(String reason) {
    return new DataUnavailable(reason);
  }

  default boolean isUnavailable() {
    return this instanceof DataUnavailable;
  }

  /** True for a successful execution that matched nothing. */
  default boolean isEmpty() {
    return this instanceof Rows r && r.rows().isEmpty();
  }

  default List<JsonNode> rowsOrEmpty() {
    return this instanceof Rows r ? r.rows() : List.of();
  }
}
