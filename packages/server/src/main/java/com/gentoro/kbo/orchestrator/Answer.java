package com.gentoro.kbo.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.classifier.Category;
import java.util.List;
import java.util.Optional;

/**
 * The text returned for a question, with the category it was routed to. Generic questions also
 * carry the pseudo-SQL that was compiled and the rows it returned, in answer order.
 */
public record Answer(Category category, String text, String pseudoSql, List<JsonNode> rows) {

  public Answer {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public static Answer text(Category category, String text) {
    return new Answer(category, text, null, List.of());
  }

  public Optional<String> optionalPseudoSql() {
    return Optional.ofNullable(pseudoSql);
  }
}
