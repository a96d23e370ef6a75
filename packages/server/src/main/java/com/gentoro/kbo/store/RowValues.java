package com.gentoro.kbo.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Comparator;

/** Typed reads from store rows, which arrive as loosely typed JSON objects. */
public final class RowValues {
  private RowValues() {}

  public static boolean isNull(JsonNode row, String column) {
    JsonNode value = row == null ? null : row.get(column);
    return value == null || value.isNull() || (value.isTextual() && value.asText().isBlank());
  }

  /** Numeric value of a column, or null when absent or not a number. Numeric strings count. */
  public static Double number(JsonNode row, String column) {
    if (isNull(row, column)) {
      return null;
    }
    JsonNode value = row.get(column);
    if (value.isNumber()) {
      return value.asDouble();
    }
    if (value.isTextual()) {
      try {
        return Double.parseDouble(value.asText().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  public static String text(JsonNode row, String column) {
    return isNull(row, column) ? null : row.get(column).asText();
  }

  public static String text(JsonNode row, String column, String fallback) {
    String value = text(row, column);
    return value == null ? fallback : value;
  }

  public static int integer(JsonNode row, String column, int fallback) {
    Double value = number(row, column);
    return value == null ? fallback : value.intValue();
  }

  /**
   * Row ordering for client-side sorts. A missing sort key counts as zero; keys that are text on
   * both sides compare lexically.
   */
  public static Comparator<JsonNode> comparator(OrderSpec order) {
    Comparator<JsonNode> ascending =
        (a, b) -> {
          boolean aText = isText(a, order.column());
          boolean bText = isText(b, order.column());
          if (aText && bText) {
            return text(a, order.column()).compareTo(text(b, order.column()));
          }
          return Double.compare(numberOrZero(a, order.column()), numberOrZero(b, order.column()));
        };
    return order.descending() ? ascending.reversed() : ascending;
  }

  private static double numberOrZero(JsonNode row, String column) {
    Double value = number(row, column);
    return value == null ? 0.0 : value;
  }

  private static boolean isText(JsonNode row, String column) {
    return !isNull(row, column) && number(row, column) == null;
  }
}
