package com.gentoro.kbo.compiler;

import com.gentoro.kbo.store.Comparison;
import com.gentoro.kbo.store.OrderSpec;
import com.gentoro.kbo.store.RangeFilter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the SQL-shaped text a model produces and extracts its structure.
 *
 * <p>Accepted grammar, case-insensitive:
 *
 * <pre>
 * SELECT [DISTINCT] col[, col...] | *
 *   FROM table [[AS] alias]
 *   [WHERE cond [AND cond ...]]
 *   [ORDER BY col [ASC|DESC] [NULLS FIRST|LAST][, ...]]
 *   [LIMIT n] ;
 *
 * cond := col = literal | col IN (literal, ...) | col (&gt;=|&lt;=|&gt;|&lt;) number
 *       | col IS NOT NULL | (col = literal OR col = literal ...)
 * </pre>
 *
 * <p>Markdown fences and surrounding prose are ignored. Anything else (joins, grouping, sub-queries,
 * functions, write statements, a second statement) is rejected. Only the first ORDER BY key is
 * kept.
 *
 * <p>{@link #parse(String)} never throws.
 */
public final class PseudoSqlParser {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(PseudoSqlParser.class);

  private static final int CI = Pattern.CASE_INSENSITIVE;
  private static final String COLUMN_REF = "(?:[A-Za-z_]\\w*\\.)?([A-Za-z_]\\w*)";

  private static final Pattern FENCE = Pattern.compile("```[A-Za-z]*");
  private static final Pattern SELECT_WORD = Pattern.compile("\\bSELECT\\b", CI);
  private static final Pattern WRITE_VERB =
      Pattern.compile(
          "^\\s*(INSERT|UPDATE|DELETE|DROP|ALTER|CREATE|TRUNCATE|MERGE|GRANT|REVOKE|UPSERT)\\b", CI);
  private static final Pattern UNSUPPORTED_CLAUSE =
      Pattern.compile("\\b(JOIN|GROUP\\s+BY|HAVING|UNION|INTERSECT|EXCEPT|OFFSET)\\b", CI);
  private static final Pattern STATEMENT =
      Pattern.compile(
          "^SELECT\\s+(?:DISTINCT\\s+)?(.+?)\\s+FROM\\s+([A-Za-z_][\\w.]*)(.*)$",
          CI | Pattern.DOTALL);
  private static final Pattern TABLE_ALIAS =
      Pattern.compile("^\\s+(?:AS\\s+)?(?!(?:WHERE|ORDER|LIMIT)\\b)([A-Za-z_]\\w*)", CI);
  private static final Pattern WHERE = Pattern.compile("\\bWHERE\\b", CI);
  private static final Pattern ORDER_BY = Pattern.compile("\\bORDER\\s+BY\\b", CI);
  private static final Pattern LIMIT = Pattern.compile("\\bLIMIT\\b", CI);
  private static final Pattern LIMIT_VALUE = Pattern.compile("^\\s*(\\d{1,6})\\s*$");
  private static final Pattern ORDER_ITEM =
      Pattern.compile(
          "^\\s*" + COLUMN_REF + "(?:\\s+(ASC|DESC))?(?:\\s+NULLS\\s+(?:FIRST|LAST))?\\s*$", CI);
  private static final Pattern SELECT_ITEM =
      Pattern.compile(
          "^\\s*(?:(?:[A-Za-z_]\\w*\\.)?(\\*)|" + COLUMN_REF + ")(?:\\s+(?:AS\\s+)?[A-Za-z_]\\w*)?\\s*$",
          CI);
  private static final Pattern COMPARISON =
      Pattern.compile("^\\s*" + COLUMN_REF + "\\s*(>=|<=|<>|!=|=|>|<)\\s*(.+?)\\s*$", Pattern.DOTALL);
  private static final Pattern MEMBERSHIP =
      Pattern.compile("^\\s*" + COLUMN_REF + "\\s+IN\\s*\\((.*)\\)\\s*$", CI | Pattern.DOTALL);
  private static final Pattern NOT_NULL =
      Pattern.compile("^\\s*" + COLUMN_REF + "\\s+IS\\s+NOT\\s+NULL\\s*$", CI);
  private static final Pattern AND = Pattern.compile("\\s+AND\\s+", CI);
  private static final Pattern OR = Pattern.compile("\\s+OR\\s+", CI);
  private static final Pattern COMMA = Pattern.compile(",");
  private static final Pattern BARE_LITERAL =
      Pattern.compile("^[\\w.+-]+$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern NUMBER = Pattern.compile("^[+-]?\\d+(?:\\.\\d+)?$");

  private static final char MASK = '_';

  /** Raised inside the parser only; {@link #parse(String)} turns it into {@link ParseResult.Err}. */
  private static final class Rejection extends RuntimeException {
    Rejection(String reason) {
      super(reason, null, false, false);
    }
  }

  /** A slice of the statement, kept in both original and literal-masked form. */
  private record Span(String text, String masked) {
    Span slice(int start, int end) {
      return new Span(text.substring(start, end), masked.substring(start, end));
    }

    Span trim() {
      int start = 0;
      int end = masked.length();
      while (start < end && Character.isWhitespace(masked.charAt(start))) {
        start++;
      }
      while (end > start && Character.isWhitespace(masked.charAt(end - 1))) {
        end--;
      }
      return slice(start, end);
    }

    boolean isBlank() {
      return masked.isBlank();
    }
  }

  public ParseResult parse(String modelOutput) {
    if (modelOutput == null || modelOutput.isBlank()) {
      return ParseResult.err("empty model output", modelOutput);
    }
    String text = FENCE.matcher(modelOutput).replaceAll(" ").trim();
    if (text.toUpperCase(Locale.ROOT).contains("DB_ERROR:")) {
      return ParseResult.err("model reported DB_ERROR", text);
    }
    try {
      Span statement = locateStatement(text);
      ParsedQuery query = parseStatement(statement);
      log.debug("Parsed pseudo-SQL: table={}, order={}, limit={}", query.table(), query.order(), query.limit());
      return ParseResult.ok(query);
    } catch (Rejection r) {
      log.debug("Rejected pseudo-SQL ({}): {}", r.getMessage(), text);
      return ParseResult.err(r.getMessage(), text);
    }
  }

  private Span locateStatement(String text) {
    String masked = mask(text);
    Span whole = new Span(text, masked);

    Span statement = null;
    int start = 0;
    while (start <= masked.length()) {
      int semi = masked.indexOf(';', start);
      int end = semi < 0 ? masked.length() : semi;
      Span segment = whole.slice(start, end);
      if (WRITE_VERB.matcher(segment.masked()).find()) {
        throw new Rejection("only SELECT statements are supported");
      }
      Matcher select = SELECT_WORD.matcher(segment.masked());
      if (select.find()) {
        if (statement != null) {
          throw new Rejection("more than one statement");
        }
        statement = segment.slice(select.start(), segment.masked().length()).trim();
      }
      if (semi < 0) {
        break;
      }
      start = semi + 1;
    }
    if (statement == null) {
      throw new Rejection("no SELECT statement found");
    }
    return statement;
  }

  private ParsedQuery parseStatement(Span statement) {
    String masked = statement.masked();
    Matcher selects = SELECT_WORD.matcher(masked);
    selects.find();
    if (selects.find()) {
      throw new Rejection("sub-queries are not supported");
    }
    Matcher unsupported = UNSUPPORTED_CLAUSE.matcher(masked);
    if (unsupported.find()) {
      throw new Rejection("unsupported clause: " + unsupported.group(1).toUpperCase(Locale.ROOT));
    }
    Matcher m = STATEMENT.matcher(masked);
    if (!m.matches()) {
      throw new Rejection("statement is not of the form SELECT ... FROM table");
    }
    List<String> columns = parseSelectList(statement.slice(m.start(1), m.end(1)));
    String table = m.group(2).toLowerCase(Locale.ROOT);
    if (table.contains(".")) {
      table = table.substring(table.lastIndexOf('.') + 1);
    }

    Span tail = statement.slice(m.start(3), m.end(3));
    Matcher alias = TABLE_ALIAS.matcher(tail.masked());
    if (alias.find()) {
      tail = tail.slice(alias.end(), tail.masked().length());
    }

    int whereAt = find(WHERE, tail.masked());
    int orderAt = find(ORDER_BY, tail.masked());
    int limitAt = find(LIMIT, tail.masked());
    int firstClause = firstNonNegative(whereAt, orderAt, limitAt, tail.masked().length());
    if (!tail.slice(0, firstClause).isBlank()) {
      throw new Rejection("unexpected text after FROM " + table);
    }
    if ((whereAt >= 0 && orderAt >= 0 && orderAt < whereAt)
        || (whereAt >= 0 && limitAt >= 0 && limitAt < whereAt)
        || (orderAt >= 0 && limitAt >= 0 && limitAt < orderAt)) {
      throw new Rejection("clauses are out of order");
    }

    Clauses clauses = new Clauses();
    if (whereAt >= 0) {
      int end = firstNonNegative(orderAt, limitAt, tail.masked().length());
      Matcher w = WHERE.matcher(tail.masked());
      w.find(whereAt);
      parseWhere(tail.slice(w.end(), end).trim(), clauses);
    }
    OrderSpec order = null;
    if (orderAt >= 0) {
      int end = limitAt >= 0 ? limitAt : tail.masked().length();
      Matcher o = ORDER_BY.matcher(tail.masked());
      o.find(orderAt);
      order = parseOrder(tail.slice(o.end(), end).trim());
    }
    Integer limit = null;
    if (limitAt >= 0) {
      Matcher l = LIMIT.matcher(tail.masked());
      l.find(limitAt);
      Matcher value = LIMIT_VALUE.matcher(tail.masked().substring(l.end()));
      if (!value.matches()) {
        throw new Rejection("LIMIT must be a plain number");
      }
      limit = Integer.parseInt(value.group(1));
    }

    return new ParsedQuery(
        table,
        columns,
        clauses.equalities,
        clauses.memberships,
        clauses.ranges,
        clauses.notNull,
        order,
        limit,
        statement.text());
  }

  private List<String> parseSelectList(Span list) {
    List<String> columns = new ArrayList<>();
    for (Span item : splitTopLevel(list, COMMA)) {
      if (item.masked().contains("(")) {
        throw new Rejection("functions are not supported in SELECT: " + item.text().trim());
      }
      Matcher m = SELECT_ITEM.matcher(item.masked());
      if (!m.matches()) {
        throw new Rejection("cannot read SELECT item: " + item.text().trim());
      }
      String column = m.group(1) != null ? "*" : m.group(2).toLowerCase(Locale.ROOT);
      if (!columns.contains(column)) {
        columns.add(column);
      }
    }
    if (columns.isEmpty()) {
      throw new Rejection("empty SELECT list");
    }
    return columns;
  }

  private OrderSpec parseOrder(Span clause) {
    List<Span> keys = splitTopLevel(clause, COMMA);
    if (keys.isEmpty()) {
      throw new Rejection("empty ORDER BY clause");
    }
    Matcher m = ORDER_ITEM.matcher(keys.get(0).masked());
    if (!m.matches()) {
      throw new Rejection("cannot read ORDER BY: " + clause.text());
    }
    if (keys.size() > 1) {
      log.debug("Ignoring secondary ORDER BY keys: {}", clause.text());
    }
    boolean descending = m.group(2) != null && m.group(2).equalsIgnoreCase("DESC");
    return new OrderSpec(m.group(1).toLowerCase(Locale.ROOT), descending);
  }

  private void parseWhere(Span where, Clauses clauses) {
    if (where.isBlank()) {
      throw new Rejection("empty WHERE clause");
    }
    List<Span> conjuncts = splitTopLevel(where, AND);
    if (conjuncts.size() > 1 && splitTopLevel(where, OR).size() > 1) {
      throw new Rejection("AND and OR must not be mixed without parentheses");
    }
    for (Span conjunct : conjuncts) {
      Span condition = unwrap(conjunct);
      List<Span> alternatives = splitTopLevel(condition, OR);
      if (alternatives.size() > 1) {
        parseAlternatives(alternatives, clauses);
      } else {
        parseCondition(condition, clauses);
      }
    }
  }

  /** {@code a = 'x' OR a = 'y' OR a IN ('z')} on a single column becomes a membership. */
  private void parseAlternatives(List<Span> alternatives, Clauses clauses) {
    String column = null;
    List<String> values = new ArrayList<>();
    for (Span alternative : alternatives) {
      Span condition = unwrap(alternative);
      String current;
      Matcher in = MEMBERSHIP.matcher(condition.masked());
      Matcher cmp = COMPARISON.matcher(condition.masked());
      if (in.matches()) {
        current = in.group(1).toLowerCase(Locale.ROOT);
        values.addAll(literals(condition.slice(in.start(2), in.end(2))));
      } else if (cmp.matches() && cmp.group(2).equals("=")) {
        current = cmp.group(1).toLowerCase(Locale.ROOT);
        values.add(literal(condition.slice(cmp.start(3), cmp.end(3))));
      } else {
        throw new Rejection("OR is only supported between equalities on one column");
      }
      if (column != null && !column.equals(current)) {
        throw new Rejection("OR is only supported between equalities on one column");
      }
      column = current;
    }
    clauses.addMembership(column, values);
  }

  private void parseCondition(Span condition, Clauses clauses) {
    Matcher notNull = NOT_NULL.matcher(condition.masked());
    if (notNull.matches()) {
      clauses.notNull.add(notNull.group(1).toLowerCase(Locale.ROOT));
      return;
    }
    Matcher in = MEMBERSHIP.matcher(condition.masked());
    if (in.matches()) {
      clauses.addMembership(
          in.group(1).toLowerCase(Locale.ROOT), literals(condition.slice(in.start(2), in.end(2))));
      return;
    }
    Matcher cmp = COMPARISON.matcher(condition.masked());
    if (!cmp.matches()) {
      throw new Rejection("unsupported condition: " + condition.text().trim());
    }
    String column = cmp.group(1).toLowerCase(Locale.ROOT);
    String operator = cmp.group(2);
    String value = literal(condition.slice(cmp.start(3), cmp.end(3)));
    switch (operator) {
      case "=" -> clauses.addEquality(column, value);
      case "<>", "!=" -> throw new Rejection("inequality is not supported: " + condition.text().trim());
      default -> {
        if (!NUMBER.matcher(value).matches()) {
          throw new Rejection("comparison needs a number: " + condition.text().trim());
        }
        clauses.ranges.add(new RangeFilter(column, Comparison.fromSymbol(operator), value));
      }
    }
  }

  private List<String> literals(Span list) {
    List<String> values = new ArrayList<>();
    for (Span item : splitTopLevel(list, COMMA)) {
      values.add(literal(item));
    }
    if (values.isEmpty()) {
      throw new Rejection("empty IN list");
    }
    return values;
  }

  private String literal(Span raw) {
    Span value = raw.trim();
    String text = value.text();
    String masked = value.masked();
    if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
      if (masked.substring(1, masked.length() - 1).indexOf('\'') >= 0) {
        throw new Rejection("expected a single literal: " + text);
      }
      return text.substring(1, text.length() - 1).replace("''", "'");
    }
    if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
      String inner = text.substring(1, text.length() - 1);
      if (inner.indexOf('"') >= 0) {
        throw new Rejection("expected a single literal: " + text);
      }
      return inner;
    }
    if (BARE_LITERAL.matcher(text).matches()) {
      return text;
    }
    throw new Rejection("cannot read literal: " + text);
  }

  /** Mutable accumulator for WHERE predicates. */
  private static final class Clauses {
    final Map<String, String> equalities = new LinkedHashMap<>();
    final Map<String, List<String>> memberships = new LinkedHashMap<>();
    final List<RangeFilter> ranges = new ArrayList<>();
    final Set<String> notNull = new LinkedHashSet<>();

    void addEquality(String column, String value) {
      String previous = equalities.get(column);
      if ((previous != null && !previous.equals(value)) || memberships.containsKey(column)) {
        throw new Rejection("conflicting predicates on " + column);
      }
      equalities.put(column, value);
    }

    void addMembership(String column, List<String> values) {
      if (memberships.containsKey(column) || equalities.containsKey(column)) {
        throw new Rejection("conflicting predicates on " + column);
      }
      memberships.put(column, new ArrayList<>(new LinkedHashSet<>(values)));
    }
  }

  // --- lexical helpers --------------------------------------------------------------------------

  /**
   * Replace the characters inside single-quoted literals with a placeholder so keywords and
   * separators inside literals are never matched. Quotes themselves are kept; the result has the
   * same length as the input.
   */
  static String mask(String text) {
    StringBuilder out = new StringBuilder(text.length());
    boolean inLiteral = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\'') {
        if (inLiteral && i + 1 < text.length() && text.charAt(i + 1) == '\'') {
          out.append(MASK).append(MASK);
          i++;
          continue;
        }
        inLiteral = !inLiteral;
        out.append(c);
      } else {
        out.append(inLiteral ? MASK : c);
      }
    }
    if (inLiteral) {
      throw new Rejection("unterminated string literal");
    }
    return out.toString();
  }

  private static List<Span> splitTopLevel(Span span, Pattern separator) {
    String masked = span.masked();
    List<Span> parts = new ArrayList<>();
    Matcher matcher = separator.matcher(masked);
    int depth = 0;
    int partStart = 0;
    int i = 0;
    while (i < masked.length()) {
      char c = masked.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth < 0) {
          throw new Rejection("unbalanced parentheses");
        }
      } else if (depth == 0 && matcher.region(i, masked.length()).lookingAt()) {
        parts.add(span.slice(partStart, i));
        i = matcher.end();
        partStart = i;
        continue;
      }
      i++;
    }
    if (depth != 0) {
      throw new Rejection("unbalanced parentheses");
    }
    parts.add(span.slice(partStart, masked.length()));
    return parts.stream().map(Span::trim).filter(p -> !p.isBlank()).toList();
  }

  /** Strip parentheses that enclose the whole condition. */
  private static Span unwrap(Span condition) {
    Span current = condition.trim();
    while (current.masked().startsWith("(") && closingIndex(current.masked()) == current.masked().length() - 1) {
      current = current.slice(1, current.masked().length() - 1).trim();
    }
    return current;
  }

  private static int closingIndex(String masked) {
    int depth = 0;
    for (int i = 0; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private static int find(Pattern pattern, String masked) {
    Matcher m = pattern.matcher(masked);
    return m.find() ? m.start() : -1;
  }

  private static int firstNonNegative(int... candidates) {
    int best = Integer.MAX_VALUE;
    for (int c : candidates) {
      if (c >= 0 && c < best) {
        best = c;
      }
    }
    return best;
  }
}
