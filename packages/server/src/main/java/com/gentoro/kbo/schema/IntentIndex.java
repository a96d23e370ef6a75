package com.gentoro.kbo.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lexical similarity search over the intent exemplars and table descriptions.
 *
 * <p>Each exemplar and table becomes a TF-IDF vector at construction time; a question is scored by
 * cosine similarity. The index is immutable and safe to share across threads.
 */
public final class IntentIndex {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(IntentIndex.class);

  private final SchemaCatalog catalog;
  private final double threshold;
  private final Map<String, Double> idf;
  private final List<Entry<IntentExemplar>> exemplarVectors = new ArrayList<>();
  private final List<Entry<TableDescriptor>> tableVectors = new ArrayList<>();

  private record Entry<T>(T item, TermVector vector) {}

  public IntentIndex(SchemaCatalog catalog, double threshold) {
    this.catalog = catalog;
    this.threshold = threshold;

    List<List<String>> documents = new ArrayList<>();
    for (IntentExemplar e : catalog.exemplars()) {
      documents.add(exemplarText(e));
    }
    for (TableDescriptor t : catalog.tables()) {
      documents.add(tableText(t));
    }
    this.idf = inverseDocumentFrequency(documents);

    for (IntentExemplar e : catalog.exemplars()) {
      exemplarVectors.add(new Entry<>(e, TermVector.of(exemplarText(e), idf)));
    }
    for (TableDescriptor t : catalog.tables()) {
      tableVectors.add(new Entry<>(t, TermVector.of(tableText(t), idf)));
    }
  }

  private static List<String> exemplarText(IntentExemplar e) {
    List<String> text = new ArrayList<>(e.keywords());
    text.add(e.description());
    return text;
  }

  private static List<String> tableText(TableDescriptor t) {
    List<String> text = new ArrayList<>();
    text.add(t.description());
    for (ColumnDescriptor c : t.columns()) {
      text.add(c.description());
      text.addAll(c.synonyms());
    }
    return text;
  }

  private static Map<String, Double> inverseDocumentFrequency(Collection<List<String>> documents) {
    Map<String, Integer> df = new HashMap<>();
    for (List<String> doc : documents) {
      Set<String> seen = new HashSet<>();
      for (String text : doc) {
        seen.addAll(TermVector.termCounts(text).keySet());
      }
      seen.forEach(term -> df.merge(term, 1, Integer::sum));
    }
    int n = documents.size();
    Map<String, Double> idf = new HashMap<>();
    df.forEach((term, count) -> idf.put(term, Math.log(1.0 + (double) n / count)));
    return idf;
  }

  /** Exemplars ranked by similarity, best first. Scores of zero are omitted. */
  public List<IntentMatch> search(String question, int topK) {
    TermVector query = TermVector.of(List.of(question == null ? "" : question), idf);
    if (query.isEmpty()) {
      return List.of();
    }
    return exemplarVectors.stream()
        .map(e -> new IntentMatch(e.item(), query.cosine(e.vector())))
        .filter(m -> m.score() > 0)
        .sorted(Comparator.comparingDouble(IntentMatch::score).reversed())
        .limit(Math.max(1, topK))
        .toList();
  }

  /**
   * Table hint for the SQL prompt. Empty when the best exemplar scores below the threshold or is
   * bound to no table.
   */
  public Optional<String> tableHint(String question) {
    List<IntentMatch> matches = search(question, 1);
    if (matches.isEmpty()) {
      return Optional.empty();
    }
    IntentMatch best = matches.get(0);
    log.debug(
        "Best intent for question: {} (score {})",
        best.exemplar().category(),
        String.format("%.3f", best.score()));
    if (best.score() < threshold || !best.exemplar().hasTable()) {
      return Optional.empty();
    }
    return Optional.of(best.exemplar().table());
  }

  /** All tables ordered by relevance to the question; ties keep catalog order. */
  public List<TableDescriptor> rankTables(String question) {
    TermVector query = TermVector.of(List.of(question == null ? "" : question), idf);
    List<Entry<TableDescriptor>> ordered = new ArrayList<>(tableVectors);
    ordered.sort(
        Comparator.comparingDouble((Entry<TableDescriptor> e) -> query.cosine(e.vector())).reversed());
    return ordered.stream().map(Entry::item).toList();
  }

  /**
   * Schema section of the SQL-generation prompt: every table with its columns, semantic types and
   * synonyms, the tables most relevant to the question first.
   */
  public String schemaHints(String question) {
    StringBuilder sb = new StringBuilder();
    for (TableDescriptor table : rankTables(question)) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(table.name()).append(" 테이블: ").append(table.description()).append('\n');
      for (ColumnDescriptor column : table.columns()) {
        sb.append("- ").append(column.name()).append(": ").append(column.type());
        if (column.description() != null && !column.description().isBlank()) {
          sb.append(" - ").append(column.description());
        }
        if (!column.synonyms().isEmpty()) {
          sb.append(" [별칭: ").append(String.join(", ", column.synonyms())).append(']');
        }
        sb.append('\n');
      }
    }
    return sb.toString().trim();
  }

  public double threshold() {
    return threshold;
  }

  public SchemaCatalog catalog() {
    return catalog;
  }
}
