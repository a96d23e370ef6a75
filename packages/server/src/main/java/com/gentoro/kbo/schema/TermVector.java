package com.gentoro.kbo.schema;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sparse bag-of-terms vector. Latin words are kept whole; Hangul runs are also split into
 * character bigrams because Korean particles glue onto nouns ({@code 홈런왕은}, {@code 타율이}).
 */
final class TermVector {
  private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final double EPS = 1e-9;

  private final Map<String, Double> weights;

  private TermVector(Map<String, Double> weights) {
    this.weights = weights;
  }

  static Map<String, Integer> termCounts(String text) {
    Map<String, Integer> counts = new HashMap<>();
    if (text == null || text.isBlank()) {
      return counts;
    }
    for (String token : SPLIT.split(text.toLowerCase(Locale.ROOT))) {
      if (token.isEmpty()) {
        continue;
      }
      counts.merge(token, 1, Integer::sum);
      if (isHangul(token) && token.length() > 2) {
        for (int i = 0; i + 2 <= token.length(); i++) {
          counts.merge(token.substring(i, i + 2), 1, Integer::sum);
        }
      }
    }
    return counts;
  }

  static TermVector of(Map<String, Integer> counts, Map<String, Double> idf) {
    Map<String, Double> weights = new HashMap<>();
    counts.forEach((term, count) -> weights.put(term, count * idf.getOrDefault(term, 1.0)));
    return new TermVector(weights);
  }

  static TermVector of(Collection<String> texts, Map<String, Double> idf) {
    Map<String, Integer> counts = new HashMap<>();
    texts.forEach(t -> termCounts(t).forEach((k, v) -> counts.merge(k, v, Integer::sum)));
    return of(counts, idf);
  }

  double cosine(TermVector other) {
    double dot = 0;
    for (Map.Entry<String, Double> e : weights.entrySet()) {
      Double w = other.weights.get(e.getKey());
      if (w != null) {
        dot += e.getValue() * w;
      }
    }
    if (dot == 0) {
      return 0.0;
    }
    return dot / (norm() * other.norm() + EPS);
  }

  boolean isEmpty() {
    return weights.isEmpty();
  }

  private double norm() {
    double sum = 0;
    for (double w : weights.values()) {
      sum += w * w;
    }
    return Math.sqrt(sum);
  }

  private static boolean isHangul(String token) {
    for (int i = 0; i < token.length(); i++) {
      if (Character.UnicodeScript.of(token.charAt(i)) != Character.UnicodeScript.HANGUL) {
        return false;
      }
    }
    return true;
  }
}
