package com.gentoro.kbo.classifier;

import java.util.Optional;

/**
 * Outcome of classifying one question. {@code tableHint} is only ever set for {@link
 * Category#GENERIC_QUERY}.
 */
public record Classification(Category category, String rule, String tableHint) {

  public static Classification of(Category category, String rule) {
    return new Classification(category, rule, null);
  }

  public Optional<String> optionalTableHint() {
    return Optional.ofNullable(tableHint);
  }
}
