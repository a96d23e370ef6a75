package com.gentoro.kbo.classifier;

import java.util.function.Predicate;

/** One row of the ordered rule table: when {@code predicate} holds the question is {@code category}. */
public record ClassificationRule(
    String name, Predicate<ClassificationInput> predicate, Category category) {

  public boolean matches(ClassificationInput input) {
    return predicate.test(input);
  }
}
