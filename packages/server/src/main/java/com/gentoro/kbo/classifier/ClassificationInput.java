package com.gentoro.kbo.classifier;

import com.gentoro.kbo.entity.ResolvedEntities;
import java.util.Locale;

/**
 * What the classification rules look at: the lower-cased question, the entities already extracted
 * from it and the keyword vocabularies.
 */
public record ClassificationInput(
    String question, ResolvedEntities entities, ClassifierKeywords keywords) {

  public ClassificationInput {
    question = question == null ? "" : question.toLowerCase(Locale.ROOT);
  }

  public boolean mentionsFutureDetail() {
    return ClassifierKeywords.containsAny(question, keywords.futureDetail());
  }

  public boolean mentionsPrediction() {
    return ClassifierKeywords.containsAny(question, keywords.prediction());
  }

  public boolean mentionsResult() {
    return ClassifierKeywords.containsAny(question, keywords.result());
  }

  public boolean mentionsSchedule() {
    return ClassifierKeywords.containsAny(question, keywords.schedule())
        && !ClassifierKeywords.containsAny(question, keywords.scheduleExclusions());
  }

  public boolean mentionsDate() {
    return entities.hasDate() || ClassifierKeywords.containsAny(question, keywords.date());
  }

  public boolean mentionsGame() {
    return ClassifierKeywords.containsAny(question, keywords.game());
  }

  public boolean namesTeam() {
    return entities.hasTeam();
  }
}
