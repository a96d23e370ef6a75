package com.gentoro.kbo.classifier;

import com.gentoro.kbo.entity.ResolvedEntities;
import com.gentoro.kbo.schema.IntentIndex;
import java.util.List;
import java.util.Optional;

/**
 * Routes a question to a {@link Category}.
 *
 * <p>Rules are evaluated in order and the first match wins. Detail and prediction questions share
 * vocabulary with plain schedule and result questions, so they are tested first. Whether a team is
 * named separates the batch intents (every game of a day) from the single-game intent.
 *
 * <p>Questions no rule claims become {@link Category#GENERIC_QUERY}; for those the {@link
 * IntentIndex} is asked for a table hint, which is kept only above its similarity threshold.
 */
public class RequestClassifier {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(RequestClassifier.class);

  public static final List<ClassificationRule> DEFAULT_RULES =
      List.of(
          new ClassificationRule(
              "future-game-detail",
              in -> in.mentionsFutureDetail() && !in.mentionsPrediction() && isAboutAGame(in),
              Category.FUTURE_GAME_DETAIL),
          new ClassificationRule(
              "game-prediction", ClassificationInput::mentionsPrediction, Category.GAME_PREDICTION),
          new ClassificationRule(
              "daily-results",
              in -> in.mentionsDate() && in.mentionsResult() && !in.namesTeam(),
              Category.DAILY_RESULTS_ANALYSIS),
          new ClassificationRule(
              "daily-schedule",
              in -> in.mentionsSchedule() && !in.namesTeam(),
              Category.DAILY_SCHEDULE),
          new ClassificationRule(
              "game-analysis",
              in -> in.mentionsDate() && in.mentionsGame() && in.namesTeam(),
              Category.GAME_ANALYSIS));

  private final ClassifierKeywords keywords;
  private final IntentIndex intentIndex;
  private final List<ClassificationRule> rules;

  public RequestClassifier(ClassifierKeywords keywords, IntentIndex intentIndex) {
    this(keywords, intentIndex, DEFAULT_RULES);
  }

  public RequestClassifier(
      ClassifierKeywords keywords, IntentIndex intentIndex, List<ClassificationRule> rules) {
    this.keywords = keywords;
    this.intentIndex = intentIndex;
    this.rules = List.copyOf(rules);
  }

  // Detail words such as 선발 or 언제 also appear in stat questions; require a game context.
  private static boolean isAboutAGame(ClassificationInput in) {
    return in.mentionsGame() || in.namesTeam() || in.entities().hasDate();
  }

  public Classification classify(String question, ResolvedEntities entities) {
    ClassificationInput input = new ClassificationInput(question, entities, keywords);
    for (ClassificationRule rule : rules) {
      if (rule.matches(input)) {
        log.debug("Question classified as {} by rule '{}'", rule.category(), rule.name());
        return Classification.of(rule.category(), rule.name());
      }
    }
    Optional<String> hint =
        intentIndex == null ? Optional.empty() : intentIndex.tableHint(question);
    log.debug("Question classified as GENERIC_QUERY, table hint: {}", hint.orElse("<none>"));
    return new Classification(Category.GENERIC_QUERY, "fallback", hint.orElse(null));
  }

  public List<ClassificationRule> rules() {
    return rules;
  }
}
