package com.gentoro.kbo.orchestrator;

import com.gentoro.kbo.classifier.Category;
import com.gentoro.kbo.classifier.Classification;
import com.gentoro.kbo.compiler.CompiledPlan;
import com.gentoro.kbo.entity.ResolvedEntities;
import com.gentoro.kbo.exception.CompileException;
import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.LlmException;
import com.gentoro.kbo.exception.UnsupportedTableException;
import com.gentoro.kbo.handler.CategoryHandler;
import com.gentoro.kbo.handler.HandlerRequest;
import com.gentoro.kbo.handler.NoDataMessages;
import com.gentoro.kbo.store.QueryOutcome;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Answers one question: extract entities, classify, then either hand the question to its category
 * handler or run the generic path (model pseudo-SQL, compile, execute, render).
 *
 * <p>{@link #answer(String)} is blocking and never throws. Terminal compile failures produce the
 * fixed apology without touching the store; everything else that goes wrong produces a no-data
 * text. The service holds no per-call state and may be called from several threads.
 */
public class AnswerService {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(AnswerService.class);

  private final AssistantContext context;

  public AnswerService(AssistantContext context) {
    this.context = context;
  }

  public String answer(String question) {
    return answer(question, LocalDate.now(context.zone()));
  }

  /** Answers as if asked on {@code today}; relative dates resolve against it. */
  public String answer(String question, LocalDate today) {
    return resolve(question, today).text();
  }

  public Answer resolve(String question, LocalDate today) {
    if (question == null || question.isBlank()) {
      return Answer.text(Category.GENERIC_QUERY, NoDataMessages.APOLOGY);
    }
    String trimmed = question.trim();
    long start = System.currentTimeMillis();
    Category category = Category.GENERIC_QUERY;
    try {
      ResolvedEntities entities = context.extractor().extract(trimmed, today);
      Classification classification = context.classifier().classify(trimmed, entities);
      category = classification.category();
      log.info("Question routed to {} (rule '{}')", category, classification.rule());

      Optional<CategoryHandler> handler = context.handler(category);
      if (handler.isPresent()) {
        String text = handler.get().handle(new HandlerRequest(trimmed, entities, today));
        return Answer.text(category, text);
      }
      if (category != Category.GENERIC_QUERY) {
        log.warn("No handler registered for {}, answering as a generic question", category);
      }
      return answerGeneric(trimmed, entities, classification);
    } catch (RuntimeException e) {
      log.error("Unexpected failure answering question: {}", ExceptionUtil.toErrorDetails(e), e);
      return Answer.text(category, NoDataMessages.UNAVAILABLE);
    } finally {
      log.debug("Answered in {} ms", System.currentTimeMillis() - start);
    }
  }

  private Answer answerGeneric(
      String question, ResolvedEntities entities, Classification classification) {
    Category category = Category.GENERIC_QUERY;
    if (context.sqlGenerator().isEmpty()) {
      log.warn("No model configured, statistics questions cannot be answered");
      return Answer.text(category, NoDataMessages.UNAVAILABLE);
    }

    String pseudoSql;
    try {
      pseudoSql = context.sqlGenerator().get().generate(question, classification);
    } catch (LlmException e) {
      log.warn("Pseudo-SQL generation failed: {}", ExceptionUtil.toErrorDetails(e));
      return Answer.text(category, NoDataMessages.UNAVAILABLE);
    }

    CompiledPlan plan;
    try {
      plan = context.compiler().compile(pseudoSql, question);
    } catch (CompileException | UnsupportedTableException e) {
      log.info("Pseudo-SQL rejected: {}", ExceptionUtil.toErrorDetails(e));
      return new Answer(category, NoDataMessages.APOLOGY, pseudoSql, null);
    }

    QueryOutcome outcome = context.executor().execute(plan);
    if (outcome.isUnavailable()) {
      return new Answer(category, NoDataMessages.UNAVAILABLE, pseudoSql, null);
    }
    if (outcome.isEmpty()) {
      return new Answer(category, NoDataMessages.forQuestion(question, entities), pseudoSql, null);
    }
    String text = context.renderer().render(question, outcome.rowsOrEmpty());
    return new Answer(category, text, pseudoSql, outcome.rowsOrEmpty());
  }
}
