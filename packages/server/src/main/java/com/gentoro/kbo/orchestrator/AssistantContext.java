package com.gentoro.kbo.orchestrator;

import com.gentoro.kbo.classifier.Category;
import com.gentoro.kbo.classifier.RequestClassifier;
import com.gentoro.kbo.compiler.QueryCompiler;
import com.gentoro.kbo.entity.EntityExtractor;
import com.gentoro.kbo.handler.CategoryHandler;
import com.gentoro.kbo.store.ExecutionAdapter;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a question needs, built once at start-up and shared by all callers. Every component
 * held here is immutable or stateless, so one context can serve concurrent questions.
 *
 * @param sqlGenerator absent when no model is configured; statistics questions then cannot be
 *     answered
 * @param zone zone in which "today" is evaluated when the caller does not pass a date
 */
public record AssistantContext(
    EntityExtractor extractor,
    RequestClassifier classifier,
    QueryCompiler compiler,
    ExecutionAdapter executor,
    Map<Category, CategoryHandler> handlers,
    Optional<SqlGenerator> sqlGenerator,
    AnswerRenderer renderer,
    ZoneId zone) {

  public static final ZoneId KST = ZoneId.of("Asia/Seoul");

  public AssistantContext {
    Map<Category, CategoryHandler> byCategory = new EnumMap<>(Category.class);
    byCategory.putAll(handlers);
    handlers = Collections.unmodifiableMap(byCategory);
    sqlGenerator = sqlGenerator == null ? Optional.empty() : sqlGenerator;
    zone = zone == null ? KST : zone;
  }

  /** Indexes handlers by the category each one declares. */
  public static Map<Category, CategoryHandler> byCategory(Collection<CategoryHandler> handlers) {
    Map<Category, CategoryHandler> map = new EnumMap<>(Category.class);
    for (CategoryHandler handler : handlers) {
      if (handler.category() == Category.GENERIC_QUERY) {
        throw new IllegalArgumentException("Generic questions are not answered by a handler");
      }
      map.put(handler.category(), handler);
    }
    return map;
  }

  public Optional<CategoryHandler> handler(Category category) {
    return Optional.ofNullable(handlers.get(category));
  }
}
