package com.gentoro.kbo.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.compiler.CompiledPlan;
import com.gentoro.kbo.compiler.PostFilter;
import com.gentoro.kbo.exception.ExceptionUtil;
import com.gentoro.kbo.exception.StoreException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a {@link CompiledPlan} against the {@link RemoteStore}.
 *
 * <p>Server-side plans are a single call. Client-side plans fetch every operation, merge and
 * de-duplicate the rows in arrival order, apply the post-filters, then sort (stable) and slice. A
 * transport failure on any operation turns the whole execution into {@link
 * QueryOutcome.DataUnavailable}; nothing is retried here.
 */
public class ExecutionAdapter {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(ExecutionAdapter.class);

  private final RemoteStore store;

  public ExecutionAdapter(RemoteStore store) {
    this.store = store;
  }

  public QueryOutcome execute(CompiledPlan plan) {
    long start = System.currentTimeMillis();
    try {
      Set<JsonNode> merged = new LinkedHashSet<>();
      for (StoreQuery operation : plan.operations()) {
        merged.addAll(store.select(operation));
      }
      List<JsonNode> rows = plan.isClientSide() ? finishLocally(plan, merged) : new ArrayList<>(merged);
      log.debug(
          "Executed plan on {} ({} operation(s), {}) -> {} row(s) in {}ms",
          plan.table(),
          plan.operations().size(),
          plan.locality(),
          rows.size(),
          System.currentTimeMillis() - start);
      return QueryOutcome.rows(rows);
    } catch (StoreException e) {
      log.warn(
          "Store unavailable while executing plan on {}: {}",
          plan.table(),
          ExceptionUtil.extractErrorMessage(e));
      return QueryOutcome.unavailable(ExceptionUtil.extractErrorMessage(e));
    }
  }

  private static List<JsonNode> finishLocally(CompiledPlan plan, Set<JsonNode> merged) {
    List<JsonNode> rows = new ArrayList<>();
    for (JsonNode row : merged) {
      if (passes(plan.postFilters(), row)) {
        rows.add(row);
      }
    }
    plan.optionalOrder().ifPresent(order -> rows.sort(RowValues.comparator(order)));
    if (plan.limit() != null && rows.size() > plan.limit()) {
      return new ArrayList<>(rows.subList(0, plan.limit()));
    }
    return rows;
  }

  private static boolean passes(List<PostFilter> filters, JsonNode row) {
    for (PostFilter filter : filters) {
      if (!filter.test(row)) {
        return false;
      }
    }
    return true;
  }
}
