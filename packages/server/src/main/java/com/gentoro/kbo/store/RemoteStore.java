package com.gentoro.kbo.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.exception.StoreException;
import java.util.List;

/**
 * The table store as seen by the assistant: filtered reads with optional order and limit, nothing
 * richer. Implementations are synchronous and side-effect free.
 */
public interface RemoteStore {

  /**
   * Run one read.
   *
   * @return matching rows as JSON objects, never null
   * @throws StoreException when the store cannot be reached or answers with an error
   */
  List<JsonNode> select(StoreQuery query);
}
