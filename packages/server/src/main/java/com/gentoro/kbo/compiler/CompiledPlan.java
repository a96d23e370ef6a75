package com.gentoro.kbo.compiler;

import com.gentoro.kbo.store.OrderSpec;
import com.gentoro.kbo.store.StoreQuery;
import java.util.List;
import java.util.Optional;

/**
 * Executable form of a {@link ParsedQuery}.
 *
 * <p>{@code operations} form a disjunction: their results are merged and de-duplicated. With
 * {@link Locality#CLIENT} the operations carry no order or limit and the executor applies {@code
 * postFilters}, then {@code order}, then {@code limit}.
 */
public record CompiledPlan(
    String table,
    PlayerRole role,
    List<StoreQuery> operations,
    List<PostFilter> postFilters,
    OrderSpec order,
    Integer limit,
    Locality locality,
    List<String> playerNames,
    ParsedQuery source) {

  public CompiledPlan {
    operations = List.copyOf(operations);
    postFilters = List.copyOf(postFilters);
    playerNames = List.copyOf(playerNames);
  }

  public Optional<OrderSpec> optionalOrder() {
    return Optional.ofNullable(order);
  }

  public Optional<Integer> optionalLimit() {
    return Optional.ofNullable(limit);
  }

  public boolean isClientSide() {
    return locality == Locality.CLIENT;
  }
}
