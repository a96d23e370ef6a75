package com.gentoro.kbo.game;

import com.gentoro.kbo.store.OrderSpec;
import com.gentoro.kbo.store.RemoteStore;
import com.gentoro.kbo.store.StoreQuery;
import java.util.Optional;

/** Latest standings line per team from {@code game_result}. */
public class StandingsRepository {
  static final String TABLE = "game_result";

  private final RemoteStore store;

  public StandingsRepository(RemoteStore store) {
    this.store = store;
  }

  /** @throws com.gentoro.kbo.exception.StoreException when the store cannot be reached */
  public Optional<TeamStanding> forTeam(String teamName) {
    return store
        .select(
            StoreQuery.on(TABLE)
                .eq("team_name", teamName)
                .order(OrderSpec.desc("year"))
                .limit(1)
                .build())
        .stream()
        .findFirst()
        .map(TeamStanding::fromRow);
  }
}
