package com.gentoro.kbo.entity;

import java.time.LocalDate;

/**
 * Pulls dates, teams and player candidates out of a question. Stateless apart from the immutable
 * directories it is built with, so one instance is shared by all requests.
 */
public class EntityExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(EntityExtractor.class);

  private final TeamDirectory teams;
  private final PlayerNameIndex players;
  private final DateResolver dateResolver;

  public EntityExtractor(TeamDirectory teams, PlayerNameIndex players) {
    this(teams, players, new DateResolver());
  }

  public EntityExtractor(TeamDirectory teams, PlayerNameIndex players, DateResolver dateResolver) {
    this.teams = teams;
    this.players = players == null ? PlayerNameIndex.empty() : players;
    this.dateResolver = dateResolver;
  }

  public ResolvedEntities extract(String question, LocalDate today) {
    DateResolution dates = dateResolver.resolve(question, today);
    ResolvedEntities entities =
        new ResolvedEntities(dates, teams.findAll(question), players.find(question, teams));
    log.debug(
        "Extracted entities: date={}, range={}, teams={}, players={}",
        dates.date(),
        dates.range(),
        entities.teams().stream().map(Team::code).toList(),
        entities.players());
    return entities;
  }

  public TeamDirectory teams() {
    return teams;
  }

  public PlayerNameIndex players() {
    return players;
  }

  public DateResolver dateResolver() {
    return dateResolver;
  }
}
