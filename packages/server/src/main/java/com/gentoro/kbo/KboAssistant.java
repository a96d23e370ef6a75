package com.gentoro.kbo;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.classifier.ClassifierKeywords;
import com.gentoro.kbo.classifier.RequestClassifier;
import com.gentoro.kbo.compiler.CompilerSettings;
import com.gentoro.kbo.compiler.QueryCompiler;
import com.gentoro.kbo.compiler.StoreTeamGamesProvider;
import com.gentoro.kbo.entity.EntityExtractor;
import com.gentoro.kbo.entity.PlayerNameIndex;
import com.gentoro.kbo.entity.TeamDirectory;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.game.GameDataClient;
import com.gentoro.kbo.game.GameRecordAnalyzer;
import com.gentoro.kbo.game.NaverGameClient;
import com.gentoro.kbo.game.ScheduleRepository;
import com.gentoro.kbo.game.StandingsRepository;
import com.gentoro.kbo.handler.CategoryHandler;
import com.gentoro.kbo.handler.DailyResultsAnalysisHandler;
import com.gentoro.kbo.handler.DailyScheduleHandler;
import com.gentoro.kbo.handler.FutureGameDetailHandler;
import com.gentoro.kbo.handler.GameAnalysisHandler;
import com.gentoro.kbo.handler.GamePredictionHandler;
import com.gentoro.kbo.handler.GameSummarizer;
import com.gentoro.kbo.handler.GameSummaryFormatter;
import com.gentoro.kbo.http.OkHttpFactory;
import com.gentoro.kbo.model.LlmClient;
import com.gentoro.kbo.model.LlmClientFactory;
import com.gentoro.kbo.orchestrator.AnswerRenderer;
import com.gentoro.kbo.orchestrator.AnswerService;
import com.gentoro.kbo.orchestrator.AssistantContext;
import com.gentoro.kbo.orchestrator.SqlGenerator;
import com.gentoro.kbo.prompt.PromptRepository;
import com.gentoro.kbo.schema.IntentIndex;
import com.gentoro.kbo.schema.SchemaCatalog;
import com.gentoro.kbo.store.ExecutionAdapter;
import com.gentoro.kbo.store.PostgrestStoreClient;
import com.gentoro.kbo.store.RemoteStore;
import com.gentoro.kbo.store.RowValues;
import com.gentoro.kbo.store.StoreQuery;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires the assistant from configuration: the store and game API clients, the read-only corpora,
 * the compiler, the handlers and the optional model. Everything is built once here and shared by
 * all questions.
 */
public class KboAssistant {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(KboAssistant.class);

  static final String PLAYER_TABLE = "player_season_stats";

  private final OkHttpClient httpClient;
  private final AssistantContext context;
  private final AnswerService answerService;

  KboAssistant(OkHttpClient httpClient, AssistantContext context) {
    this.httpClient = httpClient;
    this.context = context;
    this.answerService = new AnswerService(context);
  }

  public static KboAssistant create(Configuration configuration) {
    OkHttpClient httpClient = OkHttpFactory.create(configuration);
    RemoteStore store = PostgrestStoreClient.from(configuration, httpClient);
    GameDataClient gameData = NaverGameClient.from(configuration, httpClient);
    Optional<LlmClient> llmClient = LlmClientFactory.create(configuration);
    return new KboAssistant(httpClient, buildContext(configuration, store, gameData, llmClient));
  }

  /** Builds the shared context over the given collaborators. */
  public static AssistantContext buildContext(
      Configuration configuration,
      RemoteStore store,
      GameDataClient gameData,
      Optional<LlmClient> llmClient) {
    TeamDirectory teams = TeamDirectory.loadDefault();
    SchemaCatalog catalog = SchemaCatalog.loadDefault();
    IntentIndex intentIndex =
        new IntentIndex(catalog, configuration.getDouble("index.similarity-threshold", 0.15));
    CompilerSettings settings = CompilerSettings.from(configuration);
    PromptRepository prompts = PromptRepository.loadDefault();

    PlayerNameIndex players = loadPlayerNames(store, settings.season());
    EntityExtractor extractor = new EntityExtractor(teams, players);
    RequestClassifier classifier =
        new RequestClassifier(ClassifierKeywords.loadDefault(), intentIndex);
    QueryCompiler compiler =
        new QueryCompiler(catalog, teams, new StoreTeamGamesProvider(store, teams), settings);

    ScheduleRepository schedule = new ScheduleRepository(store);
    GameSummarizer summarizer =
        new GameSummarizer(gameData, new GameRecordAnalyzer(), new GameSummaryFormatter());
    List<CategoryHandler> handlers =
        List.of(
            new DailyScheduleHandler(schedule),
            new DailyResultsAnalysisHandler(schedule, summarizer),
            new GameAnalysisHandler(schedule, summarizer),
            new GamePredictionHandler(schedule, new StandingsRepository(store), gameData),
            new FutureGameDetailHandler(schedule, gameData));

    Optional<SqlGenerator> sqlGenerator =
        llmClient.map(llm -> new SqlGenerator(llm, prompts, intentIndex, settings.season()));
    ZoneId zone = ZoneId.of(configuration.getString("season.timezone", AssistantContext.KST.getId()));

    log.info(
        "Assistant ready: {} teams, {} tables, {} known players, model {}",
        teams.teams().size(),
        catalog.tables().size(),
        players.size(),
        llmClient.isPresent() ? "enabled" : "disabled");
    return new AssistantContext(
        extractor,
        classifier,
        compiler,
        new ExecutionAdapter(store),
        AssistantContext.byCategory(handlers),
        sqlGenerator,
        new AnswerRenderer(llmClient, prompts),
        zone);
  }

  /** Player names of the season; an unreachable store leaves the index empty. */
  static PlayerNameIndex loadPlayerNames(RemoteStore store, String season) {
    try {
      Set<String> names = new LinkedHashSet<>();
      for (JsonNode row : store.select(StoreQuery.on(PLAYER_TABLE).eq("gyear", season).build())) {
        String name = RowValues.text(row, "player_name");
        if (name != null && !name.isBlank()) {
          names.add(name.trim());
        }
      }
      return new PlayerNameIndex(names);
    } catch (StoreException e) {
      log.warn("Player names unavailable, continuing without them: {}", e.getMessage());
      return PlayerNameIndex.empty();
    }
  }

  public AnswerService answerService() {
    return answerService;
  }

  public AssistantContext context() {
    return context;
  }

  /** Releases HTTP resources. Safe to call more than once. */
  public void shutdown() {
    if (httpClient != null) {
      httpClient.dispatcher().executorService().shutdown();
      httpClient.connectionPool().evictAll();
    }
  }
}
