package com.gentoro.kbo.game;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.exception.GameApiException;
import com.gentoro.kbo.utility.JacksonUtility;
import java.io.IOException;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link GameDataClient} over the public sports schedule API.
 *
 * <p>Responses are wrapped in an envelope {@code {"code":200,"success":true,"result":{...}}}; only
 * a {@code 200} envelope with a non-null payload counts as data.
 */
public class NaverGameClient implements GameDataClient {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(NaverGameClient.class);

  public static final String DEFAULT_BASE_URL = "https://api-gw.sports.naver.com/schedule/games";

  private final OkHttpClient httpClient;
  private final HttpUrl baseUrl;

  public NaverGameClient(OkHttpClient httpClient, String baseUrl) {
    this.httpClient = httpClient;
    HttpUrl parsed = HttpUrl.parse(StringUtils.removeEnd(baseUrl, "/"));
    if (parsed == null) {
      throw new ConfigException("Invalid game API base URL: " + baseUrl);
    }
    this.baseUrl = parsed;
  }

  public static NaverGameClient from(Configuration configuration, OkHttpClient httpClient) {
    return new NaverGameClient(
        httpClient, configuration.getString("game-api.base-url", DEFAULT_BASE_URL));
  }

  @Override
  public Optional<JsonNode> getRecord(String gameId) {
    JsonNode envelope = fetch(gameId, "record");
    if (envelope.path("code").asInt() != 200) {
      log.debug("No record for game {} (code {})", gameId, envelope.path("code").asText());
      return Optional.empty();
    }
    return payload(envelope, "recordData");
  }

  @Override
  public Optional<JsonNode> getPreview(String gameId) {
    JsonNode envelope = fetch(gameId, "preview");
    if (envelope.path("code").asInt() != 200 || !envelope.path("success").asBoolean(false)) {
      log.debug("No preview for game {} (code {})", gameId, envelope.path("code").asText());
      return Optional.empty();
    }
    return payload(envelope, "previewData");
  }

  private static Optional<JsonNode> payload(JsonNode envelope, String field) {
    JsonNode data = envelope.path("result").path(field);
    return data.isObject() ? Optional.of(data) : Optional.empty();
  }

  private JsonNode fetch(String gameId, String resource) {
    if (StringUtils.isBlank(gameId)) {
      throw new GameApiException("Game id is required");
    }
    HttpUrl url = baseUrl.newBuilder().addPathSegment(gameId).addPathSegment(resource).build();
    Request request = new Request.Builder().url(url).get().header("Accept", "application/json").build();
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new GameApiException(
                "HTTP " + response.code() + " from game API: " + StringUtils.abbreviate(text, 300))
            .withContext("gameId", gameId);
      }
      JsonNode root = JacksonUtility.getJsonMapper().readTree(text);
      if (root == null || !root.isObject()) {
        throw new GameApiException("Game API returned a non-object body for " + gameId);
      }
      return root;
    } catch (IOException e) {
      throw new GameApiException("Game API request failed for " + gameId + "/" + resource, e);
    }
  }
}
