package com.gentoro.kbo.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.exception.StoreException;
import com.gentoro.kbo.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link RemoteStore} over a PostgREST endpoint (the REST face of a Supabase project).
 *
 * <p>A {@link StoreQuery} maps one-to-one onto a GET request:
 *
 * <pre>
 * GET {base}/rest/v1/player_season_stats?select=*&amp;team=eq.한화&amp;ab=gte.400
 *     &amp;hra=not.is.null&amp;order=hra.desc&amp;limit=1
 * </pre>
 */
public class PostgrestStoreClient implements RemoteStore {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(PostgrestStoreClient.class);

  private static final int MAX_ERROR_BODY = 300;

  private final OkHttpClient httpClient;
  private final HttpUrl baseUrl;
  private final String apiKey;
  private final String schema;

  public PostgrestStoreClient(OkHttpClient httpClient, String baseUrl, String apiKey, String schema) {
    this.httpClient = httpClient;
    HttpUrl parsed = HttpUrl.parse(StringUtils.removeEnd(baseUrl, "/"));
    if (parsed == null) {
      throw new ConfigException("Invalid store base URL: " + baseUrl);
    }
    this.baseUrl = parsed;
    this.apiKey = apiKey;
    this.schema = schema;
  }

  public static PostgrestStoreClient from(Configuration configuration, OkHttpClient httpClient) {
    return new PostgrestStoreClient(
        httpClient,
        configuration.getString("store.base-url", "http://localhost:54321"),
        configuration.getString("store.api-key", ""),
        configuration.getString("store.schema", "public"));
  }

  HttpUrl buildUrl(StoreQuery query) {
    HttpUrl.Builder url =
        baseUrl.newBuilder().addPathSegments("rest/v1").addPathSegment(query.table());
    url.addQueryParameter("select", "*");
    for (Map.Entry<String, String> e : query.equalities().entrySet()) {
      url.addQueryParameter(e.getKey(), "eq." + e.getValue());
    }
    for (RangeFilter r : query.ranges()) {
      url.addQueryParameter(r.column(), r.comparison().restOperator() + "." + r.value());
    }
    for (String column : query.notNull()) {
      url.addQueryParameter(column, "not.is.null");
    }
    query
        .optionalOrder()
        .ifPresent(
            o -> url.addQueryParameter("order", o.column() + (o.descending() ? ".desc.nullslast" : ".asc.nullslast")));
    query.optionalLimit().ifPresent(l -> url.addQueryParameter("limit", String.valueOf(l)));
    return url.build();
  }

  @Override
  public List<JsonNode> select(StoreQuery query) {
    HttpUrl url = buildUrl(query);
    Request.Builder request = new Request.Builder().url(url).get().header("Accept", "application/json");
    if (StringUtils.isNotBlank(apiKey)) {
      request.header("apikey", apiKey).header("Authorization", "Bearer " + apiKey);
    }
    if (StringUtils.isNotBlank(schema) && !"public".equals(schema)) {
      request.header("Accept-Profile", schema);
    }

    try (Response response = httpClient.newCall(request.build()).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new StoreException(
                "HTTP " + response.code() + " from store: " + StringUtils.abbreviate(text, MAX_ERROR_BODY))
            .withContext("table", query.table());
      }
      JsonNode root = JacksonUtility.getJsonMapper().readTree(text);
      if (root == null || !root.isArray()) {
        throw new StoreException("Store returned a non-array body for table " + query.table());
      }
      List<JsonNode> rows = new ArrayList<>(root.size());
      root.forEach(rows::add);
      log.debug("Store returned {} rows from {}", rows.size(), query.table());
      return rows;
    } catch (IOException e) {
      throw new StoreException("Store request failed for table " + query.table(), e);
    }
  }
}
