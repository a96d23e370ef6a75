package com.gentoro.kbo.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/** Keyword vocabularies consulted by {@link RequestClassifier}. All entries are lower-case. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassifierKeywords(
    @JsonProperty("future-detail") List<String> futureDetail,
    @JsonProperty("prediction") List<String> prediction,
    @JsonProperty("result") List<String> result,
    @JsonProperty("schedule") List<String> schedule,
    @JsonProperty("schedule-exclusions") List<String> scheduleExclusions,
    @JsonProperty("date") List<String> date,
    @JsonProperty("game") List<String> game) {

  public static final String DEFAULT_RESOURCE = "catalog/keywords.yaml";

  public ClassifierKeywords {
    futureDetail = lower(futureDetail);
    prediction = lower(prediction);
    result = lower(result);
    schedule = lower(schedule);
    scheduleExclusions = lower(scheduleExclusions);
    date = lower(date);
    game = lower(game);
  }

  private static List<String> lower(Collection<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
  }

  public static ClassifierKeywords load(String resource) {
    try (InputStream in =
        ClassifierKeywords.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Classifier keywords not found on classpath: " + resource);
      }
      return JacksonUtility.getYamlMapper().readValue(in, ClassifierKeywords.class);
    } catch (IOException e) {
      throw new ConfigException("Could not read classifier keywords " + resource, e);
    }
  }

  public static ClassifierKeywords loadDefault() {
    return load(DEFAULT_RESOURCE);
  }

  static boolean containsAny(String lowerText, List<String> keywords) {
    for (String k : keywords) {
      if (lowerText.contains(k)) {
        return true;
      }
    }
    return false;
  }
}
