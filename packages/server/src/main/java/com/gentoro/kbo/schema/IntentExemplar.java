package com.gentoro.kbo.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A labelled example of one kind of question. {@code table} is null for intents the store cannot
 * answer (for example championship history).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntentExemplar(
    @JsonProperty("category") String category,
    @JsonProperty("table") String table,
    @JsonProperty("description") String description,
    @JsonProperty("keywords") List<String> keywords) {

  public IntentExemplar {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  public boolean hasTable() {
    return table != null && !table.isBlank();
  }
}
