package com.gentoro.kbo.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One column of a remote table. {@code type} is a semantic type; {@code team_name} and {@code
 * team_code} tell the compiler how team literals must be normalized for the column.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("description") String description,
    @JsonProperty("synonyms") List<String> synonyms) {

  public static final String TEAM_NAME = "team_name";
  public static final String TEAM_CODE = "team_code";

  public ColumnDescriptor {
    synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
  }

  public boolean isTeamName() {
    return TEAM_NAME.equals(type);
  }

  public boolean isTeamCode() {
    return TEAM_CODE.equals(type);
  }

  public boolean isNumeric() {
    return "integer".equals(type) || "decimal".equals(type);
  }
}
