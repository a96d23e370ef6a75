package com.gentoro.kbo.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** A table the remote store exposes. Loaded once and never mutated. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("columns") List<ColumnDescriptor> columns) {

  public TableDescriptor {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  public boolean hasColumn(String column) {
    return column(column).isPresent();
  }

  public Optional<ColumnDescriptor> column(String column) {
    if (column == null) {
      return Optional.empty();
    }
    String key = column.toLowerCase(Locale.ROOT);
    return columns.stream().filter(c -> c.name().equals(key)).findFirst();
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnDescriptor::name).toList();
  }
}
