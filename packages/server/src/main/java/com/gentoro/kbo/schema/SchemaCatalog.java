package com.gentoro.kbo.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only description of the remote store: tables, intent exemplars and the role vocabularies.
 * Built once at start-up from {@code catalog/schema.yaml}.
 */
public final class SchemaCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(SchemaCatalog.class);

  public static final String DEFAULT_RESOURCE = "catalog/schema.yaml";

  private final Map<String, TableDescriptor> tables;
  private final List<IntentExemplar> exemplars;
  private final Set<String> pitcherTerms;
  private final Set<String> batterTerms;

  public SchemaCatalog(
      Collection<TableDescriptor> tables,
      List<IntentExemplar> exemplars,
      Collection<String> pitcherTerms,
      Collection<String> batterTerms) {
    Map<String, TableDescriptor> byName = new LinkedHashMap<>();
    tables.forEach(t -> byName.put(t.name().toLowerCase(Locale.ROOT), t));
    this.tables = Collections.unmodifiableMap(byName);
    this.exemplars = List.copyOf(exemplars);
    this.pitcherTerms = lowerSet(pitcherTerms);
    this.batterTerms = lowerSet(batterTerms);
    Set<String> overlap = new LinkedHashSet<>(this.pitcherTerms);
    overlap.retainAll(this.batterTerms);
    if (!overlap.isEmpty()) {
      throw new ConfigException("Pitcher and batter vocabularies must be disjoint, shared: " + overlap);
    }
  }

  private static Set<String> lowerSet(Collection<String> values) {
    Set<String> out = new LinkedHashSet<>();
    if (values != null) {
      values.forEach(v -> out.add(v.toLowerCase(Locale.ROOT)));
    }
    return Collections.unmodifiableSet(out);
  }

  public static SchemaCatalog load(String resource) {
    try (InputStream in = SchemaCatalog.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Schema catalog not found on classpath: " + resource);
      }
      Document doc = JacksonUtility.getYamlMapper().readValue(in, Document.class);
      log.debug(
          "Loaded schema catalog {}: {} tables, {} exemplars",
          resource,
          doc.tables.size(),
          doc.exemplars.size());
      return new SchemaCatalog(
          doc.tables,
          doc.exemplars,
          doc.roles.getOrDefault("pitcher", List.of()),
          doc.roles.getOrDefault("batter", List.of()));
    } catch (IOException e) {
      throw new ConfigException("Could not read schema catalog " + resource, e);
    }
  }

  public static SchemaCatalog loadDefault() {
    return load(DEFAULT_RESOURCE);
  }

  public boolean hasTable(String table) {
    return table != null && tables.containsKey(table.toLowerCase(Locale.ROOT));
  }

  public Optional<TableDescriptor> table(String table) {
    if (table == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(tables.get(table.toLowerCase(Locale.ROOT)));
  }

  public Collection<TableDescriptor> tables() {
    return tables.values();
  }

  public List<IntentExemplar> exemplars() {
    return exemplars;
  }

  public Set<String> pitcherTerms() {
    return pitcherTerms;
  }

  public Set<String> batterTerms() {
    return batterTerms;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class Document {
    @JsonProperty("tables")
    List<TableDescriptor> tables = new ArrayList<>();

    @JsonProperty("exemplars")
    List<IntentExemplar> exemplars = new ArrayList<>();

    @JsonProperty("roles")
    Map<String, List<String>> roles = new LinkedHashMap<>();
  }
}
