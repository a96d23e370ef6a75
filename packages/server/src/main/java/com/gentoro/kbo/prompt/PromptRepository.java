package com.gentoro.kbo.prompt;

import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prompt templates read from classpath YAML files under {@code prompts/}. Templates are looked up
 * by name, with or without a leading slash: {@code get("/sql_generation")} reads {@code
 * prompts/sql_generation.yaml}.
 *
 * <p>All templates are loaded eagerly so a broken resource fails start-up rather than the first
 * question that needs it.
 */
public final class PromptRepository {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(PromptRepository.class);

  public static final String BASE_PATH = "prompts/";
  public static final String SQL_GENERATION = "sql_generation";
  public static final String ANSWER_RENDERING = "answer_rendering";

  private final Map<String, PromptTemplate> templates;

  public PromptRepository(Map<String, PromptTemplate> templates) {
    this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
  }

  public static PromptRepository load(List<String> names) {
    Map<String, PromptTemplate> templates = new LinkedHashMap<>();
    for (String name : names) {
      String key = normalize(name);
      templates.put(key, read(key));
    }
    log.debug("Loaded {} prompt templates", templates.size());
    return new PromptRepository(templates);
  }

  public static PromptRepository loadDefault() {
    return load(List.of(SQL_GENERATION, ANSWER_RENDERING));
  }

  private static PromptTemplate read(String name) {
    String resource = BASE_PATH + name + ".yaml";
    try (InputStream in = PromptRepository.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Prompt template not found on classpath: " + resource);
      }
      return JacksonUtility.getYamlMapper().readValue(in, PromptTemplate.class).withName(name);
    } catch (IOException e) {
      throw new ConfigException("Could not read prompt template " + resource, e);
    }
  }

  private static String normalize(String name) {
    String key = name == null ? "" : name.trim();
    while (key.startsWith("/")) {
      key = key.substring(1);
    }
    if (key.isEmpty()) {
      throw new ConfigException("Prompt name must not be empty");
    }
    return key;
  }

  /**
   * @throws ConfigException when no template with that name was loaded
   */
  public PromptTemplate get(String name) {
    PromptTemplate template = templates.get(normalize(name));
    if (template == null) {
      throw new ConfigException("Unknown prompt template: " + name);
    }
    return template;
  }

  public Set<String> names() {
    return templates.keySet();
  }
}
