package com.gentoro.kbo.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.model.LlmClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A prompt made of an optional system section and a user section. Both may reference values with
 * {@code {{name}}} placeholders.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PromptTemplate(
    @JsonProperty("name") String name,
    @JsonProperty("system") String system,
    @JsonProperty("user") String user) {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_]+)\\s*}}");

  public PromptTemplate {
    if (user == null || user.isBlank()) {
      throw new ConfigException("Prompt '" + name + "' has no user section");
    }
  }

  PromptTemplate withName(String name) {
    return new PromptTemplate(name, system, user);
  }

  /**
   * Renders the template into chat messages.
   *
   * @throws ConfigException when a placeholder has no value
   */
  public List<LlmClient.Message> render(Map<String, ?> values) {
    List<LlmClient.Message> messages = new ArrayList<>(2);
    if (system != null && !system.isBlank()) {
      messages.add(LlmClient.Message.system(substitute(system, values)));
    }
    messages.add(LlmClient.Message.user(substitute(user, values)));
    return List.copyOf(messages);
  }

  private String substitute(String text, Map<String, ?> values) {
    Matcher m = PLACEHOLDER.matcher(text);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String key = m.group(1);
      Object value = values.get(key);
      if (value == null) {
        throw new ConfigException("Prompt '" + name + "' is missing a value for '" + key + "'")
            .withContext("prompt", name);
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(value)));
    }
    m.appendTail(sb);
    return sb.toString().trim();
  }
}
