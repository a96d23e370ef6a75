package com.gentoro.kbo.model;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.kbo.exception.ConfigException;
import java.util.Optional;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LlmClientFactoryTest {

  private static BaseConfiguration config(String provider, String apiKey) {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("llm.provider", provider);
    if (apiKey != null) {
      configuration.setProperty("llm.api-key", apiKey);
    }
    return configuration;
  }

  @Test
  @DisplayName("provider none creates no client")
  void disabled() {
    assertTrue(LlmClientFactory.create(config("none", null)).isEmpty());
    assertTrue(LlmClientFactory.create(config("NONE", "sk-ignored")).isEmpty());
  }

  @Test
  @DisplayName("openai with a key creates the OpenAI client")
  void openAi() {
    Optional<LlmClient> client = LlmClientFactory.create(config("openai", "sk-test"));

    assertInstanceOf(OpenAiLlmClient.class, client.orElseThrow());
  }

  @Test
  @DisplayName("a missing or unresolved key and an unknown provider are configuration errors")
  void invalid() {
    assertThrows(ConfigException.class, () -> LlmClientFactory.create(config("openai", null)));
    assertThrows(ConfigException.class, () -> LlmClientFactory.create(config("openai", " ")));
    assertThrows(
        ConfigException.class, () -> LlmClientFactory.create(config("openai", "${env:OPENAI_API_KEY}")));
    assertThrows(ConfigException.class, () -> LlmClientFactory.create(config("claude", "key")));
  }
}
