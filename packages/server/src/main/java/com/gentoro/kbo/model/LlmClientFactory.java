package com.gentoro.kbo.model;

import com.gentoro.kbo.exception.ConfigException;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import java.util.Locale;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds the configured {@link LlmClient}.
 *
 * <p>{@code llm.provider} is {@code openai} or {@code none}. With {@code none} no client is
 * created; stat questions then need a pseudo-SQL source other than the model and answers are
 * rendered without it.
 */
public final class LlmClientFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(LlmClientFactory.class);

  private LlmClientFactory() {}

  public static Optional<LlmClient> create(Configuration configuration) {
    String provider = configuration.getString("llm.provider", "openai").toLowerCase(Locale.ROOT);
    switch (provider) {
      case "none":
        log.info("LLM provider disabled");
        return Optional.empty();
      case "openai":
        String apiKey = configuration.getString("llm.api-key", "");
        // an unset ${env:...} reference is left in place by the interpolator
        if (StringUtils.isBlank(apiKey) || apiKey.startsWith("${")) {
          throw new ConfigException("llm.api-key is required for provider 'openai'");
        }
        log.info("Using OpenAI model {}", configuration.getString("llm.model", OpenAiLlmClient.DEFAULT_MODEL));
        return Optional.of(
            new OpenAiLlmClient(OpenAIOkHttpClient.builder().apiKey(apiKey).build(), configuration));
      default:
        throw new ConfigException("Unknown llm.provider: " + provider);
    }
  }
}
