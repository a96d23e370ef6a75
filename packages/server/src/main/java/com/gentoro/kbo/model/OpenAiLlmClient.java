package com.gentoro.kbo.model;

import com.gentoro.kbo.exception.LlmException;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/** OpenAI implementation of {@link LlmClient} using the openai-java SDK (Chat Completions API). */
public class OpenAiLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(OpenAiLlmClient.class);

  static final String DEFAULT_MODEL = "gpt-4o-mini";
  static final double DEFAULT_TEMPERATURE = 0.1;

  private final OpenAIClient openAIClient;

  public OpenAiLlmClient(OpenAIClient openAIClient, Configuration configuration) {
    super(configuration);
    this.openAIClient = openAIClient;
  }

  ChatCompletionCreateParams params(List<Message> messages) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder()
            .model(configuration.getString("llm.model", DEFAULT_MODEL))
            .temperature(configuration.getDouble("llm.temperature", DEFAULT_TEMPERATURE));

    if (Message.contains(messages, Role.SYSTEM)) {
      builder.addSystemMessage(Message.findFirst(messages, Role.SYSTEM).content());
    }
    Message.allExcept(messages, Role.SYSTEM)
        .forEach(
            message -> {
              if (message.role() == Role.ASSISTANT) {
                builder.addAssistantMessage(message.content());
              } else {
                builder.addUserMessage(message.content());
              }
            });
    return builder.build();
  }

  @Override
  protected String runInference(List<Message> messages) {
    ChatCompletion completion = openAIClient.chat().completions().create(params(messages));
    completion
        .usage()
        .ifPresent(
            u -> log.debug("OpenAI usage: prompt={} completion={}", u.promptTokens(), u.completionTokens()));
    return completion.choices().stream()
        .filter(c -> c.message().content().isPresent())
        .map(c -> c.message().content().get().trim())
        .findFirst()
        .orElseThrow(() -> new LlmException("No content returned from OpenAI inference."));
  }
}
