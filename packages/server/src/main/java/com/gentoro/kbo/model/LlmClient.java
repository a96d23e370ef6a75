package com.gentoro.kbo.model;

import java.util.List;

/**
 * Text-in, text-out access to a language model. The assistant uses it for two things only:
 * writing pseudo-SQL for a stat question and phrasing the rows that query returned.
 *
 * <p>Implementations must be safe to call from several threads at once.
 */
public interface LlmClient {

  /**
   * One completion over a conversation.
   *
   * @throws com.gentoro.kbo.exception.LlmException when the provider fails or returns no content
   */
  String chat(List<Message> messages);

  /** One completion for a single user prompt. */
  default String generate(String prompt) {
    return chat(List.of(new Message(Role.USER, prompt)));
  }

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {
    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }

    static List<Message> allExcept(List<Message> messages, Role role) {
      return messages.stream().filter(m -> !m.role().equals(role)).toList();
    }

    static boolean contains(List<Message> messages, Role role) {
      return messages.stream().anyMatch(m -> m.role().equals(role));
    }

    static Message findFirst(List<Message> messages, Role role) {
      return messages.stream().filter(m -> m.role().equals(role)).findFirst().orElseThrow();
    }
  }
}
