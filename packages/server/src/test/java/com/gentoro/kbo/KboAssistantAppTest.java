package com.gentoro.kbo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.handler.NoDataMessages;
import com.gentoro.kbo.orchestrator.AnswerService;
import com.gentoro.kbo.support.FakeGameDataClient;
import com.gentoro.kbo.support.InMemoryRemoteStore;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KboAssistantAppTest {

  // An empty store: every schedule question has no games, every stat question has no model.
  private final AnswerService answers =
      new AnswerService(
          KboAssistant.buildContext(
              new BaseConfiguration(), new InMemoryRemoteStore(), new FakeGameDataClient(), Optional.empty()));
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

  private String run(String input, String... args) {
    InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
    KboAssistantApp.run(new StartupParameters(args), answers, in, out);
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("dry-run answers the fixed schedule question")
  void dryRun() {
    assertEquals(NoDataMessages.NO_GAMES_TODAY + System.lineSeparator(), run("", "--mode=dry-run"));
  }

  @Test
  @DisplayName("answer mode answers --question once")
  void answerMode() {
    String output = run("", "--mode=answer", "--question=한화 타율 1위 선수는?");

    assertEquals(NoDataMessages.UNAVAILABLE + System.lineSeparator(), output);
  }

  @Test
  @DisplayName("interactive mode answers each line until exit, skipping blank lines")
  void interactive() {
    String output = run("\n오늘 경기 일정\nexit\n오늘 경기 일정\n", "--mode=interactive");

    assertTrue(output.startsWith("KBO 질문을 입력하세요"), output);
    int first = output.indexOf(NoDataMessages.NO_GAMES_TODAY);
    assertTrue(first > 0, output);
    assertEquals(first, output.lastIndexOf(NoDataMessages.NO_GAMES_TODAY), output);
    assertTrue(output.endsWith("Goodbye!" + System.lineSeparator()), output);
  }

  @Test
  @DisplayName("interactive mode also stops at end of input")
  void endOfInput() {
    String output = run("오늘 경기 일정", "--mode=INTERACTIVE");

    assertTrue(output.contains(NoDataMessages.NO_GAMES_TODAY), output);
    assertTrue(output.endsWith("> "), output);
  }

  @Test
  @DisplayName("bad modes and a missing question are configuration errors")
  void invalid() {
    assertThrows(ConfigException.class, () -> run("", "--mode=serve"));
    assertThrows(ConfigException.class, () -> run("", "--mode=answer"));
  }
}
