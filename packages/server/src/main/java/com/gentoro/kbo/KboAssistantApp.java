package com.gentoro.kbo;

import com.gentoro.kbo.exception.ConfigException;
import com.gentoro.kbo.logging.LoggingService;
import com.gentoro.kbo.orchestrator.AnswerService;
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Scanner;
import org.apache.commons.configuration2.Configuration;

public class KboAssistantApp {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(KboAssistantApp.class);

  static final String DRY_RUN_QUESTION = "오늘 경기 일정 알려줘";

  public static void main(String[] args) {
    try {
      StartupParameters parameters = new StartupParameters(args);
      Configuration configuration = new ConfigurationProvider(parameters.configFile()).config();
      LoggingService.applyConfiguration(configuration);
      if ("interactive".equalsIgnoreCase(parameters.mode())) {
        LoggingService.switchToFileLogging(logDirectory(configuration));
      }

      KboAssistant assistant = KboAssistant.create(configuration);
      try {
        run(parameters, assistant.answerService(), System.in, System.out);
      } finally {
        assistant.shutdown();
      }
    } catch (Exception e) {
      log.error("Application failed", e);
      System.exit(1);
    }
  }

  static void run(
      StartupParameters parameters, AnswerService answers, InputStream in, PrintStream out) {
    switch (parameters.mode().toLowerCase(Locale.ROOT)) {
      case "interactive" -> enterInteractiveMode(answers, in, out);
      case "dry-run" -> out.println(answers.answer(DRY_RUN_QUESTION));
      case "answer" -> {
        String question = parameters.question();
        if (question == null) {
          throw new ConfigException("--question is required in answer mode");
        }
        out.println(answers.answer(question));
      }
      default -> throw new ConfigException("Invalid mode: " + parameters.mode());
    }
  }

  static void enterInteractiveMode(AnswerService answers, InputStream in, PrintStream out) {
    Scanner scanner = new Scanner(in, StandardCharsets.UTF_8);
    out.println("KBO 질문을 입력하세요 ('exit' 입력 시 종료):");
    while (true) {
      out.print("> ");
      if (!scanner.hasNextLine()) {
        break;
      }
      String input = scanner.nextLine().trim();
      if (input.equalsIgnoreCase("exit")) {
        out.println("Goodbye!");
        break;
      }
      if (!input.isEmpty()) {
        out.println(answers.answer(input));
      }
    }
  }

  private static String logDirectory(Configuration configuration) {
    String configured = configuration.getString("logging.dir", System.getenv("KBO_LOG_DIR"));
    if (configured != null && !configured.isBlank()) {
      return configured;
    }
    String home = System.getProperty("user.home", System.getProperty("java.io.tmpdir"));
    File dir = new File(home, ".kbo-assistant/logs");
    if (!dir.exists() && !dir.mkdirs()) {
      log.warn("Could not create log directory {}", dir);
    }
    return dir.getPath();
  }
}
