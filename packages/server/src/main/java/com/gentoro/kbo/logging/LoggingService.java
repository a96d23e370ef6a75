package com.gentoro.kbo.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Levels can be tuned from {@code application.yaml}:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.kbo.compiler: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static org.slf4j.Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} keys to the Logback context. Unknown levels are ignored. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null || !(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      return;
    }
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      String loggerName = key.length() > LEVEL_PREFIX.length()
          ? key.substring(LEVEL_PREFIX.length() + 1)
          : org.slf4j.Logger.ROOT_LOGGER_NAME;
      // hierarchical keys escape dots inside a YAML map key
      loggerName = loggerName.replace("..", ".");
      if ("root".equalsIgnoreCase(loggerName)) {
        loggerName = org.slf4j.Logger.ROOT_LOGGER_NAME;
      }
      String value = configuration.getString(key);
      Level level = Level.toLevel(value, null);
      if (level != null) {
        ctx.getLogger(loggerName).setLevel(level);
      }
    }
  }

  /**
   * Detach console appenders from the root logger and write to a daily rolling file instead. Used
   * by interactive mode so log lines never interleave with answers on stdout.
   */
  public static void switchToFileLogging(String directory) {
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      return;
    }
    Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    List<Appender<ILoggingEvent>> consoles = new ArrayList<>();
    root.iteratorForAppenders().forEachRemaining(
        appender -> {
          if (appender instanceof ConsoleAppender) {
            consoles.add(appender);
          }
        });
    consoles.forEach(root::detachAppender);

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(ctx);
    encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    RollingFileAppender<ILoggingEvent> file = new RollingFileAppender<>();
    file.setContext(ctx);
    file.setName("FILE");
    file.setFile(directory + "/kbo-assistant.log");

    TimeBasedRollingPolicy<ILoggingEvent> policy = new TimeBasedRollingPolicy<>();
    policy.setContext(ctx);
    policy.setParent(file);
    policy.setFileNamePattern(directory + "/kbo-assistant.%d{yyyy-MM-dd}.log");
    policy.setMaxHistory(7);
    policy.start();

    file.setRollingPolicy(policy);
    file.setEncoder(encoder);
    file.start();
    root.addAppender(file);
  }
}
