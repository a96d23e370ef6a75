package com.gentoro.kbo.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private static final String COMPILER = "com.gentoro.kbo.compiler";
  private static final String STORE = "com.gentoro.kbo.store";

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

  @AfterEach
  void resetLevels() {
    context.getLogger(COMPILER).setLevel(null);
    context.getLogger(STORE).setLevel(null);
  }

  @Test
  @DisplayName("logging.level keys set logger levels, unknown levels are ignored")
  void applyConfiguration() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("logging.level." + COMPILER, "DEBUG");
    configuration.setProperty("logging.level." + STORE, "LOUD");

    LoggingService.applyConfiguration(configuration);

    assertEquals(Level.DEBUG, context.getLogger(COMPILER).getLevel());
    assertNull(context.getLogger(STORE).getLevel());
  }

  @Test
  @DisplayName("loggers are named after their class")
  void loggerName() {
    assertEquals(
        LoggingServiceTest.class.getName(), LoggingService.getLogger(LoggingServiceTest.class).getName());
  }
}
