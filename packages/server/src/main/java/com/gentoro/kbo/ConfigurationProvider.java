package com.gentoro.kbo;

import com.gentoro.kbo.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads {@code application.yaml}, from the given file when one is named and from the classpath
 * otherwise. Values may use {@code ${env:NAME}} to read the environment.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.kbo.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this.config = new YAMLConfiguration();
    if (configFile == null || configFile.isBlank()) {
      loadFromClasspath(DEFAULT_RESOURCE);
    } else {
      loadFromFile(Path.of(configFile));
    }
  }

  private void loadFromClasspath(String resource) {
    try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Configuration not found on classpath: " + resource);
      }
      read(new InputStreamReader(in, StandardCharsets.UTF_8), resource);
    } catch (IOException e) {
      throw new ConfigException("Could not read configuration " + resource, e);
    }
  }

  private void loadFromFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file does not exist: " + file.toAbsolutePath());
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      read(reader, file.toString());
    } catch (IOException e) {
      throw new ConfigException("Could not read configuration " + file, e);
    }
  }

  private void read(Reader reader, String source) {
    try {
      config.read(reader);
      log.debug("Configuration loaded from {}", source);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid configuration in " + source, e);
    }
  }

  public Configuration config() {
    return config;
  }
}
