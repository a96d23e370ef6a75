package com.gentoro.kbo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.gentoro.kbo.exception.ConfigException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  @DisplayName("the bundled configuration is read from the classpath")
  void classpathDefault() {
    Configuration config = new ConfigurationProvider(null).config();

    assertEquals("2025", config.getString("season.year"));
    assertEquals("Asia/Seoul", config.getString("season.timezone"));
    assertEquals(3.1, config.getDouble("compiler.qualified-pa-factor"));
    assertEquals(
        "https://api-gw.sports.naver.com/schedule/games", config.getString("game-api.base-url"));
  }

  @Test
  @DisplayName("a named file replaces the bundled configuration")
  void fromFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("kbo.yaml");
    Files.writeString(file, "llm:\n  provider: none\nseason:\n  year: \"2024\"\n", StandardCharsets.UTF_8);

    Configuration config = new ConfigurationProvider(file.toString()).config();

    assertEquals("none", config.getString("llm.provider"));
    assertEquals("2024", config.getString("season.year"));
  }

  @Test
  @DisplayName("missing or malformed files are configuration errors")
  void invalid(@TempDir Path dir) throws IOException {
    assertThrows(
        ConfigException.class, () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));

    Path broken = dir.resolve("broken.yaml");
    Files.writeString(broken, "season: [unclosed\n", StandardCharsets.UTF_8);
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(broken.toString()));
  }
}
