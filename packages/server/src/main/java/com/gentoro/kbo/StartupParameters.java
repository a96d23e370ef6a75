package com.gentoro.kbo;

import com.gentoro.kbo.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line parameters in {@code --name=value} form. A bare {@code --name} is stored as {@code
 * true}.
 */
public class StartupParameters {
  public static final String MODE = "mode";
  public static final String CONFIG = "config";
  public static final String QUESTION = "question";
  public static final String DEFAULT_MODE = "interactive";

  private final Map<String, String> parameters;

  public StartupParameters(String[] args) {
    Map<String, String> parsed = new LinkedHashMap<>();
    if (args != null) {
      for (String arg : args) {
        if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
          throw new ConfigException("Unrecognized argument: " + arg);
        }
        String body = arg.substring(2);
        int eq = body.indexOf('=');
        if (eq < 0) {
          parsed.put(body, "true");
        } else {
          parsed.put(body.substring(0, eq), body.substring(eq + 1));
        }
      }
    }
    this.parameters = Collections.unmodifiableMap(parsed);
  }

  public String getParameter(String name, String defaultValue) {
    String value = parameters.get(name);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  public String mode() {
    return getParameter(MODE, DEFAULT_MODE);
  }

  /** The {@code --config} file, or {@code KBO_CONFIG} from the environment; null for the default. */
  public String configFile() {
    String fromArgs = getParameter(CONFIG, null);
    return fromArgs != null ? fromArgs : System.getenv("KBO_CONFIG");
  }

  public String question() {
    return getParameter(QUESTION, null);
  }
}
