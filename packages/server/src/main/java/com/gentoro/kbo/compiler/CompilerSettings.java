package com.gentoro.kbo.compiler;

import org.apache.commons.configuration2.Configuration;

/** Tunables of the query compiler. */
public record CompilerSettings(double qualifiedPaFactor, String season, RoleWeights roleWeights) {

  public static final double DEFAULT_QUALIFIED_PA_FACTOR = 3.1;
  public static final String DEFAULT_SEASON = "2025";

  public static CompilerSettings defaults() {
    return new CompilerSettings(DEFAULT_QUALIFIED_PA_FACTOR, DEFAULT_SEASON, RoleWeights.DEFAULT);
  }

  public static CompilerSettings from(Configuration configuration) {
    return new CompilerSettings(
        configuration.getDouble("compiler.qualified-pa-factor", DEFAULT_QUALIFIED_PA_FACTOR),
        configuration.getString("season.year", DEFAULT_SEASON),
        RoleWeights.from(configuration));
  }
}
