package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.exception.ConfigException;
import java.util.Arrays;
import java.util.Locale;

public enum RoutingMode {
  SEQUENTIAL,
  DYNAMIC,
  PARALLEL;

  /** Parse {@code orchestrator.mode}; unknown values are a configuration error. */
  public static RoutingMode parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ConfigException("Missing orchestrator.mode, expected one of " + names());
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException(
          "Unknown orchestrator.mode '%s', expected one of %s".formatted(value, names()), e);
    }
  }

  private static String names() {
    return Arrays.toString(
        Arrays.stream(values()).map(m -> m.name().toLowerCase(Locale.ROOT)).toArray());
  }
}
