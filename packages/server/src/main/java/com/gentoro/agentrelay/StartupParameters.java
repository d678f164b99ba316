package com.gentoro.agentrelay;

import com.gentoro.agentrelay.exception.ConfigException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line parameters, given as {@code --name value} pairs.
 *
 * <ul>
 *   <li>{@code --config-file}: configuration location, default {@code classpath:application.yaml}
 *   <li>{@code --mode}: {@code server} (default) keeps the HTTP endpoints running; {@code query}
 *       answers {@code --query} once and exits
 *   <li>{@code --query}: the request used by {@code query} mode
 * </ul>
 */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("server", "query");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "server");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new ConfigException("Invalid mode: " + mode + ", expected one of " + MODES);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new ConfigException("Missing config file location");
    }

    if ("query".equals(mode)
        && (parameters.get("query") == null || parameters.get("query").toString().isBlank())) {
      throw new ConfigException("Mode 'query' requires --query <text>");
    }
  }

  /** Returns the configuration location string, e.g. "classpath:application.yaml". */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
