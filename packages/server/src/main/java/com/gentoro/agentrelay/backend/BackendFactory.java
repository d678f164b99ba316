package com.gentoro.agentrelay.backend;

import com.gentoro.agentrelay.ConfigurationProvider;
import com.gentoro.agentrelay.exception.ConfigException;
import java.time.Duration;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/** Creates the operation backend selected by {@code backend.type}. */
public final class BackendFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(BackendFactory.class);

  private BackendFactory() {}

  public static OperationBackend create(Configuration configuration) {
    String type =
        configuration.getString("backend.type", "in-memory").trim().toLowerCase(Locale.ROOT);
    log.info("Using '{}' operation backend", type);
    return switch (type) {
      case "in-memory" -> {
        String seed = configuration.getString("backend.seed", "");
        if (seed.isBlank()) {
          yield new InMemorySupportBackend();
        }
        if (!seed.startsWith("classpath:")) {
          throw new ConfigException("backend.seed must be a classpath: location, got " + seed);
        }
        yield InMemorySupportBackend.fromClasspath(seed.substring("classpath:".length()));
      }
      case "mcp" -> {
        String url = configuration.getString("backend.mcp.url", null);
        if (url == null || url.isBlank()) {
          throw new ConfigException("backend.mcp.url is required for backend.type mcp");
        }
        yield new McpOperationBackend(
            url.trim(),
            configuration.getString("backend.mcp.endpoint", "/mcp"),
            Duration.ofMillis(configuration.getLong("backend.mcp.request-timeout-ms", 20000L)),
            ConfigurationProvider.strings(configuration, "backend.mcp.mutating"));
      }
      default -> throw new ConfigException("Unknown backend.type: " + type);
    };
  }
}
