package com.gentoro.agentrelay.reasoning;

import com.gentoro.agentrelay.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Resolves the configured {@link ReasoningUnitProvider} through {@link ServiceLoader}. */
public final class ReasoningUnitFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(ReasoningUnitFactory.class);

  private ReasoningUnitFactory() {}

  /**
   * Example configuration:
   *
   * <pre>
   * reasoning:
   *   provider: keyword
   * </pre>
   */
  public static ReasoningUnit create(Configuration configuration) {
    Configuration subset = configuration.subset("reasoning");
    String provider = subset.getString("provider", "keyword").trim().toLowerCase(Locale.ROOT);

    List<String> available = new ArrayList<>();
    for (ReasoningUnitProvider p : ServiceLoader.load(ReasoningUnitProvider.class)) {
      if (provider.equals(p.providerId())) {
        log.info("Using reasoning provider '{}'", provider);
        return p.create(subset);
      }
      available.add(p.providerId());
    }

    throw new ConfigException(
        "Unknown reasoning.provider '%s', available: %s".formatted(provider, available));
  }
}
