package com.gentoro.agentrelay.reasoning;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable reasoning units.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and selected by matching
 * {@code reasoning.provider} to {@link #providerId()}. Register a provider by listing its class in
 * {@code META-INF/services/com.gentoro.agentrelay.reasoning.ReasoningUnitProvider}.
 */
public interface ReasoningUnitProvider {

  /** A stable, lowercase identifier for this provider (e.g. "keyword"). */
  String providerId();

  /**
   * Creates a configured unit.
   *
   * @param configuration the {@code reasoning.*} subset
   */
  ReasoningUnit create(Configuration configuration);
}
