package com.gentoro.agentrelay.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Every agent of a fan-out failed; synthesis was skipped. */
public class AllAgentsFailedException extends AgentRelayException {
  private final Map<String, String> causes;

  public AllAgentsFailedException(Map<String, String> causes) {
    super(
        AgentRelayErrorCode.ALL_AGENTS_FAILED,
        "All %d agents failed".formatted(causes.size()),
        Map.of("causes", Collections.unmodifiableMap(new LinkedHashMap<>(causes))));
    this.causes = Collections.unmodifiableMap(new LinkedHashMap<>(causes));
  }

  /** Failure message per agent id, in registry order. */
  public Map<String, String> getCauses() {
    return causes;
  }
}
