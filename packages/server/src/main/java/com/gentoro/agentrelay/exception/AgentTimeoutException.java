package com.gentoro.agentrelay.exception;

import java.time.Duration;
import java.util.Map;

/** A remote agent call exceeded its deadline. Never retried. */
public class AgentTimeoutException extends AgentRelayException {
  public AgentTimeoutException(String agentId, Duration timeout, Throwable cause) {
    super(
        AgentRelayErrorCode.DEADLINE_EXCEEDED,
        "Agent '%s' did not answer within %d ms".formatted(agentId, timeout.toMillis()),
        Map.of("agentId", agentId, "timeoutMs", timeout.toMillis()),
        cause);
  }
}
