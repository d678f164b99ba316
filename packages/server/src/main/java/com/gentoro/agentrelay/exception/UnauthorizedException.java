package com.gentoro.agentrelay.exception;

import java.util.Map;

/** An agent attempted to invoke an operation outside of its tool binding. */
public class UnauthorizedException extends AgentRelayException {
  public UnauthorizedException(String agentId, String operation) {
    super(
        AgentRelayErrorCode.PERMISSION_DENIED,
        "Agent '%s' is not allowed to invoke operation '%s'".formatted(agentId, operation),
        Map.of("agentId", String.valueOf(agentId), "operation", String.valueOf(operation)));
  }
}
