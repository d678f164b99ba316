package com.gentoro.agentrelay.exception;

import java.util.Map;

/** A run or an agent loop asked for more invocations than it is allowed. */
public class BudgetExceededException extends AgentRelayException {
  public BudgetExceededException(String message, int requested, int budget) {
    super(
        AgentRelayErrorCode.RESOURCE_EXHAUSTED,
        message,
        Map.of("requested", requested, "budget", budget));
  }
}
