package com.gentoro.agentrelay.exception;

import java.util.Map;

/** Generic failure while executing a request. */
public class ExecutionException extends AgentRelayException {
  public ExecutionException(String message) {
    super(AgentRelayErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(AgentRelayErrorCode.EXECUTION_ERROR, message, cause);
  }

  public ExecutionException(String message, Map<String, ?> context) {
    super(AgentRelayErrorCode.EXECUTION_ERROR, message, context);
  }
}
