package com.gentoro.agentrelay.exception;

import java.util.Map;

/**
 * Wraps a failure reported by the operation backend. The backend's own message is kept as this
 * exception's message.
 */
public class BackendException extends AgentRelayException {
  private final String operation;

  public BackendException(String operation, String message) {
    super(AgentRelayErrorCode.BACKEND_ERROR, message, Map.of("operation", operation));
    this.operation = operation;
  }

  public BackendException(String operation, String message, Throwable cause) {
    super(AgentRelayErrorCode.BACKEND_ERROR, message, Map.of("operation", operation), cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
