package com.gentoro.agentrelay.exception;

import java.util.Map;

/**
 * The agent endpoint could not be reached. Failures raised before any response was received are
 * retryable; a connection lost while a response was being read is not.
 */
public class UnreachableException extends AgentRelayException {
  private final boolean retryable;

  public UnreachableException(String agentId, String message, boolean retryable, Throwable cause) {
    super(AgentRelayErrorCode.UNAVAILABLE, message, Map.of("agentId", agentId), cause);
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
