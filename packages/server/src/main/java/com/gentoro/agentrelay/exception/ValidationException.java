package com.gentoro.agentrelay.exception;

import java.util.Map;

/** Input did not satisfy the expected schema or constraints. */
public class ValidationException extends AgentRelayException {
  public ValidationException(String message) {
    super(AgentRelayErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(AgentRelayErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(AgentRelayErrorCode.INVALID_ARGUMENT, message, context);
  }
}
