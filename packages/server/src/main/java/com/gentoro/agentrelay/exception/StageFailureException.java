package com.gentoro.agentrelay.exception;

import java.util.Map;

/** A pipeline stage failed terminally; later stages were not invoked. */
public class StageFailureException extends AgentRelayException {
  public StageFailureException(String agentId, Throwable cause) {
    this(agentId, AgentRelayErrorCode.STAGE_FAILURE, cause);
  }

  /** A stage failure reported under the kind of its cause, e.g. {@code PERMISSION_DENIED}. */
  public StageFailureException(String agentId, AgentRelayErrorCode code, Throwable cause) {
    super(
        code,
        "Stage '%s' failed: %s".formatted(agentId, cause.getMessage()),
        Map.of("agentId", agentId),
        cause);
  }
}
