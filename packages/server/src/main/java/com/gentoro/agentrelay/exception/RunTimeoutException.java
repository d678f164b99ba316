package com.gentoro.agentrelay.exception;

import java.time.Duration;
import java.util.Map;

/** The orchestration run exceeded its overall deadline. */
public class RunTimeoutException extends AgentRelayException {
  public RunTimeoutException(Duration deadline) {
    super(
        AgentRelayErrorCode.RUN_TIMEOUT,
        "Run did not complete within %d ms".formatted(deadline.toMillis()),
        Map.of("deadlineMs", deadline.toMillis()));
  }
}
