package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.exception.AgentRelayErrorCode;
import com.gentoro.agentrelay.protocol.AgentResponse;

/**
 * What happened to one agent during a run.
 *
 * @param response the agent's answer, only for {@link Status#SUCCESS}
 * @param errorCode kind of the failure for {@link Status#FAILED}, otherwise {@code null}
 * @param cause failure message for {@link Status#FAILED}, skip reason for {@link Status#SKIPPED}
 */
public record StageOutcome(
    String agentId,
    String role,
    Status status,
    AgentResponse response,
    AgentRelayErrorCode errorCode,
    String cause,
    long elapsedMs) {

  public enum Status {
    SUCCESS,
    FAILED,
    SKIPPED
  }

  public static StageOutcome success(
      String agentId, String role, AgentResponse response, long elapsedMs) {
    return new StageOutcome(agentId, role, Status.SUCCESS, response, null, null, elapsedMs);
  }

  public static StageOutcome failed(
      String agentId, String role, AgentRelayErrorCode errorCode, String cause, long elapsedMs) {
    return new StageOutcome(agentId, role, Status.FAILED, null, errorCode, cause, elapsedMs);
  }

  public static StageOutcome skipped(String agentId, String role, String reason) {
    return new StageOutcome(agentId, role, Status.SKIPPED, null, null, reason, 0L);
  }
}
