package com.gentoro.agentrelay.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;

/**
 * Structured failure returned by the front door and written by hosted agents as {@code {"error":
 * ErrorDetails}}. {@code agentId} is lifted from the exception context when the failure is
 * attributed to an agent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ErrorDetails {
  public final AgentRelayErrorCode code;
  public final String type;
  public final String message;
  public final String agentId;
  public final Map<String, Object> context;
  public final Instant timestamp;

  public ErrorDetails(
      AgentRelayErrorCode code,
      String type,
      String message,
      Map<String, Object> context,
      Instant timestamp) {
    this.code = code == null ? AgentRelayErrorCode.UNKNOWN : code;
    this.type = type;
    this.message = message == null ? "" : message;
    this.context = context == null ? Map.of() : context;
    Object agent = this.context.get("agentId");
    this.agentId = agent == null ? null : agent.toString();
    this.timestamp = timestamp;
  }

  @Override
  public String toString() {
    return code + (agentId == null ? "" : " [" + agentId + "]") + ": " + message;
  }
}
