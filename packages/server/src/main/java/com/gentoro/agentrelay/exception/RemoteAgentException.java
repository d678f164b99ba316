package com.gentoro.agentrelay.exception;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/** The remote agent answered with a well-formed error. The payload is kept unmodified. */
public class RemoteAgentException extends AgentRelayException {
  private final int status;
  private final JsonNode payload;

  public RemoteAgentException(String agentId, int status, JsonNode payload) {
    super(
        AgentRelayErrorCode.REMOTE_ERROR,
        "Agent '%s' returned an error (status %d): %s"
            .formatted(agentId, status, describe(payload)),
        Map.of("agentId", agentId, "status", status));
    this.status = status;
    this.payload = payload;
  }

  public int getStatus() {
    return status;
  }

  public JsonNode getPayload() {
    return payload;
  }

  private static String describe(JsonNode payload) {
    if (payload == null) return "<empty>";
    JsonNode message = payload.path("error").path("message");
    return message.isTextual() ? message.asText() : payload.toString();
  }
}
