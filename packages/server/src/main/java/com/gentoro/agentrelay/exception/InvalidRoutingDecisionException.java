package com.gentoro.agentrelay.exception;

import java.util.Map;

/** A routing decision named unknown agents or could not be interpreted. */
public class InvalidRoutingDecisionException extends AgentRelayException {
  public InvalidRoutingDecisionException(String message) {
    super(AgentRelayErrorCode.INVALID_ROUTING_DECISION, message);
  }

  public InvalidRoutingDecisionException(String message, Map<String, ?> context) {
    super(AgentRelayErrorCode.INVALID_ROUTING_DECISION, message, context);
  }

  public InvalidRoutingDecisionException(String message, Throwable cause) {
    super(AgentRelayErrorCode.INVALID_ROUTING_DECISION, message, cause);
  }
}
