package com.gentoro.agentrelay.exception;

/** The application context was used before {@code initialize()} or after shutdown. */
public class StateException extends AgentRelayException {
  public StateException(String message) {
    super(AgentRelayErrorCode.FAILED_PRECONDITION, message);
  }
}
