package com.gentoro.agentrelay.exception;

/** Descriptor document could not be fetched or parsed. */
public class DiscoveryException extends AgentRelayException {
  public DiscoveryException(String message) {
    super(AgentRelayErrorCode.DISCOVERY_ERROR, message);
  }

  public DiscoveryException(String message, Throwable cause) {
    super(AgentRelayErrorCode.DISCOVERY_ERROR, message, cause);
  }
}
