package com.gentoro.agentrelay.exception;

/**
 * JSON or YAML could not be read or written: configuration, seed data, wire payloads or stream
 * chunks.
 */
public class SerializationException extends AgentRelayException {
  public SerializationException(String message, Throwable cause) {
    super(AgentRelayErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
