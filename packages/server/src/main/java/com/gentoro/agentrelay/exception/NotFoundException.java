package com.gentoro.agentrelay.exception;

import java.util.Map;

/**
 * Something addressed by name or id does not exist: a descriptor, a registered agent, an operation
 * or a backend record.
 */
public class NotFoundException extends AgentRelayException {
  public NotFoundException(String message) {
    super(AgentRelayErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(AgentRelayErrorCode.NOT_FOUND, message, context);
  }

  /** Missing backend record, e.g. {@code record("Customer", 99)} reads "Customer 99 not found". */
  public static NotFoundException record(String kind, Object id) {
    return new NotFoundException(
        "%s %s not found".formatted(kind, id), Map.of("kind", kind, "id", id));
  }
}
