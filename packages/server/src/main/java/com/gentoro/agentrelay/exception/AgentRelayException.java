package com.gentoro.agentrelay.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for AgentRelay with a stable {@link AgentRelayErrorCode} and optional
 * context.
 *
 * <p>The context map is copied and unmodifiable. Well-known keys are {@code agentId} (the agent a
 * failure is attributed to) and {@code operation} (the backend operation involved).
 */
public class AgentRelayException extends RuntimeException {
  private final AgentRelayErrorCode code;
  private final Map<String, Object> context;

  public AgentRelayException(AgentRelayErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public AgentRelayException(AgentRelayErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public AgentRelayException(AgentRelayErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public AgentRelayException(
      AgentRelayErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public AgentRelayErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  /** The agent this failure is attributed to, when known. */
  public String getAgentId() {
    Object agentId = context.get("agentId");
    return agentId == null ? null : agentId.toString();
  }

  /** {@code StageFailureException[STAGE_FAILURE @customer_data]: message (caused by ...)}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('[').append(code);
    String agentId = getAgentId();
    if (agentId != null) {
      sb.append(" @").append(agentId);
    }
    sb.append("]: ").append(getMessage());
    if (getCause() != null) {
      sb.append(" (caused by ").append(getCause().getClass().getSimpleName()).append(')');
    }
    return sb.toString();
  }
}
