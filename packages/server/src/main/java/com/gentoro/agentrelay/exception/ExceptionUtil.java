package com.gentoro.agentrelay.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is an {@link AgentRelayException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof AgentRelayException ex) {
      return new ErrorDetails(
          ex.getCode(),
          ex.getClass().getSimpleName(),
          ex.getMessage(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        AgentRelayErrorCode.UNKNOWN,
        t.getClass().getSimpleName(),
        t.getMessage(),
        null,
        Instant.now());
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, limited to the
   * first {@code maxFrames} frames (all frames when {@code maxFrames <= 0}).
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Short description of a failure, suitable for "unavailable: ..." style summaries. Falls back to
   * the exception type when no message is available.
   */
  public static String describe(Throwable t) {
    if (t == null) return "unknown error";
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }

  /** Unwrap wrapper exceptions produced by executors and futures. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof java.util.concurrent.ExecutionException
            || current instanceof java.util.concurrent.CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** The throwable itself when it already is an {@link AgentRelayException}, else wrapped. */
  public static AgentRelayException asAgentRelayException(
      Throwable t, Function<Throwable, AgentRelayException> wrapper) {
    if (t instanceof AgentRelayException ex) {
      return ex;
    }
    return wrapper.apply(t);
  }

  /**
   * Error kind of a failure. For a remote agent error this is the {@code error.code} of its
   * payload, so a remote authorization failure reads the same as a local one.
   */
  public static AgentRelayErrorCode errorCodeOf(Throwable t) {
    if (t instanceof RemoteAgentException remote && remote.getPayload() != null) {
      String code = remote.getPayload().path("error").path("code").asText("");
      for (AgentRelayErrorCode candidate : AgentRelayErrorCode.values()) {
        if (candidate.name().equals(code)) {
          return candidate;
        }
      }
      return remote.getCode();
    }
    if (t instanceof AgentRelayException ex) {
      return ex.getCode();
    }
    return AgentRelayErrorCode.UNKNOWN;
  }

  /** Failures caused by how agents are configured; retrying or synthesizing around them is wrong. */
  public static boolean isConfigurationFault(AgentRelayErrorCode code) {
    return code == AgentRelayErrorCode.PERMISSION_DENIED
        || code == AgentRelayErrorCode.INVALID_ARGUMENT;
  }
}
