package com.gentoro.agentrelay.exception;

/**
 * Invalid configuration, reported at startup: unknown routing mode, a binding naming an unknown
 * operation, duplicate agents, missing keys or unreadable files.
 */
public class ConfigException extends AgentRelayException {
  public ConfigException(String message) {
    super(AgentRelayErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(AgentRelayErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  /** A required key is absent or blank, {@code where} naming the section it belongs to. */
  public static ConfigException missing(String key, String where) {
    return new ConfigException("Missing '%s' in %s".formatted(key, where));
  }
}
