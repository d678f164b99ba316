package com.gentoro.agentrelay.exception;

/**
 * Canonical error codes for AgentRelay. Inspired by Google/RPC style codes. Codes are stable and
 * suitable for downstream services, agent error payloads and logs. Prefer the most specific code
 * that reflects the failure origin.
 */
public enum AgentRelayErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  PERMISSION_DENIED,
  RESOURCE_EXHAUSTED,
  DEADLINE_EXCEEDED,
  UNAVAILABLE,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  DISCOVERY_ERROR,
  BACKEND_ERROR,
  REMOTE_ERROR,
  EXECUTION_ERROR,
  PROMPT_ERROR,
  STAGE_FAILURE,
  INVALID_ROUTING_DECISION,
  ALL_AGENTS_FAILED,
  RUN_TIMEOUT,
}
