package com.gentoro.agentrelay.exception;

/** Prompt template could not be loaded or rendered. */
public class PromptException extends AgentRelayException {
  public PromptException(String message) {
    super(AgentRelayErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(AgentRelayErrorCode.PROMPT_ERROR, message, cause);
  }
}
