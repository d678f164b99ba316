package com.gentoro.agentrelay.prompt;

/** Source of named prompt templates. */
public interface PromptRepository {
  /**
   * Load a template by name, e.g. {@code "routing-decision"}.
   *
   * @throws com.gentoro.agentrelay.exception.PromptException when missing or malformed
   */
  PromptTemplate get(String name);
}
