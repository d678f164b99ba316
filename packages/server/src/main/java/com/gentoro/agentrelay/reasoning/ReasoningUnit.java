package com.gentoro.agentrelay.reasoning;

/**
 * Decision-making component of an agent: given the conversation and the allowed operations, it
 * either requests one operation or produces the final answer. Implementations must not call the
 * backend themselves.
 */
@FunctionalInterface
public interface ReasoningUnit {
  ReasoningStep next(ReasoningRequest request);
}
