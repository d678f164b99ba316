package com.gentoro.agentrelay.reasoning;

import java.util.Map;

/** Outcome of one reasoning step: either an operation to perform, or the final answer. */
public record ReasoningStep(String operation, Map<String, Object> args, String answer) {

  public static ReasoningStep toolCall(String operation, Map<String, Object> args) {
    return new ReasoningStep(operation, args == null ? Map.of() : args, null);
  }

  public static ReasoningStep finalAnswer(String answer) {
    return new ReasoningStep(null, Map.of(), answer == null ? "" : answer);
  }

  public boolean isFinal() {
    return operation == null;
  }
}
