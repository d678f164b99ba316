package com.gentoro.agentrelay.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.backend.OperationDefinition;
import com.gentoro.agentrelay.protocol.ToolCall;
import com.gentoro.agentrelay.protocol.Turn;
import java.util.List;
import java.util.Map;

/**
 * Everything a reasoning unit sees for one step.
 *
 * @param agentId agent on whose behalf the unit reasons
 * @param instruction role instruction or rendered prompt
 * @param query the end-user query
 * @param operations operations the unit may request; empty when it must answer directly
 * @param history conversation turns so far
 * @param scratch outputs of earlier agents, keyed by role
 * @param toolCalls operations already performed in this invocation, in order
 */
public record ReasoningRequest(
    String agentId,
    String instruction,
    String query,
    List<OperationDefinition> operations,
    List<Turn> history,
    Map<String, JsonNode> scratch,
    List<ToolCall> toolCalls) {

  public ReasoningRequest {
    instruction = instruction == null ? "" : instruction;
    query = query == null ? "" : query;
    operations = operations == null ? List.of() : List.copyOf(operations);
    history = history == null ? List.of() : List.copyOf(history);
    scratch = scratch == null ? Map.of() : scratch;
    toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
  }

  /** A request with no operations, asking for a direct answer to an instruction. */
  public static ReasoningRequest direct(String agentId, String instruction, String query) {
    return new ReasoningRequest(
        agentId, instruction, query, List.of(), List.of(), Map.of(), List.of());
  }
}
