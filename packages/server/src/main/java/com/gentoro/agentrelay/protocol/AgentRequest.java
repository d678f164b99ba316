package com.gentoro.agentrelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invocation request sent to an agent: the end-user query, the conversation so far and a snapshot
 * of the run's shared scratch space.
 */
public record AgentRequest(String query, List<Turn> history, Map<String, JsonNode> scratch) {
  public AgentRequest {
    history = history == null ? List.of() : List.copyOf(history);
    scratch =
        scratch == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(scratch));
  }

  public static AgentRequest of(String query) {
    return new AgentRequest(query, List.of(), Map.of());
  }
}
