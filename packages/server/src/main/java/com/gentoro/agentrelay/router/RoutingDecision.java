package com.gentoro.agentrelay.router;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the routing-decision step of a dynamic run.
 *
 * @param selectedAgents agent ids to invoke, in order
 * @param skipReasons why other agents were left out
 * @param directAnswer answer returned when no agent is selected
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoutingDecision(
    List<String> selectedAgents,
    String rationale,
    Map<String, String> skipReasons,
    String directAnswer) {

  public RoutingDecision {
    selectedAgents = selectedAgents == null ? List.of() : List.copyOf(selectedAgents);
    skipReasons =
        skipReasons == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(skipReasons));
  }

  public static RoutingDecision select(List<String> agents, String rationale) {
    return new RoutingDecision(agents, rationale, Map.of(), null);
  }

  public static RoutingDecision answerDirectly(String answer, String rationale) {
    return new RoutingDecision(List.of(), rationale, Map.of(), answer);
  }
}
