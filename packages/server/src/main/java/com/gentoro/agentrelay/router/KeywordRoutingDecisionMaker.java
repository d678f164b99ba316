package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.descriptor.AgentSkill;
import com.gentoro.agentrelay.exception.AgentRelayException;
import com.gentoro.agentrelay.reasoning.QueryIntent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic decision maker. The {@code data} role is selected when the query asks for customer
 * or ticket data, the {@code support} role when it describes a problem; any agent is also selected
 * when the query mentions its role or one of its skill tags. Selected agents keep registry order.
 */
public class KeywordRoutingDecisionMaker implements RoutingDecisionMaker {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(KeywordRoutingDecisionMaker.class);

  public static final String DATA_ROLE = "data";
  public static final String SUPPORT_ROLE = "support";

  @Override
  public RoutingDecision decide(String query, AgentRegistry registry) {
    QueryIntent intent = QueryIntent.analyze(query);
    List<String> tokens = QueryIntent.tokens(query);

    List<String> selected = new ArrayList<>();
    List<String> reasons = new ArrayList<>();
    Map<String, String> skipReasons = new LinkedHashMap<>();
    for (AgentRegistry.Entry entry : registry.entries()) {
      String reason = matchReason(entry, intent, tokens);
      if (reason != null) {
        selected.add(entry.agentId());
        reasons.add(entry.agentId() + ": " + reason);
      } else {
        skipReasons.put(
            entry.agentId(), "query does not concern role '%s'".formatted(entry.role()));
      }
    }

    String rationale =
        "intent %s%s%s"
            .formatted(
                intent.mode().name().toLowerCase(Locale.ROOT),
                intent.urgent() ? ", urgent" : "",
                reasons.isEmpty() ? "" : "; " + String.join("; ", reasons));
    if (selected.isEmpty()) {
      return new RoutingDecision(List.of(), rationale, skipReasons, clarification(registry));
    }
    return new RoutingDecision(selected, rationale, skipReasons, null);
  }

  private String matchReason(AgentRegistry.Entry entry, QueryIntent intent, List<String> tokens) {
    if (DATA_ROLE.equals(entry.role()) && intent.needsData()) return "data keywords";
    if (SUPPORT_ROLE.equals(entry.role()) && intent.needsSupport()) return "support keywords";
    if (QueryIntent.matchesAny(tokens, List.of(entry.role()))) return "role mentioned";
    if (QueryIntent.matchesAny(tokens, skillTags(entry))) return "skill tag mentioned";
    return null;
  }

  private static List<String> skillTags(AgentRegistry.Entry entry) {
    try {
      return entry.agent().descriptor().skills().stream()
          .map(AgentSkill::tags)
          .flatMap(List::stream)
          .toList();
    } catch (AgentRelayException e) {
      log.warn("Skills of agent '{}' unavailable for routing: {}", entry.agentId(), e.getMessage());
      return List.of();
    }
  }

  private static String clarification(AgentRegistry registry) {
    String agents =
        registry.entries().stream()
            .map(e -> "%s (%s)".formatted(e.agentId(), e.role()))
            .collect(Collectors.joining(", "));
    return "Could you tell me more about what you need? I can involve: " + agents + ".";
  }
}
