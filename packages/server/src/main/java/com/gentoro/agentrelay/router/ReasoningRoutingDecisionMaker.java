package com.gentoro.agentrelay.router;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.descriptor.AgentSkill;
import com.gentoro.agentrelay.exception.AgentRelayException;
import com.gentoro.agentrelay.exception.InvalidRoutingDecisionException;
import com.gentoro.agentrelay.exception.SerializationException;
import com.gentoro.agentrelay.prompt.PromptRepository;
import com.gentoro.agentrelay.reasoning.ReasoningRequest;
import com.gentoro.agentrelay.reasoning.ReasoningStep;
import com.gentoro.agentrelay.reasoning.ReasoningUnit;
import com.gentoro.agentrelay.utility.JacksonUtility;
import com.gentoro.agentrelay.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Asks a reasoning unit for the routing decision. The {@code routing-decision} template is rendered
 * with the query and the registry's agents; the unit must answer with a JSON decision, optionally
 * inside a {@code ```json} block. Anything else is an invalid decision.
 */
public class ReasoningRoutingDecisionMaker implements RoutingDecisionMaker {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(ReasoningRoutingDecisionMaker.class);

  static final String TEMPLATE = "routing-decision";

  private final PromptRepository prompts;
  private final ReasoningUnit reasoningUnit;

  public ReasoningRoutingDecisionMaker(PromptRepository prompts, ReasoningUnit reasoningUnit) {
    this.prompts = Objects.requireNonNull(prompts, "prompts");
    this.reasoningUnit = Objects.requireNonNull(reasoningUnit, "reasoningUnit");
  }

  @Override
  public RoutingDecision decide(String query, AgentRegistry registry) {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("query", query);
    vars.put("agents", registry.entries().stream().map(this::describe).toList());
    String instruction =
        prompts
            .get(TEMPLATE)
            .newSession()
            .enable("instructions", Map.of())
            .enable("request", vars)
            .renderText();

    ReasoningStep step = reasoningUnit.next(ReasoningRequest.direct("router", instruction, query));
    if (!step.isFinal()) {
      throw new InvalidRoutingDecisionException(
          "Routing decision requested operation '%s' instead of answering"
              .formatted(step.operation()),
          Map.of("operation", step.operation()));
    }
    return parse(step.answer());
  }

  static RoutingDecision parse(String answer) {
    String json = StringUtility.extractSnippet(answer, "json");
    if (json == null) {
      json = answer == null ? "" : answer.trim();
    }
    try {
      JsonNode node = JacksonUtility.getJsonMapper().readTree(json);
      if (node == null || !node.isObject() || !node.path("selectedAgents").isArray()) {
        throw new InvalidRoutingDecisionException(
            "Routing decision must be a JSON object with a 'selectedAgents' array: "
                + StringUtility.truncate(json, 200));
      }
      return JacksonUtility.fromTree(node, RoutingDecision.class);
    } catch (java.io.IOException | SerializationException e) {
      log.debug("Unparseable routing decision: {}", answer);
      throw new InvalidRoutingDecisionException(
          "Routing decision is not valid JSON: " + StringUtility.truncate(json, 200), e);
    }
  }

  private Map<String, Object> describe(AgentRegistry.Entry entry) {
    String description = "";
    String skills = "";
    try {
      AgentDescriptor descriptor = entry.agent().descriptor();
      description = Objects.requireNonNullElse(descriptor.description(), descriptor.displayName());
      List<String> names = new ArrayList<>();
      for (AgentSkill skill : descriptor.skills()) {
        names.add(Objects.requireNonNullElse(skill.name(), skill.skillId()));
      }
      if (!names.isEmpty()) {
        skills = names.stream().collect(Collectors.joining(", ", " Skills: ", "."));
      }
    } catch (AgentRelayException e) {
      log.warn(
          "Descriptor of agent '{}' unavailable for routing: {}", entry.agentId(), e.getMessage());
    }
    return Map.of(
        "agentId", entry.agentId(),
        "role", entry.role(),
        "description", description,
        "skills", skills);
  }
}
