package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.BudgetExceededException;
import com.gentoro.agentrelay.exception.InvalidRoutingDecisionException;
import com.gentoro.agentrelay.exception.StageFailureException;
import com.gentoro.agentrelay.protocol.AgentResponse;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Condition-driven routing. A {@link RoutingDecisionMaker} picks agents, the decision is checked
 * against the registry and the invocation budget before any agent is called, then the selected
 * agents run as a pipeline. A decision selecting nobody ends the run with its direct answer.
 */
public class DynamicRouter implements Router {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(DynamicRouter.class);

  private final RoutingDecisionMaker decisionMaker;
  private final int budget;
  private final StageRunner runner = new StageRunner();

  public DynamicRouter(RoutingDecisionMaker decisionMaker, int budget) {
    this.decisionMaker = Objects.requireNonNull(decisionMaker, "decisionMaker");
    this.budget = budget;
  }

  @Override
  public String route(RunContext ctx, AgentRegistry registry) {
    ctx.progress().beginStage("route", "Choosing agents", 1);
    RoutingDecision decision;
    try {
      decision = decisionMaker.decide(ctx.query(), registry);
      if (decision == null) {
        throw new InvalidRoutingDecisionException("Decision maker returned no decision");
      }
      ctx.decision(decision);
      validate(decision, registry);
    } catch (RuntimeException e) {
      ctx.progress().endStageError("route", e.getMessage(), Map.of());
      throw e;
    }
    ctx.progress().endStageOk("route", Map.of("selected", decision.selectedAgents()));
    log.debug("Routing decision: {} ({})", decision.selectedAgents(), decision.rationale());

    Set<String> selected = new HashSet<>(decision.selectedAgents());
    for (AgentRegistry.Entry entry : registry.entries()) {
      if (!selected.contains(entry.agentId())) {
        ctx.record(
            StageOutcome.skipped(
                entry.agentId(),
                entry.role(),
                decision.skipReasons().getOrDefault(entry.agentId(), "not selected")));
      }
    }

    if (decision.selectedAgents().isEmpty()) {
      return decision.directAnswer() == null ? "" : decision.directAnswer();
    }

    AgentResponse last = null;
    for (String agentId : decision.selectedAgents()) {
      AgentRegistry.Entry entry = registry.get(agentId);
      try {
        last = runner.runStage(ctx, entry);
      } catch (RuntimeException e) {
        throw new StageFailureException(agentId, e);
      }
    }
    return last.answer();
  }

  private void validate(RoutingDecision decision, AgentRegistry registry) {
    List<String> unknown = new ArrayList<>();
    List<String> duplicates = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    for (String agentId : decision.selectedAgents()) {
      if (!registry.contains(agentId)) {
        unknown.add(agentId);
      } else if (!seen.add(agentId)) {
        duplicates.add(agentId);
      }
    }
    if (!unknown.isEmpty()) {
      throw new InvalidRoutingDecisionException(
          "Routing decision selects unknown agents: " + unknown,
          Map.of("unknownAgents", unknown, "knownAgents", registry.agentIds()));
    }
    if (!duplicates.isEmpty()) {
      throw new InvalidRoutingDecisionException(
          "Routing decision selects agents more than once: " + duplicates,
          Map.of("duplicateAgents", duplicates));
    }
    if (decision.selectedAgents().size() > budget) {
      throw new BudgetExceededException(
          "Routing decision selects %d agents, the run budget is %d"
              .formatted(decision.selectedAgents().size(), budget),
          decision.selectedAgents().size(),
          budget);
    }
  }
}
