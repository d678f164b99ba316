package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.agent.AgentRegistry;

/** Chooses the agents of a dynamic run. Only the router validates the choice. */
@FunctionalInterface
public interface RoutingDecisionMaker {
  RoutingDecision decide(String query, AgentRegistry registry);
}
