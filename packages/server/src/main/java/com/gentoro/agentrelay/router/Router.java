package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.agent.AgentRegistry;

/**
 * Routing strategy: decides which agents of the registry handle a query, calls them and produces
 * the final answer. Outcomes and shared state are recorded in the {@link RunContext}.
 */
public interface Router {
  String route(RunContext context, AgentRegistry registry);
}
