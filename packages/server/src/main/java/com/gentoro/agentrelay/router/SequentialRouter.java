package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.StageFailureException;
import com.gentoro.agentrelay.protocol.AgentResponse;
import java.util.List;

/**
 * Fixed pipeline. Each agent receives the original query plus the scratch written by the agents
 * before it; the answer of the last agent is the answer of the run. A failing stage stops the
 * pipeline with {@link StageFailureException}.
 */
public class SequentialRouter implements Router {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(SequentialRouter.class);

  private final List<String> order;
  private final StageRunner runner = new StageRunner();

  /**
   * @param order agent ids in pipeline order; empty means registry order
   */
  public SequentialRouter(List<String> order) {
    this.order = order == null ? List.of() : List.copyOf(order);
  }

  /** Fail fast on an order naming agents the registry does not know. */
  public void validate(AgentRegistry registry) {
    List<String> unknown = order.stream().filter(id -> !registry.contains(id)).toList();
    if (!unknown.isEmpty()) {
      throw new ConfigException(
          "orchestrator.sequential.order references unknown agents: " + unknown);
    }
    if (order.isEmpty() && registry.size() == 0) {
      throw new ConfigException("Sequential routing needs at least one agent");
    }
  }

  @Override
  public String route(RunContext ctx, AgentRegistry registry) {
    List<AgentRegistry.Entry> stages =
        order.isEmpty() ? registry.entries() : order.stream().map(registry::get).toList();

    AgentResponse last = null;
    for (AgentRegistry.Entry entry : stages) {
      log.debug("Sequential stage {} ({})", entry.agentId(), entry.role());
      try {
        last = runner.runStage(ctx, entry);
      } catch (RuntimeException e) {
        throw new StageFailureException(entry.agentId(), e);
      }
    }
    return last == null ? "" : last.answer();
  }
}
