package com.gentoro.agentrelay.orchestrator;

import com.gentoro.agentrelay.agent.AgentHandler;
import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.exception.AgentRelayException;
import com.gentoro.agentrelay.exception.ErrorDetails;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Exposes the front door as an agent, so clients reach the orchestrator through the same protocol
 * as any other agent. A failed run is rethrown with its error code, context and implicated agents.
 */
public class HostAgentHandler implements AgentHandler {
  private final AgentDescriptor descriptor;
  private final OrchestratorService orchestrator;

  public HostAgentHandler(AgentDescriptor descriptor, OrchestratorService orchestrator) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
  }

  @Override
  public AgentDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public AgentResponse handle(AgentRequest request, Consumer<AgentResponse> chunks) {
    OrchestrationResult result = orchestrator.handleQuery(request.query());
    if (!result.isSuccess()) {
      ErrorDetails error = result.error();
      Map<String, Object> context = new LinkedHashMap<>();
      if (error.context != null) context.putAll(error.context);
      context.put("implicatedAgents", result.implicatedAgents());
      throw new AgentRelayException(error.code, error.message, context);
    }
    AgentResponse response = new AgentResponse(result.answer(), List.of(), true);
    chunks.accept(response);
    return response;
  }
}
