package com.gentoro.agentrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentrelay.backend.OperationDefinition;
import com.gentoro.agentrelay.broker.ToolBinding;
import com.gentoro.agentrelay.broker.ToolBroker;
import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.exception.BackendException;
import com.gentoro.agentrelay.exception.BudgetExceededException;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import com.gentoro.agentrelay.protocol.ToolCall;
import com.gentoro.agentrelay.protocol.Turn;
import com.gentoro.agentrelay.reasoning.ReasoningRequest;
import com.gentoro.agentrelay.reasoning.ReasoningStep;
import com.gentoro.agentrelay.reasoning.ReasoningUnit;
import com.gentoro.agentrelay.utility.JacksonUtility;
import com.gentoro.agentrelay.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Agent-side tool loop.
 *
 * <p>Each round asks the reasoning unit for the next step. A tool-call step is executed through the
 * {@link ToolBroker} with this agent's binding and appended to the conversation as a {@code tool}
 * turn, then streamed as a non-final chunk. A final step ends the loop with a final chunk.
 *
 * <p>Authorization and validation failures abort the run. Backend failures are handed back to the
 * reasoning unit as an {@code {"error": ...}} tool result so it can explain them. More than {@code
 * maxToolRounds} tool calls raise {@link BudgetExceededException}.
 */
public class AgentRuntime implements AgentHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(AgentRuntime.class);

  private final AgentDescriptor descriptor;
  private final String instruction;
  private final ToolBinding binding;
  private final ToolBroker broker;
  private final ReasoningUnit reasoningUnit;
  private final int maxToolRounds;

  public AgentRuntime(
      AgentDescriptor descriptor,
      String instruction,
      ToolBinding binding,
      ToolBroker broker,
      ReasoningUnit reasoningUnit,
      int maxToolRounds) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.instruction = instruction == null ? "" : instruction;
    this.binding = Objects.requireNonNull(binding, "binding");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.reasoningUnit = Objects.requireNonNull(reasoningUnit, "reasoningUnit");
    this.maxToolRounds = maxToolRounds;
  }

  @Override
  public AgentDescriptor descriptor() {
    return descriptor;
  }

  public ToolBinding binding() {
    return binding;
  }

  @Override
  public AgentResponse handle(AgentRequest request, Consumer<AgentResponse> chunks) {
    String agentId = descriptor.agentId();
    List<OperationDefinition> operations = broker.operationsFor(binding);
    List<Turn> history = new ArrayList<>(request.history());
    List<ToolCall> toolCalls = new ArrayList<>();

    while (true) {
      ReasoningStep step =
          reasoningUnit.next(
              new ReasoningRequest(
                  agentId,
                  instruction,
                  request.query(),
                  operations,
                  history,
                  request.scratch(),
                  toolCalls));

      if (step.isFinal()) {
        log.debug("[{}] final answer after {} tool calls", agentId, toolCalls.size());
        chunks.accept(new AgentResponse(step.answer(), List.of(), true));
        return new AgentResponse(step.answer(), toolCalls, true);
      }

      if (toolCalls.size() >= maxToolRounds) {
        throw new BudgetExceededException(
            "Agent '%s' requested more than %d tool calls".formatted(agentId, maxToolRounds),
            toolCalls.size() + 1,
            maxToolRounds);
      }

      JsonNode result;
      try {
        result = broker.invoke(binding, step.operation(), step.args());
      } catch (BackendException e) {
        log.warn("[{}] operation {} failed: {}", agentId, step.operation(), e.getMessage());
        result = errorResult(e);
      }

      ToolCall call = new ToolCall(step.operation(), step.args(), result);
      toolCalls.add(call);
      history.add(
          Turn.of(
              Turn.TOOL,
              "%s -> %s"
                  .formatted(
                      step.operation(),
                      StringUtility.truncate(JacksonUtility.toCompactJson(result), 2000))));
      chunks.accept(new AgentResponse("", List.of(call), false));
    }
  }

  private static JsonNode errorResult(BackendException e) {
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    ObjectNode error = root.putObject("error");
    error.put("code", e.getCode().name());
    error.put("message", e.getMessage());
    return root;
  }
}
