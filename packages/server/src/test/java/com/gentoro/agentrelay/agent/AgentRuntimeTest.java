package com.gentoro.agentrelay.agent;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentrelay.backend.InMemorySupportBackend;
import com.gentoro.agentrelay.backend.OperationCatalog;
import com.gentoro.agentrelay.broker.ToolBinding;
import com.gentoro.agentrelay.broker.ToolBroker;
import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.exception.BudgetExceededException;
import com.gentoro.agentrelay.exception.UnauthorizedException;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import com.gentoro.agentrelay.protocol.Turn;
import com.gentoro.agentrelay.reasoning.ReasoningRequest;
import com.gentoro.agentrelay.reasoning.ReasoningStep;
import com.gentoro.agentrelay.reasoning.ReasoningUnit;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AgentRuntimeTest {

  private ToolBroker broker;
  private final AgentDescriptor descriptor =
      AgentDescriptor.builder().agentId("data").endpoint("/agents/data").build();

  @BeforeEach
  void setUp() {
    InMemorySupportBackend backend = InMemorySupportBackend.fromClasspath("seed/support-data.yaml");
    broker = new ToolBroker(OperationCatalog.of(backend), backend, Duration.ofMillis(1));
  }

  private AgentRuntime runtime(Set<String> operations, ReasoningUnit unit, int maxRounds) {
    return new AgentRuntime(
        descriptor, "be brief", ToolBinding.of("data", operations), broker, unit, maxRounds);
  }

  @Test
  void toolResultsAreFedBackUntilFinalAnswer() {
    List<ReasoningRequest> seen = new ArrayList<>();
    ReasoningUnit unit =
        request -> {
          seen.add(request);
          return request.toolCalls().isEmpty()
              ? ReasoningStep.toolCall("get_customer", Map.of("customer_id", 2))
              : ReasoningStep.finalAnswer(
                  "name=" + request.toolCalls().get(0).result().path("name").asText());
        };
    List<AgentResponse> chunks = new ArrayList<>();

    AgentResponse response =
        runtime(Set.of("get_customer"), unit, 6).handle(AgentRequest.of("who?"), chunks::add);

    assertEquals("name=Sarah Johnson", response.answer());
    assertEquals(1, response.toolCalls().size());
    assertEquals(2, chunks.size());
    assertFalse(chunks.get(0).complete());
    assertTrue(chunks.get(1).complete());

    ReasoningRequest second = seen.get(1);
    assertEquals("be brief", second.instruction());
    assertEquals(1, second.operations().size());
    Turn toolTurn = second.history().get(second.history().size() - 1);
    assertEquals(Turn.TOOL, toolTurn.role());
    assertTrue(toolTurn.content().startsWith("get_customer -> "));
  }

  @Test
  void backendFailureIsReportedToTheReasoningUnit() {
    ReasoningUnit unit =
        request ->
            request.toolCalls().isEmpty()
                ? ReasoningStep.toolCall("get_customer", Map.of("customer_id", 404))
                : ReasoningStep.finalAnswer(
                    request.toolCalls().get(0).result().path("error").path("code").asText());

    AgentResponse response =
        runtime(Set.of("get_customer"), unit, 6).handle(AgentRequest.of("q"), c -> {});

    assertEquals("BACKEND_ERROR", response.answer());
  }

  @Test
  void unauthorizedOperationAbortsTheRun() {
    ReasoningUnit unit = request -> ReasoningStep.toolCall("delete_ticket", Map.of("ticket_id", 1));
    AgentRuntime runtime = runtime(Set.of("get_ticket"), unit, 6);
    assertThrows(UnauthorizedException.class, () -> runtime.handle(AgentRequest.of("q"), c -> {}));
  }

  @Test
  void toolLoopIsBounded() {
    ReasoningUnit unit = request -> ReasoningStep.toolCall("get_ticket_stats", Map.of());
    AgentRuntime runtime = runtime(Set.of("get_ticket_stats"), unit, 3);
    BudgetExceededException ex =
        assertThrows(
            BudgetExceededException.class, () -> runtime.handle(AgentRequest.of("q"), c -> {}));
    assertEquals("RESOURCE_EXHAUSTED", ex.getCode().name());
  }
}
