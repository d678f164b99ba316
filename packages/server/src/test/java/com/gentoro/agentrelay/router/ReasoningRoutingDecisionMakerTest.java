package com.gentoro.agentrelay.router;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.InvalidRoutingDecisionException;
import com.gentoro.agentrelay.prompt.impl.ClasspathPromptRepository;
import com.gentoro.agentrelay.reasoning.ReasoningStep;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ReasoningRoutingDecisionMakerTest {

  private final ClasspathPromptRepository prompts = new ClasspathPromptRepository("prompts");
  private final AgentRegistry registry =
      AgentRegistry.builder()
          .register(
              "customer_data", "data", StubAgent.answering("customer_data", ""), Duration.ofSeconds(1))
          .register(
              "support_specialist",
              "support",
              StubAgent.answering("support_specialist", ""),
              Duration.ofSeconds(1))
          .build();

  @Test
  void parsesFencedJsonDecision() {
    RoutingDecision decision =
        ReasoningRoutingDecisionMaker.parse(
            """
            Here is my decision:
            ```json
            {"selectedAgents": ["customer_data"], "rationale": "needs data",
             "skipReasons": {"support_specialist": "no problem described"}}
            ```
            """);

    assertEquals(List.of("customer_data"), decision.selectedAgents());
    assertEquals("needs data", decision.rationale());
    assertEquals("no problem described", decision.skipReasons().get("support_specialist"));
  }

  @Test
  void parsesBareJsonDecision() {
    RoutingDecision decision =
        ReasoningRoutingDecisionMaker.parse(
            "{\"selectedAgents\": [], \"directAnswer\": \"Hi! How can I help?\"}");
    assertTrue(decision.selectedAgents().isEmpty());
    assertEquals("Hi! How can I help?", decision.directAnswer());
  }

  @Test
  void rejectsAnswersThatAreNotDecisions() {
    assertThrows(
        InvalidRoutingDecisionException.class,
        () -> ReasoningRoutingDecisionMaker.parse("I would ask the data agent."));
    assertThrows(
        InvalidRoutingDecisionException.class,
        () -> ReasoningRoutingDecisionMaker.parse("{\"agents\": [\"customer_data\"]}"));
    assertThrows(
        InvalidRoutingDecisionException.class,
        () -> ReasoningRoutingDecisionMaker.parse("{\"selectedAgents\": \"customer_data\"}"));
  }

  @Test
  void promptListsAgentsAndQuery() {
    AtomicReference<String> instruction = new AtomicReference<>();
    ReasoningRoutingDecisionMaker maker =
        new ReasoningRoutingDecisionMaker(
            prompts,
            request -> {
              instruction.set(request.instruction());
              return ReasoningStep.finalAnswer("{\"selectedAgents\": [\"support_specialist\"]}");
            });

    RoutingDecision decision = maker.decide("My invoice is wrong", registry);

    assertEquals(List.of("support_specialist"), decision.selectedAgents());
    assertTrue(instruction.get().contains("- customer_data (role data)"), instruction.get());
    assertTrue(instruction.get().contains("- support_specialist (role support)"));
    assertTrue(instruction.get().contains("Request: My invoice is wrong"));
    assertTrue(instruction.get().contains("selectedAgents"));
  }

  @Test
  void toolCallInsteadOfAnswerIsInvalid() {
    ReasoningRoutingDecisionMaker maker =
        new ReasoningRoutingDecisionMaker(
            prompts, request -> ReasoningStep.toolCall("get_customer", Map.of("customer_id", 1)));
    assertThrows(
        InvalidRoutingDecisionException.class, () -> maker.decide("q", registry));
  }
}
