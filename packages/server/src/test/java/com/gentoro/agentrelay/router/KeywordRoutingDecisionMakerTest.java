package com.gentoro.agentrelay.router;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentrelay.agent.AgentRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordRoutingDecisionMakerTest {

  private final KeywordRoutingDecisionMaker maker = new KeywordRoutingDecisionMaker();
  private final AgentRegistry registry =
      AgentRegistry.builder()
          .register(
              "customer_data", "data", StubAgent.answering("customer_data", ""), Duration.ofSeconds(1))
          .register(
              "support_specialist",
              "support",
              StubAgent.answering("support_specialist", "", "refund"),
              Duration.ofSeconds(1))
          .register("billing", "billing", StubAgent.answering("billing", ""), Duration.ofSeconds(1))
          .build();

  @Test
  void dataAndSupportKeywordsSelectBothInRegistryOrder() {
    RoutingDecision decision =
        maker.decide("Customer 5 has an urgent problem with their account", registry);

    assertEquals(List.of("customer_data", "support_specialist"), decision.selectedAgents());
    assertTrue(decision.rationale().startsWith("intent sequential, urgent"), decision.rationale());
    assertTrue(decision.skipReasons().containsKey("billing"));
    assertNull(decision.directAnswer());
  }

  @Test
  void roleMentionAndSkillTagsSelectAgents() {
    assertEquals(
        List.of("billing"), maker.decide("Question about billing", registry).selectedAgents());
    assertEquals(
        List.of("support_specialist"),
        maker.decide("I want a refund", registry).selectedAgents());
  }

  @Test
  void nothingMatchingAsksForClarification() {
    RoutingDecision decision = maker.decide("hello", registry);

    assertTrue(decision.selectedAgents().isEmpty());
    assertEquals(
        "Could you tell me more about what you need? I can involve: customer_data (data), "
            + "support_specialist (support), billing (billing).",
        decision.directAnswer());
    assertEquals(3, decision.skipReasons().size());
  }
}
