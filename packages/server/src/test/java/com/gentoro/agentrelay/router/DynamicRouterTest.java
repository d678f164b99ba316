package com.gentoro.agentrelay.router;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.BudgetExceededException;
import com.gentoro.agentrelay.exception.InvalidRoutingDecisionException;
import com.gentoro.agentrelay.exception.StageFailureException;
import com.gentoro.agentrelay.exception.ValidationException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DynamicRouterTest {

  private StubAgent data;
  private StubAgent support;
  private AgentRegistry registry;

  @BeforeEach
  void setUp() {
    data = StubAgent.answering("customer_data", "Customer 5 is Emily Chen.", "customer", "account");
    support = StubAgent.answering("support_specialist", "Ticket filed.", "help", "issue");
    registry =
        AgentRegistry.builder()
            .register("customer_data", "data", data, Duration.ofSeconds(1))
            .register("support_specialist", "support", support, Duration.ofSeconds(1))
            .build();
  }

  @Test
  @DisplayName("a decision naming an unknown agent fails before any agent is called")
  void unknownAgentFailsClosed() {
    DynamicRouter router =
        new DynamicRouter((q, r) -> RoutingDecision.select(List.of("customer_data", "ghost"), "x"), 5);

    InvalidRoutingDecisionException ex =
        assertThrows(
            InvalidRoutingDecisionException.class, () -> router.route(RunContext.of("q"), registry));

    assertEquals(List.of("ghost"), ex.getContext().get("unknownAgents"));
    assertEquals(0, data.calls());
    assertEquals(0, support.calls());
  }

  @Test
  void duplicateSelectionIsInvalid() {
    DynamicRouter router =
        new DynamicRouter(
            (q, r) -> RoutingDecision.select(List.of("customer_data", "customer_data"), "x"), 5);
    assertThrows(
        InvalidRoutingDecisionException.class, () -> router.route(RunContext.of("q"), registry));
    assertEquals(0, data.calls());
  }

  @Test
  void missingDecisionIsInvalid() {
    DynamicRouter router = new DynamicRouter((q, r) -> null, 5);
    assertThrows(
        InvalidRoutingDecisionException.class, () -> router.route(RunContext.of("q"), registry));
  }

  @Test
  void selectionOverBudgetIsRejected() {
    DynamicRouter router =
        new DynamicRouter(
            (q, r) -> RoutingDecision.select(List.of("customer_data", "support_specialist"), "x"),
            1);
    BudgetExceededException ex =
        assertThrows(BudgetExceededException.class, () -> router.route(RunContext.of("q"), registry));
    assertEquals("RESOURCE_EXHAUSTED", ex.getCode().name());
    assertEquals(0, data.calls());
  }

  @Test
  void greetingIsAnsweredWithoutCallingAgents() {
    RunContext ctx = RunContext.of("hello");

    String answer = new DynamicRouter(new KeywordRoutingDecisionMaker(), 2).route(ctx, registry);

    assertTrue(answer.startsWith("Could you tell me more about what you need?"), answer);
    assertTrue(answer.contains("customer_data (data)"));
    assertEquals(0, data.calls());
    assertEquals(0, support.calls());
    assertEquals(2, ctx.outcomes().size());
    assertTrue(ctx.outcomes().stream().allMatch(o -> o.status() == StageOutcome.Status.SKIPPED));
    assertTrue(ctx.decision().selectedAgents().isEmpty());
  }

  @Test
  void onlySelectedAgentsRunAndOthersAreSkipped() {
    RunContext ctx = RunContext.of("Check account 5");

    String answer = new DynamicRouter(new KeywordRoutingDecisionMaker(), 2).route(ctx, registry);

    assertEquals("Customer 5 is Emily Chen.", answer);
    assertEquals(1, data.calls());
    assertEquals(0, support.calls());
    StageOutcome skipped =
        ctx.outcomes().stream()
            .filter(o -> o.agentId().equals("support_specialist"))
            .findFirst()
            .orElseThrow();
    assertEquals(StageOutcome.Status.SKIPPED, skipped.status());
  }

  @Test
  void selectedAgentsRunInDecisionOrder() {
    RunContext ctx = RunContext.of("q");
    DynamicRouter router =
        new DynamicRouter(
            (q, r) -> RoutingDecision.select(List.of("support_specialist", "customer_data"), "x"),
            2);

    assertEquals("Customer 5 is Emily Chen.", router.route(ctx, registry));
    assertTrue(data.requests.get(0).scratch().containsKey("support"));
  }

  @Test
  void failingSelectedAgentIsStageFailure() {
    StubAgent broken = StubAgent.failing("broken", new ValidationException("bad"));
    AgentRegistry withBroken =
        AgentRegistry.builder()
            .register("broken", "data", broken, Duration.ofSeconds(1))
            .register("support_specialist", "support", support, Duration.ofSeconds(1))
            .build();
    DynamicRouter router =
        new DynamicRouter(
            (q, r) -> RoutingDecision.select(List.of("broken", "support_specialist"), "x"), 2);

    assertThrows(StageFailureException.class, () -> router.route(RunContext.of("q"), withBroken));
    assertEquals(0, support.calls());
  }
}
