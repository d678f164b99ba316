package com.gentoro.agentrelay.router;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.StageFailureException;
import com.gentoro.agentrelay.exception.UnreachableException;
import com.gentoro.agentrelay.protocol.AgentRequest;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SequentialRouterTest {

  private static AgentRegistry registry(StubAgent... agents) {
    AgentRegistry.Builder builder = AgentRegistry.builder();
    for (StubAgent agent : agents) {
      String id = agent.descriptor().agentId();
      builder.register(id, "role-" + id, agent, Duration.ofSeconds(1));
    }
    return builder.build();
  }

  @Test
  void laterStagesSeeEarlierOutputs() {
    StubAgent a = StubAgent.answering("a", "alpha");
    StubAgent b = StubAgent.answering("b", "beta");
    StubAgent c = StubAgent.answering("c", "gamma");
    RunContext ctx = RunContext.of("do it");

    String answer = new SequentialRouter(List.of()).route(ctx, registry(a, b, c));

    assertEquals("gamma", answer);
    assertTrue(a.requests.get(0).scratch().isEmpty());

    AgentRequest toB = b.requests.get(0);
    assertEquals("do it", toB.query());
    assertEquals(Set.of("role-a"), toB.scratch().keySet());
    assertEquals("alpha", toB.scratch().get("role-a").path("answer").asText());

    AgentRequest toC = c.requests.get(0);
    assertEquals(Set.of("role-a", "role-b"), toC.scratch().keySet());
    assertEquals("beta", toC.scratch().get("role-b").path("answer").asText());
    assertEquals(3, toC.history().size());
    assertEquals("do it", toC.history().get(0).content());

    assertTrue(
        ctx.outcomes().stream().allMatch(o -> o.status() == StageOutcome.Status.SUCCESS));
  }

  @Test
  void configuredOrderOverridesRegistryOrder() {
    StubAgent a = StubAgent.answering("a", "alpha");
    StubAgent b = StubAgent.answering("b", "beta");

    String answer = new SequentialRouter(List.of("b", "a")).route(RunContext.of("q"), registry(a, b));

    assertEquals("alpha", answer);
    assertTrue(a.requests.get(0).scratch().containsKey("role-b"));
  }

  @Test
  void failingStageStopsThePipeline() {
    StubAgent a =
        StubAgent.failing("a", new UnreachableException("a", "connection refused", true, null));
    StubAgent b = StubAgent.answering("b", "beta");
    RunContext ctx = RunContext.of("q");

    StageFailureException ex =
        assertThrows(
            StageFailureException.class,
            () -> new SequentialRouter(List.of()).route(ctx, registry(a, b)));

    assertEquals("a", ex.getContext().get("agentId"));
    assertInstanceOf(UnreachableException.class, ex.getCause());
    assertEquals(0, b.calls());
    assertEquals(StageOutcome.Status.FAILED, ctx.outcomes().get(0).status());
    assertEquals("connection refused", ctx.outcomes().get(0).cause());
  }

  @Test
  void orderNamingUnknownAgentsIsRejected() {
    SequentialRouter router = new SequentialRouter(List.of("a", "ghost"));
    assertThrows(
        ConfigException.class, () -> router.validate(registry(StubAgent.answering("a", "x"))));
  }
}
