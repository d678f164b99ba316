package com.gentoro.agentrelay.agent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.gentoro.agentrelay.exception.ConfigException;
import com.gentoro.agentrelay.exception.NotFoundException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class AgentRegistryTest {

  private final Agent agent = mock(Agent.class);

  @Test
  void keepsRegistrationOrder() {
    AgentRegistry registry =
        AgentRegistry.builder()
            .register("support_specialist", "support", agent, Duration.ofSeconds(1))
            .register("customer_data", "data", agent, Duration.ofSeconds(2))
            .build();

    assertEquals(List.of("support_specialist", "customer_data"), registry.agentIds());
    assertEquals("data", registry.get("customer_data").role());
    assertEquals(Duration.ofSeconds(2), registry.get("customer_data").timeout());
    assertTrue(registry.contains("support_specialist"));
    assertFalse(registry.contains("billing"));
    assertThrows(NotFoundException.class, () -> registry.get("billing"));
  }

  @Test
  void idsAndRolesMustBeUnique() {
    AgentRegistry.Builder builder =
        AgentRegistry.builder().register("a", "data", agent, Duration.ofSeconds(1));
    assertThrows(
        ConfigException.class, () -> builder.register("a", "other", agent, Duration.ofSeconds(1)));
    assertThrows(
        ConfigException.class, () -> builder.register("b", "data", agent, Duration.ofSeconds(1)));
  }
}
