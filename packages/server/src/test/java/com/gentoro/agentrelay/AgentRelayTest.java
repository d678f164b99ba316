package com.gentoro.agentrelay;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.agent.RemoteAgent;
import com.gentoro.agentrelay.descriptor.DescriptorReference;
import com.gentoro.agentrelay.descriptor.DescriptorResolver;
import com.gentoro.agentrelay.exception.StateException;
import com.gentoro.agentrelay.http.OkHttpFactory;
import com.gentoro.agentrelay.orchestrator.OrchestrationResult;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import com.gentoro.agentrelay.proxy.RemoteAgentProxy;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.time.Duration;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AgentRelayTest {

  private static final String CONFIG = "classpath:test-application.yaml";

  private AgentRelay relay;

  @AfterEach
  void tearDown() {
    if (relay != null) {
      relay.shutdown();
    }
  }

  @Test
  void configurationIsUnavailableBeforeInitialize() {
    relay = new AgentRelay(new String[] {"--config-file", CONFIG});
    assertThrows(StateException.class, () -> relay.configuration());
  }

  @Test
  void serverModeWiresHostedAgentsAndRoutesQueries() throws Exception {
    relay = new AgentRelay(new String[] {"--config-file", CONFIG});
    relay.initialize();

    assertTrue(relay.httpServer().isRunning());
    assertEquals(List.of("customer_data", "support_specialist"), relay.registry().agentIds());
    assertEquals(2, relay.hostedAgents().size());

    OrchestrationResult result =
        relay
            .orchestrator()
            .handleQuery("Check account 5 and create a ticket for billing issues");
    assertTrue(result.isSuccess(), () -> String.valueOf(result.error()));
    assertEquals(
        "Ticket #6 for Emily Chen: billing issues (status open, priority medium).",
        result.answer());

    OkHttpClient http = OkHttpFactory.create(2000, 5000);
    Request request =
        new Request.Builder().url(relay.httpServer().baseUrl() + "/actuator/health").build();
    try (Response response = http.newCall(request).execute()) {
      assertEquals(200, response.code());
      JsonNode health = JacksonUtility.getJsonMapper().readTree(response.body().string());
      assertEquals("UP", health.path("status").asText());
      assertEquals(2, health.path("agents").asInt());
      assertEquals("support_specialist", health.path("registry").get(1).asText());
    }
  }

  @Test
  void hostAgentAnswersOverHttp() {
    relay = new AgentRelay(new String[] {"--config-file", CONFIG});
    relay.initialize();

    OkHttpClient http = OkHttpFactory.create(2000, 5000);
    RemoteAgent host =
        new RemoteAgent(
            "host",
            DescriptorReference.discovery(relay.httpServer().baseUrl() + "/agents/host"),
            new DescriptorResolver(http),
            new RemoteAgentProxy(http, 0, Duration.ofMillis(1)));

    AgentResponse response =
        host.invoke(AgentRequest.of("What is the status of ticket 1?"), Duration.ofSeconds(10));

    assertTrue(response.complete());
    assertTrue(response.answer().contains("Ticket #1"), response.answer());
  }

  @Test
  void queryModeAnswersOnceAndShutsDown() {
    relay =
        new AgentRelay(
            new String[] {
              "--config-file", CONFIG, "--mode", "query", "--query", "Check account 5"
            });
    relay.initialize();

    OrchestrationResult result = relay.lastResult();
    assertNotNull(result);
    assertTrue(result.isSuccess(), () -> String.valueOf(result.error()));
    assertTrue(result.scratch().get("data").path("answer").asText().contains("Emily Chen"));
    assertFalse(relay.httpServer().isRunning());
  }
}
