package com.gentoro.agentrelay.agent;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.backend.InMemorySupportBackend;
import com.gentoro.agentrelay.backend.OperationCatalog;
import com.gentoro.agentrelay.broker.ToolBinding;
import com.gentoro.agentrelay.broker.ToolBroker;
import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.descriptor.DescriptorReference;
import com.gentoro.agentrelay.descriptor.DescriptorResolver;
import com.gentoro.agentrelay.exception.DiscoveryException;
import com.gentoro.agentrelay.exception.RemoteAgentException;
import com.gentoro.agentrelay.exception.UnauthorizedException;
import com.gentoro.agentrelay.http.EmbeddedJettyServer;
import com.gentoro.agentrelay.http.OkHttpFactory;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import com.gentoro.agentrelay.proxy.RemoteAgentProxy;
import com.gentoro.agentrelay.reasoning.KeywordReasoningUnit;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AgentServerTest {

  private static final MediaType JSON = MediaType.get("application/json");

  private EmbeddedJettyServer server;
  private OkHttpClient http;
  private DescriptorResolver resolver;
  private RemoteAgentProxy proxy;

  @BeforeEach
  void setUp() {
    InMemorySupportBackend backend = InMemorySupportBackend.fromClasspath("seed/support-data.yaml");
    ToolBroker broker = new ToolBroker(OperationCatalog.of(backend), backend, Duration.ofMillis(1));
    KeywordReasoningUnit unit = new KeywordReasoningUnit();

    server = new EmbeddedJettyServer("localhost", 0);
    server.prepare();
    AgentServer agents = new AgentServer(server);
    agents.register(
        "customer_data",
        new AgentRuntime(
            descriptor("customer_data", "customer_data", true),
            "",
            ToolBinding.of("customer_data", Set.of("get_customer", "list_tickets", "create_ticket")),
            broker,
            unit,
            6));
    agents.register(
        "support",
        new AgentRuntime(
            descriptor("support_specialist", "support", false),
            "",
            ToolBinding.of("support_specialist", Set.of("get_ticket")),
            broker,
            unit,
            6));
    agents.register("locked", new FailingHandler(descriptor("locked", "locked", false)));
    agents.register("locked-stream", new FailingHandler(descriptor("locked-stream", "locked-stream", true)));
    server.start();

    http = OkHttpFactory.create(2000, 5000);
    resolver = new DescriptorResolver(http);
    proxy = new RemoteAgentProxy(http, 0, Duration.ofMillis(1));
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  private static AgentDescriptor descriptor(String agentId, String path, boolean streaming) {
    return AgentDescriptor.builder()
        .agentId(agentId)
        .endpoint(AgentServer.endpointPath(path))
        .streaming(streaming)
        .build();
  }

  private RemoteAgent remote(String agentId, String path) {
    return new RemoteAgent(
        agentId,
        DescriptorReference.discovery(server.baseUrl() + AgentServer.endpointPath(path)),
        resolver,
        proxy);
  }

  @Test
  void endpointPathNormalizesSlashes() {
    assertEquals("/agents/data", AgentServer.endpointPath("/data/"));
    assertThrows(RuntimeException.class, () -> AgentServer.endpointPath(" / "));
  }

  @Test
  void descriptorIsServedWithAbsoluteEndpointAfterResolution() {
    RemoteAgent agent = remote("customer_data", "customer_data");
    AgentDescriptor descriptor = agent.descriptor();
    assertEquals(server.baseUrl() + "/agents/customer_data", descriptor.endpoint());
    assertTrue(descriptor.streaming());
  }

  @Test
  void streamedToolLoopAnswersOverHttp() {
    AgentResponse response =
        remote("customer_data", "customer_data")
            .invoke(
                AgentRequest.of("Check account 5 and create a ticket for billing issues"),
                Duration.ofSeconds(5));

    assertTrue(response.complete());
    assertEquals(
        List.of("get_customer", "create_ticket"),
        response.toolCalls().stream().map(c -> c.operation()).toList());
    assertEquals(6, response.toolCalls().get(1).result().path("id").asInt());
    assertTrue(response.answer().contains("Emily Chen"));
    assertTrue(response.answer().contains("ticket #6"));
  }

  @Test
  void plainJsonInvocation() {
    AgentResponse response =
        remote("support_specialist", "support")
            .invoke(AgentRequest.of("What is the status of ticket 1?"), Duration.ofSeconds(5));

    assertEquals(
        "Ticket #1 for John Doe: Cannot log in after password reset (status open, priority high).",
        response.answer());
  }

  @Test
  void agentIdMismatchIsDiscoveryError() {
    assertThrows(DiscoveryException.class, () -> remote("someone_else", "support").descriptor());
  }

  @Test
  void authorizationFailureIsAnswered403() {
    RemoteAgentException ex =
        assertThrows(
            RemoteAgentException.class,
            () -> remote("locked", "locked").invoke(AgentRequest.of("hi"), Duration.ofSeconds(2)));
    assertEquals(403, ex.getStatus());
    assertEquals(
        "PERMISSION_DENIED", ex.getPayload().path("error").path("code").asText());
  }

  @Test
  void failureAfterStreamStartedIsWrittenAsErrorLine() throws Exception {
    Request request =
        new Request.Builder()
            .url(server.baseUrl() + "/agents/locked-stream")
            .header("Accept", RemoteAgentProxy.NDJSON)
            .post(RequestBody.create("{\"query\":\"hi\"}", JSON))
            .build();
    try (Response response = http.newCall(request).execute()) {
      assertEquals(200, response.code());
      List<String> lines = response.body().string().lines().filter(l -> !l.isBlank()).toList();
      assertEquals(2, lines.size());
      assertFalse(JacksonUtility.getJsonMapper().readTree(lines.get(0)).path("final").asBoolean());
      JsonNode error = JacksonUtility.getJsonMapper().readTree(lines.get(1)).path("error");
      assertEquals("PERMISSION_DENIED", error.path("code").asText());
    }
  }

  @Test
  void blankQueryIsRejected422() throws Exception {
    try (Response response = post("/agents/support", "{\"query\":\"  \"}")) {
      assertEquals(422, response.code());
      assertTrue(response.body().string().contains("INVALID_ARGUMENT"));
    }
  }

  @Test
  void unreadableBodyIsRejected400() throws Exception {
    try (Response response = post("/agents/support", "not json")) {
      assertEquals(400, response.code());
    }
  }

  @Test
  void unknownSubPathIs404() throws Exception {
    try (Response response = post("/agents/support/elsewhere", "{\"query\":\"hi\"}")) {
      assertEquals(404, response.code());
    }
  }

  private Response post(String path, String body) throws Exception {
    return http.newCall(
            new Request.Builder()
                .url(server.baseUrl() + path)
                .post(RequestBody.create(body, JSON))
                .build())
        .execute();
  }

  /** Emits one chunk, then fails as an unauthorized tool call would. */
  private static final class FailingHandler implements AgentHandler {
    private final AgentDescriptor descriptor;

    FailingHandler(AgentDescriptor descriptor) {
      this.descriptor = descriptor;
    }

    @Override
    public AgentDescriptor descriptor() {
      return descriptor;
    }

    @Override
    public AgentResponse handle(AgentRequest request, Consumer<AgentResponse> chunks) {
      chunks.accept(new AgentResponse("working", List.of(), false));
      throw new UnauthorizedException(descriptor.agentId(), "delete_ticket");
    }
  }
}
