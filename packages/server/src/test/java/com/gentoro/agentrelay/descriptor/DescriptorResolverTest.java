package com.gentoro.agentrelay.descriptor;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentrelay.exception.DiscoveryException;
import com.gentoro.agentrelay.exception.NotFoundException;
import com.gentoro.agentrelay.http.EmbeddedJettyServer;
import com.gentoro.agentrelay.http.OkHttpFactory;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class DescriptorResolverTest {

  private static EmbeddedJettyServer server;
  private static DescriptorResolver resolver;

  @BeforeAll
  static void startServer() {
    server = new EmbeddedJettyServer("localhost", 0);
    server.prepare();
    serve(
        "/billing",
        """
        {"agentId":"billing","endpoint":"/billing/invoke","displayName":"Billing",
         "streaming":true,
         "skills":[{"skillId":"refunds","description":"Refund invoices","examples":["refund 12"]}]}
        """);
    serve(
        "/absolute",
        """
        {"agentId":"abs","endpoint":"http://agents.example.com:9000/abs"}
        """);
    serve("/no-endpoint", "{\"agentId\":\"lost\"}");
    serve("/not-json", "<html>hello</html>");
    server.start();
    resolver = new DescriptorResolver(OkHttpFactory.create(2000, 2000));
  }

  @AfterAll
  static void stopServer() {
    server.close();
  }

  private static void serve(String base, String body) {
    server
        .getContextHandler()
        .addServlet(
            new ServletHolder(
                new HttpServlet() {
                  @Override
                  protected void doGet(HttpServletRequest req, HttpServletResponse resp)
                      throws IOException {
                    if (!DescriptorResolver.WELL_KNOWN_PATH.equals(req.getPathInfo())) {
                      resp.setStatus(404);
                      return;
                    }
                    resp.setContentType("application/json");
                    resp.getWriter().print(body);
                  }
                }),
            base + "/*");
  }

  @Test
  void fetchesWellKnownDocumentAndResolvesRelativeEndpoint() {
    AgentDescriptor descriptor =
        resolver.resolve(DescriptorReference.discovery(server.baseUrl() + "/billing"));

    assertEquals("billing", descriptor.agentId());
    assertEquals(server.baseUrl() + "/billing/invoke", descriptor.endpoint());
    assertTrue(descriptor.streaming());
    assertEquals(1, descriptor.skills().size());
    assertEquals(List.of("refund 12"), descriptor.skills().get(0).examples());
  }

  @Test
  void trailingSlashInBaseUrlIsIgnored() {
    AgentDescriptor descriptor =
        resolver.resolve(DescriptorReference.discovery(server.baseUrl() + "/billing/"));
    assertEquals("billing", descriptor.agentId());
  }

  @Test
  void absoluteEndpointIsKept() {
    AgentDescriptor descriptor =
        resolver.resolve(DescriptorReference.discovery(server.baseUrl() + "/absolute"));
    assertEquals("http://agents.example.com:9000/abs", descriptor.endpoint());
  }

  @Test
  void missingDocumentIsNotFound() {
    assertThrows(
        NotFoundException.class,
        () -> resolver.resolve(DescriptorReference.discovery(server.baseUrl() + "/nobody")));
  }

  @Test
  void documentWithoutEndpointIsMalformed() {
    assertThrows(
        DiscoveryException.class,
        () -> resolver.resolve(DescriptorReference.discovery(server.baseUrl() + "/no-endpoint")));
    assertThrows(
        DiscoveryException.class,
        () -> resolver.resolve(DescriptorReference.discovery(server.baseUrl() + "/not-json")));
  }

  @Test
  void unreachableHostIsDiscoveryError() {
    assertThrows(
        DiscoveryException.class,
        () -> resolver.resolve(DescriptorReference.discovery("http://localhost:1/agent")));
  }

  @Test
  void inlineDescriptorIsReturnedAsIs() {
    AgentDescriptor inline =
        AgentDescriptor.builder().agentId("local").endpoint("http://localhost:1/x").build();
    assertSame(inline, resolver.resolve(DescriptorReference.inline(inline)));
  }
}
