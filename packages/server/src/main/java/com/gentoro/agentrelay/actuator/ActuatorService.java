package com.gentoro.agentrelay.actuator;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.backend.OperationCatalog;
import com.gentoro.agentrelay.http.EmbeddedJettyServer;
import com.gentoro.agentrelay.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check endpoint in the style of Spring Boot's actuator.
 *
 * <p>Registers a servlet at path: /actuator/health
 *
 * <p>Response body: {"status":"UP","operations":15,"agents":2,"registry":["customer_data",
 * "support_specialist"]}. {@code registry} lists the routed agents in routing order.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(ActuatorService.class);

  private final EmbeddedJettyServer httpServer;
  private final OperationCatalog catalog;
  private final Supplier<AgentRegistry> registry;

  public ActuatorService(
      EmbeddedJettyServer httpServer, OperationCatalog catalog, Supplier<AgentRegistry> registry) {
    this.httpServer = httpServer;
    this.catalog = catalog;
    this.registry = registry;
  }

  /** Register the actuator servlet with the shared Jetty context handler. */
  public void register() {
    httpServer
        .getContextHandler()
        .addServlet(new ServletHolder(new ActuatorServlet()), "/actuator/health");
    log.info("Actuator health endpoint registered at /actuator/health");
  }

  Map<String, Object> health() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("status", "UP");
    payload.put("operations", catalog.size());
    AgentRegistry current = registry.get();
    payload.put("agents", current == null ? 0 : current.size());
    payload.put("registry", current == null ? List.of() : current.agentIds());
    return payload;
  }

  private class ActuatorServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toCompactJson(health()));
      }
    }
  }
}
