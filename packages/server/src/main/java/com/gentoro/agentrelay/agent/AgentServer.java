package com.gentoro.agentrelay.agent;

import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.descriptor.DescriptorResolver;
import com.gentoro.agentrelay.exception.AgentRelayException;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.NotFoundException;
import com.gentoro.agentrelay.exception.ValidationException;
import com.gentoro.agentrelay.http.EmbeddedJettyServer;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import com.gentoro.agentrelay.proxy.RemoteAgentProxy;
import com.gentoro.agentrelay.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Publishes {@link AgentHandler}s over HTTP on the shared Jetty context.
 *
 * <p>For an agent hosted at {@code /agents/data} it registers:
 *
 * <ul>
 *   <li>{@code GET /agents/data/.well-known/agent-card.json}: the descriptor
 *   <li>{@code POST /agents/data}: invocation, answered with one JSON response or, when the client
 *       accepts {@code application/x-ndjson} and the agent streams, with one JSON chunk per line
 * </ul>
 *
 * <p>Failures are answered with {@code {"error": ErrorDetails}}: 400 for unreadable requests, 422
 * for validation errors, 403 for authorization errors, 404 for missing entities, 500 otherwise. A
 * failure after streaming started is written as a last error line.
 */
public class AgentServer {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(AgentServer.class);

  public static final String BASE_PATH = "/agents";

  private final EmbeddedJettyServer httpServer;

  public AgentServer(EmbeddedJettyServer httpServer) {
    this.httpServer = Objects.requireNonNull(httpServer, "httpServer");
  }

  /** Endpoint path an agent hosted under {@code path} is reachable at, e.g. {@code /agents/data}. */
  public static String endpointPath(String path) {
    String p = path == null ? "" : path.trim();
    while (p.startsWith("/")) p = p.substring(1);
    while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
    if (p.isEmpty()) {
      throw new ValidationException("Agent path must not be empty");
    }
    return BASE_PATH + "/" + p;
  }

  /** Register an agent. Must be called before the HTTP server starts. */
  public String register(String path, AgentHandler handler) {
    String endpoint = endpointPath(path);
    httpServer
        .getContextHandler()
        .addServlet(new ServletHolder(new AgentServlet(handler)), endpoint + "/*");
    log.info(
        "Agent '{}' hosted at {}, descriptor at {}{}",
        handler.descriptor().agentId(),
        endpoint,
        endpoint,
        DescriptorResolver.WELL_KNOWN_PATH);
    return endpoint;
  }

  static int statusFor(Throwable t) {
    if (!(t instanceof AgentRelayException e)) {
      return 500;
    }
    return switch (e.getCode()) {
      case SERIALIZATION_ERROR -> 400;
      case INVALID_ARGUMENT -> 422;
      case PERMISSION_DENIED -> 403;
      case NOT_FOUND -> 404;
      default -> 500;
    };
  }

  static String errorBody(Throwable t) {
    return JacksonUtility.toCompactJson(Map.of("error", ExceptionUtil.toErrorDetails(t)));
  }

  private static class AgentServlet extends HttpServlet {
    private final transient AgentHandler handler;

    AgentServlet(AgentHandler handler) {
      this.handler = handler;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      if (!DescriptorResolver.WELL_KNOWN_PATH.equals(req.getPathInfo())) {
        writeError(resp, new NotFoundException("No resource at " + req.getRequestURI()));
        return;
      }
      AgentDescriptor descriptor = handler.descriptor();
      resp.setStatus(200);
      resp.setContentType("application/json");
      resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
      try (PrintWriter out = resp.getWriter()) {
        out.print(JacksonUtility.toJson(descriptor));
      }
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String pathInfo = req.getPathInfo();
      if (pathInfo != null && !pathInfo.equals("/")) {
        writeError(resp, new NotFoundException("No resource at " + req.getRequestURI()));
        return;
      }
      String agentId = handler.descriptor().agentId();

      AgentRequest request;
      try {
        String body = new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        request = JacksonUtility.fromJson(body, AgentRequest.class);
        if (request == null || request.query() == null || request.query().isBlank()) {
          throw new ValidationException("Request must carry a non-empty 'query'");
        }
      } catch (RuntimeException e) {
        log.warn("[{}] rejected request: {}", agentId, e.getMessage());
        writeError(resp, e);
        return;
      }

      String accept = req.getHeader("Accept");
      boolean stream =
          handler.descriptor().streaming()
              && accept != null
              && accept.contains(RemoteAgentProxy.NDJSON);
      if (stream) {
        stream(agentId, request, resp);
      } else {
        respond(agentId, request, resp);
      }
    }

    private void respond(String agentId, AgentRequest request, HttpServletResponse resp)
        throws IOException {
      AgentResponse response;
      try {
        response = handler.handle(request, chunk -> {});
      } catch (RuntimeException e) {
        log.warn("[{}] invocation failed: {}", agentId, e.getMessage());
        writeError(resp, e);
        return;
      }
      resp.setStatus(200);
      resp.setContentType("application/json");
      resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
      try (PrintWriter out = resp.getWriter()) {
        out.print(JacksonUtility.toJson(response));
      }
    }

    private void stream(String agentId, AgentRequest request, HttpServletResponse resp)
        throws IOException {
      resp.setStatus(200);
      resp.setContentType(RemoteAgentProxy.NDJSON);
      resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
      PrintWriter out = resp.getWriter();
      try {
        handler.handle(
            request,
            chunk -> {
              out.println(JacksonUtility.toCompactJson(chunk));
              out.flush();
            });
      } catch (RuntimeException e) {
        log.warn("[{}] streamed invocation failed: {}", agentId, e.getMessage());
        out.println(errorBody(e));
      } finally {
        out.close();
      }
    }

    private static void writeError(HttpServletResponse resp, Throwable t) throws IOException {
      resp.setStatus(statusFor(t));
      resp.setContentType("application/json");
      resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
      try (PrintWriter out = resp.getWriter()) {
        out.print(errorBody(t));
      }
    }
  }
}
