package com.gentoro.agentrelay.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.agentrelay.backend.OperationDefinition;
import com.gentoro.agentrelay.backend.ParameterSpec;
import com.gentoro.agentrelay.broker.ToolBinding;
import com.gentoro.agentrelay.broker.ToolBroker;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.http.EmbeddedJettyServer;
import com.gentoro.agentrelay.orchestrator.OrchestrationResult;
import com.gentoro.agentrelay.orchestrator.OrchestratorService;
import com.gentoro.agentrelay.orchestrator.progress.McpProgressSink;
import com.gentoro.agentrelay.orchestrator.progress.NoOpProgressSink;
import com.gentoro.agentrelay.orchestrator.progress.ProgressSink;
import com.gentoro.agentrelay.utility.JacksonUtility;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Publishes the operation catalog as MCP tools over the SDK's streamable HTTP servlet transport,
 * mounted on the shared Jetty context.
 *
 * <p>Every operation becomes a tool with the same name and a JSON input schema built from its
 * parameters. Calls go through the {@link ToolBroker}, so they are validated and retried like agent
 * calls. When an orchestrator is given, an extra {@code agentrelay.query} tool runs the front door
 * and reports run progress to clients that send a {@code progressToken}.
 *
 * <pre>
 * mcp:
 *   enabled: true
 *   endpoint: /mcp
 *   disallow-delete: false
 *   progress:
 *     min-interval-ms: 300
 *   server:
 *     name: agentrelay
 *     version: 1.0.0
 * </pre>
 */
public class McpServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(McpServer.class);

  public static final String QUERY_TOOL = "agentrelay.query";

  private final Configuration configuration;
  private final EmbeddedJettyServer httpServer;
  private final ToolBroker broker;
  private final OrchestratorService orchestrator;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(
      Configuration configuration,
      EmbeddedJettyServer httpServer,
      ToolBroker broker,
      OrchestratorService orchestrator) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.httpServer = Objects.requireNonNull(httpServer, "httpServer");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.orchestrator = orchestrator;
  }

  /** Register the MCP servlet on the shared context handler. Must run before the server starts. */
  public void register() {
    String endpoint = normalizeEndpoint(configuration.getString("mcp.endpoint", "/mcp"));
    boolean disallowDelete = configuration.getBoolean("mcp.disallow-delete", false);
    String serverName = configuration.getString("mcp.server.name", "agentrelay");
    String serverVersion = configuration.getString("mcp.server.version", "1.0.0");

    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(new JacksonMcpJsonMapper(new ObjectMapper()))
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();
    ToolBinding binding = ToolBinding.of("mcp", broker.catalog().names());
    for (OperationDefinition definition : broker.catalog().all()) {
      tools.add(operationTool(definition, binding));
    }
    if (orchestrator != null) {
      tools.add(queryTool());
    }

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(tools)
            .build();

    httpServer.getContextHandler().addServlet(new ServletHolder(servletTransport), endpoint);
    log.info("MCP servlet registered at {} with {} tools", endpoint, tools.size());
  }

  private McpServerFeatures.SyncToolSpecification operationTool(
      OperationDefinition definition, ToolBinding binding) {
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(definition.name())
                .description(
                    Objects.requireNonNullElse(definition.description(), definition.name()))
                .inputSchema(inputSchema(definition))
                .build())
        .callHandler(
            (exchange, request) -> {
              try {
                Map<String, Object> args =
                    Objects.requireNonNullElse(
                        request.arguments(), Collections.<String, Object>emptyMap());
                return new McpSchema.CallToolResult(
                    JacksonUtility.toJson(broker.invoke(binding, definition.name(), args)), false);
              } catch (Exception e) {
                log.warn("MCP call to {} failed: {}", definition.name(), e.getMessage());
                return new McpSchema.CallToolResult(
                    Objects.requireNonNullElse(
                        e.getMessage(), ExceptionUtil.formatCompactStackTrace(e)),
                    true);
              }
            })
        .build();
  }

  private McpServerFeatures.SyncToolSpecification queryTool() {
    long minIntervalMs = configuration.getLong("mcp.progress.min-interval-ms", 300L);
    long minDelta = configuration.getLong("mcp.progress.min-delta", 1L);
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(QUERY_TOOL)
                .description("Ask the AgentRelay orchestrator a question in natural language.")
                .inputSchema(
                    new McpSchema.JsonSchema(
                        "object",
                        Map.of("query", Map.of("type", "string")),
                        List.of("query"),
                        false,
                        Collections.emptyMap(),
                        Collections.emptyMap()))
                .build())
        .callHandler(
            (exchange, request) -> {
              try {
                Object progressToken =
                    Objects.requireNonNullElse(
                            request.meta(), Collections.<String, Object>emptyMap())
                        .get("progressToken");
                ProgressSink sink =
                    progressToken == null
                        ? NoOpProgressSink.INSTANCE
                        : new McpProgressSink(
                            log, minIntervalMs, minDelta, exchange, progressToken);
                Object query =
                    Objects.requireNonNullElse(
                            request.arguments(), Collections.<String, Object>emptyMap())
                        .get("query");
                OrchestrationResult result =
                    orchestrator.handleQuery(query == null ? "" : query.toString(), sink);
                return new McpSchema.CallToolResult(
                    JacksonUtility.toJson(result), !result.isSuccess());
              } catch (Exception e) {
                log.error("Failed to handle MCP query", e);
                return new McpSchema.CallToolResult(
                    Objects.requireNonNullElse(
                        e.getMessage(), ExceptionUtil.formatCompactStackTrace(e)),
                    true);
              }
            })
        .build();
  }

  /** JSON schema of an operation's arguments. */
  static McpSchema.JsonSchema inputSchema(OperationDefinition definition) {
    Map<String, Object> properties = new LinkedHashMap<>();
    List<String> required = new ArrayList<>();
    for (ParameterSpec spec : definition.parameters()) {
      Map<String, Object> property = new LinkedHashMap<>();
      property.put("type", spec.type().schemaName());
      if (spec.description() != null) {
        property.put("description", spec.description());
      }
      properties.put(spec.name(), property);
      if (spec.required()) {
        required.add(spec.name());
      }
    }
    return new McpSchema.JsonSchema(
        "object", properties, required, false, Collections.emptyMap(), Collections.emptyMap());
  }

  @Override
  public void close() {
    if (mcpServer != null) {
      mcpServer.close();
      mcpServer = null;
    }
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
