package com.gentoro.agentrelay.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.agentrelay.exception.BackendException;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.ExecutionException;
import com.gentoro.agentrelay.utility.JacksonUtility;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.spec.McpSchema;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operation backend served by an MCP server over streamable HTTP. The tool list becomes the
 * operation catalog; each operation call is one {@code tools/call}.
 *
 * <pre>
 * backend:
 *   type: mcp
 *   mcp:
 *     url: http://localhost:8000
 *     endpoint: /mcp
 *     request-timeout-ms: 20000
 *     mutating: [add_customer, create_ticket, delete_ticket]
 * </pre>
 */
public class McpOperationBackend implements OperationBackend {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(McpOperationBackend.class);

  private final McpSyncClient client;
  private final List<OperationDefinition> operations;

  public McpOperationBackend(
      String url, String endpoint, Duration requestTimeout, Collection<String> mutating) {
    HttpClientStreamableHttpTransport transport =
        HttpClientStreamableHttpTransport.builder(url)
            .endpoint(endpoint)
            .jsonMapper(new JacksonMcpJsonMapper(new ObjectMapper()))
            .build();
    this.client =
        McpClient.sync(transport)
            .requestTimeout(requestTimeout)
            .capabilities(McpSchema.ClientCapabilities.builder().build())
            .build();
    try {
      client.initialize();
      Set<String> mutatingNames = new HashSet<>(mutating);
      List<OperationDefinition> defs = new ArrayList<>();
      for (McpSchema.Tool tool : client.listTools().tools()) {
        defs.add(toDefinition(tool, mutatingNames));
      }
      this.operations = List.copyOf(defs);
    } catch (RuntimeException e) {
      client.close();
      throw new ExecutionException(
          "Could not read the tool catalog of MCP server %s%s: %s"
              .formatted(url, endpoint, ExceptionUtil.describe(e)),
          e);
    }
    log.info("MCP backend {}{} offers {} operations", url, endpoint, operations.size());
  }

  @Override
  public List<OperationDefinition> listOperations() {
    return operations;
  }

  @Override
  public JsonNode execute(String operation, Map<String, Object> args) {
    McpSchema.CallToolResult result =
        client.callTool(
            McpSchema.CallToolRequest.builder().name(operation).arguments(args).build());
    String text = textOf(result);
    if (Boolean.TRUE.equals(result.isError())) {
      throw new BackendException(operation, text.isBlank() ? "tool reported an error" : text);
    }
    if (result.structuredContent() != null) {
      return JacksonUtility.toTree(result.structuredContent());
    }
    return parseText(text);
  }

  @Override
  public void close() {
    client.closeGracefully();
  }

  /**
   * Map an MCP tool to an operation. The mutating flag comes from the tool's {@code readOnlyHint}
   * when the server declares one, otherwise from the configured list of mutating tool names.
   */
  static OperationDefinition toDefinition(McpSchema.Tool tool, Set<String> mutatingNames) {
    OperationDefinition.Builder builder =
        OperationDefinition.builder(tool.name()).description(tool.description());
    McpSchema.JsonSchema schema = tool.inputSchema();
    if (schema != null && schema.properties() != null) {
      Set<String> required =
          schema.required() == null ? Set.of() : new HashSet<>(schema.required());
      schema
          .properties()
          .forEach(
              (name, property) -> {
                String type = null;
                String description = null;
                if (property instanceof Map<?, ?> p) {
                  type = p.get("type") instanceof String t ? t : null;
                  description = p.get("description") instanceof String d ? d : null;
                }
                builder.parameter(
                    new ParameterSpec(
                        name,
                        ParameterSpec.Type.parse(type),
                        required.contains(name),
                        description));
              });
    }
    boolean mutates = mutatingNames.contains(tool.name());
    if (tool.annotations() != null && tool.annotations().readOnlyHint() != null) {
      mutates = !tool.annotations().readOnlyHint();
    }
    return builder.mutates(mutates).build();
  }

  static String textOf(McpSchema.CallToolResult result) {
    StringBuilder sb = new StringBuilder();
    if (result.content() != null) {
      for (McpSchema.Content content : result.content()) {
        if (content instanceof McpSchema.TextContent text) {
          sb.append(text.text());
        }
      }
    }
    return sb.toString();
  }

  static JsonNode parseText(String text) {
    if (text.isBlank()) {
      return TextNode.valueOf("");
    }
    try {
      return JacksonUtility.getJsonMapper().readTree(text);
    } catch (IOException e) {
      log.trace("Tool result is plain text: {}", e.getMessage());
      return TextNode.valueOf(text);
    }
  }
}
