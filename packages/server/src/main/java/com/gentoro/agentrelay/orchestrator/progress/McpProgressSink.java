package com.gentoro.agentrelay.orchestrator.progress;

import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Objects;

/**
 * Sends run progress to the calling MCP client as progress notifications on its {@code
 * progressToken}, and logs it like the parent class.
 */
public class McpProgressSink extends LoggingProgressSink {
  private final McpSyncServerExchange exchange;
  private final String progressToken;

  public McpProgressSink(
      org.slf4j.Logger logger,
      long minIntervalMs,
      long minDelta,
      McpSyncServerExchange exchange,
      Object progressToken) {
    super(logger, minIntervalMs, minDelta);
    this.exchange = Objects.requireNonNull(exchange, "exchange");
    this.progressToken = String.valueOf(Objects.requireNonNull(progressToken, "progressToken"));
  }

  @Override
  protected void publish(ProgressEvent event) {
    String text =
        event.message() == null ? event.label() : event.label() + ": " + event.message();
    exchange.progressNotification(
        new McpSchema.ProgressNotification(
            progressToken, (double) event.completed(), (double) event.total(), text, event.toMap()));
    super.publish(event);
  }
}
