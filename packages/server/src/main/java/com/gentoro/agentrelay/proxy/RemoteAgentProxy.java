package com.gentoro.agentrelay.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.exception.AgentTimeoutException;
import com.gentoro.agentrelay.exception.DiscoveryException;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.RemoteAgentException;
import com.gentoro.agentrelay.exception.SerializationException;
import com.gentoro.agentrelay.exception.UnreachableException;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import com.gentoro.agentrelay.protocol.ResponseAccumulator;
import com.gentoro.agentrelay.utility.JacksonUtility;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Performs one request/response exchange with a remote agent.
 *
 * <p>The timeout passed to {@link #call} is a hard deadline for the whole exchange, streamed body
 * included; on expiry the HTTP call is cancelled and {@link AgentTimeoutException} is thrown.
 * Connection failures before a response arrives raise {@link UnreachableException} and are retried
 * up to {@code maxRetries} times with a fixed backoff. Timeouts are never retried. Error responses
 * raise {@link RemoteAgentException} with the remote payload.
 *
 * <p>Streamed responses ({@code application/x-ndjson}) are accumulated into one final {@link
 * AgentResponse}; callers never see partial state. The proxy holds no per-call state.
 */
public class RemoteAgentProxy {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(RemoteAgentProxy.class);

  public static final String NDJSON = "application/x-ndjson";
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final Retry retry;

  public RemoteAgentProxy(OkHttpClient httpClient, int maxRetries, Duration backoff) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.retry =
        Retry.of(
            "agent-proxy",
            RetryConfig.custom()
                .maxAttempts(Math.max(0, maxRetries) + 1)
                .waitDuration(Duration.ofMillis(Math.max(1L, backoff.toMillis())))
                .retryOnException(e -> e instanceof UnreachableException u && u.isRetryable())
                .build());
    this.retry
        .getEventPublisher()
        .onRetry(
            e ->
                log.warn(
                    "Retrying unreachable agent (attempt {}): {}",
                    e.getNumberOfRetryAttempts(),
                    ExceptionUtil.describe(e.getLastThrowable())));
  }

  public AgentResponse call(AgentDescriptor descriptor, AgentRequest request, Duration timeout) {
    HttpUrl url = HttpUrl.parse(descriptor.endpoint());
    if (url == null) {
      throw new DiscoveryException(
          "Agent '%s' has no absolute endpoint: %s"
              .formatted(descriptor.agentId(), descriptor.endpoint()));
    }
    OkHttpClient client =
        httpClient.newBuilder().callTimeout(timeout).readTimeout(timeout).build();
    Request httpRequest =
        new Request.Builder()
            .url(url)
            .header(
                "Accept",
                descriptor.streaming() ? NDJSON + ", application/json" : "application/json")
            .post(RequestBody.create(JacksonUtility.toCompactJson(request), JSON))
            .build();

    return retry.executeSupplier(() -> exchange(client, descriptor, httpRequest, timeout));
  }

  private AgentResponse exchange(
      OkHttpClient client, AgentDescriptor descriptor, Request httpRequest, Duration timeout) {
    String agentId = descriptor.agentId();
    long started = System.nanoTime();
    Response response;
    try {
      response = client.newCall(httpRequest).execute();
    } catch (InterruptedIOException e) {
      throw new AgentTimeoutException(agentId, timeout, e);
    } catch (IOException e) {
      throw new UnreachableException(
          agentId,
          "Agent '%s' is unreachable at %s: %s"
              .formatted(agentId, httpRequest.url(), ExceptionUtil.describe(e)),
          true,
          e);
    }

    try (response) {
      AgentResponse result = read(agentId, response);
      log.debug(
          "Agent '{}' answered in {} ms", agentId, (System.nanoTime() - started) / 1_000_000L);
      return result;
    } catch (InterruptedIOException e) {
      throw new AgentTimeoutException(agentId, timeout, e);
    } catch (IOException e) {
      throw new UnreachableException(
          agentId,
          "Connection to agent '%s' lost while reading the response: %s"
              .formatted(agentId, ExceptionUtil.describe(e)),
          false,
          e);
    }
  }

  private AgentResponse read(String agentId, Response response) throws IOException {
    ResponseBody body = response.body();
    if (!response.isSuccessful()) {
      String raw = body == null ? "" : body.string();
      throw new RemoteAgentException(agentId, response.code(), errorPayload(raw));
    }
    if (body == null) {
      throw new RemoteAgentException(
          agentId, response.code(), syntheticError("empty response body"));
    }
    MediaType type = body.contentType();
    if (type != null && type.subtype().contains("ndjson")) {
      return accumulate(agentId, response.code(), new NdjsonChunkIterator(body.source()));
    }
    String raw = body.string();
    try {
      return JacksonUtility.fromJson(raw, AgentResponse.class);
    } catch (SerializationException e) {
      throw new RemoteAgentException(
          agentId, response.code(), syntheticError("malformed response: " + raw));
    }
  }

  private AgentResponse accumulate(String agentId, int status, NdjsonChunkIterator chunks)
      throws IOException {
    ResponseAccumulator accumulator = new ResponseAccumulator();
    try {
      while (!accumulator.isComplete() && chunks.hasNext()) {
        JsonNode chunk = chunks.next();
        if (chunk.has("error")) {
          throw new RemoteAgentException(agentId, status, chunk);
        }
        accumulator.accept(JacksonUtility.fromTree(chunk, AgentResponse.class));
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } catch (SerializationException e) {
      throw new RemoteAgentException(
          agentId, status, syntheticError("malformed stream chunk: " + e.getMessage()));
    }
    if (!accumulator.isComplete()) {
      throw new RemoteAgentException(
          agentId,
          status,
          syntheticError(
              "stream ended after %d chunks without a final chunk"
                  .formatted(accumulator.chunkCount())));
    }
    return accumulator.toResponse();
  }

  private static JsonNode errorPayload(String raw) {
    if (raw != null && !raw.isBlank()) {
      try {
        JsonNode node = JacksonUtility.getJsonMapper().readTree(raw);
        if (node != null && node.isObject()) {
          return node;
        }
      } catch (IOException e) {
        log.trace("Error body is not JSON, wrapping it: {}", e.getMessage());
      }
    }
    return syntheticError(raw == null ? "" : raw);
  }

  private static JsonNode syntheticError(String message) {
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    root.putObject("error").put("message", message);
    return root;
  }
}
