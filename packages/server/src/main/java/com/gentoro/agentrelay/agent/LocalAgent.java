package com.gentoro.agentrelay.agent;

import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.exception.AgentRelayException;
import com.gentoro.agentrelay.exception.AgentTimeoutException;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.ExecutionException;
import com.gentoro.agentrelay.exception.UnreachableException;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * An {@link AgentHandler} of this process, invoked without HTTP. The timeout is enforced by running
 * the handler on the given executor and abandoning it on expiry.
 */
public class LocalAgent implements Agent {
  private final AgentHandler handler;
  private final ExecutorService executor;

  public LocalAgent(AgentHandler handler, ExecutorService executor) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public AgentDescriptor descriptor() {
    return handler.descriptor();
  }

  @Override
  public AgentResponse invoke(AgentRequest request, Duration timeout) {
    String agentId = handler.descriptor().agentId();
    CompletableFuture<AgentResponse> future;
    try {
      future = CompletableFuture.supplyAsync(() -> handler.handle(request, chunk -> {}), executor);
    } catch (RejectedExecutionException e) {
      throw new UnreachableException(agentId, "Agent '%s' is shut down".formatted(agentId), false, e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new AgentTimeoutException(agentId, timeout, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ExecutionException("Interrupted while waiting for agent '%s'".formatted(agentId), e);
    } catch (java.util.concurrent.ExecutionException e) {
      Throwable cause = ExceptionUtil.unwrap(e);
      if (cause instanceof AgentRelayException are) {
        throw are;
      }
      throw new ExecutionException(
          "Agent '%s' failed: %s".formatted(agentId, ExceptionUtil.describe(cause)), cause);
    }
  }
}
