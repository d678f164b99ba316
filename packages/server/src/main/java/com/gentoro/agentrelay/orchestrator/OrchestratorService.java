package com.gentoro.agentrelay.orchestrator;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.AllAgentsFailedException;
import com.gentoro.agentrelay.exception.AgentRelayException;
import com.gentoro.agentrelay.exception.ErrorDetails;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.ExecutionException;
import com.gentoro.agentrelay.exception.RunTimeoutException;
import com.gentoro.agentrelay.exception.ValidationException;
import com.gentoro.agentrelay.orchestrator.progress.ProgressSink;
import com.gentoro.agentrelay.router.Router;
import com.gentoro.agentrelay.router.RunContext;
import com.gentoro.agentrelay.router.StageOutcome;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Front door of the orchestrator. Each query gets a fresh {@link RunContext}, runs through the
 * configured {@link Router} under a run-level deadline and ends as an {@link OrchestrationResult}:
 * never an exception. On deadline expiry the run is abandoned (best effort interruption) and
 * reported as {@link RunTimeoutException}.
 */
public class OrchestratorService {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(OrchestratorService.class);

  private final AgentRegistry registry;
  private final Router router;
  private final Duration runDeadline;
  private final ExecutorService runExecutor;

  public OrchestratorService(
      AgentRegistry registry, Router router, Duration runDeadline, ExecutorService runExecutor) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.router = Objects.requireNonNull(router, "router");
    this.runDeadline = Objects.requireNonNull(runDeadline, "runDeadline");
    this.runExecutor = Objects.requireNonNull(runExecutor, "runExecutor");
  }

  public AgentRegistry registry() {
    return registry;
  }

  public OrchestrationResult handleQuery(String query) {
    return handleQuery(query, null);
  }

  public OrchestrationResult handleQuery(String query, ProgressSink progress) {
    long started = System.currentTimeMillis();
    if (query == null || query.isBlank()) {
      return failure(
          RunContext.of(query == null ? "" : query),
          new ValidationException("Query must not be empty"),
          started);
    }

    RunContext ctx = new RunContext(query, progress);
    ctx.progress().beginStage(RunContext.RUN_STAGE, "Handling query", registry.size());
    log.info("Handling query ({} chars) with {} agents", query.length(), registry.size());

    Future<String> future;
    try {
      future = runExecutor.submit(() -> router.route(ctx, registry));
    } catch (RejectedExecutionException e) {
      return failure(ctx, new ExecutionException("Orchestrator is shutting down", e), started);
    }

    try {
      String answer = future.get(runDeadline.toMillis(), TimeUnit.MILLISECONDS);
      long elapsed = System.currentTimeMillis() - started;
      ctx.progress().endStageOk(RunContext.RUN_STAGE, Map.of("elapsedMs", elapsed));
      log.info("Query answered in {} ms", elapsed);
      return new OrchestrationResult(
          OrchestrationResult.Status.SUCCESS,
          query,
          answer,
          ctx.state().scratchSnapshot(),
          ctx.outcomes(),
          ctx.decision(),
          null,
          implicated(ctx, null),
          elapsed);
    } catch (TimeoutException e) {
      future.cancel(true);
      return failure(ctx, new RunTimeoutException(runDeadline), started);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return failure(ctx, new ExecutionException("Interrupted while handling query", e), started);
    } catch (java.util.concurrent.ExecutionException e) {
      Throwable cause = ExceptionUtil.unwrap(e);
      return failure(
          ctx,
          ExceptionUtil.asAgentRelayException(
              cause,
              t -> new ExecutionException("Query failed: " + ExceptionUtil.describe(t), t)),
          started);
    }
  }

  private OrchestrationResult failure(RunContext ctx, AgentRelayException error, long started) {
    long elapsed = System.currentTimeMillis() - started;
    ErrorDetails details = ExceptionUtil.toErrorDetails(error);
    ctx.progress()
        .endStageError(RunContext.RUN_STAGE, details.message, Map.of("code", details.code.name()));
    log.warn("Query failed after {} ms: {}", elapsed, error.toString());
    return new OrchestrationResult(
        OrchestrationResult.Status.FAILED,
        ctx.query(),
        null,
        ctx.state().scratchSnapshot(),
        ctx.outcomes(),
        ctx.decision(),
        details,
        implicated(ctx, error),
        elapsed);
  }

  /** Agents a failure is attributed to, then every agent with a failed stage. */
  private static List<String> implicated(RunContext ctx, AgentRelayException error) {
    Set<String> agents = new LinkedHashSet<>();
    if (error instanceof AllAgentsFailedException all) {
      agents.addAll(all.getCauses().keySet());
    } else if (error != null && error.getAgentId() != null) {
      agents.add(error.getAgentId());
    }
    for (StageOutcome outcome : ctx.outcomes()) {
      if (outcome.status() == StageOutcome.Status.FAILED) {
        agents.add(outcome.agentId());
      }
    }
    return List.copyOf(agents);
  }
}
