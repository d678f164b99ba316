package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.AgentRelayErrorCode;
import com.gentoro.agentrelay.exception.AgentTimeoutException;
import com.gentoro.agentrelay.exception.AllAgentsFailedException;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.exception.ExecutionException;
import com.gentoro.agentrelay.exception.StageFailureException;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out routing. Every agent of the registry is called concurrently with the same request and its
 * own timeout, counted from the moment its call starts rather than from submission to the shared
 * pool. The router waits for all of them and no failure cancels the others. Outcomes are merged and
 * synthesized in registry order, whatever the completion order.
 *
 * <p>Failed agents are reported to the synthesizer as {@code unavailable: <cause>}. Two cases fail
 * the run instead: an authorization or validation fault, which surfaces as a {@link
 * StageFailureException} carrying that kind and naming the agent, and every agent failing, which
 * surfaces as {@link AllAgentsFailedException}. Synthesis is skipped in both.
 */
public class ParallelRouter implements Router {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(ParallelRouter.class);

  private final ExecutorService executor;
  private final Synthesizer synthesizer;
  private final Duration grace;
  private final StageRunner runner = new StageRunner();

  /**
   * @param grace extra wait beyond an agent's own timeout before the router gives up on it
   */
  public ParallelRouter(ExecutorService executor, Synthesizer synthesizer, Duration grace) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    this.grace = grace == null ? Duration.ZERO : grace;
  }

  /** One submitted call. {@code startedAt} stays 0 while the task waits for a pool thread. */
  private record Pending(
      AgentRegistry.Entry entry, Future<AgentResponse> future, AtomicLong startedAt, long budgetMs) {

    long elapsedMs() {
      long begun = startedAt.get();
      return begun == 0L ? 0L : System.currentTimeMillis() - begun;
    }
  }

  @Override
  public String route(RunContext ctx, AgentRegistry registry) {
    AgentRequest request = runner.requestFor(ctx);

    List<Pending> pending = new ArrayList<>();
    for (AgentRegistry.Entry entry : registry.entries()) {
      AtomicLong startedAt = new AtomicLong();
      Future<AgentResponse> future =
          executor.submit(
              () -> {
                startedAt.set(System.currentTimeMillis());
                return runner.call(ctx, entry, request);
              });
      pending.add(
          new Pending(entry, future, startedAt, entry.timeout().toMillis() + grace.toMillis()));
    }
    log.debug("Fan-out to {} agents", pending.size());

    List<SynthesisInput> inputs = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();
    StageFailureException fault = null;
    try {
      for (Pending p : pending) {
        AgentRegistry.Entry entry = p.entry();
        try {
          AgentResponse response = await(p);
          runner.merge(ctx, entry, response, p.elapsedMs());
          inputs.add(SynthesisInput.success(entry.agentId(), entry.role(), response.answer()));
        } catch (RuntimeException e) {
          runner.fail(ctx, entry, e, p.elapsedMs());
          AgentRelayErrorCode kind = ExceptionUtil.errorCodeOf(e);
          if (fault == null && ExceptionUtil.isConfigurationFault(kind)) {
            fault = new StageFailureException(entry.agentId(), kind, e);
          }
          String cause = ExceptionUtil.describe(e);
          failures.put(entry.agentId(), cause);
          inputs.add(SynthesisInput.unavailable(entry.agentId(), entry.role(), cause));
        }
      }
    } catch (InterruptedException e) {
      pending.forEach(p -> p.future().cancel(true));
      Thread.currentThread().interrupt();
      throw new ExecutionException("Interrupted while waiting for agents", e);
    }

    if (fault != null) {
      throw fault;
    }
    if (!inputs.isEmpty() && failures.size() == inputs.size()) {
      throw new AllAgentsFailedException(failures);
    }

    ctx.progress().beginStage("synthesize", "Combining answers", inputs.size());
    String answer = synthesizer.synthesize(ctx.query(), inputs);
    ctx.progress().endStageOk("synthesize", Map.of("failed", failures.size()));
    return answer;
  }

  /**
   * Wait for one call. Time spent queued for a pool thread does not count against the agent; the
   * run deadline bounds the total wait.
   */
  private static AgentResponse await(Pending p) throws InterruptedException {
    while (true) {
      long begun = p.startedAt().get();
      long wait =
          begun == 0L
              ? Math.max(1L, p.budgetMs())
              : Math.max(0L, begun + p.budgetMs() - System.currentTimeMillis());
      try {
        return p.future().get(wait, TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        begun = p.startedAt().get();
        if (begun == 0L || begun + p.budgetMs() > System.currentTimeMillis()) {
          continue;
        }
        p.future().cancel(true);
        throw new AgentTimeoutException(p.entry().agentId(), p.entry().timeout(), e);
      } catch (java.util.concurrent.ExecutionException e) {
        Throwable cause = ExceptionUtil.unwrap(e);
        if (cause instanceof RuntimeException re) {
          throw re;
        }
        throw new ExecutionException(ExceptionUtil.describe(cause), cause);
      }
    }
  }
}
