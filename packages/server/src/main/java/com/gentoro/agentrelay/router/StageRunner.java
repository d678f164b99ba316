package com.gentoro.agentrelay.router;

import com.gentoro.agentrelay.agent.AgentRegistry;
import com.gentoro.agentrelay.exception.ExceptionUtil;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import com.gentoro.agentrelay.protocol.Turn;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.util.Map;

/** Invokes single agents on behalf of the routers and merges their output into the run. */
class StageRunner {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(StageRunner.class);

  /** Original query plus everything accumulated so far. */
  AgentRequest requestFor(RunContext ctx) {
    return new AgentRequest(
        ctx.query(), ctx.state().turns(), ctx.state().scratchSnapshot());
  }

  /** Invoke one agent with progress reporting. Does not touch the run state. */
  AgentResponse call(RunContext ctx, AgentRegistry.Entry entry, AgentRequest request) {
    String stageId = "agent:" + entry.agentId();
    ctx.progress().beginStage(stageId, "Invoking " + entry.agentId(), 1);
    long started = System.currentTimeMillis();
    try {
      AgentResponse response = entry.agent().invoke(request, entry.timeout());
      ctx.progress()
          .endStageOk(
              stageId,
              Map.of(
                  "elapsedMs", System.currentTimeMillis() - started,
                  "toolCalls", response.toolCalls().size()));
      return response;
    } catch (RuntimeException e) {
      ctx.progress()
          .endStageError(
              stageId,
              ExceptionUtil.describe(e),
              Map.of("elapsedMs", System.currentTimeMillis() - started));
      throw e;
    }
  }

  /** Store a successful output under the agent's role and record the outcome. */
  void merge(RunContext ctx, AgentRegistry.Entry entry, AgentResponse response, long elapsedMs) {
    ctx.state().putScratch(entry.role(), JacksonUtility.toTree(response));
    ctx.state().addTurn(Turn.of(entry.role(), response.answer()));
    ctx.record(StageOutcome.success(entry.agentId(), entry.role(), response, elapsedMs));
    reportFinished(ctx, entry, "answered");
    log.debug("[{}] merged output under '{}' ({} ms)", entry.agentId(), entry.role(), elapsedMs);
  }

  void fail(RunContext ctx, AgentRegistry.Entry entry, Throwable cause, long elapsedMs) {
    ctx.record(
        StageOutcome.failed(
            entry.agentId(),
            entry.role(),
            ExceptionUtil.errorCodeOf(cause),
            ExceptionUtil.describe(cause),
            elapsedMs));
    reportFinished(ctx, entry, "failed");
    log.warn("[{}] stage failed after {} ms: {}", entry.agentId(), elapsedMs, cause.getMessage());
  }

  /** Request, call and merge one pipeline stage. Failures are recorded and rethrown. */
  AgentResponse runStage(RunContext ctx, AgentRegistry.Entry entry) {
    long started = System.currentTimeMillis();
    try {
      AgentResponse response = call(ctx, entry, requestFor(ctx));
      merge(ctx, entry, response, System.currentTimeMillis() - started);
      return response;
    } catch (RuntimeException e) {
      fail(ctx, entry, e, System.currentTimeMillis() - started);
      throw e;
    }
  }

  private static void reportFinished(RunContext ctx, AgentRegistry.Entry entry, String what) {
    ctx.progress()
        .step(
            RunContext.RUN_STAGE,
            ctx.outcomes().size(),
            entry.agentId() + " " + what,
            Map.of("agentId", entry.agentId(), "role", entry.role()));
  }
}
