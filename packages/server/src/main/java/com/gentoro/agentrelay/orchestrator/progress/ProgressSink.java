package com.gentoro.agentrelay.orchestrator.progress;

import java.util.Map;

/**
 * Receives progress of an orchestration run: the run itself, the routing decision, each agent call
 * and the synthesis are stages. The routers report one step on the {@code run} stage whenever an
 * agent of the run finishes.
 *
 * <p>Implementations may be called from several threads when agents run in parallel.
 */
public interface ProgressSink {

  /**
   * @param id stable stage identifier, e.g. {@code run}, {@code route}, {@code
   *     agent:customer_data}
   * @param label short human-readable label
   * @param totalWork expected units of work, 0 when unknown
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * @param completed units completed so far in the stage
   * @param attrs structured attributes such as {@code agentId}, never null
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  void endStageOk(String id, Map<String, Object> attrs);

  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}
