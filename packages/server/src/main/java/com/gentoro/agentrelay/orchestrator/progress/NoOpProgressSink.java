package com.gentoro.agentrelay.orchestrator.progress;

import java.util.Map;

/** Discards progress, for callers that did not ask for it. */
public enum NoOpProgressSink implements ProgressSink {
  INSTANCE;

  @Override
  public void beginStage(String id, String label, long totalWork) {}

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {}

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {}

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {}
}
