package com.gentoro.agentrelay.orchestrator.progress;

import com.gentoro.agentrelay.utility.JacksonUtility;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes progress to the log as one compact JSON object per event, prefixed with {@code
 * [relay.progress]}. Begin and end of a stage always pass; steps go through a {@link
 * ProgressRateLimiter}. Subclasses forward events elsewhere by overriding {@link
 * #publish(ProgressEvent)}.
 */
public class LoggingProgressSink implements ProgressSink {
  private record Stage(String label, long total, long startedAt) {}

  private final org.slf4j.Logger log;
  private final ProgressRateLimiter limiter;
  private final Map<String, Stage> stages = new ConcurrentHashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.limiter = new ProgressRateLimiter(minIntervalMs, minDelta);
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    Stage stage = new Stage(label == null ? id : label, Math.max(0, totalWork), now());
    stages.put(id, stage);
    limiter.reset(id);
    publish(
        new ProgressEvent(
            id, stage.label(), ProgressEvent.Kind.BEGIN, 0, stage.total(), null, null));
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    Stage stage = stage(id);
    if (limiter.tryAcquire(id, now(), completed, stage.total())) {
      publish(
          new ProgressEvent(
              id, stage.label(), ProgressEvent.Kind.STEP, completed, stage.total(), message, attrs));
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    Stage stage = finish(id);
    publish(
        new ProgressEvent(
            id,
            stage.label(),
            ProgressEvent.Kind.OK,
            stage.total(),
            stage.total(),
            null,
            withElapsed(stage, attrs)));
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    Stage stage = finish(id);
    publish(
        new ProgressEvent(
            id,
            stage.label(),
            ProgressEvent.Kind.ERROR,
            0,
            stage.total(),
            errorSummary,
            withElapsed(stage, attrs)));
  }

  protected void publish(ProgressEvent event) {
    log.info("[relay.progress] {}", JacksonUtility.toCompactJson(event.toMap()));
  }

  private Stage stage(String id) {
    return stages.getOrDefault(id, new Stage(id, 0, now()));
  }

  private Stage finish(String id) {
    Stage stage = stages.remove(id);
    limiter.reset(id);
    return stage == null ? new Stage(id, 0, now()) : stage;
  }

  private static Map<String, Object> withElapsed(Stage stage, Map<String, Object> attrs) {
    Map<String, Object> out = new HashMap<>();
    if (attrs != null) out.putAll(attrs);
    out.putIfAbsent("elapsedMs", now() - stage.startedAt());
    return out;
  }

  private static long now() {
    return System.currentTimeMillis();
  }
}
