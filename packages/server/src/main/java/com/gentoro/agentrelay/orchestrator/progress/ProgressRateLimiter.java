package com.gentoro.agentrelay.orchestrator.progress;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Throttles step notifications per stage. A step passes when it is the first of its stage, when
 * {@code minIntervalMs} elapsed since the last step that passed for the stage, when the completed
 * count moved by at least {@code minDelta}, or when it completes the stage.
 */
public class ProgressRateLimiter {
  private record Mark(long at, long completed) {}

  private final long minIntervalMs;
  private final long minDelta;
  private final Map<String, Mark> marks = new ConcurrentHashMap<>();

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
  }

  /**
   * @param total expected units of the stage, 0 when unknown
   * @return true when the step should be published
   */
  public boolean tryAcquire(String stageId, long nowMs, long completed, long total) {
    boolean[] accepted = new boolean[1];
    marks.compute(
        stageId,
        (id, last) -> {
          boolean pass =
              last == null
                  || (total > 0 && completed >= total)
                  || nowMs - last.at() >= minIntervalMs
                  || Math.abs(completed - last.completed()) >= minDelta;
          accepted[0] = pass;
          return pass ? new Mark(nowMs, completed) : last;
        });
    return accepted[0];
  }

  /** Forget the stage, so that its next step passes. */
  public void reset(String stageId) {
    marks.remove(stageId);
  }
}
