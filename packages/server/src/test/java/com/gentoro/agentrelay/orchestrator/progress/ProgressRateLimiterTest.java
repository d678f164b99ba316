package com.gentoro.agentrelay.orchestrator.progress;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProgressRateLimiterTest {

  @Test
  void throttlesStepsInsideTheIntervalUnlessEnoughAgentsFinished() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(300, 2);

    assertTrue(limiter.tryAcquire("run", 0, 0, 10));
    assertFalse(limiter.tryAcquire("run", 100, 1, 10));
    assertTrue(limiter.tryAcquire("run", 150, 2, 10));
    assertTrue(limiter.tryAcquire("run", 500, 2, 10));
  }

  @Test
  void stagesAreThrottledIndependently() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(1_000, 5);

    assertTrue(limiter.tryAcquire("run", 0, 1, 0));
    assertTrue(limiter.tryAcquire("synthesize", 10, 1, 0));
    assertFalse(limiter.tryAcquire("run", 20, 2, 0));

    limiter.reset("run");
    assertTrue(limiter.tryAcquire("run", 30, 2, 0));
  }

  @Test
  void completingStepAlwaysPasses() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(1_000, 5);

    assertTrue(limiter.tryAcquire("run", 0, 1, 3));
    assertFalse(limiter.tryAcquire("run", 1, 2, 3));
    assertTrue(limiter.tryAcquire("run", 2, 3, 3));
  }
}
