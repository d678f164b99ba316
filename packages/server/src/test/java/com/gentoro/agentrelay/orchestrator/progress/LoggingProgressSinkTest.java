package com.gentoro.agentrelay.orchestrator.progress;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

class LoggingProgressSinkTest {

  /** Captures events instead of relying on log output. */
  private static class RecordingSink extends LoggingProgressSink {
    final List<ProgressEvent> events = new ArrayList<>();

    RecordingSink(Logger logger) {
      super(logger, 10_000, 5);
    }

    @Override
    protected void publish(ProgressEvent event) {
      events.add(event);
      super.publish(event);
    }
  }

  @Test
  void stepsAreThrottledButStageBoundariesAlwaysPass() {
    Logger logger = mock(Logger.class);
    RecordingSink sink = new RecordingSink(logger);

    sink.beginStage("run", "Handling query", 3);
    sink.step("run", 1, "customer_data answered", Map.of("agentId", "customer_data"));
    sink.step("run", 2, "support_specialist failed", Map.of());
    sink.step("run", 3, "billing answered", Map.of());
    sink.endStageOk("run", Map.of());

    assertEquals(
        List.of(
            ProgressEvent.Kind.BEGIN,
            ProgressEvent.Kind.STEP,
            ProgressEvent.Kind.STEP,
            ProgressEvent.Kind.OK),
        sink.events.stream().map(ProgressEvent::kind).toList());
    assertEquals(3, sink.events.get(2).completed());
    assertEquals(100, sink.events.get(3).percent());
    assertTrue(sink.events.get(3).attrs().containsKey("elapsedMs"));
    verify(logger, times(4)).info(eq("[relay.progress] {}"), (Object) any());
  }

  @Test
  void errorEventCarriesTheSummary() {
    RecordingSink sink = new RecordingSink(mock(Logger.class));

    sink.beginStage("agent:customer_data", null, 1);
    sink.endStageError("agent:customer_data", "unavailable: connection refused", Map.of());

    ProgressEvent error = sink.events.get(1);
    assertEquals(ProgressEvent.Kind.ERROR, error.kind());
    assertEquals("agent:customer_data", error.label());
    Map<String, Object> shape = error.toMap();
    assertEquals("error", shape.get("event"));
    assertEquals("unavailable: connection refused", shape.get("message"));
  }

  @Test
  void completedIsClampedToTheTotal() {
    ProgressEvent event =
        new ProgressEvent("run", "run", ProgressEvent.Kind.STEP, 7, 2, null, null);
    assertEquals(2, event.completed());
    assertEquals(100, event.percent());
    assertFalse(event.toMap().containsKey("attrs"));
  }
}
