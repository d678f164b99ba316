package com.gentoro.agentrelay.orchestrator.progress;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** One progress notification, as published by {@link LoggingProgressSink} and its subclasses. */
public record ProgressEvent(
    String stageId,
    String label,
    Kind kind,
    long completed,
    long total,
    String message,
    Map<String, Object> attrs) {

  public enum Kind {
    BEGIN,
    STEP,
    OK,
    ERROR
  }

  public ProgressEvent {
    total = Math.max(0, total);
    completed = Math.max(0, total > 0 ? Math.min(completed, total) : completed);
    attrs = attrs == null ? Map.of() : Map.copyOf(attrs);
  }

  /** Completion in percent, 0 when the total is unknown. */
  public int percent() {
    return total == 0 ? 0 : (int) Math.min(100, Math.round(completed * 100.0 / total));
  }

  /** Serializable shape, keys in a stable order. */
  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("stage", stageId);
    out.put("label", label);
    out.put("event", kind.name().toLowerCase(Locale.ROOT));
    out.put("completed", completed);
    out.put("total", total);
    out.put("percent", percent());
    if (message != null) out.put("message", message);
    if (!attrs.isEmpty()) out.put("attrs", attrs);
    return out;
  }
}
