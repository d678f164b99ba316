package com.gentoro.agentrelay.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A backend operation an agent performed while answering, with its result. */
public record ToolCall(String operation, Map<String, Object> args, JsonNode result) {
  public ToolCall {
    args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
  }
}
