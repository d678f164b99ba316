package com.gentoro.agentrelay.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Agent answer. When streamed, each chunk is an {@code AgentResponse} with {@code final=false}
 * except the last one; answers concatenate and tool calls append.
 */
public record AgentResponse(
    String answer, List<ToolCall> toolCalls, @JsonProperty("final") boolean complete) {

  public AgentResponse {
    answer = answer == null ? "" : answer;
    toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
  }

  public static AgentResponse answer(String answer) {
    return new AgentResponse(answer, List.of(), true);
  }
}
