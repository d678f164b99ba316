package com.gentoro.agentrelay.protocol;

import java.util.ArrayList;
import java.util.List;

/** Folds streamed chunks into a single final {@link AgentResponse}. Not thread-safe. */
public class ResponseAccumulator {
  private final StringBuilder answer = new StringBuilder();
  private final List<ToolCall> toolCalls = new ArrayList<>();
  private boolean complete;
  private int chunks;

  public ResponseAccumulator accept(AgentResponse chunk) {
    if (complete) {
      throw new IllegalStateException("Chunk received after the final chunk");
    }
    answer.append(chunk.answer());
    toolCalls.addAll(chunk.toolCalls());
    complete = chunk.complete();
    chunks++;
    return this;
  }

  public boolean isComplete() {
    return complete;
  }

  public int chunkCount() {
    return chunks;
  }

  public AgentResponse toResponse() {
    if (!complete) {
      throw new IllegalStateException("Stream has not delivered its final chunk yet");
    }
    return new AgentResponse(answer.toString(), toolCalls, true);
  }
}
