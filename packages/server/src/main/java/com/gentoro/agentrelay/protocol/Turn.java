package com.gentoro.agentrelay.protocol;

import java.time.Instant;

/**
 * One entry of a conversation. {@code role} is {@code user} for the end user, {@code tool} for
 * operation results, or the role of the agent that produced the content.
 */
public record Turn(String role, String content, Instant timestamp) {
  public static final String USER = "user";
  public static final String TOOL = "tool";

  public Turn {
    content = content == null ? "" : content;
    timestamp = timestamp == null ? Instant.now() : timestamp;
  }

  public static Turn of(String role, String content) {
    return new Turn(role, content, Instant.now());
  }
}
