package com.gentoro.agentrelay.router;

/**
 * One agent's contribution to a fan-out. {@code text} is the agent's answer, or {@code
 * "unavailable: <cause>"} when it failed.
 */
public record SynthesisInput(String agentId, String role, boolean available, String text) {

  public static SynthesisInput success(String agentId, String role, String answer) {
    return new SynthesisInput(agentId, role, true, answer == null ? "" : answer);
  }

  public static SynthesisInput unavailable(String agentId, String role, String cause) {
    return new SynthesisInput(agentId, role, false, "unavailable: " + cause);
  }
}
