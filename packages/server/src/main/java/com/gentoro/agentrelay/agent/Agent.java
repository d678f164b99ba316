package com.gentoro.agentrelay.agent;

import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import java.time.Duration;

/**
 * Uniform view of an agent as seen by routers. Whether the agent runs in this process or behind
 * HTTP is an implementation detail; errors are reported with the exceptions of the remote
 * protocol ({@code AgentTimeoutException}, {@code UnreachableException}, {@code
 * RemoteAgentException}, ...).
 */
public interface Agent {

  /** Descriptor of the agent. May resolve it on first access. */
  AgentDescriptor descriptor();

  /**
   * Invoke the agent once and return its complete answer.
   *
   * @param timeout hard deadline for the whole exchange
   */
  AgentResponse invoke(AgentRequest request, Duration timeout);
}
