package com.gentoro.agentrelay.agent;

import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import java.util.function.Consumer;

/**
 * Server side of an agent: what an {@link AgentServer} hosts. Implementations may publish
 * intermediate chunks ({@code final=false}) while working; the returned response is the complete
 * answer.
 */
public interface AgentHandler {
  AgentDescriptor descriptor();

  AgentResponse handle(AgentRequest request, Consumer<AgentResponse> chunks);
}
