package com.gentoro.agentrelay.agent;

import com.gentoro.agentrelay.descriptor.AgentDescriptor;
import com.gentoro.agentrelay.descriptor.DescriptorReference;
import com.gentoro.agentrelay.descriptor.DescriptorResolver;
import com.gentoro.agentrelay.exception.DiscoveryException;
import com.gentoro.agentrelay.exception.UnreachableException;
import com.gentoro.agentrelay.protocol.AgentRequest;
import com.gentoro.agentrelay.protocol.AgentResponse;
import com.gentoro.agentrelay.proxy.RemoteAgentProxy;
import java.time.Duration;
import java.util.Objects;

/**
 * Agent reached over HTTP. The descriptor is resolved on first use and cached; an unreachable
 * agent drops the cached descriptor so that the next call discovers it again.
 */
public class RemoteAgent implements Agent {
  private static final org.slf4j.Logger log =
      com.gentoro.agentrelay.logging.LoggingService.getLogger(RemoteAgent.class);

  private final String agentId;
  private final DescriptorReference reference;
  private final DescriptorResolver resolver;
  private final RemoteAgentProxy proxy;
  private volatile AgentDescriptor cached;

  public RemoteAgent(
      String agentId,
      DescriptorReference reference,
      DescriptorResolver resolver,
      RemoteAgentProxy proxy) {
    this.agentId = Objects.requireNonNull(agentId, "agentId");
    this.reference = Objects.requireNonNull(reference, "reference");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.proxy = Objects.requireNonNull(proxy, "proxy");
  }

  public String agentId() {
    return agentId;
  }

  @Override
  public AgentDescriptor descriptor() {
    AgentDescriptor current = cached;
    if (current == null) {
      current = resolver.resolve(reference);
      if (!agentId.equals(current.agentId())) {
        throw new DiscoveryException(
            "Descriptor at %s announces agent '%s', expected '%s'"
                .formatted(reference, current.agentId(), agentId));
      }
      cached = current;
      log.debug("Resolved agent '{}' at {}", agentId, current.endpoint());
    }
    return current;
  }

  @Override
  public AgentResponse invoke(AgentRequest request, Duration timeout) {
    AgentDescriptor descriptor = descriptor();
    try {
      return proxy.call(descriptor, request, timeout);
    } catch (UnreachableException e) {
      cached = null;
      throw e;
    }
  }
}
