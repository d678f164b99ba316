package com.gentoro.agentrelay.descriptor;

import java.util.Objects;

/**
 * Where a descriptor comes from: either supplied inline, or fetched from a discovery base URL.
 * Exactly one of the two components is set.
 */
public record DescriptorReference(AgentDescriptor inline, String baseUrl) {

  public static DescriptorReference inline(AgentDescriptor descriptor) {
    return new DescriptorReference(Objects.requireNonNull(descriptor, "descriptor"), null);
  }

  public static DescriptorReference discovery(String baseUrl) {
    return new DescriptorReference(null, baseUrl);
  }

  public boolean isInline() {
    return inline != null;
  }

  @Override
  public String toString() {
    return isInline() ? "inline:" + inline.agentId() : "discovery:" + baseUrl;
  }
}
