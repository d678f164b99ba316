package com.gentoro.agentrelay.broker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** The subset of backend operations one agent may invoke. */
public record ToolBinding(String agentId, Set<String> allowedOperations) {

  public ToolBinding {
    allowedOperations =
        allowedOperations == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(allowedOperations));
  }

  public static ToolBinding of(String agentId, Collection<String> operations) {
    return new ToolBinding(agentId, new LinkedHashSet<>(operations));
  }

  public boolean allows(String operation) {
    return allowedOperations.contains(operation);
  }
}
